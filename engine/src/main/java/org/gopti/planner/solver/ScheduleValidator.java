package org.gopti.planner.solver;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Last check before any schedule leaves a solver stage.
 */
public final class ScheduleValidator {

    private ScheduleValidator() {
    }

    public static List<String> validate(ProblemInstance instance, Schedule schedule) {
        var problems = new ArrayList<String>();
        var seen = new HashSet<Integer>();
        long previousArrive = Long.MIN_VALUE;
        long previousDepart = 0;

        for (var visit : schedule.getVisits()) {
            var node = instance.event(visit.getEvent());
            if (!seen.add(visit.getEvent())) {
                problems.add(node.getId() + " visited twice");
            }
            if (visit.getArrive() < node.getWindowStart()) {
                problems.add(node.getId() + " entered before its window");
            }
            if (visit.getArrive() > node.getWindowEnd() + instance.getLateTolerance()) {
                problems.add(node.getId() + " entered after its window");
            }
            if (visit.getDwell() < node.getDwellMin() || visit.getDwell() > node.getDwellMax()) {
                problems.add(node.getId() + " dwell outside its range");
            }
            if (visit.getDepart() != visit.getArrive() + visit.getDwell()) {
                problems.add(node.getId() + " departure does not match dwell");
            }
            if (visit.getArrive() <= previousArrive || visit.getArrive() < previousDepart + visit.getTravel()) {
                problems.add(node.getId() + " arrives out of sequence");
            }
            previousArrive = visit.getArrive();
            previousDepart = visit.getDepart();
        }

        if (!schedule.isEmpty() && previousDepart > instance.getHorizon()) {
            problems.add("last departure after the trip end time");
        }
        return problems;
    }

    public static boolean isValid(ProblemInstance instance, Schedule schedule) {
        return validate(instance, schedule).isEmpty();
    }
}
