package org.gopti.planner.solver;

import lombok.Getter;
import org.gopti.planner.model.Event;
import org.gopti.planner.model.ObjectiveWeights;
import org.gopti.planner.travel.TravelMatrix;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything one solve works on. Events are addressed by their index; event
 * {@code i} is node {@code i + 1} of the travel matrix, node 0 is the start and,
 * with a fixed end, node {@code size() + 1} is the end.
 * <p>
 * Index -1 stands for the start wherever an event index is expected.
 */
@Getter
public class ProblemInstance {
    public static final int START = -1;

    private final Instant origin;
    private final long horizon;
    private final List<EventNode> events;
    private final TravelMatrix matrix;
    private final boolean fixedEnd;
    private final ObjectiveWeights weights;
    private final long lateTolerance;
    private final long skipPenalty;

    public ProblemInstance(
        Instant origin,
        Instant endTime,
        List<Event> events,
        TravelMatrix matrix,
        boolean fixedEnd,
        ObjectiveWeights weights,
        long lateTolerance,
        long skipPenalty
    ) {
        int expectedNodes = events.size() + 1 + (fixedEnd ? 1 : 0);
        if (matrix.size() != expectedNodes) {
            throw new IllegalArgumentException(String.format(
                "Travel matrix covers %d nodes, expected %d", matrix.size(), expectedNodes));
        }

        this.origin = origin;
        this.horizon = Duration.between(origin, endTime).getSeconds();
        this.matrix = matrix;
        this.fixedEnd = fixedEnd;
        this.weights = weights.withDefaults();
        this.lateTolerance = lateTolerance;
        this.skipPenalty = skipPenalty;

        var nodes = new ArrayList<EventNode>(events.size());
        for (int i = 0; i < events.size(); i++) {
            var event = events.get(i);
            nodes.add(new EventNode(
                i,
                event,
                event.getWindow().startSecondsFrom(origin),
                event.getWindow().endSecondsFrom(origin),
                event.getDwellMin() * 60L,
                event.getDwellMax() * 60L
            ));
        }
        this.events = Collections.unmodifiableList(nodes);
    }

    public int size() {
        return events.size();
    }

    public EventNode event(int index) {
        return events.get(index);
    }

    public int nodeOf(int event) {
        return event + 1;
    }

    public int endNode() {
        return events.size() + 1;
    }

    public long travel(int fromEvent, int toEvent) {
        return matrix.seconds(nodeOf(fromEvent), nodeOf(toEvent));
    }

    /* Zero when the trip is open-ended */
    public long travelToEnd(int fromEvent) {
        return fixedEnd ? matrix.seconds(nodeOf(fromEvent), endNode()) : 0;
    }

    public long[] dwellMinByEvent() {
        var result = new long[size()];
        for (var node : events) {
            result[node.getIndex()] = node.getDwellMin();
        }
        return result;
    }

    public long[] dwellMaxByEvent() {
        var result = new long[size()];
        for (var node : events) {
            result[node.getIndex()] = node.getDwellMax();
        }
        return result;
    }
}
