package org.gopti.planner.solver;

public interface IPrimarySolver {

    /* Never throws; anything short of a validated schedule is unresolved */
    SolveAttempt solve(ProblemInstance instance, Deadline deadline);
}
