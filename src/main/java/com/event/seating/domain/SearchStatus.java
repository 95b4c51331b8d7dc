package com.event.seating.domain;

// Lifecycle of one local search run; the last three are terminal
public enum SearchStatus {
    INITIALIZING,
    SEARCHING,
    CONVERGED,
    ITERATION_LIMIT_REACHED,
    INFEASIBLE_TERMINATED;

    public boolean isTerminal() {
        return this == CONVERGED || this == ITERATION_LIMIT_REACHED || this == INFEASIBLE_TERMINATED;
    }
}
