package com.event.seating.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationResult {
    private SeatingPlan plan;
    private PlanMetrics metrics;
    private PlanExplanations explanations;

    @Builder.Default
    private List<String> warnings = new ArrayList<>(); // missing company data, unassigned guests, infeasibility

    private boolean feasible; // every constraint satisfied by the final plan
    private int iterations;
    private SearchStatus status;

    // Residual violations of the final plan (empty when feasible)
    @Builder.Default
    private List<ConstraintViolation> violations = new ArrayList<>();

    // Metrics of the initial (post-repair) plan
    private PlanMetrics baselineMetrics;

    private long seed;
    private long computationTimeMs;

    // Multi-start info
    private int restarts;
    private String searchTrace;
}
