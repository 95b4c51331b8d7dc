package com.event.seating.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationConfig {
    public static final int DEFAULT_MAX_ITERATIONS = 1000;
    public static final long DEFAULT_SEED = 42L;
    public static final int DEFAULT_RESTARTS = 4;

    // Room geometry
    private int tableCount;
    private int seatsPerTable;

    // Search budget
    private Integer maxIterations; // null -> DEFAULT_MAX_ITERATIONS
    private Long seed;             // null -> DEFAULT_SEED
    private Integer restarts;      // multi-start only, null -> DEFAULT_RESTARTS

    public int maxIterationsOrDefault() {
        return maxIterations != null ? maxIterations : DEFAULT_MAX_ITERATIONS;
    }

    public long seedOrDefault() {
        return seed != null ? seed : DEFAULT_SEED;
    }

    public int restartsOrDefault() {
        return restarts != null ? restarts : DEFAULT_RESTARTS;
    }

    // --- PRESETS ---

    /**
     * Standard run: full iteration budget, fixed seed so regenerations reproduce.
     */
    public static OptimizationConfig defaults(int tableCount, int seatsPerTable) {
        return OptimizationConfig.builder()
                .tableCount(tableCount)
                .seatsPerTable(seatsPerTable)
                .maxIterations(DEFAULT_MAX_ITERATIONS)
                .seed(DEFAULT_SEED)
                .restarts(DEFAULT_RESTARTS)
                .build();
    }

    /**
     * Interactive preview while a planner is still editing guests: small budget, one start.
     */
    public static OptimizationConfig quickDraft(int tableCount, int seatsPerTable) {
        return defaults(tableCount, seatsPerTable).toBuilder()
                .maxIterations(100)
                .restarts(1)
                .build();
    }

    /**
     * Final plan for print: large budget and more restarts for the multi-start search.
     */
    public static OptimizationConfig thorough(int tableCount, int seatsPerTable) {
        return defaults(tableCount, seatsPerTable).toBuilder()
                .maxIterations(5000)
                .restarts(8)
                .build();
    }
}
