package com.event.seating.engine;

import com.event.seating.domain.Guest;
import com.event.seating.domain.ObjectiveWeights;
import com.event.seating.domain.OptimizationConfig;
import com.event.seating.domain.OptimizationResult;
import com.event.seating.domain.SearchStatus;
import com.event.seating.domain.SeatingConstraint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Restart strategy on top of {@link LocalSearchOptimizer}: the search runs once per seed
 * ({@code seed, seed + 1, ...}) and the best run is kept. A feasible run always beats an
 * infeasible one; among equals the higher weighted score wins and ties keep the earlier
 * seed, so the outcome is still determined by the starting seed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MultiStartOptimizer implements SeatingOptimizer {

    private final LocalSearchOptimizer localSearch;

    @Override
    public OptimizationResult optimize(List<Guest> guests, List<SeatingConstraint> constraints,
                                      ObjectiveWeights weights, OptimizationConfig config) {
        long startTime = System.currentTimeMillis();
        int restarts = Math.max(1, config.restartsOrDefault());
        long baseSeed = config.seedOrDefault();

        OptimizationResult best = null;
        StringBuilder trace = new StringBuilder();
        int runs = 0;

        for (int attempt = 0; attempt < restarts; attempt++) {
            OptimizationConfig attemptConfig = config.toBuilder().seed(baseSeed + attempt).build();
            OptimizationResult result = localSearch.optimize(guests, constraints, weights, attemptConfig);
            runs++;

            trace.append("Run #").append(attempt + 1).append(": ").append(result.getSearchTrace()).append('\n');

            // Feasibility only depends on geometry and group sizes, so no other seed can help
            if (result.getStatus() == SearchStatus.INFEASIBLE_TERMINATED) {
                best = result;
                break;
            }

            if (best == null || isBetter(result, best)) {
                log.debug("Restart {} (seed {}) is the new best: weighted {}",
                        attempt + 1, attemptConfig.getSeed(), result.getMetrics().getWeighted());
                best = result;
            }
        }

        trace.append(String.format(Locale.ROOT, "Kept seed %d (weighted %.4f, feasible=%s).",
                best.getSeed(), best.getMetrics().getWeighted(), best.isFeasible()));
        log.info("Multi-start finished after {} run(s), kept seed {}", runs, best.getSeed());

        return best.toBuilder()
                .restarts(runs)
                .searchTrace(trace.toString())
                .computationTimeMs(System.currentTimeMillis() - startTime)
                .build();
    }

    private boolean isBetter(OptimizationResult candidate, OptimizationResult incumbent) {
        if (candidate.isFeasible() != incumbent.isFeasible()) {
            return candidate.isFeasible();
        }
        return candidate.getMetrics().getWeighted() > incumbent.getMetrics().getWeighted();
    }
}
