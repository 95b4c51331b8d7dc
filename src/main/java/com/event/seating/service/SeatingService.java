package com.event.seating.service;

import com.event.seating.domain.Guest;
import com.event.seating.domain.ObjectiveWeights;
import com.event.seating.domain.OptimizationConfig;
import com.event.seating.domain.OptimizationResult;
import com.event.seating.domain.SeatingConstraint;
import com.event.seating.engine.LocalSearchOptimizer;
import com.event.seating.engine.MultiStartOptimizer;
import com.event.seating.engine.SeatingOptimizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class SeatingService {

    public static final String MULTI_START = "MULTI_START";

    private final LocalSearchOptimizer localSearchOptimizer;
    private final MultiStartOptimizer multiStartOptimizer;

    @Value("${seating.optimizer.default-max-iterations:1000}")
    private int defaultMaxIterations;

    @Value("${seating.optimizer.default-seed:42}")
    private long defaultSeed;

    @Value("${seating.optimizer.default-restarts:4}")
    private int defaultRestarts;

    @Value("${seating.optimizer.randomize-seed:false}")
    private boolean randomizeSeed;

    public OptimizationResult optimizeSeating(List<Guest> guests, List<SeatingConstraint> constraints,
                                              ObjectiveWeights weights, OptimizationConfig config,
                                              String algorithm) {
        // Basic Validation
        if (guests == null || guests.isEmpty()) {
            throw new IllegalArgumentException("Guest list cannot be empty");
        }
        if (config == null) {
            throw new IllegalArgumentException("Optimization config cannot be null");
        }
        if (config.getTableCount() < 1) {
            throw new IllegalArgumentException("Table count must be at least 1, got " + config.getTableCount());
        }
        if (config.getSeatsPerTable() < 1) {
            throw new IllegalArgumentException("Seats per table must be at least 1, got " + config.getSeatsPerTable());
        }
        if (config.getMaxIterations() != null && config.getMaxIterations() < 0) {
            throw new IllegalArgumentException("Max iterations cannot be negative");
        }
        checkGuestIds(guests);

        // Fallback to defaults if weights or constraints are missing
        if (weights == null) {
            weights = ObjectiveWeights.equal();
        }
        checkWeights(weights);
        if (constraints == null) {
            constraints = List.of();
        }
        checkConstraints(constraints);

        OptimizationConfig resolved = resolveDefaults(config);

        // Algorithm Selection
        SeatingOptimizer optimizer;
        if (MULTI_START.equalsIgnoreCase(algorithm)) {
            optimizer = multiStartOptimizer;
        } else {
            optimizer = localSearchOptimizer;
        }

        return optimizer.optimize(guests, constraints, weights, resolved);
    }

    private OptimizationConfig resolveDefaults(OptimizationConfig config) {
        OptimizationConfig.OptimizationConfigBuilder b = config.toBuilder();
        if (config.getMaxIterations() == null) {
            b.maxIterations(defaultMaxIterations);
        }
        if (config.getRestarts() == null) {
            b.restarts(defaultRestarts);
        }
        if (config.getSeed() == null) {
            if (randomizeSeed) {
                long seed = System.currentTimeMillis();
                log.info("No seed supplied, using clock-derived seed {}", seed);
                b.seed(seed);
            } else {
                b.seed(defaultSeed);
            }
        }
        return b.build();
    }

    private void checkGuestIds(List<Guest> guests) {
        Set<String> ids = new HashSet<>();
        for (Guest guest : guests) {
            if (guest == null || guest.getId() == null) {
                throw new IllegalArgumentException("Every guest needs an id");
            }
            if (guest.getGuestType() == null) {
                throw new IllegalArgumentException("Guest " + guest.getId() + " has no guest type");
            }
            if (!ids.add(guest.getId())) {
                throw new IllegalArgumentException("Duplicate guest id: " + guest.getId());
            }
        }
    }

    private void checkWeights(ObjectiveWeights weights) {
        double[] values = {weights.getNovelty(), weights.getDiversity(), weights.getBalance(), weights.getTransaction()};
        for (double value : values) {
            if (!Double.isFinite(value) || value < 0) {
                throw new IllegalArgumentException("Objective weights must be finite and non-negative: " + weights);
            }
        }
    }

    private void checkConstraints(List<SeatingConstraint> constraints) {
        for (SeatingConstraint constraint : constraints) {
            if (constraint == null || constraint.getType() == null) {
                throw new IllegalArgumentException("Every constraint needs a type");
            }
            if (constraint.getGuestIds() == null) {
                throw new IllegalArgumentException("Constraint " + constraint.getId() + " has no guest list");
            }
        }
    }
}
