package com.event.seating.engine;

import com.event.seating.domain.Guest;
import com.event.seating.domain.ObjectiveWeights;
import com.event.seating.domain.OptimizationConfig;
import com.event.seating.domain.OptimizationResult;
import com.event.seating.domain.SeatingConstraint;

import java.util.List;

public interface SeatingOptimizer {
    OptimizationResult optimize(List<Guest> guests, List<SeatingConstraint> constraints,
                                ObjectiveWeights weights, OptimizationConfig config);
}
