package com.event.seating.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanMetrics {
    // Objective scores (0.0 - 1.0)
    private double novelty;
    private double diversity;
    private double balance;
    private double transaction;

    // Dot product of the scores with the caller's weights
    private double weighted;

    public static PlanMetrics zero() {
        return new PlanMetrics(0, 0, 0, 0, 0);
    }

    public double scoreFor(Objective objective) {
        return switch (objective) {
            case NOVELTY -> novelty;
            case DIVERSITY -> diversity;
            case BALANCE -> balance;
            case TRANSACTION -> transaction;
        };
    }
}
