package com.event.seating.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Relative importance of the four soft objectives. The engine uses the values exactly
 * as given; callers that want them to sum to 1.0 call {@link #normalized()} first.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ObjectiveWeights {
    private double novelty;     // new connections
    private double diversity;   // cross-company / cross-department mixing
    private double balance;     // seniority and role mix
    private double transaction; // buyer-seller opportunities

    public static ObjectiveWeights equal() {
        return new ObjectiveWeights(0.25, 0.25, 0.25, 0.25);
    }

    public double sum() {
        return novelty + diversity + balance + transaction;
    }

    /**
     * Scales the weights to sum to 1.0. An all-zero tuple becomes {@link #equal()}.
     */
    public ObjectiveWeights normalized() {
        double total = sum();
        if (total == 0) {
            return equal();
        }
        return new ObjectiveWeights(novelty / total, diversity / total, balance / total, transaction / total);
    }
}
