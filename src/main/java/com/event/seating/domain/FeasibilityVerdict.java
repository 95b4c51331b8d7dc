package com.event.seating.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeasibilityVerdict {
    private boolean feasible;
    private String reason; // null when feasible

    public static FeasibilityVerdict ok() {
        return new FeasibilityVerdict(true, null);
    }

    public static FeasibilityVerdict infeasible(String reason) {
        return new FeasibilityVerdict(false, reason);
    }
}
