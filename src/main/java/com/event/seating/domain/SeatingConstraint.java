package com.event.seating.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeatingConstraint {
    private String id;
    private ConstraintType type;

    // Group members for the together/apart kinds. The seller/buyer kinds apply to every table.
    @Builder.Default
    private List<String> guestIds = new ArrayList<>();

    private Integer value;    // threshold for the numeric kinds
    private Integer priority; // informational only

    /**
     * Threshold for MAX_SELLERS_PER_TABLE / MIN_BUYERS_PER_TABLE, falling back to the
     * kind's default when none was given.
     */
    public int threshold() {
        if (value != null) {
            return value;
        }
        Integer fallback = type.getDefaultThreshold();
        return fallback != null ? fallback : 0;
    }

    public boolean involves(String guestId) {
        return guestIds != null && guestIds.contains(guestId);
    }

    public int groupSize() {
        return guestIds == null ? 0 : guestIds.size();
    }
}
