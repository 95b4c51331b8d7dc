package com.event.seating.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One attributable observation about a table. Descriptive only: nothing in scoring
 * reads reason codes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReasonCode {

    public enum Impact {
        POSITIVE,
        NEGATIVE,
        NEUTRAL
    }

    private String code; // e.g. "BUYER_SELLER_MIX"
    private String tableId;
    private List<String> guestIds;
    private String description;
    private Impact impact;
    private Objective objective; // null when not tied to an objective
}
