package com.event.seating.web;

import com.event.seating.domain.Guest;
import com.event.seating.domain.ObjectiveWeights;
import com.event.seating.domain.OptimizationConfig;
import com.event.seating.domain.SeatingConstraint;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeatingRequest {
    private List<Guest> guests;
    private List<SeatingConstraint> constraints;
    private ObjectiveWeights weights;
    private OptimizationConfig config;
    private String algorithm; // "LOCAL_SEARCH" (default) or "MULTI_START"
}
