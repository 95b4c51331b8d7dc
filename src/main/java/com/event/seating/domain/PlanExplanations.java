package com.event.seating.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanExplanations {
    // Table id -> explanation lines, in table order
    @Builder.Default
    private Map<String, List<String>> perTable = new LinkedHashMap<>();

    private String overall;

    // Structured form for downstream text generation
    @Builder.Default
    private List<ReasonCode> reasonCodes = new ArrayList<>();
}
