package com.event.seating.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConstraintViolation {
    private String constraintId;
    private ConstraintType constraintType;
    private String message;
    private String tableId; // null when the violation spans tables
    private List<String> guestIds;
}
