package com.event.seating.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResult {
    private boolean valid;
    private List<ConstraintViolation> violations;

    public static ValidationResult of(List<ConstraintViolation> violations) {
        return new ValidationResult(violations.isEmpty(), violations);
    }
}
