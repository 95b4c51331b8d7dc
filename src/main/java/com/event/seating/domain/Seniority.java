package com.event.seating.domain;

// Ordered from least to most senior
public enum Seniority {
    JUNIOR,
    MID,
    SENIOR,
    EXECUTIVE
}
