package com.event.seating.domain;

public enum Objective {
    NOVELTY("new connections"),
    DIVERSITY("cross-department mixing"),
    BALANCE("balanced conversations"),
    TRANSACTION("business opportunities");

    private final String label;

    Objective(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
