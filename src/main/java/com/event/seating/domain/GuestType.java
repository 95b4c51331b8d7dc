package com.event.seating.domain;

public enum GuestType {
    BUYER,
    SELLER,
    NEUTRAL,
    CATALYST
}
