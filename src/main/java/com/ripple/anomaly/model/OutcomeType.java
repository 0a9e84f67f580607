package com.ripple.anomaly.model;

public enum OutcomeType {
    SUCCESS,
    CREATED,
    NO_CONTENT,
    RATE_LIMITED,
    FAILURE
}
