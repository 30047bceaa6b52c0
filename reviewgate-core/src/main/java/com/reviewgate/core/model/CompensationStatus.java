package com.reviewgate.core.model;

public enum CompensationStatus {
    PENDING,
    EXECUTED,
    FAILED
}
