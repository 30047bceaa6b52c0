package com.reviewgate.core.model;

public enum DecisionOutcome {
    ADMIT,
    BLOCK
}
