package com.reviewgate.core.model;

import java.util.List;

/**
 * Admit or block verdict with the factors that produced it.
 */
public record Decision(
    DecisionOutcome outcome,
    ReasonCode reasonCode,
    String reason,
    List<String> factors,
    String overrideLabel
) {
    public Decision {
        factors = factors != null ? List.copyOf(factors) : List.of();
    }

    public static Decision admit(ReasonCode code, String reason, List<String> factors) {
        return new Decision(DecisionOutcome.ADMIT, code, reason, factors, null);
    }

    public static Decision block(ReasonCode code, String reason, List<String> factors) {
        return new Decision(DecisionOutcome.BLOCK, code, reason, factors, null);
    }

    public static Decision override(String label) {
        return new Decision(DecisionOutcome.ADMIT, ReasonCode.OVERRIDE_APPLIED, "override applied",
            List.of("label:" + label), label);
    }

    public boolean admitted() {
        return outcome == DecisionOutcome.ADMIT;
    }
}
