package com.pulsarr.decision;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Verdict carried by a {@link RouterDecision}.
 */
public enum DecisionAction {
    /** Acquire on the attached routing. */
    ROUTE("route"),
    /** Defer until an admin approves the proposed routing. */
    REQUIRE_APPROVAL("require_approval"),
    /** Terminal refusal. */
    REJECT("reject"),
    /** Decline explicitly and let the next stage decide. */
    CONTINUE("continue");

    private final String value;

    DecisionAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static DecisionAction fromValue(String value) {
        for (DecisionAction action : values()) {
            if (action.value.equals(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown decision action: " + value);
    }
}
