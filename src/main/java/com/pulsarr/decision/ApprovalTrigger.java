package com.pulsarr.decision;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What caused a request to be held for approval.
 */
public enum ApprovalTrigger {
    QUOTA_EXCEEDED("quota_exceeded"),
    ROUTER_RULE("router_rule"),
    MANUAL_FLAG("manual_flag"),
    CONTENT_CRITERIA("content_criteria");

    private final String value;

    ApprovalTrigger(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ApprovalTrigger fromValue(String value) {
        for (ApprovalTrigger trigger : values()) {
            if (trigger.value.equals(value)) {
                return trigger;
            }
        }
        throw new IllegalArgumentException("Unknown approval trigger: " + value);
    }
}
