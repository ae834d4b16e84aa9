package com.mediacache.interfaces.api.dto;

import lombok.Value;

@Value
public class DecisionOutcome {

    public enum Status {
        APPLIED,
        /** Already in the desired state. */
        NOOP,
        /** Path absent; nothing attempted. */
        SKIPPED,
        CANCELLED,
        FAILED
    }

    String originalPath;
    DesiredState desiredState;
    Status status;
    /** Set only for FAILED. */
    OperationError error;
}
