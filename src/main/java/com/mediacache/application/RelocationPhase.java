package com.mediacache.application;

/**
 * Progress of one relocation or release.
 *
 * <pre>
 * IDLE -> STAGING -> COMMITTING -> COMMITTED
 *            \           \
 *             +-----------+--> FAILED -> ROLLED_BACK
 * IDLE -> CANCELLED
 * </pre>
 */
public enum RelocationPhase {
    IDLE,
    STAGING,
    COMMITTING,
    COMMITTED,
    FAILED,
    ROLLED_BACK,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK || this == CANCELLED || this == FAILED;
    }
}
