package org.Dirac.routing.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Planner contract exception with deterministic reason codes.
 */
@Getter
public final class RoutePlanningException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded planning failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public RoutePlanningException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded planning failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public RoutePlanningException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
