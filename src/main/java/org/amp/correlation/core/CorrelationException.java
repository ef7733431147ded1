package org.amp.correlation.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Correlation contract failure with a deterministic reason code.
 *
 * <p>Messages are prefixed with the reason code, e.g.
 * {@code [C_CUTOFF_NOT_POSITIVE] cutoffMeters must be > 0, got -1.0}.</p>
 */
@Getter
@Accessors(fluent = true)
public final class CorrelationException extends RuntimeException {
    public static final String REASON_CUTOFF_NOT_POSITIVE = "C_CUTOFF_NOT_POSITIVE";
    public static final String REASON_POINT_REQUIRED = "C_POINT_REQUIRED";
    public static final String REASON_ZONES_REQUIRED = "C_ZONES_REQUIRED";
    public static final String REASON_ADDRESSES_REQUIRED = "C_ADDRESSES_REQUIRED";
    public static final String REASON_ALGORITHM_REQUIRED = "C_ALGORITHM_REQUIRED";
    public static final String REASON_ZONE_SET_MISMATCH = "C_ZONE_SET_MISMATCH";
    public static final String REASON_CONFIG_INVALID = "C_CONFIG_INVALID";
    public static final String REASON_SAMPLE_SIZE_INVALID = "C_SAMPLE_SIZE_INVALID";

    private final String reasonCode;

    /**
     * Creates a reason-coded correlation failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public CorrelationException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded correlation failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     * @param cause underlying exception.
     */
    public CorrelationException(String reasonCode, String message, Throwable cause) {
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
