package org.Aayush.alns.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Failure raised by the search engine itself, tagged with an {@code ALNS_*} reason code.
 *
 * <p>The engine fails in four ways:</p>
 * <ul>
 *     <li>{@link #REASON_NO_DESTROY_METHODS}: {@code solve()} was called before any destroy
 *     method was registered. Nothing is mutated.</li>
 *     <li>{@link #REASON_NO_REPAIR_METHODS}: the same for repair methods. Checked after the
 *     destroy pool.</li>
 *     <li>{@link #REASON_INVALID_PARAMS}: score parameters or a record-to-record travel
 *     schedule failed validation, at construction or on {@code setParams}.</li>
 *     <li>{@link #REASON_CONFIG_UNREADABLE}: a JSON configuration could not be read or is
 *     not a JSON object. The I/O or parse failure is attached as the cause.</li>
 * </ul>
 *
 * <p>Exceptions thrown by user-supplied operators, acceptance criteria or visitors are
 * propagated unchanged and never wrapped in this type.</p>
 */
@Getter
@Accessors(fluent = true)
public final class AlnsException extends RuntimeException {
    /** No destroy method registered when the search started. */
    public static final String REASON_NO_DESTROY_METHODS = "ALNS_NO_DESTROY_METHODS";
    /** No repair method registered when the search started. */
    public static final String REASON_NO_REPAIR_METHODS = "ALNS_NO_REPAIR_METHODS";
    /** Score parameters or acceptance schedule out of range. */
    public static final String REASON_INVALID_PARAMS = "ALNS_INVALID_PARAMS";
    /** Configuration file missing, unreadable or not a JSON object. */
    public static final String REASON_CONFIG_UNREADABLE = "ALNS_CONFIG_UNREADABLE";

    private final String reasonCode;

    /**
     * Creates a reason-coded engine failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public AlnsException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded engine failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public AlnsException(String reasonCode, String message, Throwable cause) {
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
