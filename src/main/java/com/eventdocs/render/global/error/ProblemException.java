package com.eventdocs.render.global.error;

/**
 * Non-retryable problem with a stable code, e.g. a corrupt or incompatible export.
 */
public class ProblemException extends RuntimeException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:eventdocs:";

    private final String code;
    private final String detail;
    private final String type;

    public ProblemException(String code) {
        this(code, null, null);
    }

    public ProblemException(String code, String detail) {
        this(code, detail, null);
    }

    public ProblemException(String code, String detail, Throwable cause) {
        super(detail != null && !detail.isBlank() ? code + ": " + detail : code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        String normalized = code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
        this.type = DEFAULT_TYPE_PREFIX + normalized;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }
}
