package com.mcpbridge.lifecycle;

/**
 * Thrown when a creation request is refused before anything is spawned: the caller lacks
 * an identity field its lifecycle mode needs, the server is unknown, or a capacity ceiling
 * has been reached.
 * Never retried automatically.
 */
public class AdmissionException extends LifecycleException {

    public static final String MISSING_IDENTITY = "missing-identity";
    public static final String CAPACITY = "capacity";
    public static final String USER_LIMIT = "user-limit";
    public static final String MODE_NOT_ALLOWED = "mode-not-allowed";
    public static final String QUOTA = "quota";
    public static final String UNKNOWN_SERVER = "unknown-server";

    private final String reason;

    public AdmissionException(String reason, String message) {
        super(ErrorKind.ADMISSION, message);
        this.reason = reason;
    }

    /** Short machine-readable reason, one of the constants on this class. */
    public String getReason() {
        return reason;
    }
}
