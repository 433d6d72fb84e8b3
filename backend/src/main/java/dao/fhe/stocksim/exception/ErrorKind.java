package dao.fhe.stocksim.exception;

/**
 * Failure kinds. Each kind belongs to exactly one {@link ErrorCategory}.
 */
public enum ErrorKind {

    PERMISSION_DENIED(ErrorCategory.AUTHORIZATION),

    SYSTEM_PAUSED(ErrorCategory.AVAILABILITY),
    BATCH_NOT_OPEN(ErrorCategory.AVAILABILITY),
    ALREADY_PAUSED(ErrorCategory.AVAILABILITY),
    ALREADY_UNPAUSED(ErrorCategory.AVAILABILITY),

    COOLDOWN_ACTIVE(ErrorCategory.RATE_LIMIT),

    REPLAY_ATTEMPT(ErrorCategory.PROTOCOL_INTEGRITY),
    STATE_MISMATCH(ErrorCategory.PROTOCOL_INTEGRITY),
    INVALID_PROOF(ErrorCategory.PROTOCOL_INTEGRITY),
    UNKNOWN_REQUEST(ErrorCategory.PROTOCOL_INTEGRITY),
    MALFORMED_CLEARTEXT(ErrorCategory.PROTOCOL_INTEGRITY),
    DUPLICATE_REQUEST_ID(ErrorCategory.PROTOCOL_INTEGRITY),

    INVALID_ARGUMENT(ErrorCategory.VALIDATION);

    private final ErrorCategory category;

    ErrorKind(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
