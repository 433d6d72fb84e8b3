package dao.fhe.stocksim.exception;

public enum ErrorCategory {
    AUTHORIZATION,
    AVAILABILITY,
    RATE_LIMIT,
    PROTOCOL_INTEGRITY,
    VALIDATION
}
