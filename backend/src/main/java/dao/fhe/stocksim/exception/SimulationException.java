package dao.fhe.stocksim.exception;

/**
 * Aborts the enclosing operation. Thrown before any state is touched, so a caught
 * SimulationException always means "nothing happened".
 */
public class SimulationException extends RuntimeException {
    private final ErrorKind kind;

    public SimulationException(ErrorKind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public SimulationException(ErrorKind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public ErrorCategory getCategory() {
        return kind.getCategory();
    }
}
