package main.java.wte;

/**
 * Raised when a sequence cannot be smoothed. The kind tells whether the penalty matrix
 * could not be built or the linear system could not be solved.
 */
public class WTEException extends RuntimeException {

    public enum ErrorKind {
        INVALID_ORDER,
        SPACING_LENGTH_MISMATCH,
        INSUFFICIENT_DATA,
        SOLVE_FAILURE
    }

    private final ErrorKind kind;

    public WTEException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public WTEException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
