package at.sv.zmanim.time;

/**
 * Signals an expression that is neither a clock time nor a known zman, sun keyword or degree expression.
 */
public final class InvalidZmanExpression extends RuntimeException {

    public InvalidZmanExpression(String message) {
        super(message);
    }

    public InvalidZmanExpression(String message, Throwable cause) {
        super(message, cause);
    }
}
