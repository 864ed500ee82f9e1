package sentrix.lifecycle.exceptions;

/**
 * Exception thrown when an argument passed into the lifecycle engine is invalid (confidence outside [0,1], negative
 * sizes, missing required instants, out-of-range coordinates).
 *
 * <p>
 * Raised synchronously at the call boundary and never leaves partial state behind. When the failure concerns a single
 * named argument, {@link #getArgument()} identifies it so callers can point at the offending field.
 */
public class ValidationException extends RuntimeException {

    private final String argument;

    public ValidationException(String message) {
        this(null, message);
    }

    /**
     * @param argument
     *            name of the rejected argument (may be null)
     * @param message
     *            description of the violation
     */
    public ValidationException(String argument, String message) {
        super(message);
        this.argument = argument;
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
        this.argument = null;
    }

    /**
     * @return name of the rejected argument, or null when the failure is not tied to one argument
     */
    public String getArgument() {
        return argument;
    }
}
