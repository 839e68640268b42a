package villagecompute.community.exceptions;

/**
 * Exception thrown when a request fails a business rule, e.g. a reward claim the user is not eligible for.
 *
 * <p>
 * The message is user-facing and is returned verbatim by the HTTP layer.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
