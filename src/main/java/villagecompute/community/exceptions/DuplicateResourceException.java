package villagecompute.community.exceptions;

/**
 * Exception thrown when a write would duplicate an existing record, such as a badge the user already holds.
 *
 * <p>
 * Callers in the HTTP layer map it to 409 Conflict (or 400 for the manual badge award).
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }

    public DuplicateResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
