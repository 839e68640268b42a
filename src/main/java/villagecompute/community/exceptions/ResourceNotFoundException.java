package villagecompute.community.exceptions;

/**
 * Exception thrown when a requested resource is not found (e.g., user, badge, reward, moderation record).
 *
 * <p>
 * Extends RuntimeException per project standards. Callers in the HTTP layer map it to 404 Not Found.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
