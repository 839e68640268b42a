package villagecompute.community.exceptions;

/**
 * Exception thrown when a member exceeds a per-user action limit, such as the hourly content report limit.
 *
 * <p>
 * Extends RuntimeException per project standards. Callers in the HTTP layer map it to 429 Too Many Requests.
 */
public class RateLimitException extends RuntimeException {

    public RateLimitException(String message) {
        super(message);
    }

    public RateLimitException(String message, Throwable cause) {
        super(message, cause);
    }
}
