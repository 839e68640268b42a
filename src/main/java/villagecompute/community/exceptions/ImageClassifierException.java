package villagecompute.community.exceptions;

/**
 * Exception thrown by the image classifier client when the provider cannot produce a verdict.
 *
 * <p>
 * Carries the HTTP status when the provider answered with a non-success response, or {@link #NO_STATUS} for
 * transport and parsing failures. Never escapes the image moderation adapter.
 */
public class ImageClassifierException extends RuntimeException {

    public static final int NO_STATUS = -1;

    private final int statusCode;

    public ImageClassifierException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ImageClassifierException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_STATUS;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean hasStatusCode() {
        return statusCode != NO_STATUS;
    }
}
