package villagecompute.community.services;

import villagecompute.community.api.types.ContentSubmissionType;

import java.util.UUID;

/**
 * Persists accepted content on behalf of {@link ContentSubmissionService}.
 *
 * <p>
 * Implemented by the owning feature (posts, comments, messages, feedback). Only called for content the gate did not
 * block; {@code storedContent} is the cleaned text when the content was flagged.
 */
@FunctionalInterface
public interface ContentWriter {

    /**
     * @param submission
     *            original submission
     * @param storedContent
     *            text to persist
     * @param visible
     *            false when the content awaits admin review
     * @return identifier of the persisted content
     */
    UUID write(ContentSubmissionType submission, String storedContent, boolean visible);
}
