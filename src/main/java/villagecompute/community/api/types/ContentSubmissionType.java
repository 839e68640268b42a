package villagecompute.community.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.community.data.models.ContentKind;
import villagecompute.community.data.models.MessageType;

import java.util.List;
import java.util.UUID;

/**
 * A user's request to publish a post, comment, message or feedback item.
 *
 * <p>
 * {@code images} only applies to posts; {@code messageType} only applies to messages and defaults to text.
 */
public record ContentSubmissionType(@JsonProperty("author_id") UUID authorId,

        @JsonProperty("kind") ContentKind kind,

        @JsonProperty("content") String content,

        @JsonProperty("images") List<String> images,

        @JsonProperty("message_type") MessageType messageType) {

    public ContentSubmissionType {
        images = images == null ? List.of() : List.copyOf(images);
        messageType = messageType == null ? MessageType.TEXT : messageType;
    }

    public static ContentSubmissionType text(UUID authorId, ContentKind kind, String content) {
        return new ContentSubmissionType(authorId, kind, content, List.of(), MessageType.TEXT);
    }

    public static ContentSubmissionType post(UUID authorId, String content, List<String> images) {
        return new ContentSubmissionType(authorId, ContentKind.POST, content, images, MessageType.TEXT);
    }
}
