package villagecompute.community.services;

import java.util.UUID;

/**
 * Author and text of a reported post, comment or message, as resolved by a {@link ContentLookup}.
 */
public record ReportedContent(UUID authorId, String text) {
}
