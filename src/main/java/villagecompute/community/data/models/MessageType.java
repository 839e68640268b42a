package villagecompute.community.data.models;

/**
 * Direct message payload types. Only {@link #TEXT} messages are scanned by the text rule set; the others are
 * screened as attachments.
 */
public enum MessageType {
    TEXT, IMAGE, FILE
}
