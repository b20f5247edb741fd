package sh.harold.warden.api.moderation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of rule breach the engine records. Detection order among the automatic checks
 * is the declaration order of {@link #SPAM} through {@link #BLOCKED_WORDS}.
 */
public enum ViolationType {
    SPAM("spam", "Spam", 2),
    MENTION_SPAM("mention_spam", "Mention Spam", 2),
    LINE_SPAM("line_spam", "Line Spam", 1),
    EMOJI_SPAM("emoji_spam", "Emoji Spam", 1),
    EXCESSIVE_CAPS("excessive_caps", "Excessive Caps", 1),
    BLOCKED_WORDS("blocked_words", "Blocked Words", 3),
    MANUAL_WARNING("manual_warning", "Manual Warning", 1);

    private final String id;
    private final String displayName;
    private final int severity;

    ViolationType(String id, String displayName, int severity) {
        this.id = id;
        this.displayName = displayName;
        this.severity = severity;
    }

    @JsonCreator
    public static ViolationType fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Violation type id must not be null");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (ViolationType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown violation type: " + id);
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Severity assigned when the automatic detector reports this type.
     */
    public int getSeverity() {
        return severity;
    }
}
