package sh.harold.warden.api.moderation;

/**
 * Base type for every failure the moderation engine reports to its callers.
 */
public class ModerationException extends RuntimeException {

    public ModerationException(String message) {
        super(message);
    }

    public ModerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
