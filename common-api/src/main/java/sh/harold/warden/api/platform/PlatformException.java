package sh.harold.warden.api.platform;

import sh.harold.warden.api.moderation.ModerationException;

import java.util.Objects;

/**
 * A call into the chat platform failed.
 */
public class PlatformException extends ModerationException {
    private final PlatformFailure failure;

    public PlatformException(PlatformFailure failure, String message) {
        super(message);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public PlatformException(PlatformFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public PlatformFailure getFailure() {
        return failure;
    }

    public boolean isTransient() {
        return failure.isTransient();
    }
}
