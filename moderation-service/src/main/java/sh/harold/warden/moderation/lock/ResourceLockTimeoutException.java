package sh.harold.warden.moderation.lock;

import sh.harold.warden.api.moderation.ModerationException;

public class ResourceLockTimeoutException extends ModerationException {
    private final ResourceKey key;

    public ResourceLockTimeoutException(ResourceKey key, String message) {
        super(message);
        this.key = key;
    }

    public ResourceKey getKey() {
        return key;
    }
}
