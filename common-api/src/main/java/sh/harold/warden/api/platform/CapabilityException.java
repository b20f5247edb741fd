package sh.harold.warden.api.platform;

import sh.harold.warden.api.moderation.ModerationException;

/**
 * The acting identity lacks the platform capability an action requires.
 */
public class CapabilityException extends ModerationException {
    private final PlatformCapability capability;

    public CapabilityException(PlatformCapability capability, String message) {
        super(message);
        this.capability = capability;
    }

    public PlatformCapability getCapability() {
        return capability;
    }
}
