package sh.harold.warden.api.platform;

import sh.harold.warden.api.moderation.ModerationException;

/**
 * The target's top role is not below the acting identity's top role.
 */
public class HierarchyException extends ModerationException {

    public HierarchyException(String message) {
        super(message);
    }
}
