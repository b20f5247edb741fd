package sh.harold.warden.moderation.sanction;

/**
 * Who a sanction is issued by.
 *
 * @param automatic true for auto-escalation performed by the service identity
 */
public record Actor(long userId, String displayName, boolean automatic) {

    public static Actor automatic(long serviceUserId) {
        return new Actor(serviceUserId, "auto-moderation", true);
    }

    public static Actor moderator(long userId, String displayName) {
        return new Actor(userId, displayName, false);
    }
}
