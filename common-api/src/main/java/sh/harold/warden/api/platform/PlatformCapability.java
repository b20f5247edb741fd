package sh.harold.warden.api.platform;

/**
 * Platform permissions the engine checks before acting.
 */
public enum PlatformCapability {
    ADMINISTRATOR,
    MANAGE_MESSAGES,
    MODERATE_MEMBERS,
    KICK_MEMBERS,
    BAN_MEMBERS,
    MANAGE_ROLES
}
