package sh.harold.warden.api.platform;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Point-in-time view of a guild member as the platform reports it.
 *
 * @param topRolePosition position of the member's highest role; higher outranks lower
 */
public record MemberSnapshot(long guildId,
                             long userId,
                             String displayName,
                             Set<Long> roleIds,
                             int topRolePosition,
                             Set<PlatformCapability> capabilities,
                             boolean bot,
                             boolean owner) {

    public MemberSnapshot {
        displayName = displayName == null ? Long.toString(userId) : displayName;
        roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
        capabilities = capabilities == null || capabilities.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(capabilities));
    }

    public boolean hasCapability(PlatformCapability capability) {
        Objects.requireNonNull(capability, "capability");
        return owner || capabilities.contains(PlatformCapability.ADMINISTRATOR) || capabilities.contains(capability);
    }

    /**
     * True when this member's top role sits strictly above the other member's.
     * Guild owners outrank everyone.
     */
    public boolean outranks(MemberSnapshot other) {
        if (other.owner) {
            return false;
        }
        return owner || topRolePosition > other.topRolePosition;
    }
}
