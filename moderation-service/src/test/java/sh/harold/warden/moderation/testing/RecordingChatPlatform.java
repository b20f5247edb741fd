package sh.harold.warden.moderation.testing;

import sh.harold.warden.api.platform.AuditEntry;
import sh.harold.warden.api.platform.ChatPlatform;
import sh.harold.warden.api.platform.MemberSnapshot;
import sh.harold.warden.api.platform.PlatformCapability;
import sh.harold.warden.api.platform.PlatformException;
import sh.harold.warden.api.platform.PlatformFailure;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory platform that records every mutating call as a short string such as
 * {@code timeout:1:42:PT30M} and can be told to fail specific operations.
 */
public final class RecordingChatPlatform implements ChatPlatform {

    public static final long SERVICE_ID = 999L;

    private final Map<Long, Map<Long, MemberSnapshot>> members = new ConcurrentHashMap<>();
    private final Map<Long, Map<Long, Integer>> roles = new ConcurrentHashMap<>();
    private final Set<Long> unavailableGuilds = ConcurrentHashMap.newKeySet();
    private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final List<AuditEntry> auditEntries = new CopyOnWriteArrayList<>();

    /**
     * Adds the service identity with every moderation capability and a role at position 100.
     */
    public RecordingChatPlatform withGuild(long guildId) {
        return withGuild(guildId, EnumSet.of(
                PlatformCapability.MANAGE_MESSAGES,
                PlatformCapability.MODERATE_MEMBERS,
                PlatformCapability.KICK_MEMBERS,
                PlatformCapability.BAN_MEMBERS,
                PlatformCapability.MANAGE_ROLES));
    }

    public RecordingChatPlatform withGuild(long guildId, Set<PlatformCapability> serviceCapabilities) {
        putMember(new MemberSnapshot(guildId, SERVICE_ID, "warden", Set.of(), 100, serviceCapabilities, true, false));
        return this;
    }

    public MemberSnapshot addMember(long guildId, long userId, int topRolePosition, PlatformCapability... capabilities) {
        Set<PlatformCapability> granted = capabilities.length == 0 ? Set.of() : EnumSet.of(capabilities[0], capabilities);
        MemberSnapshot member = new MemberSnapshot(guildId, userId, "user-" + userId, Set.of(), topRolePosition, granted, false, false);
        putMember(member);
        return member;
    }

    public void putMember(MemberSnapshot member) {
        members.computeIfAbsent(member.guildId(), ignored -> new ConcurrentHashMap<>()).put(member.userId(), member);
    }

    public void removeMember(long guildId, long userId) {
        Map<Long, MemberSnapshot> guild = members.get(guildId);
        if (guild != null) {
            guild.remove(userId);
        }
    }

    public void addRole(long guildId, long roleId, int position) {
        roles.computeIfAbsent(guildId, ignored -> new ConcurrentHashMap<>()).put(roleId, position);
    }

    public void setGuildAvailable(long guildId, boolean available) {
        if (available) {
            unavailableGuilds.remove(guildId);
        } else {
            unavailableGuilds.add(guildId);
        }
    }

    /**
     * Makes every call of the named operation ({@code member}, {@code delete}, {@code timeout}, {@code kick},
     * {@code ban}, {@code unban}, {@code addRole}, {@code removeRole}, {@code audit}) throw.
     * {@code member} covers lookups of other members only, never {@link #self(long)}.
     */
    public void failOn(String operation, PlatformFailure failure) {
        failOn(operation, new PlatformException(failure, operation + " failed (" + failure + ")"));
    }

    public void failOn(String operation, RuntimeException failure) {
        failures.put(operation, failure);
    }

    public void clearFailures() {
        failures.clear();
    }

    public List<String> calls() {
        return List.copyOf(calls);
    }

    public List<String> calls(String operation) {
        List<String> matching = new ArrayList<>();
        for (String call : calls) {
            if (call.startsWith(operation + ":")) {
                matching.add(call);
            }
        }
        return matching;
    }

    public List<AuditEntry> auditEntries() {
        return List.copyOf(auditEntries);
    }

    @Override
    public Optional<MemberSnapshot> self(long guildId) {
        return lookup(guildId, SERVICE_ID);
    }

    @Override
    public Optional<MemberSnapshot> member(long guildId, long userId) {
        throwIfFailing("member");
        return lookup(guildId, userId);
    }

    private Optional<MemberSnapshot> lookup(long guildId, long userId) {
        if (!isGuildAvailable(guildId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(members.getOrDefault(guildId, Map.of()).get(userId));
    }

    @Override
    public Optional<Integer> rolePosition(long guildId, long roleId) {
        return Optional.ofNullable(roles.getOrDefault(guildId, Map.of()).get(roleId));
    }

    @Override
    public boolean isGuildAvailable(long guildId) {
        return members.containsKey(guildId) && !unavailableGuilds.contains(guildId);
    }

    @Override
    public void deleteMessage(long guildId, long channelId, long messageId) {
        record("delete", guildId + ":" + channelId + ":" + messageId);
    }

    @Override
    public void timeoutMember(long guildId, long userId, Duration duration, String reason) {
        record("timeout", guildId + ":" + userId + ":" + duration);
    }

    @Override
    public void kickMember(long guildId, long userId, String reason) {
        record("kick", guildId + ":" + userId);
    }

    @Override
    public void banMember(long guildId, long userId, String reason) {
        record("ban", guildId + ":" + userId);
    }

    @Override
    public void unbanMember(long guildId, long userId, String reason) {
        record("unban", guildId + ":" + userId);
    }

    @Override
    public void addRole(long guildId, long userId, long roleId, String reason) {
        record("addRole", guildId + ":" + userId + ":" + roleId);
        MemberSnapshot member = members.getOrDefault(guildId, Map.of()).get(userId);
        if (member != null) {
            Set<Long> updated = new HashSet<>(member.roleIds());
            updated.add(roleId);
            putMember(withRoles(member, updated));
        }
    }

    @Override
    public void removeRole(long guildId, long userId, long roleId, String reason) {
        record("removeRole", guildId + ":" + userId + ":" + roleId);
        MemberSnapshot member = members.getOrDefault(guildId, Map.of()).get(userId);
        if (member != null) {
            Set<Long> updated = new HashSet<>(member.roleIds());
            updated.remove(roleId);
            putMember(withRoles(member, updated));
        }
    }

    @Override
    public void sendAuditEntry(AuditEntry entry) {
        record("audit", entry.guildId() + ":" + entry.title());
        auditEntries.add(entry);
    }

    private void record(String operation, String detail) {
        throwIfFailing(operation);
        calls.add(operation + ":" + detail);
    }

    private void throwIfFailing(String operation) {
        RuntimeException failure = failures.get(operation);
        if (failure != null) {
            throw failure;
        }
    }

    private static MemberSnapshot withRoles(MemberSnapshot member, Set<Long> roleIds) {
        return new MemberSnapshot(member.guildId(), member.userId(), member.displayName(), roleIds,
                member.topRolePosition(), member.capabilities(), member.bot(), member.owner());
    }
}
