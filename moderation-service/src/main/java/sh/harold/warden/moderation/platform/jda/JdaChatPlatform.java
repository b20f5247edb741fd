package sh.harold.warden.moderation.platform.jda;

import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.Role;
import net.dv8tion.jda.api.entities.UserSnowflake;
import net.dv8tion.jda.api.entities.channel.concrete.TextChannel;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.exceptions.PermissionException;
import net.dv8tion.jda.api.requests.ErrorResponse;
import net.dv8tion.jda.api.requests.RestAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.platform.AuditEntry;
import sh.harold.warden.api.platform.ChatPlatform;
import sh.harold.warden.api.platform.MemberSnapshot;
import sh.harold.warden.api.platform.PlatformCapability;
import sh.harold.warden.api.platform.PlatformException;
import sh.harold.warden.api.platform.PlatformFailure;

import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link ChatPlatform} backed by a connected JDA session. Mutating calls block on
 * {@code complete()}, so they must not run on the gateway thread.
 */
public final class JdaChatPlatform implements ChatPlatform {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdaChatPlatform.class);
    private static final Duration MAX_TIMEOUT = Duration.ofDays(28);
    private static final int AUDIT_COLOR = 0xE67E22;
    private static final Set<ErrorResponse> NOT_FOUND = EnumSet.of(
            ErrorResponse.UNKNOWN_GUILD,
            ErrorResponse.UNKNOWN_MEMBER,
            ErrorResponse.UNKNOWN_USER,
            ErrorResponse.UNKNOWN_MESSAGE,
            ErrorResponse.UNKNOWN_CHANNEL,
            ErrorResponse.UNKNOWN_ROLE,
            ErrorResponse.UNKNOWN_BAN);
    private static final Set<ErrorResponse> FORBIDDEN = EnumSet.of(
            ErrorResponse.MISSING_PERMISSIONS,
            ErrorResponse.MISSING_ACCESS);
    private static final Map<PlatformCapability, Permission> PERMISSIONS = new EnumMap<>(PlatformCapability.class);

    static {
        PERMISSIONS.put(PlatformCapability.ADMINISTRATOR, Permission.ADMINISTRATOR);
        PERMISSIONS.put(PlatformCapability.MANAGE_MESSAGES, Permission.MESSAGE_MANAGE);
        PERMISSIONS.put(PlatformCapability.MODERATE_MEMBERS, Permission.MODERATE_MEMBERS);
        PERMISSIONS.put(PlatformCapability.KICK_MEMBERS, Permission.KICK_MEMBERS);
        PERMISSIONS.put(PlatformCapability.BAN_MEMBERS, Permission.BAN_MEMBERS);
        PERMISSIONS.put(PlatformCapability.MANAGE_ROLES, Permission.MANAGE_ROLES);
    }

    private final JDA jda;
    private final String auditChannelName;

    public JdaChatPlatform(JDA jda, String auditChannelName) {
        this.jda = Objects.requireNonNull(jda, "jda");
        this.auditChannelName = Objects.requireNonNull(auditChannelName, "auditChannelName");
    }

    @Override
    public Optional<MemberSnapshot> self(long guildId) {
        return guild(guildId).map(guild -> snapshot(guild.getSelfMember()));
    }

    @Override
    public Optional<MemberSnapshot> member(long guildId, long userId) {
        Optional<Guild> guild = guild(guildId);
        if (guild.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(snapshot(guild.get().retrieveMemberById(userId).complete()));
        } catch (ErrorResponseException e) {
            if (NOT_FOUND.contains(e.getErrorResponse())) {
                return Optional.empty();
            }
            throw translate("retrieve member " + userId, e);
        }
    }

    @Override
    public Optional<Integer> rolePosition(long guildId, long roleId) {
        return guild(guildId)
                .map(guild -> guild.getRoleById(roleId))
                .map(JdaChatPlatform::position);
    }

    @Override
    public boolean isGuildAvailable(long guildId) {
        return guild(guildId).isPresent();
    }

    @Override
    public void deleteMessage(long guildId, long channelId, long messageId) {
        Guild guild = requireGuild(guildId);
        TextChannel channel = guild.getTextChannelById(channelId);
        if (channel == null) {
            throw new PlatformException(PlatformFailure.NOT_FOUND, "Channel " + channelId + " not found in guild " + guildId);
        }
        complete("delete message " + messageId, () -> channel.deleteMessageById(messageId));
    }

    @Override
    public void timeoutMember(long guildId, long userId, Duration duration, String reason) {
        Duration bounded = duration.compareTo(MAX_TIMEOUT) > 0 ? MAX_TIMEOUT : duration;
        if (bounded != duration) {
            LOGGER.warn("Timeout of {} for {} exceeds the platform limit, applying {}", duration, userId, MAX_TIMEOUT);
        }
        Guild guild = requireGuild(guildId);
        complete("timeout " + userId, () -> guild.timeoutFor(UserSnowflake.fromId(userId), bounded).reason(reason));
    }

    @Override
    public void kickMember(long guildId, long userId, String reason) {
        Guild guild = requireGuild(guildId);
        complete("kick " + userId, () -> guild.kick(UserSnowflake.fromId(userId)).reason(reason));
    }

    @Override
    public void banMember(long guildId, long userId, String reason) {
        Guild guild = requireGuild(guildId);
        complete("ban " + userId, () -> guild.ban(UserSnowflake.fromId(userId), 0, TimeUnit.SECONDS).reason(reason));
    }

    @Override
    public void unbanMember(long guildId, long userId, String reason) {
        Guild guild = requireGuild(guildId);
        complete("unban " + userId, () -> guild.unban(UserSnowflake.fromId(userId)).reason(reason));
    }

    @Override
    public void addRole(long guildId, long userId, long roleId, String reason) {
        Guild guild = requireGuild(guildId);
        Role role = requireRole(guild, roleId);
        complete("add role " + roleId + " to " + userId,
                () -> guild.addRoleToMember(UserSnowflake.fromId(userId), role).reason(reason));
    }

    @Override
    public void removeRole(long guildId, long userId, long roleId, String reason) {
        Guild guild = requireGuild(guildId);
        Role role = requireRole(guild, roleId);
        complete("remove role " + roleId + " from " + userId,
                () -> guild.removeRoleFromMember(UserSnowflake.fromId(userId), role).reason(reason));
    }

    @Override
    public void sendAuditEntry(AuditEntry entry) {
        Optional<Guild> guild = guild(entry.guildId());
        if (guild.isEmpty()) {
            return;
        }
        List<TextChannel> channels = guild.get().getTextChannelsByName(auditChannelName, true);
        if (channels.isEmpty()) {
            LOGGER.debug("Guild {} has no #{} channel, audit entry '{}' not sent", entry.guildId(), auditChannelName, entry.title());
            return;
        }

        EmbedBuilder embed = new EmbedBuilder()
                .setTitle(entry.title())
                .setColor(AUDIT_COLOR)
                .setTimestamp(entry.timestamp());
        entry.fields().forEach((name, value) -> embed.addField(name, value, true));
        channels.get(0).sendMessageEmbeds(embed.build()).queue(
                ignored -> {
                },
                failure -> LOGGER.warn("Failed to send audit entry to guild {}: {}", entry.guildId(), failure.getMessage()));
    }

    private Optional<Guild> guild(long guildId) {
        return Optional.ofNullable(jda.getGuildById(guildId));
    }

    private Guild requireGuild(long guildId) {
        return guild(guildId).orElseThrow(() ->
                new PlatformException(PlatformFailure.NOT_FOUND, "Guild " + guildId + " is not available"));
    }

    private static Role requireRole(Guild guild, long roleId) {
        Role role = guild.getRoleById(roleId);
        if (role == null) {
            throw new PlatformException(PlatformFailure.NOT_FOUND, "Role " + roleId + " not found in guild " + guild.getIdLong());
        }
        return role;
    }

    /**
     * Builds and completes the action. JDA checks permissions and role hierarchy while building,
     * so construction happens inside the translated section too.
     */
    private static void complete(String operation, Supplier<RestAction<?>> action) {
        try {
            action.get().complete();
        } catch (ErrorResponseException e) {
            throw translate(operation, e);
        } catch (PermissionException e) {
            throw new PlatformException(PlatformFailure.FORBIDDEN, "Cannot " + operation + ": " + e.getMessage(), e);
        } catch (IllegalStateException | IllegalArgumentException e) {
            throw new PlatformException(PlatformFailure.UNAVAILABLE, "Cannot " + operation + ": " + e.getMessage(), e);
        }
    }

    static PlatformException translate(String operation, ErrorResponseException e) {
        PlatformFailure failure;
        if (NOT_FOUND.contains(e.getErrorResponse())) {
            failure = PlatformFailure.NOT_FOUND;
        } else if (FORBIDDEN.contains(e.getErrorResponse())) {
            failure = PlatformFailure.FORBIDDEN;
        } else if (e.getErrorCode() == 429) {
            failure = PlatformFailure.RATE_LIMITED;
        } else {
            failure = PlatformFailure.UNAVAILABLE;
        }
        return new PlatformException(failure, "Cannot " + operation + ": " + e.getMeaning(), e);
    }

    // shifted by one so a member holding only the public role sits at 0
    private static int position(Role role) {
        return role.getPosition() + 1;
    }

    static MemberSnapshot snapshot(Member member) {
        List<Role> roles = member.getRoles();
        Set<Long> roleIds = roles.stream().map(Role::getIdLong).collect(Collectors.toSet());
        int topPosition = roles.isEmpty() ? 0 : position(roles.get(0));
        Set<PlatformCapability> capabilities = EnumSet.noneOf(PlatformCapability.class);
        PERMISSIONS.forEach((capability, permission) -> {
            if (member.hasPermission(permission)) {
                capabilities.add(capability);
            }
        });
        return new MemberSnapshot(member.getGuild().getIdLong(), member.getIdLong(), member.getEffectiveName(),
                roleIds, topPosition, capabilities, member.getUser().isBot(), member.isOwner());
    }
}
