package sh.harold.warden.moderation.effects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.messagebus.ChannelConstants;
import sh.harold.warden.api.messagebus.MessageBus;
import sh.harold.warden.api.messagebus.MessageEnvelope;
import sh.harold.warden.api.messagebus.messages.SanctionAppliedMessage;
import sh.harold.warden.api.messagebus.messages.SanctionReversedMessage;
import sh.harold.warden.api.platform.AuditEntry;
import sh.harold.warden.api.platform.ChatPlatform;
import sh.harold.warden.api.util.Durations;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Mirrors applied and reversed sanctions into the guild's audit channel.
 */
public final class AuditLogSubscriber {

    private static final Logger LOGGER = LoggerFactory.getLogger(AuditLogSubscriber.class);

    private final ChatPlatform platform;
    private final ObjectMapper objectMapper;

    public AuditLogSubscriber(ChatPlatform platform, ObjectMapper objectMapper) {
        this.platform = Objects.requireNonNull(platform, "platform");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public void register(MessageBus messageBus) {
        messageBus.subscribe(ChannelConstants.SANCTION_APPLIED, this::onSanctionApplied);
        messageBus.subscribe(ChannelConstants.SANCTION_REVERSED, this::onSanctionReversed);
    }

    void onSanctionApplied(MessageEnvelope envelope) {
        SanctionAppliedMessage message = read(envelope, SanctionAppliedMessage.class);
        if (message == null) {
            return;
        }

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("User", "<@" + message.getUserId() + ">");
        fields.put("Action", message.getAction() == null ? "temporary_role" : message.getAction().getId());
        if (message.getTier() > 0) {
            fields.put("Tier", Integer.toString(message.getTier()));
        }
        if (message.getViolationType() != null) {
            fields.put("Violation", message.getViolationType().getDisplayName());
            fields.put("Severity", Integer.toString(message.getSeverity()));
        }
        if (message.getDuration() != null) {
            fields.put("Duration", Durations.format(message.getDuration()));
        }
        fields.put("Moderator", message.isAutomatic() ? "Auto-moderation" : "<@" + message.getModeratorId() + ">");
        if (message.getReason() != null) {
            fields.put("Reason", message.getReason());
        }

        String title = message.isAutomatic() ? "Auto-Moderation Action" : "Moderation Action";
        platform.sendAuditEntry(new AuditEntry(message.getGuildId(), title, fields, timestamp(message.getIssuedAt(), envelope)));
    }

    void onSanctionReversed(MessageEnvelope envelope) {
        SanctionReversedMessage message = read(envelope, SanctionReversedMessage.class);
        if (message == null) {
            return;
        }

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("User", "<@" + message.getUserId() + ">");
        fields.put("Sanction", message.getType() == null ? "unknown" : message.getType().getId());
        if (message.getRoleId() != null) {
            fields.put("Role", "<@&" + message.getRoleId() + ">");
        }
        fields.put("Result", message.isReverted() ? "Reversed" : "Dropped (" + message.getFailure() + ")");

        platform.sendAuditEntry(new AuditEntry(message.getGuildId(), "Temporary Sanction Expired", fields,
                timestamp(message.getReversedAt(), envelope)));
    }

    private <T> T read(MessageEnvelope envelope, Class<T> type) {
        try {
            return objectMapper.treeToValue(envelope.getPayload(), type);
        } catch (JsonProcessingException e) {
            LOGGER.warn("Ignoring malformed {} message {}: {}", envelope.getType(), envelope.getCorrelationId(), e.getOriginalMessage());
            return null;
        }
    }

    private static Instant timestamp(Instant value, MessageEnvelope envelope) {
        return value != null ? value : Instant.ofEpochMilli(envelope.getTimestamp());
    }
}
