package sh.harold.warden.moderation.effects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.messagebus.ChannelConstants;
import sh.harold.warden.api.messagebus.MessageBus;
import sh.harold.warden.api.messagebus.MessageEnvelope;
import sh.harold.warden.api.messagebus.MessageHandler;
import sh.harold.warden.api.messagebus.messages.SanctionAppliedMessage;

import java.util.Objects;

/**
 * Deducts reputation for every violation-driven sanction: {@code penaltyPerSeverity * severity} points.
 */
public final class ReputationSubscriber implements MessageHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReputationSubscriber.class);

    private final ReputationLedger ledger;
    private final ObjectMapper objectMapper;
    private final int penaltyPerSeverity;

    public ReputationSubscriber(ReputationLedger ledger, ObjectMapper objectMapper, int penaltyPerSeverity) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        if (penaltyPerSeverity < 0) {
            throw new IllegalArgumentException("penaltyPerSeverity must not be negative");
        }
        this.penaltyPerSeverity = penaltyPerSeverity;
    }

    public void register(MessageBus messageBus) {
        messageBus.subscribe(ChannelConstants.SANCTION_APPLIED, this);
    }

    @Override
    public void handle(MessageEnvelope envelope) {
        SanctionAppliedMessage message;
        try {
            message = objectMapper.treeToValue(envelope.getPayload(), SanctionAppliedMessage.class);
        } catch (JsonProcessingException e) {
            LOGGER.warn("Ignoring malformed sanction message {}: {}", envelope.getCorrelationId(), e.getOriginalMessage());
            return;
        }
        if (message.getViolationType() == null || message.getSeverity() <= 0) {
            return;
        }

        int delta = -penaltyPerSeverity * message.getSeverity();
        int total = ledger.adjust(message.getGuildId(), message.getUserId(), delta, message.getIssuedAt());
        LOGGER.debug("Reputation of {} in guild {} adjusted by {} to {}", message.getUserId(), message.getGuildId(), delta, total);
    }
}
