package sh.harold.warden.api.messagebus;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

/**
 * Metadata plus JSON payload for one published message.
 */
public class MessageEnvelope {

    private final String type;
    private final String senderId;
    private final UUID correlationId;
    private final long timestamp;
    private final int version;
    private final JsonNode payload;

    @JsonCreator
    public MessageEnvelope(@JsonProperty("type") String type,
                           @JsonProperty("senderId") String senderId,
                           @JsonProperty("correlationId") UUID correlationId,
                           @JsonProperty("timestamp") long timestamp,
                           @JsonProperty("version") int version,
                           @JsonProperty("payload") JsonNode payload) {
        this.type = type;
        this.senderId = senderId;
        this.correlationId = correlationId;
        this.timestamp = timestamp;
        this.version = version;
        this.payload = payload;
    }

    public String getType() {
        return type;
    }

    public String getSenderId() {
        return senderId;
    }

    public UUID getCorrelationId() {
        return correlationId;
    }

    /**
     * @return creation time in milliseconds since epoch
     */
    public long getTimestamp() {
        return timestamp;
    }

    public int getVersion() {
        return version;
    }

    public JsonNode getPayload() {
        return payload;
    }
}
