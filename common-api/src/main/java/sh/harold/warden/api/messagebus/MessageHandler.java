package sh.harold.warden.api.messagebus;

/**
 * Callback for messages published on a channel.
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * Handles an incoming message envelope. Exceptions thrown here are logged by the bus
     * and never reach the publisher.
     */
    void handle(MessageEnvelope envelope);
}
