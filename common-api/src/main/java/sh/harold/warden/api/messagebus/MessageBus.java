package sh.harold.warden.api.messagebus;

/**
 * Publish/subscribe channel between the sanction path and its side-effect consumers.
 * Publishing never blocks on, or fails because of, a subscriber.
 */
public interface MessageBus extends AutoCloseable {

    /**
     * Publishes a payload to every handler subscribed to the given type.
     *
     * @param type    the channel identifier, see {@link ChannelConstants}
     * @param payload a Jackson-serializable payload
     */
    void broadcast(String type, Object payload);

    void subscribe(String type, MessageHandler handler);

    void unsubscribe(String type, MessageHandler handler);

    /**
     * Stops delivery and waits briefly for in-flight handlers.
     */
    @Override
    void close();
}
