package sh.harold.warden.api.messagebus.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.warden.api.messagebus.MessageBus;
import sh.harold.warden.api.messagebus.MessageEnvelope;
import sh.harold.warden.api.messagebus.MessageHandler;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Process-local bus. Each handler invocation is handed to the delivery executor, so a slow or
 * failing subscriber never holds up the publisher.
 */
public class InMemoryMessageBus implements MessageBus {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryMessageBus.class);

    private final Map<String, List<MessageHandler>> subscriptions = new ConcurrentHashMap<>();
    private final String senderId;
    private final ObjectMapper objectMapper;
    private final Executor deliveryExecutor;
    private final Clock clock;
    private volatile boolean closed;

    public InMemoryMessageBus(String senderId, ObjectMapper objectMapper, Executor deliveryExecutor, Clock clock) {
        this.senderId = Objects.requireNonNull(senderId, "senderId");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.deliveryExecutor = Objects.requireNonNull(deliveryExecutor, "deliveryExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        LOGGER.info("InMemoryMessageBus initialized for {}", senderId);
    }

    @Override
    public void broadcast(String type, Object payload) {
        Objects.requireNonNull(type, "type");
        if (closed) {
            LOGGER.warn("Dropping message of type {} published after shutdown", type);
            return;
        }

        List<MessageHandler> handlers = subscriptions.get(type);
        if (handlers == null || handlers.isEmpty()) {
            LOGGER.debug("No subscribers for message type {}", type);
            return;
        }

        MessageEnvelope envelope;
        try {
            envelope = new MessageEnvelope(
                    type,
                    senderId,
                    UUID.randomUUID(),
                    clock.millis(),
                    1,
                    objectMapper.valueToTree(payload));
        } catch (IllegalArgumentException ex) {
            LOGGER.error("Failed to serialize payload for message type {}", type, ex);
            return;
        }

        for (MessageHandler handler : handlers) {
            try {
                deliveryExecutor.execute(() -> deliver(handler, envelope));
            } catch (RejectedExecutionException ex) {
                LOGGER.warn("Delivery of message type {} rejected: {}", type, ex.getMessage());
            }
        }
    }

    @Override
    public void subscribe(String type, MessageHandler handler) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        subscriptions.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>()).add(handler);
        LOGGER.debug("Subscribed handler to message type {}", type);
    }

    @Override
    public void unsubscribe(String type, MessageHandler handler) {
        List<MessageHandler> handlers = subscriptions.get(type);
        if (handlers != null) {
            handlers.remove(handler);
            if (handlers.isEmpty()) {
                subscriptions.remove(type, handlers);
            }
        }
    }

    @Override
    public void close() {
        closed = true;
        subscriptions.clear();
        if (deliveryExecutor instanceof ExecutorService executorService) {
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                executorService.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        LOGGER.info("InMemoryMessageBus shut down");
    }

    private void deliver(MessageHandler handler, MessageEnvelope envelope) {
        try {
            handler.handle(envelope);
        } catch (Exception e) {
            LOGGER.warn("Error handling message of type {}: {}", envelope.getType(), e.getMessage(), e);
        }
    }
}
