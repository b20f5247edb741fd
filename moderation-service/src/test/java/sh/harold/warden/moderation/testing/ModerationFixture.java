package sh.harold.warden.moderation.testing;

import com.fasterxml.jackson.databind.ObjectMapper;
import sh.harold.warden.api.data.impl.memory.InMemoryDocumentStore;
import sh.harold.warden.api.messagebus.ChannelConstants;
import sh.harold.warden.api.messagebus.MessageEnvelope;
import sh.harold.warden.api.messagebus.impl.InMemoryMessageBus;
import sh.harold.warden.api.moderation.EscalationTable;
import sh.harold.warden.api.util.ObjectMappers;
import sh.harold.warden.moderation.ledger.ViolationLedger;
import sh.harold.warden.moderation.ledger.WarningLedger;
import sh.harold.warden.moderation.lock.ResourceLockRegistry;
import sh.harold.warden.moderation.sanction.ModerationActions;
import sh.harold.warden.moderation.sanction.SanctionExecutor;
import sh.harold.warden.moderation.schedule.TemporarySanctionRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Wires the sanction path against in-memory storage, a recording platform and a bus that
 * delivers on the publishing thread.
 */
public final class ModerationFixture {

    public static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    public final ObjectMapper mapper = ObjectMappers.create();
    public final MutableClock clock = new MutableClock(START);
    public final InMemoryDocumentStore store = new InMemoryDocumentStore(mapper);
    public final ResourceLockRegistry locks = new ResourceLockRegistry(Duration.ofSeconds(5));
    public final RecordingChatPlatform platform = new RecordingChatPlatform();
    public final InMemoryMessageBus bus = new InMemoryMessageBus("test", mapper, Runnable::run, clock);
    public final ViolationLedger violationLedger =
            new ViolationLedger(store, locks, EscalationTable.defaults(), ViolationLedger.DEFAULT_RETENTION);
    public final WarningLedger warningLedger = new WarningLedger(store, locks);
    public final TemporarySanctionRegistry temporarySanctions = new TemporarySanctionRegistry(store, locks);
    public final SanctionExecutor executor = new SanctionExecutor(platform, violationLedger, warningLedger,
            EscalationTable.defaults(), locks, bus, clock);
    public final ModerationActions actions = new ModerationActions(platform, executor, violationLedger, warningLedger,
            temporarySanctions, locks, bus, clock);

    private final List<MessageEnvelope> applied = new CopyOnWriteArrayList<>();
    private final List<MessageEnvelope> reversed = new CopyOnWriteArrayList<>();

    public ModerationFixture() {
        bus.subscribe(ChannelConstants.SANCTION_APPLIED, applied::add);
        bus.subscribe(ChannelConstants.SANCTION_REVERSED, reversed::add);
    }

    public List<MessageEnvelope> applied() {
        return List.copyOf(applied);
    }

    public List<MessageEnvelope> reversed() {
        return List.copyOf(reversed);
    }
}
