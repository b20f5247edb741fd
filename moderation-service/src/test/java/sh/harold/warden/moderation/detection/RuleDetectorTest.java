package sh.harold.warden.moderation.detection;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sh.harold.warden.api.moderation.GuildConfig;
import sh.harold.warden.api.moderation.ViolationType;
import sh.harold.warden.api.platform.InboundMessage;
import sh.harold.warden.moderation.lock.ResourceLockRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RuleDetectorTest {

    private static final long GUILD = 1L;
    private static final long USER = 42L;
    private static final long MODERATOR_ROLE = 7L;
    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    private SpamTracker spamTracker;
    private RuleDetector detector;
    private GuildConfig config;
    private long nextMessageId;

    @BeforeEach
    void setUp() {
        spamTracker = new SpamTracker(new ResourceLockRegistry(Duration.ofSeconds(5)));
        detector = new RuleDetector(spamTracker);
        config = GuildConfig.defaults(GUILD);
    }

    @Test
    @DisplayName("Six messages inside five seconds produce one spam finding with severity 2")
    void sixthMessageInWindowIsSpam() {
        List<List<Finding>> results = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            results.add(detector.inspect(message("hello", START.plusMillis(i * 500L)), config, Set.of()));
        }

        for (int i = 0; i < 5; i++) {
            assertThat(results.get(i)).isEmpty();
        }
        assertThat(results.get(5)).singleElement().satisfies(finding -> {
            assertThat(finding.type()).isEqualTo(ViolationType.SPAM);
            assertThat(finding.severity()).isEqualTo(2);
        });
    }

    @Test
    void messagesOutsideTheWindowDoNotCount() {
        for (int i = 0; i < 10; i++) {
            List<Finding> findings = detector.inspect(message("hello", START.plusSeconds(i * 2L)), config, Set.of());
            assertThat(findings).isEmpty();
        }
    }

    @Test
    void mentionThresholdIsExclusive() {
        assertThat(detector.inspect(message("hi", START, ids(5)), config, Set.of())).isEmpty();

        List<Finding> findings = detector.inspect(message("hi", START.plusSeconds(10), ids(6)), config, Set.of());

        assertThat(findings).extracting(Finding::type).containsExactly(ViolationType.MENTION_SPAM);
    }

    @Test
    void tooManyLinesIsLineSpam() {
        String content = String.join("\n", Collections.nCopies(11, "line"));

        assertThat(detector.inspect(message(content, START), config, Set.of()))
                .extracting(Finding::type)
                .containsExactly(ViolationType.LINE_SPAM);
    }

    @Test
    void customAndUnicodeEmojisAreCounted() {
        String content = "<:pog:123456>".repeat(6) + "😀".repeat(5);

        assertThat(RuleDetector.countEmojis(content)).isEqualTo(11);
        assertThat(detector.inspect(message(content, START), config, Set.of()))
                .extracting(Finding::type)
                .containsExactly(ViolationType.EMOJI_SPAM);
    }

    @Test
    void capsNeedMoreThanTenCharacters() {
        assertThat(detector.inspect(message("HELLOWORLD", START), config, Set.of())).isEmpty();

        assertThat(detector.inspect(message("HELLO WORLD!!", START.plusSeconds(10)), config, Set.of()))
                .extracting(Finding::type)
                .containsExactly(ViolationType.EXCESSIVE_CAPS);
    }

    @Test
    void blockedWordsMatchCaseInsensitively() {
        config = config.toBuilder().addBlockedWord("Forbidden").build();

        List<Finding> findings = detector.inspect(message("this is FORBIDDEN text", START), config, Set.of());

        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.type()).isEqualTo(ViolationType.BLOCKED_WORDS);
            assertThat(finding.severity()).isEqualTo(3);
        });
    }

    @Test
    @DisplayName("Findings follow check order and the most severe wins, first one on ties")
    void findingsAreOrderedAndMostSevereWins() {
        config = config.toBuilder().addBlockedWord("bad").build();
        String content = "BAD BAD BAD BAD\n".repeat(11);

        List<Finding> findings = detector.inspect(message(content, START, ids(6)), config, Set.of());

        assertThat(findings).extracting(Finding::type).containsExactly(
                ViolationType.MENTION_SPAM,
                ViolationType.LINE_SPAM,
                ViolationType.EXCESSIVE_CAPS,
                ViolationType.BLOCKED_WORDS);
        assertThat(Finding.mostSevere(findings)).map(Finding::type).contains(ViolationType.BLOCKED_WORDS);
        assertThat(Finding.mostSevere(findings.subList(0, 3))).map(Finding::type).contains(ViolationType.MENTION_SPAM);
    }

    @Test
    void whitelistedRoleSkipsEveryCheckIncludingSpamTracking() {
        for (int i = 0; i < 10; i++) {
            InboundMessage message = new InboundMessage(GUILD, 10L, nextMessageId++, USER, false, Set.of(MODERATOR_ROLE),
                    "SHOUTING LOUDLY HERE", ids(20), START.plusMillis(i));
            assertThat(detector.inspect(message, config, Set.of(MODERATOR_ROLE))).isEmpty();
        }
        assertThat(spamTracker.trackedMembers()).isZero();
    }

    @Test
    void idleWindowsAreEvicted() {
        detector.inspect(message("hi", START), config, Set.of());
        assertThat(spamTracker.trackedMembers()).isEqualTo(1);

        assertThat(spamTracker.evictIdle(START.plus(Duration.ofMinutes(30)), Duration.ofHours(1))).isZero();
        assertThat(spamTracker.evictIdle(START.plus(Duration.ofHours(2)), Duration.ofHours(1))).isEqualTo(1);
        assertThat(spamTracker.trackedMembers()).isZero();
    }

    private InboundMessage message(String content, Instant at) {
        return message(content, at, List.of());
    }

    private InboundMessage message(String content, Instant at, List<Long> mentions) {
        return new InboundMessage(GUILD, 10L, nextMessageId++, USER, false, Set.of(), content, mentions, at);
    }

    private static List<Long> ids(int count) {
        List<Long> ids = new ArrayList<>();
        for (long i = 0; i < count; i++) {
            ids.add(1000L + i);
        }
        return ids;
    }
}
