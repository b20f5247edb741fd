package sh.harold.warden.moderation.detection;

import sh.harold.warden.api.moderation.GuildConfig;
import sh.harold.warden.api.moderation.ViolationType;
import sh.harold.warden.api.platform.InboundMessage;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs the automatic checks against one message. Findings come back in check order:
 * spam, mentions, lines, emojis, caps, blocked words.
 */
public final class RuleDetector {

    static final int CAPS_MIN_LENGTH = 10;
    private static final Pattern EMOJI_PATTERN = Pattern.compile("<a?:\\w+:\\d+>|[\\x{1F300}-\\x{1F9FF}]");

    private final SpamTracker spamTracker;

    public RuleDetector(SpamTracker spamTracker) {
        this.spamTracker = Objects.requireNonNull(spamTracker, "spamTracker");
    }

    public List<Finding> inspect(InboundMessage message, GuildConfig config, Set<Long> whitelistedRoles) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(config, "config");
        if (hasWhitelistedRole(message.authorRoleIds(), whitelistedRoles)) {
            return List.of();
        }

        List<Finding> findings = new ArrayList<>();
        String content = message.content();

        int recentMessages = spamTracker.record(message.guildId(), message.authorId(), message.createdAt(),
                Duration.ofSeconds(config.timeframeSeconds()));
        if (recentMessages > config.maxMessages()) {
            findings.add(Finding.of(ViolationType.SPAM,
                    recentMessages + " messages in " + config.timeframeSeconds() + "s"));
        }

        int mentions = message.mentionedUserIds().size();
        if (mentions > config.maxMentions()) {
            findings.add(Finding.of(ViolationType.MENTION_SPAM, mentions + " mentions"));
        }

        long lines = content.lines().count();
        if (lines > config.maxLines()) {
            findings.add(Finding.of(ViolationType.LINE_SPAM, lines + " lines"));
        }

        int emojis = countEmojis(content);
        if (emojis > config.maxEmojis()) {
            findings.add(Finding.of(ViolationType.EMOJI_SPAM, emojis + " emojis"));
        }

        int length = content.codePointCount(0, content.length());
        if (length > CAPS_MIN_LENGTH) {
            double ratio = (double) countUppercase(content) / length;
            if (ratio > config.capsThreshold()) {
                findings.add(Finding.of(ViolationType.EXCESSIVE_CAPS,
                        String.format(Locale.ROOT, "%.0f%% uppercase", ratio * 100)));
            }
        }

        String matchedWord = firstBlockedWord(content, config.blockedWords());
        if (matchedWord != null) {
            findings.add(Finding.of(ViolationType.BLOCKED_WORDS, "matched blocked word"));
        }

        return Collections.unmodifiableList(findings);
    }

    static boolean hasWhitelistedRole(Set<Long> memberRoles, Set<Long> whitelistedRoles) {
        if (whitelistedRoles == null || whitelistedRoles.isEmpty()) {
            return false;
        }
        for (Long role : memberRoles) {
            if (whitelistedRoles.contains(role)) {
                return true;
            }
        }
        return false;
    }

    static int countEmojis(String content) {
        Matcher matcher = EMOJI_PATTERN.matcher(content);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    static int countUppercase(String content) {
        return (int) content.codePoints().filter(Character::isUpperCase).count();
    }

    static String firstBlockedWord(String content, Set<String> blockedWords) {
        if (blockedWords.isEmpty()) {
            return null;
        }
        String lowered = content.toLowerCase(Locale.ROOT);
        for (String word : blockedWords) {
            if (lowered.contains(word)) {
                return word;
            }
        }
        return null;
    }
}
