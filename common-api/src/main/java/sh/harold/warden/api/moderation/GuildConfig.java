package sh.harold.warden.api.moderation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Detection thresholds for one guild. Structural validation (non-negative limits,
 * ratio within [0, 1]) is enforced by the config store, not here, so malformed
 * persisted records can still be read and repaired.
 */
public record GuildConfig(
        @JsonProperty("guild_id") long guildId,
        @JsonProperty("max_mentions") int maxMentions,
        @JsonProperty("max_messages") int maxMessages,
        @JsonProperty("timeframe") int timeframeSeconds,
        @JsonProperty("max_lines") int maxLines,
        @JsonProperty("max_emojis") int maxEmojis,
        @JsonProperty("caps_threshold") double capsThreshold,
        @JsonProperty("blocked_words") Set<String> blockedWords,
        @JsonProperty("link_whitelist") Set<String> linkWhitelist) {

    public static final int DEFAULT_MAX_MENTIONS = 5;
    public static final int DEFAULT_MAX_MESSAGES = 5;
    public static final int DEFAULT_TIMEFRAME_SECONDS = 5;
    public static final int DEFAULT_MAX_LINES = 10;
    public static final int DEFAULT_MAX_EMOJIS = 10;
    public static final double DEFAULT_CAPS_THRESHOLD = 0.7;

    public GuildConfig {
        blockedWords = normalizeWords(blockedWords);
        linkWhitelist = normalizeWords(linkWhitelist);
    }

    public static GuildConfig defaults(long guildId) {
        return new GuildConfig(
                guildId,
                DEFAULT_MAX_MENTIONS,
                DEFAULT_MAX_MESSAGES,
                DEFAULT_TIMEFRAME_SECONDS,
                DEFAULT_MAX_LINES,
                DEFAULT_MAX_EMOJIS,
                DEFAULT_CAPS_THRESHOLD,
                Set.of(),
                Set.of());
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    private static Set<String> normalizeWords(Collection<String> words) {
        if (words == null || words.isEmpty()) {
            return Set.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String word : words) {
            if (word != null && !word.isBlank()) {
                normalized.add(word.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableSet(normalized);
    }

    public static final class Builder {
        private final long guildId;
        private int maxMentions;
        private int maxMessages;
        private int timeframeSeconds;
        private int maxLines;
        private int maxEmojis;
        private double capsThreshold;
        private final Set<String> blockedWords;
        private final Set<String> linkWhitelist;

        private Builder(GuildConfig source) {
            this.guildId = source.guildId;
            this.maxMentions = source.maxMentions;
            this.maxMessages = source.maxMessages;
            this.timeframeSeconds = source.timeframeSeconds;
            this.maxLines = source.maxLines;
            this.maxEmojis = source.maxEmojis;
            this.capsThreshold = source.capsThreshold;
            this.blockedWords = new LinkedHashSet<>(source.blockedWords);
            this.linkWhitelist = new LinkedHashSet<>(source.linkWhitelist);
        }

        public Builder maxMentions(int value) {
            this.maxMentions = value;
            return this;
        }

        public Builder maxMessages(int value) {
            this.maxMessages = value;
            return this;
        }

        public Builder timeframeSeconds(int value) {
            this.timeframeSeconds = value;
            return this;
        }

        public Builder maxLines(int value) {
            this.maxLines = value;
            return this;
        }

        public Builder maxEmojis(int value) {
            this.maxEmojis = value;
            return this;
        }

        public Builder capsThreshold(double value) {
            this.capsThreshold = value;
            return this;
        }

        public Builder addBlockedWord(String word) {
            blockedWords.add(word.trim().toLowerCase(Locale.ROOT));
            return this;
        }

        public Builder removeBlockedWord(String word) {
            blockedWords.remove(word.trim().toLowerCase(Locale.ROOT));
            return this;
        }

        public Builder addWhitelistedLink(String domain) {
            linkWhitelist.add(domain.trim().toLowerCase(Locale.ROOT));
            return this;
        }

        public Builder removeWhitelistedLink(String domain) {
            linkWhitelist.remove(domain.trim().toLowerCase(Locale.ROOT));
            return this;
        }

        public GuildConfig build() {
            return new GuildConfig(guildId, maxMentions, maxMessages, timeframeSeconds, maxLines, maxEmojis,
                    capsThreshold, blockedWords, linkWhitelist);
        }
    }
}
