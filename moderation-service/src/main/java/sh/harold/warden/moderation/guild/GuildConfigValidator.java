package sh.harold.warden.moderation.guild;

import sh.harold.warden.api.moderation.GuildConfig;

import java.util.ArrayList;
import java.util.List;

final class GuildConfigValidator {
    private static final int MAX_BLOCKED_WORDS = 500;
    private static final int MAX_WORD_LENGTH = 100;

    private GuildConfigValidator() {
    }

    static void validate(GuildConfig config) {
        List<String> errors = new ArrayList<>();

        requireNonNegative(errors, "max_mentions", config.maxMentions());
        requireNonNegative(errors, "max_messages", config.maxMessages());
        requireNonNegative(errors, "timeframe", config.timeframeSeconds());
        requireNonNegative(errors, "max_lines", config.maxLines());
        requireNonNegative(errors, "max_emojis", config.maxEmojis());

        double ratio = config.capsThreshold();
        if (Double.isNaN(ratio) || ratio < 0.0 || ratio > 1.0) {
            errors.add("caps_threshold must be between 0 and 1");
        }

        if (config.blockedWords().size() > MAX_BLOCKED_WORDS) {
            errors.add("blocked_words may contain at most " + MAX_BLOCKED_WORDS + " entries");
        }
        for (String word : config.blockedWords()) {
            if (word.length() > MAX_WORD_LENGTH) {
                errors.add("blocked word '" + word.substring(0, 16) + "...' exceeds " + MAX_WORD_LENGTH + " characters");
            }
        }
        for (String domain : config.linkWhitelist()) {
            if (domain.contains(" ") || domain.contains("/")) {
                errors.add("link_whitelist entry '" + domain + "' is not a bare domain");
            }
        }

        if (!errors.isEmpty()) {
            throw new GuildConfigValidationException(config.guildId(), errors);
        }
    }

    private static void requireNonNegative(List<String> errors, String field, int value) {
        if (value < 0) {
            errors.add(field + " must not be negative");
        }
    }
}
