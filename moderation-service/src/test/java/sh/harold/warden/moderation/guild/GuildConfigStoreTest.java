package sh.harold.warden.moderation.guild;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sh.harold.warden.api.data.impl.memory.InMemoryDocumentStore;
import sh.harold.warden.api.moderation.GuildConfig;
import sh.harold.warden.api.moderation.ValidationException;
import sh.harold.warden.api.util.ObjectMappers;
import sh.harold.warden.moderation.lock.ResourceLockRegistry;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GuildConfigStoreTest {

    private final ObjectMapper mapper = ObjectMappers.create();
    private InMemoryDocumentStore store;
    private ResourceLockRegistry locks;
    private GuildConfigStore configStore;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore(mapper);
        locks = new ResourceLockRegistry(Duration.ofSeconds(5));
        configStore = new GuildConfigStore(store, mapper, locks);
    }

    @Test
    void firstLookupCreatesAndPersistsDefaults() {
        GuildConfig config = configStore.get(7L);

        assertThat(config).isEqualTo(GuildConfig.defaults(7L));
        assertThat(store.exists(GuildConfigStore.DOCUMENT_ID)).isTrue();
        assertThat(reload().find(7L)).contains(config);
    }

    @Test
    void initializeKeepsExistingRecord() {
        configStore.updateSetting(7L, AutoModSetting.MAX_LINES, "20");

        GuildConfig config = configStore.initialize(7L);

        assertThat(config.maxLines()).isEqualTo(20);
    }

    @Test
    void settingUpdatesAreValidatedAndPersisted() {
        GuildConfig updated = configStore.updateSetting(7L, AutoModSetting.fromId("caps-threshold").orElseThrow(), "0.5");

        assertThat(updated.capsThreshold()).isEqualTo(0.5);
        assertThat(reload().find(7L)).map(GuildConfig::capsThreshold).contains(0.5);
    }

    @Test
    void invalidUpdateLeavesRecordUntouched() {
        configStore.get(7L);

        assertThatThrownBy(() -> configStore.updateSetting(7L, AutoModSetting.CAPS_THRESHOLD, "1.5"))
                .isInstanceOfSatisfying(GuildConfigValidationException.class, e -> {
                    assertThat(e.getGuildId()).isEqualTo(7L);
                    assertThat(e.getErrors()).containsExactly("caps_threshold must be between 0 and 1");
                });
        assertThatThrownBy(() -> configStore.updateSetting(7L, AutoModSetting.MAX_MENTIONS, "-1"))
                .isInstanceOf(GuildConfigValidationException.class);
        assertThatThrownBy(() -> configStore.updateSetting(7L, AutoModSetting.MAX_MENTIONS, "many"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("whole number");

        assertThat(configStore.get(7L)).isEqualTo(GuildConfig.defaults(7L));
    }

    @Test
    void blockedWordsAreNormalized() {
        configStore.addBlockedWord(7L, "  Spoiler ");
        configStore.addBlockedWord(7L, "spoiler");

        assertThat(configStore.get(7L).blockedWords()).containsExactly("spoiler");

        configStore.removeBlockedWord(7L, "SPOILER");
        assertThat(configStore.get(7L).blockedWords()).isEmpty();
    }

    @Test
    void linkWhitelistRejectsPaths() {
        configStore.addWhitelistedLink(7L, "Example.com");
        assertThat(configStore.get(7L).linkWhitelist()).containsExactly("example.com");

        assertThatThrownBy(() -> configStore.addWhitelistedLink(7L, "example.com/path"))
                .isInstanceOf(GuildConfigValidationException.class);
        assertThatThrownBy(() -> configStore.addBlockedWord(7L, " "))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void malformedRecordsAreRepairedIndividually() throws Exception {
        store.replace(GuildConfigStore.DOCUMENT_ID, mapper.readTree("""
                {"guilds": {
                  "1": {"guild_id": 1, "max_mentions": 3, "max_messages": 5, "timeframe": 5, "max_lines": 10,
                        "max_emojis": 10, "caps_threshold": 0.7, "blocked_words": ["bad"], "link_whitelist": []},
                  "2": {"guild_id": 2, "max_mentions": 3},
                  "3": {"guild_id": 3, "max_mentions": -4, "max_messages": 5, "timeframe": 5, "max_lines": 10,
                        "max_emojis": 10, "caps_threshold": 0.7, "blocked_words": [], "link_whitelist": []},
                  "4": {"guild_id": 99, "max_mentions": 3, "max_messages": 5, "timeframe": 5, "max_lines": 10,
                        "max_emojis": 10, "caps_threshold": 0.7, "blocked_words": [], "link_whitelist": []},
                  "abc": {}
                }}
                """));

        configStore.load();

        assertThat(configStore.size()).isEqualTo(4);
        assertThat(configStore.find(1L)).map(GuildConfig::maxMentions).contains(3);
        assertThat(configStore.find(1L)).map(GuildConfig::blockedWords).hasValueSatisfying(words -> assertThat(words).containsExactly("bad"));
        assertThat(configStore.find(2L)).contains(GuildConfig.defaults(2L));
        assertThat(configStore.find(3L)).contains(GuildConfig.defaults(3L));
        assertThat(configStore.find(4L)).contains(GuildConfig.defaults(4L));
        assertThat(reload().find(2L)).contains(GuildConfig.defaults(2L));
    }

    @Test
    void unknownSettingIdIsEmpty() {
        assertThat(AutoModSetting.fromId("max_links")).isEmpty();
        assertThat(AutoModSetting.fromId("TIMEFRAME")).contains(AutoModSetting.TIMEFRAME);
    }

    private GuildConfigStore reload() {
        GuildConfigStore reloaded = new GuildConfigStore(store, mapper, locks);
        reloaded.load();
        return reloaded;
    }
}
