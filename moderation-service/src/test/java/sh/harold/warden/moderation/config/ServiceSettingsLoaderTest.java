package sh.harold.warden.moderation.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sh.harold.warden.api.moderation.EscalationTable;
import sh.harold.warden.api.moderation.PunishmentSpec;
import sh.harold.warden.api.moderation.SanctionAction;
import sh.harold.warden.api.moderation.ValidationException;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceSettingsLoaderTest {

    private final ServiceSettingsLoader loader = new ServiceSettingsLoader(Map.of(
            "DISCORD_TOKEN", "secret-token",
            "WARDEN_STORAGE", "memory")::get);

    @Test
    void bundledConfigurationResolvesEnvironmentAndDefaults() {
        ServiceSettings settings = loader.load((Path) null);

        assertThat(settings.discord().token()).isEqualTo("secret-token");
        assertThat(settings.storage().type()).isEqualTo(StorageType.MEMORY);
        assertThat(settings.storage().jsonDirectory()).isEqualTo(Path.of("data"));
        assertThat(settings.storage().redis()).isNull();
        assertThat(settings.moderation().retention()).isEqualTo(Duration.ofDays(30));
        assertThat(settings.moderation().schedulerInterval()).isEqualTo(Duration.ofSeconds(60));
        assertThat(settings.moderation().auditChannel()).isEqualTo("mod-logs");
        assertThat(settings.moderation().escalation().getTiers())
                .isEqualTo(EscalationTable.defaults().getTiers());
        assertThat(settings.consoleEnabled()).isTrue();
    }

    @Test
    void emptyDocumentFallsBackToDefaults() {
        ServiceSettings settings = load("");

        assertThat(settings.discord().hasToken()).isFalse();
        assertThat(settings.storage().type()).isEqualTo(StorageType.JSON);
        assertThat(settings.moderation().lockTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.moderation().reputationPenaltyPerSeverity()).isEqualTo(10);
    }

    @Test
    void brokenYamlFallsBackToDefaults() {
        ServiceSettings settings = load("storage: [unclosed");

        assertThat(settings.storage().type()).isEqualTo(StorageType.JSON);
    }

    @Test
    void missingFileFallsBackToDefaults(@TempDir Path directory) {
        ServiceSettings settings = loader.load(directory.resolve("absent.yml"));

        assertThat(settings.moderation().retentionSweepInterval()).isEqualTo(Duration.ofMinutes(60));
    }

    @Test
    void readsFileFromDisk(@TempDir Path directory) throws Exception {
        Path file = directory.resolve("application.yml");
        Files.writeString(file, """
                storage:
                  type: redis
                  redis:
                    host: cache.internal
                    port: 6380
                    database: 2
                console:
                  enabled: false
                """);

        ServiceSettings settings = loader.load(file);

        assertThat(settings.storage().type()).isEqualTo(StorageType.REDIS);
        assertThat(settings.storage().redis().host()).isEqualTo("cache.internal");
        assertThat(settings.storage().redis().port()).isEqualTo(6380);
        assertThat(settings.storage().redis().database()).isEqualTo(2);
        assertThat(settings.storage().redis().keyPrefix()).isEqualTo("warden:documents:");
        assertThat(settings.consoleEnabled()).isFalse();
    }

    @Test
    void customEscalationTableIsBound() {
        ServiceSettings settings = load("""
                moderation:
                  escalation:
                    - tier: 1
                      action: timeout
                      duration: 10m
                    - tier: 2
                      action: kick
                    - tier: 3
                      action: ban
                """);

        EscalationTable table = settings.moderation().escalation();
        assertThat(table.maxTier()).isEqualTo(3);
        assertThat(table.punishmentFor(1)).isEqualTo(PunishmentSpec.timeout(Duration.ofMinutes(10)));
        assertThat(table.punishmentFor(2).action()).isEqualTo(SanctionAction.KICK);
        assertThat(table.tierFor(7)).isEqualTo(3);
    }

    @Test
    void invalidValuesAreCollectedTogether() {
        assertThatThrownBy(() -> load("""
                storage:
                  type: postgres
                moderation:
                  retention-days: 0
                  reputation-penalty-per-severity: -2
                  audit-channel: "  "
                  escalation:
                    - tier: 1
                      action: warn
                      duration: 5m
                    - tier: 2
                      action: timeout
                """))
                .isInstanceOfSatisfying(ValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(6)
                        .anyMatch(error -> error.startsWith("storage.type"))
                        .anyMatch(error -> error.startsWith("moderation.retention-days"))
                        .anyMatch(error -> error.contains("reputation-penalty-per-severity"))
                        .anyMatch(error -> error.contains("audit-channel"))
                        .anyMatch(error -> error.contains("only timeout tiers take a duration"))
                        .anyMatch(error -> error.contains("timeout tiers need a positive duration")));
    }

    @Test
    void gappedTiersAreRejected() {
        assertThatThrownBy(() -> load("""
                moderation:
                  escalation:
                    - tier: 1
                      action: warn
                    - tier: 3
                      action: ban
                """))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("without gaps");
    }

    @Test
    void placeholdersUseFallbackWhenVariableIsUnset() {
        ServiceSettingsLoader bare = new ServiceSettingsLoader(name -> null);

        Map<String, Object> resolved = bare.substitute(Map.of(
                "a", "${MISSING:fallback}",
                "b", "${MISSING}",
                "c", Map.of("nested", "${MISSING:inner}")));

        assertThat(resolved)
                .containsEntry("a", "fallback")
                .containsEntry("b", "")
                .containsEntry("c", Map.of("nested", "inner"));
    }

    private ServiceSettings load(String yaml) {
        return loader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }
}
