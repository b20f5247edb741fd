package sh.harold.warden.moderation.appeal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sh.harold.warden.api.moderation.AppealRecord;
import sh.harold.warden.api.moderation.AppealStatus;
import sh.harold.warden.api.moderation.ValidationException;
import sh.harold.warden.moderation.testing.ModerationFixture;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AppealStoreTest {

    private ModerationFixture fixture;
    private AppealStore appeals;

    @BeforeEach
    void setUp() {
        fixture = new ModerationFixture();
        appeals = new AppealStore(fixture.store, fixture.locks, fixture.clock);
    }

    @Test
    void onlyOnePendingAppealPerMember() {
        AppealRecord first = appeals.submit(1L, 42L, " I was framed ");

        assertThat(first.reason()).isEqualTo("I was framed");
        assertThat(first.status()).isEqualTo(AppealStatus.PENDING);
        assertThatThrownBy(() -> appeals.submit(1L, 42L, "again"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("You already have a pending appeal!");
        assertThat(appeals.submit(2L, 42L, "other guild").guildId()).isEqualTo(2L);
    }

    @Test
    void decidedAppealCanBeReplaced() {
        appeals.submit(1L, 42L, "first");
        fixture.clock.advance(Duration.ofHours(1));

        AppealRecord denied = appeals.updateStatus(1L, 42L, AppealStatus.DENIED).orElseThrow();
        assertThat(denied.updatedAt()).isEqualTo(ModerationFixture.START.plus(Duration.ofHours(1)));
        assertThat(denied.submittedAt()).isEqualTo(ModerationFixture.START);

        assertThat(appeals.submit(1L, 42L, "second").status()).isEqualTo(AppealStatus.PENDING);
    }

    @Test
    void listFiltersByGuildAndStatus() {
        appeals.submit(1L, 10L, "a");
        fixture.clock.advance(Duration.ofMinutes(1));
        appeals.submit(1L, 11L, "b");
        appeals.submit(2L, 12L, "c");
        appeals.updateStatus(1L, 10L, AppealStatus.APPROVED);

        assertThat(appeals.list(1L, null)).extracting(AppealRecord::userId).containsExactly(10L, 11L);
        assertThat(appeals.list(1L, AppealStatus.PENDING)).extracting(AppealRecord::userId).containsExactly(11L);
        assertThat(appeals.updateStatus(1L, 99L, AppealStatus.DENIED)).isEmpty();
    }

    @Test
    void reasonIsValidated() {
        assertThatThrownBy(() -> appeals.submit(1L, 42L, "  ")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> appeals.submit(1L, 42L, "x".repeat(AppealStore.MAX_REASON_LENGTH + 1)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void appealsSurviveReload() {
        appeals.submit(1L, 42L, "please");

        AppealStore reloaded = new AppealStore(fixture.store, fixture.locks, fixture.clock);
        reloaded.load();

        assertThat(reloaded.find(1L, 42L)).map(AppealRecord::reason).contains("please");
    }
}
