package xyz.firestige.release.domain.release;

import org.junit.jupiter.api.Test;
import xyz.firestige.release.domain.shared.exception.InvalidTransitionException;
import xyz.firestige.release.domain.shared.vo.EnvironmentId;
import xyz.firestige.release.domain.shared.vo.ReleaseId;
import xyz.firestige.release.domain.shared.vo.ServiceId;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReleaseTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 5, 1, 8, 0);
    private static final EnvironmentId STAGING = EnvironmentId.of("staging");
    private static final EnvironmentId PROD = EnvironmentId.of("prod");

    private Release newRelease() {
        return new Release(ReleaseId.generate(), ServiceId.of("svc"), "1.0.0", "alice", T0);
    }

    @Test
    void promoteToSecondEnvironment_recordsTimeOnly() {
        Release release = newRelease();
        release.promoteTo(STAGING, T0.plusHours(1));
        release.promoteTo(PROD, T0.plusHours(2));

        assertThat(release.getStatus()).isEqualTo(ReleaseStatus.PROMOTED);
        assertThat(release.getPromotedAt(STAGING)).contains(T0.plusHours(1));
        assertThat(release.getPromotedAt(PROD)).contains(T0.plusHours(2));
    }

    @Test
    void repromotionToSameEnvironment_appendsHistory() {
        Release release = newRelease();
        release.promoteTo(STAGING, T0.plusHours(1));
        release.promoteTo(STAGING, T0.plusHours(3));

        assertThat(release.getPromotedAt(STAGING)).contains(T0.plusHours(3));
        assertThat(release.getPromotionHistory(STAGING)).containsExactly(T0.plusHours(1), T0.plusHours(3));
        assertThat(release.getLastPromotedBefore(STAGING, T0.plusHours(2))).contains(T0.plusHours(1));
        assertThat(release.getLastPromotedBefore(STAGING, T0.plusHours(1))).isEmpty();
    }

    @Test
    void draftCannotBeRolledBack() {
        Release release = newRelease();

        assertThatThrownBy(release::markRolledBack).isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void restore_undoesPromotion() {
        Release release = newRelease();
        Release.ReleaseSnapshot snapshot = release.snapshot();
        release.promoteTo(STAGING, T0);

        release.restore(snapshot);

        assertThat(release.getStatus()).isEqualTo(ReleaseStatus.DRAFT);
        assertThat(release.getPromotedAt(STAGING)).isEmpty();
        assertThat(release.getPromotionHistory(STAGING)).isEmpty();
    }

    @Test
    void blankVersion_rejected() {
        assertThatThrownBy(() -> new Release(ReleaseId.generate(), ServiceId.of("svc"), " ", "alice", T0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
