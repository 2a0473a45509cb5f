package xyz.firestige.release.domain.deployment;

import org.junit.jupiter.api.Test;
import xyz.firestige.release.domain.deployment.event.DeploymentCreatedEvent;
import xyz.firestige.release.domain.deployment.event.DeploymentEvent;
import xyz.firestige.release.domain.deployment.event.DeploymentFailedEvent;
import xyz.firestige.release.domain.shared.exception.ErrorType;
import xyz.firestige.release.domain.shared.exception.FailureInfo;
import xyz.firestige.release.domain.shared.exception.InvalidTransitionException;
import xyz.firestige.release.domain.shared.vo.DeploymentId;
import xyz.firestige.release.domain.shared.vo.EnvironmentId;
import xyz.firestige.release.domain.shared.vo.ReleaseId;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeploymentAggregateTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 3, 1, 10, 0);

    private DeploymentAggregate newDeployment() {
        return new DeploymentAggregate(DeploymentId.generate(), ReleaseId.generate(), EnvironmentId.of("staging"),
                "alice", T0);
    }

    @Test
    void lifecycle_collectsEvents() {
        DeploymentAggregate deployment = newDeployment();
        deployment.start(T0.plusMinutes(1));
        deployment.fail(FailureInfo.of(ErrorType.STAGE_FAILED, "boom", "test", T0.plusMinutes(2)), T0.plusMinutes(2));

        List<DeploymentEvent> events = deployment.pullDomainEvents();
        assertThat(events).hasSize(3);
        assertThat(events.get(0)).isInstanceOf(DeploymentCreatedEvent.class);
        assertThat(events.get(2)).isInstanceOf(DeploymentFailedEvent.class);
        assertThat(deployment.getDomainEvents()).isEmpty();
        assertThat(deployment.getCompletedAt()).isEqualTo(T0.plusMinutes(2));
    }

    @Test
    void pendingCannotSucceedOrRollBack() {
        DeploymentAggregate deployment = newDeployment();

        assertThatThrownBy(() -> deployment.succeed(T0)).isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> deployment.markRolledBack("rb-1", T0)).isInstanceOf(InvalidTransitionException.class);
        assertThat(deployment.getStatus()).isEqualTo(DeploymentStatus.PENDING);
    }

    @Test
    void restore_revertsStatusAndDropsLaterEvents() {
        DeploymentAggregate deployment = newDeployment();
        deployment.start(T0);
        deployment.fail(FailureInfo.of(ErrorType.STAGE_FAILED, "boom", "test", T0), T0);
        deployment.clearDomainEvents();

        DeploymentAggregate.DeploymentSnapshot snapshot = deployment.snapshot();
        deployment.markRolledBack("rb-1", T0.plusHours(1));
        deployment.restore(snapshot);

        assertThat(deployment.getStatus()).isEqualTo(DeploymentStatus.FAILED);
        assertThat(deployment.getRollbackId()).isNull();
        assertThat(deployment.getCompletedAt()).isEqualTo(T0);
        assertThat(deployment.getDomainEvents()).isEmpty();
    }
}
