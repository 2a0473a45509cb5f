package xyz.firestige.release.domain.state;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import xyz.firestige.release.domain.approval.ApprovalDecision;
import xyz.firestige.release.domain.deployment.DeploymentStatus;
import xyz.firestige.release.domain.pipeline.StageStatus;
import xyz.firestige.release.domain.release.ReleaseStatus;
import xyz.firestige.release.domain.rollback.RollbackStatus;
import xyz.firestige.release.domain.shared.exception.ErrorType;
import xyz.firestige.release.domain.shared.exception.InvalidTransitionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class StateMachinesTest {

    @Test
    void deployment_allowedTransitions() {
        assertThat(StateMachines.DEPLOYMENT.allowedTargets(DeploymentStatus.PENDING))
                .containsExactly(DeploymentStatus.IN_PROGRESS);
        assertThat(StateMachines.DEPLOYMENT.allowedTargets(DeploymentStatus.IN_PROGRESS))
                .containsExactlyInAnyOrder(DeploymentStatus.SUCCEEDED, DeploymentStatus.FAILED);
        assertThat(StateMachines.DEPLOYMENT.allowedTargets(DeploymentStatus.FAILED))
                .containsExactly(DeploymentStatus.ROLLED_BACK);
    }

    @Test
    void deployment_terminalStates() {
        assertThat(DeploymentStatus.SUCCEEDED.isTerminal()).isTrue();
        assertThat(DeploymentStatus.ROLLED_BACK.isTerminal()).isTrue();
        assertThat(DeploymentStatus.FAILED.isTerminal()).isFalse();
        assertThat(DeploymentStatus.FAILED.isActive()).isFalse();
        assertThat(DeploymentStatus.PENDING.isActive()).isTrue();
    }

    @ParameterizedTest
    @EnumSource(DeploymentStatus.class)
    void deployment_noTransitionOutOfSucceededOrRolledBack(DeploymentStatus target) {
        assertThat(StateMachines.DEPLOYMENT.isAllowed(DeploymentStatus.SUCCEEDED, target)).isFalse();
        assertThat(StateMachines.DEPLOYMENT.isAllowed(DeploymentStatus.ROLLED_BACK, target)).isFalse();
    }

    @Test
    void stage_forwardOnly() {
        assertDoesNotThrow(() -> StateMachines.STAGE.check("s", StageStatus.PENDING, StageStatus.RUNNING));
        assertDoesNotThrow(() -> StateMachines.STAGE.check("s", StageStatus.RUNNING, StageStatus.COMPLETED));
        assertDoesNotThrow(() -> StateMachines.STAGE.check("s", StageStatus.RUNNING, StageStatus.FAILED));

        assertThatThrownBy(() -> StateMachines.STAGE.check("s", StageStatus.COMPLETED, StageStatus.RUNNING))
                .isInstanceOf(InvalidTransitionException.class)
                .satisfies(e -> {
                    InvalidTransitionException ite = (InvalidTransitionException) e;
                    assertThat(ite.getErrorType()).isEqualTo(ErrorType.INVALID_TRANSITION);
                    assertThat(ite.getContext())
                            .containsEntry("entityId", "s")
                            .containsEntry("actualStatus", "COMPLETED")
                            .containsEntry("requestedStatus", "RUNNING");
                });
        assertThat(StateMachines.STAGE.isAllowed(StageStatus.PENDING, StageStatus.COMPLETED)).isFalse();
    }

    @Test
    void release_rollbackAndApprovalTables() {
        assertThat(StateMachines.RELEASE.isAllowed(ReleaseStatus.DRAFT, ReleaseStatus.PROMOTED)).isTrue();
        assertThat(StateMachines.RELEASE.isAllowed(ReleaseStatus.PROMOTED, ReleaseStatus.ROLLED_BACK)).isTrue();
        assertThat(StateMachines.RELEASE.isAllowed(ReleaseStatus.DRAFT, ReleaseStatus.ROLLED_BACK)).isFalse();

        assertThat(StateMachines.ROLLBACK.isAllowed(RollbackStatus.PENDING, RollbackStatus.SUCCEEDED)).isFalse();
        assertThat(StateMachines.ROLLBACK.allowedTargets(RollbackStatus.IN_PROGRESS))
                .containsExactlyInAnyOrder(RollbackStatus.SUCCEEDED, RollbackStatus.FAILED);

        assertThat(StateMachines.APPROVAL.isTerminal(ApprovalDecision.APPROVED)).isTrue();
        assertThat(StateMachines.APPROVAL.isAllowed(ApprovalDecision.REJECTED, ApprovalDecision.APPROVED)).isFalse();
    }
}
