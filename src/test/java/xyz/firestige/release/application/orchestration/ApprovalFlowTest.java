package xyz.firestige.release.application.orchestration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.firestige.release.domain.approval.Approval;
import xyz.firestige.release.domain.approval.ApprovalDecision;
import xyz.firestige.release.domain.approval.event.ApprovalDecidedEvent;
import xyz.firestige.release.domain.audit.AuditActions;
import xyz.firestige.release.domain.audit.AuditQuery;
import xyz.firestige.release.domain.deployment.DeploymentAggregate;
import xyz.firestige.release.domain.deployment.DeploymentStatus;
import xyz.firestige.release.domain.pipeline.PipelineStage;
import xyz.firestige.release.domain.pipeline.PipelineTemplate;
import xyz.firestige.release.domain.pipeline.StageStatus;
import xyz.firestige.release.domain.release.Release;
import xyz.firestige.release.domain.rollback.Rollback;
import xyz.firestige.release.domain.rollback.RollbackStatus;
import xyz.firestige.release.domain.shared.exception.ApprovalRequiredException;
import xyz.firestige.release.domain.shared.exception.ConflictException;
import xyz.firestige.release.domain.shared.exception.ErrorType;
import xyz.firestige.release.domain.shared.exception.InvalidTransitionException;
import xyz.firestige.release.domain.shared.exception.NotFoundException;
import xyz.firestige.release.domain.shared.vo.DeploymentId;
import xyz.firestige.release.util.OrchestrationFixture;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static xyz.firestige.release.util.OrchestrationFixture.PROD;
import static xyz.firestige.release.util.OrchestrationFixture.STAGING;

/**
 * 审批门禁
 */
class ApprovalFlowTest {

    private OrchestrationFixture f;
    private Release release;

    @BeforeEach
    void setUp() {
        f = new OrchestrationFixture();
        release = f.release("2.0.0");
    }

    private DeploymentId promoteToProdAndReachDeploy() {
        DeploymentAggregate deployment = f.promote(release, PROD);
        f.complete(deployment.getId(), PipelineTemplate.BUILD, PipelineTemplate.TEST, PipelineTemplate.SECURITY_SCAN);
        return deployment.getId();
    }

    @Test
    void promotionToApprovalEnvironment_createsPendingApprovalForGatedStage() {
        DeploymentAggregate deployment = f.promote(release, PROD);

        List<Approval> approvals = f.queries.listApprovals(deployment.getId());
        assertThat(approvals).hasSize(1);
        assertThat(approvals.get(0).getStageName()).isEqualTo(PipelineTemplate.DEPLOY);
        assertThat(approvals.get(0).isPending()).isTrue();
        assertThat(f.auditLog.findAll(AuditQuery.all().action(AuditActions.APPROVAL_REQUEST))).hasSize(1);
    }

    @Test
    void gatedStage_withPendingApproval_approvalRequired() {
        DeploymentId id = promoteToProdAndReachDeploy();

        assertThat(f.queries.nextRunnableStage(id)).isEmpty();
        ApprovalRequiredException e = assertThrows(ApprovalRequiredException.class,
                () -> f.report(id, PipelineTemplate.DEPLOY, StageStatus.RUNNING));
        assertThat(e.getStageName()).isEqualTo(PipelineTemplate.DEPLOY);
        assertThat(e.isRetryable()).isTrue();
        assertThat(f.stage(id, PipelineTemplate.DEPLOY).getStatus()).isEqualTo(StageStatus.PENDING);
    }

    @Test
    void approval_clearsGate() {
        DeploymentId id = promoteToProdAndReachDeploy();

        Approval approval = f.orchestrator.recordApprovalDecision(id, "carol", ApprovalDecision.APPROVED, "lgtm");

        assertThat(approval.isApproved()).isTrue();
        assertThat(approval.getApprover()).isEqualTo("carol");
        assertThat(approval.getDecidedAt()).isNotNull();
        ApprovalDecidedEvent event = f.events.getEventsOfType(ApprovalDecidedEvent.class).get(0);
        assertThat(event.isGateCleared()).isTrue();
        assertThat(f.queries.nextRunnableStage(id)).map(PipelineStage::getName).contains(PipelineTemplate.DEPLOY);

        f.complete(id, PipelineTemplate.DEPLOY, PipelineTemplate.SMOKE_TEST);
        assertThat(f.deployment(id).getStatus()).isEqualTo(DeploymentStatus.SUCCEEDED);
        assertThat(f.auditLog.findAll(AuditQuery.all().action(AuditActions.APPROVAL_DECIDE).userId("carol")))
                .hasSize(1);
    }

    @Test
    void rejection_failsDeploymentAndAllowsRollback() {
        DeploymentId stable = promoteToProdAndReachDeploy();
        f.orchestrator.recordApprovalDecision(stable, "carol", ApprovalDecision.APPROVED, null);
        f.complete(stable, PipelineTemplate.DEPLOY, PipelineTemplate.SMOKE_TEST);
        Release next = f.release("2.1.0");
        DeploymentAggregate deployment = f.promote(next, PROD);

        f.orchestrator.recordApprovalDecision(deployment.getId(), "carol", ApprovalDecision.REJECTED, "change freeze");

        DeploymentAggregate reloaded = f.deployment(deployment.getId());
        assertThat(reloaded.getStatus()).isEqualTo(DeploymentStatus.FAILED);
        assertThat(reloaded.getFailureInfo().getErrorType()).isEqualTo(ErrorType.APPROVAL_REJECTED);
        assertThat(reloaded.getFailureInfo().getFailedAt()).isEqualTo(PipelineTemplate.DEPLOY);
        assertThat(f.tracker.getStages(deployment.getId())).allMatch(s -> s.getStatus() == StageStatus.PENDING);

        Rollback rollback = f.orchestrator.executeRollback(deployment.getId(), "oncall", "rejected");
        assertThat(rollback.getStatus()).isEqualTo(RollbackStatus.SUCCEEDED);
    }

    @Test
    void decidingTwice_conflict() {
        DeploymentId id = promoteToProdAndReachDeploy();
        f.orchestrator.recordApprovalDecision(id, "carol", ApprovalDecision.APPROVED, null);

        assertThatThrownBy(() -> f.orchestrator.recordApprovalDecision(id, "dave", ApprovalDecision.REJECTED, null))
                .isInstanceOf(ConflictException.class);
        assertThat(f.deployment(id).getStatus()).isEqualTo(DeploymentStatus.IN_PROGRESS);
    }

    @Test
    void deploymentWithoutApprovals_notFound() {
        DeploymentAggregate deployment = f.promote(release, STAGING);

        assertThatThrownBy(() -> f.orchestrator.recordApprovalDecision(deployment.getId(), "carol",
                ApprovalDecision.APPROVED, null))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void pendingDecision_rejectedAsArgument() {
        DeploymentId id = promoteToProdAndReachDeploy();

        assertThatThrownBy(() -> f.orchestrator.recordApprovalDecision(id, "carol", ApprovalDecision.PENDING, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void decisionOnFailedDeployment_invalidTransition() {
        DeploymentAggregate deployment = f.promote(release, PROD);
        f.report(deployment.getId(), PipelineTemplate.BUILD, StageStatus.RUNNING);
        f.report(deployment.getId(), PipelineTemplate.BUILD, StageStatus.FAILED);

        assertThatThrownBy(() -> f.orchestrator.recordApprovalDecision(deployment.getId(), "carol",
                ApprovalDecision.APPROVED, null))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void requestApproval_gatesAnyPendingStage() {
        DeploymentAggregate deployment = f.promote(release, STAGING);
        DeploymentId id = deployment.getId();

        Approval approval = f.orchestrator.requestApproval(id, "alice", PipelineTemplate.SMOKE_TEST);

        assertThat(approval.isPending()).isTrue();
        assertThatThrownBy(() -> f.orchestrator.requestApproval(id, "alice", PipelineTemplate.SMOKE_TEST))
                .isInstanceOf(ConflictException.class);

        f.complete(id, PipelineTemplate.BUILD, PipelineTemplate.TEST, PipelineTemplate.SECURITY_SCAN,
                PipelineTemplate.DEPLOY);
        assertThatThrownBy(() -> f.report(id, PipelineTemplate.SMOKE_TEST, StageStatus.RUNNING))
                .isInstanceOf(ApprovalRequiredException.class);
        assertThatThrownBy(() -> f.orchestrator.requestApproval(id, "alice", PipelineTemplate.BUILD))
                .isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> f.orchestrator.requestApproval(id, "alice", "unknown"))
                .isInstanceOf(NotFoundException.class);
    }
}
