package xyz.firestige.release.application.orchestration;

import org.junit.jupiter.api.Test;
import xyz.firestige.release.domain.approval.Approval;
import xyz.firestige.release.domain.audit.AuditActions;
import xyz.firestige.release.domain.audit.AuditQuery;
import xyz.firestige.release.domain.deployment.DeploymentAggregate;
import xyz.firestige.release.domain.deployment.event.DeploymentCreatedEvent;
import xyz.firestige.release.domain.pipeline.PipelineStage;
import xyz.firestige.release.domain.release.Release;
import xyz.firestige.release.domain.release.ReleaseStatus;
import xyz.firestige.release.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.release.infrastructure.repository.memory.InMemoryApprovalRepository;
import xyz.firestige.release.infrastructure.repository.memory.InMemoryDeploymentRepository;
import xyz.firestige.release.infrastructure.repository.memory.InMemoryPipelineStageRepository;
import xyz.firestige.release.util.OrchestrationFixture;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static xyz.firestige.release.util.OrchestrationFixture.PROD;
import static xyz.firestige.release.util.OrchestrationFixture.STAGING;

/**
 * 晋级中途失败时的同步补偿
 */
class PromotionCompensationTest {

    @Test
    void stageMaterializationFailure_removesDeployment() {
        OrchestrationFixture f = OrchestrationFixture.builder()
                .stageRepository(new InMemoryPipelineStageRepository() {
                    @Override
                    public void saveAll(List<PipelineStage> stages) {
                        throw new IllegalStateException("stage store unavailable");
                    }
                })
                .build();
        Release release = f.release("1.0.0");

        assertThatThrownBy(() -> f.promote(release, STAGING))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("stage store unavailable");

        assertThat(f.deploymentRepository.findByReleaseAndEnvironment(release.getId(), STAGING)).isEmpty();
        assertThat(f.reload(release).getStatus()).isEqualTo(ReleaseStatus.DRAFT);
        assertThat(f.auditLog.findAll(AuditQuery.all().action(AuditActions.DEPLOYMENT_CREATE))).isEmpty();
        assertThat(f.events.hasEvent(DeploymentCreatedEvent.class)).isFalse();
        assertThat(f.metrics.count(MetricsRegistry.PROMOTIONS_COMPENSATED)).isEqualTo(1);
    }

    @Test
    void failureAfterReleasePromotion_restoresReleaseAndCleansUp() {
        AtomicBoolean failStart = new AtomicBoolean(true);
        OrchestrationFixture f = OrchestrationFixture.builder()
                .deploymentRepository(new InMemoryDeploymentRepository() {
                    @Override
                    public void save(DeploymentAggregate deployment) {
                        if (failStart.get() && deployment.getStartedAt() != null) {
                            throw new IllegalStateException("deployment store unavailable");
                        }
                        super.save(deployment);
                    }
                })
                .build();
        Release release = f.release("1.0.0");

        assertThatThrownBy(() -> f.promote(release, PROD))
                .isInstanceOf(IllegalStateException.class);

        assertThat(f.deploymentRepository.findByEnvironment(PROD)).isEmpty();
        assertThat(f.reload(release).getStatus()).isEqualTo(ReleaseStatus.DRAFT);
        assertThat(f.reload(release).getPromotedAt(PROD)).isEmpty();

        failStart.set(false);
        DeploymentAggregate retried = f.promote(release, PROD);
        assertThat(f.tracker.getStages(retried.getId())).hasSize(5);
        assertThat(f.queries.listApprovals(retried.getId())).extracting(Approval::isPending).containsExactly(true);
    }

    @Test
    void approvalStoreFailure_removesStagesAndDeployment() {
        OrchestrationFixture f = OrchestrationFixture.builder()
                .approvalRepository(new InMemoryApprovalRepository() {
                    @Override
                    public void save(Approval approval) {
                        throw new IllegalStateException("approval store unavailable");
                    }
                })
                .build();
        Release release = f.release("1.0.0");

        assertThatThrownBy(() -> f.promote(release, PROD))
                .isInstanceOf(IllegalStateException.class);

        assertThat(f.deploymentRepository.findByEnvironment(PROD)).isEmpty();
        assertThat(f.reload(release).getStatus()).isEqualTo(ReleaseStatus.DRAFT);
        assertThat(f.auditLog.findAll(AuditQuery.all().action(AuditActions.RELEASE_PROMOTE))).isEmpty();
    }
}
