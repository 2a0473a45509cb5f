package xyz.firestige.release.application.query;

import org.junit.jupiter.api.Test;
import xyz.firestige.release.domain.deployment.DeploymentAggregate;
import xyz.firestige.release.domain.pipeline.PipelineStage;
import xyz.firestige.release.domain.shared.exception.NotFoundException;
import xyz.firestige.release.domain.shared.vo.DeploymentId;
import xyz.firestige.release.util.OrchestrationFixture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static xyz.firestige.release.util.OrchestrationFixture.STAGING;

class DeploymentQueryServiceTest {

    private final OrchestrationFixture f = new OrchestrationFixture();

    @Test
    void getDeploymentWithStages_returnsOrderedStages() {
        DeploymentAggregate deployment = f.promote(f.release("1.0.0"), STAGING);
        f.metricsRecorder.recordMetric(deployment.getId(), "lead_time", 12, "minutes");

        DeploymentDetail detail = f.queries.getDeploymentWithStages(deployment.getId());

        assertThat(detail.getDeployment().getId()).isEqualTo(deployment.getId());
        assertThat(detail.getStages()).extracting(PipelineStage::getOrder).containsExactly(0, 1, 2, 3, 4);
        assertThat(detail.getMetrics()).isEmpty();
        assertThat(f.queries.getDeploymentWithMetrics(deployment.getId()).getMetrics()).hasSize(1);
    }

    @Test
    void unknownIds_notFound() {
        DeploymentId missing = DeploymentId.of("dep-missing");

        assertThatThrownBy(() -> f.queries.getDeploymentWithStages(missing)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> f.queries.getDeploymentWithMetrics(missing)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> f.queries.listApprovals(missing)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> f.queries.listRollbacks(missing)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> f.queries.getRollback("rb-missing")).isInstanceOf(NotFoundException.class);
    }
}
