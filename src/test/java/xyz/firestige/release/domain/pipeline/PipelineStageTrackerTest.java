package xyz.firestige.release.domain.pipeline;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.firestige.release.domain.shared.exception.ApprovalRequiredException;
import xyz.firestige.release.domain.shared.exception.ConflictException;
import xyz.firestige.release.domain.shared.exception.InvalidTransitionException;
import xyz.firestige.release.domain.shared.vo.DeploymentId;
import xyz.firestige.release.infrastructure.repository.memory.InMemoryPipelineStageRepository;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineStageTrackerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 0, 0);

    private final Set<String> blockedStages = new HashSet<>();
    private PipelineStageTracker tracker;
    private DeploymentId deploymentId;

    @BeforeEach
    void setUp() {
        ApprovalGate gate = (id, stageName) -> !blockedStages.contains(stageName);
        tracker = new PipelineStageTracker(new InMemoryPipelineStageRepository(), gate, PipelineTemplate.canonical());
        deploymentId = DeploymentId.generate();
        tracker.materialize(deploymentId);
    }

    private void advance(String stageName, StageStatus status) {
        PipelineStage stage = tracker.findStageByName(deploymentId, stageName).orElseThrow();
        stage.applyStatus(status, null, NOW);
        tracker.updateStage(stage);
    }

    @Test
    void materialize_twice_conflict() {
        assertThatThrownBy(() -> tracker.materialize(deploymentId)).isInstanceOf(ConflictException.class);
        assertThat(tracker.getStages(deploymentId)).hasSize(5);
    }

    @Test
    void nextRunnableStage_followsOrder() {
        assertThat(tracker.nextRunnableStage(deploymentId)).map(PipelineStage::getName).contains(PipelineTemplate.BUILD);

        advance(PipelineTemplate.BUILD, StageStatus.RUNNING);
        assertThat(tracker.nextRunnableStage(deploymentId)).isEmpty();

        advance(PipelineTemplate.BUILD, StageStatus.COMPLETED);
        assertThat(tracker.nextRunnableStage(deploymentId)).map(PipelineStage::getName).contains(PipelineTemplate.TEST);
    }

    @Test
    void nextRunnableStage_blockedByGate() {
        blockedStages.add(PipelineTemplate.TEST);
        advance(PipelineTemplate.BUILD, StageStatus.RUNNING);
        advance(PipelineTemplate.BUILD, StageStatus.COMPLETED);

        assertThat(tracker.nextRunnableStage(deploymentId)).isEmpty();
        PipelineStage test = tracker.findStageByName(deploymentId, PipelineTemplate.TEST).orElseThrow();
        assertThatThrownBy(() -> tracker.checkCanStart(test)).isInstanceOf(ApprovalRequiredException.class);
    }

    @Test
    void checkCanStart_predecessorNotCompleted() {
        PipelineStage deploy = tracker.findStageByName(deploymentId, PipelineTemplate.DEPLOY).orElseThrow();

        assertThatThrownBy(() -> tracker.checkCanStart(deploy))
                .isInstanceOf(InvalidTransitionException.class)
                .satisfies(e -> assertThat(((InvalidTransitionException) e).getContext())
                        .containsEntry("blockingStage", PipelineTemplate.BUILD));
    }

    @Test
    void allCompleted_onlyWhenEveryStageCompleted() {
        List<PipelineStage> stages = tracker.getStages(deploymentId);
        for (int i = 0; i < stages.size(); i++) {
            assertThat(tracker.allCompleted(deploymentId)).isFalse();
            advance(stages.get(i).getName(), StageStatus.RUNNING);
            advance(stages.get(i).getName(), StageStatus.COMPLETED);
        }
        assertThat(tracker.allCompleted(deploymentId)).isTrue();
        assertThat(tracker.allCompleted(DeploymentId.generate())).isFalse();
    }

    @Test
    void applyStatus_sameStatusIsNoOp() {
        PipelineStage build = tracker.findStageByName(deploymentId, PipelineTemplate.BUILD).orElseThrow();

        assertThat(build.applyStatus(StageStatus.RUNNING, null, NOW)).isTrue();
        assertThat(build.applyStatus(StageStatus.RUNNING, null, NOW.plusMinutes(5))).isFalse();
        assertThat(build.getStartedAt()).isEqualTo(NOW);
    }

    @Test
    void removeStages_clearsDeployment() {
        tracker.removeStages(deploymentId);

        assertThat(tracker.getStages(deploymentId)).isEmpty();
    }

    @Test
    void template_rejectsDuplicateNames() {
        assertThatThrownBy(() -> new PipelineTemplate(List.of(
                new StageDefinition("build", 0, 60, false),
                new StageDefinition("build", 1, 60, false))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(PipelineTemplate.canonical().gatedStages())
                .extracting(StageDefinition::getName)
                .containsExactly(PipelineTemplate.DEPLOY);
    }
}
