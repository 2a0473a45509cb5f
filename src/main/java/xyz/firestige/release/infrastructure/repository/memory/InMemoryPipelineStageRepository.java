package xyz.firestige.release.infrastructure.repository.memory;

import xyz.firestige.release.domain.pipeline.PipelineStage;
import xyz.firestige.release.domain.pipeline.PipelineStageRepository;
import xyz.firestige.release.domain.shared.vo.DeploymentId;
import xyz.firestige.release.domain.shared.vo.StageId;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryPipelineStageRepository implements PipelineStageRepository {

    private final Map<StageId, PipelineStage> stages = new ConcurrentHashMap<>();

    @Override
    public synchronized void saveAll(List<PipelineStage> batch) {
        for (PipelineStage stage : batch) {
            if (stage == null || stage.getId() == null) {
                throw new IllegalArgumentException("Stage or StageId cannot be null");
            }
        }
        batch.forEach(stage -> stages.put(stage.getId(), stage));
    }

    @Override
    public void save(PipelineStage stage) {
        if (stage == null || stage.getId() == null) {
            throw new IllegalArgumentException("Stage or StageId cannot be null");
        }
        stages.put(stage.getId(), stage);
    }

    @Override
    public Optional<PipelineStage> findById(StageId stageId) {
        return Optional.ofNullable(stages.get(stageId));
    }

    @Override
    public List<PipelineStage> findByDeploymentId(DeploymentId deploymentId) {
        return stages.values().stream()
                .filter(s -> s.getDeploymentId().equals(deploymentId))
                .sorted(Comparator.comparingInt(PipelineStage::getOrder))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void removeByDeploymentId(DeploymentId deploymentId) {
        stages.values().removeIf(s -> s.getDeploymentId().equals(deploymentId));
    }
}
