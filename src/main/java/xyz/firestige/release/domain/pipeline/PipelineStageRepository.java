package xyz.firestige.release.domain.pipeline;

import xyz.firestige.release.domain.shared.vo.DeploymentId;
import xyz.firestige.release.domain.shared.vo.StageId;

import java.util.List;
import java.util.Optional;

public interface PipelineStageRepository {

    /**
     * 一次保存一个部署的全部阶段（原子）
     */
    void saveAll(List<PipelineStage> stages);

    void save(PipelineStage stage);

    Optional<PipelineStage> findById(StageId stageId);

    /**
     * 按 order 升序返回
     */
    List<PipelineStage> findByDeploymentId(DeploymentId deploymentId);

    void removeByDeploymentId(DeploymentId deploymentId);
}
