package xyz.firestige.release.domain.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.release.domain.shared.exception.ApprovalRequiredException;
import xyz.firestige.release.domain.shared.exception.ConflictException;
import xyz.firestige.release.domain.shared.exception.InvalidTransitionException;
import xyz.firestige.release.domain.shared.vo.DeploymentId;
import xyz.firestige.release.domain.shared.vo.StageId;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 流水线阶段跟踪器
 * <p>
 * 职责：
 * 1. 按模板为部署物化有序的阶段列表
 * 2. 回答"第 N 个阶段能否启动"：所有更小 order 的阶段已 COMPLETED，且审批门禁已放行
 * 3. 提供 nextRunnableStage / allCompleted 查询
 * <p>
 * 不了解回滚，对审批只通过 {@link ApprovalGate} 做布尔判断。
 */
public class PipelineStageTracker {

    private static final Logger log = LoggerFactory.getLogger(PipelineStageTracker.class);

    private final PipelineStageRepository stageRepository;
    private final ApprovalGate approvalGate;
    private final PipelineTemplate template;

    public PipelineStageTracker(PipelineStageRepository stageRepository,
                                ApprovalGate approvalGate,
                                PipelineTemplate template) {
        this.stageRepository = Objects.requireNonNull(stageRepository, "stageRepository");
        this.approvalGate = Objects.requireNonNull(approvalGate, "approvalGate");
        this.template = Objects.requireNonNull(template, "template");
    }

    /**
     * 物化阶段列表，全部为 PENDING
     *
     * @throws ConflictException 部署已经有阶段
     */
    public List<PipelineStage> materialize(DeploymentId deploymentId) {
        if (!stageRepository.findByDeploymentId(deploymentId).isEmpty()) {
            ConflictException e = new ConflictException("部署已存在流水线阶段: " + deploymentId);
            e.addContext("deploymentId", deploymentId.getValue());
            throw e;
        }
        List<PipelineStage> stages = new ArrayList<>();
        for (StageDefinition definition : template.getStages()) {
            stages.add(new PipelineStage(StageId.generate(), deploymentId, definition));
        }
        stageRepository.saveAll(stages);
        log.debug("[PipelineStageTracker] 物化阶段: deploymentId={}, stages={}", deploymentId, template.getStages());
        return stages;
    }

    public List<PipelineStage> getStages(DeploymentId deploymentId) {
        return stageRepository.findByDeploymentId(deploymentId);
    }

    public Optional<PipelineStage> findStage(StageId stageId) {
        return stageRepository.findById(stageId);
    }

    public Optional<PipelineStage> findStageByName(DeploymentId deploymentId, String stageName) {
        return getStages(deploymentId).stream()
                .filter(s -> s.getName().equals(stageName))
                .findFirst();
    }

    /**
     * 保存一次阶段迁移
     */
    public void updateStage(PipelineStage stage) {
        stageRepository.save(stage);
    }

    /**
     * 外部执行器轮询下一个可执行阶段
     */
    public Optional<PipelineStage> nextRunnableStage(DeploymentId deploymentId) {
        List<PipelineStage> stages = getStages(deploymentId);
        for (PipelineStage stage : stages) {
            if (stage.getStatus() != StageStatus.PENDING) {
                continue;
            }
            if (predecessorsCompleted(stages, stage)
                    && approvalGate.isCleared(deploymentId, stage.getName())) {
                return Optional.of(stage);
            }
            return Optional.empty();
        }
        return Optional.empty();
    }

    public boolean allCompleted(DeploymentId deploymentId) {
        List<PipelineStage> stages = getStages(deploymentId);
        return !stages.isEmpty() && stages.stream().allMatch(s -> s.getStatus() == StageStatus.COMPLETED);
    }

    /**
     * 校验阶段是否可以进入 RUNNING
     *
     * @throws InvalidTransitionException 存在更早 order 的阶段未完成
     * @throws ApprovalRequiredException  审批门禁未放行
     */
    public void checkCanStart(PipelineStage stage) {
        List<PipelineStage> stages = getStages(stage.getDeploymentId());
        for (PipelineStage other : stages) {
            if (other.getOrder() < stage.getOrder() && other.getStatus() != StageStatus.COMPLETED) {
                InvalidTransitionException e = new InvalidTransitionException(
                        "PipelineStage", stage.getId().getValue(), stage.getStatus(), StageStatus.RUNNING,
                        String.format("阶段 %s 不能启动：前序阶段 %s 当前为 %s",
                                stage.getName(), other.getName(), other.getStatus()));
                e.addContext("deploymentId", stage.getDeploymentId().getValue());
                e.addContext("stageName", stage.getName());
                e.addContext("blockingStage", other.getName());
                throw e;
            }
        }
        if (!approvalGate.isCleared(stage.getDeploymentId(), stage.getName())) {
            throw new ApprovalRequiredException(stage.getDeploymentId().getValue(), stage.getName());
        }
    }

    /**
     * 删除部署的全部阶段（仅用于补偿与清理）
     */
    public void removeStages(DeploymentId deploymentId) {
        stageRepository.removeByDeploymentId(deploymentId);
        log.debug("[PipelineStageTracker] 删除阶段: deploymentId={}", deploymentId);
    }

    public PipelineTemplate getTemplate() {
        return template;
    }

    private boolean predecessorsCompleted(List<PipelineStage> stages, PipelineStage stage) {
        for (PipelineStage other : stages) {
            if (other.getOrder() < stage.getOrder() && other.getStatus() != StageStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }
}
