package xyz.firestige.release.domain.pipeline.event;

import xyz.firestige.release.domain.pipeline.PipelineStage;
import xyz.firestige.release.domain.pipeline.StageStatus;
import xyz.firestige.release.domain.shared.event.DomainEvent;
import xyz.firestige.release.domain.shared.vo.DeploymentId;
import xyz.firestige.release.domain.shared.vo.StageId;

import java.time.LocalDateTime;

/**
 * 阶段状态变更事件（重复上报相同状态不会产生）
 */
public class StageStatusChangedEvent extends DomainEvent {

    private final DeploymentId deploymentId;
    private final StageId stageId;
    private final String stageName;
    private final StageStatus previousStatus;
    private final StageStatus status;

    public StageStatusChangedEvent(PipelineStage stage, StageStatus previousStatus, LocalDateTime timestamp) {
        super(timestamp);
        this.deploymentId = stage.getDeploymentId();
        this.stageId = stage.getId();
        this.stageName = stage.getName();
        this.previousStatus = previousStatus;
        this.status = stage.getStatus();
    }

    public DeploymentId getDeploymentId() {
        return deploymentId;
    }

    public StageId getStageId() {
        return stageId;
    }

    public String getStageName() {
        return stageName;
    }

    public StageStatus getPreviousStatus() {
        return previousStatus;
    }

    public StageStatus getStatus() {
        return status;
    }
}
