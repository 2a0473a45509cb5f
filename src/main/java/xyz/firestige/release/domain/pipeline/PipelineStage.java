package xyz.firestige.release.domain.pipeline;

import xyz.firestige.release.domain.shared.vo.DeploymentId;
import xyz.firestige.release.domain.shared.vo.StageId;
import xyz.firestige.release.domain.state.StateMachines;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 流水线阶段实体，归属于一个 Deployment
 * <p>
 * 不变式：
 * 1. 状态只能前进（PENDING → RUNNING → COMPLETED/FAILED）
 * 2. startedAt / completedAt 每次迁移只写一次
 * 3. 重复上报相同状态是 no-op（外部执行器至少一次投递）
 */
public class PipelineStage {

    private final StageId id;
    private final DeploymentId deploymentId;
    private final String name;
    private final int order;
    private final int timeoutSeconds;
    private final boolean gated;

    private StageStatus status;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String output;

    public PipelineStage(StageId id, DeploymentId deploymentId, StageDefinition definition) {
        this.id = Objects.requireNonNull(id, "id");
        this.deploymentId = Objects.requireNonNull(deploymentId, "deploymentId");
        this.name = definition.getName();
        this.order = definition.getOrder();
        this.timeoutSeconds = definition.getTimeoutSeconds();
        this.gated = definition.isGated();
        this.status = StageStatus.PENDING;
    }

    /**
     * 应用外部执行器上报的状态
     *
     * @return false 表示与当前状态相同（no-op），true 表示发生了迁移
     * @throws xyz.firestige.release.domain.shared.exception.InvalidTransitionException 状态回退或跳跃
     */
    public boolean applyStatus(StageStatus target, String output, LocalDateTime now) {
        if (status == target) {
            return false;
        }
        StateMachines.STAGE.check(id.getValue(), status, target);
        this.status = target;
        if (target == StageStatus.RUNNING && startedAt == null) {
            this.startedAt = now;
        }
        if (target.isFinished() && completedAt == null) {
            this.completedAt = now;
        }
        if (output != null) {
            this.output = output;
        }
        return true;
    }

    public StageId getId() {
        return id;
    }

    public DeploymentId getDeploymentId() {
        return deploymentId;
    }

    public String getName() {
        return name;
    }

    public int getOrder() {
        return order;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public boolean isGated() {
        return gated;
    }

    public StageStatus getStatus() {
        return status;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public LocalDateTime getCompletedAt() {
        return completedAt;
    }

    public String getOutput() {
        return output;
    }

    @Override
    public String toString() {
        return "PipelineStage{" +
                "name='" + name + '\'' +
                ", order=" + order +
                ", status=" + status +
                '}';
    }
}
