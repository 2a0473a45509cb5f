package xyz.firestige.release.domain.rollback;

import xyz.firestige.release.domain.shared.exception.FailureInfo;
import xyz.firestige.release.domain.shared.vo.DeploymentId;
import xyz.firestige.release.domain.shared.vo.ReleaseId;
import xyz.firestige.release.domain.state.StateMachines;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * 回滚记录：把失败部署的有效版本恢复到之前的稳定版本
 * <p>
 * 回滚不会重新晋级目标版本，只标记"当前真实运行的版本"
 */
public class Rollback {

    private final String id;
    private final DeploymentId deploymentId;
    private final ReleaseId fromReleaseId;
    private final ReleaseId targetReleaseId;
    private final String initiatedBy;
    private final String reason;
    private final boolean forced;
    private final LocalDateTime createdAt;

    private RollbackStatus status;
    private LocalDateTime completedAt;
    private FailureInfo failureInfo;

    public Rollback(DeploymentId deploymentId, ReleaseId fromReleaseId, ReleaseId targetReleaseId,
                    String initiatedBy, String reason, boolean forced, LocalDateTime createdAt) {
        this.id = "rb-" + UUID.randomUUID();
        this.deploymentId = Objects.requireNonNull(deploymentId, "deploymentId");
        this.fromReleaseId = Objects.requireNonNull(fromReleaseId, "fromReleaseId");
        this.targetReleaseId = Objects.requireNonNull(targetReleaseId, "targetReleaseId");
        this.initiatedBy = initiatedBy;
        this.reason = reason;
        this.forced = forced;
        this.createdAt = createdAt;
        this.status = RollbackStatus.PENDING;
    }

    public void start() {
        StateMachines.ROLLBACK.check(id, status, RollbackStatus.IN_PROGRESS);
        this.status = RollbackStatus.IN_PROGRESS;
    }

    public void succeed(LocalDateTime now) {
        StateMachines.ROLLBACK.check(id, status, RollbackStatus.SUCCEEDED);
        this.status = RollbackStatus.SUCCEEDED;
        this.completedAt = now;
    }

    public void fail(FailureInfo failureInfo, LocalDateTime now) {
        StateMachines.ROLLBACK.check(id, status, RollbackStatus.FAILED);
        this.status = RollbackStatus.FAILED;
        this.failureInfo = failureInfo;
        this.completedAt = now;
    }

    public String getId() {
        return id;
    }

    public DeploymentId getDeploymentId() {
        return deploymentId;
    }

    public ReleaseId getFromReleaseId() {
        return fromReleaseId;
    }

    public ReleaseId getTargetReleaseId() {
        return targetReleaseId;
    }

    public String getInitiatedBy() {
        return initiatedBy;
    }

    public String getReason() {
        return reason;
    }

    public boolean isForced() {
        return forced;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public RollbackStatus getStatus() {
        return status;
    }

    public LocalDateTime getCompletedAt() {
        return completedAt;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }

    @Override
    public String toString() {
        return "Rollback{" +
                "id='" + id + '\'' +
                ", deploymentId=" + deploymentId +
                ", targetReleaseId=" + targetReleaseId +
                ", status=" + status +
                '}';
    }
}
