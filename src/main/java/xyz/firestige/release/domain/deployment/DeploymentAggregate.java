package xyz.firestige.release.domain.deployment;

import xyz.firestige.release.domain.deployment.event.DeploymentCreatedEvent;
import xyz.firestige.release.domain.deployment.event.DeploymentEvent;
import xyz.firestige.release.domain.deployment.event.DeploymentFailedEvent;
import xyz.firestige.release.domain.deployment.event.DeploymentRolledBackEvent;
import xyz.firestige.release.domain.deployment.event.DeploymentStartedEvent;
import xyz.firestige.release.domain.deployment.event.DeploymentSucceededEvent;
import xyz.firestige.release.domain.shared.exception.FailureInfo;
import xyz.firestige.release.domain.shared.vo.DeploymentId;
import xyz.firestige.release.domain.shared.vo.EnvironmentId;
import xyz.firestige.release.domain.shared.vo.ReleaseId;
import xyz.firestige.release.domain.state.StateMachines;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 部署聚合：一次把 Release 推进到某个 Environment 的尝试
 * <p>
 * 职责：
 * 1. 管理部署生命周期，所有迁移经过 {@link StateMachines#DEPLOYMENT} 校验
 * 2. 记录时间戳（创建/开始/结束）与失败原因
 * 3. 收集领域事件，由应用层在保存后发布
 * <p>
 * 部署记录保留用于历史追溯，正常流程中不会删除。
 */
public class DeploymentAggregate {

    private final DeploymentId id;
    private final ReleaseId releaseId;
    private final EnvironmentId environmentId;
    private final String requestedBy;

    private DeploymentStatus status;
    private final LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private FailureInfo failureInfo;
    private String rollbackId;

    private final List<DeploymentEvent> domainEvents = new ArrayList<>();

    public DeploymentAggregate(DeploymentId id, ReleaseId releaseId, EnvironmentId environmentId,
                               String requestedBy, LocalDateTime createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.releaseId = Objects.requireNonNull(releaseId, "releaseId");
        this.environmentId = Objects.requireNonNull(environmentId, "environmentId");
        this.requestedBy = requestedBy;
        this.createdAt = createdAt;
        this.status = DeploymentStatus.PENDING;
        addDomainEvent(new DeploymentCreatedEvent(this, createdAt));
    }

    // ============================================
    // 事件管理
    // ============================================

    public List<DeploymentEvent> getDomainEvents() {
        return Collections.unmodifiableList(domainEvents);
    }

    /**
     * 取出并清空事件（发布前调用）
     */
    public List<DeploymentEvent> pullDomainEvents() {
        List<DeploymentEvent> events = new ArrayList<>(domainEvents);
        domainEvents.clear();
        return events;
    }

    public void clearDomainEvents() {
        domainEvents.clear();
    }

    private void addDomainEvent(DeploymentEvent event) {
        this.domainEvents.add(event);
    }

    // ============================================
    // 业务行为
    // ============================================

    /**
     * 开始推进流水线
     * 不变式：只有 PENDING 状态可以开始
     */
    public void start(LocalDateTime now) {
        transitionTo(DeploymentStatus.IN_PROGRESS);
        this.startedAt = now;
        addDomainEvent(new DeploymentStartedEvent(this, now));
    }

    /**
     * 所有 Stage 完成
     */
    public void succeed(LocalDateTime now) {
        transitionTo(DeploymentStatus.SUCCEEDED);
        this.completedAt = now;
        addDomainEvent(new DeploymentSucceededEvent(this, now));
    }

    /**
     * Stage 失败 / 审批拒绝 / 强制回滚前置
     */
    public void fail(FailureInfo failureInfo, LocalDateTime now) {
        transitionTo(DeploymentStatus.FAILED);
        this.failureInfo = failureInfo;
        this.completedAt = now;
        addDomainEvent(new DeploymentFailedEvent(this, failureInfo, now));
    }

    /**
     * 回滚完成
     * 不变式：只有 FAILED 状态可以迁移到 ROLLED_BACK
     */
    public void markRolledBack(String rollbackId, LocalDateTime now) {
        transitionTo(DeploymentStatus.ROLLED_BACK);
        this.rollbackId = rollbackId;
        this.completedAt = now;
        addDomainEvent(new DeploymentRolledBackEvent(this, rollbackId, now));
    }

    private void transitionTo(DeploymentStatus target) {
        StateMachines.DEPLOYMENT.check(id.getValue(), status, target);
        this.status = target;
    }

    /**
     * 补偿用快照：回滚提交失败时恢复到回滚前的 FAILED 状态
     */
    public DeploymentSnapshot snapshot() {
        return new DeploymentSnapshot(status, completedAt, failureInfo, rollbackId, domainEvents.size());
    }

    public void restore(DeploymentSnapshot snapshot) {
        this.status = snapshot.status;
        this.completedAt = snapshot.completedAt;
        this.failureInfo = snapshot.failureInfo;
        this.rollbackId = snapshot.rollbackId;
        while (domainEvents.size() > snapshot.eventCount) {
            domainEvents.remove(domainEvents.size() - 1);
        }
    }

    public boolean isActive() {
        return status.isActive();
    }

    // Getters

    public DeploymentId getId() {
        return id;
    }

    public ReleaseId getReleaseId() {
        return releaseId;
    }

    public EnvironmentId getEnvironmentId() {
        return environmentId;
    }

    public String getRequestedBy() {
        return requestedBy;
    }

    public DeploymentStatus getStatus() {
        return status;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public LocalDateTime getCompletedAt() {
        return completedAt;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }

    public String getRollbackId() {
        return rollbackId;
    }

    @Override
    public String toString() {
        return "Deployment{" +
                "id=" + id +
                ", releaseId=" + releaseId +
                ", environmentId=" + environmentId +
                ", status=" + status +
                '}';
    }

    public static final class DeploymentSnapshot {
        private final DeploymentStatus status;
        private final LocalDateTime completedAt;
        private final FailureInfo failureInfo;
        private final String rollbackId;
        private final int eventCount;

        private DeploymentSnapshot(DeploymentStatus status, LocalDateTime completedAt, FailureInfo failureInfo,
                                   String rollbackId, int eventCount) {
            this.status = status;
            this.completedAt = completedAt;
            this.failureInfo = failureInfo;
            this.rollbackId = rollbackId;
            this.eventCount = eventCount;
        }

        public DeploymentStatus getStatus() {
            return status;
        }
    }
}
