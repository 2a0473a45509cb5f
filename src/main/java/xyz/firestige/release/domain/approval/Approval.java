package xyz.firestige.release.domain.approval;

import xyz.firestige.release.domain.shared.vo.DeploymentId;
import xyz.firestige.release.domain.state.StateMachines;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * 审批门禁：门禁阶段启动前需要的人工决策
 * <p>
 * 不变式：存在 PENDING 的必需审批时，部署不能越过门禁阶段
 */
public class Approval {

    private final String id;
    private final DeploymentId deploymentId;
    private final String stageName;
    private final String requestedBy;
    private final LocalDateTime requestedAt;

    private ApprovalDecision decision;
    private String approver;
    private String comment;
    private LocalDateTime decidedAt;

    public Approval(DeploymentId deploymentId, String stageName, String requestedBy, LocalDateTime requestedAt) {
        this.id = "apr-" + UUID.randomUUID();
        this.deploymentId = Objects.requireNonNull(deploymentId, "deploymentId");
        this.stageName = Objects.requireNonNull(stageName, "stageName");
        this.requestedBy = requestedBy;
        this.requestedAt = requestedAt;
        this.decision = ApprovalDecision.PENDING;
    }

    /**
     * 记录审批决策，只能从 PENDING 决策一次
     */
    public void decide(String approver, ApprovalDecision decision, String comment, LocalDateTime now) {
        if (decision == null || decision == ApprovalDecision.PENDING) {
            throw new IllegalArgumentException("审批决策必须是 APPROVED 或 REJECTED: " + decision);
        }
        StateMachines.APPROVAL.check(id, this.decision, decision);
        this.decision = decision;
        this.approver = approver;
        this.comment = comment;
        this.decidedAt = now;
    }

    public boolean isPending() {
        return decision == ApprovalDecision.PENDING;
    }

    public boolean isApproved() {
        return decision == ApprovalDecision.APPROVED;
    }

    public String getId() {
        return id;
    }

    public DeploymentId getDeploymentId() {
        return deploymentId;
    }

    public String getStageName() {
        return stageName;
    }

    public String getRequestedBy() {
        return requestedBy;
    }

    public LocalDateTime getRequestedAt() {
        return requestedAt;
    }

    public ApprovalDecision getDecision() {
        return decision;
    }

    public String getApprover() {
        return approver;
    }

    public String getComment() {
        return comment;
    }

    public LocalDateTime getDecidedAt() {
        return decidedAt;
    }

    @Override
    public String toString() {
        return "Approval{" +
                "id='" + id + '\'' +
                ", deploymentId=" + deploymentId +
                ", stageName='" + stageName + '\'' +
                ", decision=" + decision +
                '}';
    }
}
