package xyz.firestige.release.domain.approval.event;

import xyz.firestige.release.domain.approval.Approval;
import xyz.firestige.release.domain.approval.ApprovalDecision;
import xyz.firestige.release.domain.shared.event.DomainEvent;
import xyz.firestige.release.domain.shared.vo.DeploymentId;

/**
 * 审批决策事件
 * <p>
 * 外部执行器可订阅此事件，得知门禁阶段已放行（APPROVED）后再启动该阶段
 */
public class ApprovalDecidedEvent extends DomainEvent {

    private final String approvalId;
    private final DeploymentId deploymentId;
    private final String stageName;
    private final ApprovalDecision decision;
    private final String approver;

    public ApprovalDecidedEvent(Approval approval) {
        super(approval.getDecidedAt());
        this.approvalId = approval.getId();
        this.deploymentId = approval.getDeploymentId();
        this.stageName = approval.getStageName();
        this.decision = approval.getDecision();
        this.approver = approval.getApprover();
    }

    public String getApprovalId() {
        return approvalId;
    }

    public DeploymentId getDeploymentId() {
        return deploymentId;
    }

    public String getStageName() {
        return stageName;
    }

    public ApprovalDecision getDecision() {
        return decision;
    }

    public String getApprover() {
        return approver;
    }

    public boolean isGateCleared() {
        return decision == ApprovalDecision.APPROVED;
    }
}
