package xyz.firestige.release.domain.state;

import xyz.firestige.release.domain.approval.ApprovalDecision;
import xyz.firestige.release.domain.deployment.DeploymentStatus;
import xyz.firestige.release.domain.pipeline.StageStatus;
import xyz.firestige.release.domain.release.ReleaseStatus;
import xyz.firestige.release.domain.rollback.RollbackStatus;

/**
 * 各实体的合法状态迁移表
 * <p>
 * Deployment: PENDING → IN_PROGRESS → {SUCCEEDED, FAILED}; FAILED → ROLLED_BACK（仅回滚）<br>
 * Stage: PENDING → RUNNING → {COMPLETED, FAILED}<br>
 * Release: DRAFT → PROMOTED → ROLLED_BACK<br>
 * Rollback: PENDING → IN_PROGRESS → {SUCCEEDED, FAILED}<br>
 * Approval: PENDING → {APPROVED, REJECTED}
 */
public final class StateMachines {

    public static final TransitionRules<DeploymentStatus> DEPLOYMENT =
            TransitionRules.builder("Deployment", DeploymentStatus.class)
                    .allow(DeploymentStatus.PENDING, DeploymentStatus.IN_PROGRESS)
                    .allow(DeploymentStatus.IN_PROGRESS, DeploymentStatus.SUCCEEDED, DeploymentStatus.FAILED)
                    .allow(DeploymentStatus.FAILED, DeploymentStatus.ROLLED_BACK)
                    .build();

    public static final TransitionRules<StageStatus> STAGE =
            TransitionRules.builder("PipelineStage", StageStatus.class)
                    .allow(StageStatus.PENDING, StageStatus.RUNNING)
                    .allow(StageStatus.RUNNING, StageStatus.COMPLETED, StageStatus.FAILED)
                    .build();

    public static final TransitionRules<ReleaseStatus> RELEASE =
            TransitionRules.builder("Release", ReleaseStatus.class)
                    .allow(ReleaseStatus.DRAFT, ReleaseStatus.PROMOTED)
                    .allow(ReleaseStatus.PROMOTED, ReleaseStatus.ROLLED_BACK)
                    .build();

    public static final TransitionRules<RollbackStatus> ROLLBACK =
            TransitionRules.builder("Rollback", RollbackStatus.class)
                    .allow(RollbackStatus.PENDING, RollbackStatus.IN_PROGRESS)
                    .allow(RollbackStatus.IN_PROGRESS, RollbackStatus.SUCCEEDED, RollbackStatus.FAILED)
                    .build();

    public static final TransitionRules<ApprovalDecision> APPROVAL =
            TransitionRules.builder("Approval", ApprovalDecision.class)
                    .allow(ApprovalDecision.PENDING, ApprovalDecision.APPROVED, ApprovalDecision.REJECTED)
                    .build();

    private StateMachines() {
    }
}
