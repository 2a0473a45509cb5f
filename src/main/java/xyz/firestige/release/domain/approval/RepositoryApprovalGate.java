package xyz.firestige.release.domain.approval;

import xyz.firestige.release.domain.pipeline.ApprovalGate;
import xyz.firestige.release.domain.shared.vo.DeploymentId;

/**
 * 基于审批记录的门禁：该阶段所有审批都已 APPROVED（或不存在审批）时放行
 */
public class RepositoryApprovalGate implements ApprovalGate {

    private final ApprovalRepository approvalRepository;

    public RepositoryApprovalGate(ApprovalRepository approvalRepository) {
        this.approvalRepository = approvalRepository;
    }

    @Override
    public boolean isCleared(DeploymentId deploymentId, String stageName) {
        return approvalRepository.findByDeploymentId(deploymentId).stream()
                .filter(a -> a.getStageName().equals(stageName))
                .allMatch(Approval::isApproved);
    }
}
