package xyz.firestige.release.domain.approval;

import xyz.firestige.release.domain.shared.vo.DeploymentId;

import java.util.List;
import java.util.Optional;

public interface ApprovalRepository {

    void save(Approval approval);

    void remove(String approvalId);

    Optional<Approval> findById(String approvalId);

    /**
     * 按申请时间升序
     */
    List<Approval> findByDeploymentId(DeploymentId deploymentId);
}
