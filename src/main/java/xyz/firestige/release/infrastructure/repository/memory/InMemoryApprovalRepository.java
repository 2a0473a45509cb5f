package xyz.firestige.release.infrastructure.repository.memory;

import xyz.firestige.release.domain.approval.Approval;
import xyz.firestige.release.domain.approval.ApprovalRepository;
import xyz.firestige.release.domain.shared.vo.DeploymentId;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryApprovalRepository implements ApprovalRepository {

    private final Map<String, Approval> approvals = new ConcurrentHashMap<>();

    @Override
    public void save(Approval approval) {
        if (approval == null || approval.getId() == null) {
            throw new IllegalArgumentException("Approval or ApprovalId cannot be null");
        }
        approvals.put(approval.getId(), approval);
    }

    @Override
    public void remove(String approvalId) {
        approvals.remove(approvalId);
    }

    @Override
    public Optional<Approval> findById(String approvalId) {
        return Optional.ofNullable(approvals.get(approvalId));
    }

    @Override
    public List<Approval> findByDeploymentId(DeploymentId deploymentId) {
        return approvals.values().stream()
                .filter(a -> a.getDeploymentId().equals(deploymentId))
                .sorted(Comparator.comparing(Approval::getRequestedAt))
                .collect(Collectors.toList());
    }
}
