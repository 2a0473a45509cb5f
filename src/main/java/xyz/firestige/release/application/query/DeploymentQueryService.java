package xyz.firestige.release.application.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.release.domain.approval.Approval;
import xyz.firestige.release.domain.approval.ApprovalRepository;
import xyz.firestige.release.domain.deployment.DeploymentAggregate;
import xyz.firestige.release.domain.deployment.DeploymentRepository;
import xyz.firestige.release.domain.metric.DeploymentMetricRepository;
import xyz.firestige.release.domain.pipeline.PipelineStage;
import xyz.firestige.release.domain.pipeline.PipelineStageTracker;
import xyz.firestige.release.domain.rollback.Rollback;
import xyz.firestige.release.domain.rollback.RollbackRepository;
import xyz.firestige.release.domain.shared.exception.NotFoundException;
import xyz.firestige.release.domain.shared.vo.DeploymentId;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 只读查询，不加锁
 */
public class DeploymentQueryService {

    private static final Logger log = LoggerFactory.getLogger(DeploymentQueryService.class);

    private final DeploymentRepository deploymentRepository;
    private final PipelineStageTracker stageTracker;
    private final DeploymentMetricRepository metricRepository;
    private final ApprovalRepository approvalRepository;
    private final RollbackRepository rollbackRepository;

    public DeploymentQueryService(DeploymentRepository deploymentRepository,
                                  PipelineStageTracker stageTracker,
                                  DeploymentMetricRepository metricRepository,
                                  ApprovalRepository approvalRepository,
                                  RollbackRepository rollbackRepository) {
        this.deploymentRepository = deploymentRepository;
        this.stageTracker = stageTracker;
        this.metricRepository = metricRepository;
        this.approvalRepository = approvalRepository;
        this.rollbackRepository = rollbackRepository;
    }

    public DeploymentDetail getDeploymentWithStages(DeploymentId deploymentId) {
        DeploymentAggregate deployment = requireDeployment(deploymentId);
        return new DeploymentDetail(deployment, stageTracker.getStages(deploymentId), List.of());
    }

    public DeploymentDetail getDeploymentWithMetrics(DeploymentId deploymentId) {
        DeploymentAggregate deployment = requireDeployment(deploymentId);
        return new DeploymentDetail(deployment, stageTracker.getStages(deploymentId),
                metricRepository.findByDeploymentId(deploymentId));
    }

    /**
     * 外部执行器轮询下一个可执行阶段
     */
    public Optional<PipelineStage> nextRunnableStage(DeploymentId deploymentId) {
        requireDeployment(deploymentId);
        return stageTracker.nextRunnableStage(deploymentId);
    }

    public List<Approval> listApprovals(DeploymentId deploymentId) {
        requireDeployment(deploymentId);
        return approvalRepository.findByDeploymentId(deploymentId).stream()
                .sorted(Comparator.comparing(Approval::getRequestedAt))
                .collect(Collectors.toList());
    }

    public List<Rollback> listRollbacks(DeploymentId deploymentId) {
        requireDeployment(deploymentId);
        return rollbackRepository.findByDeploymentId(deploymentId).stream()
                .sorted(Comparator.comparing(Rollback::getCreatedAt))
                .collect(Collectors.toList());
    }

    public Rollback getRollback(String rollbackId) {
        return rollbackRepository.findById(rollbackId)
                .orElseThrow(() -> new NotFoundException("Rollback", rollbackId));
    }

    private DeploymentAggregate requireDeployment(DeploymentId deploymentId) {
        return deploymentRepository.findById(deploymentId)
                .orElseThrow(() -> {
                    log.debug("[DeploymentQueryService] 部署不存在: {}", deploymentId);
                    return new NotFoundException("Deployment", deploymentId.getValue());
                });
    }
}
