package xyz.firestige.release.domain.rollback;

import xyz.firestige.release.domain.deployment.DeploymentAggregate;
import xyz.firestige.release.domain.deployment.DeploymentRepository;
import xyz.firestige.release.domain.deployment.DeploymentStatus;
import xyz.firestige.release.domain.release.Release;
import xyz.firestige.release.domain.release.ReleaseRepository;
import xyz.firestige.release.domain.release.ReleaseStatus;
import xyz.firestige.release.domain.shared.vo.EnvironmentId;
import xyz.firestige.release.domain.shared.vo.ReleaseId;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 回滚目标选择（领域服务）
 * <p>
 * 候选版本必须同时满足：
 * <ol>
 *   <li>与失败版本属于同一 Service，且不是失败版本本身</li>
 *   <li>状态为 PROMOTED</li>
 *   <li>晋级到同一环境的时间严格早于失败部署的晋级时间（即失败部署的 startedAt）</li>
 *   <li>在该环境有一次在失败部署之前启动、且已 SUCCEEDED 的部署（稳定版本）</li>
 * </ol>
 * 截止时间取自失败部署本身，而不是失败版本最近一次晋级时间：同一版本之后重新晋级不会让截止时间后移。
 * 按截止时间之前的最近晋级时间降序、release id 升序取第一个，结果是确定的。
 */
public class StableReleaseSelector {

    private final ReleaseRepository releaseRepository;
    private final DeploymentRepository deploymentRepository;

    public StableReleaseSelector(ReleaseRepository releaseRepository, DeploymentRepository deploymentRepository) {
        this.releaseRepository = releaseRepository;
        this.deploymentRepository = deploymentRepository;
    }

    public Optional<Release> select(DeploymentAggregate failedDeployment, Release failedRelease) {
        EnvironmentId environmentId = failedDeployment.getEnvironmentId();
        LocalDateTime cutoff = failedDeployment.getStartedAt() != null
                ? failedDeployment.getStartedAt()
                : failedDeployment.getCreatedAt();

        Set<ReleaseId> succeededBeforeCutoff = deploymentRepository.findByEnvironment(environmentId).stream()
                .filter(d -> d.getStatus() == DeploymentStatus.SUCCEEDED)
                .filter(d -> d.getStartedAt() != null && d.getStartedAt().isBefore(cutoff))
                .map(DeploymentAggregate::getReleaseId)
                .collect(Collectors.toSet());

        Comparator<Release> newestFirst = Comparator
                .comparing((Release r) -> r.getLastPromotedBefore(environmentId, cutoff).orElseThrow(),
                        Comparator.reverseOrder())
                .thenComparing(Release::getId);

        return releaseRepository.findByServiceId(failedRelease.getServiceId()).stream()
                .filter(r -> !r.getId().equals(failedRelease.getId()))
                .filter(r -> r.getStatus() == ReleaseStatus.PROMOTED)
                .filter(r -> r.getLastPromotedBefore(environmentId, cutoff).isPresent())
                .filter(r -> succeededBeforeCutoff.contains(r.getId()))
                .min(newestFirst);
    }
}
