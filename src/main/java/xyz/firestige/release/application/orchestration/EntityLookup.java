package xyz.firestige.release.application.orchestration;

import xyz.firestige.release.domain.deployment.DeploymentAggregate;
import xyz.firestige.release.domain.deployment.DeploymentRepository;
import xyz.firestige.release.domain.environment.Environment;
import xyz.firestige.release.domain.environment.EnvironmentRepository;
import xyz.firestige.release.domain.release.Release;
import xyz.firestige.release.domain.release.ReleaseRepository;
import xyz.firestige.release.domain.shared.exception.NotFoundException;
import xyz.firestige.release.domain.shared.vo.DeploymentId;
import xyz.firestige.release.domain.shared.vo.EnvironmentId;
import xyz.firestige.release.domain.shared.vo.ReleaseId;

/**
 * 按 ID 加载实体，不存在时抛出 {@link NotFoundException}
 */
class EntityLookup {

    private final ReleaseRepository releaseRepository;
    private final EnvironmentRepository environmentRepository;
    private final DeploymentRepository deploymentRepository;

    EntityLookup(ReleaseRepository releaseRepository,
                 EnvironmentRepository environmentRepository,
                 DeploymentRepository deploymentRepository) {
        this.releaseRepository = releaseRepository;
        this.environmentRepository = environmentRepository;
        this.deploymentRepository = deploymentRepository;
    }

    Release release(ReleaseId releaseId) {
        return releaseRepository.findById(releaseId)
                .orElseThrow(() -> new NotFoundException("Release", releaseId.getValue()));
    }

    Environment environment(EnvironmentId environmentId) {
        return environmentRepository.findById(environmentId)
                .orElseThrow(() -> new NotFoundException("Environment", environmentId.getValue()));
    }

    DeploymentAggregate deployment(DeploymentId deploymentId) {
        return deploymentRepository.findById(deploymentId)
                .orElseThrow(() -> new NotFoundException("Deployment", deploymentId.getValue()));
    }
}
