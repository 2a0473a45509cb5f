package xyz.firestige.release.domain.shared.exception;

/**
 * 找不到可回滚的稳定版本
 * 终态错误，需要人工介入，不会自动重试
 */
public class NoStableReleaseException extends OrchestrationException {

    public NoStableReleaseException(String deploymentId, String serviceId, String environmentId) {
        super(ErrorType.NO_STABLE_RELEASE,
                String.format("没有可回滚的稳定版本，deploymentId: %s, serviceId: %s, environmentId: %s",
                        deploymentId, serviceId, environmentId));
        addContext("deploymentId", deploymentId);
        addContext("serviceId", serviceId);
        addContext("environmentId", environmentId);
    }
}
