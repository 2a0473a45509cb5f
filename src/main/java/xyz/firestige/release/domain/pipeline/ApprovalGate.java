package xyz.firestige.release.domain.pipeline;

import xyz.firestige.release.domain.shared.vo.DeploymentId;

/**
 * 审批门禁查询
 * <p>
 * Tracker 对审批的全部认知就是这个布尔判断
 */
@FunctionalInterface
public interface ApprovalGate {

    /**
     * @return true 表示该阶段没有未批准的必需审批
     */
    boolean isCleared(DeploymentId deploymentId, String stageName);

    static ApprovalGate open() {
        return (deploymentId, stageName) -> true;
    }
}
