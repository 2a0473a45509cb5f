package xyz.firestige.release.domain.shared.exception;

/**
 * 审批门禁未放行
 * 与一般失败区分：表示"等待人工"而不是"出错"，调用方应轮询或订阅审批事件
 */
public class ApprovalRequiredException extends OrchestrationException {

    private final String deploymentId;
    private final String stageName;

    public ApprovalRequiredException(String deploymentId, String stageName) {
        super(ErrorType.APPROVAL_REQUIRED,
                String.format("阶段 %s 需要审批通过后才能启动，deploymentId: %s", stageName, deploymentId));
        this.deploymentId = deploymentId;
        this.stageName = stageName;
        addContext("deploymentId", deploymentId);
        addContext("stageName", stageName);
    }

    public String getDeploymentId() {
        return deploymentId;
    }

    public String getStageName() {
        return stageName;
    }
}
