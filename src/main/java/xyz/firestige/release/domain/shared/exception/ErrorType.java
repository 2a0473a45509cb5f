package xyz.firestige.release.domain.shared.exception;

/**
 * 错误类型枚举
 * 调用方（HTTP/CLI 层）据此映射传输层错误码，例如 CONFLICT → 409
 */
public enum ErrorType {

    /**
     * 引用的发布/部署/阶段/环境不存在
     */
    NOT_FOUND("资源不存在", false),

    /**
     * 唯一性或状态前置条件冲突
     */
    CONFLICT("状态冲突", true),

    /**
     * 非法状态迁移
     */
    INVALID_TRANSITION("非法状态迁移", false),

    /**
     * 受审批门禁保护的阶段无法启动
     */
    APPROVAL_REQUIRED("等待审批", true),

    /**
     * 回滚找不到可用的稳定版本（需人工介入）
     */
    NO_STABLE_RELEASE("无可回滚版本", false),

    /**
     * 审批被拒绝
     */
    APPROVAL_REJECTED("审批被拒绝", false),

    /**
     * 阶段执行失败（由外部执行器上报）
     */
    STAGE_FAILED("阶段执行失败", false),

    /**
     * 运维人员强制终止（强制回滚）
     */
    OPERATOR_ABORTED("人工终止", false),

    /**
     * 系统错误
     */
    SYSTEM_ERROR("系统错误", false);

    private final String description;
    private final boolean retryable;

    ErrorType(String description, boolean retryable) {
        this.description = description;
        this.retryable = retryable;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 调用方在检查当前状态后是否可以重试
     */
    public boolean isRetryable() {
        return retryable;
    }
}
