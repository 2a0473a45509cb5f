package xyz.firestige.release.domain.deployment;

import xyz.firestige.release.domain.state.StateMachines;

/**
 * 部署状态枚举
 * <p>
 * 状态转换说明：
 * - PENDING → IN_PROGRESS: 阶段已物化，开始推进
 * - IN_PROGRESS → SUCCEEDED: 所有 Stage 完成
 * - IN_PROGRESS → FAILED: Stage 失败或审批被拒绝
 * - FAILED → ROLLED_BACK: 仅通过回滚
 * <p>
 * SUCCEEDED / ROLLED_BACK 为终态；FAILED 为半终态，只允许迁移到 ROLLED_BACK
 */
public enum DeploymentStatus {

    PENDING("待执行"),

    IN_PROGRESS("执行中"),

    SUCCEEDED("已成功"),

    FAILED("已失败"),

    ROLLED_BACK("已回滚");

    private final String description;

    DeploymentStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return StateMachines.DEPLOYMENT.isTerminal(this);
    }

    /**
     * 是否占用 (release, environment) 的唯一活跃名额
     */
    public boolean isActive() {
        return this == PENDING || this == IN_PROGRESS;
    }
}
