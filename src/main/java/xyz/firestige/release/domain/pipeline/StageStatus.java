package xyz.firestige.release.domain.pipeline;

/**
 * 流水线阶段状态
 * <p>
 * PENDING → RUNNING → {COMPLETED, FAILED}，不允许回退
 */
public enum StageStatus {

    PENDING("待执行"),

    RUNNING("执行中"),

    COMPLETED("已完成"),

    FAILED("已失败");

    private final String description;

    StageStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }
}
