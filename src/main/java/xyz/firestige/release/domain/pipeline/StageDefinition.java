package xyz.firestige.release.domain.pipeline;

import java.util.Objects;

/**
 * 阶段定义（物化前的模板条目）
 *
 * @see PipelineTemplate
 */
public final class StageDefinition {

    private final String name;
    private final int order;
    private final int timeoutSeconds;
    private final boolean gated;

    public StageDefinition(String name, int order, int timeoutSeconds, boolean gated) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("stage name 不能为空");
        }
        if (order < 0) {
            throw new IllegalArgumentException("stage order 不能为负数: " + order);
        }
        this.name = name;
        this.order = order;
        this.timeoutSeconds = timeoutSeconds;
        this.gated = gated;
    }

    public String getName() {
        return name;
    }

    public int getOrder() {
        return order;
    }

    /**
     * 超时时间只做存储，由外部 supervisor 负责执行
     */
    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    /**
     * 是否受审批门禁保护（只在目标环境要求审批时生效）
     */
    public boolean isGated() {
        return gated;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StageDefinition that = (StageDefinition) o;
        return order == that.order && timeoutSeconds == that.timeoutSeconds && gated == that.gated
                && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, order, timeoutSeconds, gated);
    }

    @Override
    public String toString() {
        return name + "#" + order + (gated ? "(gated)" : "");
    }
}
