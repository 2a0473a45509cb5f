package xyz.firestige.release.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import xyz.firestige.release.domain.pipeline.PipelineTemplate;
import xyz.firestige.release.domain.pipeline.StageDefinition;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 发布编排配置
 * prefix: release.orchestration
 * <p>
 * 未配置 stages 时使用标准流水线 build, test, security_scan, deploy(gated), smoke_test
 */
@ConfigurationProperties(prefix = "release.orchestration")
@Validated
public class ReleaseOrchestrationProperties {

    /** 是否启用编排引擎自动配置 */
    private boolean enabled = true;

    /** 流水线阶段，按列表顺序编号 */
    @Valid
    private List<StageProperties> stages = new ArrayList<>();

    /** 获取部署锁的最长等待时间，超时返回冲突 */
    @NotNull
    private Duration lockTimeout = Duration.ofSeconds(5);

    public PipelineTemplate toPipelineTemplate() {
        if (stages.isEmpty()) {
            return PipelineTemplate.canonical();
        }
        List<StageDefinition> definitions = new ArrayList<>();
        for (int i = 0; i < stages.size(); i++) {
            StageProperties stage = stages.get(i);
            definitions.add(new StageDefinition(stage.getName(), i, stage.getTimeoutSeconds(), stage.isGated()));
        }
        return new PipelineTemplate(definitions);
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public List<StageProperties> getStages() { return stages; }
    public void setStages(List<StageProperties> stages) { this.stages = stages; }
    public Duration getLockTimeout() { return lockTimeout; }
    public void setLockTimeout(Duration lockTimeout) { this.lockTimeout = lockTimeout; }

    public static class StageProperties {
        @NotBlank
        private String name;
        /** 只保存，不由引擎强制执行 */
        @Min(1)
        private int timeoutSeconds = PipelineTemplate.DEFAULT_TIMEOUT_SECONDS;
        /** 是否受审批门禁保护 */
        private boolean gated = false;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public boolean isGated() { return gated; }
        public void setGated(boolean gated) { this.gated = gated; }
    }
}
