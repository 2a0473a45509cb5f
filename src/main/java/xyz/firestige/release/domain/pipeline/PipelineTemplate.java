package xyz.firestige.release.domain.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 晋级流水线模板：按 order 排序的阶段定义列表
 */
public final class PipelineTemplate {

    public static final int DEFAULT_TIMEOUT_SECONDS = 3600;

    public static final String BUILD = "build";
    public static final String TEST = "test";
    public static final String SECURITY_SCAN = "security_scan";
    public static final String DEPLOY = "deploy";
    public static final String SMOKE_TEST = "smoke_test";

    private final List<StageDefinition> stages;

    public PipelineTemplate(List<StageDefinition> stages) {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("流水线至少需要一个阶段");
        }
        Set<String> names = new HashSet<>();
        for (StageDefinition stage : stages) {
            if (!names.add(stage.getName())) {
                throw new IllegalArgumentException("阶段名重复: " + stage.getName());
            }
        }
        List<StageDefinition> sorted = new ArrayList<>(stages);
        sorted.sort(Comparator.comparingInt(StageDefinition::getOrder));
        this.stages = Collections.unmodifiableList(sorted);
    }

    /**
     * 标准晋级流水线：build, test, security_scan, deploy, smoke_test（order 0..4），deploy 受门禁保护
     */
    public static PipelineTemplate canonical() {
        return new PipelineTemplate(List.of(
                new StageDefinition(BUILD, 0, DEFAULT_TIMEOUT_SECONDS, false),
                new StageDefinition(TEST, 1, DEFAULT_TIMEOUT_SECONDS, false),
                new StageDefinition(SECURITY_SCAN, 2, DEFAULT_TIMEOUT_SECONDS, false),
                new StageDefinition(DEPLOY, 3, DEFAULT_TIMEOUT_SECONDS, true),
                new StageDefinition(SMOKE_TEST, 4, DEFAULT_TIMEOUT_SECONDS, false)
        ));
    }

    public List<StageDefinition> getStages() {
        return stages;
    }

    public Optional<StageDefinition> find(String name) {
        return stages.stream().filter(s -> s.getName().equals(name)).findFirst();
    }

    public List<StageDefinition> gatedStages() {
        List<StageDefinition> gated = new ArrayList<>();
        for (StageDefinition stage : stages) {
            if (stage.isGated()) {
                gated.add(stage);
            }
        }
        return gated;
    }
}
