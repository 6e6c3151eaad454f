package io.surfworks.hybridforge.stage;

import com.fasterxml.jackson.annotation.JsonValue;
import io.surfworks.hybridforge.config.PathTable;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * The six pipeline stages, declared in execution order.
 *
 * <p>Each stage's output artifact is the next stage's input artifact.
 * {@link #GENERATE} and {@link #CHECK} always run locally; the remaining four
 * may be placed on either side by the execution plan.
 */
public enum Stage {

    GENERATE("generate", "generate_data", false, paths -> null, PathTable::data),
    CHECK("check", "check_structure", false, PathTable::data, PathTable::dataCheck1),
    FILTER("filter", "filter_gpt2", true, PathTable::dataCheck1, PathTable::dataCheck2),
    COLLECT("collect", "collect_activations", true, PathTable::dataCheck2, PathTable::saved),
    PATCH("patch", "patch_activations", true, PathTable::saved, PathTable::results),
    PLOT("plot", "plot_heatmap", true, PathTable::results, PathTable::heatmap);

    private static final List<Stage> PRE_STAGES = List.of(GENERATE, CHECK);
    private static final List<Stage> REMOTE_ELIGIBLE = Arrays.stream(values())
            .filter(Stage::isRemoteEligible)
            .toList();

    private final String task;
    private final String reportName;
    private final boolean remoteEligible;
    private final Function<PathTable, Path> input;
    private final Function<PathTable, Path> output;

    Stage(String task, String reportName, boolean remoteEligible,
          Function<PathTable, Path> input, Function<PathTable, Path> output) {
        this.task = task;
        this.reportName = reportName;
        this.remoteEligible = remoteEligible;
        this.input = input;
        this.output = output;
    }

    /**
     * Value passed to the stage process as {@code --task}.
     */
    public String task() {
        return task;
    }

    /**
     * Key prefix in the execution plan and the timing report, also used when a stage is written as JSON.
     */
    @JsonValue
    public String reportName() {
        return reportName;
    }

    public boolean isRemoteEligible() {
        return remoteEligible;
    }

    /**
     * Returns the input artifact, or null for a stage that consumes nothing.
     */
    public Path input(PathTable paths) {
        return input.apply(paths);
    }

    public Path output(PathTable paths) {
        return output.apply(paths);
    }

    /**
     * Stages that always run locally before the plan is consulted.
     */
    public static List<Stage> preStages() {
        return PRE_STAGES;
    }

    /**
     * Stages the execution plan may place remotely, in pipeline order.
     */
    public static List<Stage> remoteEligible() {
        return REMOTE_ELIGIBLE;
    }

    /**
     * Looks up a stage by its report name ({@code filter_gpt2} etc).
     *
     * @throws IllegalArgumentException if no stage has that name
     */
    public static Stage fromReportName(String reportName) {
        for (Stage stage : values()) {
            if (stage.reportName.equals(reportName)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + reportName);
    }
}
