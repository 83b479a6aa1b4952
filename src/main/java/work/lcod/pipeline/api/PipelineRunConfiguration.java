package work.lcod.pipeline.api;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.pipeline.load.PipelineTarget;
import work.lcod.pipeline.load.RunnerSettings;

/**
 * Immutable configuration of one pipeline run. Either {@code settingsTarget} or {@code pipelineName}
 * must be present; the name is resolved through {@link RunnerSettings}.
 */
public record PipelineRunConfiguration(
    Optional<PipelineTarget> settingsTarget,
    Optional<String> pipelineName,
    Map<String, String> activeParameters,
    Path workingDirectory,
    RunnerSettings runnerSettings,
    boolean dryRun,
    boolean debug,
    boolean checkOnly,
    Optional<Path> parametersOut
) {
    public PipelineRunConfiguration {
        Objects.requireNonNull(settingsTarget, "settingsTarget");
        Objects.requireNonNull(pipelineName, "pipelineName");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(runnerSettings, "runnerSettings");
        Objects.requireNonNull(parametersOut, "parametersOut");
        if (settingsTarget.isEmpty() && pipelineName.filter(name -> !name.isBlank()).isEmpty()) {
            throw new IllegalArgumentException("Either a settings target or a pipeline name must be present.");
        }
        activeParameters = activeParameters == null ? Map.of() : Map.copyOf(activeParameters);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private PipelineTarget settingsTarget;
        private String pipelineName;
        private final Map<String, String> activeParameters = new LinkedHashMap<>();
        private Path workingDirectory = Path.of("").toAbsolutePath();
        private RunnerSettings runnerSettings = RunnerSettings.defaults();
        private boolean dryRun;
        private boolean debug;
        private boolean checkOnly;
        private Path parametersOut;

        public Builder settingsTarget(PipelineTarget settingsTarget) {
            this.settingsTarget = settingsTarget;
            return this;
        }

        public Builder pipelineName(String pipelineName) {
            this.pipelineName = pipelineName;
            return this;
        }

        public Builder activeParameters(Map<String, String> parameters) {
            if (parameters != null) {
                parameters.forEach(this::activeParameter);
            }
            return this;
        }

        public Builder activeParameter(String name, String value) {
            if (name != null && value != null) {
                this.activeParameters.put(name, value);
            }
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder runnerSettings(RunnerSettings runnerSettings) {
            this.runnerSettings = runnerSettings;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder checkOnly(boolean checkOnly) {
            this.checkOnly = checkOnly;
            return this;
        }

        public Builder parametersOut(Path parametersOut) {
            this.parametersOut = parametersOut;
            return this;
        }

        public PipelineRunConfiguration build() {
            return new PipelineRunConfiguration(
                Optional.ofNullable(settingsTarget),
                Optional.ofNullable(pipelineName),
                activeParameters,
                workingDirectory,
                runnerSettings,
                dryRun,
                debug,
                checkOnly,
                Optional.ofNullable(parametersOut)
            );
        }
    }
}
