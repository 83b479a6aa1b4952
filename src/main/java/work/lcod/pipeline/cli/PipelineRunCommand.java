package work.lcod.pipeline.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.pipeline.api.PipelineRunConfiguration;
import work.lcod.pipeline.api.PipelineRunner;
import work.lcod.pipeline.api.RunResult;
import work.lcod.pipeline.demo.DemoActions;
import work.lcod.pipeline.load.PipelineTarget;
import work.lcod.pipeline.load.RunnerSettings;
import work.lcod.pipeline.load.RunnerSettingsLoader;
import work.lcod.pipeline.runtime.ActionRegistry;

@CommandLine.Command(
    name = "lcod-pipeline",
    description = "Check and run a settings-driven pipeline.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class PipelineRunCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter JSON_WRITER = JSON.writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-s", "--settings"},
        paramLabel = "PATH|URL",
        description = "Pipeline settings YAML file path or HTTP(S) URL.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String settings;

    @CommandLine.Option(
        names = {"-n", "--pipeline-name"},
        description = "Pipeline name, used to locate the settings when --settings is absent.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String pipelineName;

    @CommandLine.Option(
        names = {"-p", "--param"},
        paramLabel = "KEY=VALUE",
        description = "Active pipeline parameter (repeatable)."
    )
    private Map<String, String> params = new LinkedHashMap<>();

    @CommandLine.Option(
        names = {"-e", "--env-file"},
        paramLabel = "PATH",
        description = "JSON object of active parameters, or a parameter list written by --parameters-out.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String envFile;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "PATH",
        description = "Runner configuration (default: ./pipeline.toml when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String config;

    @CommandLine.Option(names = "--dry-run", description = "Emulate stages without calling actions.")
    private boolean dryRun;

    @CommandLine.Option(names = "--debug", description = "Print debug diagnostics.")
    private boolean debug;

    @CommandLine.Option(names = "--check-only", description = "Check parameters and stages, do not execute.")
    private boolean checkOnly;

    @CommandLine.Option(
        names = "--strict-actions",
        description = "Fail unregistered actions instead of echoing them."
    )
    private boolean strictActions;

    @CommandLine.Option(
        names = "--parameters-out",
        paramLabel = "PATH",
        description = "Where injected parameter definitions are written as JSON.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String parametersOut;

    @Override
    public Integer call() throws Exception {
        if ((settings == null || settings.isBlank()) && (pipelineName == null || pipelineName.isBlank())) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Either --settings or --pipeline-name is required.");
        }
        var workingDir = Paths.get("").toAbsolutePath();
        var builder = PipelineRunConfiguration.builder()
            .workingDirectory(workingDir)
            .runnerSettings(loadRunnerSettings(workingDir))
            .dryRun(dryRun)
            .debug(debug)
            .checkOnly(checkOnly);
        if (settings != null && !settings.isBlank()) {
            builder.settingsTarget(detectTarget(settings));
        } else {
            builder.pipelineName(pipelineName);
        }
        if (envFile != null) {
            builder.activeParameters(readEnvFile(Paths.get(envFile)));
        }
        builder.activeParameters(params);
        if (parametersOut != null) {
            builder.parametersOut(Paths.get(parametersOut).toAbsolutePath().normalize());
        }

        var registry = DemoActions.register(new ActionRegistry());
        if (!strictActions) {
            registry.setFallback(DemoActions::echo);
        }
        RunResult result = new PipelineRunner(registry).run(builder.build());
        spec.commandLine().getOut().println(JSON_WRITER.writeValueAsString(result.toSerializableMap()));
        spec.commandLine().getOut().flush();
        return result.status().exitCode();
    }

    private PipelineTarget detectTarget(String value) {
        var target = PipelineTarget.parse(value);
        if (target.isRemote()) {
            return target;
        }
        Path path = target.localPath().orElseThrow().toAbsolutePath().normalize();
        if (!Files.exists(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Pipeline settings not found: " + path);
        }
        return PipelineTarget.forLocal(path);
    }

    private RunnerSettings loadRunnerSettings(Path workingDir) {
        if (config == null) {
            return RunnerSettingsLoader.loadFromDirectory(workingDir);
        }
        var path = Paths.get(config).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Runner configuration not found: " + path);
        }
        return RunnerSettingsLoader.load(path);
    }

    /**
     * A JSON object maps names to values. A JSON array is read as injected parameter definitions,
     * each contributing its default (or first choice).
     */
    static Map<String, String> readEnvFile(Path path) {
        JsonNode root;
        try {
            root = JSON.readTree(path.toFile());
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to read parameters from " + path + ": " + ex.getMessage(), ex);
        }
        var values = new LinkedHashMap<String, String>();
        if (root == null || root.isNull() || root.isMissingNode()) {
            return values;
        }
        if (root.isObject()) {
            var fields = root.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                if (!entry.getValue().isNull()) {
                    values.put(entry.getKey(), scalarText(entry.getValue()));
                }
            }
            return values;
        }
        if (root.isArray()) {
            for (var item : root) {
                var name = item.path("name").asText("");
                if (name.isBlank()) {
                    continue;
                }
                if (item.hasNonNull("default")) {
                    values.put(name, scalarText(item.get("default")));
                } else if (item.path("choices").isArray() && item.get("choices").size() > 0) {
                    values.put(name, item.get("choices").get(0).asText());
                } else {
                    values.put(name, "");
                }
            }
            return values;
        }
        throw new IllegalArgumentException("Parameters file must hold a JSON object or array: " + path);
    }

    private static String scalarText(JsonNode node) {
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
