package work.lcod.pipeline.api;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.pipeline.diagnostics.DiagnosticSink;
import work.lcod.pipeline.diagnostics.Severity;
import work.lcod.pipeline.diagnostics.Slf4jDiagnosticSink;
import work.lcod.pipeline.load.PipelineLoader;
import work.lcod.pipeline.load.PipelineNames;
import work.lcod.pipeline.load.PipelineTarget;
import work.lcod.pipeline.parameter.JsonParameterSink;
import work.lcod.pipeline.parameter.ParameterDefinition;
import work.lcod.pipeline.parameter.ParameterSettings;
import work.lcod.pipeline.parameter.ParameterSink;
import work.lcod.pipeline.parameter.ReconcileDecision;
import work.lcod.pipeline.runtime.ActionInvoker;
import work.lcod.pipeline.runtime.NodeSelector;
import work.lcod.pipeline.runtime.ResolvedEnvironment;
import work.lcod.pipeline.runtime.TerminalAbortException;

/**
 * Public entry point: loads a settings document, processes its parameters, checks it and runs it.
 */
public final class PipelineRunner {
    static final String SETTINGS_ERRORS = "Pipeline settings contain error(s).";
    static final String REQUIRED_PARAMETERS = "Required pipeline parameter(s) not specified or incorrect.";
    static final String STAGES_FAILED = "Stage execution finished with failure.";
    static final String PARAMETER_SETTINGS_ERRORS = "Error(s) in pipeline parameter settings.";

    private final ActionInvoker invoker;
    private final DiagnosticSink sink;

    public PipelineRunner(ActionInvoker invoker) {
        this(invoker, new Slf4jDiagnosticSink());
    }

    public PipelineRunner(ActionInvoker invoker, DiagnosticSink sink) {
        this.invoker = invoker;
        this.sink = sink == null ? DiagnosticSink.NONE : sink;
    }

    public RunResult run(PipelineRunConfiguration configuration) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        try {
            var target = resolveTarget(configuration);
            metadata.put("settings", target.display());
            var settings = PipelineLoader.load(target);
            return run(configuration, settings, metadata, started);
        } catch (Exception ex) {
            if (Boolean.getBoolean("lcod.debug")) {
                ex.printStackTrace();
            }
            if (ex instanceof PipelineFailureException failure) {
                metadata.put("reasons", failure.reasons());
            }
            return RunResult.failure(ex.getMessage(), metadata, started);
        }
    }

    private RunResult run(PipelineRunConfiguration configuration, Map<String, Object> settings, Map<String, Object> metadata, Instant started) {
        var runnerSettings = configuration.runnerSettings();
        var environment = ResolvedEnvironment.of(configuration.activeParameters());
        var dryRun = configuration.dryRun() || environment.flag(ParameterSettings.DRY_RUN);
        var debug = configuration.debug() || environment.flag(ParameterSettings.DEBUG_MODE);
        var out = sink.atLeast(debug ? Severity.DEBUG : Severity.INFO);

        var builtins = ParameterSettings.builtins(runnerSettings.nodeParameter(), runnerSettings.nodeLabelParameter(),
            runnerSettings.defaultNodeLabel());
        var allParameters = ParameterSettings.extract(settings, builtins);
        var node = NodeSelector.fromEnvironment(environment, runnerSettings.nodeParameter(), runnerSettings.nodeLabelParameter());
        out.info("Pipeline runs on " + node.display() + ".");
        metadata.put("node", node.toSerializableMap());
        metadata.put("dryRun", dryRun);

        var settingsOk = true;
        var requiredOk = true;
        var stagesOk = true;
        var parameterSettingsOk = true;
        try (var engine = new PipelineEngine(invoker, parameterSink(configuration, out), out)) {
            var parametersOk = true;
            if (allParameters.isEmpty()) {
                out.info("No pipeline parameters in the config.");
            } else {
                var reconciliation = engine.reconcileParameters(allParameters, configuration.activeParameters(), dryRun);
                if (reconciliation.decision() == ReconcileDecision.HALT) {
                    metadata.put("injectedParameters", names(reconciliation.injected()));
                    return RunResult.halted(metadata, started);
                }
                parameterSettingsOk = reconciliation.allValid();
                parametersOk = engine.checkParameters(allParameters);
                if (parametersOk || dryRun) {
                    var enforced = engine.enforceParameters(settings, environment);
                    var regexOk = engine.processParameterRegex(allParameters, environment);
                    requiredOk = enforced && regexOk;
                }
            }

            var check = engine.checkStages(settings);
            settingsOk = check.allPassed() && parametersOk;
            metadata.put("status", check.report().toSerializableMap());

            var clean = settingsOk && requiredOk && parameterSettingsOk;
            if (!configuration.checkOnly() && (clean || dryRun)) {
                if (dryRun) {
                    out.warning("Dry-run mode enabled. All pipeline and settings errors will be ignored and pipeline stages "
                        + "will be emulated skipping the actions.");
                }
                try {
                    var execution = engine.execute(settings, environment, dryRun);
                    metadata.put("status", execution.status().toSerializableMap());
                    stagesOk = execution.allPassed();
                } catch (TerminalAbortException ex) {
                    metadata.put("status", ex.report().toSerializableMap());
                    metadata.put("environment", environment.snapshot());
                    throw ex;
                }
            }
            metadata.put("environment", environment.snapshot());
        }

        var reasons = new ArrayList<String>();
        if (!settingsOk) {
            reasons.add(SETTINGS_ERRORS);
        }
        if (!requiredOk) {
            reasons.add(REQUIRED_PARAMETERS);
        }
        if (!stagesOk) {
            reasons.add(STAGES_FAILED);
        }
        if (!parameterSettingsOk) {
            reasons.add(PARAMETER_SETTINGS_ERRORS);
        }
        if (!reasons.isEmpty()) {
            throw new PipelineFailureException(reasons);
        }
        return RunResult.success(metadata, started);
    }

    private PipelineTarget resolveTarget(PipelineRunConfiguration configuration) {
        if (configuration.settingsTarget().isPresent()) {
            return configuration.settingsTarget().get();
        }
        var name = configuration.pipelineName().orElseThrow();
        return PipelineTarget.forLocal(PipelineNames.settingsPath(configuration.runnerSettings(), name, configuration.workingDirectory()));
    }

    private ParameterSink parameterSink(PipelineRunConfiguration configuration, DiagnosticSink out) {
        if (configuration.parametersOut().isPresent()) {
            var json = new JsonParameterSink(configuration.parametersOut().get());
            return definitions -> {
                json.inject(definitions);
                out.info("Pipeline parameters written to " + json.target());
            };
        }
        return definitions -> out.info("Pipeline parameters to inject: " + String.join(", ", names(definitions)));
    }

    private static List<String> names(List<ParameterDefinition> definitions) {
        return definitions.stream().map(ParameterDefinition::name).toList();
    }
}
