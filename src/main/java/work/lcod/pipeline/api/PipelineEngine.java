package work.lcod.pipeline.api;

import java.util.List;
import java.util.Map;
import work.lcod.pipeline.diagnostics.DiagnosticSink;
import work.lcod.pipeline.diagnostics.Diagnostics;
import work.lcod.pipeline.parameter.ParameterRegexProcessor;
import work.lcod.pipeline.parameter.ParameterSchemaBuilder;
import work.lcod.pipeline.parameter.ParameterSettings;
import work.lcod.pipeline.parameter.ParameterSink;
import work.lcod.pipeline.parameter.ParameterValidator;
import work.lcod.pipeline.parameter.Reconciliation;
import work.lcod.pipeline.parameter.RequiredParameterEnforcer;
import work.lcod.pipeline.parameter.SchemaReconciler;
import work.lcod.pipeline.runtime.ActionInvoker;
import work.lcod.pipeline.runtime.ExecuteVisitor;
import work.lcod.pipeline.runtime.PipelineWalker;
import work.lcod.pipeline.runtime.ResolvedEnvironment;
import work.lcod.pipeline.runtime.WalkResult;

/**
 * Core operations on one settings document. Holds the walker's worker pool, so close it when done.
 */
public final class PipelineEngine implements AutoCloseable {
    private final ActionInvoker invoker;
    private final ParameterSink parameterSink;
    private final DiagnosticSink sink;
    private final PipelineWalker walker = new PipelineWalker();

    public PipelineEngine(ActionInvoker invoker, ParameterSink parameterSink, DiagnosticSink sink) {
        this.invoker = invoker;
        this.parameterSink = parameterSink == null ? ParameterSink.NONE : parameterSink;
        this.sink = sink == null ? DiagnosticSink.NONE : sink;
    }

    /**
     * Static check of the declared parameters and of the stage tree. Nothing is invoked or injected.
     */
    public boolean validate(Map<String, Object> settings) {
        var parametersOk = checkParameters(ParameterSettings.extract(settings, List.of()));
        var stagesOk = checkStages(settings).allPassed();
        return parametersOk && stagesOk;
    }

    /**
     * @throws work.lcod.pipeline.runtime.TerminalAbortException when a failing action had {@code stop_on_fail}
     */
    public ExecutionReport execute(Map<String, Object> settings, ResolvedEnvironment environment, boolean dryRun) {
        var env = environment == null ? new ResolvedEnvironment() : environment;
        var result = walker.execute(settings, new ExecuteVisitor(invoker, env, sink, dryRun));
        return new ExecutionReport(result.report(), result.allPassed(), env);
    }

    public Reconciliation reconcileParameters(List<Map<String, Object>> declarations, Map<String, ?> activeParameters) {
        return reconciler().reconcile(declarations, activeParameters);
    }

    public Reconciliation reconcileParameters(List<Map<String, Object>> declarations, Map<String, ?> activeParameters, boolean dryRun) {
        return reconciler().reconcile(declarations, activeParameters, dryRun);
    }

    public boolean checkParameters(List<Map<String, Object>> declarations) {
        return new ParameterValidator(sink).validateAll(declarations);
    }

    public boolean enforceParameters(Map<String, Object> settings, ResolvedEnvironment environment) {
        return new RequiredParameterEnforcer(sink).enforce(ParameterSettings.required(settings), environment);
    }

    public boolean processParameterRegex(List<Map<String, Object>> declarations, ResolvedEnvironment environment) {
        return new ParameterRegexProcessor(sink).process(declarations, environment);
    }

    public WalkResult checkStages(Map<String, Object> settings) {
        return walker.check(settings, Diagnostics.forwardingTo(sink));
    }

    private SchemaReconciler reconciler() {
        return new SchemaReconciler(new ParameterSchemaBuilder(), parameterSink, sink);
    }

    @Override
    public void close() {
        walker.close();
    }
}
