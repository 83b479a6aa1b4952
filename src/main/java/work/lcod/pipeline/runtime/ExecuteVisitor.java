package work.lcod.pipeline.runtime;

import work.lcod.pipeline.diagnostics.DiagnosticSink;
import work.lcod.pipeline.diagnostics.Severity;
import work.lcod.pipeline.runtime.StageParser.ParsedAction;
import work.lcod.pipeline.runtime.StageParser.ParsedStage;

/**
 * Execute pass: prints action messages, calls the invoker and applies {@code ignore_fail} and
 * {@code stop_on_fail}. In dry-run mode the invoker is never called.
 */
public final class ExecuteVisitor implements PipelineVisitor {
    static final String DRY_RUN_LINK = "dry-run";

    private final ActionInvoker invoker;
    private final ResolvedEnvironment environment;
    private final DiagnosticSink sink;
    private final boolean dryRun;

    public ExecuteVisitor(ActionInvoker invoker, ResolvedEnvironment environment, DiagnosticSink sink, boolean dryRun) {
        this.invoker = invoker;
        this.environment = environment == null ? new ResolvedEnvironment() : environment;
        this.sink = sink == null ? DiagnosticSink.NONE : sink;
        this.dryRun = dryRun;
    }

    @Override
    public void noStages() {
        sink.info("No stages to execute in pipeline config.");
    }

    @Override
    public boolean visitStage(ParsedStage stage) {
        sink.info(String.format("Executing '%s' stage", stage.declaration().name()));
        return true;
    }

    @Override
    public ActionResult visitAction(StageDeclaration stage, ParsedAction parsed) {
        var action = parsed.declaration();
        var index = action.index();
        var key = stage.actionKey(index);
        var displayName = stage.actionDisplayName(index);
        sink.info(String.format("Executing action number %d from '%s' stage", index, stage.name()));

        if (action.action() == null) {
            if (parsed.actionKeyPresent()) {
                sink.warning(String.format("'action' key in '%s' should be a string, nothing to perform.", displayName));
                return new ActionResult(new ActionOutcome(key, displayName, OutcomeState.FAIL, "invalid action"), false, false);
            }
            sink.warning(String.format("No 'action' key specified, nothing to perform at '%s' action.", displayName));
            return new ActionResult(new ActionOutcome(key, displayName, OutcomeState.FAIL, "no action"), false, false);
        }

        message(Severity.INFO, action.beforeMessage());
        var result = invoke(action, displayName);
        message(Severity.INFO, action.afterMessage());
        if (result.success()) {
            message(Severity.INFO, action.successMessage());
        } else {
            message(Severity.ERROR, action.failMessage());
        }

        var passed = result.success() || action.ignoreFail();
        var outcome = new ActionOutcome(key, displayName, OutcomeState.of(passed), result.description());
        return new ActionResult(outcome, passed, !result.success() && action.stopOnFail());
    }

    private InvocationResult invoke(ActionDeclaration action, String displayName) {
        if (dryRun) {
            sink.info(String.format("Dry-run mode: '%s' action of '%s' is not performed.", action.action(), displayName));
            return InvocationResult.success(DRY_RUN_LINK);
        }
        if (invoker == null) {
            return InvocationResult.failure("No action invoker configured");
        }
        try {
            var result = invoker.invoke(action.action(), action.node(), environment);
            return result == null ? InvocationResult.failure("Action returned no result") : result;
        } catch (Exception ex) {
            var description = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            sink.error(String.format("Action '%s' in '%s' failed: %s", action.action(), displayName, description));
            return InvocationResult.failure(description);
        }
    }

    private void message(Severity severity, String text) {
        if (text != null) {
            sink.emit(severity, text);
        }
    }
}
