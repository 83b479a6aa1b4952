package work.lcod.pipeline.runtime;

import work.lcod.pipeline.diagnostics.DiagnosticSink;
import work.lcod.pipeline.runtime.StageParser.ParsedAction;
import work.lcod.pipeline.runtime.StageParser.ParsedStage;

/**
 * Structural check pass. Has no side effects beyond diagnostics, so running it twice gives the same result.
 */
public final class CheckVisitor implements PipelineVisitor {
    private final DiagnosticSink sink;

    public CheckVisitor(DiagnosticSink sink) {
        this.sink = sink == null ? DiagnosticSink.NONE : sink;
    }

    @Override
    public void noStages() {
        sink.debug("No stages to check in pipeline config.");
    }

    @Override
    public boolean visitStage(ParsedStage stage) {
        sink.debug(String.format("Checking '%s' stage", stage.declaration().name()));
        return stage.structureOk();
    }

    @Override
    public ActionResult visitAction(StageDeclaration stage, ParsedAction action) {
        var declaration = action.declaration();
        sink.debug(String.format("Checking action number %d from '%s' stage", declaration.index(), stage.name()));
        var outcome = new ActionOutcome(
            stage.actionKey(declaration.index()),
            stage.actionDisplayName(declaration.index()),
            OutcomeState.of(action.structureOk()),
            declaration.action()
        );
        return new ActionResult(outcome, action.structureOk(), false);
    }

    @Override
    public boolean allowsParallel() {
        return false;
    }
}
