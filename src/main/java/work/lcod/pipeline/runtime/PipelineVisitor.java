package work.lcod.pipeline.runtime;

import work.lcod.pipeline.runtime.StageParser.ParsedAction;
import work.lcod.pipeline.runtime.StageParser.ParsedStage;

/**
 * Behavior plugged into {@link PipelineWalker}. The walker owns the order; visitors decide what a
 * stage or an action means in their mode.
 */
public interface PipelineVisitor {
    /**
     * The document has no stages.
     */
    void noStages();

    /**
     * Called before the stage's actions; the return value is the stage's own verdict.
     */
    boolean visitStage(ParsedStage stage);

    ActionResult visitAction(StageDeclaration stage, ParsedAction action);

    /**
     * Whether {@code parallel: true} stages may fan out. Visitors that must produce deterministic
     * output answer false.
     */
    default boolean allowsParallel() {
        return true;
    }
}
