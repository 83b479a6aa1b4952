package work.lcod.pipeline.runtime;

/**
 * What a visitor reports for one action: the status entry, the verdict it contributes to the walk,
 * and whether the run must terminate once the current stage has joined.
 */
public record ActionResult(ActionOutcome outcome, boolean passed, boolean abortRun) {}
