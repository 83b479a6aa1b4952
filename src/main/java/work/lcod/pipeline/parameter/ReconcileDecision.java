package work.lcod.pipeline.parameter;

/**
 * What the run should do after parameter reconciliation. {@link #HALT} is a clean stop, not a failure.
 */
public enum ReconcileDecision {
    PROCEED,
    HALT,
    FAIL
}
