package work.lcod.pipeline.runtime;

public enum OutcomeState {
    OK,
    FAIL;

    public static OutcomeState of(boolean passed) {
        return passed ? OK : FAIL;
    }
}
