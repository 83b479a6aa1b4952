package work.lcod.pipeline.runtime;

/**
 * Raised after a stage joins when one of its failing actions had {@code stop_on_fail} enabled.
 * Carries the status collected up to that point.
 */
public final class TerminalAbortException extends RuntimeException {
    private final transient StatusReport report;

    public TerminalAbortException(String actionDisplayName, StatusReport report) {
        super(String.format("Terminating current pipeline run due to an error in '%s' ('stop_on_fail' is enabled for current action).",
            actionDisplayName));
        this.report = report == null ? new StatusReport() : report;
    }

    public StatusReport report() {
        return report;
    }
}
