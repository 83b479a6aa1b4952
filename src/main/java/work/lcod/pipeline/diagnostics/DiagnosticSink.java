package work.lcod.pipeline.diagnostics;

/**
 * Receives diagnostics produced while checking or running a pipeline. Return values are never inspected.
 */
@FunctionalInterface
public interface DiagnosticSink {
    DiagnosticSink NONE = (severity, message) -> {};

    void emit(Severity severity, String message);

    default void debug(String message) {
        emit(Severity.DEBUG, message);
    }

    default void info(String message) {
        emit(Severity.INFO, message);
    }

    default void warning(String message) {
        emit(Severity.WARNING, message);
    }

    default void error(String message) {
        emit(Severity.ERROR, message);
    }

    /**
     * A view of this sink that drops everything below {@code threshold}.
     */
    default DiagnosticSink atLeast(Severity threshold) {
        return (severity, message) -> {
            if (severity.isAtLeast(threshold)) {
                emit(severity, message);
            }
        };
    }
}
