package work.lcod.pipeline.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes diagnostics to SLF4J; WARNING maps to {@code warn}.
 */
public final class Slf4jDiagnosticSink implements DiagnosticSink {
    public static final String LOGGER_NAME = "work.lcod.pipeline";

    private final Logger logger;

    public Slf4jDiagnosticSink() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    public Slf4jDiagnosticSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void emit(Severity severity, String message) {
        switch (severity) {
            case DEBUG -> logger.debug(message);
            case INFO -> logger.info(message);
            case WARNING -> logger.warn(message);
            case ERROR -> logger.error(message);
        }
    }
}
