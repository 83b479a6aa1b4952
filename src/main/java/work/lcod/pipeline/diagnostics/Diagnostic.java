package work.lcod.pipeline.diagnostics;

import java.util.Objects;

public record Diagnostic(Severity severity, String message) {
    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        message = message == null ? "" : message;
    }

    @Override
    public String toString() {
        return severity + ": " + message;
    }
}
