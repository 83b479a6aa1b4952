package work.lcod.pipeline.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records diagnostics, forwards them to a delegate sink, and remembers whether an ERROR was seen.
 * A silent instance drops everything, which is how execute mode converts declarations without re-reporting.
 */
public final class Diagnostics implements DiagnosticSink {
    private final DiagnosticSink delegate;
    private final boolean enabled;
    private final List<Diagnostic> entries = Collections.synchronizedList(new ArrayList<>());

    private Diagnostics(DiagnosticSink delegate, boolean enabled) {
        this.delegate = delegate == null ? DiagnosticSink.NONE : delegate;
        this.enabled = enabled;
    }

    public static Diagnostics recording() {
        return new Diagnostics(DiagnosticSink.NONE, true);
    }

    public static Diagnostics forwardingTo(DiagnosticSink delegate) {
        return new Diagnostics(delegate, true);
    }

    public static Diagnostics silent() {
        return new Diagnostics(DiagnosticSink.NONE, false);
    }

    @Override
    public void emit(Severity severity, String message) {
        if (!enabled) {
            return;
        }
        entries.add(new Diagnostic(severity, message));
        delegate.emit(severity, message);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean hasErrors() {
        return count(Severity.ERROR) > 0;
    }

    public long count(Severity severity) {
        synchronized (entries) {
            return entries.stream().filter(entry -> entry.severity() == severity).count();
        }
    }

    public List<Diagnostic> entries() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    public List<String> messages(Severity severity) {
        synchronized (entries) {
            return entries.stream()
                .filter(entry -> entry.severity() == severity)
                .map(Diagnostic::message)
                .toList();
        }
    }

    public void clear() {
        entries.clear();
    }
}
