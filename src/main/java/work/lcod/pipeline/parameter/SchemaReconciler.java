package work.lcod.pipeline.parameter;

import java.util.List;
import java.util.Map;
import work.lcod.pipeline.diagnostics.DiagnosticSink;
import work.lcod.pipeline.shared.ValuePredicates;

/**
 * Compares declared parameters with the caller's active ones and, when they differ, injects a fresh
 * parameter set and asks the run to halt so the operator can re-run with the parameters visible.
 */
public final class SchemaReconciler {
    public static final String UPDATE_PARAMETERS = "UPDATE_PARAMETERS";
    public static final String DRY_RUN = "DRY_RUN";

    private final ParameterSchemaBuilder builder;
    private final ParameterSink parameterSink;
    private final DiagnosticSink sink;

    public SchemaReconciler(ParameterSchemaBuilder builder, ParameterSink parameterSink, DiagnosticSink sink) {
        this.builder = builder == null ? new ParameterSchemaBuilder() : builder;
        this.parameterSink = parameterSink == null ? ParameterSink.NONE : parameterSink;
        this.sink = sink == null ? DiagnosticSink.NONE : sink;
    }

    /**
     * Dry-run mode is read from the active {@code DRY_RUN} parameter.
     */
    public Reconciliation reconcile(List<Map<String, Object>> declarations, Map<String, ?> activeParameters) {
        var active = activeParameters == null ? Map.<String, Object>of() : activeParameters;
        return reconcile(declarations, active, ValuePredicates.toBoolean(active.get(DRY_RUN)));
    }

    public Reconciliation reconcile(List<Map<String, Object>> declarations, Map<String, ?> activeParameters, boolean dryRun) {
        var active = activeParameters == null ? Map.<String, Object>of() : activeParameters;
        var items = declarations == null ? List.<Map<String, Object>>of() : declarations;
        sink.info("Checking that current pipeline parameters are the same with pipeline settings...");

        var updateRequired = false;
        var allValid = true;
        for (var item : items) {
            var name = item.get("name");
            if (!ValuePredicates.isPosixName(name)) {
                var reason = ValuePredicates.isStringConvertible(name) ? " (parameter name didn't met POSIX standards)" : "";
                sink.warning("Skipping parameter from pipeline settings: 'name' key for pipeline parameter is undefined or incorrect value specified" + reason + ".");
                continue;
            }
            if (!item.containsKey("type") && ParameterKind.infer(item).isEmpty()) {
                sink.warning(String.format("Parameter '%s' from pipeline settings might be ignored: 'type' key for pipeline parameter is undefined or incorrect value specified.",
                    ValuePredicates.printableName(item)));
                allValid = false;
            }
            if (!active.containsKey(name.toString())) {
                updateRequired = true;
            }
        }

        var forced = ValuePredicates.toBoolean(active.get(UPDATE_PARAMETERS));
        if (!updateRequired && !forced) {
            return new Reconciliation(false, allValid, ReconcileDecision.PROCEED, List.of());
        }

        sink.info("Current pipeline parameters requires an update from settings. Updating"
            + (dryRun ? " will be skipped in dry-run mode." : "..."));
        var definitions = builder.buildAll(items);
        if (!dryRun) {
            parameterSink.inject(definitions);
        }
        if (!allValid) {
            sink.error("Pipeline parameters injection failed. Check pipeline config and run again.");
            return new Reconciliation(true, false, ReconcileDecision.FAIL, dryRun ? List.of() : definitions);
        }
        if (dryRun) {
            sink.warning("Pipeline parameters weren't injected. Disable dry-run mode and run again.");
        } else {
            sink.warning("Pipeline parameters were successfully injected. Select 'Build with parameters' and run again.");
        }
        return new Reconciliation(true, true, ReconcileDecision.HALT, dryRun ? List.of() : definitions);
    }
}
