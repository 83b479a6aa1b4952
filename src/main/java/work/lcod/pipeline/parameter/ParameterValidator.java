package work.lcod.pipeline.parameter;

import java.util.List;
import java.util.Map;
import work.lcod.pipeline.diagnostics.DiagnosticSink;
import work.lcod.pipeline.shared.ValuePredicates;

/**
 * Checks one parameter declaration for naming, type, default and choices consistency. Every rule is
 * evaluated so a single pass reports all problems; any ERROR makes the verdict false.
 */
public final class ParameterValidator {
    private final DiagnosticSink sink;

    public ParameterValidator(DiagnosticSink sink) {
        this.sink = sink == null ? DiagnosticSink.NONE : sink;
    }

    public boolean validateAll(List<Map<String, Object>> items) {
        var allPass = true;
        if (items == null) {
            return true;
        }
        for (var item : items) {
            allPass = validate(item) && allPass;
        }
        return allPass;
    }

    public boolean validate(Map<String, Object> rawItem) {
        var item = rawItem == null ? Map.<String, Object>of() : rawItem;
        var printable = ValuePredicates.printableName(item);
        var check = new Check(printable);
        sink.debug(String.format("Checking pipeline parameter '%s': %s", printable, item));

        check.error(!item.containsKey("name"), "'name' key is required, but undefined");
        check.error(item.containsKey("name") && !ValuePredicates.isPosixName(item.get("name")), "Invalid parameter name");

        var onEmpty = ValuePredicates.asMap(item.get("on_empty"));
        if (onEmpty != null && onEmpty.get("assign") instanceof String assign && assign.startsWith("$")) {
            check.error(!ValuePredicates.isPosixName(OnEmptyPolicy.stripReference(assign)),
                String.format("Unable to assign due to incorrect variable name: '%s'", assign));
        }

        if (item.containsKey("type")) {
            checkDeclaredType(item, check);
        } else {
            var inference = ParameterKind.infer(item);
            if (inference.isPresent()) {
                check.error(true, String.format("'type' key is not defined, but was detected by '%s' key: %s",
                    inference.get().triggerKey(), inference.get().kind().key()));
            } else {
                var hint = item.containsKey("default") && ValuePredicates.isStringConvertible(item.get("default"))
                    ? ". Probably 'type' is password, string or text"
                    : "";
                check.error(true, "'type' is required, but wasn't defined" + hint);
            }
        }

        check.error(item.containsKey("choices") && item.containsKey("default"), "'default' and 'choices' keys are incompatible");
        check.error(item.containsKey("choices") && !(item.get("choices") instanceof List<?>), "'choices' value is not a list of items");
        return check.ok;
    }

    private void checkDeclaredType(Map<String, Object> item, Check check) {
        var declared = ParameterKind.fromDeclared(item.get("type"));
        if (declared.isEmpty()) {
            check.error(true, String.format("'type' value '%s' is not one of: string, text, password, boolean, choice", item.get("type")));
            return;
        }
        if (declared.get() == ParameterKind.CHOICE && !item.containsKey("choices")) {
            check.error(true, "'type' set as choice while no 'choices' list defined");
        }
        if (declared.get() == ParameterKind.BOOLEAN && item.containsKey("default") && !(item.get("default") instanceof Boolean)) {
            var value = item.get("default");
            check.error(true, String.format("'type' set as boolean while 'default' key is not. It's %s%s",
                ValuePredicates.typeName(value),
                ValuePredicates.isBooleanConvertible(value) ? ", but it's convertible to boolean" : ""));
        }
    }

    private final class Check {
        private final String parameterName;
        private boolean ok = true;

        private Check(String parameterName) {
            this.parameterName = parameterName;
        }

        private void error(boolean condition, String message) {
            if (!condition) {
                return;
            }
            sink.error(String.format("Wrong syntax in pipeline parameter '%s': %s.", parameterName, message));
            ok = false;
        }
    }
}
