package work.lcod.pipeline.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.lcod.pipeline.diagnostics.Diagnostics;
import work.lcod.pipeline.shared.ValuePredicates;

/**
 * Converts raw stage and action items into declarations, reporting structural problems as it goes.
 * The verdicts only count when the reporter is live; execute mode hands in a silent reporter.
 */
public final class StageParser {
    private static final String WRONG_TYPE = "'%s' key in '%s' should be a %s.";
    private static final String EMPTY_KEY = "'%s' key defined for '%s', but it's empty. Remove a key or define it's value.";
    private static final String WRONG_NODE = "Wrong format of node %skey '%s' for '%s' action. %s";

    private final Diagnostics reporter;

    public StageParser(Diagnostics reporter) {
        this.reporter = reporter == null ? Diagnostics.silent() : reporter;
    }

    public Diagnostics reporter() {
        return reporter;
    }

    /**
     * {@code actionKeyPresent} tells a missing {@code action} key apart from one of the wrong type.
     */
    public record ParsedAction(ActionDeclaration declaration, boolean structureOk, boolean actionKeyPresent) {}

    public record ParsedStage(StageDeclaration declaration, List<ParsedAction> actions, boolean structureOk) {}

    private record NodeParse(NodeSelector selector, boolean ok) {}

    /**
     * Raw stage items, or an empty list when the document has none. A non-list value is reported.
     */
    public List<Object> stageItems(Map<String, Object> settings) {
        var raw = settings == null ? null : settings.get("stages");
        if (raw instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        if (raw != null) {
            reporter.error("'stages' key should be a list of stages.");
        }
        return List.of();
    }

    public ParsedStage parseStage(int index, Object rawStage) {
        var stage = ValuePredicates.asMap(rawStage);
        if (stage == null) {
            stage = Map.of();
        }
        var ok = true;
        if (!ValuePredicates.isStringConvertible(stage.get("name"))) {
            reporter.error("Unable to convert stage name to a string, probably it's undefined or empty.");
            ok = false;
        }
        var name = ValuePredicates.printableName(stage);
        var rawActions = stage.get("actions");
        if (!(rawActions instanceof List<?> list) || list.isEmpty()) {
            reporter.error(String.format("Incorrect or undefined actions for '%s' stage.", name));
            ok = false;
        }
        var parallel = false;
        if (stage.containsKey("parallel")) {
            if (ValuePredicates.isBooleanConvertible(stage.get("parallel"))) {
                parallel = ValuePredicates.toBoolean(stage.get("parallel"));
            } else {
                reporter.error(String.format("Unable to determine 'parallel' value for '%s' stage. Remove them or set as boolean.", name));
                ok = false;
            }
        }

        var parsedActions = new ArrayList<ParsedAction>();
        if (rawActions instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                parsedActions.add(parseAction(name + " [" + i + "]", i, list.get(i)));
            }
        }
        var declarations = parsedActions.stream().map(ParsedAction::declaration).toList();
        return new ParsedStage(new StageDeclaration(index, name, parallel, declarations), parsedActions, ok);
    }

    ParsedAction parseAction(String printable, int index, Object rawAction) {
        var item = ValuePredicates.asMap(rawAction);
        if (item == null) {
            item = Map.of();
        }
        var ok = true;
        for (var key : List.of("before_message", "after_message", "success_message", "fail_message")) {
            ok = checkScalarKey(item, key, printable, true) && ok;
        }
        for (var key : List.of("ignore_fail", "stop_on_fail")) {
            ok = checkScalarKey(item, key, printable, false) && ok;
        }

        var node = NodeSelector.ANY;
        if (item.containsKey("node")) {
            var rawNode = item.get("node");
            if (rawNode == null) {
                reporter.debug(String.format("'node' key in '%s' action is null. This stage will run on any free node.", printable));
            } else if (ValuePredicates.isStringConvertible(rawNode)) {
                node = NodeSelector.byName(rawNode.toString(), false);
            } else if (rawNode instanceof Map<?, ?>) {
                var parsed = parseNode(ValuePredicates.asMap(rawNode), printable);
                node = parsed.selector();
                ok = parsed.ok() && ok;
            } else {
                reporter.error(String.format(WRONG_NODE, "", "node", printable, "Key will be ignored."));
                ok = false;
            }
        }

        String action = null;
        if (!item.containsKey("action")) {
            reporter.error(String.format("No 'action' key specified, nothing to check in '%s' action.", printable));
            ok = false;
        } else if (ValuePredicates.isStringConvertible(item.get("action")) && !ValuePredicates.isBlank(item.get("action"))) {
            action = item.get("action").toString();
        } else {
            reporter.error(String.format(WRONG_TYPE, "action", printable, "string"));
            ok = false;
        }

        var declaration = new ActionDeclaration(
            index,
            action,
            node,
            message(item, "before_message"),
            message(item, "after_message"),
            message(item, "success_message"),
            message(item, "fail_message"),
            flag(item, "ignore_fail"),
            flag(item, "stop_on_fail")
        );
        return new ParsedAction(declaration, ok, item.containsKey("action"));
    }

    private NodeParse parseNode(Map<String, Object> node, String printable) {
        var ok = true;
        var hasName = node.containsKey("name");
        var hasLabel = node.containsKey("label");
        if (hasName && hasLabel) {
            reporter.warning("Node sub-keys 'name' and 'label' are incompatible. Please define only one of them.");
        }
        for (var key : List.of("name", "label")) {
            if (node.containsKey(key) && !ValuePredicates.isStringConvertible(node.get(key))) {
                reporter.error(String.format(WRONG_NODE, "sub-", key, printable, "Sub-key should be a string."));
                ok = false;
            }
        }
        var pattern = false;
        if (node.containsKey("pattern")) {
            if (ValuePredicates.isBooleanConvertible(node.get("pattern"))) {
                pattern = ValuePredicates.toBoolean(node.get("pattern"));
            } else {
                reporter.warning(String.format(WRONG_NODE, "sub-", "pattern", printable, "Sub-key should be boolean."));
            }
        }
        var selector = NodeSelector.ANY;
        if (hasLabel && ValuePredicates.isStringConvertible(node.get("label"))) {
            selector = NodeSelector.byLabel(node.get("label").toString(), pattern);
        } else if (hasName && ValuePredicates.isStringConvertible(node.get("name"))) {
            selector = NodeSelector.byName(node.get("name").toString(), pattern);
        }
        return new NodeParse(selector, ok);
    }

    private boolean checkScalarKey(Map<String, Object> item, String key, String printable, boolean isString) {
        if (!item.containsKey(key)) {
            return true;
        }
        var value = item.get(key);
        if (value == null || (value instanceof String str && str.isBlank())) {
            reporter.warning(String.format(EMPTY_KEY, key, printable));
            return true;
        }
        var typeOk = isString ? ValuePredicates.isStringConvertible(value) : ValuePredicates.isBooleanConvertible(value);
        if (!typeOk) {
            reporter.error(String.format(WRONG_TYPE, key, printable, isString ? "string" : "boolean"));
            return false;
        }
        return true;
    }

    private static String message(Map<String, Object> item, String key) {
        var value = item.get(key);
        return ValuePredicates.isStringConvertible(value) && !value.toString().isBlank() ? value.toString() : null;
    }

    private static boolean flag(Map<String, Object> item, String key) {
        var value = item.get(key);
        return ValuePredicates.isBooleanConvertible(value) && ValuePredicates.toBoolean(value);
    }
}
