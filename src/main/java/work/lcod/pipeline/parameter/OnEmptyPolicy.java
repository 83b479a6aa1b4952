package work.lcod.pipeline.parameter;

import java.util.Map;
import java.util.Optional;
import work.lcod.pipeline.shared.ValuePredicates;

/**
 * What to do when a required parameter is unset: assign it from a variable or literal, then fail or warn.
 */
public record OnEmptyPolicy(String assign, boolean fail, boolean warn) {
    public static final OnEmptyPolicy DEFAULT = new OnEmptyPolicy(null, true, false);

    public static Optional<OnEmptyPolicy> from(Object raw) {
        var map = ValuePredicates.asMap(raw);
        if (map == null || map.isEmpty()) {
            return Optional.empty();
        }
        var assignRaw = map.get("assign");
        String assign = ValuePredicates.isStringConvertible(assignRaw) && !assignRaw.toString().isBlank()
            ? assignRaw.toString()
            : null;
        boolean fail = !map.containsKey("fail") || map.get("fail") == null || ValuePredicates.toBoolean(map.get("fail"));
        boolean warn = map.containsKey("warn") && ValuePredicates.toBoolean(map.get("warn"));
        return Optional.of(new OnEmptyPolicy(assign, fail, warn));
    }

    public boolean hasAssignment() {
        return assign != null;
    }

    /**
     * {@code $NAME} and {@code ${NAME}} reference another variable; anything else is a literal.
     */
    public boolean assignsFromVariable() {
        return assign != null && assign.startsWith("$");
    }

    public String referencedVariable() {
        return assignsFromVariable() ? stripReference(assign) : null;
    }

    static String stripReference(String reference) {
        return reference.replaceAll("[${}]", "");
    }
}
