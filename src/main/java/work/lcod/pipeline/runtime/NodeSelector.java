package work.lcod.pipeline.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Where an action should run: any host, a host by name, or hosts carrying a label. {@code pattern}
 * asks the host provider to treat the value as a pattern.
 */
public record NodeSelector(Kind kind, String value, boolean pattern) {
    public static final NodeSelector ANY = new NodeSelector(Kind.ANY, null, false);

    public enum Kind {
        ANY,
        NAME,
        LABEL
    }

    public static NodeSelector byName(String name, boolean pattern) {
        return new NodeSelector(Kind.NAME, name, pattern);
    }

    public static NodeSelector byLabel(String label, boolean pattern) {
        return new NodeSelector(Kind.LABEL, label, pattern);
    }

    /**
     * Run node for the whole pipeline: a non-blank label parameter wins over the name parameter.
     */
    public static NodeSelector fromEnvironment(ResolvedEnvironment environment, String nameParameter, String labelParameter) {
        if (environment.isDefined(labelParameter)) {
            return byLabel(environment.get(labelParameter), false);
        }
        if (environment.isDefined(nameParameter)) {
            return byName(environment.get(nameParameter), false);
        }
        return ANY;
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        if (kind == Kind.ANY) {
            return map;
        }
        map.put(kind == Kind.NAME ? "name" : "label", value);
        if (pattern) {
            map.put("pattern", true);
        }
        return map;
    }

    public String display() {
        return switch (kind) {
            case ANY -> "any node";
            case NAME -> "node '" + value + "'";
            case LABEL -> "label '" + value + "'";
        };
    }
}
