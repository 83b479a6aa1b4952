package work.lcod.pipeline.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parameter and variable values of one pipeline run, shared by reference and mutated in place by the
 * required-parameter enforcer, the regex rewriter and actions. Writes from parallel actions are not
 * serialized beyond the map's own atomicity.
 */
public final class ResolvedEnvironment {
    private final Map<String, String> values = new ConcurrentHashMap<>();

    public ResolvedEnvironment() {}

    public ResolvedEnvironment(Map<String, ?> initial) {
        if (initial != null) {
            initial.forEach((key, value) -> put(key, value == null ? null : String.valueOf(value)));
        }
    }

    public static ResolvedEnvironment of(Map<String, ?> initial) {
        return new ResolvedEnvironment(initial);
    }

    public String get(String name) {
        return name == null ? null : values.get(name);
    }

    public boolean contains(String name) {
        return name != null && values.containsKey(name);
    }

    /**
     * A variable is defined when it holds a non-blank value.
     */
    public boolean isDefined(String name) {
        var value = get(name);
        return value != null && !value.isBlank();
    }

    public boolean flag(String name) {
        var value = get(name);
        return value != null && "true".equalsIgnoreCase(value.trim());
    }

    public void put(String name, String value) {
        if (name == null) {
            return;
        }
        if (value == null) {
            values.remove(name);
        } else {
            values.put(name, value);
        }
    }

    public Map<String, String> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(new TreeMap<>(values)));
    }

    @Override
    public String toString() {
        return snapshot().toString();
    }
}
