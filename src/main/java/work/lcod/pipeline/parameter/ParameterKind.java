package work.lcod.pipeline.parameter;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import work.lcod.pipeline.shared.ValuePredicates;

/**
 * Parameter kinds a settings document may declare. {@link #UNSET} marks a declaration whose kind is
 * neither declared (with a known value) nor inferable.
 */
public enum ParameterKind {
    STRING,
    TEXT,
    PASSWORD,
    BOOLEAN,
    CHOICE,
    UNSET;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a declared {@code type} value; anything but one of the five kinds is empty.
     */
    public static Optional<ParameterKind> fromDeclared(Object raw) {
        if (!(raw instanceof String str)) {
            return Optional.empty();
        }
        for (var kind : values()) {
            if (kind != UNSET && kind.key().equals(str.trim())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Kind inferred from structure alone: a {@code choices} list wins over a boolean {@code default}.
     */
    public static Optional<Inference> infer(Map<String, Object> item) {
        if (ValuePredicates.isProbablyChoice(item)) {
            return Optional.of(new Inference(CHOICE, "choices"));
        }
        if (ValuePredicates.isProbablyBoolean(item)) {
            return Optional.of(new Inference(BOOLEAN, "default"));
        }
        return Optional.empty();
    }

    /**
     * Explicit {@code type} first, inference second, {@link #UNSET} otherwise.
     */
    public static ParameterKind resolve(Map<String, Object> item) {
        if (item.containsKey("type")) {
            return fromDeclared(item.get("type")).orElse(UNSET);
        }
        return infer(item).map(Inference::kind).orElse(UNSET);
    }

    public record Inference(ParameterKind kind, String triggerKey) {}
}
