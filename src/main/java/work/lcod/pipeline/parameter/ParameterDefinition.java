package work.lcod.pipeline.parameter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A concrete parameter ready to be injected into the host. {@code defaultValue} is a {@link String}
 * for string/text/password, a {@link Boolean} for boolean and {@code null} for choice parameters.
 */
public record ParameterDefinition(
    String name,
    ParameterKind kind,
    Object defaultValue,
    List<String> choices,
    String description,
    boolean trim
) {
    public ParameterDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        choices = choices == null ? List.of() : List.copyOf(choices);
        description = description == null ? "" : description;
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        map.put("type", kind.key());
        if (kind == ParameterKind.CHOICE) {
            map.put("choices", choices);
        } else {
            map.put("default", defaultValue);
        }
        map.put("description", description);
        if (kind == ParameterKind.STRING) {
            map.put("trim", trim);
        }
        return map;
    }
}
