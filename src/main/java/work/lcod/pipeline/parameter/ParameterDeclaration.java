package work.lcod.pipeline.parameter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.lcod.pipeline.shared.ValuePredicates;

/**
 * Read-only view of one parameter item from the settings document. Conversion is total: values of
 * the wrong shape become absent rather than coerced, and the raw item is kept for diagnostics.
 */
public record ParameterDeclaration(
    String name,
    ParameterKind kind,
    Object defaultValue,
    List<String> choices,
    String description,
    boolean trim,
    Object regex,
    Optional<RegexReplace> regexReplace,
    Optional<OnEmptyPolicy> onEmpty,
    Map<String, Object> raw
) {
    public static ParameterDeclaration from(Map<String, Object> item) {
        var raw = item == null ? Map.<String, Object>of() : item;
        var nameRaw = raw.get("name");
        String name = ValuePredicates.isPosixName(nameRaw) ? nameRaw.toString() : null;
        List<String> choices = null;
        if (raw.get("choices") instanceof List<?> list) {
            choices = new ArrayList<>();
            for (var choice : list) {
                choices.add(String.valueOf(choice));
            }
        }
        var descriptionRaw = raw.get("description");
        return new ParameterDeclaration(
            name,
            ParameterKind.resolve(raw),
            raw.get("default"),
            choices,
            ValuePredicates.isStringConvertible(descriptionRaw) ? descriptionRaw.toString() : "",
            ValuePredicates.toBoolean(raw.get("trim")),
            raw.get("regex"),
            RegexReplace.from(raw.get("regex_replace")),
            OnEmptyPolicy.from(raw.get("on_empty")),
            raw
        );
    }

    public boolean hasValidName() {
        return name != null;
    }

    public String printableName() {
        return ValuePredicates.printableName(raw);
    }
}
