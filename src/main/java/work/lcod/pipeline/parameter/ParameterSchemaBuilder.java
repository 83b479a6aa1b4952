package work.lcod.pipeline.parameter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.lcod.pipeline.shared.ValuePredicates;

/**
 * Turns parameter declarations into injectable {@link ParameterDefinition}s. Items that cannot be
 * typed or named emit nothing; reporting them is {@link ParameterValidator}'s job.
 */
public final class ParameterSchemaBuilder {
    public Optional<ParameterDefinition> build(Map<String, Object> item) {
        if (item == null || !ValuePredicates.isPosixName(item.get("name"))) {
            return Optional.empty();
        }
        var declaration = ParameterDeclaration.from(item);
        var name = declaration.name();
        var description = declaration.description();
        var defaultString = item.containsKey("default") && item.get("default") != null
            ? item.get("default").toString()
            : "";
        return switch (declaration.kind()) {
            case CHOICE -> declaration.choices() == null || declaration.choices().isEmpty()
                ? Optional.empty()
                : Optional.of(new ParameterDefinition(name, ParameterKind.CHOICE, null, declaration.choices(), description, false));
            case BOOLEAN -> Optional.of(new ParameterDefinition(
                name,
                ParameterKind.BOOLEAN,
                item.containsKey("default") && ValuePredicates.toBoolean(item.get("default")),
                List.of(),
                description,
                false
            ));
            case STRING -> Optional.of(new ParameterDefinition(name, ParameterKind.STRING, defaultString, List.of(), description, declaration.trim()));
            case TEXT, PASSWORD -> Optional.of(new ParameterDefinition(name, declaration.kind(), defaultString, List.of(), description, false));
            case UNSET -> Optional.empty();
        };
    }

    public List<ParameterDefinition> buildAll(List<Map<String, Object>> items) {
        var definitions = new ArrayList<ParameterDefinition>();
        if (items == null) {
            return definitions;
        }
        for (var item : items) {
            build(item).ifPresent(definitions::add);
        }
        return definitions;
    }
}
