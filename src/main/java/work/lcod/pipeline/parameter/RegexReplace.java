package work.lcod.pipeline.parameter;

import java.util.Map;
import java.util.Optional;
import work.lcod.pipeline.shared.ValuePredicates;

/**
 * Raw {@code regex_replace} sub-keys. Types are checked by {@link ParameterRegexProcessor} so it can
 * report them.
 */
public record RegexReplace(Object pattern, Object replacement, boolean replacementDeclared) {
    public static Optional<RegexReplace> from(Object raw) {
        Map<String, Object> map = ValuePredicates.asMap(raw);
        if (map == null || map.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new RegexReplace(map.get("regex"), map.get("to"), map.containsKey("to")));
    }
}
