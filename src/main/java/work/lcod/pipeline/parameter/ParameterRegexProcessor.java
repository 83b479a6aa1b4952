package work.lcod.pipeline.parameter;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import work.lcod.pipeline.diagnostics.DiagnosticSink;
import work.lcod.pipeline.runtime.ResolvedEnvironment;
import work.lcod.pipeline.shared.ValuePredicates;

/**
 * Validates parameter values against their {@code regex} key and rewrites them with {@code regex_replace}.
 */
public final class ParameterRegexProcessor {
    private static final String FIX_HINT = " Please fix them. Otherwise, replacement will be skipped with an error.";

    private final DiagnosticSink sink;

    public ParameterRegexProcessor(DiagnosticSink sink) {
        this.sink = sink == null ? DiagnosticSink.NONE : sink;
    }

    public boolean process(List<Map<String, Object>> items, ResolvedEnvironment environment) {
        var allCorrect = true;
        if (items == null) {
            return true;
        }
        for (var item : items) {
            var declaration = ParameterDeclaration.from(item);
            if (declaration.raw().containsKey("regex")) {
                allCorrect = validate(declaration, environment) && allCorrect;
            }
            if (declaration.regexReplace().isPresent()) {
                allCorrect = rewrite(declaration, declaration.regexReplace().get(), environment) && allCorrect;
            }
        }
        return allCorrect;
    }

    /**
     * A list of regex items is concatenated in order into one pattern.
     */
    static String patternOf(Object regex) {
        if (regex instanceof List<?> list) {
            var builder = new StringBuilder();
            for (var part : list) {
                builder.append(part == null ? "" : part.toString());
            }
            return builder.toString();
        }
        return regex == null ? "" : regex.toString();
    }

    private boolean validate(ParameterDeclaration declaration, ResolvedEnvironment environment) {
        var pattern = patternOf(declaration.regex());
        if (pattern.isBlank()) {
            return true;
        }
        var printable = declaration.printableName();
        sink.debug(String.format("Found '%s' regex for pipeline parameter '%s'.", pattern, printable));
        if (!declaration.hasValidName() || !environment.isDefined(declaration.name())) {
            return true;
        }
        try {
            if (Pattern.compile(pattern).matcher(environment.get(declaration.name())).matches()) {
                return true;
            }
            sink.error(String.format("%s parameter is incorrect due to regex mismatch.", printable));
        } catch (PatternSyntaxException ex) {
            sink.error(String.format("Invalid regex '%s' for pipeline parameter '%s': %s", pattern, printable, ex.getDescription()));
        }
        return false;
    }

    private boolean rewrite(ParameterDeclaration declaration, RegexReplace replace, ResolvedEnvironment environment) {
        var printable = declaration.printableName();
        var ok = true;

        var replacement = "";
        var to = replace.replacement();
        if (to != null && !ValuePredicates.isStringConvertible(to)) {
            sink.error(String.format("Wrong type of 'to' value sub-key of 'regex_replace' for '%s' pipeline parameter.%s", printable, FIX_HINT));
            ok = false;
        } else if (to != null) {
            replacement = to.toString();
        }

        var regex = replace.pattern();
        if (ValuePredicates.isBlank(regex)) {
            sink.error(String.format("'regex' sub-key value of 'regex_replace' wasn't defined for '%s' pipeline parameter.%s", printable, FIX_HINT));
            return false;
        }
        if (!ValuePredicates.isStringConvertible(regex)) {
            sink.error(String.format("Wrong type of 'regex' value sub-key of 'regex_replace' for '%s' pipeline parameter.%s", printable, FIX_HINT));
            return false;
        }
        if (!ok) {
            return false;
        }
        if (replacement.isBlank()) {
            sink.warning(String.format("'to' sub-key value of 'regex_replace' wasn't defined for '%s' pipeline parameter. Regex match(es) will be removed.", printable));
            replacement = "";
        }
        if (!declaration.hasValidName()) {
            sink.error(String.format("Replace '%s' regex to '%s' is not possible: 'name' key is not defined for pipeline parameter item. "
                + "Please fix pipeline config. Otherwise, replacement will be skipped with an error.", regex, replacement));
            return false;
        }
        if (!environment.isDefined(declaration.name())) {
            return true;
        }
        sink.debug(String.format("Replacing '%s' regex to '%s' in '%s' pipeline parameter value...", regex, replacement, printable));
        try {
            var current = environment.get(declaration.name());
            environment.put(declaration.name(), Pattern.compile(regex.toString()).matcher(current).replaceAll(replacement));
            return true;
        } catch (IllegalArgumentException | IndexOutOfBoundsException ex) {
            sink.error(String.format("Unable to replace '%s' regex in '%s' pipeline parameter value: %s", regex, printable, ex.getMessage()));
            return false;
        }
    }
}
