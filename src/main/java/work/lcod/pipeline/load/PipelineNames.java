package work.lcod.pipeline.load;

import java.nio.file.Path;
import java.util.List;

/**
 * Derives the settings document location from a pipeline name.
 */
public final class PipelineNames {
    private PipelineNames() {}

    /**
     * {@code <settings_prefix>/<name without name_regex_replace matches>.yaml}, relative to {@code baseDirectory}.
     */
    public static Path settingsPath(RunnerSettings settings, String pipelineName, Path baseDirectory) {
        var fileName = applyReplaceRegexItems(pipelineName, settings.nameRegexReplace(), List.of()) + ".yaml";
        return baseDirectory.resolve(settings.settingsPrefix()).resolve(fileName);
    }

    /**
     * Applies each pattern in order. A pattern without a replacement at the same index is removed.
     */
    public static String applyReplaceRegexItems(String text, List<String> patterns, List<String> replacements) {
        var result = text;
        for (int i = 0; i < patterns.size(); i++) {
            var replacement = replacements != null && i < replacements.size() ? replacements.get(i) : "";
            result = result.replaceAll(patterns.get(i), replacement);
        }
        return result;
    }
}
