package work.lcod.pipeline.load;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;

/**
 * Reads {@code pipeline.toml}. Keys that are missing keep their {@link RunnerSettings#defaults()} value.
 */
public final class RunnerSettingsLoader {
    public static final String FILE_NAME = "pipeline.toml";

    private RunnerSettingsLoader() {}

    /**
     * Looks for {@code pipeline.toml} in the directory; defaults when there is none.
     */
    public static RunnerSettings loadFromDirectory(Path directory) {
        var candidate = directory.resolve(FILE_NAME);
        return Files.isRegularFile(candidate) ? load(candidate) : RunnerSettings.defaults();
    }

    public static RunnerSettings load(Path path) {
        try {
            return parse(Files.readString(path), path.toString());
        } catch (IOException ex) {
            throw new PipelineLoadException("Failed to read runner configuration: " + path, ex);
        }
    }

    public static RunnerSettings parse(String toml, String source) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            throw new PipelineLoadException("Invalid runner configuration " + source + ": " + result.errors().get(0).getMessage());
        }
        var defaults = RunnerSettings.defaults();
        return new RunnerSettings(
            Optional.ofNullable(result.getString("settings_prefix")).orElse(defaults.settingsPrefix()),
            readList(result.getArray("name_regex_replace")).orElse(defaults.nameRegexReplace()),
            Optional.ofNullable(result.getString("node_parameter")).orElse(defaults.nodeParameter()),
            Optional.ofNullable(result.getString("node_label_parameter")).orElse(defaults.nodeLabelParameter()),
            result.contains("default_node_label") ? result.getString("default_node_label") : defaults.defaultNodeLabel()
        );
    }

    private static Optional<List<String>> readList(TomlArray array) {
        if (array == null) {
            return Optional.empty();
        }
        var items = new ArrayList<String>();
        for (int i = 0; i < array.size(); i++) {
            items.add(String.valueOf(array.get(i)));
        }
        return Optional.of(items);
    }
}
