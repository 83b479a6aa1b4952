package work.lcod.pipeline.load;

import java.util.List;
import java.util.Objects;

/**
 * Runner-wide configuration read from {@code pipeline.toml}.
 *
 * @param settingsPrefix relative directory of the settings documents
 * @param nameRegexReplace patterns removed from the pipeline name to build the settings file name
 * @param nodeParameter parameter naming the node to run on
 * @param nodeLabelParameter parameter naming the node label to run on
 * @param defaultNodeLabel default value of the node label parameter, blank for none
 */
public record RunnerSettings(
    String settingsPrefix,
    List<String> nameRegexReplace,
    String nodeParameter,
    String nodeLabelParameter,
    String defaultNodeLabel
) {
    public static final String DEFAULT_SETTINGS_PREFIX = "settings";
    public static final List<String> DEFAULT_NAME_REGEX_REPLACE = List.of("^(admin|devops|qa)_");
    public static final String DEFAULT_NODE_PARAMETER = "NODE_NAME";
    public static final String DEFAULT_NODE_LABEL_PARAMETER = "NODE_TAG";
    public static final String DEFAULT_NODE_LABEL = "ansible210";

    public RunnerSettings {
        Objects.requireNonNull(settingsPrefix, "settingsPrefix");
        Objects.requireNonNull(nodeParameter, "nodeParameter");
        Objects.requireNonNull(nodeLabelParameter, "nodeLabelParameter");
        nameRegexReplace = nameRegexReplace == null ? List.of() : List.copyOf(nameRegexReplace);
        defaultNodeLabel = defaultNodeLabel == null || defaultNodeLabel.isBlank() ? null : defaultNodeLabel;
    }

    public static RunnerSettings defaults() {
        return new RunnerSettings(
            DEFAULT_SETTINGS_PREFIX,
            DEFAULT_NAME_REGEX_REPLACE,
            DEFAULT_NODE_PARAMETER,
            DEFAULT_NODE_LABEL_PARAMETER,
            DEFAULT_NODE_LABEL
        );
    }
}
