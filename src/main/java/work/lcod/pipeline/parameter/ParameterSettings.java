package work.lcod.pipeline.parameter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.pipeline.shared.ValuePredicates;

/**
 * Pulls the {@code parameters} section out of a settings document. Items that are not mappings become
 * empty mappings so validators can report them instead of the caller crashing on a cast.
 */
public final class ParameterSettings {
    public static final String UPDATE_PARAMETERS = SchemaReconciler.UPDATE_PARAMETERS;
    public static final String SETTINGS_GIT_BRANCH = "SETTINGS_GIT_BRANCH";
    public static final String DRY_RUN = SchemaReconciler.DRY_RUN;
    public static final String DEBUG_MODE = "DEBUG_MODE";

    private ParameterSettings() {}

    public static List<Map<String, Object>> required(Map<String, Object> settings) {
        return section(settings, "required");
    }

    public static List<Map<String, Object>> optional(Map<String, Object> settings) {
        return section(settings, "optional");
    }

    /**
     * Required, then optional, then the built-ins. Without a {@code parameters} section the list is empty.
     */
    public static List<Map<String, Object>> extract(Map<String, Object> settings, List<Map<String, Object>> builtins) {
        var all = new ArrayList<Map<String, Object>>();
        var parameters = settings == null ? null : ValuePredicates.asMap(settings.get("parameters"));
        if (parameters == null || parameters.isEmpty()) {
            return all;
        }
        all.addAll(required(settings));
        all.addAll(optional(settings));
        if (builtins != null) {
            all.addAll(builtins);
        }
        return all;
    }

    /**
     * Parameters every pipeline carries whether or not its settings declare them.
     */
    public static List<Map<String, Object>> builtins(String nodeParameter, String nodeLabelParameter, String defaultNodeLabel) {
        var list = new ArrayList<Map<String, Object>>();
        list.add(declaration(UPDATE_PARAMETERS, "boolean", false, "Update pipeline parameters from settings file only."));
        list.add(declaration(SETTINGS_GIT_BRANCH, "string", null, "Git branch of pipeline settings (to override defaults on development)."));
        list.add(declaration(nodeParameter, "string", null, "Node name to run."));
        list.add(declaration(nodeLabelParameter, "string", defaultNodeLabel, "Node label to run."));
        list.add(declaration(DRY_RUN, "boolean", null,
            "Dry run mode to use for pipeline settings troubleshooting (will be ignored on pipeline parameters needs to be injected)."));
        list.add(declaration(DEBUG_MODE, "boolean", null, null));
        return list;
    }

    private static Map<String, Object> declaration(String name, String type, Object defaultValue, String description) {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        map.put("type", type);
        if (defaultValue != null) {
            map.put("default", defaultValue);
        }
        if (description != null) {
            map.put("description", description);
        }
        return map;
    }

    private static List<Map<String, Object>> section(Map<String, Object> settings, String key) {
        var items = new ArrayList<Map<String, Object>>();
        var parameters = settings == null ? null : ValuePredicates.asMap(settings.get("parameters"));
        if (parameters == null || !(parameters.get(key) instanceof List<?> list)) {
            return items;
        }
        for (var entry : list) {
            var map = ValuePredicates.asMap(entry);
            items.add(map == null ? new LinkedHashMap<>() : map);
        }
        return items;
    }
}
