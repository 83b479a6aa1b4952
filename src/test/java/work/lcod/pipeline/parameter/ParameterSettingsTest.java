package work.lcod.pipeline.parameter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.pipeline.support.PipelineTestSupport.yaml;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ParameterSettingsTest {
    @Test
    void extractsRequiredOptionalThenBuiltins() {
        var settings = yaml("""
            parameters:
              required:
                - name: A
                  type: string
              optional:
                - name: B
                  type: text
            """);
        var builtins = ParameterSettings.builtins("NODE_NAME", "NODE_TAG", "ansible210");
        var names = ParameterSettings.extract(settings, builtins).stream().map(item -> item.get("name")).toList();

        assertEquals(List.of("A", "B", "UPDATE_PARAMETERS", "SETTINGS_GIT_BRANCH", "NODE_NAME", "NODE_TAG", "DRY_RUN", "DEBUG_MODE"), names);
    }

    @Test
    void noParametersSectionMeansNoParameters() {
        var settings = yaml("stages: []\n");
        assertTrue(ParameterSettings.extract(settings, ParameterSettings.builtins("N", "T", null)).isEmpty());
    }

    @Test
    void nonMappingItemsBecomeEmptyMappings() {
        var settings = yaml("""
            parameters:
              required:
                - just a string
                - name: A
            """);
        var required = ParameterSettings.required(settings);

        assertEquals(2, required.size());
        assertEquals(Map.of(), required.get(0));
    }

    @Test
    void builtinNodeParametersFollowConfiguration() {
        var builtins = ParameterSettings.builtins("HOST", "HOST_LABEL", "linux");
        var label = builtins.get(3);

        assertEquals("HOST", builtins.get(2).get("name"));
        assertEquals("HOST_LABEL", label.get("name"));
        assertEquals("linux", label.get("default"));
        assertTrue(new ParameterValidator(null).validateAll(builtins));
    }
}
