package work.lcod.pipeline.parameter;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonParameterSinkTest {
    @TempDir
    Path tempDir;

    @Test
    void writesDefinitionsAsJsonArray() throws Exception {
        var target = tempDir.resolve("out/parameters.json");
        new JsonParameterSink(target).inject(List.of(
            new ParameterDefinition("VERSION", ParameterKind.STRING, "1.0", List.of(), "Version", true),
            new ParameterDefinition("CHANNEL", ParameterKind.CHOICE, null, List.of("stable", "beta"), null, false)
        ));

        var tree = new ObjectMapper().readTree(target.toFile());
        assertEquals(2, tree.size());
        assertEquals("VERSION", tree.get(0).get("name").asText());
        assertEquals("string", tree.get(0).get("type").asText());
        assertEquals(true, tree.get(0).get("trim").asBoolean());
        assertEquals("beta", tree.get(1).get("choices").get(1).asText());
    }
}
