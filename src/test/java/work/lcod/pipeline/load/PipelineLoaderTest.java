package work.lcod.pipeline.load;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PipelineLoaderTest {
    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(PipelineLoaderTest.class.getResource("/pipelines/" + name).toURI());
    }

    @Test
    void loadsFixtureIntoPlainCollections() throws Exception {
        var settings = PipelineLoader.load(PipelineTarget.forLocal(fixture("build.yaml")));

        var stages = (List<?>) settings.get("stages");
        assertEquals(2, stages.size());
        var checks = (Map<?, ?>) stages.get(1);
        assertEquals(true, checks.get("parallel"));
        assertEquals(List.of("parameters", "stages"), List.copyOf(settings.keySet()));
    }

    @Test
    void keepsScalarTypes() {
        var settings = PipelineLoader.parse("a: 1\nb: true\nc: ~\nd: text\ne: 1.5\n");

        assertEquals(1, settings.get("a"));
        assertEquals(true, settings.get("b"));
        assertTrue(settings.containsKey("c"));
        assertEquals(null, settings.get("c"));
        assertEquals("text", settings.get("d"));
        assertEquals(1.5, settings.get("e"));
    }

    @Test
    void malformedDocumentIsReported() {
        var ex = assertThrows(PipelineLoadException.class, () -> PipelineLoader.parse("stages: [unclosed\n"));
        assertTrue(ex.getMessage().startsWith("Failed to parse pipeline settings: "));
    }

    @Test
    void emptyDocumentIsEmptyMapping() {
        assertTrue(PipelineLoader.parse("").isEmpty());
    }

    @Test
    void rootMustBeAMapping() throws Exception {
        var path = fixture("list-root.yaml");
        var ex = assertThrows(PipelineLoadException.class, () -> PipelineLoader.loadFromLocalFile(path));
        assertTrue(ex.getMessage().startsWith("Pipeline settings must be a mapping"));
    }

    @Test
    void missingFileIsReported(@TempDir Path tempDir) {
        var missing = tempDir.resolve("nope.yaml");
        var ex = assertThrows(PipelineLoadException.class, () -> PipelineLoader.loadFromLocalFile(missing));
        assertEquals("Pipeline settings not found: " + missing, ex.getMessage());
    }

    @Test
    void targetParsingDistinguishesUrls() {
        assertTrue(PipelineTarget.parse("HTTPS://example.org/build.yaml").isRemote());
        assertFalse(PipelineTarget.parse("settings/build.yaml").isRemote());
        assertEquals("settings/build.yaml", PipelineTarget.parse("settings/build.yaml").display());
    }
}
