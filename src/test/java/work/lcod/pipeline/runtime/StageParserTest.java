package work.lcod.pipeline.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.pipeline.support.PipelineTestSupport.anyMessageContains;
import static work.lcod.pipeline.support.PipelineTestSupport.errors;
import static work.lcod.pipeline.support.PipelineTestSupport.map;
import static work.lcod.pipeline.support.PipelineTestSupport.warnings;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.pipeline.diagnostics.Diagnostics;
import work.lcod.pipeline.diagnostics.Severity;

class StageParserTest {
    private final Diagnostics diagnostics = Diagnostics.recording();
    private final StageParser parser = new StageParser(diagnostics);

    @Test
    void labelWinsOverNameWithWarning() {
        var parsed = parser.parseAction("Build [0]", 0, map("action", "compile", "node", map("name", "n1", "label", "linux")));

        assertTrue(parsed.structureOk());
        assertEquals(NodeSelector.byLabel("linux", false), parsed.declaration().node());
        assertEquals(List.of("Node sub-keys 'name' and 'label' are incompatible. Please define only one of them."), warnings(diagnostics));
    }

    @Test
    void nodeAsStringSelectsByName() {
        var parsed = parser.parseAction("Build [0]", 0, map("action", "compile", "node", "builder-1"));
        assertEquals(NodeSelector.byName("builder-1", false), parsed.declaration().node());
    }

    @Test
    void nullNodeMeansAnyHost() {
        var parsed = parser.parseAction("Build [0]", 0, map("action", "compile", "node", null));

        assertTrue(parsed.structureOk());
        assertEquals(NodeSelector.ANY, parsed.declaration().node());
        assertTrue(anyMessageContains(diagnostics, Severity.DEBUG, "will run on any free node"));
    }

    @Test
    void nodeOfWrongTypeIsIgnoredWithError() {
        var parsed = parser.parseAction("Build [0]", 0, map("action", "compile", "node", List.of("a")));

        assertFalse(parsed.structureOk());
        assertEquals(NodeSelector.ANY, parsed.declaration().node());
        assertEquals(List.of("Wrong format of node key 'node' for 'Build [0]' action. Key will be ignored."), errors(diagnostics));
    }

    @Test
    void nonBooleanPatternIsDroppedWithWarning() {
        var parsed = parser.parseAction("Build [0]", 0, map("action", "compile", "node", map("label", "linux", "pattern", "maybe")));

        assertTrue(parsed.structureOk());
        assertFalse(parsed.declaration().node().pattern());
        assertTrue(anyMessageContains(diagnostics, Severity.WARNING, "sub-key 'pattern'"));
    }

    @Test
    void patternFlagIsKept() {
        var parsed = parser.parseAction("Build [0]", 0, map("action", "compile", "node", map("name", "web-.*", "pattern", true)));
        assertEquals(NodeSelector.byName("web-.*", true), parsed.declaration().node());
    }

    @Test
    void nonStringNodeSubKeyIsAnError() {
        var parsed = parser.parseAction("Build [0]", 0, map("action", "compile", "node", map("name", List.of("x"))));
        assertFalse(parsed.structureOk());
        assertTrue(anyMessageContains(diagnostics, Severity.ERROR, "sub-key 'name'"));
    }

    @Test
    void messageAndPolicyKeysAreTypeChecked() {
        var parsed = parser.parseAction("Build [1]", 1, map(
            "action", "compile",
            "before_message", List.of("x"),
            "after_message", "",
            "ignore_fail", "sometimes",
            "stop_on_fail", null
        ));

        assertFalse(parsed.structureOk());
        assertEquals(List.of(
            "'before_message' key in 'Build [1]' should be a string.",
            "'ignore_fail' key in 'Build [1]' should be a boolean."
        ), errors(diagnostics));
        assertEquals(2, warnings(diagnostics).size());
        assertNull(parsed.declaration().beforeMessage());
        assertFalse(parsed.declaration().ignoreFail());
    }

    @Test
    void booleanFalseIsNotBlank() {
        var parsed = parser.parseAction("Build [0]", 0, map("action", "compile", "ignore_fail", false, "stop_on_fail", "true"));

        assertTrue(parsed.structureOk());
        assertTrue(warnings(diagnostics).isEmpty());
        assertTrue(parsed.declaration().stopOnFail());
    }

    @Test
    void missingActionIsAnError() {
        var parsed = parser.parseAction("Build [0]", 0, map("node", "x"));

        assertFalse(parsed.structureOk());
        assertNull(parsed.declaration().action());
        assertEquals(List.of("No 'action' key specified, nothing to check in 'Build [0]' action."), errors(diagnostics));
    }

    @Test
    void stageStructureIsChecked() {
        var parsed = parser.parseStage(0, map("name", true, "actions", List.of(), "parallel", "sometimes"));

        assertFalse(parsed.structureOk());
        assertEquals(List.of(
            "Unable to convert stage name to a string, probably it's undefined or empty.",
            "Incorrect or undefined actions for '<undefined>' stage.",
            "Unable to determine 'parallel' value for '<undefined>' stage. Remove them or set as boolean."
        ), errors(diagnostics));
    }

    @Test
    void stageConvertsAllActions() {
        var parsed = parser.parseStage(2, map("name", "Deploy", "parallel", "true", "actions", List.of(map("action", "a"), map("action", "b"))));

        assertTrue(parsed.structureOk());
        assertTrue(parsed.declaration().parallel());
        assertEquals(2, parsed.declaration().actions().size());
        assertEquals("2-Deploy[1]", parsed.declaration().actionKey(1));
    }

    @Test
    void silentReporterStillConverts() {
        var silent = new StageParser(Diagnostics.silent());
        var parsed = silent.parseAction("Build [0]", 0, map("node", List.of()));

        assertFalse(parsed.structureOk());
        assertTrue(silent.reporter().entries().isEmpty());
    }
}
