package work.lcod.pipeline.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StatusReportTest {
    @Test
    void keysStripWhitespaceFromStageName() {
        var stage = new StageDeclaration(3, "Build and\tTest", false, List.of());

        assertEquals("3-BuildandTest[0]", stage.actionKey(0));
        assertEquals("Build and\tTest [0]", stage.actionDisplayName(0));
    }

    @Test
    void serializesInInsertionOrder() {
        var report = new StatusReport();
        report.put(new ActionOutcome("1-B[0]", "B [0]", OutcomeState.FAIL, "x"));
        report.put(new ActionOutcome("0-A[0]", "A [0]", OutcomeState.OK, "y"));

        var serialized = report.toSerializableMap();

        assertEquals(List.of("1-B[0]", "0-A[0]"), List.copyOf(serialized.keySet()));
        assertEquals(Map.of("name", "B [0]", "state", "FAIL", "link", "x"), serialized.get("1-B[0]"));
    }

    @Test
    void putAllMergesAndIgnoresSelf() {
        var first = new StatusReport();
        var second = new StatusReport();
        second.put(new ActionOutcome("0-A[0]", "A [0]", OutcomeState.OK, ""));

        first.putAll(second);
        first.putAll(first);
        first.putAll(null);

        assertEquals(1, first.size());
        assertTrue(new StatusReport().isEmpty());
    }
}
