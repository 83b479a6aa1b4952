package work.lcod.pipeline.parameter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.pipeline.support.PipelineTestSupport.anyMessageContains;
import static work.lcod.pipeline.support.PipelineTestSupport.map;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.pipeline.diagnostics.Diagnostics;
import work.lcod.pipeline.diagnostics.Severity;

class SchemaReconcilerTest {
    private final List<List<ParameterDefinition>> injections = new ArrayList<>();
    private final Diagnostics diagnostics = Diagnostics.recording();
    private final SchemaReconciler reconciler = new SchemaReconciler(new ParameterSchemaBuilder(), injections::add, diagnostics);

    private final List<Map<String, Object>> declarations = List.of(
        map("name", "VERSION", "type", "string"),
        map("name", "CLEAN", "type", "boolean", "default", false)
    );

    @Test
    void proceedsWhenEveryParameterIsActive() {
        var result = reconciler.reconcile(declarations, Map.of("VERSION", "1", "CLEAN", "false"));

        assertEquals(ReconcileDecision.PROCEED, result.decision());
        assertFalse(result.updateRequired());
        assertTrue(result.allValid());
        assertTrue(injections.isEmpty());
    }

    @Test
    void injectsAndHaltsWhenAParameterIsMissing() {
        var result = reconciler.reconcile(declarations, Map.of("VERSION", "1"));

        assertEquals(ReconcileDecision.HALT, result.decision());
        assertTrue(result.updateRequired());
        assertTrue(result.halted());
        assertEquals(1, injections.size());
        assertEquals(List.of("VERSION", "CLEAN"), injections.get(0).stream().map(ParameterDefinition::name).toList());
        assertTrue(anyMessageContains(diagnostics, Severity.WARNING, "successfully injected"));
    }

    @Test
    void dryRunHaltsWithoutInjecting() {
        var result = reconciler.reconcile(declarations, Map.of("DRY_RUN", "true"));

        assertEquals(ReconcileDecision.HALT, result.decision());
        assertTrue(injections.isEmpty());
        assertTrue(result.injected().isEmpty());
        assertTrue(anyMessageContains(diagnostics, Severity.INFO, "will be skipped in dry-run mode"));
    }

    @Test
    void updateFlagForcesInjection() {
        var result = reconciler.reconcile(declarations, Map.of("VERSION", "1", "CLEAN", "true", "UPDATE_PARAMETERS", "true"));

        assertEquals(ReconcileDecision.HALT, result.decision());
        assertTrue(result.updateRequired());
        assertEquals(1, injections.size());
    }

    @Test
    void failsInjectionWhenADeclarationCannotBeTyped() {
        var items = List.of(map("name", "VERSION", "type", "string"), map("name", "HOST", "default", "x"));
        var result = reconciler.reconcile(items, Map.of());

        assertEquals(ReconcileDecision.FAIL, result.decision());
        assertFalse(result.allValid());
        assertTrue(anyMessageContains(diagnostics, Severity.WARNING, "'HOST' from pipeline settings might be ignored"));
        assertTrue(anyMessageContains(diagnostics, Severity.ERROR, "Pipeline parameters injection failed"));
    }

    @Test
    void untypedButActiveDeclarationOnlyMarksInvalid() {
        var items = List.of(map("name", "HOST", "default", "x"));
        var result = reconciler.reconcile(items, Map.of("HOST", "h"));

        assertEquals(ReconcileDecision.PROCEED, result.decision());
        assertFalse(result.allValid());
    }

    @Test
    void skipsDeclarationsWithInvalidNames() {
        var items = List.of(map("name", "VERSION", "type", "string"), map("name", "NOT-POSIX", "type", "string"), map("type", "text"));
        var result = reconciler.reconcile(items, Map.of("VERSION", "1"));

        assertEquals(ReconcileDecision.PROCEED, result.decision());
        assertTrue(result.allValid());
        assertEquals(2, diagnostics.messages(Severity.WARNING).size());
        assertTrue(anyMessageContains(diagnostics, Severity.WARNING, "didn't met POSIX standards"));
    }

    @Test
    void untypedDeclarationWithInvalidNameIsOnlySkipped() {
        var items = List.of(map("name", "VERSION", "type", "string"), map("name", "bad-name", "default", "x"));
        var result = reconciler.reconcile(items, Map.of("VERSION", "1"));

        assertEquals(ReconcileDecision.PROCEED, result.decision());
        assertTrue(result.allValid());
        assertEquals(List.of("Skipping parameter from pipeline settings: 'name' key for pipeline parameter is undefined or incorrect "
            + "value specified (parameter name didn't met POSIX standards)."), diagnostics.messages(Severity.WARNING));
    }
}
