package work.lcod.pipeline.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.pipeline.support.PipelineTestSupport.map;
import static work.lcod.pipeline.support.PipelineTestSupport.yaml;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import work.lcod.pipeline.diagnostics.Diagnostics;
import work.lcod.pipeline.diagnostics.Severity;
import work.lcod.pipeline.parameter.ParameterDefinition;
import work.lcod.pipeline.parameter.ParameterSettings;
import work.lcod.pipeline.parameter.ReconcileDecision;
import work.lcod.pipeline.runtime.InvocationResult;
import work.lcod.pipeline.runtime.OutcomeState;
import work.lcod.pipeline.runtime.ResolvedEnvironment;

class PipelineEngineTest {
    private final Diagnostics diagnostics = Diagnostics.recording();
    private final List<List<ParameterDefinition>> injected = new ArrayList<>();
    private final PipelineEngine engine = new PipelineEngine(
        (action, node, env) -> InvocationResult.success(action),
        injected::add,
        diagnostics
    );

    @AfterEach
    void close() {
        engine.close();
    }

    @Test
    void validateCombinesParameterAndStageChecks() {
        var good = yaml("""
            parameters:
              required:
                - name: VERSION
                  type: string
            stages:
              - name: A
                actions:
                  - action: run
            """);
        var badParameter = yaml("""
            parameters:
              optional:
                - name: 1BAD
                  type: string
            stages:
              - name: A
                actions:
                  - action: run
            """);

        assertTrue(engine.validate(good));
        assertFalse(engine.validate(badParameter));
        assertTrue(injected.isEmpty());
    }

    @Test
    void reconcileInjectsAndHaltsWhenParametersAreMissing() {
        var declarations = List.of(map("name", "VERSION", "type", "string"));

        var reconciliation = engine.reconcileParameters(declarations, Map.of());

        assertEquals(ReconcileDecision.HALT, reconciliation.decision());
        assertEquals(1, injected.size());
        assertEquals("VERSION", injected.get(0).get(0).name());
    }

    @Test
    void reconcileProceedsWhenParametersMatch() {
        var declarations = List.of(map("name", "VERSION", "type", "string"));
        assertEquals(ReconcileDecision.PROCEED, engine.reconcileParameters(declarations, Map.of("VERSION", "1"), false).decision());
    }

    @Test
    void enforceAndRegexMutateEnvironment() {
        var settings = yaml("""
            parameters:
              required:
                - name: TARGET
                  type: string
                  on_empty:
                    assign: $FALLBACK
                  regex_replace:
                    regex: "-"
                    to: "_"
            """);
        var env = ResolvedEnvironment.of(Map.of("FALLBACK", "eu-west"));

        assertTrue(engine.enforceParameters(settings, env));
        assertTrue(engine.processParameterRegex(ParameterSettings.required(settings), env));
        assertEquals("eu_west", env.get("TARGET"));
    }

    @Test
    void executeReturnsStatusAndEnvironment() {
        var env = new ResolvedEnvironment();
        var report = engine.execute(yaml("""
            stages:
              - name: A
                actions:
                  - action: run
            """), env, false);

        assertTrue(report.allPassed());
        assertEquals(OutcomeState.OK, report.status().get("0-A[0]").state());
        assertSame(env, report.environment());
    }

    @Test
    void checkStagesForwardsDiagnostics() {
        var result = engine.checkStages(yaml("stages: oops\n"));

        assertFalse(result.allPassed());
        assertEquals(1, diagnostics.count(Severity.ERROR));
    }
}
