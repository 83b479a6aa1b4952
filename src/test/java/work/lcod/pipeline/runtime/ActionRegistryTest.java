package work.lcod.pipeline.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ActionRegistryTest {
    private final ResolvedEnvironment env = new ResolvedEnvironment();

    @Test
    void dispatchesByActionReference() throws Exception {
        var registry = new ActionRegistry()
            .register("build", (action, node, environment) -> InvocationResult.success("built on " + node.display()));

        var result = registry.invoke("build", NodeSelector.byLabel("linux", false), env);

        assertTrue(result.success());
        assertEquals("built on label 'linux'", result.description());
    }

    @Test
    void unknownActionFailsWithoutFallback() throws Exception {
        var result = new ActionRegistry().invoke("missing", NodeSelector.ANY, env);

        assertFalse(result.success());
        assertEquals("Action not registered: missing", result.description());
    }

    @Test
    void fallbackHandlesUnknownActions() throws Exception {
        var registry = new ActionRegistry()
            .setFallback((action, node, environment) -> InvocationResult.success("fallback " + action));

        assertEquals("fallback anything", registry.invoke("anything", NodeSelector.ANY, env).description());
    }

    @Test
    void unregisterRemovesEntry() {
        var registry = new ActionRegistry().register("a", (action, node, environment) -> InvocationResult.success(""));
        registry.unregister("a");
        registry.unregister(null);

        assertNull(registry.get("a"));
        assertTrue(registry.entries().isEmpty());
    }
}
