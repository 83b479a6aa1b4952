package work.lcod.pipeline.demo;

import work.lcod.pipeline.runtime.ActionRegistry;
import work.lcod.pipeline.runtime.InvocationResult;
import work.lcod.pipeline.runtime.NodeSelector;
import work.lcod.pipeline.runtime.ResolvedEnvironment;

/**
 * Demo actions so settings documents can be tried out without a real action backend.
 */
public final class DemoActions {
    public static final String ECHO = "demo/echo";
    public static final String FAIL = "demo/fail";
    public static final String SLEEP = "demo/sleep";

    private DemoActions() {}

    public static ActionRegistry register(ActionRegistry registry) {
        registry.register(ECHO, DemoActions::echo);
        registry.register(FAIL, DemoActions::fail);
        registry.register(SLEEP, DemoActions::sleep);
        return registry;
    }

    public static InvocationResult echo(String action, NodeSelector node, ResolvedEnvironment environment) {
        return InvocationResult.success(action + " on " + node.display());
    }

    private static InvocationResult fail(String action, NodeSelector node, ResolvedEnvironment environment) {
        return InvocationResult.failure(action + " failed on " + node.display());
    }

    /**
     * Sleeps for {@code DEMO_SLEEP_MS} milliseconds (100 by default), handy to watch parallel stages.
     */
    private static InvocationResult sleep(String action, NodeSelector node, ResolvedEnvironment environment) throws InterruptedException {
        long millis = 100L;
        var raw = environment.get("DEMO_SLEEP_MS");
        if (raw != null && !raw.isBlank()) {
            try {
                millis = Long.parseLong(raw.trim());
            } catch (NumberFormatException ex) {
                return InvocationResult.failure("DEMO_SLEEP_MS is not a number: " + raw);
            }
        }
        Thread.sleep(millis);
        return InvocationResult.success("slept " + millis + "ms on " + node.display());
    }
}
