package work.lcod.pipeline.runtime;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps action references to invokers, with an optional fallback for references nobody registered.
 */
public final class ActionRegistry implements ActionInvoker {
    private final Map<String, ActionInvoker> actions = new ConcurrentHashMap<>();
    private volatile ActionInvoker fallback;

    public ActionRegistry register(String action, ActionInvoker invoker) {
        actions.put(action, invoker);
        return this;
    }

    public ActionRegistry setFallback(ActionInvoker invoker) {
        this.fallback = invoker;
        return this;
    }

    public ActionInvoker get(String action) {
        return action == null ? null : actions.get(action);
    }

    public void unregister(String action) {
        if (action != null) {
            actions.remove(action);
        }
    }

    public Map<String, ActionInvoker> entries() {
        return Collections.unmodifiableMap(actions);
    }

    @Override
    public InvocationResult invoke(String action, NodeSelector node, ResolvedEnvironment environment) throws Exception {
        var invoker = get(action);
        if (invoker == null) {
            invoker = fallback;
        }
        if (invoker == null) {
            return InvocationResult.failure("Action not registered: " + action);
        }
        return invoker.invoke(action, node, environment);
    }
}
