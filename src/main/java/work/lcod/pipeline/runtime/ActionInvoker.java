package work.lcod.pipeline.runtime;

/**
 * Performs the domain work behind an action reference. A thrown exception is reported as a failed action.
 */
@FunctionalInterface
public interface ActionInvoker {
    InvocationResult invoke(String action, NodeSelector node, ResolvedEnvironment environment) throws Exception;
}
