package work.lcod.pipeline.runtime;

/**
 * Outcome of one action invocation. {@code description} ends up as the status link.
 */
public record InvocationResult(boolean success, String description) {
    public InvocationResult {
        description = description == null ? "" : description;
    }

    public static InvocationResult success(String description) {
        return new InvocationResult(true, description);
    }

    public static InvocationResult failure(String description) {
        return new InvocationResult(false, description);
    }
}
