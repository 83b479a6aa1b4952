package work.lcod.pipeline.api;

import java.util.List;

/**
 * Ends a failed run with every failure category collected along the way.
 */
public final class PipelineFailureException extends RuntimeException {
    private final List<String> reasons;

    public PipelineFailureException(List<String> reasons) {
        super(String.join(" ", reasons) + " Please fix then re-build.");
        this.reasons = List.copyOf(reasons);
    }

    public List<String> reasons() {
        return reasons;
    }
}
