package work.lcod.pipeline.runtime;

public record WalkResult(StatusReport report, boolean allPassed) {}
