package work.lcod.pipeline.api;

import work.lcod.pipeline.runtime.ResolvedEnvironment;
import work.lcod.pipeline.runtime.StatusReport;

/**
 * Result of an execute pass: per-action status, the overall verdict and the (possibly mutated) environment.
 */
public record ExecutionReport(StatusReport status, boolean allPassed, ResolvedEnvironment environment) {}
