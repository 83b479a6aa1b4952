package work.lcod.pipeline.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import work.lcod.pipeline.diagnostics.Diagnostics;
import work.lcod.pipeline.runtime.StageParser.ParsedAction;

/**
 * Walks stages in declared order and the actions of each stage either sequentially or, for
 * {@code parallel: true} stages, fanned out on a worker pool that is joined before the next stage.
 */
public final class PipelineWalker implements AutoCloseable {
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final ExecutorService executor;

    public PipelineWalker() {
        this.executor = Executors.newCachedThreadPool(daemonThreads("lcod-pipeline-" + POOL_SEQUENCE.incrementAndGet()));
    }

    public WalkResult check(Map<String, Object> settings, Diagnostics reporter) {
        return walk(settings, new StageParser(reporter), new CheckVisitor(reporter));
    }

    /**
     * @throws TerminalAbortException when a failing action had {@code stop_on_fail} enabled
     */
    public WalkResult execute(Map<String, Object> settings, ExecuteVisitor visitor) {
        return walk(settings, new StageParser(Diagnostics.silent()), visitor);
    }

    public WalkResult walk(Map<String, Object> settings, StageParser parser, PipelineVisitor visitor) {
        var report = new StatusReport();
        var allPassed = true;
        var hasStagesKey = settings != null && settings.get("stages") != null;
        var stages = parser.stageItems(settings);
        if (stages.isEmpty()) {
            visitor.noStages();
            return new WalkResult(report, !hasStagesKey || settings.get("stages") instanceof List<?>);
        }

        for (int index = 0; index < stages.size(); index++) {
            var parsed = parser.parseStage(index, stages.get(index));
            allPassed = visitor.visitStage(parsed) && allPassed;
            var stage = parsed.declaration();
            List<ActionResult> results = stage.parallel() && visitor.allowsParallel()
                ? fanOut(stage, parsed.actions(), visitor)
                : runSequentially(stage, parsed.actions(), visitor);

            String abortedBy = null;
            for (var result : results) {
                report.put(result.outcome());
                allPassed = result.passed() && allPassed;
                if (result.abortRun() && abortedBy == null) {
                    abortedBy = result.outcome().name();
                }
            }
            if (abortedBy != null) {
                throw new TerminalAbortException(abortedBy, report);
            }
        }
        return new WalkResult(report, allPassed);
    }

    private List<ActionResult> runSequentially(StageDeclaration stage, List<ParsedAction> actions, PipelineVisitor visitor) {
        var results = new ArrayList<ActionResult>();
        for (var action : actions) {
            var result = visitor.visitAction(stage, action);
            results.add(result);
            if (result.abortRun()) {
                break;
            }
        }
        return results;
    }

    private List<ActionResult> fanOut(StageDeclaration stage, List<ParsedAction> actions, PipelineVisitor visitor) {
        var futures = new ArrayList<Future<ActionResult>>();
        for (var action : actions) {
            futures.add(executor.submit(() -> visitor.visitAction(stage, action)));
        }
        var results = new ArrayList<ActionResult>();
        RuntimeException failure = null;
        for (var future : futures) {
            try {
                results.add(future.get());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for '" + stage.name() + "' stage actions", ex);
            } catch (ExecutionException ex) {
                var cause = ex.getCause();
                if (failure == null) {
                    failure = cause instanceof RuntimeException runtime
                        ? runtime
                        : new IllegalStateException("Action of '" + stage.name() + "' stage failed", cause);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return results;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, prefix + "-action-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
