package work.lcod.pipeline.parameter;

import java.util.List;

/**
 * Applies a freshly built parameter set to the host so that the next run sees it.
 */
@FunctionalInterface
public interface ParameterSink {
    ParameterSink NONE = definitions -> {};

    void inject(List<ParameterDefinition> definitions);
}
