package work.lcod.pipeline.load;

/**
 * The settings document or the runner configuration could not be read or parsed.
 */
public final class PipelineLoadException extends RuntimeException {
    public PipelineLoadException(String message) {
        super(message);
    }

    public PipelineLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
