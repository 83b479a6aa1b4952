package work.lcod.pipeline.load;

import java.net.URI;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Where the settings document comes from: a local file or an HTTP(S) URL.
 */
public record PipelineTarget(Optional<Path> localPath, Optional<URI> remoteUri) {
    public PipelineTarget {
        Objects.requireNonNull(localPath, "localPath");
        Objects.requireNonNull(remoteUri, "remoteUri");
        if (localPath.isEmpty() && remoteUri.isEmpty()) {
            throw new IllegalArgumentException("Either localPath or remoteUri must be present.");
        }
    }

    public static PipelineTarget forLocal(Path path) {
        return new PipelineTarget(Optional.of(path), Optional.empty());
    }

    public static PipelineTarget forRemote(URI uri) {
        return new PipelineTarget(Optional.empty(), Optional.of(uri));
    }

    /**
     * {@code http://} and {@code https://} arguments are remote, anything else is a path.
     */
    public static PipelineTarget parse(String value) {
        Objects.requireNonNull(value, "value");
        var lower = value.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return forRemote(URI.create(value));
        }
        return forLocal(Path.of(value));
    }

    public boolean isRemote() {
        return remoteUri.isPresent();
    }

    public String display() {
        return localPath.map(Path::toString).or(() -> remoteUri.map(URI::toString)).orElse("unknown");
    }
}
