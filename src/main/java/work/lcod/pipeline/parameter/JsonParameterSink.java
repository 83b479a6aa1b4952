package work.lcod.pipeline.parameter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes injected parameter definitions as a pretty-printed JSON array.
 */
public final class JsonParameterSink implements ParameterSink {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    private final Path target;

    public JsonParameterSink(Path target) {
        this.target = target.toAbsolutePath().normalize();
    }

    public Path target() {
        return target;
    }

    @Override
    public void inject(List<ParameterDefinition> definitions) {
        List<Map<String, Object>> payload = new ArrayList<>();
        for (var definition : definitions) {
            payload.add(definition.toSerializableMap());
        }
        try {
            var parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            WRITER.writeValue(target.toFile(), payload);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write pipeline parameters to " + target, ex);
        }
    }
}
