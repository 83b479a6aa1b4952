package work.lcod.pipeline.load;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads a YAML settings document (local path or HTTP URL) into plain maps, lists and scalars.
 */
public final class PipelineLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private PipelineLoader() {}

    public static Map<String, Object> load(PipelineTarget target) {
        return target.remoteUri()
            .map(PipelineLoader::loadFromHttp)
            .orElseGet(() -> loadFromLocalFile(target.localPath().orElseThrow()));
    }

    public static Map<String, Object> loadFromLocalFile(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new PipelineLoadException("Pipeline settings not found: " + path);
        }
        try (var in = Files.newInputStream(path)) {
            return parseSettings(in, path.toString());
        } catch (IOException ex) {
            throw new PipelineLoadException("Failed to read pipeline settings: " + path, ex);
        }
    }

    public static Map<String, Object> loadFromHttp(URI uri) {
        try {
            var client = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build();
            var request = HttpRequest.newBuilder(uri).GET().build();
            var response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            if (response.statusCode() >= 400) {
                throw new PipelineLoadException("HTTP " + response.statusCode() + " while downloading pipeline settings: " + uri);
            }
            try (var body = response.body()) {
                return parseSettings(body, uri.toString());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new PipelineLoadException("Interrupted while downloading pipeline settings: " + uri, ex);
        } catch (IOException ex) {
            throw new PipelineLoadException("Failed to download pipeline settings: " + uri, ex);
        }
    }

    public static Map<String, Object> parse(String yaml) {
        try {
            return toMap(YAML_MAPPER.readTree(yaml), "inline document");
        } catch (JsonProcessingException ex) {
            throw new PipelineLoadException("Failed to parse pipeline settings: " + ex.getOriginalMessage(), ex);
        }
    }

    private static Map<String, Object> parseSettings(InputStream in, String source) throws IOException {
        return toMap(YAML_MAPPER.readTree(in), source);
    }

    private static Map<String, Object> toMap(JsonNode root, String source) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return new LinkedHashMap<>();
        }
        if (!root.isObject()) {
            throw new PipelineLoadException("Pipeline settings must be a mapping: " + source);
        }
        @SuppressWarnings("unchecked")
        var map = (Map<String, Object>) convertNode(root);
        return map;
    }

    static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
