package work.lcod.context.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Loads request payloads (JSON, or YAML for {@code .yaml}/{@code .yml} files) into maps.
 */
public final class RequestLoader {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private RequestLoader() {}

    public static Map<String, Object> load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ConfigurationException("Request file not found: " + path);
        }
        var mapper = isYaml(path) ? YAML : JSON;
        try {
            return normalize(mapper.readValue(path.toFile(), MAP_REF));
        } catch (IOException ex) {
            throw new ConfigurationException("Invalid request payload in " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static Map<String, Object> read(InputStream in) {
        try {
            return normalize(JSON.readValue(in, MAP_REF));
        } catch (IOException ex) {
            throw new ConfigurationException("Invalid request payload: " + ex.getMessage(), ex);
        }
    }

    public static Map<String, Object> parse(String payload) {
        if (payload == null || payload.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return normalize(JSON.readValue(payload, MAP_REF));
        } catch (IOException ex) {
            throw new ConfigurationException("Invalid request payload: " + ex.getMessage(), ex);
        }
    }

    private static boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    private static Map<String, Object> normalize(Map<String, Object> parsed) {
        return parsed == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parsed);
    }
}
