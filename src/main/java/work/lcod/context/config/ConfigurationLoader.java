package work.lcod.context.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.context.api.RunnerSettings;
import work.lcod.context.shared.DurationParser;

/**
 * Reads application configuration from TOML into plain nested maps and lists.
 *
 * <pre>
 * [runtime]
 * timeout = "30s"
 *
 * [app]
 * name = "demo"
 * </pre>
 */
public final class ConfigurationLoader {
    private ConfigurationLoader() {}

    public static Map<String, Object> load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try {
            return toMap(check(Toml.parse(path), path.toString()));
        } catch (IOException ex) {
            throw new ConfigurationException("Unable to read configuration " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static Map<String, Object> parse(String toml) {
        if (toml == null || toml.isBlank()) {
            return Map.of();
        }
        return toMap(check(Toml.parse(toml), "inline configuration"));
    }

    /**
     * Derives runner settings from the {@code [runtime]} table; missing keys keep the defaults.
     */
    public static RunnerSettings runnerSettings(Map<String, Object> configuration) {
        var builder = RunnerSettings.builder();
        Object runtime = configuration == null ? null : configuration.get("runtime");
        if (runtime instanceof Map<?, ?> table) {
            Object timeout = table.get("timeout");
            if (timeout instanceof Number millis) {
                builder.timeout(DurationParser.parse(String.valueOf(millis.longValue())));
            } else if (timeout != null) {
                try {
                    builder.timeout(DurationParser.parse(String.valueOf(timeout)));
                } catch (IllegalArgumentException ex) {
                    throw new ConfigurationException("Invalid runtime.timeout: " + ex.getMessage(), ex);
                }
            }
        }
        return builder.build();
    }

    private static TomlParseResult check(TomlParseResult result, String source) {
        if (result.hasErrors()) {
            String errors = result.errors().stream()
                .map(Object::toString)
                .collect(Collectors.joining("; "));
            throw new ConfigurationException("Invalid configuration in " + source + ": " + errors);
        }
        return result;
    }

    static Map<String, Object> toMap(TomlTable table) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String key : table.keySet()) {
            map.put(key, convert(table.get(Collections.singletonList(key))));
        }
        return map;
    }

    private static Object convert(Object value) {
        if (value instanceof TomlTable table) {
            return toMap(table);
        }
        if (value instanceof TomlArray array) {
            List<Object> list = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                list.add(convert(array.get(i)));
            }
            return list;
        }
        return value;
    }
}
