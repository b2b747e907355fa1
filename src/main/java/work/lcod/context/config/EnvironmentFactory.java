package work.lcod.context.config;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.context.api.EnvironmentSupplier;
import work.lcod.context.runtime.Environment;

/**
 * Combines application configuration and shared handles with per-request payloads into environments.
 */
public final class EnvironmentFactory {
    static final String REQUEST_ID_KEY = "requestId";

    private final Map<String, Object> configuration;
    private final Map<String, Object> handles;

    public EnvironmentFactory(Map<String, Object> configuration, Map<String, Object> handles) {
        this.configuration = configuration == null ? Map.of() : new LinkedHashMap<>(configuration);
        this.handles = handles == null ? Map.of() : new LinkedHashMap<>(handles);
    }

    public static EnvironmentFactory fromConfigFile(Path configFile) {
        Map<String, Object> configuration = configFile == null ? Map.of() : ConfigurationLoader.load(configFile);
        return new EnvironmentFactory(configuration, Map.of());
    }

    public Map<String, Object> configuration() {
        return configuration;
    }

    public Environment create(Map<String, Object> request) {
        var builder = Environment.builder()
            .configuration(configuration)
            .handles(handles)
            .request(request);
        if (request != null && request.get(REQUEST_ID_KEY) instanceof String id && !id.isBlank()) {
            builder.requestId(id);
        }
        return builder.build();
    }

    /**
     * Defers reading {@code requestFile} until the runner asks for the environment, so read or
     * parse errors surface as environment failures.
     */
    public EnvironmentSupplier forRequestFile(Path requestFile) {
        return () -> create(RequestLoader.load(requestFile));
    }

    public EnvironmentSupplier forPayload(String payload) {
        return () -> create(RequestLoader.parse(payload));
    }
}
