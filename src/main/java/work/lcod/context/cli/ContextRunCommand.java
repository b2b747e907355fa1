package work.lcod.context.cli;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.lcod.context.api.EnvironmentSupplier;
import work.lcod.context.api.Outcome;
import work.lcod.context.api.Runner;
import work.lcod.context.api.RunnerSettings;
import work.lcod.context.config.ConfigurationLoader;
import work.lcod.context.config.EnvironmentFactory;
import work.lcod.context.config.RequestLoader;
import work.lcod.context.shared.DurationParser;

@CommandLine.Command(
    name = "context-run",
    description = "Run a built-in handler inside a request-scoped context and print the outcome as JSON.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ContextRunCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(ContextRunCommand.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-H", "--handler"},
        description = "Handler to run (see --list).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String handlerName;

    @CommandLine.Option(
        names = {"-r", "--request"},
        paramLabel = "PATH|-",
        description = "Request payload file (JSON, or YAML by extension); use '-' to read JSON from stdin.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String request;

    @CommandLine.Option(
        names = {"-p", "--payload"},
        description = "Inline JSON request payload (ignored when --request is given).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String payload;

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "TOML application configuration.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--timeout",
        description = "Request timeout (e.g. 500ms, 30s, 2m); overrides runtime.timeout.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--list",
        description = "List built-in handlers and exit."
    )
    private boolean list;

    @Override
    public Integer call() {
        var catalog = HandlerCatalog.builtIn();
        var out = spec.commandLine().getOut();
        if (list) {
            for (var entry : catalog.entries().values()) {
                out.printf("%-10s %s%n", entry.name(), entry.description());
            }
            out.flush();
            return 0;
        }
        if (handlerName == null || handlerName.isBlank()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Missing required option: --handler");
        }
        var entry = catalog.find(handlerName).orElseThrow(() -> new CommandLine.ParameterException(
            spec.commandLine(),
            "Unknown handler: " + handlerName + " (available: " + String.join(", ", catalog.entries().keySet()) + ")"
        ));

        Map<String, Object> configuration = config == null ? Map.of() : ConfigurationLoader.load(config);
        var runner = new Runner(resolveSettings(configuration));
        var factory = new EnvironmentFactory(configuration, Map.of());

        log.info("Running handler {}", entry.name());
        Outcome<Object> outcome = runner.run(environmentSupplier(factory), entry.handler());
        out.println(outcome.toPrettyJson());
        out.flush();
        return outcome.status().exitCode();
    }

    private RunnerSettings resolveSettings(Map<String, Object> configuration) {
        var settings = ConfigurationLoader.runnerSettings(configuration);
        if (timeoutRaw == null || timeoutRaw.isBlank()) {
            return settings;
        }
        try {
            return RunnerSettings.builder().timeout(DurationParser.parse(timeoutRaw)).build();
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage(), ex);
        }
    }

    private EnvironmentSupplier environmentSupplier(EnvironmentFactory factory) {
        if (request == null || request.isBlank()) {
            return factory.forPayload(payload);
        }
        if ("-".equals(request)) {
            return () -> factory.create(RequestLoader.read(System.in));
        }
        return factory.forRequestFile(Path.of(request));
    }
}
