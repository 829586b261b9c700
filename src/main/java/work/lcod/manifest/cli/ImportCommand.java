package work.lcod.manifest.cli;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.manifest.api.ImportConfiguration;
import work.lcod.manifest.api.ImportRunner;
import work.lcod.manifest.api.LogLevel;
import work.lcod.manifest.shared.DurationParser;
import work.lcod.manifest.shared.Logging;

@CommandLine.Command(
    name = "manifest-import",
    description = "Import a live cluster object into managed state.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ImportCommand implements Callable<Integer> {
    static final String ENV_LOG_LEVEL = "MANIFEST_IMPORT_LOG_LEVEL";
    static final String ENV_SERVER = "MANIFEST_IMPORT_SERVER";
    static final String ENV_TOKEN = "MANIFEST_IMPORT_TOKEN";

    @CommandLine.Parameters(
        index = "0",
        paramLabel = "ID",
        description = "Import ID: <apiVersion>#<Kind>#[<namespace>#]<name>, e.g. v1#Secret#default#my-secret."
    )
    private String importId;

    @CommandLine.Option(
        names = {"-t", "--type"},
        description = "Resource type name to import into.",
        defaultValue = "kubernetes_manifest"
    )
    private String typeName;

    @CommandLine.Option(
        names = {"-c", "--catalog"},
        required = true,
        paramLabel = "PATH",
        description = "YAML/JSON catalog describing resource types, schemas and (offline) objects."
    )
    private String catalog;

    @CommandLine.Option(
        names = "--server",
        paramLabel = "URL",
        description = "API server to read the live object from (default: objects listed in the catalog).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String server;

    @CommandLine.Option(
        names = "--token",
        description = "Bearer token for --server.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String token;

    @CommandLine.Option(
        names = "--timeout",
        description = "Import timeout (e.g. 500ms, 30s, 1m30s).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        LogLevel logLevel = LogLevel.from(firstNonBlank(logLevelRaw, System.getenv(ENV_LOG_LEVEL)));
        Logging.configure(logLevel);

        Path catalogFile = Paths.get(catalog).toAbsolutePath().normalize();
        if (!Files.isRegularFile(catalogFile)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Catalog not found: " + catalogFile);
        }
        Optional<Duration> timeout = parseTimeout();

        ImportConfiguration configuration = ImportConfiguration.builder()
            .typeName(typeName)
            .importId(importId)
            .catalogFile(catalogFile)
            .apiServer(Optional.ofNullable(firstNonBlank(server, System.getenv(ENV_SERVER))).map(this::parseServer))
            .bearerToken(Optional.ofNullable(firstNonBlank(token, System.getenv(ENV_TOKEN))))
            .timeout(timeout)
            .logLevel(logLevel)
            .build();

        var result = new ImportRunner().run(configuration);
        spec.commandLine().getOut().println(result.toPrettyJson());
        spec.commandLine().getOut().flush();
        return result.status().exitCode();
    }

    private Optional<Duration> parseTimeout() {
        try {
            return DurationParser.parse(timeoutRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage(), ex);
        }
    }

    private URI parseServer(String value) {
        try {
            var uri = new URI(value);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new URISyntaxException(value, "expected an absolute http(s) URL");
            }
            return uri;
        } catch (URISyntaxException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid --server: " + ex.getMessage());
        }
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second == null || second.isBlank() ? null : second;
    }
}
