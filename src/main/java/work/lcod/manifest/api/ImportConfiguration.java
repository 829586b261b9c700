package work.lcod.manifest.api;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable settings of one import run.
 *
 * <p>Types and schemas always come from the catalog. Objects come from {@code apiServer} when one is set,
 * otherwise from the catalog too.
 */
public record ImportConfiguration(
    String typeName,
    String importId,
    Path catalogFile,
    Optional<URI> apiServer,
    Optional<String> bearerToken,
    Optional<Duration> timeout,
    LogLevel logLevel
) {
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    public ImportConfiguration {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(importId, "importId");
        Objects.requireNonNull(catalogFile, "catalogFile");
        Objects.requireNonNull(apiServer, "apiServer");
        Objects.requireNonNull(bearerToken, "bearerToken");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Per-request timeout for the API server: the import timeout when set, a fixed default otherwise.
     */
    public Duration requestTimeout() {
        return timeout.filter(value -> !value.isZero()).orElse(DEFAULT_REQUEST_TIMEOUT);
    }

    public static final class Builder {
        private String typeName = "kubernetes_manifest";
        private String importId;
        private Path catalogFile;
        private Optional<URI> apiServer = Optional.empty();
        private Optional<String> bearerToken = Optional.empty();
        private Optional<Duration> timeout = Optional.empty();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder typeName(String typeName) {
            this.typeName = typeName;
            return this;
        }

        public Builder importId(String importId) {
            this.importId = importId;
            return this;
        }

        public Builder catalogFile(Path catalogFile) {
            this.catalogFile = catalogFile;
            return this;
        }

        public Builder apiServer(Optional<URI> apiServer) {
            this.apiServer = apiServer;
            return this;
        }

        public Builder bearerToken(Optional<String> bearerToken) {
            this.bearerToken = bearerToken;
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public ImportConfiguration build() {
            return new ImportConfiguration(
                typeName,
                importId,
                catalogFile,
                apiServer,
                bearerToken,
                timeout,
                logLevel
            );
        }
    }
}
