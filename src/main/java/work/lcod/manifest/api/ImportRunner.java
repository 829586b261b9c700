package work.lcod.manifest.api;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.tinylog.Logger;
import work.lcod.manifest.catalog.ClusterCatalog;
import work.lcod.manifest.discovery.TypeResolver;
import work.lcod.manifest.pipeline.CancellationToken;
import work.lcod.manifest.pipeline.ImportContext;
import work.lcod.manifest.pipeline.ImportException;
import work.lcod.manifest.pipeline.ImportPipeline;
import work.lcod.manifest.pipeline.ImportRequest;
import work.lcod.manifest.schema.SchemaCache;
import work.lcod.manifest.schema.SchemaResolver;
import work.lcod.manifest.state.ImportAssembler;
import work.lcod.manifest.state.ResourceTypes;
import work.lcod.manifest.state.StateSerializer;
import work.lcod.manifest.store.HttpObjectStore;
import work.lcod.manifest.store.ObjectFetcher;
import work.lcod.manifest.store.ObjectStore;

/**
 * Public entry point for embedding the importer. Failures never escape as exceptions: they come back as
 * diagnostics on the {@link ImportResult}.
 *
 * <p>One runner keeps one {@link SchemaCache}; reuse the runner to share schemas between imports.
 */
public final class ImportRunner {
    private final SchemaCache schemaCache;
    private final ResourceTypes resourceTypes;
    private final StateSerializer serializer = new StateSerializer();

    public ImportRunner() {
        this(new SchemaCache(), ResourceTypes.defaults());
    }

    public ImportRunner(SchemaCache schemaCache, ResourceTypes resourceTypes) {
        this.schemaCache = Objects.requireNonNull(schemaCache, "schemaCache");
        this.resourceTypes = Objects.requireNonNull(resourceTypes, "resourceTypes");
    }

    public ImportResult run(ImportConfiguration configuration) {
        return run(configuration, new CancellationToken());
    }

    public ImportResult run(ImportConfiguration configuration, CancellationToken token) {
        var started = Instant.now();
        ClusterCatalog catalog;
        try {
            catalog = ClusterCatalog.load(configuration.catalogFile());
        } catch (IllegalStateException ex) {
            return ImportResult.failure(List.of(Diagnostic.error("Failed to load cluster catalog", describe(ex))), started);
        }
        ObjectStore store = configuration.apiServer()
            .<ObjectStore>map(server -> new HttpObjectStore(server, configuration.bearerToken(), configuration.requestTimeout()))
            .orElse(catalog);
        var pipeline = new ImportPipeline(
            new TypeResolver(catalog),
            new ObjectFetcher(store),
            new SchemaResolver(catalog, schemaCache),
            new ImportAssembler(resourceTypes, serializer)
        );
        var context = new ImportContext(token, configuration.timeout().filter(timeout -> !timeout.isZero()));
        return run(pipeline, new ImportRequest(configuration.typeName(), configuration.importId()), context, started);
    }

    public ImportResult run(ImportPipeline pipeline, ImportRequest request, ImportContext context) {
        return run(pipeline, request, context, Instant.now());
    }

    private ImportResult run(ImportPipeline pipeline, ImportRequest request, ImportContext context, Instant started) {
        try {
            var imported = pipeline.run(request, context);
            return ImportResult.success(imported, context.warnings(), started);
        } catch (ImportException ex) {
            Logger.error(ex, "Import of [{}] failed: {}", request.id(), ex.summary());
            List<Diagnostic> diagnostics = new ArrayList<>(context.warnings());
            diagnostics.add(Diagnostic.error(ex.summary(), ex.detail()));
            return ImportResult.failure(diagnostics, started);
        } catch (RuntimeException ex) {
            Logger.error(ex, "Unexpected failure while importing [{}]", request.id());
            List<Diagnostic> diagnostics = new ArrayList<>(context.warnings());
            diagnostics.add(Diagnostic.error("Unexpected import failure", describe(ex)));
            return ImportResult.failure(diagnostics, started);
        }
    }

    private static String describe(Throwable error) {
        var message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
