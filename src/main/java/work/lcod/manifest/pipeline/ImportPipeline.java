package work.lcod.manifest.pipeline;

import java.util.Objects;
import org.tinylog.Logger;
import work.lcod.manifest.convert.TypedConverter;
import work.lcod.manifest.convert.UnknownBackfill;
import work.lcod.manifest.discovery.TypeResolver;
import work.lcod.manifest.filter.ServerFieldFilter;
import work.lcod.manifest.identity.ImportIdParser;
import work.lcod.manifest.schema.SchemaResolver;
import work.lcod.manifest.state.ImportAssembler;
import work.lcod.manifest.state.ImportedResource;
import work.lcod.manifest.store.ObjectFetcher;

/**
 * Brings one live object under management: parse the import ID, resolve its type, fetch and filter the object,
 * convert it against the type's schema, backfill pending values and package the resulting state.
 *
 * <p>Fail-fast: the first {@link ImportException} aborts the remaining stages. Instances hold no per-import state
 * and can serve concurrent imports.
 */
public final class ImportPipeline {
    private final TypeResolver typeResolver;
    private final ObjectFetcher fetcher;
    private final SchemaResolver schemaResolver;
    private final ImportAssembler assembler;

    public ImportPipeline(
        TypeResolver typeResolver,
        ObjectFetcher fetcher,
        SchemaResolver schemaResolver,
        ImportAssembler assembler
    ) {
        this.typeResolver = Objects.requireNonNull(typeResolver, "typeResolver");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.schemaResolver = Objects.requireNonNull(schemaResolver, "schemaResolver");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
    }

    public ImportedResource run(ImportRequest request, ImportContext context) {
        var identity = ImportIdParser.parse(request.id());
        Logger.trace("Import ID {} parsed as {}", request.id(), identity);
        var resourceType = assembler.resourceType(request.typeName());

        context.ensureNotCancelled();
        var type = typeResolver.resolve(identity, context);
        var live = fetcher.fetch(type, identity, context);
        Logger.trace("Live object: {}", live);

        context.ensureNotCancelled();
        var schema = schemaResolver.schemaFor(identity);
        var filtered = ServerFieldFilter.filter(live);
        var converted = TypedConverter.convert(filtered, schema);
        var backfilled = UnknownBackfill.backfill(schema, converted);
        var object = UnknownBackfill.narrowTopLevel(backfilled);
        Logger.trace("Typed object: {}", object);

        var state = assembler.assemble(resourceType, object);
        var imported = assembler.export(resourceType, state);
        Logger.info("Imported {} as {}", identity.display(), imported.typeName());
        return imported;
    }
}
