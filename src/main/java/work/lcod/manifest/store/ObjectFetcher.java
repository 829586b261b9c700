package work.lcod.manifest.store;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.tinylog.Logger;
import work.lcod.manifest.discovery.ResolvedType;
import work.lcod.manifest.identity.ResourceIdentity;
import work.lcod.manifest.pipeline.ErrorKind;
import work.lcod.manifest.pipeline.ImportContext;
import work.lcod.manifest.pipeline.ImportException;

/**
 * Reads the live object behind a resolved identity. The read is never retried.
 *
 * <p>The store call runs on a worker thread so the import can be abandoned as soon as the caller cancels or the
 * deadline passes; the worker is interrupted in that case.
 */
public final class ObjectFetcher {
    private static final long POLL_MILLIS = 50L;
    private static final AtomicInteger THREADS = new AtomicInteger();
    private static final ExecutorService SHARED_EXECUTOR = Executors.newCachedThreadPool(task -> {
        var thread = new Thread(task, "object-fetch-" + THREADS.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private final ObjectStore store;
    private final ExecutorService executor;

    public ObjectFetcher(ObjectStore store) {
        this(store, SHARED_EXECUTOR);
    }

    public ObjectFetcher(ObjectStore store, ExecutorService executor) {
        this.store = Objects.requireNonNull(store, "store");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public Map<String, Object> fetch(ResolvedType type, ResourceIdentity identity, ImportContext context) {
        context.ensureNotCancelled();
        String namespace = type.namespaced() ? identity.namespace() : null;
        Logger.debug("Fetching {} from {}", identity.display(), type.endpoint().objectPath(namespace, identity.name()));
        Future<Optional<Map<String, Object>>> pending = executor.submit(
            () -> store.get(type.endpoint(), namespace, identity.name())
        );
        var result = await(pending, identity, context);
        return result.orElseThrow(() -> new ImportException(
            ErrorKind.FETCH,
            "resource " + identity.display() + " not found"
        ));
    }

    private static Optional<Map<String, Object>> await(
        Future<Optional<Map<String, Object>>> pending,
        ResourceIdentity identity,
        ImportContext context
    ) {
        while (true) {
            try {
                context.ensureNotCancelled();
            } catch (ImportException ex) {
                pending.cancel(true);
                throw ex;
            }
            try {
                return pending.get(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException ex) {
                // still running; re-check cancellation
            } catch (InterruptedException ex) {
                pending.cancel(true);
                Thread.currentThread().interrupt();
                throw new ImportException(ErrorKind.CANCELED, "interrupted while reading " + identity.display(), ex);
            } catch (ExecutionException ex) {
                var cause = ex.getCause() == null ? ex : ex.getCause();
                if (cause instanceof InterruptedException) {
                    throw new ImportException(ErrorKind.CANCELED, "read of " + identity.display() + " was interrupted", cause);
                }
                throw new ImportException(ErrorKind.FETCH, "unable to read " + identity.display(), cause);
            }
        }
    }
}
