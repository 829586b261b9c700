package work.lcod.manifest.pipeline;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.tinylog.Logger;
import work.lcod.manifest.api.Diagnostic;

/**
 * Per-import state: cancellation, deadline and the warnings gathered along the way.
 */
public final class ImportContext {
    private final CancellationToken token;
    private final Optional<Instant> deadline;
    private final List<Diagnostic> warnings = Collections.synchronizedList(new ArrayList<>());

    public ImportContext() {
        this(new CancellationToken(), Optional.empty());
    }

    public ImportContext(CancellationToken token, Optional<Duration> timeout) {
        this.token = Objects.requireNonNull(token, "token");
        this.deadline = Objects.requireNonNull(timeout, "timeout").map(Instant.now()::plus);
    }

    public CancellationToken token() {
        return token;
    }

    public Optional<Instant> deadline() {
        return deadline;
    }

    public boolean isDeadlineExceeded() {
        return deadline.map(limit -> !Instant.now().isBefore(limit)).orElse(false);
    }

    /**
     * @throws ImportException of kind {@link ErrorKind#CANCELED} when the import was cancelled or ran out of time
     */
    public void ensureNotCancelled() {
        if (token.isCancelled()) {
            throw new ImportException(ErrorKind.CANCELED, "import cancelled by caller");
        }
        if (isDeadlineExceeded()) {
            throw new ImportException(ErrorKind.CANCELED, "import timed out");
        }
    }

    public void warn(String summary, String detail) {
        Logger.warn("{}: {}", summary, detail);
        warnings.add(Diagnostic.warning(summary, detail));
    }

    public List<Diagnostic> warnings() {
        synchronized (warnings) {
            return List.copyOf(warnings);
        }
    }
}
