package work.lcod.manifest.pipeline;

import java.util.Objects;

/**
 * Failure raised by any stage of the import pipeline. The {@link ErrorKind} decides the diagnostic summary.
 */
public class ImportException extends RuntimeException {
    private final ErrorKind kind;

    public ImportException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ImportException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }

    public String summary() {
        return kind.summary();
    }

    /**
     * Message plus the root cause, when the cause adds something the message does not already say.
     */
    public String detail() {
        var message = getMessage() == null ? "" : getMessage();
        Throwable root = getCause();
        while (root != null && root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        if (root == null || root.getMessage() == null || root.getMessage().isBlank() || message.contains(root.getMessage())) {
            return message;
        }
        return message + ": " + root.getMessage();
    }
}
