package work.lcod.manifest.convert;

import java.util.Objects;
import work.lcod.manifest.pipeline.ErrorKind;
import work.lcod.manifest.pipeline.ImportException;
import work.lcod.manifest.value.AttributePath;

/**
 * Raw data that cannot be shaped into the schema. The path grows as the error travels up the conversion.
 */
public final class ConversionException extends ImportException {
    private final AttributePath path;
    private final String reason;

    public ConversionException(String reason) {
        this(AttributePath.root(), reason, null);
    }

    public ConversionException(String reason, Throwable cause) {
        this(AttributePath.root(), reason, cause);
    }

    private ConversionException(AttributePath path, String reason, Throwable cause) {
        super(ErrorKind.CONVERSION, "at " + path + ": " + reason, cause);
        this.path = Objects.requireNonNull(path, "path");
        this.reason = reason;
    }

    public AttributePath path() {
        return path;
    }

    public String reason() {
        return reason;
    }

    ConversionException within(AttributePath.Step step) {
        var wrapped = new ConversionException(path.prepend(step), reason, getCause());
        wrapped.setStackTrace(getStackTrace());
        return wrapped;
    }
}
