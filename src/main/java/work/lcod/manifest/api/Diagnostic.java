package work.lcod.manifest.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * User-visible message attached to an import result.
 */
public record Diagnostic(Severity severity, String summary, String detail) {
    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(summary, "summary");
        detail = detail == null ? "" : detail;
    }

    public static Diagnostic error(String summary, String detail) {
        return new Diagnostic(Severity.ERROR, summary, detail);
    }

    public static Diagnostic warning(String summary, String detail) {
        return new Diagnostic(Severity.WARNING, summary, detail);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("severity", severity.name().toLowerCase());
        map.put("summary", summary);
        if (!detail.isEmpty()) {
            map.put("detail", detail);
        }
        return map;
    }

    public enum Severity {
        ERROR,
        WARNING
    }
}
