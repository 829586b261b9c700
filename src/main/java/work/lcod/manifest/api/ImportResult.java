package work.lcod.manifest.api;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.manifest.state.ImportedResource;

/**
 * Outcome of an {@link ImportRunner} call: diagnostics, plus the imported resource on success.
 */
public record ImportResult(
    Status status,
    List<Diagnostic> diagnostics,
    List<ImportedResource> importedResources,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectMapper JSON = new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private static final ObjectWriter WRITER = JSON.writerWithDefaultPrettyPrinter();

    public ImportResult {
        diagnostics = List.copyOf(diagnostics);
        importedResources = List.copyOf(importedResources);
    }

    public static ImportResult success(ImportedResource resource, List<Diagnostic> warnings, Instant startedAt) {
        return new ImportResult(Status.SUCCESS, warnings, List.of(resource), startedAt, Instant.now());
    }

    public static ImportResult failure(List<Diagnostic> diagnostics, Instant startedAt) {
        return new ImportResult(Status.FAILURE, diagnostics, List.of(), startedAt, Instant.now());
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        List<Object> diags = new ArrayList<>();
        diagnostics.forEach(d -> diags.add(d.toSerializableMap()));
        serializable.put("diagnostics", diags);
        List<Object> resources = new ArrayList<>();
        for (ImportedResource resource : importedResources) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("typeName", resource.typeName());
            entry.put("state", readState(resource.serialized()));
            resources.add(entry);
        }
        serializable.put("importedResources", resources);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (IOException ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    private static Object readState(String serialized) {
        try {
            return JSON.readTree(serialized);
        } catch (IOException ex) {
            return serialized;
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
