package work.lcod.manifest.pipeline;

/**
 * Failure categories reported by the import pipeline. Each kind carries the diagnostic summary shown to operators.
 */
public enum ErrorKind {
    PARSE("Failed to parse import ID"),
    UNKNOWN_RESOURCE_TYPE("Failed to determine resource type"),
    RESOLUTION_UNKNOWN_TYPE("Resource type is not known to the type registry"),
    RESOLUTION_UNREACHABLE("Failed to reach the type registry"),
    FETCH("Failed to get resource from API"),
    SCHEMA("Failed to determine resource schema"),
    CONVERSION("Failed to convert resource into typed state"),
    ASSEMBLY("Failed to construct imported state"),
    CANCELED("Import canceled");

    private final String summary;

    ErrorKind(String summary) {
        this.summary = summary;
    }

    public String summary() {
        return summary;
    }
}
