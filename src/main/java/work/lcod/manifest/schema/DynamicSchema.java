package work.lcod.manifest.schema;

/**
 * Position whose shape is taken from the data itself (schemaless sub-documents such as preserved unknown fields).
 */
public record DynamicSchema() implements FieldSchema {
    static final DynamicSchema INSTANCE = new DynamicSchema();
}
