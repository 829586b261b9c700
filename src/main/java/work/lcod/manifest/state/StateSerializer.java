package work.lcod.manifest.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import work.lcod.manifest.pipeline.ErrorKind;
import work.lcod.manifest.pipeline.ImportException;
import work.lcod.manifest.schema.SchemaDocuments;
import work.lcod.manifest.value.ListValue;
import work.lcod.manifest.value.MapValue;
import work.lcod.manifest.value.NullValue;
import work.lcod.manifest.value.ObjectValue;
import work.lcod.manifest.value.PendingValue;
import work.lcod.manifest.value.PrimitiveValue;
import work.lcod.manifest.value.SetValue;
import work.lcod.manifest.value.TypedValue;

/**
 * JSON form of imported state: {@code {"type": <schema document>, "value": <value>}}.
 * Pending nodes are written as {@code {"$pending": true}} and nulls as JSON {@code null}.
 */
public final class StateSerializer {
    public static final String PENDING_MARKER = "$pending";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final int MAX_PLAIN_DIGITS = 64;

    private final ObjectMapper mapper;

    public StateSerializer() {
        this(new ObjectMapper());
    }

    public StateSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String toJson(ImportedState state) {
        var value = state.toValue();
        ObjectNode root = NODES.objectNode();
        root.set("type", SchemaDocuments.write(value.type()));
        root.set("value", toNode(value));
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            throw new ImportException(ErrorKind.ASSEMBLY, "unable to serialize imported state", ex);
        }
    }

    public static JsonNode toNode(TypedValue value) {
        if (value instanceof PrimitiveValue primitive) {
            Object raw = primitive.value();
            if (raw instanceof BigDecimal number) {
                return numberNode(number);
            }
            if (raw instanceof Boolean flag) {
                return NODES.booleanNode(flag);
            }
            return NODES.textNode((String) raw);
        }
        if (value instanceof NullValue) {
            return NODES.nullNode();
        }
        if (value instanceof PendingValue) {
            return NODES.objectNode().put(PENDING_MARKER, true);
        }
        if (value instanceof ObjectValue object) {
            ObjectNode out = NODES.objectNode();
            object.attributes().forEach((name, attribute) -> out.set(name, toNode(attribute)));
            return out;
        }
        if (value instanceof MapValue map) {
            ObjectNode out = NODES.objectNode();
            map.entries().forEach((key, entry) -> out.set(key, toNode(entry)));
            return out;
        }
        if (value instanceof ListValue list) {
            ArrayNode out = NODES.arrayNode();
            list.elements().forEach(element -> out.add(toNode(element)));
            return out;
        }
        if (value instanceof SetValue set) {
            ArrayNode out = NODES.arrayNode();
            set.elements().forEach(element -> out.add(toNode(element)));
            return out;
        }
        throw new ImportException(ErrorKind.ASSEMBLY, "cannot serialize " + value.getClass().getSimpleName());
    }

    // integral values of reasonable size are written without fraction or exponent, the rest as is
    private static JsonNode numberNode(BigDecimal number) {
        if (number.signum() == 0) {
            return NODES.numberNode(BigInteger.ZERO);
        }
        var stripped = number.stripTrailingZeros();
        if (stripped.scale() <= 0 && stripped.precision() - stripped.scale() <= MAX_PLAIN_DIGITS) {
            return NODES.numberNode(stripped.toBigIntegerExact());
        }
        return NODES.numberNode(stripped);
    }
}
