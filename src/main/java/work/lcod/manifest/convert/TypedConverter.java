package work.lcod.manifest.convert;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.manifest.schema.DynamicSchema;
import work.lcod.manifest.schema.FieldSchema;
import work.lcod.manifest.schema.ListSchema;
import work.lcod.manifest.schema.MapSchema;
import work.lcod.manifest.schema.ObjectSchema;
import work.lcod.manifest.schema.ScalarSchema;
import work.lcod.manifest.schema.SetSchema;
import work.lcod.manifest.value.AttributePath;
import work.lcod.manifest.value.ListValue;
import work.lcod.manifest.value.MapValue;
import work.lcod.manifest.value.NullValue;
import work.lcod.manifest.value.ObjectValue;
import work.lcod.manifest.value.PrimitiveValue;
import work.lcod.manifest.value.SetValue;
import work.lcod.manifest.value.TypedValue;
import work.lcod.manifest.value.UndeterminedValue;

/**
 * Converts schemaless data (maps, lists, JSON scalars) into a {@link TypedValue} tree shaped by a {@link FieldSchema}.
 *
 * <p>The schema is authoritative: raw keys it does not declare are dropped, and declared attributes the raw data
 * lacks become {@link UndeterminedValue} placeholders for {@link UnknownBackfill} to resolve. Only data whose JSON
 * kind cannot be coerced into the declared kind fails, with a {@link ConversionException} naming its path.
 */
public final class TypedConverter {
    private static final Set<String> TRUE_LITERALS = Set.of("1", "t", "T", "TRUE", "true", "True");
    private static final Set<String> FALSE_LITERALS = Set.of("0", "f", "F", "FALSE", "false", "False");

    private TypedConverter() {}

    public static TypedValue convert(Object raw, FieldSchema schema) {
        return convertNode(raw, schema, false);
    }

    private static TypedValue convertNode(Object raw, FieldSchema schema, boolean nullable) {
        if (raw == null) {
            return nullable ? new NullValue(schema) : new UndeterminedValue(schema);
        }
        if (schema instanceof ScalarSchema scalar) {
            return convertScalar(raw, scalar);
        }
        if (schema instanceof ObjectSchema object) {
            return convertObject(raw, object);
        }
        if (schema instanceof ListSchema list) {
            return new ListValue(list, convertElements(raw, list.element(), "list"));
        }
        if (schema instanceof SetSchema set) {
            return new SetValue(set, convertElements(raw, set.element(), "set"));
        }
        if (schema instanceof MapSchema map) {
            return convertMap(raw, map);
        }
        if (schema instanceof DynamicSchema) {
            return convertDynamic(raw);
        }
        throw new ConversionException("unsupported schema " + schema);
    }

    private static ObjectValue convertObject(Object raw, ObjectSchema schema) {
        var fields = requireMap(raw, "object");
        Map<String, TypedValue> attributes = new LinkedHashMap<>();
        for (var entry : schema.attributes().entrySet()) {
            String name = entry.getKey();
            if (!fields.containsKey(name)) {
                attributes.put(name, new UndeterminedValue(entry.getValue()));
                continue;
            }
            try {
                attributes.put(name, convertNode(fields.get(name), entry.getValue(), schema.isOptional(name)));
            } catch (ConversionException ex) {
                throw ex.within(new AttributePath.Attribute(name));
            }
        }
        return new ObjectValue(schema, attributes);
    }

    private static MapValue convertMap(Object raw, MapSchema schema) {
        var fields = requireMap(raw, "map");
        Map<String, TypedValue> entries = new LinkedHashMap<>();
        for (var entry : fields.entrySet()) {
            String key = String.valueOf(entry.getKey());
            try {
                entries.put(key, convertNode(entry.getValue(), schema.value(), true));
            } catch (ConversionException ex) {
                throw ex.within(new AttributePath.ElementKey(key));
            }
        }
        return new MapValue(schema, entries);
    }

    private static List<TypedValue> convertElements(Object raw, FieldSchema element, String expected) {
        if (!(raw instanceof List<?> items)) {
            throw mismatch(expected, raw);
        }
        List<TypedValue> out = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            try {
                out.add(convertNode(items.get(i), element, true));
            } catch (ConversionException ex) {
                throw ex.within(new AttributePath.ElementIndex(i));
            }
        }
        return out;
    }

    private static TypedValue convertDynamic(Object raw) {
        if (raw instanceof Map<?, ?> map) {
            var schema = ObjectSchema.builder();
            Map<String, TypedValue> attributes = new LinkedHashMap<>();
            for (var entry : map.entrySet()) {
                String name = String.valueOf(entry.getKey());
                TypedValue child;
                try {
                    child = convertNode(entry.getValue(), FieldSchema.dynamic(), true);
                } catch (ConversionException ex) {
                    throw ex.within(new AttributePath.Attribute(name));
                }
                if (child instanceof NullValue) {
                    schema.optional(name, child.type());
                } else {
                    schema.required(name, child.type());
                }
                attributes.put(name, child);
            }
            return new ObjectValue(schema.build(), attributes);
        }
        if (raw instanceof List<?>) {
            var list = FieldSchema.list(FieldSchema.dynamic());
            return new ListValue(list, convertElements(raw, list.element(), "list"));
        }
        if (raw instanceof String text) {
            return PrimitiveValue.of(text);
        }
        if (raw instanceof Boolean flag) {
            return PrimitiveValue.of(flag);
        }
        if (raw instanceof Number number) {
            return PrimitiveValue.of(toBigDecimal(number));
        }
        throw mismatch("dynamic value", raw);
    }

    private static PrimitiveValue convertScalar(Object raw, ScalarSchema schema) {
        return switch (schema.kind()) {
            case STRING -> new PrimitiveValue(schema, toText(raw));
            case NUMBER -> new PrimitiveValue(schema, toNumber(raw));
            case BOOL -> new PrimitiveValue(schema, toBool(raw));
        };
    }

    private static String toText(Object raw) {
        if (raw instanceof String text) {
            return text;
        }
        if (raw instanceof Number number) {
            return toBigDecimal(number).stripTrailingZeros().toPlainString();
        }
        if (raw instanceof Boolean flag) {
            return flag.toString();
        }
        throw mismatch("string", raw);
    }

    private static BigDecimal toNumber(Object raw) {
        if (raw instanceof Number number) {
            return toBigDecimal(number);
        }
        if (raw instanceof String text) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException ex) {
                throw new ConversionException("cannot parse \"" + text + "\" as a number", ex);
            }
        }
        throw mismatch("number", raw);
    }

    private static Boolean toBool(Object raw) {
        if (raw instanceof Boolean flag) {
            return flag;
        }
        if (raw instanceof String text) {
            if (TRUE_LITERALS.contains(text)) {
                return Boolean.TRUE;
            }
            if (FALSE_LITERALS.contains(text)) {
                return Boolean.FALSE;
            }
            throw new ConversionException("cannot parse \"" + text + "\" as a bool");
        }
        throw mismatch("bool", raw);
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (number instanceof Double || number instanceof Float) {
            double value = number.doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new ConversionException("number " + value + " is not finite");
            }
            return BigDecimal.valueOf(value);
        }
        return BigDecimal.valueOf(number.longValue());
    }

    private static Map<?, ?> requireMap(Object raw, String expected) {
        if (raw instanceof Map<?, ?> map) {
            return map;
        }
        throw mismatch(expected, raw);
    }

    private static ConversionException mismatch(String expected, Object raw) {
        return new ConversionException("irreconcilable types: expected " + expected + " but found " + jsonKind(raw));
    }

    private static String jsonKind(Object raw) {
        if (raw instanceof Map<?, ?>) {
            return "object";
        }
        if (raw instanceof List<?>) {
            return "list";
        }
        if (raw instanceof String) {
            return "string";
        }
        if (raw instanceof Number) {
            return "number";
        }
        if (raw instanceof Boolean) {
            return "bool";
        }
        return raw.getClass().getSimpleName();
    }
}
