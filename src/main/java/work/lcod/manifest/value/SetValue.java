package work.lcod.manifest.value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.lcod.manifest.schema.SetSchema;

/**
 * Set elements keep the order they were read in; that order carries no meaning.
 *
 * <p>Known elements that compare equal are kept once, first occurrence wins. Numbers compare by value, so
 * {@code 1} and {@code 1.0} are the same element. Elements that are not fully known are never merged.
 */
public record SetValue(SetSchema type, List<TypedValue> elements) implements TypedValue {
    public SetValue {
        Objects.requireNonNull(type, "type");
        elements = distinct(elements);
    }

    private static List<TypedValue> distinct(List<TypedValue> elements) {
        Set<Object> seen = new HashSet<>();
        List<TypedValue> out = new ArrayList<>(elements.size());
        for (TypedValue element : elements) {
            if (!isKnown(element) || seen.add(identity(TypedValues.flatten(element)))) {
                out.add(element);
            }
        }
        return List.copyOf(out);
    }

    private static boolean isKnown(TypedValue element) {
        return !TypedValues.anyMatch(element, node -> node instanceof PendingValue || node instanceof UndeterminedValue);
    }

    private static Object identity(Object flat) {
        if (flat instanceof BigDecimal number) {
            return number.signum() == 0 ? BigDecimal.ZERO : number.stripTrailingZeros();
        }
        if (flat instanceof Map<?, ?> map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            map.forEach((key, value) -> out.put(key, identity(value)));
            return out;
        }
        if (flat instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(identity(item));
            }
            return out;
        }
        return flat;
    }
}
