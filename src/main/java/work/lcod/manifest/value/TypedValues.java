package work.lcod.manifest.value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Inspection helpers over typed value trees.
 */
public final class TypedValues {
    private TypedValues() {}

    /**
     * True when {@code predicate} holds for the node itself or any descendant.
     */
    public static boolean anyMatch(TypedValue value, Predicate<TypedValue> predicate) {
        if (predicate.test(value)) {
            return true;
        }
        for (TypedValue child : children(value)) {
            if (anyMatch(child, predicate)) {
                return true;
            }
        }
        return false;
    }

    public static boolean containsPending(TypedValue value) {
        return anyMatch(value, node -> node instanceof PendingValue);
    }

    public static boolean containsUndetermined(TypedValue value) {
        return anyMatch(value, node -> node instanceof UndeterminedValue);
    }

    public static List<TypedValue> children(TypedValue value) {
        if (value instanceof ObjectValue object) {
            return List.copyOf(object.attributes().values());
        }
        if (value instanceof MapValue map) {
            return List.copyOf(map.entries().values());
        }
        if (value instanceof ListValue list) {
            return list.elements();
        }
        if (value instanceof SetValue set) {
            return set.elements();
        }
        return List.of();
    }

    /**
     * Turns a fully known tree back into plain maps, lists and scalars. Null nodes become {@code null}.
     *
     * @throws IllegalStateException when the tree holds a pending or undetermined node
     */
    public static Object flatten(TypedValue value) {
        if (value instanceof PrimitiveValue primitive) {
            return primitive.value();
        }
        if (value instanceof NullValue) {
            return null;
        }
        if (value instanceof ObjectValue object) {
            return flattenMap(object.attributes());
        }
        if (value instanceof MapValue map) {
            return flattenMap(map.entries());
        }
        if (value instanceof ListValue list) {
            return flattenList(list.elements());
        }
        if (value instanceof SetValue set) {
            return flattenList(set.elements());
        }
        throw new IllegalStateException("Cannot flatten a value that is not known: " + value);
    }

    private static Map<String, Object> flattenMap(Map<String, TypedValue> entries) {
        Map<String, Object> out = new LinkedHashMap<>();
        entries.forEach((key, child) -> out.put(key, flatten(child)));
        return out;
    }

    private static List<Object> flattenList(List<TypedValue> elements) {
        List<Object> out = new ArrayList<>(elements.size());
        for (TypedValue element : elements) {
            out.add(flatten(element));
        }
        return out;
    }
}
