package work.lcod.manifest.value;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Location of a node inside a typed value tree, e.g. {@code spec.containers[0].ports[1]} or
 * {@code metadata.labels["app"]}.
 */
public final class AttributePath {
    private static final AttributePath ROOT = new AttributePath(List.of());

    private final List<Step> steps;

    private AttributePath(List<Step> steps) {
        this.steps = List.copyOf(steps);
    }

    public static AttributePath root() {
        return ROOT;
    }

    public static AttributePath of(Step... steps) {
        return new AttributePath(List.of(steps));
    }

    public List<Step> steps() {
        return steps;
    }

    public boolean isRoot() {
        return steps.isEmpty();
    }

    public AttributePath prepend(Step step) {
        var copy = new ArrayList<Step>(steps.size() + 1);
        copy.add(Objects.requireNonNull(step, "step"));
        copy.addAll(steps);
        return new AttributePath(copy);
    }

    public AttributePath append(Step step) {
        var copy = new ArrayList<>(steps);
        copy.add(Objects.requireNonNull(step, "step"));
        return new AttributePath(copy);
    }

    @Override
    public String toString() {
        if (steps.isEmpty()) {
            return "<root>";
        }
        var out = new StringBuilder();
        for (Step step : steps) {
            if (step instanceof Attribute attribute) {
                if (out.length() > 0) {
                    out.append('.');
                }
                out.append(attribute.name());
            } else if (step instanceof ElementIndex index) {
                out.append('[').append(index.index()).append(']');
            } else if (step instanceof ElementKey key) {
                out.append("[\"");
                appendEscaped(out, key.key());
                out.append("\"]");
            }
        }
        return out.toString();
    }

    // backslash and quote are escaped so a key always ends at the first unescaped quote
    private static void appendEscaped(StringBuilder out, String key) {
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c == '"' || c == '\\') {
                out.append('\\');
            }
            out.append(c);
        }
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof AttributePath path && steps.equals(path.steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }

    public interface Step {}

    public record Attribute(String name) implements Step {
        public Attribute {
            Objects.requireNonNull(name, "name");
        }
    }

    public record ElementIndex(int index) implements Step {}

    public record ElementKey(String key) implements Step {
        public ElementKey {
            Objects.requireNonNull(key, "key");
        }
    }
}
