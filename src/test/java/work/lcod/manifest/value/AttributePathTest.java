package work.lcod.manifest.value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import org.junit.jupiter.api.Test;

class AttributePathTest {
    @Test
    void rendersAttributesIndexesAndKeys() {
        var path = AttributePath.of(
            new AttributePath.Attribute("spec"),
            new AttributePath.Attribute("ports"),
            new AttributePath.ElementIndex(1),
            new AttributePath.Attribute("port")
        );

        assertEquals("spec.ports[1].port", path.toString());
        assertEquals("<root>", AttributePath.root().toString());
        assertEquals(
            "metadata.labels[\"app\"]",
            AttributePath.root()
                .append(new AttributePath.ElementKey("app"))
                .prepend(new AttributePath.Attribute("labels"))
                .prepend(new AttributePath.Attribute("metadata"))
                .toString()
        );
    }

    @Test
    void escapesQuotesAndBackslashesInKeys() {
        var quoted = AttributePath.of(new AttributePath.Attribute("data"), new AttributePath.ElementKey("a\"]b"));
        var nested = AttributePath.of(
            new AttributePath.Attribute("data"),
            new AttributePath.ElementKey("a"),
            new AttributePath.ElementKey("b")
        );
        var backslash = AttributePath.of(new AttributePath.ElementKey("c:\\tmp"));

        assertEquals("data[\"a\\\"]b\"]", quoted.toString());
        assertEquals("data[\"a\"][\"b\"]", nested.toString());
        assertNotEquals(quoted.toString(), nested.toString());
        assertEquals("[\"c:\\\\tmp\"]", backslash.toString());
    }
}
