package ai.widgetprops.analyzer.element;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class TypeRefTest {

    @Test
    void testParseSimpleName() {
        var type = TypeRef.parse("double");
        assertEquals(TypeRef.named("double"), type);
        assertTrue(type.isDouble());
        assertFalse(type.nullable());
    }

    @Test
    void testParseNullable() {
        var type = TypeRef.parse("EdgeInsetsGeometry?");
        assertEquals("EdgeInsetsGeometry", type.name());
        assertTrue(type.nullable());
        assertEquals("EdgeInsetsGeometry?", type.toString());
    }

    @Test
    void testParseTypeArguments() {
        var type = TypeRef.parse("Map<String, List<Widget>>?");
        assertEquals("Map", type.name());
        assertEquals(2, type.typeArguments().size());
        assertEquals(new TypeRef("List", List.of(TypeRef.named("Widget")), false), type.typeArguments().get(1));
        assertEquals("Map<String, List<Widget>>?", type.toString());
    }

    @Test
    void testIterableTypes() {
        assertTrue(TypeRef.parse("List<Widget>").isIterable());
        assertTrue(TypeRef.parse("Iterable<int>").isIterable());
        assertFalse(TypeRef.parse("Widget").isIterable());
    }

    @Test
    void testMalformedTypes() {
        assertThrows(IllegalArgumentException.class, () -> TypeRef.parse(""));
        assertThrows(IllegalArgumentException.class, () -> TypeRef.parse("List<int"));
        assertThrows(IllegalArgumentException.class, () -> TypeRef.parse("int>"));
    }
}
