package ai.widgetprops.property;

import static ai.widgetprops.testutil.FlutterTestUnits.describe;
import static ai.widgetprops.testutil.FlutterTestUnits.find;
import static ai.widgetprops.testutil.FlutterTestUnits.idOf;
import static ai.widgetprops.testutil.FlutterTestUnits.offsetOf;
import static ai.widgetprops.testutil.FlutterTestUnits.resolve;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.widgetprops.PropertyEditorConfig;
import ai.widgetprops.protocol.EditorKind;
import ai.widgetprops.protocol.EnumValue;
import ai.widgetprops.protocol.PropertyDescriptor;
import ai.widgetprops.protocol.PropertyValue;
import ai.widgetprops.testutil.FlutterTestUnits;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Describing widgets and editing properties by id")
class WidgetDescriptionsTest {

    private static final String IMPORT = "import 'package:flutter/widgets.dart';\n";
    private static final String TEXT = IMPORT + "f() => Text('aaa', maxLines: 2);";

    private final WidgetDescriptions descriptions = FlutterTestUnits.descriptions();

    private static List<String> names(List<PropertyDescriptor> properties) {
        return properties.stream().map(PropertyDescriptor::name).toList();
    }

    @Test
    void testPropertyNames() throws Exception {
        var properties = describe(descriptions, resolve(TEXT), "Text(");
        assertEquals(List.of("data", "style", "textAlign", "softWrap", "maxLines", "Container"), names(properties));
        assertEquals(
                List.of("inherit", "color", "fontSize", "letterSpacing"), names(find(properties, "style").children()));
    }

    @Test
    void testIdsAreAssignedDepthFirst() throws Exception {
        var properties = describe(descriptions, resolve(TEXT), "Text(");
        assertEquals(0, idOf(properties, "data"));
        assertEquals(1, idOf(properties, "style"));
        assertEquals(2, idOf(properties, "style", "inherit"));
        assertEquals(5, idOf(properties, "style", "letterSpacing"));
        assertEquals(6, idOf(properties, "textAlign"));
        assertEquals(7, idOf(properties, "softWrap"));
        assertEquals(8, idOf(properties, "maxLines"));
        assertEquals(9, idOf(properties, "Container"));
        assertEquals(10, idOf(properties, "Container", "alignment"));
        assertEquals(11, idOf(properties, "Container", "padding"));
        assertEquals(15, idOf(properties, "Container", "padding", "bottom"));
        assertEquals(16, idOf(properties, "Container", "color"));
        assertEquals(19, idOf(properties, "Container", "margin"));
        assertEquals(23, idOf(properties, "Container", "margin", "bottom"));
    }

    @Test
    void testDescriptors() throws Exception {
        var properties = describe(descriptions, resolve(TEXT), "Text(");

        var data = find(properties, "data");
        assertTrue(data.required());
        assertTrue(data.safeToUpdate());
        assertEquals("'aaa'", data.expression());
        assertEquals(PropertyValue.ofString("aaa"), data.value());
        assertEquals(EditorKind.STRING, data.editor().kind());
        assertEquals("The text to display.", data.documentation());

        var maxLines = find(properties, "maxLines");
        assertFalse(maxLines.required());
        assertEquals("2", maxLines.expression());
        assertEquals(PropertyValue.ofInt(2), maxLines.value());
        assertEquals(EditorKind.INT, maxLines.editor().kind());

        var softWrap = find(properties, "softWrap");
        assertTrue(softWrap.safeToUpdate());
        assertNull(softWrap.expression());
        assertNull(softWrap.value());
        assertEquals(EditorKind.BOOL, softWrap.editor().kind());

        var textAlign = find(properties, "textAlign");
        assertEquals(EditorKind.ENUM, textAlign.editor().kind());
        assertEquals(6, textAlign.editor().enumItems().size());
        assertEquals(new EnumValue("dart:ui", "TextAlign", "left"), textAlign.editor().enumItems().get(0));

        var style = find(properties, "style");
        assertNull(style.editor());
        assertEquals(EditorKind.DOUBLE, find(properties, "style", "fontSize").editor().kind());
        // no class for Color in the catalog
        assertNull(find(properties, "style", "color").editor());
    }

    @Test
    void testUnsafeExpression() throws Exception {
        var unit = resolve(IMPORT + "f() => Text(title, maxLines: compute(lines));");
        var properties = describe(descriptions, unit, "Text(");
        var data = find(properties, "data");
        assertFalse(data.safeToUpdate());
        assertEquals("title", data.expression());
        assertNull(data.value());
        var maxLines = find(properties, "maxLines");
        assertFalse(maxLines.safeToUpdate());
        assertEquals("compute(lines)", maxLines.expression());
    }

    @Test
    void testEnumValueDecoded() throws Exception {
        var unit = resolve(IMPORT
                + "f() => Column(mainAxisAlignment: MainAxisAlignment.center, children: [Text('a')]);\n"
                + "g() => Column(mainAxisAlignment: MainAxisAlignment.middle, children: []);");
        var properties = describe(descriptions, unit, "Column(");
        assertEquals(List.of("mainAxisAlignment", "Container"), names(properties));
        var alignment = find(properties, "mainAxisAlignment");
        assertFalse(alignment.required());
        assertTrue(alignment.safeToUpdate());
        assertEquals(
                PropertyValue.ofEnum(
                        new EnumValue("package:flutter/src/rendering/flex.dart", "MainAxisAlignment", "center")),
                alignment.value());

        var unknown = find(
                descriptions.getDescription(unit, offsetOf(unit.content(), "g()") + 7).orElseThrow(),
                "mainAxisAlignment");
        assertNull(unknown.value());
        assertFalse(unknown.safeToUpdate());
    }

    @Test
    void testDoubleParameterWithIntegerLiteral() throws Exception {
        var unit = resolve(IMPORT + "f() => SizedBox(width: 10);");
        var width = find(describe(descriptions, unit, "SizedBox("), "width");
        assertEquals(PropertyValue.ofDouble(10), width.value());
    }

    @Test
    void testInnermostWidgetAtOffset() throws Exception {
        var code = IMPORT + "f() => Padding(padding: EdgeInsets.all(8), child: Text('aaa'));";
        var unit = resolve(code);
        assertEquals(List.of("padding", "Container"), names(describe(descriptions, unit, "EdgeInsets")));
        assertEquals(List.of("padding", "Container"), names(describe(descriptions, unit, "child")));
        assertEquals("data", describe(descriptions, unit, "'aaa'").get(0).name());
    }

    @Test
    void testNoWidgetAtOffset() throws Exception {
        var code = IMPORT + "f() => compute(EdgeInsets.all(8));";
        var unit = resolve(code);
        assertTrue(descriptions.getDescription(unit, offsetOf(code, "EdgeInsets")).isEmpty());
        assertTrue(descriptions.getDescription(unit, 0).isEmpty());
    }

    @Test
    void testUnresolvedConstructorHasNoProperties() throws Exception {
        var unit = resolve(IMPORT + "f() => SizedBox.expand();");
        assertEquals(List.of(), describe(descriptions, unit, "SizedBox"));
    }

    @Test
    void testMaxNestingDepth() throws Exception {
        var shallow = FlutterTestUnits.descriptions(new PropertyEditorConfig(Set.of("child"), 0));
        var properties = describe(shallow, resolve(TEXT), "Text(");
        assertTrue(find(properties, "style").children().isEmpty());
        assertEquals(4, find(properties, "Container", "padding").children().size());
    }

    @Test
    void testUnknownId() throws Exception {
        describe(descriptions, resolve(TEXT), "Text(");
        var e = assertThrows(
                PropertyEditException.class, () -> descriptions.setPropertyValue(999, PropertyValue.ofInt(1)));
        assertEquals(PropertyEditException.Reason.INVALID_ID, e.getReason());
        assertTrue(descriptions.property(999).isEmpty());
    }

    @Test
    void testIdsOfPreviousDescriptionAreInvalid() throws Exception {
        var unit = resolve(TEXT);
        var first = describe(descriptions, unit, "Text(");
        var second = describe(descriptions, unit, "Text(");
        assertEquals(24, idOf(second, "data"));

        var e = assertThrows(
                PropertyEditException.class,
                () -> descriptions.setPropertyValue(idOf(first, "maxLines"), PropertyValue.ofInt(1)));
        assertEquals(PropertyEditException.Reason.INVALID_ID, e.getReason());
        assertTrue(descriptions.property(idOf(second, "maxLines")).isPresent());
    }

    @Test
    void testRequiredPropertyCannotBeRemoved() throws Exception {
        var properties = describe(descriptions, resolve(TEXT), "Text(");
        var e = assertThrows(
                PropertyEditException.class, () -> descriptions.setPropertyValue(idOf(properties, "data"), null));
        assertEquals(PropertyEditException.Reason.REQUIRED_PROPERTY, e.getReason());
    }

    @Test
    void testPropertyWithoutEditor() throws Exception {
        var properties = describe(descriptions, resolve(TEXT), "Text(");
        for (var name : List.of("style", "Container")) {
            var e = assertThrows(
                    PropertyEditException.class,
                    () -> descriptions.setPropertyValue(idOf(properties, name), PropertyValue.ofInt(1)));
            assertEquals(PropertyEditException.Reason.NOT_EDITABLE, e.getReason());
        }
    }

    @Test
    void testJsonShape() throws Exception {
        var properties = describe(descriptions, resolve(TEXT), "Text(");
        var mapper = new ObjectMapper();

        var maxLines = mapper.readTree(mapper.writeValueAsString(find(properties, "maxLines")));
        assertEquals(8, maxLines.get("id").asInt());
        assertEquals("maxLines", maxLines.get("name").asText());
        assertEquals(2, maxLines.get("value").get("intValue").asInt());
        assertFalse(maxLines.get("value").has("isEmpty"));
        assertFalse(maxLines.get("value").has("doubleValue"));
        assertEquals("INT", maxLines.get("editor").get("kind").asText());
        assertFalse(maxLines.get("editor").has("enumItems"));

        var softWrap = mapper.readTree(mapper.writeValueAsString(find(properties, "softWrap")));
        assertFalse(softWrap.has("value"));
        assertFalse(softWrap.has("expression"));

        var textAlign = mapper.readTree(mapper.writeValueAsString(find(properties, "textAlign")));
        var firstItem = textAlign.get("editor").get("enumItems").get(0);
        assertEquals("TextAlign", firstItem.get("className").asText());
        assertFalse(firstItem.has("documentation"));

        var value = mapper.readValue("{\"doubleValue\": 1.5}", PropertyValue.class);
        assertEquals(PropertyValue.ofDouble(1.5), value);
    }
}
