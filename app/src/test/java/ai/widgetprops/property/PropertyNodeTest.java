package ai.widgetprops.property;

import static ai.widgetprops.testutil.AssertionHelperUtil.assertChange;
import static ai.widgetprops.testutil.AssertionHelperUtil.assertNoChange;
import static ai.widgetprops.testutil.FlutterTestUnits.describe;
import static ai.widgetprops.testutil.FlutterTestUnits.idOf;
import static ai.widgetprops.testutil.FlutterTestUnits.resolve;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ai.widgetprops.PropertyEditorConfig;
import ai.widgetprops.edit.SourceFormatter;
import ai.widgetprops.protocol.EnumValue;
import ai.widgetprops.protocol.PropertyValue;
import ai.widgetprops.testutil.FlutterTestUnits;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Setting and removing property values")
class PropertyNodeTest {

    private static final String IMPORT = "import 'package:flutter/widgets.dart';\n";
    private static final EnumValue TEXT_ALIGN_CENTER = new EnumValue("dart:ui", "TextAlign", "center");

    private final WidgetDescriptions descriptions = FlutterTestUnits.descriptions();

    @Nested
    class ChangeValue {

        @Test
        void testReplaceExistingArgument() throws Exception {
            var unit = resolve(IMPORT + "f() => Text('aaa', maxLines: 1);");
            var properties = describe(descriptions, unit, "Text(");
            var change = descriptions.setPropertyValue(idOf(properties, "maxLines"), PropertyValue.ofInt(2));
            assertChange(unit, change, IMPORT + "f() => Text('aaa', maxLines: 2);");
        }

        @Test
        void testReplacePositionalArgument() throws Exception {
            var unit = resolve(IMPORT + "f() => Text('aaa', maxLines: 1);");
            var properties = describe(descriptions, unit, "Text(");
            var change = descriptions.setPropertyValue(idOf(properties, "data"), PropertyValue.ofString("it's"));
            assertChange(unit, change, IMPORT + "f() => Text('it\\'s', maxLines: 1);");
        }

        @Test
        void testInsertAtEnd() throws Exception {
            var unit = resolve(IMPORT + "f() => Text('aaa');");
            var properties = describe(descriptions, unit, "Text(");
            var change = descriptions.setPropertyValue(idOf(properties, "maxLines"), PropertyValue.ofInt(3));
            assertChange(unit, change, IMPORT + "f() => Text('aaa', maxLines: 3, );");
        }

        @Test
        void testInsertAfterTrailingComma() throws Exception {
            var unit = resolve(IMPORT + "f() => Text('aaa',);");
            var properties = describe(descriptions, unit, "Text(");
            var change = descriptions.setPropertyValue(idOf(properties, "maxLines"), PropertyValue.ofInt(3));
            assertChange(unit, change, IMPORT + "f() => Text('aaa',maxLines: 3, );");
        }

        @Test
        void testInsertIntoEmptyArguments() throws Exception {
            var unit = resolve(IMPORT + "f() => SizedBox();");
            var properties = describe(descriptions, unit, "SizedBox(");
            var change = descriptions.setPropertyValue(idOf(properties, "width"), PropertyValue.ofDouble(10));
            assertChange(unit, change, IMPORT + "f() => SizedBox(width: 10, );");
        }

        @Test
        void testInsertBeforeArgumentSortingAfter() throws Exception {
            var unit = resolve(IMPORT + "f() => Container(alignment: Alignment.center, width: 10, child: Text(''));");
            var properties = describe(descriptions, unit, "Container(");
            var change = descriptions.setPropertyValue(idOf(properties, "height"), PropertyValue.ofDouble(20));
            assertChange(
                    unit,
                    change,
                    IMPORT + "f() => Container(alignment: Alignment.center, height: 20, width: 10, child: Text(''));");
        }

        @Test
        void testInsertBeforeTrailingChild() throws Exception {
            var unit = resolve(IMPORT + "f() => SizedBox(child: Text(''));");
            var properties = describe(descriptions, unit, "SizedBox(");
            var change = descriptions.setPropertyValue(idOf(properties, "width"), PropertyValue.ofDouble(10));
            assertChange(unit, change, IMPORT + "f() => SizedBox(width: 10, child: Text(''));");
        }

        @Test
        void testInsertAfterChildWithoutTrailingNames() throws Exception {
            var noTrailing = FlutterTestUnits.descriptions(new PropertyEditorConfig(Set.of(), 4));
            var unit = resolve(IMPORT + "f() => SizedBox(child: Text(''));");
            var properties = describe(noTrailing, unit, "SizedBox(");
            var change = noTrailing.setPropertyValue(idOf(properties, "width"), PropertyValue.ofDouble(10));
            assertChange(unit, change, IMPORT + "f() => SizedBox(child: Text(''), width: 10, );");
        }

        @Test
        void testReplaceInNamedConstructor() throws Exception {
            var unit = resolve(IMPORT + "f() => SizedBox.square(dimension: 4);");
            var properties = describe(descriptions, unit, "SizedBox");
            var change = descriptions.setPropertyValue(idOf(properties, "dimension"), PropertyValue.ofDouble(2.5));
            assertChange(unit, change, IMPORT + "f() => SizedBox.square(dimension: 2.5);");
        }

        @Test
        void testChangeMessage() throws Exception {
            var unit = resolve(IMPORT + "f() => Text('aaa');");
            var properties = describe(descriptions, unit, "Text(");
            var change = descriptions.setPropertyValue(idOf(properties, "softWrap"), PropertyValue.ofBool(false));
            assertEquals("Set softWrap", change.get().message());
            assertChange(unit, change, IMPORT + "f() => Text('aaa', softWrap: false, );");
        }

        @Test
        void testEmptyValueRejected() throws Exception {
            var unit = resolve(IMPORT + "f() => Text('aaa');");
            var properties = describe(descriptions, unit, "Text(");
            var node = descriptions.property(idOf(properties, "maxLines")).orElseThrow();
            assertThrows(
                    IllegalStateException.class,
                    () -> node.changeValue(new PropertyValue(null, null, null, null, null)));
        }

        @Test
        void testFormatsEnclosingBody() throws Exception {
            var formatting = new WidgetDescriptions(
                    FlutterTestUnits.catalog(),
                    code -> code.replace(", )", ")"),
                    PropertyEditorConfig.defaults());
            var unit = resolve(IMPORT + "f() => Text('aaa');\ng() => Text('bbb', );");
            var properties = describe(formatting, unit, "Text(");
            var change = formatting.setPropertyValue(idOf(properties, "maxLines"), PropertyValue.ofInt(3));
            assertChange(unit, change, IMPORT + "f() => Text('aaa', maxLines: 3);\ng() => Text('bbb', );");
        }

        @Test
        void testFormatterLeavingCodeUnchanged() throws Exception {
            var formatting = new WidgetDescriptions(
                    FlutterTestUnits.catalog(), SourceFormatter.NONE, PropertyEditorConfig.defaults());
            var unit = resolve(IMPORT + "Widget build() {\n  return Text('aaa');\n}\n");
            var properties = describe(formatting, unit, "Text(");
            var change = formatting.setPropertyValue(idOf(properties, "maxLines"), PropertyValue.ofInt(3));
            assertEquals(1, change.get().edits().get(0).edits().size());
        }
    }

    @Nested
    class Enums {

        @Test
        void testEnumThroughImportedLibrary() throws Exception {
            var unit = resolve(IMPORT + "f() => Text('aaa');");
            var properties = describe(descriptions, unit, "Text(");
            var change = descriptions.setPropertyValue(
                    idOf(properties, "textAlign"), PropertyValue.ofEnum(TEXT_ALIGN_CENTER));
            assertChange(unit, change, IMPORT + "f() => Text('aaa', textAlign: TextAlign.center, );");
        }

        @Test
        void testEnumThroughPrefixedImport() throws Exception {
            var code = "import 'package:flutter/widgets.dart' as w;\nf() => w.Text('aaa');";
            var unit = resolve(code);
            var properties = describe(descriptions, unit, "w.Text(");
            var change = descriptions.setPropertyValue(
                    idOf(properties, "textAlign"), PropertyValue.ofEnum(TEXT_ALIGN_CENTER));
            assertChange(
                    unit,
                    change,
                    "import 'package:flutter/widgets.dart' as w;\n"
                            + "f() => w.Text('aaa', textAlign: w.TextAlign.center, );");
        }

        @Test
        void testEnumAddsImport() throws Exception {
            var unit = resolve("f() => Text('aaa');");
            var properties = describe(descriptions, unit, "Text(");
            var change = descriptions.setPropertyValue(
                    idOf(properties, "textAlign"), PropertyValue.ofEnum(TEXT_ALIGN_CENTER));
            assertChange(unit, change, """
                    import 'package:flutter/painting.dart';

                    f() => Text('aaa', textAlign: TextAlign.center, );""");
        }

        @Test
        void testUnresolvedEnumWrittenByName() throws Exception {
            var unit = resolve(IMPORT + "f() => Text('aaa', textAlign: TextAlign.left);");
            var properties = describe(descriptions, unit, "Text(");
            var change = descriptions.setPropertyValue(
                    idOf(properties, "textAlign"), PropertyValue.ofEnum(new EnumValue("dart:ui", "Nope", "x")));
            assertChange(unit, change, IMPORT + "f() => Text('aaa', textAlign: Nope.x);");
        }
    }

    @Nested
    class NestedObjects {

        @Test
        void testCreatesNestedObject() throws Exception {
            var unit = resolve(IMPORT + "f() => Text('aaa');");
            var properties = describe(descriptions, unit, "Text(");
            var change = descriptions.setPropertyValue(
                    idOf(properties, "style", "fontSize"), PropertyValue.ofDouble(24));
            assertChange(unit, change, IMPORT + "f() => Text('aaa', style: TextStyle(fontSize: 24, ), );");
        }

        @Test
        void testAddsToExistingNestedObject() throws Exception {
            var unit = resolve(IMPORT + "f() => Text('aaa', style: TextStyle(fontSize: 10));");
            var properties = describe(descriptions, unit, "Text(");
            var change = descriptions.setPropertyValue(
                    idOf(properties, "style", "letterSpacing"), PropertyValue.ofDouble(1.5));
            assertChange(
                    unit, change, IMPORT + "f() => Text('aaa', style: TextStyle(fontSize: 10, letterSpacing: 1.5, ));");
        }

        @Test
        void testBindings() throws Exception {
            var unit = resolve(IMPORT + "f() => Text('aaa', style: TextStyle(fontSize: 10));");
            var properties = describe(descriptions, unit, "Text(");
            var data = descriptions.property(idOf(properties, "data")).orElseThrow();
            var style = descriptions.property(idOf(properties, "style")).orElseThrow();
            var softWrap = descriptions.property(idOf(properties, "softWrap")).orElseThrow();
            var fontSize = style.child("fontSize").orElseThrow();

            var dataBinding = assertInstanceOf(PropertyBinding.ArgumentSet.class, data.binding());
            assertEquals("'aaa'", unit.textOf(dataBinding.value()));
            assertInstanceOf(PropertyBinding.ArgumentUnset.class, softWrap.binding());
            assertInstanceOf(PropertyBinding.ArgumentSet.class, fontSize.binding());
            assertEquals(style, fontSize.parent());
            assertEquals("fontSize", fontSize.binding().parameter().name());
        }
    }

    @Nested
    class RemoveValue {

        @Test
        void testRemoveNotLastArgument() throws Exception {
            var unit = resolve(IMPORT + "f() => Text('aaa', maxLines: 1, softWrap: true);");
            var properties = describe(descriptions, unit, "Text(");
            var change = descriptions.setPropertyValue(idOf(properties, "maxLines"), null);
            assertEquals("Remove maxLines", change.get().message());
            assertChange(unit, change, IMPORT + "f() => Text('aaa', softWrap: true);");
        }

        @Test
        void testRemoveLastArgument() throws Exception {
            var unit = resolve(IMPORT + "f() => Text('aaa', maxLines: 1, softWrap: true);");
            var properties = describe(descriptions, unit, "Text(");
            var change = descriptions.setPropertyValue(idOf(properties, "softWrap"), null);
            assertChange(unit, change, IMPORT + "f() => Text('aaa', maxLines: 1, );");
        }

        @Test
        void testRemoveNestedObject() throws Exception {
            var unit = resolve(IMPORT + "f() => Text('aaa', style: TextStyle(fontSize: 10), maxLines: 2);");
            var properties = describe(descriptions, unit, "Text(");
            var change = descriptions.setPropertyValue(idOf(properties, "style"), null);
            assertChange(unit, change, IMPORT + "f() => Text('aaa', maxLines: 2);");
        }

        @Test
        void testRemoveAbsentArgument() throws Exception {
            var unit = resolve(IMPORT + "f() => Text('aaa');");
            var properties = describe(descriptions, unit, "Text(");
            assertNoChange(descriptions.setPropertyValue(idOf(properties, "maxLines"), null));
            assertNoChange(descriptions.setPropertyValue(idOf(properties, "style", "fontSize"), null));
        }
    }
}
