package ai.widgetprops.property;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import ai.widgetprops.testutil.FlutterTestUnits;
import org.junit.jupiter.api.Test;

class DocCommentsTest {

    @Test
    void testSlashComments() {
        assertNull(DocComments.toPlainText(null));
        assertEquals("The text to display.", DocComments.toPlainText("/// The text to display."));
        assertEquals("first,\nsecond.", DocComments.toPlainText("/// first,\n/// second."));
        assertEquals("", DocComments.toPlainText("///"));
        assertEquals("tight", DocComments.toPlainText("///tight"));
        assertEquals(" indented", DocComments.toPlainText("///  indented"));
    }

    @Test
    void testBlockComments() {
        assertEquals(
                "A convenience widget\nthat paints.",
                DocComments.toPlainText("/**\n * A convenience widget\n * that paints.\n */"));
        assertEquals("One line.", DocComments.toPlainText("/** One line. */"));
        assertEquals("Line\n\nafter blank.", DocComments.toPlainText("/**\n * Line\n *\n * after blank.\n */"));
    }

    @Test
    void testParameterDocumentation() {
        var text = FlutterTestUnits.catalog().classNamed("Text").orElseThrow();
        var constructor = text.unnamedConstructor();
        assertEquals(
                "The text to display.",
                DocComments.parameterDocumentation(constructor.parameter("data").orElseThrow()));
        assertEquals(
                "An optional maximum number of lines for the text to span,\nwrapping if necessary.",
                DocComments.parameterDocumentation(constructor.parameter("maxLines").orElseThrow()));
        // not a field formal parameter
        assertNull(DocComments.parameterDocumentation(constructor.parameter("key").orElseThrow()));
    }

    @Test
    void testClassDocumentation() {
        var container = FlutterTestUnits.catalog().classNamed("Container").orElseThrow();
        assertEquals(
                "A convenience widget that combines common painting, positioning, and sizing\nwidgets.",
                DocComments.toPlainText(container.documentationComment()));
    }
}
