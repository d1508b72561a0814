package ai.widgetprops.property;

import ai.widgetprops.analyzer.element.FieldElement;
import ai.widgetprops.analyzer.element.ParameterElement;
import com.google.common.base.Splitter;
import org.jetbrains.annotations.Nullable;

/** Plain-text documentation of fields and parameters. */
public final class DocComments {
    private static final Splitter LINES = Splitter.on('\n');

    private DocComments() {
        // utility class
    }

    public static @Nullable String fieldDocumentation(FieldElement field) {
        return toPlainText(field.documentationComment());
    }

    /** Only parameters that initialize a field ({@code this.name}) have documentation. */
    public static @Nullable String parameterDocumentation(ParameterElement parameter) {
        var field = parameter.field();
        if (field == null) {
            return null;
        }
        return fieldDocumentation(field);
    }

    /**
     * Strips the markers of a {@code /** ... *}{@code /} or {@code ///} doc comment. Lines are trimmed and lose a
     * leading {@code *} or {@code ///} together with one following space.
     */
    public static @Nullable String toPlainText(@Nullable String rawComment) {
        if (rawComment == null) {
            return null;
        }
        var text = rawComment;
        if (text.startsWith("/**")) {
            text = text.substring(3);
        }
        if (text.endsWith("*/")) {
            text = text.substring(0, text.length() - 2);
        }
        text = text.trim();

        var sb = new StringBuilder();
        boolean firstLine = true;
        for (var rawLine : LINES.split(text)) {
            var line = rawLine.trim();
            if (line.startsWith("*")) {
                line = stripSpace(line.substring(1));
            } else if (line.startsWith("///")) {
                line = stripSpace(line.substring(3));
            }
            if (!firstLine) {
                sb.append('\n');
            }
            firstLine = false;
            sb.append(line);
        }
        return sb.toString();
    }

    private static String stripSpace(String line) {
        return line.startsWith(" ") ? line.substring(1) : line;
    }
}
