package ai.widgetprops.analyzer.element;

import java.util.ArrayList;
import java.util.List;

/** A reference to a type by name, e.g. {@code double}, {@code EdgeInsetsGeometry?} or {@code List<Widget>}. */
public record TypeRef(String name, List<TypeRef> typeArguments, boolean nullable) {

    public TypeRef {
        typeArguments = List.copyOf(typeArguments);
    }

    public static TypeRef named(String name) {
        return new TypeRef(name, List.of(), false);
    }

    /**
     * Parses the textual form of a type. Only names, type arguments and the trailing {@code ?} are understood.
     *
     * @throws IllegalArgumentException if the text is not a well-formed type
     */
    public static TypeRef parse(String text) {
        var parser = new Parser(text.replace(" ", ""));
        var type = parser.type();
        if (parser.pos != parser.text.length()) {
            throw new IllegalArgumentException("Malformed type: " + text);
        }
        return type;
    }

    public boolean isBool() {
        return name.equals("bool");
    }

    public boolean isInt() {
        return name.equals("int");
    }

    public boolean isDouble() {
        return name.equals("double");
    }

    public boolean isString() {
        return name.equals("String");
    }

    public boolean isIterable() {
        return name.equals("List") || name.equals("Iterable") || name.equals("Set");
    }

    @Override
    public String toString() {
        var sb = new StringBuilder(name);
        if (!typeArguments.isEmpty()) {
            sb.append('<');
            for (int i = 0; i < typeArguments.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(typeArguments.get(i));
            }
            sb.append('>');
        }
        if (nullable) sb.append('?');
        return sb.toString();
    }

    private static final class Parser {
        private final String text;
        private int pos;

        Parser(String text) {
            this.text = text;
        }

        TypeRef type() {
            int start = pos;
            while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
                pos++;
            }
            if (start == pos) {
                throw new IllegalArgumentException("Expected type name at " + start + " in " + text);
            }
            var name = text.substring(start, pos);
            var arguments = new ArrayList<TypeRef>();
            if (pos < text.length() && text.charAt(pos) == '<') {
                pos++;
                arguments.add(type());
                while (pos < text.length() && text.charAt(pos) == ',') {
                    pos++;
                    arguments.add(type());
                }
                if (pos >= text.length() || text.charAt(pos) != '>') {
                    throw new IllegalArgumentException("Unclosed type arguments in " + text);
                }
                pos++;
            }
            boolean nullable = false;
            if (pos < text.length() && text.charAt(pos) == '?') {
                nullable = true;
                pos++;
            }
            return new TypeRef(name, arguments, nullable);
        }
    }
}
