package ai.widgetprops.property;

import ai.widgetprops.analyzer.ast.BooleanLiteral;
import ai.widgetprops.analyzer.ast.DoubleLiteral;
import ai.widgetprops.analyzer.ast.Expression;
import ai.widgetprops.analyzer.ast.IntegerLiteral;
import ai.widgetprops.analyzer.ast.SimpleStringLiteral;
import ai.widgetprops.analyzer.element.ClassElement;
import ai.widgetprops.analyzer.element.TypeRef;
import ai.widgetprops.edit.EditBuilder;
import ai.widgetprops.protocol.PropertyValue;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.jetbrains.annotations.Nullable;

/** Converts between {@link PropertyValue}s and their Dart source spelling. */
public final class ValueCodec {

    private ValueCodec() {
        // utility class
    }

    /**
     * Writes {@code value} as code. An enum value is written as a reference to {@code enumElement} followed by the
     * member name; when the enum class could not be resolved its plain name is written instead.
     *
     * @throws IllegalStateException if {@code value} has no populated variant
     */
    public static void writeCode(EditBuilder builder, PropertyValue value, @Nullable ClassElement enumElement) {
        var enumValue = value.enumValue();
        if (enumValue != null) {
            if (enumElement != null) {
                builder.writeReference(enumElement);
            } else {
                builder.write(enumValue.className());
            }
            builder.write(".");
            builder.write(enumValue.name());
            return;
        }
        builder.write(toPrimitiveCode(value));
    }

    /**
     * Returns the literal for a boolean, double, integer or string value.
     *
     * @throws IllegalStateException if no primitive variant is populated
     */
    public static String toPrimitiveCode(PropertyValue value) {
        if (value.boolValue() != null) {
            return value.boolValue().toString();
        }
        if (value.doubleValue() != null) {
            return toDoubleCode(value.doubleValue());
        }
        if (value.intValue() != null) {
            return value.intValue().toString();
        }
        if (value.stringValue() != null) {
            return toStringCode(value.stringValue());
        }
        throw new IllegalStateException("Not a primitive value: " + value);
    }

    /**
     * One decimal digit, rounded half up on the exact binary value, without a trailing {@code .0}. A negative value
     * that rounds to zero is {@code -0}. An absent value is {@code 0}.
     */
    public static String toDoubleCode(@Nullable Double value) {
        if (value == null) {
            return "0";
        }
        double v = value;
        if (Double.isNaN(v)) {
            return "double.nan";
        }
        if (Double.isInfinite(v)) {
            return v > 0 ? "double.infinity" : "-double.infinity";
        }
        var rounded = new BigDecimal(v).setScale(1, RoundingMode.HALF_UP);
        var code = rounded.toPlainString();
        // negative values that round to zero keep their sign
        if (rounded.signum() == 0 && Math.copySign(1.0, v) < 0) {
            code = "-" + code;
        }
        if (code.endsWith(".0")) {
            code = code.substring(0, code.length() - 2);
        }
        return code;
    }

    /** A single-quoted string literal; quotes, backslashes, dollars and line breaks are escaped. */
    public static String toStringCode(String value) {
        var sb = new StringBuilder(value.length() + 2).append('\'');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\'' -> sb.append("\\'");
                case '\\' -> sb.append("\\\\");
                case '$' -> sb.append("\\$");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }

    /** Decodes a boolean, integer, double or simple string literal; null for any other expression. */
    public static @Nullable PropertyValue literalToValue(@Nullable Expression expression) {
        if (expression instanceof BooleanLiteral literal) {
            return PropertyValue.ofBool(literal.value());
        }
        if (expression instanceof IntegerLiteral literal) {
            long v = literal.value();
            return v == (int) v ? PropertyValue.ofInt((int) v) : null;
        }
        if (expression instanceof DoubleLiteral literal) {
            return PropertyValue.ofDouble(literal.value());
        }
        if (expression instanceof SimpleStringLiteral literal) {
            return PropertyValue.ofString(literal.value());
        }
        return null;
    }

    /** Like {@link #literalToValue(Expression)}, but integer literals given for a {@code double} are doubles. */
    public static @Nullable PropertyValue literalToValue(@Nullable Expression expression, TypeRef type) {
        if (type.isDouble()) {
            var number = literalToDouble(expression);
            return number == null ? null : PropertyValue.ofDouble(number);
        }
        return literalToValue(expression);
    }

    /** The numeric value of a double or integer literal; null for any other expression, including constants. */
    public static @Nullable Double literalToDouble(@Nullable Expression expression) {
        if (expression instanceof DoubleLiteral literal) {
            return literal.value();
        }
        if (expression instanceof IntegerLiteral literal) {
            return (double) literal.value();
        }
        return null;
    }
}
