package ai.widgetprops.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

/**
 * The value of a property as exchanged with the client. At most one variant is expected to be populated; a value
 * with none is a caller error that code generation rejects.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PropertyValue(
        @Nullable Boolean boolValue,
        @Nullable Double doubleValue,
        @Nullable Integer intValue,
        @Nullable String stringValue,
        @Nullable EnumValue enumValue) {

    public static PropertyValue ofBool(boolean value) {
        return new PropertyValue(value, null, null, null, null);
    }

    public static PropertyValue ofDouble(double value) {
        return new PropertyValue(null, value, null, null, null);
    }

    public static PropertyValue ofInt(int value) {
        return new PropertyValue(null, null, value, null, null);
    }

    public static PropertyValue ofString(String value) {
        return new PropertyValue(null, null, null, value, null);
    }

    public static PropertyValue ofEnum(EnumValue value) {
        return new PropertyValue(null, null, null, null, value);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return boolValue == null && doubleValue == null && intValue == null && stringValue == null && enumValue == null;
    }
}
