package ai.widgetprops.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/** Editor hint for a property; {@code enumItems} is only populated for {@link EditorKind#ENUM}. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record PropertyEditor(EditorKind kind, List<EnumValue> enumItems) {

    public PropertyEditor {
        enumItems = List.copyOf(enumItems);
    }

    public static PropertyEditor of(EditorKind kind) {
        return new PropertyEditor(kind, List.of());
    }

    public static PropertyEditor ofEnum(List<EnumValue> items) {
        return new PropertyEditor(EditorKind.ENUM, items);
    }
}
