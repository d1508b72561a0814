package ai.widgetprops.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * What the client sees of one property.
 *
 * @param required whether the constructor parameter must be given, so the property cannot be removed
 * @param safeToUpdate whether the current value is absent or simple enough to be replaced through an editor
 * @param expression the source text of the current value, if the property is set
 * @param children nested properties, e.g. the four sides of an {@code EdgeInsets}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PropertyDescriptor(
        int id,
        boolean required,
        boolean safeToUpdate,
        String name,
        @Nullable String documentation,
        @Nullable String expression,
        @Nullable PropertyValue value,
        @Nullable PropertyEditor editor,
        List<PropertyDescriptor> children) {

    public PropertyDescriptor {
        children = List.copyOf(children);
    }

    public PropertyDescriptor withChildren(List<PropertyDescriptor> newChildren) {
        return new PropertyDescriptor(
                id, required, safeToUpdate, name, documentation, expression, value, editor, newChildren);
    }
}
