package ai.widgetprops.analyzer.element;

import org.jetbrains.annotations.Nullable;

/**
 * A constructor parameter.
 *
 * @param field the field initialized by a {@code this.name} parameter, null for ordinary parameters
 */
public record ParameterElement(
        String name, TypeRef type, boolean named, boolean required, @Nullable FieldElement field) {

    public boolean isPositional() {
        return !named;
    }

    public boolean isFieldFormal() {
        return field != null;
    }
}
