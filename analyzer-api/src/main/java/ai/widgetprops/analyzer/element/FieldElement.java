package ai.widgetprops.analyzer.element;

import org.jetbrains.annotations.Nullable;

/**
 * A field of a class.
 *
 * @param documentationComment the raw doc comment including its markers, or null
 */
public record FieldElement(String name, TypeRef type, @Nullable String documentationComment) {}
