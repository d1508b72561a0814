package ai.widgetprops.property;

import ai.widgetprops.analyzer.element.ClassElement;
import ai.widgetprops.analyzer.element.ConstructorElement;
import ai.widgetprops.edit.EditBuilder;

/** A class that is not instantiated in source yet, and the constructor that will instantiate it. */
public record ClassDescription(ClassElement element, ConstructorElement constructor) {

    public ClassDescription {
        if (constructor.enclosingElement() != element) {
            throw new IllegalArgumentException(constructor + " is not a constructor of " + element.name());
        }
    }

    /** Writes {@code Class} or {@code Class.name}, the callee of the instance creation. */
    public void writeConstructorReference(EditBuilder builder) {
        builder.writeReference(element);
        if (!constructor.isUnnamed()) {
            builder.write(".");
            builder.write(constructor.name());
        }
    }
}
