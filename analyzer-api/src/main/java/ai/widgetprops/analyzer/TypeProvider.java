package ai.widgetprops.analyzer;

import ai.widgetprops.analyzer.element.ClassElement;
import ai.widgetprops.analyzer.element.TypeRef;
import java.util.Optional;

/** Name-based access to the class elements visible to a resolved unit. */
public interface TypeProvider {

    Optional<ClassElement> classNamed(String name);

    default Optional<ClassElement> classForType(TypeRef type) {
        return classNamed(type.name());
    }

    /** Whether {@code element} is, or transitively extends, the class named {@code superName}. */
    boolean isSubtypeOf(ClassElement element, String superName);
}
