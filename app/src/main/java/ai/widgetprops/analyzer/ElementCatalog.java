package ai.widgetprops.analyzer;

import ai.widgetprops.analyzer.element.ClassElement;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The set of classes known to the analysis front end. Class names are unique within a catalog, which stands in for
 * the library scope a full resolver would compute.
 */
public final class ElementCatalog implements TypeProvider, SymbolResolver {
    private static final Logger logger = LogManager.getLogger(ElementCatalog.class);

    private final Map<String, ClassElement> classesByName = new LinkedHashMap<>();

    public ElementCatalog add(ClassElement element) {
        var previous = classesByName.putIfAbsent(element.name(), element);
        if (previous != null) {
            throw new IllegalArgumentException("Duplicate class " + element.name() + ", already declared in "
                    + previous.libraryUri());
        }
        return this;
    }

    public Collection<ClassElement> classes() {
        return Collections.unmodifiableCollection(classesByName.values());
    }

    @Override
    public Optional<ClassElement> classNamed(String name) {
        return Optional.ofNullable(classesByName.get(name));
    }

    @Override
    public boolean isSubtypeOf(ClassElement element, String superName) {
        ClassElement current = element;
        // bounded by the catalog size so a cyclic supertype declaration cannot loop
        for (int i = 0; i <= classesByName.size() && current != null; i++) {
            if (current.name().equals(superName)) {
                return true;
            }
            var supertype = current.supertypeName();
            if (supertype == null) {
                return superName.equals("Object");
            }
            current = classesByName.get(supertype);
        }
        return false;
    }

    @Override
    public CompletableFuture<Optional<ClassElement>> findClass(String libraryUri, String className) {
        var element = classesByName.get(className);
        if (element == null || !element.isProvidedBy(libraryUri)) {
            logger.debug("No class {} provided by {}", className, libraryUri);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return CompletableFuture.completedFuture(Optional.of(element));
    }
}
