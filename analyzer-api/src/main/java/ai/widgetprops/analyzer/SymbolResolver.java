package ai.widgetprops.analyzer;

import ai.widgetprops.analyzer.element.ClassElement;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/** Resolves declared classes by the library that exports them. */
public interface SymbolResolver {

    /**
     * Looks up the class (or enum) named {@code className} that is declared in, or exported by, the library with
     * the given URI. Completes with an empty Optional when no such class is known.
     */
    CompletableFuture<Optional<ClassElement>> findClass(String libraryUri, String className);
}
