package ai.widgetprops.analyzer;

import ai.widgetprops.analyzer.element.ClassElement;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Loads an {@link ElementCatalog} from its JSON description: a list of libraries, each declaring classes with fields,
 * constructors and enum constants.
 */
public final class CatalogReader {
    private static final Logger logger = LogManager.getLogger(CatalogReader.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private CatalogReader() {
        // utility class
    }

    public static ElementCatalog read(InputStream json) throws IOException {
        var file = objectMapper.readValue(json, CatalogFile.class);
        var catalog = new ElementCatalog();
        for (var library : Objects.requireNonNullElse(file.libraries(), List.<LibrarySpec>of())) {
            for (var spec : nonNull(library.classes())) {
                catalog.add(toElement(library, spec));
            }
        }
        logger.debug("Loaded {} classes", catalog.classes().size());
        return catalog;
    }

    /** Reads a catalog bundled as a classpath resource. */
    public static ElementCatalog readResource(String resourceName) {
        try (var in = CatalogReader.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new IllegalArgumentException("Catalog resource not found: " + resourceName);
            }
            return read(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read catalog " + resourceName, e);
        }
    }

    private static ClassElement toElement(LibrarySpec library, ClassSpec spec) {
        var builder = ClassElement.builder(spec.name(), library.uri())
                .supertype(spec.supertype())
                .nested(Boolean.TRUE.equals(spec.nested()))
                .documentation(spec.doc());
        nonNull(library.exportedBy()).forEach(builder::exportedBy);
        nonNull(spec.enumConstants()).forEach(builder::enumConstant);
        for (var field : nonNull(spec.fields())) {
            builder.field(field.name(), field.type(), field.doc());
        }
        for (var constructor : nonNull(spec.constructors())) {
            var constructorSpec = builder.constructor(Objects.requireNonNullElse(constructor.name(), ""));
            for (var p : nonNull(constructor.parameters())) {
                boolean named = !Boolean.FALSE.equals(p.named());
                boolean required = p.required() != null ? p.required() : !named;
                constructorSpec.parameter(p.name(), p.type(), named, required, Boolean.TRUE.equals(p.fieldFormal()));
            }
        }
        return builder.build();
    }

    private static <T> List<T> nonNull(@Nullable List<T> list) {
        return list == null ? List.of() : list;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogFile(@Nullable List<LibrarySpec> libraries) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LibrarySpec(String uri, @Nullable List<String> exportedBy, @Nullable List<ClassSpec> classes) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ClassSpec(
            String name,
            @Nullable String supertype,
            @Nullable Boolean nested,
            @Nullable String doc,
            @Nullable List<String> enumConstants,
            @Nullable List<FieldSpec> fields,
            @Nullable List<ConstructorSpec> constructors) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FieldSpec(String name, String type, @Nullable String doc) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ConstructorSpec(@Nullable String name, @Nullable List<ParameterSpec> parameters) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ParameterSpec(
            String name,
            @Nullable String type,
            @Nullable Boolean named,
            @Nullable Boolean required,
            @Nullable Boolean fieldFormal) {}
}
