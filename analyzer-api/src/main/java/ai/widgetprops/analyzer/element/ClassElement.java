package ai.widgetprops.analyzer.element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * A class or enum declaration. Instances are built once through {@link Builder} and are immutable afterwards;
 * identity comparison is meaningful within one catalog.
 */
public final class ClassElement {
    private final String name;
    private final String libraryUri;
    private final Set<String> exportingLibraries;
    private final @Nullable String supertypeName;
    private final boolean isEnum;
    private final boolean nested;
    private final List<String> enumConstants;
    private final List<FieldElement> fields;
    private final @Nullable String documentationComment;
    private final List<ConstructorElement> constructors = new ArrayList<>();

    private ClassElement(Builder builder) {
        this.name = builder.name;
        this.libraryUri = builder.libraryUri;
        this.exportingLibraries = Collections.unmodifiableSet(new LinkedHashSet<>(builder.exportingLibraries));
        this.supertypeName = builder.supertypeName;
        this.isEnum = builder.isEnum;
        this.nested = builder.nested;
        this.enumConstants = List.copyOf(builder.enumConstants);
        this.fields = List.copyOf(builder.fields);
        this.documentationComment = builder.documentationComment;
    }

    public static Builder builder(String name, String libraryUri) {
        return new Builder(name, libraryUri);
    }

    public String name() {
        return name;
    }

    /** The library that declares this class. */
    public String libraryUri() {
        return libraryUri;
    }

    /** Public libraries that re-export this class, in the order they were declared. */
    public Set<String> exportingLibraries() {
        return exportingLibraries;
    }

    /** Whether importing {@code uri} makes this class visible. */
    public boolean isProvidedBy(String uri) {
        return libraryUri.equals(uri) || exportingLibraries.contains(uri);
    }

    public @Nullable String supertypeName() {
        return supertypeName;
    }

    public boolean isEnum() {
        return isEnum;
    }

    /** Whether properties of this type are edited through the constructor parameters of the type. */
    public boolean isNested() {
        return nested;
    }

    public List<String> enumConstants() {
        return enumConstants;
    }

    public List<FieldElement> fields() {
        return fields;
    }

    public Optional<FieldElement> field(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    public @Nullable String documentationComment() {
        return documentationComment;
    }

    public List<ConstructorElement> constructors() {
        return List.copyOf(constructors);
    }

    public @Nullable ConstructorElement unnamedConstructor() {
        return getNamedConstructor("");
    }

    public @Nullable ConstructorElement getNamedConstructor(String constructorName) {
        for (var constructor : constructors) {
            if (constructor.name().equals(constructorName)) {
                return constructor;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return name + " (" + libraryUri + ")";
    }

    public static final class Builder {
        private final String name;
        private final String libraryUri;
        private final Set<String> exportingLibraries = new LinkedHashSet<>();
        private @Nullable String supertypeName;
        private boolean isEnum;
        private boolean nested;
        private final List<String> enumConstants = new ArrayList<>();
        private final List<FieldElement> fields = new ArrayList<>();
        private @Nullable String documentationComment;
        private final List<ConstructorSpec> constructors = new ArrayList<>();

        private Builder(String name, String libraryUri) {
            this.name = name;
            this.libraryUri = libraryUri;
        }

        public Builder exportedBy(String uri) {
            exportingLibraries.add(uri);
            return this;
        }

        public Builder supertype(@Nullable String supertype) {
            this.supertypeName = supertype;
            return this;
        }

        public Builder nested(boolean nested) {
            this.nested = nested;
            return this;
        }

        public Builder documentation(@Nullable String comment) {
            this.documentationComment = comment;
            return this;
        }

        public Builder enumConstant(String constant) {
            this.isEnum = true;
            enumConstants.add(constant);
            return this;
        }

        public Builder field(String fieldName, String type, @Nullable String comment) {
            fields.add(new FieldElement(fieldName, TypeRef.parse(type), comment));
            return this;
        }

        public ConstructorSpec constructor(String constructorName) {
            var spec = new ConstructorSpec(this, constructorName);
            constructors.add(spec);
            return spec;
        }

        public ClassElement build() {
            var element = new ClassElement(this);
            for (var spec : constructors) {
                var parameters = new ArrayList<ParameterElement>();
                for (var p : spec.parameters) {
                    FieldElement field = null;
                    if (p.fieldFormal) {
                        field = element.field(p.name)
                                .orElseThrow(() -> new IllegalArgumentException(
                                        "No field '%s' in %s for this.%s".formatted(p.name, name, p.name)));
                    }
                    var type = field != null && p.type == null ? field.type() : TypeRef.parse(requireType(p));
                    parameters.add(new ParameterElement(p.name, type, p.named, p.required, field));
                }
                element.constructors.add(new ConstructorElement(element, spec.name, parameters));
            }
            return element;
        }

        private String requireType(ParameterSpec p) {
            if (p.type == null) {
                throw new IllegalArgumentException("Parameter '%s' of %s needs a type".formatted(p.name, name));
            }
            return p.type;
        }
    }

    /** Collects the parameters of one constructor while building a {@link ClassElement}. */
    public static final class ConstructorSpec {
        private final Builder owner;
        private final String name;
        private final List<ParameterSpec> parameters = new ArrayList<>();

        private ConstructorSpec(Builder owner, String name) {
            this.owner = owner;
            this.name = name;
        }

        /**
         * Adds a parameter.
         *
         * @param type the declared type, or null for a field formal parameter that takes its field's type
         */
        public ConstructorSpec parameter(
                String parameterName, @Nullable String type, boolean named, boolean required, boolean fieldFormal) {
            parameters.add(new ParameterSpec(parameterName, type, named, required, fieldFormal));
            return this;
        }

        public ConstructorSpec positional(String parameterName, String type) {
            return parameter(parameterName, type, false, true, false);
        }

        public ConstructorSpec named(String parameterName, String type) {
            return parameter(parameterName, type, true, false, false);
        }

        public ConstructorSpec fieldFormal(String parameterName) {
            return parameter(parameterName, null, true, false, true);
        }

        public Builder done() {
            return owner;
        }
    }

    private record ParameterSpec(
            String name, @Nullable String type, boolean named, boolean required, boolean fieldFormal) {}
}
