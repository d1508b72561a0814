package ai.widgetprops.analyzer.element;

import java.util.List;
import java.util.Optional;

/** A constructor; the unnamed constructor has the empty name. */
public final class ConstructorElement {
    private final ClassElement enclosingElement;
    private final String name;
    private final List<ParameterElement> parameters;

    ConstructorElement(ClassElement enclosingElement, String name, List<ParameterElement> parameters) {
        this.enclosingElement = enclosingElement;
        this.name = name;
        this.parameters = List.copyOf(parameters);
    }

    public ClassElement enclosingElement() {
        return enclosingElement;
    }

    public String name() {
        return name;
    }

    public boolean isUnnamed() {
        return name.isEmpty();
    }

    public List<ParameterElement> parameters() {
        return parameters;
    }

    public Optional<ParameterElement> parameter(String parameterName) {
        return parameters.stream().filter(p -> p.name().equals(parameterName)).findFirst();
    }

    /** Positional parameters in declaration order. */
    public List<ParameterElement> positionalParameters() {
        return parameters.stream().filter(ParameterElement::isPositional).toList();
    }

    @Override
    public String toString() {
        return isUnnamed() ? enclosingElement.name() : enclosingElement.name() + "." + name;
    }
}
