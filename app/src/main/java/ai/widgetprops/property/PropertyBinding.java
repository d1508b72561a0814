package ai.widgetprops.property;

import ai.widgetprops.analyzer.ast.Expression;
import ai.widgetprops.analyzer.ast.InstanceCreationExpression;
import ai.widgetprops.analyzer.element.ParameterElement;
import org.jetbrains.annotations.Nullable;

/**
 * Where a property lives in source. A null {@link #parameter()} marks a group property, such as {@code Container},
 * that stands for a whole object rather than one of its arguments.
 */
public sealed interface PropertyBinding
        permits PropertyBinding.ArgumentSet, PropertyBinding.ArgumentUnset, PropertyBinding.Unmaterialized {

    @Nullable
    ParameterElement parameter();

    /**
     * The argument is present in {@code creation}.
     *
     * @param argument the whole argument, a {@code NamedExpression} for named parameters
     * @param value the value part of {@code argument}, the same node for positional arguments
     */
    record ArgumentSet(
            InstanceCreationExpression creation, Expression argument, Expression value, ParameterElement parameter)
            implements PropertyBinding {}

    /** The object is instantiated by {@code creation} but has no argument for the parameter. */
    record ArgumentUnset(InstanceCreationExpression creation, @Nullable ParameterElement parameter)
            implements PropertyBinding {}

    /** The object does not exist in source yet; setting the property instantiates it. */
    record Unmaterialized(ClassDescription description, @Nullable ParameterElement parameter)
            implements PropertyBinding {}
}
