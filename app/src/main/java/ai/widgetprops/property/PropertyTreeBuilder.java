package ai.widgetprops.property;

import ai.widgetprops.analyzer.TypeProvider;
import ai.widgetprops.analyzer.ast.Expression;
import ai.widgetprops.analyzer.ast.InstanceCreationExpression;
import ai.widgetprops.analyzer.ast.NamedExpression;
import ai.widgetprops.analyzer.ast.PrefixedIdentifier;
import ai.widgetprops.analyzer.element.ClassElement;
import ai.widgetprops.analyzer.element.ConstructorElement;
import ai.widgetprops.analyzer.element.ParameterElement;
import ai.widgetprops.analyzer.element.TypeRef;
import ai.widgetprops.protocol.EditorKind;
import ai.widgetprops.protocol.EnumValue;
import ai.widgetprops.protocol.PropertyDescriptor;
import ai.widgetprops.protocol.PropertyEditor;
import ai.widgetprops.protocol.PropertyValue;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Builds the property tree of one widget instance creation. Ids are assigned depth-first. */
final class PropertyTreeBuilder {
    private static final Logger logger = LogManager.getLogger(PropertyTreeBuilder.class);

    private final EditContext context;
    private final TypeProvider types;
    private final PropertyIdSequence ids;

    PropertyTreeBuilder(EditContext context, PropertyIdSequence ids) {
        this.context = context;
        this.types = context.unit().types();
        this.ids = ids;
    }

    /** The properties of the constructor parameters of {@code widgetCreation}, then its {@code Container}. */
    List<PropertyNode> build(InstanceCreationExpression widgetCreation) {
        var constructor = widgetCreation.staticElement();
        if (constructor == null) {
            logger.debug("No constructor for {}, no properties", widgetCreation.constructorName());
            return List.of();
        }
        var properties = new ArrayList<>(addProperties(null, widgetCreation, null, constructor, 0));
        var container = containerProperty(widgetCreation);
        if (container != null) {
            properties.add(container);
        }
        return properties;
    }

    private List<PropertyNode> addProperties(
            @Nullable PropertyNode parent,
            @Nullable InstanceCreationExpression creation,
            @Nullable ClassDescription description,
            ConstructorElement constructor,
            int depth) {
        var properties = new ArrayList<PropertyNode>();
        for (var parameter : constructor.parameters()) {
            if (!isEditableParameter(parameter)) {
                continue;
            }
            var argument = creation == null ? null : findArgument(creation, constructor, parameter);
            properties.add(createProperty(parent, creation, description, parameter, argument, depth));
        }
        return properties;
    }

    private boolean isEditableParameter(ParameterElement parameter) {
        var type = parameter.type();
        return !parameter.name().equals("key") && !type.isIterable() && !FlutterClasses.isWidgetType(types, type);
    }

    private PropertyNode createProperty(
            @Nullable PropertyNode parent,
            @Nullable InstanceCreationExpression creation,
            @Nullable ClassDescription description,
            ParameterElement parameter,
            @Nullable Expression argument,
            int depth) {
        Expression value = argument instanceof NamedExpression named ? named.expression() : argument;

        PropertyBinding binding;
        if (creation == null) {
            if (description == null) {
                throw new IllegalStateException("Property " + parameter.name() + " has neither object nor class");
            }
            binding = new PropertyBinding.Unmaterialized(description, parameter);
        } else if (argument != null) {
            binding = new PropertyBinding.ArgumentSet(creation, argument, value, parameter);
        } else {
            binding = new PropertyBinding.ArgumentUnset(creation, parameter);
        }

        var property = new PropertyNode(parent, context, binding, descriptor(parameter, value), null);
        addNested(property, parameter.type(), value, depth);
        return property;
    }

    private PropertyDescriptor descriptor(ParameterElement parameter, @Nullable Expression value) {
        var type = parameter.type();
        var decoded = value == null ? null : decodeValue(value, type);
        return new PropertyDescriptor(
                ids.next(),
                parameter.required(),
                value == null || decoded != null,
                parameter.name(),
                DocComments.parameterDocumentation(parameter),
                value == null ? null : context.unit().textOf(value),
                decoded,
                editor(type),
                List.of());
    }

    private @Nullable PropertyValue decodeValue(Expression value, TypeRef type) {
        var typeClass = types.classForType(type).orElse(null);
        if (typeClass != null && typeClass.isEnum()) {
            if (value instanceof PrefixedIdentifier identifier
                    && identifier.prefix().name().equals(typeClass.name())
                    && typeClass.enumConstants().contains(identifier.identifier().name())) {
                return PropertyValue.ofEnum(
                        new EnumValue(typeClass.libraryUri(), typeClass.name(), identifier.identifier().name()));
            }
            return null;
        }
        return ValueCodec.literalToValue(value, type);
    }

    private @Nullable PropertyEditor editor(TypeRef type) {
        if (type.isBool()) {
            return PropertyEditor.of(EditorKind.BOOL);
        }
        if (type.isDouble()) {
            return PropertyEditor.of(EditorKind.DOUBLE);
        }
        if (type.isInt()) {
            return PropertyEditor.of(EditorKind.INT);
        }
        if (type.isString()) {
            return PropertyEditor.of(EditorKind.STRING);
        }
        var typeClass = types.classForType(type).orElse(null);
        if (typeClass != null && typeClass.isEnum()) {
            var items = typeClass.enumConstants().stream()
                    .map(name -> new EnumValue(typeClass.libraryUri(), typeClass.name(), name))
                    .toList();
            return PropertyEditor.ofEnum(items);
        }
        return null;
    }

    /** Adds the sides of an {@code EdgeInsets}, or the properties of a nested object such as a {@code TextStyle}. */
    private void addNested(PropertyNode property, TypeRef type, @Nullable Expression value, int depth) {
        if (FlutterClasses.isEdgeInsetsType(type)) {
            types.classNamed(FlutterClasses.EDGE_INSETS)
                    .ifPresent(edgeInsets -> property.addEdgeInsetsNestedProperties(ids, edgeInsets));
            return;
        }

        var typeClass = types.classForType(type).orElse(null);
        if (typeClass == null || !typeClass.isNested()) {
            return;
        }
        if (depth >= context.config().maxNestingDepth()) {
            logger.debug("Not expanding {} of type {} at depth {}", property.name(), type, depth);
            return;
        }

        List<PropertyNode> nested;
        if (value instanceof InstanceCreationExpression creation
                && creation.classElement() == typeClass
                && creation.staticElement() != null) {
            nested = addProperties(property, creation, null, creation.staticElement(), depth + 1);
        } else if (value == null && typeClass.unnamedConstructor() != null) {
            var constructor = typeClass.unnamedConstructor();
            nested = addProperties(
                    property, null, new ClassDescription(typeClass, constructor), constructor, depth + 1);
        } else {
            return;
        }
        nested.forEach(property::addChild);
    }

    /**
     * The {@code Container} group of a widget that is not itself a {@code Container}. It is bound to an existing
     * {@code Container} parent, or virtual; a virtual one adopts the {@code padding} of a {@code Padding} parent.
     */
    private @Nullable PropertyNode containerProperty(InstanceCreationExpression widgetCreation) {
        var containerElement = types.classNamed(FlutterClasses.CONTAINER).orElse(null);
        if (containerElement == null || widgetCreation.classElement() == containerElement) {
            return null;
        }
        var containerConstructor = containerElement.unnamedConstructor();
        if (containerConstructor == null) {
            return null;
        }

        var parentCreation = FlutterClasses.parentCreation(widgetCreation);
        if (parentCreation != null
                && parentCreation.classElement() == containerElement
                && parentCreation.staticElement() != null) {
            var group = new PropertyNode(
                    null,
                    context,
                    new PropertyBinding.ArgumentUnset(parentCreation, null),
                    groupDescriptor(containerElement),
                    null);
            addProperties(group, parentCreation, null, parentCreation.staticElement(), 1)
                    .forEach(group::addChild);
            return group;
        }

        var virtualContainer = new VirtualContainerProperty(containerElement, widgetCreation);
        var description = new ClassDescription(containerElement, containerConstructor);
        var group = new PropertyNode(
                null,
                context,
                new PropertyBinding.Unmaterialized(description, null),
                groupDescriptor(containerElement),
                virtualContainer);

        NamedExpression paddingArgument = null;
        if (parentCreation != null && parentCreation.classElement().name().equals(FlutterClasses.PADDING)) {
            paddingArgument = FlutterClasses.argumentByName(parentCreation.argumentList().arguments(), "padding");
            if (paddingArgument != null) {
                virtualContainer.setParentCreation(parentCreation, paddingArgument);
                logger.debug("Container of {} will replace its Padding", widgetCreation.classElement().name());
            }
        }

        for (var parameter : containerConstructor.parameters()) {
            if (!isEditableParameter(parameter)) {
                continue;
            }
            PropertyNode child;
            if (paddingArgument != null && parameter.name().equals("padding")) {
                child = createProperty(group, parentCreation, null, parameter, paddingArgument, 1);
            } else {
                child = createProperty(group, null, description, parameter, null, 1);
            }
            group.addChild(child);
        }
        return group;
    }

    private PropertyDescriptor groupDescriptor(ClassElement element) {
        return new PropertyDescriptor(
                ids.next(),
                false,
                false,
                element.name(),
                DocComments.toPlainText(element.documentationComment()),
                null,
                null,
                null,
                List.of());
    }

    /** The argument for {@code parameter}: by name for named parameters, by position otherwise. */
    private static @Nullable Expression findArgument(
            InstanceCreationExpression creation, ConstructorElement constructor, ParameterElement parameter) {
        var arguments = creation.argumentList().arguments();
        if (parameter.named()) {
            return FlutterClasses.argumentByName(arguments, parameter.name());
        }
        int index = constructor.positionalParameters().indexOf(parameter);
        return FlutterClasses.argumentByIndex(arguments, index);
    }
}
