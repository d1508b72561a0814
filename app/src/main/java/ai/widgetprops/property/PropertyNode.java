package ai.widgetprops.property;

import ai.widgetprops.analyzer.SourceRange;
import ai.widgetprops.analyzer.ast.ArgumentList;
import ai.widgetprops.analyzer.ast.AstNode;
import ai.widgetprops.analyzer.ast.Expression;
import ai.widgetprops.analyzer.ast.FunctionBody;
import ai.widgetprops.analyzer.ast.NamedExpression;
import ai.widgetprops.analyzer.ast.TokenType;
import ai.widgetprops.analyzer.element.ClassElement;
import ai.widgetprops.analyzer.element.ParameterElement;
import ai.widgetprops.edit.EditBuilder;
import ai.widgetprops.edit.FileEditBuilder;
import ai.widgetprops.edit.SourceChange;
import ai.widgetprops.protocol.PropertyDescriptor;
import ai.widgetprops.protocol.PropertyValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * One editable property of a widget, or of an object nested in a widget's arguments.
 *
 * <p>Nodes are built once per description of a widget. Their offsets refer to the source the description was built
 * from, so after any change has been applied the tree is stale and must be rebuilt.
 */
public final class PropertyNode {
    private static final Logger logger = LogManager.getLogger(PropertyNode.class);

    private final @Nullable PropertyNode parent;
    private final EditContext context;
    private final PropertyBinding binding;
    private final PropertyDescriptor protocolProperty;
    private final @Nullable VirtualContainerProperty virtualContainer;
    private final List<PropertyNode> children = new ArrayList<>();

    private @Nullable EdgeInsetsProperty edgeInsetsProperty;

    public PropertyNode(
            @Nullable PropertyNode parent,
            EditContext context,
            PropertyBinding binding,
            PropertyDescriptor protocolProperty,
            @Nullable VirtualContainerProperty virtualContainer) {
        this.parent = parent;
        this.context = context;
        this.binding = binding;
        this.protocolProperty = protocolProperty;
        this.virtualContainer = virtualContainer;
    }

    public int id() {
        return protocolProperty.id();
    }

    public String name() {
        return protocolProperty.name();
    }

    public boolean isRequired() {
        return protocolProperty.required();
    }

    /** Whether the client may set a value, i.e. the property has an editor. */
    public boolean isEditable() {
        return protocolProperty.editor() != null;
    }

    public @Nullable PropertyNode parent() {
        return parent;
    }

    public PropertyBinding binding() {
        return binding;
    }

    public @Nullable VirtualContainerProperty virtualContainer() {
        return virtualContainer;
    }

    public List<PropertyNode> children() {
        return Collections.unmodifiableList(children);
    }

    public Optional<PropertyNode> child(String childName) {
        return children.stream().filter(c -> c.name().equals(childName)).findFirst();
    }

    EditContext context() {
        return context;
    }

    /** The value part of the argument, when the property is set. */
    public @Nullable Expression valueExpression() {
        return binding instanceof PropertyBinding.ArgumentSet set ? set.value() : null;
    }

    void addChild(PropertyNode child) {
        if (child.parent != this) {
            throw new IllegalArgumentException(child.name() + " is not a child of " + name());
        }
        children.add(child);
    }

    /** This property has type {@code EdgeInsets}: adds its four sides as children. */
    void addEdgeInsetsNestedProperties(PropertyIdSequence ids, ClassElement classEdgeInsets) {
        edgeInsetsProperty = new EdgeInsetsProperty(classEdgeInsets, this);
        edgeInsetsProperty.addNested(ids);
    }

    /** The descriptor of this property, with the descriptors of its children. */
    public PropertyDescriptor describe() {
        if (children.isEmpty()) {
            return protocolProperty;
        }
        return protocolProperty.withChildren(
                children.stream().map(PropertyNode::describe).toList());
    }

    /**
     * Sets the property to {@code value}, adding whatever objects have to be instantiated to hold it.
     *
     * @throws IllegalStateException if {@code value} has no populated variant
     */
    public CompletableFuture<SourceChange> changeValue(PropertyValue value) {
        if (parent != null && parent.edgeInsetsProperty != null) {
            return parent.edgeInsetsProperty.changeValue(this, value);
        }
        if (value.isEmpty()) {
            throw new IllegalStateException("Not a primitive value: " + value);
        }

        var enumValue = value.enumValue();
        CompletableFuture<Optional<ClassElement>> enumElement;
        if (enumValue == null) {
            enumElement = CompletableFuture.completedFuture(Optional.empty());
        } else {
            enumElement = context.symbols()
                    .findClass(enumValue.libraryUri(), enumValue.className())
                    .exceptionally(e -> {
                        logger.warn("Lookup of {} in {} failed", enumValue.className(), enumValue.libraryUri(), e);
                        return Optional.empty();
                    });
        }

        return enumElement.thenApply(element -> {
            if (enumValue != null && element.isEmpty()) {
                logger.warn(
                        "Enum {} not found in {}, writing {}.{} without an import",
                        enumValue.className(),
                        enumValue.libraryUri(),
                        enumValue.className(),
                        enumValue.name());
            }
            var changeBuilder = context.newChangeBuilder();
            changeBuilder.setMessage("Set " + name());
            changeBuilder.addFileEdit(context.unit(), builder -> {
                changeCode(builder, b -> ValueCodec.writeCode(b, value, element.orElse(null)));
                formatEnclosingFunctionBody(builder);
            });
            return changeBuilder.sourceChange();
        });
    }

    /**
     * Removes the argument of this property together with the separator that follows it. Empty change when the
     * property has no argument.
     */
    public CompletableFuture<SourceChange> removeValue() {
        if (parent != null && parent.edgeInsetsProperty != null) {
            return parent.edgeInsetsProperty.removeValue(this);
        }

        var changeBuilder = context.newChangeBuilder();
        if (binding instanceof PropertyBinding.ArgumentSet set) {
            var argumentList = set.creation().argumentList();
            var arguments = argumentList.arguments();
            int argumentIndex = argumentList.indexOf(set.argument());
            int endOffset;
            if (argumentIndex < arguments.size() - 1) {
                endOffset = arguments.get(argumentIndex + 1).offset();
            } else {
                endOffset = argumentList.rightParenthesis().offset();
            }
            int beginOffset = set.argument().offset();
            changeBuilder.setMessage("Remove " + name());
            changeBuilder.addFileEdit(
                    context.unit(),
                    builder -> builder.addDeletion(SourceRange.startOffsetEndOffset(beginOffset, endOffset)));
        }
        return CompletableFuture.completedFuture(changeBuilder.sourceChange());
    }

    /** Writes the code of {@code buildCode} as the value of this property, wherever that value has to go. */
    void changeCode(FileEditBuilder builder, Consumer<EditBuilder> buildCode) {
        if (binding instanceof PropertyBinding.ArgumentSet set) {
            builder.addReplacement(SourceRange.node(set.value()), buildCode);
            return;
        }

        var parameterName = requireParameter().name();
        if (binding instanceof PropertyBinding.ArgumentUnset unset) {
            insertArgument(builder, unset.creation().argumentList(), parameterName, buildCode);
            return;
        }

        var description = ((PropertyBinding.Unmaterialized) binding).description();
        var materializedParent = requireParent();
        if (materializedParent.virtualContainer != null) {
            materializedParent.changeCodeVirtualContainer(builder, parameterName, buildCode);
        } else {
            materializedParent.changeCode(builder, b -> {
                description.writeConstructorReference(b);
                b.write("(");
                b.write(parameterName);
                b.write(": ");
                buildCode.accept(b);
                b.write(", ");
                b.write(")");
            });
        }
    }

    /**
     * Inserts {@code name: value, } before the first named argument that sorts after the parameter, or before a
     * trailing argument such as {@code child}; otherwise at the end of the list.
     */
    private void insertArgument(
            FileEditBuilder builder, ArgumentList argumentList, String parameterName, Consumer<EditBuilder> buildCode) {
        int insertOffset = -1;
        for (var argument : argumentList.arguments()) {
            if (argument instanceof NamedExpression named) {
                var argumentName = named.name().name();
                if (argumentName.compareTo(parameterName) > 0
                        || context.config().isTrailingArgument(argumentName)) {
                    insertOffset = argument.offset();
                    break;
                }
            }
        }

        boolean needsLeadingComma = false;
        if (insertOffset < 0) {
            var rightParenthesis = argumentList.rightParenthesis();
            insertOffset = rightParenthesis.offset();
            var previous = rightParenthesis.previous();
            if (previous != null && !previous.is(TokenType.COMMA) && previous != argumentList.leftParenthesis()) {
                needsLeadingComma = true;
            }
        }

        boolean leadingComma = needsLeadingComma;
        builder.addInsertion(insertOffset, b -> {
            if (leadingComma) {
                b.write(", ");
            }
            b.write(parameterName);
            b.write(": ");
            buildCode.accept(b);
            b.write(", ");
        });
    }

    private void changeCodeVirtualContainer(
            FileEditBuilder builder, String parameterName, Consumer<EditBuilder> writeArgumentValue) {
        var container = requireVirtualContainer();
        container.markConsumed();

        var parentCreation = container.parentCreation();
        var existingArgument = container.parentArgumentToMove();
        if (parentCreation != null && existingArgument != null) {
            // Padding(...) -> Container(...)
            builder.addReplacement(
                    SourceRange.startEnd(parentCreation, parentCreation.constructorName()),
                    b -> b.writeReference(container.containerElement()));

            var existingName = existingArgument.name().name();
            int parameterOffset;
            boolean leadingComma = false;
            boolean trailingComma = false;
            if (existingName.compareTo(parameterName) > 0) {
                parameterOffset = existingArgument.offset();
                trailingComma = true;
            } else {
                parameterOffset = existingArgument.end();
                leadingComma = true;
            }

            boolean writeLeadingComma = leadingComma;
            boolean writeTrailingComma = trailingComma;
            builder.addInsertion(parameterOffset, b -> {
                if (writeLeadingComma) {
                    b.write(", ");
                }
                b.write(parameterName);
                b.write(": ");
                writeArgumentValue.accept(b);
                if (writeTrailingComma) {
                    b.write(", ");
                }
            });
        } else {
            var widgetCreation = container.widgetCreation();
            builder.addInsertion(widgetCreation.offset(), b -> {
                b.writeReference(container.containerElement());
                b.write("(");
                b.write(parameterName);
                b.write(": ");
                writeArgumentValue.accept(b);
                b.write(", ");
                b.write("child: ");
            });
            builder.addSimpleInsertion(widgetCreation.end(), ",)");
        }
    }

    @Nullable
    FunctionBody enclosingFunctionBody() {
        if (parent != null) {
            return parent.enclosingFunctionBody();
        }
        AstNode anchor;
        if (virtualContainer != null) {
            anchor = virtualContainer.widgetCreation();
        } else if (binding instanceof PropertyBinding.ArgumentSet set) {
            anchor = set.creation();
        } else if (binding instanceof PropertyBinding.ArgumentUnset unset) {
            anchor = unset.creation();
        } else {
            return null;
        }
        return anchor.thisOrAncestorOfType(FunctionBody.class);
    }

    void formatEnclosingFunctionBody(FileEditBuilder builder) {
        var functionBody = enclosingFunctionBody();
        if (functionBody == null) {
            logger.warn("No enclosing function body for {} in {}, not formatting", name(), builder.path());
            return;
        }
        builder.format(SourceRange.node(functionBody));
    }

    private ParameterElement requireParameter() {
        var parameter = binding.parameter();
        if (parameter == null) {
            throw new IllegalStateException(name() + " is a group property and has no value of its own");
        }
        return parameter;
    }

    private PropertyNode requireParent() {
        if (parent == null) {
            throw new IllegalStateException("Unmaterialized property " + name() + " has no parent to write into");
        }
        return parent;
    }

    private VirtualContainerProperty requireVirtualContainer() {
        if (virtualContainer == null) {
            throw new IllegalStateException(name() + " has no virtual Container");
        }
        return virtualContainer;
    }

    @Override
    public String toString() {
        return "PropertyNode[" + id() + ", " + name() + "]";
    }
}
