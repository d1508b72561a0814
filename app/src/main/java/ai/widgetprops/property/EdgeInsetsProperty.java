package ai.widgetprops.property;

import ai.widgetprops.analyzer.ast.Expression;
import ai.widgetprops.analyzer.ast.InstanceCreationExpression;
import ai.widgetprops.analyzer.ast.NamedExpression;
import ai.widgetprops.analyzer.element.ClassElement;
import ai.widgetprops.analyzer.element.ConstructorElement;
import ai.widgetprops.edit.EditBuilder;
import ai.widgetprops.edit.SourceChange;
import ai.widgetprops.protocol.EditorKind;
import ai.widgetprops.protocol.PropertyDescriptor;
import ai.widgetprops.protocol.PropertyEditor;
import ai.widgetprops.protocol.PropertyValue;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Support for {@code EdgeInsets} typed properties: the four sides are edited as separate double properties, and every
 * edit writes the shortest equivalent {@code EdgeInsets} constructor call.
 */
final class EdgeInsetsProperty {
    private static final Logger logger = LogManager.getLogger(EdgeInsetsProperty.class);

    private final ClassElement classEdgeInsets;

    /** The property that has type {@code EdgeInsets}. */
    private final PropertyNode property;

    private final ConstructorElement onlyConstructor;

    private @Nullable Double leftValue;
    private @Nullable Double topValue;
    private @Nullable Double rightValue;
    private @Nullable Double bottomValue;

    private @Nullable PropertyNode leftProperty;
    private @Nullable PropertyNode topProperty;
    private @Nullable PropertyNode rightProperty;
    private @Nullable PropertyNode bottomProperty;

    EdgeInsetsProperty(ClassElement classEdgeInsets, PropertyNode property) {
        var only = classEdgeInsets.getNamedConstructor("only");
        if (only == null) {
            throw new IllegalArgumentException(classEdgeInsets.name() + " has no 'only' constructor");
        }
        this.classEdgeInsets = classEdgeInsets;
        this.property = property;
        this.onlyConstructor = only;
    }

    void addNested(PropertyIdSequence ids) {
        Expression leftExpression = null;
        Expression topExpression = null;
        Expression rightExpression = null;
        Expression bottomExpression = null;
        if (property.valueExpression() instanceof InstanceCreationExpression creation) {
            var constructor = creation.staticElement();
            if (constructor != null && constructor.enclosingElement() == classEdgeInsets) {
                var arguments = creation.argumentList().arguments();
                switch (constructor.name()) {
                    case "all" -> {
                        var expression = FlutterClasses.argumentByIndex(arguments, 0);
                        leftExpression = expression;
                        topExpression = expression;
                        rightExpression = expression;
                        bottomExpression = expression;
                    }
                    case "fromLTRB" -> {
                        leftExpression = FlutterClasses.argumentByIndex(arguments, 0);
                        topExpression = FlutterClasses.argumentByIndex(arguments, 1);
                        rightExpression = FlutterClasses.argumentByIndex(arguments, 2);
                        bottomExpression = FlutterClasses.argumentByIndex(arguments, 3);
                    }
                    case "only" -> {
                        leftExpression = valueOf(FlutterClasses.argumentByName(arguments, "left"));
                        topExpression = valueOf(FlutterClasses.argumentByName(arguments, "top"));
                        rightExpression = valueOf(FlutterClasses.argumentByName(arguments, "right"));
                        bottomExpression = valueOf(FlutterClasses.argumentByName(arguments, "bottom"));
                    }
                    case "symmetric" -> {
                        var horizontal = valueOf(FlutterClasses.argumentByName(arguments, "horizontal"));
                        var vertical = valueOf(FlutterClasses.argumentByName(arguments, "vertical"));
                        leftExpression = horizontal;
                        topExpression = vertical;
                        rightExpression = horizontal;
                        bottomExpression = vertical;
                    }
                    default -> logger.debug("Not decomposing {}.{}", classEdgeInsets.name(), constructor.name());
                }

                leftValue = ValueCodec.literalToDouble(leftExpression);
                topValue = ValueCodec.literalToDouble(topExpression);
                rightValue = ValueCodec.literalToDouble(rightExpression);
                bottomValue = ValueCodec.literalToDouble(bottomExpression);
            }
        }

        leftProperty = addNestedProperty(ids, "left", leftExpression, leftValue);
        topProperty = addNestedProperty(ids, "top", topExpression, topValue);
        rightProperty = addNestedProperty(ids, "right", rightExpression, rightValue);
        bottomProperty = addNestedProperty(ids, "bottom", bottomExpression, bottomValue);
    }

    /**
     * The value of {@code nested} changed: writes the whole {@code EdgeInsets} again. When all four sides become zero
     * the property is removed instead.
     */
    CompletableFuture<SourceChange> changeValue(PropertyNode nested, PropertyValue value) {
        var doubleValue = value.doubleValue();
        if (doubleValue == null) {
            return CompletableFuture.completedFuture(SourceChange.empty());
        }

        if (nested == leftProperty) {
            leftValue = doubleValue;
        } else if (nested == topProperty) {
            topValue = doubleValue;
        } else if (nested == rightProperty) {
            rightValue = doubleValue;
        } else if (nested == bottomProperty) {
            bottomValue = doubleValue;
        } else {
            throw new IllegalArgumentException(nested + " is not a side of " + property);
        }

        var leftCode = ValueCodec.toDoubleCode(leftValue);
        var topCode = ValueCodec.toDoubleCode(topValue);
        var rightCode = ValueCodec.toDoubleCode(rightValue);
        var bottomCode = ValueCodec.toDoubleCode(bottomValue);

        if (leftCode.equals("0") && topCode.equals("0") && rightCode.equals("0") && bottomCode.equals("0")) {
            return property.removeValue();
        }

        var context = property.context();
        var changeBuilder = context.newChangeBuilder();
        changeBuilder.setMessage("Set " + property.name() + "." + nested.name());
        changeBuilder.addFileEdit(context.unit(), builder -> {
            property.changeCode(builder, b -> writeEdgeInsets(b, leftCode, topCode, rightCode, bottomCode));
            property.formatEnclosingFunctionBody(builder);
        });
        return CompletableFuture.completedFuture(changeBuilder.sourceChange());
    }

    /** Removing a side sets it to zero. */
    CompletableFuture<SourceChange> removeValue(PropertyNode nested) {
        return changeValue(nested, PropertyValue.ofDouble(0));
    }

    private void writeEdgeInsets(
            EditBuilder builder, String leftCode, String topCode, String rightCode, String bottomCode) {
        builder.writeReference(classEdgeInsets);
        if (leftCode.equals(rightCode) && topCode.equals(bottomCode)) {
            if (leftCode.equals(topCode)) {
                builder.write(".all(");
                builder.write(leftCode);
                builder.write(")");
            } else {
                boolean hasHorizontal = false;
                builder.write(".symmetric(");
                if (!leftCode.equals("0")) {
                    builder.write("horizontal: ");
                    builder.write(leftCode);
                    hasHorizontal = true;
                }
                if (!topCode.equals("0")) {
                    if (hasHorizontal) {
                        builder.write(", ");
                    }
                    builder.write("vertical: ");
                    builder.write(topCode);
                }
                builder.write(")");
            }
            return;
        }

        builder.write(".only(");
        boolean needsComma = false;
        var names = List.of("left", "top", "right", "bottom");
        var codes = List.of(leftCode, topCode, rightCode, bottomCode);
        for (int i = 0; i < names.size(); i++) {
            if (codes.get(i).equals("0")) {
                continue;
            }
            if (needsComma) {
                builder.write(", ");
            }
            builder.write(names.get(i));
            builder.write(": ");
            builder.write(codes.get(i));
            needsComma = true;
        }
        builder.write(")");
    }

    private PropertyNode addNestedProperty(
            PropertyIdSequence ids, String name, @Nullable Expression expression, @Nullable Double value) {
        var parameter = onlyConstructor
                .parameter(name)
                .orElseThrow(() -> new IllegalArgumentException(onlyConstructor + " has no parameter " + name));
        var unit = property.context().unit();
        var descriptor = new PropertyDescriptor(
                ids.next(),
                false,
                true,
                name,
                DocComments.parameterDocumentation(parameter),
                expression == null ? null : unit.textOf(expression),
                value == null ? null : PropertyValue.ofDouble(value),
                PropertyEditor.of(EditorKind.DOUBLE),
                List.of());
        var nested = new PropertyNode(
                property,
                property.context(),
                new PropertyBinding.Unmaterialized(new ClassDescription(classEdgeInsets, onlyConstructor), parameter),
                descriptor,
                null);
        property.addChild(nested);
        return nested;
    }

    private static @Nullable Expression valueOf(@Nullable NamedExpression argument) {
        return argument == null ? null : argument.expression();
    }
}
