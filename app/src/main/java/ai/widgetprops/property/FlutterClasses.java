package ai.widgetprops.property;

import ai.widgetprops.analyzer.ResolvedUnit;
import ai.widgetprops.analyzer.TypeProvider;
import ai.widgetprops.analyzer.ast.ArgumentList;
import ai.widgetprops.analyzer.ast.AstNode;
import ai.widgetprops.analyzer.ast.Expression;
import ai.widgetprops.analyzer.ast.InstanceCreationExpression;
import ai.widgetprops.analyzer.ast.NamedExpression;
import ai.widgetprops.analyzer.element.ClassElement;
import ai.widgetprops.analyzer.element.TypeRef;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Names of the Flutter classes the property engine knows about, and helpers to find widgets in a syntax tree. */
public final class FlutterClasses {
    public static final String WIDGET = "Widget";
    public static final String CONTAINER = "Container";
    public static final String PADDING = "Padding";
    public static final String EDGE_INSETS = "EdgeInsets";
    public static final String EDGE_INSETS_GEOMETRY = "EdgeInsetsGeometry";

    private FlutterClasses() {
        // utility class
    }

    public static boolean isWidget(TypeProvider types, ClassElement element) {
        return types.isSubtypeOf(element, WIDGET);
    }

    public static boolean isWidgetType(TypeProvider types, TypeRef type) {
        return types.classForType(type).map(c -> isWidget(types, c)).orElse(false);
    }

    public static boolean isEdgeInsetsType(TypeRef type) {
        return type.name().equals(EDGE_INSETS) || type.name().equals(EDGE_INSETS_GEOMETRY);
    }

    /**
     * The widget instance creation at {@code offset}: the innermost instance creation covering the offset whose class
     * is a widget. Null when there is none.
     */
    public static @Nullable InstanceCreationExpression widgetCreationAt(ResolvedUnit unit, int offset) {
        AstNode node = unit.nodeAt(offset);
        while (node != null) {
            if (node instanceof InstanceCreationExpression creation && isWidget(unit.types(), creation.classElement())) {
                return creation;
            }
            node = node.parent();
        }
        return null;
    }

    /** The instance creation that has {@code creation} as one of its arguments, e.g. a wrapping {@code Padding}. */
    public static @Nullable InstanceCreationExpression parentCreation(InstanceCreationExpression creation) {
        AstNode parent = creation.parent();
        if (parent instanceof NamedExpression) {
            parent = parent.parent();
        }
        if (parent instanceof ArgumentList && parent.parent() instanceof InstanceCreationExpression parentCreation) {
            return parentCreation;
        }
        return null;
    }

    public static @Nullable NamedExpression argumentByName(List<Expression> arguments, String name) {
        for (var argument : arguments) {
            if (argument instanceof NamedExpression named && named.name().name().equals(name)) {
                return named;
            }
        }
        return null;
    }

    /** The positional argument at {@code index}; named arguments are not counted. */
    public static @Nullable Expression argumentByIndex(List<Expression> arguments, int index) {
        int position = 0;
        for (var argument : arguments) {
            if (argument instanceof NamedExpression) {
                continue;
            }
            if (position++ == index) {
                return argument;
            }
        }
        return null;
    }
}
