package ai.widgetprops.property;

import ai.widgetprops.analyzer.ast.InstanceCreationExpression;
import ai.widgetprops.analyzer.ast.NamedExpression;
import ai.widgetprops.analyzer.element.ClassElement;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Every widget has a {@code Container} property. When no {@code Container} wraps the widget, this describes how to
 * introduce one the first time one of its properties is set.
 *
 * <p>A narrower wrapper such as {@code Padding} is renamed to {@code Container} instead of adding a second wrapper;
 * its argument is kept in place. Materialization happens at most once: afterwards the source no longer matches this
 * description, and the widget has to be described again.
 */
public final class VirtualContainerProperty {
    private static final Logger logger = LogManager.getLogger(VirtualContainerProperty.class);

    private final ClassElement containerElement;
    private final InstanceCreationExpression widgetCreation;

    private @Nullable InstanceCreationExpression parentCreation;
    private @Nullable NamedExpression parentArgumentToMove;
    private boolean consumed;

    public VirtualContainerProperty(ClassElement containerElement, InstanceCreationExpression widgetCreation) {
        this.containerElement = containerElement;
        this.widgetCreation = widgetCreation;
    }

    public ClassElement containerElement() {
        return containerElement;
    }

    public InstanceCreationExpression widgetCreation() {
        return widgetCreation;
    }

    /** The wrapper to promote to {@code Container}, or null to wrap the widget in a new one. */
    public @Nullable InstanceCreationExpression parentCreation() {
        return parentCreation;
    }

    /** The argument of {@link #parentCreation()} that the promoted {@code Container} keeps. */
    public @Nullable NamedExpression parentArgumentToMove() {
        return parentArgumentToMove;
    }

    public void setParentCreation(InstanceCreationExpression parentCreation, NamedExpression parentArgumentToMove) {
        if (parentArgumentToMove.thisOrAncestorOfType(InstanceCreationExpression.class) != parentCreation) {
            throw new IllegalArgumentException("The argument to move must belong to " + parentCreation);
        }
        this.parentCreation = parentCreation;
        this.parentArgumentToMove = parentArgumentToMove;
    }

    public boolean isConsumed() {
        return consumed;
    }

    void markConsumed() {
        if (consumed) {
            throw new IllegalStateException(
                    "Container around " + widgetCreation.classElement().name() + " was already materialized");
        }
        consumed = true;
        logger.debug(
                "Materializing Container around {} {}",
                widgetCreation.classElement().name(),
                parentCreation == null ? "as a new wrapper" : "by promoting " + parentCreation.classElement().name());
    }
}
