package ai.widgetprops.property;

import ai.widgetprops.PropertyEditorConfig;
import ai.widgetprops.analyzer.ResolvedUnit;
import ai.widgetprops.analyzer.SymbolResolver;
import ai.widgetprops.edit.SourceChange;
import ai.widgetprops.edit.SourceFormatter;
import ai.widgetprops.protocol.PropertyDescriptor;
import ai.widgetprops.protocol.PropertyValue;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Describes the properties of the widget at an offset, and applies edits to them by id.
 *
 * <p>Only the most recent description is kept: computing a new one invalidates the ids of the previous one. Callers
 * describe the widget again after applying any returned change, since the old description refers to the old source.
 * Not thread-safe.
 */
public final class WidgetDescriptions {
    private static final Logger logger = LogManager.getLogger(WidgetDescriptions.class);

    private final SymbolResolver symbols;
    private final SourceFormatter formatter;
    private final PropertyEditorConfig config;

    private final Map<Integer, PropertyNode> properties = new HashMap<>();
    private final PropertyIdSequence ids = new PropertyIdSequence();

    public WidgetDescriptions(SymbolResolver symbols, SourceFormatter formatter, PropertyEditorConfig config) {
        this.symbols = symbols;
        this.formatter = formatter;
        this.config = config;
    }

    /**
     * Returns the properties of the innermost widget instance creation that covers {@code offset}, or empty when
     * there is none.
     */
    public Optional<List<PropertyDescriptor>> getDescription(ResolvedUnit unit, int offset) {
        var widgetCreation = FlutterClasses.widgetCreationAt(unit, offset);
        if (widgetCreation == null) {
            logger.debug("No widget at offset {} in {}", offset, unit.path());
            return Optional.empty();
        }

        properties.clear();
        var context = new EditContext(unit, symbols, formatter, config);
        var roots = new PropertyTreeBuilder(context, ids).build(widgetCreation);
        roots.forEach(this::register);
        logger.debug(
                "Described {} in {}: {} properties",
                widgetCreation.classElement().name(),
                unit.path(),
                properties.size());
        return Optional.of(roots.stream().map(PropertyNode::describe).toList());
    }

    /**
     * Sets the property with {@code id} to {@code value}, or removes it when {@code value} is null.
     *
     * @throws PropertyEditException if the id is unknown, a required property would be removed, or the property has
     *     no value of its own
     */
    public CompletableFuture<SourceChange> setPropertyValue(int id, @Nullable PropertyValue value)
            throws PropertyEditException {
        var property = properties.get(id);
        if (property == null) {
            throw new PropertyEditException(PropertyEditException.Reason.INVALID_ID, "No property with id " + id);
        }
        if (value == null) {
            if (property.isRequired()) {
                throw new PropertyEditException(
                        PropertyEditException.Reason.REQUIRED_PROPERTY,
                        "Property " + property.name() + " is required and cannot be removed");
            }
            return property.removeValue();
        }
        if (!property.isEditable()) {
            throw new PropertyEditException(
                    PropertyEditException.Reason.NOT_EDITABLE, "Property " + property.name() + " has no value");
        }
        return property.changeValue(value);
    }

    /** The property with {@code id} in the current description. */
    public Optional<PropertyNode> property(int id) {
        return Optional.ofNullable(properties.get(id));
    }

    private void register(PropertyNode property) {
        properties.put(property.id(), property);
        property.children().forEach(this::register);
    }
}
