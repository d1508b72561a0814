package ai.widgetprops.property;

import ai.widgetprops.PropertyEditorConfig;
import ai.widgetprops.analyzer.ResolvedUnit;
import ai.widgetprops.analyzer.SymbolResolver;
import ai.widgetprops.edit.ChangeBuilder;
import ai.widgetprops.edit.SourceFormatter;

/** What every property of one description needs to produce changes. */
public record EditContext(
        ResolvedUnit unit, SymbolResolver symbols, SourceFormatter formatter, PropertyEditorConfig config) {

    public ChangeBuilder newChangeBuilder() {
        return new ChangeBuilder(formatter);
    }
}
