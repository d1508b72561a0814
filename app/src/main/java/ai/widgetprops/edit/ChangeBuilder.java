package ai.widgetprops.edit;

import ai.widgetprops.analyzer.ResolvedUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/** Builds a {@link SourceChange} from edits to one or more resolved units. */
public final class ChangeBuilder {
    private final SourceFormatter formatter;
    private final Map<String, FileEditBuilder> fileEditBuilders = new LinkedHashMap<>();
    private String message = "";

    public ChangeBuilder() {
        this(SourceFormatter.NONE);
    }

    public ChangeBuilder(SourceFormatter formatter) {
        this.formatter = formatter;
    }

    /** Runs {@code buildFileEdit} against the edit builder of {@code unit}, creating it on first use. */
    public void addFileEdit(ResolvedUnit unit, Consumer<FileEditBuilder> buildFileEdit) {
        var builder = fileEditBuilders.computeIfAbsent(unit.path(), p -> new FileEditBuilder(unit, formatter));
        buildFileEdit.accept(builder);
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public SourceChange sourceChange() {
        var edits = fileEditBuilders.values().stream()
                .map(FileEditBuilder::build)
                .filter(e -> !e.edits().isEmpty())
                .toList();
        return new SourceChange(message, edits);
    }
}
