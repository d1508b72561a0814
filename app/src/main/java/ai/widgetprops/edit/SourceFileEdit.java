package ai.widgetprops.edit;

import java.util.List;

/**
 * The edits to one file, sorted by descending offset so they can be applied one after another to the original text.
 */
public record SourceFileEdit(String file, List<SourceEdit> edits) {

    public SourceFileEdit {
        edits = List.copyOf(edits);
    }

    public String apply(String content) {
        return SourceEdit.applySequence(content, edits);
    }
}
