package ai.widgetprops.edit;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Optional;

/** An atomic, user-facing change: the file edits produced by one operation. */
public record SourceChange(String message, List<SourceFileEdit> edits) {

    public SourceChange {
        edits = List.copyOf(edits);
    }

    /** A change that does nothing. */
    public static SourceChange empty() {
        return new SourceChange("", List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return edits.stream().allMatch(e -> e.edits().isEmpty());
    }

    public Optional<SourceFileEdit> getFileEdit(String file) {
        return edits.stream().filter(e -> e.file().equals(file)).findFirst();
    }

    /** Applies the edits for {@code file} to {@code content}; unchanged content when the file is not edited. */
    public String applyTo(String file, String content) {
        return getFileEdit(file).map(e -> e.apply(content)).orElse(content);
    }
}
