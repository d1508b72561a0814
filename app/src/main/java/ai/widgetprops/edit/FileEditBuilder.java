package ai.widgetprops.edit;

import ai.widgetprops.analyzer.ResolvedUnit;
import ai.widgetprops.analyzer.SourceRange;
import ai.widgetprops.analyzer.element.ClassElement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Collects the edits to one file. Offsets always refer to the original content of the resolved unit; edits may not
 * overlap, and insertions at the same offset keep the order in which they were added.
 */
public final class FileEditBuilder {
    private static final Logger logger = LogManager.getLogger(FileEditBuilder.class);

    private static final Comparator<PendingEdit> APPLY_ORDER = Comparator.comparingInt(
                    (PendingEdit p) -> p.edit().offset())
            .reversed()
            .thenComparing(p -> p.edit().isInsertion())
            .thenComparing(Comparator.comparingInt(PendingEdit::sequence).reversed());

    private final ResolvedUnit unit;
    private final SourceFormatter formatter;
    private final List<PendingEdit> edits = new ArrayList<>();
    private final Set<String> requestedImports = new LinkedHashSet<>();
    private final List<SourceRange> formatRanges = new ArrayList<>();
    private int sequence;

    private record PendingEdit(SourceEdit edit, int sequence) {}

    FileEditBuilder(ResolvedUnit unit, SourceFormatter formatter) {
        this.unit = unit;
        this.formatter = formatter;
    }

    public String path() {
        return unit.path();
    }

    public void addInsertion(int offset, Consumer<EditBuilder> buildEdit) {
        addEdit(new SourceRange(offset, 0), buildEdit);
    }

    public void addReplacement(SourceRange range, Consumer<EditBuilder> buildEdit) {
        addEdit(range, buildEdit);
    }

    public void addDeletion(SourceRange range) {
        addSimpleReplacement(range, "");
    }

    public void addSimpleInsertion(int offset, String text) {
        addSimpleReplacement(new SourceRange(offset, 0), text);
    }

    public void addSimpleReplacement(SourceRange range, String text) {
        add(new SourceEdit(range.offset(), range.length(), text));
    }

    /** Requests that the region {@code range} of the original content be normalized once all edits are known. */
    public void format(SourceRange range) {
        formatRanges.add(range);
    }

    private void addEdit(SourceRange range, Consumer<EditBuilder> buildEdit) {
        var builder = new EditBuilder(this);
        buildEdit.accept(builder);
        add(new SourceEdit(range.offset(), range.length(), builder.toString()));
    }

    private void add(SourceEdit edit) {
        if (edit.end() > unit.content().length()) {
            throw new IllegalStateException("Edit %s is outside of %s".formatted(edit, unit.path()));
        }
        for (var existing : edits) {
            if (conflicts(existing.edit(), edit)) {
                throw new IllegalStateException("Edit %s overlaps %s".formatted(edit, existing.edit()));
            }
        }
        edits.add(new PendingEdit(edit, sequence++));
    }

    private static boolean conflicts(SourceEdit a, SourceEdit b) {
        if (a.isInsertion() && b.isInsertion()) {
            return false;
        }
        if (a.isInsertion()) {
            return b.offset() < a.offset() && a.offset() < b.end();
        }
        if (b.isInsertion()) {
            return a.offset() < b.offset() && b.offset() < a.end();
        }
        return a.offset() < b.end() && b.offset() < a.end();
    }

    String referenceTo(ClassElement element) {
        for (var directive : unit.unit().imports()) {
            if (element.isProvidedBy(directive.uriValue())) {
                var prefix = directive.prefix();
                return prefix == null ? element.name() : prefix.name() + "." + element.name();
            }
        }
        var uri = element.exportingLibraries().stream().findFirst().orElse(element.libraryUri());
        if (requestedImports.add(uri)) {
            logger.debug("Adding import of {} for {}", uri, element.name());
        }
        return element.name();
    }

    SourceFileEdit build() {
        var pending = new ArrayList<>(edits);
        for (var range : formatRanges) {
            pending = applyFormat(pending, range);
        }
        if (!requestedImports.isEmpty()) {
            pending.add(new PendingEdit(importEdit(), sequence++));
        }
        pending.sort(APPLY_ORDER);
        return new SourceFileEdit(unit.path(), pending.stream().map(PendingEdit::edit).toList());
    }

    private SourceEdit importEdit() {
        var imports = unit.unit().imports();
        var sb = new StringBuilder();
        if (imports.isEmpty()) {
            for (var uri : requestedImports) {
                sb.append("import '").append(uri).append("';\n");
            }
            sb.append('\n');
            return new SourceEdit(0, 0, sb.toString());
        }
        for (var uri : requestedImports) {
            sb.append("\nimport '").append(uri).append("';");
        }
        return new SourceEdit(imports.get(imports.size() - 1).end(), 0, sb.toString());
    }

    /**
     * Runs the formatter over the edited text of {@code range}. When the formatter changes anything, the edits inside
     * the range are replaced by a single replacement of the whole range.
     */
    private ArrayList<PendingEdit> applyFormat(ArrayList<PendingEdit> pending, SourceRange range) {
        var inside = new ArrayList<PendingEdit>();
        int deltaBefore = 0;
        int deltaInside = 0;
        for (var p : pending) {
            var e = p.edit();
            int delta = e.replacement().length() - e.length();
            if (e.end() <= range.offset() && !(e.isInsertion() && e.offset() == range.offset())) {
                deltaBefore += delta;
            } else if (range.offset() <= e.offset() && e.end() <= range.end()) {
                inside.add(p);
                deltaInside += delta;
            } else if (e.offset() < range.end()) {
                logger.warn("Edit {} crosses the format range {} in {}, not formatting", e, range, unit.path());
                return pending;
            }
        }
        if (inside.isEmpty()) {
            return pending;
        }

        var sorted = new ArrayList<>(pending);
        sorted.sort(APPLY_ORDER);
        var newContent = SourceEdit.applySequence(
                unit.content(), sorted.stream().map(PendingEdit::edit).toList());
        int newStart = range.offset() + deltaBefore;
        int newEnd = range.end() + deltaBefore + deltaInside;
        var region = newContent.substring(newStart, newEnd);
        var formatted = formatter.format(region);
        if (formatted.equals(region)) {
            return pending;
        }

        var result = new ArrayList<>(pending);
        result.removeAll(inside);
        result.add(new PendingEdit(new SourceEdit(range.offset(), range.length(), formatted), sequence++));
        return result;
    }
}
