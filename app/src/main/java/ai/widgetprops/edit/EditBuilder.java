package ai.widgetprops.edit;

import ai.widgetprops.analyzer.element.ClassElement;

/** Accumulates the replacement text of a single edit. */
public final class EditBuilder {
    private final FileEditBuilder fileEditBuilder;
    private final StringBuilder buffer = new StringBuilder();

    EditBuilder(FileEditBuilder fileEditBuilder) {
        this.fileEditBuilder = fileEditBuilder;
    }

    public void write(String text) {
        buffer.append(text);
    }

    /**
     * Writes a reference to {@code element} that resolves in the edited file: through the prefix of an import that
     * already provides it, or unprefixed after adding an import for it.
     */
    public void writeReference(ClassElement element) {
        buffer.append(fileEditBuilder.referenceTo(element));
    }

    @Override
    public String toString() {
        return buffer.toString();
    }
}
