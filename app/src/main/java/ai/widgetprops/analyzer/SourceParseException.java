package ai.widgetprops.analyzer;

/** Thrown when source text cannot be tokenized or parsed. */
public class SourceParseException extends Exception {
    private final int offset;

    public SourceParseException(String message, int offset) {
        super(message + " at offset " + offset);
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
