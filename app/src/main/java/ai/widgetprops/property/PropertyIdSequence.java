package ai.widgetprops.property;

/** Hands out property ids, in the order properties are created. Not thread-safe. */
public final class PropertyIdSequence {
    private int next;

    public PropertyIdSequence() {
        this(0);
    }

    public PropertyIdSequence(int first) {
        this.next = first;
    }

    public int next() {
        return next++;
    }

    /** The id the next call to {@link #next()} returns. */
    public int peek() {
        return next;
    }
}
