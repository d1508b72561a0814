package ai.widgetprops.property;

/** A property edit request that cannot be carried out. */
public class PropertyEditException extends Exception {

    public enum Reason {
        /** The id does not name a property of the current description. */
        INVALID_ID,
        /** A required property cannot be removed. */
        REQUIRED_PROPERTY,
        /** The property groups other properties and has no value of its own. */
        NOT_EDITABLE
    }

    private final Reason reason;

    public PropertyEditException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
