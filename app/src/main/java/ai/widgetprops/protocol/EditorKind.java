package ai.widgetprops.protocol;

/** The kind of client-side editor suited to a property. */
public enum EditorKind {
    BOOL,
    DOUBLE,
    ENUM,
    INT,
    STRING
}
