package ai.widgetprops.edit;

/** Normalizes the layout of a region of source code. */
@FunctionalInterface
public interface SourceFormatter {

    /** Leaves code untouched. */
    SourceFormatter NONE = code -> code;

    String format(String code);
}
