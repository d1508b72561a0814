package ai.widgetprops.edit;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/** Replace {@code length} characters at {@code offset} with {@code replacement}. */
public record SourceEdit(int offset, int length, String replacement) {

    @JsonIgnore
    public int end() {
        return offset + length;
    }

    @JsonIgnore
    public boolean isInsertion() {
        return length == 0;
    }

    public String apply(String code) {
        return code.substring(0, offset) + replacement + code.substring(end());
    }

    /** Applies {@code edits} in list order; offsets of later edits refer to the text produced by earlier ones. */
    public static String applySequence(String code, List<SourceEdit> edits) {
        var result = code;
        for (var edit : edits) {
            result = edit.apply(result);
        }
        return result;
    }
}
