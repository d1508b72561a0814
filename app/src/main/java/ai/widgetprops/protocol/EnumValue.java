package ai.widgetprops.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

/**
 * A member of an enum, identified by the library that declares the enum, the enum's name and the member name.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EnumValue(String libraryUri, String className, String name, @Nullable String documentation) {

    public EnumValue(String libraryUri, String className, String name) {
        this(libraryUri, className, name, null);
    }
}
