package ai.widgetprops;

import com.google.common.base.Splitter;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Settings of the property editor.
 *
 * <ul>
 *   <li>{@code WIDGETPROPS_TRAILING_ARGUMENTS} (or system property {@code widgetprops.trailingArguments}): named
 *       arguments that stay last in an argument list, so new arguments are inserted before them. Comma-separated;
 *       defaults to {@code child,children}. A blank value disables the rule.</li>
 *   <li>{@code WIDGETPROPS_MAX_NESTING_DEPTH} (or {@code widgetprops.maxNestingDepth}): how deep nested class
 *       properties (e.g. a {@code TextStyle} inside a {@code Text}) are expanded. Defaults to 4.</li>
 * </ul>
 *
 * System properties win over environment variables.
 */
public final class PropertyEditorConfig {
    private static final Logger logger = LogManager.getLogger(PropertyEditorConfig.class);

    static final String TRAILING_ARGUMENTS_ENV = "WIDGETPROPS_TRAILING_ARGUMENTS";
    static final String TRAILING_ARGUMENTS_PROPERTY = "widgetprops.trailingArguments";
    static final String MAX_NESTING_DEPTH_ENV = "WIDGETPROPS_MAX_NESTING_DEPTH";
    static final String MAX_NESTING_DEPTH_PROPERTY = "widgetprops.maxNestingDepth";

    public static final Set<String> DEFAULT_TRAILING_ARGUMENTS = Set.of("child", "children");
    public static final int DEFAULT_MAX_NESTING_DEPTH = 4;

    private final Set<String> trailingArguments;
    private final int maxNestingDepth;

    public PropertyEditorConfig(Set<String> trailingArguments, int maxNestingDepth) {
        if (maxNestingDepth < 0) {
            throw new IllegalArgumentException("maxNestingDepth must not be negative: " + maxNestingDepth);
        }
        this.trailingArguments = Set.copyOf(trailingArguments);
        this.maxNestingDepth = maxNestingDepth;
    }

    public static PropertyEditorConfig defaults() {
        return new PropertyEditorConfig(DEFAULT_TRAILING_ARGUMENTS, DEFAULT_MAX_NESTING_DEPTH);
    }

    public static PropertyEditorConfig fromEnvironment() {
        return load(System::getenv, System::getProperty);
    }

    static PropertyEditorConfig load(
            Function<String, @Nullable String> env, Function<String, @Nullable String> systemProperties) {
        var trailing = DEFAULT_TRAILING_ARGUMENTS;
        var trailingOverride = lookup(env, systemProperties, TRAILING_ARGUMENTS_ENV, TRAILING_ARGUMENTS_PROPERTY);
        if (trailingOverride != null) {
            trailing = Splitter.on(',').trimResults().omitEmptyStrings().splitToStream(trailingOverride)
                    .collect(Collectors.toUnmodifiableSet());
            logger.info("Trailing argument override in effect: {}", trailing);
        }

        int depth = DEFAULT_MAX_NESTING_DEPTH;
        var depthOverride = lookup(env, systemProperties, MAX_NESTING_DEPTH_ENV, MAX_NESTING_DEPTH_PROPERTY);
        if (depthOverride != null) {
            try {
                depth = Integer.parseInt(depthOverride.trim());
                if (depth < 0) {
                    logger.warn("Negative nesting depth {} ignored, using {}", depth, DEFAULT_MAX_NESTING_DEPTH);
                    depth = DEFAULT_MAX_NESTING_DEPTH;
                } else {
                    logger.info("Max nesting depth override in effect: {}", depth);
                }
            } catch (NumberFormatException e) {
                logger.warn("Invalid nesting depth '{}', using {}", depthOverride, DEFAULT_MAX_NESTING_DEPTH);
            }
        }
        return new PropertyEditorConfig(trailing, depth);
    }

    private static @Nullable String lookup(
            Function<String, @Nullable String> env,
            Function<String, @Nullable String> systemProperties,
            String envName,
            String propertyName) {
        var value = systemProperties.apply(propertyName);
        return value != null ? value : env.apply(envName);
    }

    /** Named arguments that new arguments are inserted in front of. */
    public Set<String> trailingArguments() {
        return trailingArguments;
    }

    public boolean isTrailingArgument(String name) {
        return trailingArguments.contains(name);
    }

    public int maxNestingDepth() {
        return maxNestingDepth;
    }

    @Override
    public String toString() {
        return "PropertyEditorConfig[trailingArguments=" + trailingArguments + ", maxNestingDepth=" + maxNestingDepth
                + "]";
    }
}
