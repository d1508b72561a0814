package ai.widgetprops;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PropertyEditorConfigTest {

    private static PropertyEditorConfig load(Map<String, String> env, Map<String, String> properties) {
        return PropertyEditorConfig.load(env::get, properties::get);
    }

    @Test
    void testDefaults() {
        var config = load(Map.of(), Map.of());
        assertEquals(Set.of("child", "children"), config.trailingArguments());
        assertEquals(4, config.maxNestingDepth());
        assertTrue(config.isTrailingArgument("child"));
        assertFalse(config.isTrailingArgument("width"));
    }

    @Test
    void testEnvironmentOverrides() {
        var config = load(
                Map.of("WIDGETPROPS_TRAILING_ARGUMENTS", " child , body,,", "WIDGETPROPS_MAX_NESTING_DEPTH", " 2 "),
                Map.of());
        assertEquals(Set.of("child", "body"), config.trailingArguments());
        assertEquals(2, config.maxNestingDepth());
    }

    @Test
    void testSystemPropertiesWin() {
        var config = load(
                Map.of("WIDGETPROPS_TRAILING_ARGUMENTS", "body", "WIDGETPROPS_MAX_NESTING_DEPTH", "2"),
                Map.of("widgetprops.trailingArguments", "slivers", "widgetprops.maxNestingDepth", "0"));
        assertEquals(Set.of("slivers"), config.trailingArguments());
        assertEquals(0, config.maxNestingDepth());
    }

    @Test
    void testBlankTrailingArgumentsDisablesRule() {
        var config = load(Map.of("WIDGETPROPS_TRAILING_ARGUMENTS", "  "), Map.of());
        assertTrue(config.trailingArguments().isEmpty());
    }

    @Test
    void testInvalidDepthFallsBackToDefault() {
        assertEquals(4, load(Map.of("WIDGETPROPS_MAX_NESTING_DEPTH", "deep"), Map.of()).maxNestingDepth());
        assertEquals(4, load(Map.of("WIDGETPROPS_MAX_NESTING_DEPTH", "-1"), Map.of()).maxNestingDepth());
    }

    @Test
    void testNegativeDepthRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PropertyEditorConfig(Set.of(), -1));
    }
}
