package ai.widgetprops.testutil;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.widgetprops.analyzer.ResolvedUnit;
import ai.widgetprops.edit.SourceChange;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.jetbrains.annotations.Nullable;

/** Assertions over source code and source changes. */
public final class AssertionHelperUtil {

    private AssertionHelperUtil() {}

    /**
     * Provides a line-ending agnostic string equality assertion.
     */
    public static void assertCodeEquals(String expected, String actual) {
        assertCodeEquals(expected, actual, null);
    }

    /**
     * Provides a line-ending agnostic string equality assertion.
     */
    public static void assertCodeEquals(String expected, String actual, @Nullable String message) {
        var cleanExpected = normalizeLineEndings(expected);
        var cleanActual = normalizeLineEndings(actual);
        if (message == null) {
            assertEquals(cleanExpected, cleanActual);
        } else {
            assertEquals(cleanExpected, cleanActual, message);
        }
    }

    /**
     * Waits for {@code change} and applies it to the content of {@code unit}.
     */
    public static String applyChange(ResolvedUnit unit, CompletableFuture<SourceChange> change) throws Exception {
        var sourceChange = change.get(5, TimeUnit.SECONDS);
        return sourceChange.applyTo(unit.path(), unit.content());
    }

    /**
     * Asserts that applying {@code change} to {@code unit} yields {@code expected}.
     */
    public static void assertChange(ResolvedUnit unit, CompletableFuture<SourceChange> change, String expected)
            throws Exception {
        assertCodeEquals(expected, applyChange(unit, change));
    }

    /**
     * Asserts that {@code change} completes without edits.
     */
    public static void assertNoChange(CompletableFuture<SourceChange> change) throws Exception {
        var sourceChange = change.get(5, TimeUnit.SECONDS);
        assertTrue(sourceChange.isEmpty(), "Expected no edits but got " + sourceChange.edits());
    }

    private static String normalizeLineEndings(String content) {
        return content.replaceAll("\\R", "\n").strip();
    }
}
