package ai.widgetprops.analyzer;

import ai.widgetprops.analyzer.ast.AstNode;
import ai.widgetprops.analyzer.ast.CompilationUnit;
import ai.widgetprops.analyzer.ast.NodeLocator;
import org.jetbrains.annotations.Nullable;

/**
 * A parsed and resolved source file: its path, raw text, syntax tree and the types the tree was resolved against.
 * Offsets in the tree index into {@link #content()}.
 */
public record ResolvedUnit(String path, String content, CompilationUnit unit, TypeProvider types) {

    /** Returns the innermost node whose range contains {@code offset}, or null when outside every declaration. */
    public @Nullable AstNode nodeAt(int offset) {
        return NodeLocator.locate(unit, offset);
    }

    public String textOf(AstNode node) {
        return content.substring(node.offset(), node.end());
    }
}
