package ai.widgetprops.analyzer.ast;

import org.jetbrains.annotations.Nullable;

/** Finds the innermost node covering an offset. */
public final class NodeLocator {

    private NodeLocator() {
        // utility
    }

    public static @Nullable AstNode locate(AstNode root, int offset) {
        if (offset < root.offset() || offset > root.end()) {
            return null;
        }
        AstNode current = root;
        outer:
        while (true) {
            for (var child : current.childNodes()) {
                if (child.offset() <= offset && offset <= child.end()) {
                    current = child;
                    continue outer;
                }
            }
            return current;
        }
    }
}
