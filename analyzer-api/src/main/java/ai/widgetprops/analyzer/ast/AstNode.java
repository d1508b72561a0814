package ai.widgetprops.analyzer.ast;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Base class of the syntax tree. A node spans from the start of its first token to the end of its last token, and
 * knows its parent once it has been attached to one.
 */
public abstract class AstNode {
    private @Nullable AstNode parent;

    public abstract Token beginToken();

    public abstract Token endToken();

    /** Direct children in source order. */
    public abstract List<AstNode> childNodes();

    public final int offset() {
        return beginToken().offset();
    }

    public final int end() {
        return endToken().end();
    }

    public final int length() {
        return end() - offset();
    }

    public final @Nullable AstNode parent() {
        return parent;
    }

    protected final <T extends AstNode> T becomeParentOf(T child) {
        ((AstNode) child).parent = this;
        return child;
    }

    protected final <T extends AstNode> @Nullable T becomeParentOfNullable(@Nullable T child) {
        if (child != null) {
            ((AstNode) child).parent = this;
        }
        return child;
    }

    /** Returns this node, or the closest ancestor, that is an instance of {@code type}. */
    public final <T extends AstNode> @Nullable T thisOrAncestorOfType(Class<T> type) {
        AstNode current = this;
        while (current != null) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.parent;
        }
        return null;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + offset() + ".." + end() + "]";
    }
}
