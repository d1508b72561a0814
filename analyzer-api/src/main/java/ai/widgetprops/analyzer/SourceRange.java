package ai.widgetprops.analyzer;

import ai.widgetprops.analyzer.ast.AstNode;

/** A half-open range {@code [offset, offset + length)} of characters in a source file. */
public record SourceRange(int offset, int length) {

    public SourceRange {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("Invalid range: offset=%d, length=%d".formatted(offset, length));
        }
    }

    public static SourceRange node(AstNode node) {
        return new SourceRange(node.offset(), node.length());
    }

    /** From the start of {@code first} through the end of {@code last}. */
    public static SourceRange startEnd(AstNode first, AstNode last) {
        return startOffsetEndOffset(first.offset(), last.end());
    }

    public static SourceRange startOffsetEndOffset(int startOffset, int endOffset) {
        return new SourceRange(startOffset, endOffset - startOffset);
    }

    public int end() {
        return offset + length;
    }

    public boolean contains(int otherOffset) {
        return offset <= otherOffset && otherOffset <= end();
    }

    public boolean covers(SourceRange other) {
        return offset <= other.offset && other.end() <= end();
    }

    public boolean intersects(SourceRange other) {
        return offset < other.end() && other.offset < end();
    }
}
