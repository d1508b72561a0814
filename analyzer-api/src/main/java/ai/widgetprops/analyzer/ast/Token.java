package ai.widgetprops.analyzer.ast;

import org.jetbrains.annotations.Nullable;

/**
 * A lexical token. Tokens of one file form a doubly linked stream ending with an {@link TokenType#EOF} token, so
 * callers can look at the punctuation around any node without re-scanning the text.
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final int offset;

    private @Nullable Token previous;
    private @Nullable Token next;

    public Token(TokenType type, String lexeme, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.offset = offset;
    }

    public TokenType type() {
        return type;
    }

    public String lexeme() {
        return lexeme;
    }

    public int offset() {
        return offset;
    }

    public int end() {
        return offset + lexeme.length();
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && lexeme.equals(keyword);
    }

    public @Nullable Token previous() {
        return previous;
    }

    public @Nullable Token next() {
        return next;
    }

    /** Appends {@code following} after this token and returns it. */
    public Token link(Token following) {
        this.next = following;
        following.previous = this;
        return following;
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "<EOF>" : lexeme;
    }
}
