package ai.widgetprops.analyzer.ast;

import java.util.List;

/** Single-token literal expressions. */
public abstract class Literal extends Expression {
    private final Token literal;

    protected Literal(Token literal) {
        this.literal = literal;
    }

    public Token literal() {
        return literal;
    }

    @Override
    public Token beginToken() {
        return literal;
    }

    @Override
    public Token endToken() {
        return literal;
    }

    @Override
    public List<AstNode> childNodes() {
        return List.of();
    }
}
