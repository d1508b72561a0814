package ai.widgetprops.analyzer.ast;

import java.util.List;

public final class ExpressionStatement extends Statement {
    private final Expression expression;
    private final Token semicolon;

    public ExpressionStatement(Expression expression, Token semicolon) {
        this.expression = becomeParentOf(expression);
        this.semicolon = semicolon;
    }

    public Expression expression() {
        return expression;
    }

    @Override
    public Token beginToken() {
        return expression.beginToken();
    }

    @Override
    public Token endToken() {
        return semicolon;
    }

    @Override
    public List<AstNode> childNodes() {
        return List.of(expression);
    }
}
