package ai.widgetprops.analyzer.ast;

import java.util.List;

public final class ParenthesizedExpression extends Expression {
    private final Token leftParenthesis;
    private final Expression expression;
    private final Token rightParenthesis;

    public ParenthesizedExpression(Token leftParenthesis, Expression expression, Token rightParenthesis) {
        this.leftParenthesis = leftParenthesis;
        this.expression = becomeParentOf(expression);
        this.rightParenthesis = rightParenthesis;
    }

    public Expression expression() {
        return expression;
    }

    @Override
    public Token beginToken() {
        return leftParenthesis;
    }

    @Override
    public Token endToken() {
        return rightParenthesis;
    }

    @Override
    public List<AstNode> childNodes() {
        return List.of(expression);
    }
}
