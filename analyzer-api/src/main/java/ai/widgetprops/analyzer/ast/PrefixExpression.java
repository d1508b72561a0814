package ai.widgetprops.analyzer.ast;

import java.util.List;

public final class PrefixExpression extends Expression {
    private final Token operator;
    private final Expression operand;

    public PrefixExpression(Token operator, Expression operand) {
        this.operator = operator;
        this.operand = becomeParentOf(operand);
    }

    public Token operator() {
        return operator;
    }

    public Expression operand() {
        return operand;
    }

    @Override
    public Token beginToken() {
        return operator;
    }

    @Override
    public Token endToken() {
        return operand.endToken();
    }

    @Override
    public List<AstNode> childNodes() {
        return List.of(operand);
    }
}
