package ai.widgetprops.analyzer.ast;

import java.util.List;

/** A named argument, {@code name: expression}. */
public final class NamedExpression extends Expression {
    private final Label name;
    private final Expression expression;

    public NamedExpression(Label name, Expression expression) {
        this.name = becomeParentOf(name);
        this.expression = becomeParentOf(expression);
    }

    public Label name() {
        return name;
    }

    public Expression expression() {
        return expression;
    }

    @Override
    public Token beginToken() {
        return name.beginToken();
    }

    @Override
    public Token endToken() {
        return expression.endToken();
    }

    @Override
    public List<AstNode> childNodes() {
        return List.of(name, expression);
    }
}
