package ai.widgetprops.analyzer.ast;

import java.util.List;

public final class ExpressionFunctionBody extends FunctionBody {
    private final Token functionDefinition;
    private final Expression expression;
    private final Token semicolon;

    public ExpressionFunctionBody(Token functionDefinition, Expression expression, Token semicolon) {
        this.functionDefinition = functionDefinition;
        this.expression = becomeParentOf(expression);
        this.semicolon = semicolon;
    }

    public Expression expression() {
        return expression;
    }

    @Override
    public Token beginToken() {
        return functionDefinition;
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
