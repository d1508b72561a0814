package ai.widgetprops.analyzer.ast;

import java.util.List;
import org.jetbrains.annotations.Nullable;

public final class ReturnStatement extends Statement {
    private final Token returnKeyword;
    private final @Nullable Expression expression;
    private final Token semicolon;

    public ReturnStatement(Token returnKeyword, @Nullable Expression expression, Token semicolon) {
        this.returnKeyword = returnKeyword;
        this.expression = becomeParentOfNullable(expression);
        this.semicolon = semicolon;
    }

    public @Nullable Expression expression() {
        return expression;
    }

    @Override
    public Token beginToken() {
        return returnKeyword;
    }

    @Override
    public Token endToken() {
        return semicolon;
    }

    @Override
    public List<AstNode> childNodes() {
        return expression == null ? List.of() : List.of(expression);
    }
}
