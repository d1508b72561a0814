package ai.widgetprops.analyzer.ast;

import java.util.List;

public final class SimpleIdentifier extends Expression {
    private final Token token;

    public SimpleIdentifier(Token token) {
        this.token = token;
    }

    public String name() {
        return token.lexeme();
    }

    @Override
    public Token beginToken() {
        return token;
    }

    @Override
    public Token endToken() {
        return token;
    }

    @Override
    public List<AstNode> childNodes() {
        return List.of();
    }
}
