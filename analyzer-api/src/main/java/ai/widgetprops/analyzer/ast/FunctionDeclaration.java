package ai.widgetprops.analyzer.ast;

import java.util.List;

/** A top-level function or method; the return type and parameter list are kept only as tokens. */
public final class FunctionDeclaration extends AstNode {
    private final Token firstToken;
    private final SimpleIdentifier name;
    private final FunctionBody body;

    public FunctionDeclaration(Token firstToken, SimpleIdentifier name, FunctionBody body) {
        this.firstToken = firstToken;
        this.name = becomeParentOf(name);
        this.body = becomeParentOf(body);
    }

    public SimpleIdentifier name() {
        return name;
    }

    public FunctionBody body() {
        return body;
    }

    @Override
    public Token beginToken() {
        return firstToken;
    }

    @Override
    public Token endToken() {
        return body.endToken();
    }

    @Override
    public List<AstNode> childNodes() {
        return List.of(name, body);
    }
}
