package ai.widgetprops.analyzer.ast;

import java.util.List;

public final class BlockFunctionBody extends FunctionBody {
    private final Token leftBracket;
    private final List<Statement> statements;
    private final Token rightBracket;

    public BlockFunctionBody(Token leftBracket, List<Statement> statements, Token rightBracket) {
        this.leftBracket = leftBracket;
        this.statements = List.copyOf(statements);
        this.statements.forEach(this::becomeParentOf);
        this.rightBracket = rightBracket;
    }

    public List<Statement> statements() {
        return statements;
    }

    @Override
    public Token beginToken() {
        return leftBracket;
    }

    @Override
    public Token endToken() {
        return rightBracket;
    }

    @Override
    public List<AstNode> childNodes() {
        return List.copyOf(statements);
    }
}
