package ai.widgetprops.analyzer.ast;

import java.util.List;

public final class ListLiteral extends Expression {
    private final Token leftBracket;
    private final List<Expression> elements;
    private final Token rightBracket;

    public ListLiteral(Token leftBracket, List<Expression> elements, Token rightBracket) {
        this.leftBracket = leftBracket;
        this.elements = List.copyOf(elements);
        this.elements.forEach(this::becomeParentOf);
        this.rightBracket = rightBracket;
    }

    public List<Expression> elements() {
        return elements;
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
        return List.copyOf(elements);
    }
}
