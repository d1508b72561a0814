package ai.widgetprops.analyzer.ast;

import java.util.List;

public final class ArgumentList extends AstNode {
    private final Token leftParenthesis;
    private final List<Expression> arguments;
    private final Token rightParenthesis;

    public ArgumentList(Token leftParenthesis, List<Expression> arguments, Token rightParenthesis) {
        this.leftParenthesis = leftParenthesis;
        this.arguments = List.copyOf(arguments);
        this.arguments.forEach(this::becomeParentOf);
        this.rightParenthesis = rightParenthesis;
    }

    public Token leftParenthesis() {
        return leftParenthesis;
    }

    /** Positional arguments and {@link NamedExpression}s, in source order. */
    public List<Expression> arguments() {
        return arguments;
    }

    public Token rightParenthesis() {
        return rightParenthesis;
    }

    /** Index of {@code argument} in this list by identity, or -1. */
    public int indexOf(Expression argument) {
        for (int i = 0; i < arguments.size(); i++) {
            if (arguments.get(i) == argument) {
                return i;
            }
        }
        return -1;
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
        return List.copyOf(arguments);
    }
}
