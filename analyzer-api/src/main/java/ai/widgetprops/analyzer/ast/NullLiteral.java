package ai.widgetprops.analyzer.ast;

public final class NullLiteral extends Literal {
    public NullLiteral(Token literal) {
        super(literal);
    }
}
