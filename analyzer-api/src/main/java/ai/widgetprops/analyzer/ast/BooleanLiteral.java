package ai.widgetprops.analyzer.ast;

public final class BooleanLiteral extends Literal {
    private final boolean value;

    public BooleanLiteral(Token literal, boolean value) {
        super(literal);
        this.value = value;
    }

    public boolean value() {
        return value;
    }
}
