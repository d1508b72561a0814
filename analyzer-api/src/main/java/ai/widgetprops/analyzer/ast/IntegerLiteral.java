package ai.widgetprops.analyzer.ast;

public final class IntegerLiteral extends Literal {
    private final long value;

    public IntegerLiteral(Token literal, long value) {
        super(literal);
        this.value = value;
    }

    public long value() {
        return value;
    }
}
