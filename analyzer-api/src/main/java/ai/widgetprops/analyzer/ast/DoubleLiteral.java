package ai.widgetprops.analyzer.ast;

public final class DoubleLiteral extends Literal {
    private final double value;

    public DoubleLiteral(Token literal, double value) {
        super(literal);
        this.value = value;
    }

    public double value() {
        return value;
    }
}
