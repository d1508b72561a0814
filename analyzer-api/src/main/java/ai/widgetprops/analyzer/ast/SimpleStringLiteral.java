package ai.widgetprops.analyzer.ast;

public final class SimpleStringLiteral extends Literal {
    private final String value;

    public SimpleStringLiteral(Token literal, String value) {
        super(literal);
        this.value = value;
    }

    public String value() {
        return value;
    }
}
