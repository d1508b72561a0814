package ai.widgetprops.analyzer.ast;

/** A string literal containing {@code $} interpolations; its value is not known statically. */
public final class StringInterpolation extends Literal {
    public StringInterpolation(Token literal) {
        super(literal);
    }
}
