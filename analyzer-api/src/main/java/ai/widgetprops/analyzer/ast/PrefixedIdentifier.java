package ai.widgetprops.analyzer.ast;

import java.util.List;

/** {@code prefix.identifier}, e.g. a reference to an enum constant such as {@code TextAlign.center}. */
public final class PrefixedIdentifier extends Expression {
    private final SimpleIdentifier prefix;
    private final Token period;
    private final SimpleIdentifier identifier;

    public PrefixedIdentifier(SimpleIdentifier prefix, Token period, SimpleIdentifier identifier) {
        this.prefix = becomeParentOf(prefix);
        this.period = period;
        this.identifier = becomeParentOf(identifier);
    }

    public SimpleIdentifier prefix() {
        return prefix;
    }

    public Token period() {
        return period;
    }

    public SimpleIdentifier identifier() {
        return identifier;
    }

    @Override
    public Token beginToken() {
        return prefix.beginToken();
    }

    @Override
    public Token endToken() {
        return identifier.endToken();
    }

    @Override
    public List<AstNode> childNodes() {
        return List.of(prefix, identifier);
    }
}
