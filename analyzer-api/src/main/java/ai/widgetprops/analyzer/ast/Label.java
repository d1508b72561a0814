package ai.widgetprops.analyzer.ast;

import java.util.List;

/** The {@code name:} part of a named argument. */
public final class Label extends AstNode {
    private final SimpleIdentifier label;
    private final Token colon;

    public Label(SimpleIdentifier label, Token colon) {
        this.label = becomeParentOf(label);
        this.colon = colon;
    }

    public SimpleIdentifier label() {
        return label;
    }

    public String name() {
        return label.name();
    }

    @Override
    public Token beginToken() {
        return label.beginToken();
    }

    @Override
    public Token endToken() {
        return colon;
    }

    @Override
    public List<AstNode> childNodes() {
        return List.of(label);
    }
}
