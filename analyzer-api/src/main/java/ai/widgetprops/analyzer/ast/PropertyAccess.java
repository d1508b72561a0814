package ai.widgetprops.analyzer.ast;

import java.util.List;

/** {@code target.propertyName} where the target is itself a compound expression. */
public final class PropertyAccess extends Expression {
    private final Expression target;
    private final Token operator;
    private final SimpleIdentifier propertyName;

    public PropertyAccess(Expression target, Token operator, SimpleIdentifier propertyName) {
        this.target = becomeParentOf(target);
        this.operator = operator;
        this.propertyName = becomeParentOf(propertyName);
    }

    public Expression target() {
        return target;
    }

    public Token operator() {
        return operator;
    }

    public SimpleIdentifier propertyName() {
        return propertyName;
    }

    @Override
    public Token beginToken() {
        return target.beginToken();
    }

    @Override
    public Token endToken() {
        return propertyName.endToken();
    }

    @Override
    public List<AstNode> childNodes() {
        return List.of(target, propertyName);
    }
}
