package ai.widgetprops.analyzer.ast;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** A call that does not resolve to a known class, e.g. a function call or a method on a variable. */
public final class MethodInvocation extends Expression {
    private final @Nullable Expression target;
    private final SimpleIdentifier methodName;
    private final ArgumentList argumentList;

    public MethodInvocation(@Nullable Expression target, SimpleIdentifier methodName, ArgumentList argumentList) {
        this.target = becomeParentOfNullable(target);
        this.methodName = becomeParentOf(methodName);
        this.argumentList = becomeParentOf(argumentList);
    }

    public @Nullable Expression target() {
        return target;
    }

    public SimpleIdentifier methodName() {
        return methodName;
    }

    public ArgumentList argumentList() {
        return argumentList;
    }

    @Override
    public Token beginToken() {
        return target != null ? target.beginToken() : methodName.beginToken();
    }

    @Override
    public Token endToken() {
        return argumentList.endToken();
    }

    @Override
    public List<AstNode> childNodes() {
        var children = new ArrayList<AstNode>(3);
        if (target != null) children.add(target);
        children.add(methodName);
        children.add(argumentList);
        return children;
    }
}
