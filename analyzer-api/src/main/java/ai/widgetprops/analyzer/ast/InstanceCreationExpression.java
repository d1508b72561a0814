package ai.widgetprops.analyzer.ast;

import ai.widgetprops.analyzer.element.ClassElement;
import ai.widgetprops.analyzer.element.ConstructorElement;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A call that instantiates a known class, with or without a {@code new} / {@code const} keyword. The class is always
 * resolved; the constructor is null when the class has no constructor with the written name.
 */
public final class InstanceCreationExpression extends Expression {
    private final @Nullable Token keyword;
    private final ConstructorName constructorName;
    private final ArgumentList argumentList;
    private final ClassElement classElement;
    private final @Nullable ConstructorElement staticElement;

    public InstanceCreationExpression(
            @Nullable Token keyword,
            ConstructorName constructorName,
            ArgumentList argumentList,
            ClassElement classElement,
            @Nullable ConstructorElement staticElement) {
        this.keyword = keyword;
        this.constructorName = becomeParentOf(constructorName);
        this.argumentList = becomeParentOf(argumentList);
        this.classElement = classElement;
        this.staticElement = staticElement;
    }

    public @Nullable Token keyword() {
        return keyword;
    }

    public ConstructorName constructorName() {
        return constructorName;
    }

    public ArgumentList argumentList() {
        return argumentList;
    }

    /** The instantiated class, also the static type of this expression. */
    public ClassElement classElement() {
        return classElement;
    }

    public @Nullable ConstructorElement staticElement() {
        return staticElement;
    }

    @Override
    public Token beginToken() {
        return keyword != null ? keyword : constructorName.beginToken();
    }

    @Override
    public Token endToken() {
        return argumentList.endToken();
    }

    @Override
    public List<AstNode> childNodes() {
        var children = new ArrayList<AstNode>(2);
        children.add(constructorName);
        children.add(argumentList);
        return children;
    }
}
