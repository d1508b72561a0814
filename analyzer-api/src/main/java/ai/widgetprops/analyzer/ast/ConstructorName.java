package ai.widgetprops.analyzer.ast;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** {@code [importPrefix.]Type[.name]} as written in an instance creation. */
public final class ConstructorName extends AstNode {
    private final @Nullable SimpleIdentifier importPrefix;
    private final SimpleIdentifier typeName;
    private final @Nullable SimpleIdentifier name;

    public ConstructorName(
            @Nullable SimpleIdentifier importPrefix, SimpleIdentifier typeName, @Nullable SimpleIdentifier name) {
        this.importPrefix = becomeParentOfNullable(importPrefix);
        this.typeName = becomeParentOf(typeName);
        this.name = becomeParentOfNullable(name);
    }

    public @Nullable SimpleIdentifier importPrefix() {
        return importPrefix;
    }

    public SimpleIdentifier typeName() {
        return typeName;
    }

    public @Nullable SimpleIdentifier name() {
        return name;
    }

    @Override
    public Token beginToken() {
        return importPrefix != null ? importPrefix.beginToken() : typeName.beginToken();
    }

    @Override
    public Token endToken() {
        return name != null ? name.endToken() : typeName.endToken();
    }

    @Override
    public List<AstNode> childNodes() {
        var children = new ArrayList<AstNode>(3);
        if (importPrefix != null) children.add(importPrefix);
        children.add(typeName);
        if (name != null) children.add(name);
        return children;
    }
}
