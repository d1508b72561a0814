package ai.widgetprops.analyzer.ast;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** {@code import 'uri' [as prefix];} */
public final class ImportDirective extends AstNode {
    private final Token keyword;
    private final SimpleStringLiteral uri;
    private final @Nullable SimpleIdentifier prefix;
    private final Token semicolon;

    public ImportDirective(Token keyword, SimpleStringLiteral uri, @Nullable SimpleIdentifier prefix, Token semicolon) {
        this.keyword = keyword;
        this.uri = becomeParentOf(uri);
        this.prefix = becomeParentOfNullable(prefix);
        this.semicolon = semicolon;
    }

    public String uriValue() {
        return uri.value();
    }

    public @Nullable SimpleIdentifier prefix() {
        return prefix;
    }

    @Override
    public Token beginToken() {
        return keyword;
    }

    @Override
    public Token endToken() {
        return semicolon;
    }

    @Override
    public List<AstNode> childNodes() {
        var children = new ArrayList<AstNode>(2);
        children.add(uri);
        if (prefix != null) children.add(prefix);
        return children;
    }
}
