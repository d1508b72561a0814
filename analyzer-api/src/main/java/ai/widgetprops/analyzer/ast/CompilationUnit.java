package ai.widgetprops.analyzer.ast;

import java.util.ArrayList;
import java.util.List;

public final class CompilationUnit extends AstNode {
    private final Token beginToken;
    private final List<ImportDirective> imports;
    private final List<FunctionDeclaration> declarations;
    private final Token eof;

    public CompilationUnit(
            Token beginToken, List<ImportDirective> imports, List<FunctionDeclaration> declarations, Token eof) {
        this.beginToken = beginToken;
        this.imports = List.copyOf(imports);
        this.imports.forEach(this::becomeParentOf);
        this.declarations = List.copyOf(declarations);
        this.declarations.forEach(this::becomeParentOf);
        this.eof = eof;
    }

    public List<ImportDirective> imports() {
        return imports;
    }

    public List<FunctionDeclaration> declarations() {
        return declarations;
    }

    @Override
    public Token beginToken() {
        return beginToken;
    }

    @Override
    public Token endToken() {
        return eof;
    }

    @Override
    public List<AstNode> childNodes() {
        var children = new ArrayList<AstNode>(imports.size() + declarations.size());
        children.addAll(imports);
        children.addAll(declarations);
        return children;
    }
}
