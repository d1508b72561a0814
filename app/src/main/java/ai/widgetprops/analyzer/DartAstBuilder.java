package ai.widgetprops.analyzer;

import ai.widgetprops.analyzer.DartAntlrParser.ArgumentContext;
import ai.widgetprops.analyzer.DartAntlrParser.ArgumentsContext;
import ai.widgetprops.analyzer.DartAntlrParser.BlockBodyContext;
import ai.widgetprops.analyzer.DartAntlrParser.BooleanLiteralContext;
import ai.widgetprops.analyzer.DartAntlrParser.CallContext;
import ai.widgetprops.analyzer.DartAntlrParser.CompilationUnitContext;
import ai.widgetprops.analyzer.DartAntlrParser.DoubleLiteralContext;
import ai.widgetprops.analyzer.DartAntlrParser.ExpressionBodyContext;
import ai.widgetprops.analyzer.DartAntlrParser.ExpressionContext;
import ai.widgetprops.analyzer.DartAntlrParser.ExpressionStatementContext;
import ai.widgetprops.analyzer.DartAntlrParser.FunctionBodyContext;
import ai.widgetprops.analyzer.DartAntlrParser.FunctionDeclarationContext;
import ai.widgetprops.analyzer.DartAntlrParser.IdentifierReferenceContext;
import ai.widgetprops.analyzer.DartAntlrParser.ImportDirectiveContext;
import ai.widgetprops.analyzer.DartAntlrParser.IntegerLiteralContext;
import ai.widgetprops.analyzer.DartAntlrParser.ListLiteralContext;
import ai.widgetprops.analyzer.DartAntlrParser.NegationContext;
import ai.widgetprops.analyzer.DartAntlrParser.NullLiteralContext;
import ai.widgetprops.analyzer.DartAntlrParser.ParenthesizedContext;
import ai.widgetprops.analyzer.DartAntlrParser.PrimaryContext;
import ai.widgetprops.analyzer.DartAntlrParser.PrimaryExpressionContext;
import ai.widgetprops.analyzer.DartAntlrParser.QualifiedNameContext;
import ai.widgetprops.analyzer.DartAntlrParser.ReturnStatementContext;
import ai.widgetprops.analyzer.DartAntlrParser.StatementContext;
import ai.widgetprops.analyzer.DartAntlrParser.StringLiteralContext;
import ai.widgetprops.analyzer.ast.ArgumentList;
import ai.widgetprops.analyzer.ast.BlockFunctionBody;
import ai.widgetprops.analyzer.ast.BooleanLiteral;
import ai.widgetprops.analyzer.ast.CompilationUnit;
import ai.widgetprops.analyzer.ast.ConstructorName;
import ai.widgetprops.analyzer.ast.DoubleLiteral;
import ai.widgetprops.analyzer.ast.Expression;
import ai.widgetprops.analyzer.ast.ExpressionFunctionBody;
import ai.widgetprops.analyzer.ast.ExpressionStatement;
import ai.widgetprops.analyzer.ast.FunctionBody;
import ai.widgetprops.analyzer.ast.FunctionDeclaration;
import ai.widgetprops.analyzer.ast.ImportDirective;
import ai.widgetprops.analyzer.ast.InstanceCreationExpression;
import ai.widgetprops.analyzer.ast.IntegerLiteral;
import ai.widgetprops.analyzer.ast.Label;
import ai.widgetprops.analyzer.ast.ListLiteral;
import ai.widgetprops.analyzer.ast.MethodInvocation;
import ai.widgetprops.analyzer.ast.NamedExpression;
import ai.widgetprops.analyzer.ast.NullLiteral;
import ai.widgetprops.analyzer.ast.ParenthesizedExpression;
import ai.widgetprops.analyzer.ast.PrefixExpression;
import ai.widgetprops.analyzer.ast.PrefixedIdentifier;
import ai.widgetprops.analyzer.ast.PropertyAccess;
import ai.widgetprops.analyzer.ast.ReturnStatement;
import ai.widgetprops.analyzer.ast.SimpleIdentifier;
import ai.widgetprops.analyzer.ast.SimpleStringLiteral;
import ai.widgetprops.analyzer.ast.Statement;
import ai.widgetprops.analyzer.ast.StringInterpolation;
import ai.widgetprops.analyzer.ast.Token;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.jetbrains.annotations.Nullable;

/**
 * Turns a {@link DartAntlrParser} parse tree into the syntax tree model, resolving instance creations against an
 * {@link ElementCatalog}. A call whose callee names a catalog class, or a named constructor of one, becomes an
 * {@link InstanceCreationExpression}; any other call is a {@link MethodInvocation}.
 */
final class DartAstBuilder {
    private final ElementCatalog catalog;

    /** Syntax tree tokens, indexed like the parser's token stream. */
    private final List<Token> tokens;

    private final Set<String> importPrefixes = new HashSet<>();

    DartAstBuilder(ElementCatalog catalog, List<Token> tokens) {
        this.catalog = catalog;
        this.tokens = tokens;
    }

    CompilationUnit compilationUnit(CompilationUnitContext ctx) throws SourceParseException {
        var imports = new ArrayList<ImportDirective>();
        for (var directive : ctx.importDirective()) {
            imports.add(importDirective(directive));
        }
        var declarations = new ArrayList<FunctionDeclaration>();
        for (var declaration : ctx.functionDeclaration()) {
            declarations.add(functionDeclaration(declaration));
        }
        return new CompilationUnit(token(ctx.getStart()), imports, declarations, token(ctx.EOF()));
    }

    private ImportDirective importDirective(ImportDirectiveContext ctx) throws SourceParseException {
        var uriToken = token(ctx.uri);
        var uriValue = stringValue(uriToken.lexeme());
        if (uriValue == null) {
            throw new SourceParseException("Import URI must be a constant string", uriToken.offset());
        }
        SimpleIdentifier prefix = null;
        if (ctx.prefix != null) {
            prefix = new SimpleIdentifier(token(ctx.prefix));
            importPrefixes.add(prefix.name());
        }
        return new ImportDirective(
                token(ctx.IMPORT()), new SimpleStringLiteral(uriToken, uriValue), prefix, token(ctx.SEMICOLON()));
    }

    private FunctionDeclaration functionDeclaration(FunctionDeclarationContext ctx) throws SourceParseException {
        return new FunctionDeclaration(
                token(ctx.getStart()), new SimpleIdentifier(token(ctx.name)), functionBody(ctx.functionBody()));
    }

    private FunctionBody functionBody(FunctionBodyContext ctx) throws SourceParseException {
        if (ctx instanceof ExpressionBodyContext body) {
            return new ExpressionFunctionBody(
                    token(body.ARROW()), expression(body.expression()), token(body.SEMICOLON()));
        }
        var block = (BlockBodyContext) ctx;
        var statements = new ArrayList<Statement>();
        for (var statement : block.statement()) {
            statements.add(statement(statement));
        }
        return new BlockFunctionBody(token(block.LBRACE()), statements, token(block.RBRACE()));
    }

    private Statement statement(StatementContext ctx) throws SourceParseException {
        if (ctx instanceof ReturnStatementContext returnStatement) {
            var expression = returnStatement.expression() == null ? null : expression(returnStatement.expression());
            return new ReturnStatement(
                    token(returnStatement.RETURN()), expression, token(returnStatement.SEMICOLON()));
        }
        var expressionStatement = (ExpressionStatementContext) ctx;
        return new ExpressionStatement(
                expression(expressionStatement.expression()), token(expressionStatement.SEMICOLON()));
    }

    private Expression expression(ExpressionContext ctx) throws SourceParseException {
        if (ctx instanceof NegationContext negation) {
            return new PrefixExpression(token(negation.MINUS()), expression(negation.expression()));
        }
        return primary(((PrimaryExpressionContext) ctx).primary());
    }

    private Expression primary(PrimaryContext ctx) throws SourceParseException {
        if (ctx instanceof IntegerLiteralContext literal) {
            var token = token(literal.INTEGER());
            return new IntegerLiteral(token, parseInteger(token));
        }
        if (ctx instanceof DoubleLiteralContext literal) {
            var token = token(literal.DOUBLE());
            return new DoubleLiteral(token, Double.parseDouble(token.lexeme()));
        }
        if (ctx instanceof StringLiteralContext literal) {
            var token = token(literal.STRING());
            var value = stringValue(token.lexeme());
            return value == null ? new StringInterpolation(token) : new SimpleStringLiteral(token, value);
        }
        if (ctx instanceof BooleanLiteralContext literal) {
            return new BooleanLiteral(token(literal.value), literal.TRUE() != null);
        }
        if (ctx instanceof NullLiteralContext literal) {
            return new NullLiteral(token(literal.NULL()));
        }
        if (ctx instanceof ParenthesizedContext parenthesized) {
            return new ParenthesizedExpression(
                    token(parenthesized.LPAREN()),
                    expression(parenthesized.expression()),
                    token(parenthesized.RPAREN()));
        }
        if (ctx instanceof ListLiteralContext list) {
            var elements = new ArrayList<Expression>();
            if (list.elements() != null) {
                for (var element : list.elements().expression()) {
                    elements.add(expression(element));
                }
            }
            return new ListLiteral(token(list.LBRACKET()), elements, token(list.RBRACKET()));
        }
        if (ctx instanceof CallContext call) {
            var keyword = call.keyword == null ? null : token(call.keyword);
            return call(keyword, call.qualifiedName(), argumentList(call.arguments()));
        }
        return identifierReference(((IdentifierReferenceContext) ctx).qualifiedName());
    }

    private Expression identifierReference(QualifiedNameContext ctx) {
        var chain = identifiers(ctx);
        Expression result = chain.get(0);
        if (chain.size() >= 2) {
            result = new PrefixedIdentifier(chain.get(0), token(ctx.DOT(0)), chain.get(1));
        }
        if (chain.size() == 3) {
            result = new PropertyAccess(result, token(ctx.DOT(1)), chain.get(2));
        }
        return result;
    }

    /** Resolves {@code a(...)}, {@code a.b(...)} or {@code a.b.c(...)}, where {@code a} may be an import prefix. */
    private Expression call(@Nullable Token keyword, QualifiedNameContext ctx, ArgumentList arguments)
            throws SourceParseException {
        var chain = identifiers(ctx);
        SimpleIdentifier importPrefix = null;
        var names = chain;
        if (chain.size() > 1 && importPrefixes.contains(chain.get(0).name())) {
            importPrefix = chain.get(0);
            names = chain.subList(1, chain.size());
        }
        var classElement = catalog.classNamed(names.get(0).name()).orElse(null);
        if (classElement != null && names.size() <= 2) {
            var constructorName = names.size() == 2 ? names.get(1) : null;
            var name = new ConstructorName(importPrefix, names.get(0), constructorName);
            var constructor =
                    classElement.getNamedConstructor(constructorName == null ? "" : constructorName.name());
            return new InstanceCreationExpression(keyword, name, arguments, classElement, constructor);
        }
        if (keyword != null) {
            var unknown = names.get(0);
            throw new SourceParseException("Unknown class '" + unknown.name() + "'", unknown.beginToken().offset());
        }
        var methodName = chain.get(chain.size() - 1);
        Expression target = null;
        if (chain.size() == 2) {
            target = chain.get(0);
        } else if (chain.size() == 3) {
            target = new PrefixedIdentifier(chain.get(0), token(ctx.DOT(0)), chain.get(1));
        }
        return new MethodInvocation(target, methodName, arguments);
    }

    private ArgumentList argumentList(ArgumentsContext ctx) throws SourceParseException {
        var arguments = new ArrayList<Expression>();
        for (var argument : ctx.argument()) {
            arguments.add(argument(argument));
        }
        return new ArgumentList(token(ctx.LPAREN()), arguments, token(ctx.RPAREN()));
    }

    private Expression argument(ArgumentContext ctx) throws SourceParseException {
        var expression = expression(ctx.expression());
        if (ctx.label == null) {
            return expression;
        }
        var label = new Label(new SimpleIdentifier(token(ctx.label)), token(ctx.COLON()));
        return new NamedExpression(label, expression);
    }

    private List<SimpleIdentifier> identifiers(QualifiedNameContext ctx) {
        var identifiers = new ArrayList<SimpleIdentifier>();
        for (var identifier : ctx.IDENTIFIER()) {
            identifiers.add(new SimpleIdentifier(token(identifier)));
        }
        return identifiers;
    }

    private Token token(TerminalNode node) {
        return token(node.getSymbol());
    }

    private Token token(org.antlr.v4.runtime.Token antlrToken) {
        return tokens.get(antlrToken.getTokenIndex());
    }

    private static long parseInteger(Token token) throws SourceParseException {
        var lexeme = token.lexeme();
        try {
            if (lexeme.startsWith("0x") || lexeme.startsWith("0X")) {
                return Long.parseLong(lexeme.substring(2), 16);
            }
            return Long.parseLong(lexeme);
        } catch (NumberFormatException e) {
            throw new SourceParseException("Integer literal out of range: " + lexeme, token.offset());
        }
    }

    /**
     * Decodes the value of a string literal such as {@code 'it\'s'} or {@code r'a\b'}. Returns null when the literal
     * contains an interpolation, whose value is not a constant.
     */
    static @Nullable String stringValue(String lexeme) {
        boolean raw = lexeme.startsWith("r");
        var body = lexeme.substring(raw ? 2 : 1, lexeme.length() - 1);
        if (raw) {
            return body;
        }
        var sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '$') {
                return null;
            }
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                continue;
            }
            char escaped = body.charAt(++i);
            switch (escaped) {
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'v' -> sb.append('\u000B');
                default -> sb.append(escaped);
            }
        }
        return sb.toString();
    }
}
