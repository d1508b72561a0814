package ai.widgetprops.analyzer;

import ai.widgetprops.analyzer.ast.Token;
import ai.widgetprops.analyzer.ast.TokenType;
import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Parses the subset of Dart used by widget build code and resolves instance creations against an
 * {@link ElementCatalog}.
 *
 * <p>Understood: import directives (optionally with {@code as} prefixes) and top-level functions or methods with a
 * block body of {@code return} / expression statements, or an {@code =>} body. Expressions are calls with positional
 * and named arguments, literals, (prefixed) identifiers, unary minus, list literals and parentheses. The text is
 * tokenized and parsed by the generated {@link DartAntlrLexer} and {@link DartAntlrParser}; {@link DartAstBuilder}
 * turns the parse tree into the syntax tree model.
 */
public final class WidgetSourceParser {
    private static final Logger logger = LogManager.getLogger(WidgetSourceParser.class);

    private WidgetSourceParser() {}

    /** Parses and resolves {@code content} as the file at {@code path}. */
    public static ResolvedUnit resolve(ElementCatalog catalog, String path, String content)
            throws SourceParseException {
        var offsets = new CodePointOffsets(content);
        var errors = new ThrowingErrorListener(offsets);

        var lexer = new DartAntlrLexer(CharStreams.fromString(content, path));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);
        var tokenStream = new CommonTokenStream(lexer);

        var parser = new DartAntlrParser(tokenStream);
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        try {
            tokenStream.fill();
            var tree = parser.compilationUnit();
            var tokens = linkTokens(tokenStream.getTokens(), offsets, content.length());
            var unit = new DartAstBuilder(catalog, tokens).compilationUnit(tree);
            return new ResolvedUnit(path, content, unit, catalog);
        } catch (SyntaxError e) {
            logger.debug("Failed to parse {}: {}", path, e.getMessage());
            throw new SourceParseException(e.getMessage(), e.offset);
        }
    }

    /** Converts the token stream into linked syntax tree tokens, keeping the stream's indexes. */
    private static List<Token> linkTokens(
            List<org.antlr.v4.runtime.Token> antlrTokens, CodePointOffsets offsets, int length) {
        var tokens = new ArrayList<Token>(antlrTokens.size());
        Token previous = null;
        for (var antlrToken : antlrTokens) {
            var token = antlrToken.getType() == org.antlr.v4.runtime.Token.EOF
                    ? new Token(TokenType.EOF, "", length)
                    : new Token(
                            tokenType(antlrToken.getType()),
                            antlrToken.getText(),
                            offsets.charOffset(antlrToken.getStartIndex()));
            if (previous != null) {
                previous.link(token);
            }
            tokens.add(token);
            previous = token;
        }
        return tokens;
    }

    private static TokenType tokenType(int type) {
        return switch (type) {
            case DartAntlrLexer.IMPORT,
                    DartAntlrLexer.AS,
                    DartAntlrLexer.RETURN,
                    DartAntlrLexer.CONST,
                    DartAntlrLexer.NEW,
                    DartAntlrLexer.TRUE,
                    DartAntlrLexer.FALSE,
                    DartAntlrLexer.NULL -> TokenType.KEYWORD;
            case DartAntlrLexer.IDENTIFIER -> TokenType.IDENTIFIER;
            case DartAntlrLexer.INTEGER -> TokenType.INTEGER;
            case DartAntlrLexer.DOUBLE -> TokenType.DOUBLE;
            case DartAntlrLexer.STRING -> TokenType.STRING;
            case DartAntlrLexer.ARROW -> TokenType.FUNCTION;
            case DartAntlrLexer.LPAREN -> TokenType.OPEN_PAREN;
            case DartAntlrLexer.RPAREN -> TokenType.CLOSE_PAREN;
            case DartAntlrLexer.LBRACE -> TokenType.OPEN_CURLY_BRACKET;
            case DartAntlrLexer.RBRACE -> TokenType.CLOSE_CURLY_BRACKET;
            case DartAntlrLexer.LBRACKET -> TokenType.OPEN_SQUARE_BRACKET;
            case DartAntlrLexer.RBRACKET -> TokenType.CLOSE_SQUARE_BRACKET;
            case DartAntlrLexer.LT -> TokenType.LT;
            case DartAntlrLexer.GT -> TokenType.GT;
            case DartAntlrLexer.COMMA -> TokenType.COMMA;
            case DartAntlrLexer.COLON -> TokenType.COLON;
            case DartAntlrLexer.SEMICOLON -> TokenType.SEMICOLON;
            case DartAntlrLexer.DOT -> TokenType.PERIOD;
            case DartAntlrLexer.MINUS -> TokenType.MINUS;
            case DartAntlrLexer.EQ -> TokenType.EQ;
            case DartAntlrLexer.QUESTION -> TokenType.QUESTION;
            case DartAntlrLexer.BANG -> TokenType.BANG;
            default -> throw new IllegalArgumentException("Unmapped token type " + type);
        };
    }

    /** Carries the first lexer or parser error out of the generated recognizers. */
    private static final class SyntaxError extends RuntimeException {
        private final int offset;

        SyntaxError(String message, int offset) {
            super(message);
            this.offset = offset;
        }
    }

    private static final class ThrowingErrorListener extends BaseErrorListener {
        private final CodePointOffsets offsets;

        ThrowingErrorListener(CodePointOffsets offsets) {
            this.offsets = offsets;
        }

        @Override
        public void syntaxError(
                Recognizer<?, ?> recognizer,
                @Nullable Object offendingSymbol,
                int line,
                int charPositionInLine,
                String msg,
                @Nullable RecognitionException e) {
            int index = 0;
            if (offendingSymbol instanceof org.antlr.v4.runtime.Token token) {
                index = token.getStartIndex();
            } else if (e instanceof LexerNoViableAltException lexerError) {
                index = lexerError.getStartIndex();
            }
            throw new SyntaxError(msg, offsets.charOffset(index));
        }
    }
}
