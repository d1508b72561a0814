package ai.widgetprops.analyzer.ast;

public enum TokenType {
    IDENTIFIER,
    KEYWORD,
    INTEGER,
    DOUBLE,
    STRING,
    OPEN_PAREN,
    CLOSE_PAREN,
    OPEN_CURLY_BRACKET,
    CLOSE_CURLY_BRACKET,
    OPEN_SQUARE_BRACKET,
    CLOSE_SQUARE_BRACKET,
    LT,
    GT,
    COMMA,
    COLON,
    SEMICOLON,
    PERIOD,
    MINUS,
    EQ,
    FUNCTION,
    QUESTION,
    BANG,
    EOF
}
