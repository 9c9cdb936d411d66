package com.odebridge.matlab.parser;

/**
 * One lexical token. The lexeme is exactly the source text spanned by {@link #position}.
 */
public final class Token {
    public final TokenType type;
    public final String lexeme;
    public final Object literal; // Double for NUMBER, unescaped String for STRING
    public final SourcePosition position;
    /** True when whitespace separated this token from the previous one on the same line. */
    public final boolean spaceBefore;

    Token(TokenType type, String lexeme, Object literal, SourcePosition position, boolean spaceBefore) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.position = position;
        this.spaceBefore = spaceBefore;
    }

    public int line() { return position.line; }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' @" + position;
    }
}
