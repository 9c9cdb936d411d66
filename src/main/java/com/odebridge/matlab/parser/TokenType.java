package com.odebridge.matlab.parser;

public enum TokenType {
    // literals
    IDENTIFIER(Category.IDENTIFIER),
    NUMBER(Category.NUMBER),
    STRING(Category.STRING),

    // keywords
    FUNCTION(Category.KEYWORD),
    END(Category.KEYWORD),
    IF(Category.KEYWORD),
    ELSEIF(Category.KEYWORD),
    ELSE(Category.KEYWORD),
    FOR(Category.KEYWORD),
    PARFOR(Category.KEYWORD),
    WHILE(Category.KEYWORD),
    SWITCH(Category.KEYWORD),
    CASE(Category.KEYWORD),
    OTHERWISE(Category.KEYWORD),
    TRY(Category.KEYWORD),
    CATCH(Category.KEYWORD),
    RETURN(Category.KEYWORD),
    BREAK(Category.KEYWORD),
    CONTINUE(Category.KEYWORD),
    GLOBAL(Category.KEYWORD),
    PERSISTENT(Category.KEYWORD),

    // arithmetic
    PLUS(Category.OPERATOR),
    MINUS(Category.OPERATOR),
    STAR(Category.OPERATOR),
    SLASH(Category.OPERATOR),
    BACKSLASH(Category.OPERATOR),
    CARET(Category.OPERATOR),
    DOT_STAR(Category.OPERATOR),
    DOT_SLASH(Category.OPERATOR),
    DOT_BACKSLASH(Category.OPERATOR),
    DOT_CARET(Category.OPERATOR),
    TRANSPOSE(Category.OPERATOR),
    DOT_TRANSPOSE(Category.OPERATOR),

    // comparison / logic
    EQUAL_EQUAL(Category.OPERATOR),
    NOT_EQUAL(Category.OPERATOR),
    LESS(Category.OPERATOR),
    LESS_EQUAL(Category.OPERATOR),
    GREATER(Category.OPERATOR),
    GREATER_EQUAL(Category.OPERATOR),
    AMP(Category.OPERATOR),
    PIPE(Category.OPERATOR),
    AMP_AMP(Category.OPERATOR),
    PIPE_PIPE(Category.OPERATOR),
    TILDE(Category.OPERATOR),

    EQUAL(Category.OPERATOR),
    COLON(Category.OPERATOR),
    AT(Category.OPERATOR),
    DOT(Category.OPERATOR),

    // punctuation
    COMMA(Category.PUNCTUATION),
    SEMICOLON(Category.PUNCTUATION),
    LEFT_PAREN(Category.PUNCTUATION),
    RIGHT_PAREN(Category.PUNCTUATION),
    LEFT_BRACKET(Category.PUNCTUATION),
    RIGHT_BRACKET(Category.PUNCTUATION),
    LEFT_BRACE(Category.PUNCTUATION),
    RIGHT_BRACE(Category.PUNCTUATION),
    NEWLINE(Category.PUNCTUATION),

    // "!cmd" escapes to the operating system, kept whole
    SHELL_COMMAND(Category.KEYWORD),

    EOF(Category.PUNCTUATION);

    /** Coarse token classes. */
    public enum Category { IDENTIFIER, NUMBER, OPERATOR, KEYWORD, PUNCTUATION, STRING }

    public final Category category;

    TokenType(Category category) {
        this.category = category;
    }
}
