package com.odebridge.matlab.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import com.odebridge.debug.Debug;

/**
 * MATLAB/Octave lexer.
 *
 * Tokens are produced lazily: every call to {@link #iterator()} starts a fresh scan of the
 * same text, so the sequence can be restarted at will. The sequence always ends with EOF.
 *
 * Layout rules that matter to the parser are decided here:
 *  - newlines are tokens (statement and matrix-row separators)
 *  - "..." splices the next physical line into the current logical line
 *  - a quote is a transpose when it directly follows a value, otherwise it opens a string
 */
public class Lexer implements Iterable<Token> {
    private static final String TAG = "odebridge.lexer";

    private final String sourceName;
    private final String source;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("function", TokenType.FUNCTION);
        map.put("end", TokenType.END);
        map.put("endfunction", TokenType.END);
        map.put("endif", TokenType.END);
        map.put("endfor", TokenType.END);
        map.put("endwhile", TokenType.END);
        map.put("endswitch", TokenType.END);
        map.put("end_try_catch", TokenType.END);
        map.put("if", TokenType.IF);
        map.put("elseif", TokenType.ELSEIF);
        map.put("else", TokenType.ELSE);
        map.put("for", TokenType.FOR);
        map.put("parfor", TokenType.PARFOR);
        map.put("while", TokenType.WHILE);
        map.put("switch", TokenType.SWITCH);
        map.put("case", TokenType.CASE);
        map.put("otherwise", TokenType.OTHERWISE);
        map.put("try", TokenType.TRY);
        map.put("catch", TokenType.CATCH);
        map.put("return", TokenType.RETURN);
        map.put("break", TokenType.BREAK);
        map.put("continue", TokenType.CONTINUE);
        map.put("global", TokenType.GLOBAL);
        map.put("persistent", TokenType.PERSISTENT);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String sourceName, String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        this.sourceName = (sourceName == null) ? "<script>" : sourceName;
        this.source = source;
    }

    public String sourceName() { return sourceName; }

    public String source() { return source; }

    /** Scans the whole text eagerly. Throws {@link LexError} on the first bad input. */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        for (Token t : this) tokens.add(t);
        Debug.get().d(TAG, sourceName + ": " + tokens.size() + " tokens");
        return tokens;
    }

    @Override
    public Iterator<Token> iterator() {
        return new Scan();
    }

    public static boolean isKeyword(String word) {
        return keywords.containsKey(word);
    }

    /** One pass over the text. */
    private final class Scan implements Iterator<Token> {
        private int start = 0;
        private int current = 0;
        private int line = 1;
        private int lineStart = 0;
        private int startLine = 1;
        private int startColumn = 1;
        private boolean sawSpace = false;
        private boolean done = false;
        private Token previous = null;
        private boolean previousStartedStatement = true;
        private Token pending = null;

        // innermost open delimiter: '(', '[' or '{'
        private final Deque<Character> groups = new ArrayDeque<>();

        @Override
        public boolean hasNext() {
            if (pending != null) return true;
            if (done) return false;
            pending = scanNext();
            return true;
        }

        @Override
        public Token next() {
            if (!hasNext()) throw new NoSuchElementException();
            Token t = pending;
            pending = null;
            previousStartedStatement = atStatementStart();
            previous = t;
            if (t.type == TokenType.EOF) done = true;
            return t;
        }

        private Token scanNext() {
            sawSpace = false;
            while (true) {
                if (isAtEnd()) {
                    start = current;
                    markStart();
                    return make(TokenType.EOF, null);
                }
                start = current;
                markStart();
                Token t = scanToken();
                if (t != null) return t;
            }
        }

        /** Returns null for input that produces no token (whitespace, comments, continuations). */
        private Token scanToken() {
            char c = advance();
            switch (c) {
                case ' ': case '\t': case '\f':
                    sawSpace = true;
                    return null;
                case '\r':
                    match('\n');
                    return newline();
                case '\n':
                    return newline();
                case '%':
                    if (peek() == '{' && blockCommentOpener(start)) {
                        blockComment();
                    } else {
                        while (!isAtEnd() && peek() != '\n' && peek() != '\r') advance();
                    }
                    return null;
                case '(': groups.push('('); return make(TokenType.LEFT_PAREN, null);
                case ')': pop(); return make(TokenType.RIGHT_PAREN, null);
                case '[': groups.push('['); return make(TokenType.LEFT_BRACKET, null);
                case ']': pop(); return make(TokenType.RIGHT_BRACKET, null);
                case '{': groups.push('{'); return make(TokenType.LEFT_BRACE, null);
                case '}': pop(); return make(TokenType.RIGHT_BRACE, null);
                case ',': return make(TokenType.COMMA, null);
                case ';': return make(TokenType.SEMICOLON, null);
                case ':': return make(TokenType.COLON, null);
                case '@': return make(TokenType.AT, null);
                case '+': return make(TokenType.PLUS, null);
                case '-': return make(TokenType.MINUS, null);
                case '*': return make(TokenType.STAR, null);
                case '/': return make(TokenType.SLASH, null);
                case '\\': return make(TokenType.BACKSLASH, null);
                case '^': return make(TokenType.CARET, null);
                case '=': return make(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL, null);
                case '<': return make(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS, null);
                case '>': return make(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER, null);
                case '~': return make(match('=') ? TokenType.NOT_EQUAL : TokenType.TILDE, null);
                case '&': return make(match('&') ? TokenType.AMP_AMP : TokenType.AMP, null);
                case '|': return make(match('|') ? TokenType.PIPE_PIPE : TokenType.PIPE, null);
                case '!':
                    if (match('=')) return make(TokenType.NOT_EQUAL, null);
                    if (atStatementStart()) {
                        while (!isAtEnd() && peek() != '\n' && peek() != '\r') advance();
                        return make(TokenType.SHELL_COMMAND, source.substring(start + 1, current).trim());
                    }
                    return make(TokenType.TILDE, null);
                case '.':
                    return dot();
                case '\'':
                    if (quoteIsTranspose()) return make(TokenType.TRANSPOSE, null);
                    return string('\'');
                case '"':
                    return string('"');
                default:
                    if (isDigit(c)) return number();
                    if (isAlpha(c)) return identifier();
                    throw error("Unexpected character '" + c + "'");
            }
        }

        private Token dot() {
            if (match('.')) {
                if (match('.')) {
                    continuation();
                    return null;
                }
                throw error("Unexpected '..'");
            }
            if (isDigit(peek())) return numberAfterDot();
            if (match('*')) return make(TokenType.DOT_STAR, null);
            if (match('/')) return make(TokenType.DOT_SLASH, null);
            if (match('\\')) return make(TokenType.DOT_BACKSLASH, null);
            if (match('^')) return make(TokenType.DOT_CARET, null);
            if (match('\'')) return make(TokenType.DOT_TRANSPOSE, null);
            return make(TokenType.DOT, null);
        }

        // "..." drops the rest of the physical line, including its line break.
        private void continuation() {
            while (!isAtEnd() && peek() != '\n' && peek() != '\r') advance();
            if (isAtEnd()) return;
            if (advance() == '\r') match('\n');
            nextLine();
            sawSpace = true;
        }

        private Token newline() {
            Token t = make(TokenType.NEWLINE, null);
            nextLine();
            return t;
        }

        private boolean blockCommentOpener(int percentOffset) {
            // "%{" only opens a block when it is alone on its line
            for (int i = lineStart; i < percentOffset; i++) {
                if (!isBlank(source.charAt(i))) return false;
            }
            int i = percentOffset + 2;
            while (i < source.length() && source.charAt(i) != '\n' && source.charAt(i) != '\r') {
                if (!isBlank(source.charAt(i))) return false;
                i++;
            }
            return true;
        }

        private void blockComment() {
            int openLine = line;
            int openColumn = start - lineStart + 1;
            int openOffset = start;
            int depth = 1;
            // skip the rest of the opener line
            while (!isAtEnd() && peek() != '\n' && peek() != '\r') advance();
            while (depth > 0) {
                if (isAtEnd()) {
                    throw new LexError("Unterminated block comment",
                            new SourcePosition(sourceName, openLine, openColumn, openOffset, openOffset + 2));
                }
                if (advance() == '\r') match('\n');
                nextLine();
                int lineEnd = current;
                while (lineEnd < source.length() && source.charAt(lineEnd) != '\n' && source.charAt(lineEnd) != '\r') {
                    lineEnd++;
                }
                String text = source.substring(current, lineEnd).trim();
                if (text.equals("%{")) depth++;
                else if (text.equals("%}")) depth--;
                current = lineEnd;
            }
        }

        private Token number() {
            while (isDigit(peek())) advance();
            if (peek() == '.' && !isOperatorAfterDot(peekNext()) && peekNext() != '.') {
                advance();
                while (isDigit(peek())) advance();
            }
            exponent();
            return makeNumber();
        }

        private Token numberAfterDot() {
            while (isDigit(peek())) advance();
            exponent();
            return makeNumber();
        }

        private void exponent() {
            char e = peek();
            if (e != 'e' && e != 'E' && e != 'd' && e != 'D') return;
            int save = current;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            if (!isDigit(peek())) {
                current = save; // "2e" followed by something else: leave the letter for the next token
                return;
            }
            while (isDigit(peek())) advance();
        }

        private Token makeNumber() {
            String text = source.substring(start, current).replace('d', 'e').replace('D', 'e');
            double value;
            try {
                value = Double.parseDouble(text);
            } catch (NumberFormatException ex) {
                throw error("Malformed number '" + source.substring(start, current) + "'");
            }
            return make(TokenType.NUMBER, value);
        }

        private Token identifier() {
            while (isAlphaNumeric(peek())) advance();
            String text = source.substring(start, current);
            TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
            return make(type, null);
        }

        private Token string(char quote) {
            StringBuilder value = new StringBuilder();
            while (true) {
                if (isAtEnd() || peek() == '\n' || peek() == '\r') {
                    throw error("Unterminated string");
                }
                char c = advance();
                if (c == quote) {
                    if (peek() == quote) {
                        advance();
                        value.append(quote);
                        continue;
                    }
                    break;
                }
                value.append(c);
            }
            return make(TokenType.STRING, value.toString());
        }

        private boolean quoteIsTranspose() {
            if (previous == null) return false;
            switch (previous.type) {
                case IDENTIFIER:
                case NUMBER:
                case RIGHT_PAREN:
                case RIGHT_BRACKET:
                case RIGHT_BRACE:
                case TRANSPOSE:
                case DOT_TRANSPOSE:
                case END:
                    break;
                default:
                    return false;
            }
            if (!sawSpace) return true;
            // command syntax: disp 'text'
            if (previous.type == TokenType.IDENTIFIER && previousStartedStatement && groups.isEmpty()) return false;
            // inside [ ] or { } a space before the quote starts a new string element
            Character g = groups.peek();
            return g == null || g == '(';
        }

        private boolean atStatementStart() {
            if (previous == null) return true;
            switch (previous.type) {
                case NEWLINE:
                case SEMICOLON:
                    return true;
                case COMMA:
                    return groups.isEmpty();
                default:
                    return false;
            }
        }

        private void pop() {
            if (!groups.isEmpty()) groups.pop();
        }

        private boolean isAtEnd() { return current >= source.length(); }
        private char advance() { return source.charAt(current++); }

        private boolean match(char expected) {
            if (isAtEnd()) return false;
            if (source.charAt(current) != expected) return false;
            current++;
            return true;
        }

        private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
        private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

        private void nextLine() {
            line++;
            lineStart = current;
        }

        private void markStart() {
            startLine = line;
            startColumn = start - lineStart + 1;
        }

        private Token make(TokenType type, Object literal) {
            String text = source.substring(start, current);
            SourcePosition pos = new SourcePosition(sourceName, startLine, startColumn, start, current);
            return new Token(type, text, literal, pos, sawSpace);
        }

        private LexError error(String msg) {
            SourcePosition pos = new SourcePosition(sourceName, startLine, startColumn, start, current);
            return new LexError(msg, pos);
        }
    }

    private static boolean isOperatorAfterDot(char c) {
        return c == '*' || c == '/' || c == '\\' || c == '^' || c == '\'';
    }

    private static boolean isBlank(char c) { return c == ' ' || c == '\t' || c == '\f'; }
    private static boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c) || c == '_';
    }
}
