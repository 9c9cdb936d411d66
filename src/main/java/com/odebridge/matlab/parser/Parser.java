package com.odebridge.matlab.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import com.odebridge.debug.Debug;
import com.odebridge.matlab.MatlabBuiltins;
import com.odebridge.matlab.parser.Expr.Binary;
import com.odebridge.matlab.parser.Expr.CellIndex;
import com.odebridge.matlab.parser.Expr.Colon;
import com.odebridge.matlab.parser.Expr.EndIndex;
import com.odebridge.matlab.parser.Expr.ExprInterface;
import com.odebridge.matlab.parser.Expr.FieldAccess;
import com.odebridge.matlab.parser.Expr.FunctionHandle;
import com.odebridge.matlab.parser.Expr.Identifier;
import com.odebridge.matlab.parser.Expr.IndexOrCall;
import com.odebridge.matlab.parser.Expr.MatrixLiteral;
import com.odebridge.matlab.parser.Expr.NumberLiteral;
import com.odebridge.matlab.parser.Expr.Range;
import com.odebridge.matlab.parser.Expr.SolverCall;
import com.odebridge.matlab.parser.Expr.StringLiteral;
import com.odebridge.matlab.parser.Expr.Unary;
import com.odebridge.matlab.parser.Statement.Assignment;
import com.odebridge.matlab.parser.Statement.Clause;
import com.odebridge.matlab.parser.Statement.CommandStmt;
import com.odebridge.matlab.parser.Statement.ControlStmt;
import com.odebridge.matlab.parser.Statement.DeclarationStmt;
import com.odebridge.matlab.parser.Statement.ExprStmt;
import com.odebridge.matlab.parser.Statement.FunctionDef;
import com.odebridge.matlab.parser.Statement.KeywordStmt;
import com.odebridge.matlab.parser.Statement.ScriptBlock;
import com.odebridge.matlab.parser.Statement.ShellStmt;
import com.odebridge.matlab.parser.Statement.Stmt;

/**
 * Recursive-descent parser for the MATLAB subset.
 *
 * Expression precedence, lowest first: range, ||, &&, |, &, comparison, additive,
 * multiplicative, prefix unary, power, postfix (call/index, cell index, field, transpose).
 *
 * A statement that fails to parse is recorded and skipped up to the next newline or ';',
 * so one pass reports every broken statement.
 */
public class Parser {
    private static final String TAG = "odebridge.parser";

    private final List<Token> tokens;
    private final KindTable kinds = new KindTable();
    private final KindResolver resolver;
    private final List<ParseError> errors = new ArrayList<>();
    private final List<FunctionDef> functions = new ArrayList<>();
    private int current = 0;

    // innermost grouping first; true inside [ ] and { } where whitespace separates elements
    private final Deque<Boolean> spaceSeparates = new ArrayDeque<>();
    private int subscriptDepth = 0;

    public Parser(List<Token> tokens) { this(tokens, MatlabBuiltins.standard()); }

    public Parser(List<Token> tokens, MatlabBuiltins builtins) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type != TokenType.EOF) {
            throw new IllegalArgumentException("token list must end with EOF");
        }
        this.tokens = tokens;
        this.resolver = new KindResolver(builtins, kinds);
    }

    public ParsedScript parse() {
        Token first = peek();
        List<Stmt> statements = new ArrayList<>();
        while (true) {
            skipSeparators();
            if (isAtEnd()) break;
            if (check(TokenType.END)) {
                record(error(advance(), "Unexpected 'end' outside of a block.", null));
                continue;
            }
            Stmt stmt = statementSafely();
            if (stmt != null) statements.add(stmt);
        }
        resolver.exitScope();

        ScriptBlock root = new ScriptBlock(statements, SourcePosition.span(first.position, peek().position));
        String source = first.position.source;
        Debug.get().d(TAG, source + ": " + statements.size() + " statement(s), " + functions.size()
                + " function(s), " + kinds.size() + " call/index node(s), " + errors.size() + " error(s)");
        return new ParsedScript(source, root, kinds, functions, errors);
    }

    // -------------------------
    // Statements
    // -------------------------

    private Stmt statementSafely() {
        int groups = spaceSeparates.size();
        int subscripts = subscriptDepth;
        try {
            return statement();
        } catch (ParseError e) {
            record(e);
            while (spaceSeparates.size() > groups) spaceSeparates.pop();
            subscriptDepth = subscripts;
            synchronize();
            return null;
        }
    }

    private Stmt statement() {
        Token t = peek();
        switch (t.type) {
            case FUNCTION:
                return functionDefinition();
            case IF:
                return ifStatement();
            case FOR:
            case PARFOR:
                return forStatement();
            case WHILE:
                return whileStatement();
            case SWITCH:
                return switchStatement();
            case TRY:
                return tryStatement();
            case GLOBAL:
            case PERSISTENT:
                return declaration();
            case RETURN:
            case BREAK:
            case CONTINUE:
                advance();
                endOfStatement();
                return new KeywordStmt(t);
            case SHELL_COMMAND:
                advance();
                endOfStatement();
                return new ShellStmt(t);
            case IDENTIFIER:
                if (isCommandSyntax()) return commandStatement();
                break;
            case LEFT_BRACKET:
                if (isMultiAssignment()) return multiAssignment();
                break;
            default:
                break;
        }
        return expressionStatement();
    }

    private Stmt expressionStatement() {
        ExprInterface expr = expression();
        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            checkTarget(expr, equals);
            ExprInterface value = expression();
            resolver.assigned(baseName(expr), expr instanceof Identifier);
            endOfStatement();
            List<ExprInterface> targets = new ArrayList<>();
            targets.add(expr);
            return new Assignment(targets, false, equals, value);
        }
        endOfStatement();
        return new ExprStmt(expr);
    }

    private Stmt multiAssignment() {
        consume(TokenType.LEFT_BRACKET, "Expect '['.");
        List<ExprInterface> targets = new ArrayList<>();
        spaceSeparates.push(true);
        try {
            while (!check(TokenType.RIGHT_BRACKET) && !isAtEnd()) {
                if (match(TokenType.TILDE)) {
                    targets.add(new Identifier(previous()));
                } else {
                    targets.add(postfixExpression());
                }
                match(TokenType.COMMA);
            }
        } finally {
            spaceSeparates.pop();
        }
        consume(TokenType.RIGHT_BRACKET, "Expect ']' after output list.");
        Token equals = consume(TokenType.EQUAL, "Expect '=' after output list.");
        if (targets.isEmpty()) throw error(equals, "Empty output list.", "output name");
        for (ExprInterface target : targets) {
            if (!Assignment.isPlaceholder(target)) checkTarget(target, equals);
        }
        ExprInterface value = expression();
        for (ExprInterface target : targets) {
            if (!Assignment.isPlaceholder(target)) resolver.assigned(baseName(target), target instanceof Identifier);
        }
        endOfStatement();
        return new Assignment(targets, true, equals, value);
    }

    private Stmt functionDefinition() {
        Token keyword = advance();
        List<Token> outputs = new ArrayList<>();
        Token name;
        if (match(TokenType.LEFT_BRACKET)) {
            while (!check(TokenType.RIGHT_BRACKET) && !isAtEnd()) {
                outputs.add(consumeName("Expect output name."));
                match(TokenType.COMMA);
            }
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after function outputs.");
            consume(TokenType.EQUAL, "Expect '=' after function outputs.");
            name = consume(TokenType.IDENTIFIER, "Expect function name.");
        } else {
            Token first = consume(TokenType.IDENTIFIER, "Expect function name.");
            if (match(TokenType.EQUAL)) {
                outputs.add(first);
                name = consume(TokenType.IDENTIFIER, "Expect function name.");
            } else {
                name = first;
            }
        }

        List<Token> params = new ArrayList<>();
        if (match(TokenType.LEFT_PAREN)) {
            if (!check(TokenType.RIGHT_PAREN)) {
                do {
                    params.add(consumeName("Expect parameter name."));
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");
        }
        endOfStatement();

        resolver.defineFunction(name.lexeme);
        resolver.enterScope(name.lexeme);
        ScriptBlock body;
        try {
            for (Token out : outputs) {
                if (out.type == TokenType.IDENTIFIER) resolver.declareVariable(out.lexeme);
            }
            for (Token param : params) {
                if (param.type == TokenType.IDENTIFIER) resolver.declareVariable(param.lexeme);
            }
            // a body ends at its own 'end', at the next 'function' or at end of file
            body = block(TokenType.END, TokenType.FUNCTION);
            if (match(TokenType.END)) endOfStatement();
        } finally {
            resolver.exitScope();
        }

        FunctionDef def = new FunctionDef(keyword, name, outputs, params, body);
        functions.add(def);
        Debug.get().t(TAG, "function " + name.lexeme + "(" + params.size() + " param(s)) -> "
                + outputs.size() + " output(s)");
        return def;
    }

    private Stmt ifStatement() {
        Token keyword = advance();
        List<Clause> clauses = new ArrayList<>();
        ExprInterface condition = header();
        clauses.add(new Clause(keyword, null, condition, block(TokenType.ELSEIF, TokenType.ELSE, TokenType.END)));
        while (match(TokenType.ELSEIF)) {
            Token k = previous();
            condition = header();
            clauses.add(new Clause(k, null, condition, block(TokenType.ELSEIF, TokenType.ELSE, TokenType.END)));
        }
        if (match(TokenType.ELSE)) {
            Token k = previous();
            clauses.add(new Clause(k, null, null, block(TokenType.END)));
        }
        closeBlock(keyword);
        return new ControlStmt(keyword, clauses);
    }

    private Stmt forStatement() {
        Token keyword = advance();
        Token variable = null;
        ExprInterface range = null;
        int groups = spaceSeparates.size();
        try {
            boolean parenthesized = match(TokenType.LEFT_PAREN);
            if (parenthesized) spaceSeparates.push(false);
            variable = consume(TokenType.IDENTIFIER, "Expect loop variable.");
            consume(TokenType.EQUAL, "Expect '=' after loop variable.");
            range = expression();
            if (parenthesized) {
                // parfor (i = 1:n, maxWorkers)
                if (match(TokenType.COMMA)) expression();
                consume(TokenType.RIGHT_PAREN, "Expect ')' after loop header.");
                spaceSeparates.pop();
            }
        } catch (ParseError e) {
            record(e);
            while (spaceSeparates.size() > groups) spaceSeparates.pop();
            synchronize();
        }
        if (variable != null) resolver.declareVariable(variable.lexeme);
        List<Clause> clauses = new ArrayList<>();
        clauses.add(new Clause(keyword, variable, range, block(TokenType.END)));
        closeBlock(keyword);
        return new ControlStmt(keyword, clauses);
    }

    private Stmt whileStatement() {
        Token keyword = advance();
        ExprInterface condition = header();
        List<Clause> clauses = new ArrayList<>();
        clauses.add(new Clause(keyword, null, condition, block(TokenType.END)));
        closeBlock(keyword);
        return new ControlStmt(keyword, clauses);
    }

    private Stmt switchStatement() {
        Token keyword = advance();
        ExprInterface subject = header();
        List<Clause> clauses = new ArrayList<>();
        clauses.add(new Clause(keyword, null, subject,
                new ScriptBlock(new ArrayList<>(), keyword.position)));
        skipSeparators();
        while (match(TokenType.CASE)) {
            Token k = previous();
            ExprInterface value = header();
            clauses.add(new Clause(k, null, value, block(TokenType.CASE, TokenType.OTHERWISE, TokenType.END)));
        }
        if (match(TokenType.OTHERWISE)) {
            Token k = previous();
            clauses.add(new Clause(k, null, null, block(TokenType.END)));
        }
        closeBlock(keyword);
        return new ControlStmt(keyword, clauses);
    }

    private Stmt tryStatement() {
        Token keyword = advance();
        List<Clause> clauses = new ArrayList<>();
        clauses.add(new Clause(keyword, null, null, block(TokenType.CATCH, TokenType.END)));
        if (match(TokenType.CATCH)) {
            Token k = previous();
            Token id = null;
            if (check(TokenType.IDENTIFIER) && peek().line() == k.line()) {
                id = advance();
                resolver.declareVariable(id.lexeme);
            }
            clauses.add(new Clause(k, id, null, block(TokenType.END)));
        }
        closeBlock(keyword);
        return new ControlStmt(keyword, clauses);
    }

    private Stmt declaration() {
        Token keyword = advance();
        List<Token> names = new ArrayList<>();
        while (check(TokenType.IDENTIFIER)) names.add(advance());
        if (names.isEmpty()) throw error(peek(), "Expect variable name after '" + keyword.lexeme + "'.", "identifier");
        for (Token n : names) {
            if (keyword.type == TokenType.GLOBAL) resolver.declareGlobal(n.lexeme);
            else resolver.declareVariable(n.lexeme);
        }
        endOfStatement();
        return new DeclarationStmt(keyword, names);
    }

    private Stmt commandStatement() {
        Token name = advance();
        List<String> words = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.NEWLINE) && !check(TokenType.SEMICOLON) && !check(TokenType.COMMA)) {
            Token w = advance();
            words.add(w.type == TokenType.STRING ? (String) w.literal : w.lexeme);
        }
        endOfStatement();
        return new CommandStmt(name, words);
    }

    // "hold on", "format long", "clear all": a name followed on the same line by a bare word
    private boolean isCommandSyntax() {
        Token name = peek();
        Token next = peekAt(1);
        if (resolver.isVariable(name.lexeme) || !next.spaceBefore) return false;
        switch (next.type) {
            case IDENTIFIER:
            case NUMBER:
            case STRING:
                break;
            default:
                return false;
        }
        Token after = peekAt(2);
        return after.type != TokenType.EQUAL && !(after.type == TokenType.LEFT_PAREN && !after.spaceBefore);
    }

    // "[a, b] = ..." as opposed to a matrix literal statement
    private boolean isMultiAssignment() {
        int depth = 0;
        for (int i = current; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type;
            switch (type) {
                case LEFT_BRACKET:
                case LEFT_PAREN:
                case LEFT_BRACE:
                    depth++;
                    break;
                case RIGHT_BRACKET:
                case RIGHT_PAREN:
                case RIGHT_BRACE:
                    depth--;
                    if (depth == 0) {
                        return i + 1 < tokens.size() && tokens.get(i + 1).type == TokenType.EQUAL;
                    }
                    break;
                case NEWLINE:
                case EOF:
                    return false;
                default:
                    break;
            }
        }
        return false;
    }

    private ScriptBlock block(TokenType... terminators) {
        Token first = peek();
        List<Stmt> statements = new ArrayList<>();
        while (true) {
            skipSeparators();
            if (isAtEnd() || checkAny(terminators)) break;
            Stmt stmt = statementSafely();
            if (stmt != null) statements.add(stmt);
        }
        return new ScriptBlock(statements, first.position);
    }

    private void closeBlock(Token keyword) {
        consume(TokenType.END, "Expect 'end' to close '" + keyword.lexeme + "' opened at " + keyword.position + ".");
        endOfStatement();
    }

    // Condition or case value. A broken header is reported without abandoning the block,
    // otherwise its 'end' would close the enclosing one.
    private ExprInterface header() {
        int groups = spaceSeparates.size();
        int subscripts = subscriptDepth;
        try {
            return expression();
        } catch (ParseError e) {
            record(e);
            while (spaceSeparates.size() > groups) spaceSeparates.pop();
            subscriptDepth = subscripts;
            synchronize();
            return null;
        }
    }

    private void checkTarget(ExprInterface target, Token equals) {
        if (target instanceof Identifier && !Assignment.isPlaceholder(target)) return;
        if (target instanceof IndexOrCall) {
            IndexOrCall node = (IndexOrCall) target;
            if (baseName(node) == null) throw error(equals, "Invalid assignment target.", "variable");
            resolver.forceIndex(node);
            return;
        }
        if ((target instanceof CellIndex || target instanceof FieldAccess) && baseName(target) != null) return;
        throw error(equals, "Invalid assignment target.", "variable");
    }

    /** Name at the root of x, x(i), x{i} or x.f chains; null for anything else. */
    private static String baseName(ExprInterface expr) {
        while (true) {
            if (expr instanceof Identifier) return ((Identifier) expr).name();
            if (expr instanceof IndexOrCall) expr = ((IndexOrCall) expr).target;
            else if (expr instanceof CellIndex) expr = ((CellIndex) expr).target;
            else if (expr instanceof FieldAccess) expr = ((FieldAccess) expr).target;
            else return null;
        }
    }

    private void endOfStatement() {
        if (match(TokenType.SEMICOLON, TokenType.COMMA, TokenType.NEWLINE)) return;
        if (isAtEnd()) return;
        throw error(peek(), "Expect end of statement.", "';', ',' or newline");
    }

    private void skipSeparators() {
        while (match(TokenType.NEWLINE, TokenType.SEMICOLON, TokenType.COMMA)) {
            // skip
        }
    }

    private void synchronize() {
        while (!isAtEnd()) {
            TokenType type = advance().type;
            if (type == TokenType.NEWLINE || type == TokenType.SEMICOLON) return;
        }
    }

    // -------------------------
    // Expressions
    // -------------------------

    private ExprInterface expression() { return range(); }

    private ExprInterface range() {
        ExprInterface expr = orOr();
        if (match(TokenType.COLON)) {
            ExprInterface second = orOr();
            if (match(TokenType.COLON)) {
                ExprInterface third = orOr();
                return new Range(expr, second, third);
            }
            return new Range(expr, null, second);
        }
        return expr;
    }

    private ExprInterface orOr() {
        ExprInterface expr = andAnd();
        while (match(TokenType.PIPE_PIPE)) {
            Token op = previous();
            expr = new Binary(expr, op, andAnd());
        }
        return expr;
    }

    private ExprInterface andAnd() {
        ExprInterface expr = elementOr();
        while (match(TokenType.AMP_AMP)) {
            Token op = previous();
            expr = new Binary(expr, op, elementOr());
        }
        return expr;
    }

    private ExprInterface elementOr() {
        ExprInterface expr = elementAnd();
        while (match(TokenType.PIPE)) {
            Token op = previous();
            expr = new Binary(expr, op, elementAnd());
        }
        return expr;
    }

    private ExprInterface elementAnd() {
        ExprInterface expr = comparison();
        while (match(TokenType.AMP)) {
            Token op = previous();
            expr = new Binary(expr, op, comparison());
        }
        return expr;
    }

    private ExprInterface comparison() {
        ExprInterface expr = additive();
        while (match(TokenType.EQUAL_EQUAL, TokenType.NOT_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL,
                TokenType.GREATER, TokenType.GREATER_EQUAL)) {
            Token op = previous();
            expr = new Binary(expr, op, additive());
        }
        return expr;
    }

    private ExprInterface additive() {
        ExprInterface expr = multiplicative();
        while ((check(TokenType.PLUS) || check(TokenType.MINUS)) && !startsNewElement()) {
            Token op = advance();
            expr = new Binary(expr, op, multiplicative());
        }
        return expr;
    }

    private ExprInterface multiplicative() {
        ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.BACKSLASH,
                TokenType.DOT_STAR, TokenType.DOT_SLASH, TokenType.DOT_BACKSLASH)) {
            Token op = previous();
            expr = new Binary(expr, op, unary());
        }
        return expr;
    }

    private ExprInterface unary() {
        if (match(TokenType.MINUS, TokenType.PLUS, TokenType.TILDE)) {
            Token op = previous();
            return new Unary(op, unary(), false);
        }
        return power();
    }

    // left associative: 2^3^2 is (2^3)^2
    private ExprInterface power() {
        ExprInterface expr = postfixExpression();
        while (match(TokenType.CARET, TokenType.DOT_CARET)) {
            Token op = previous();
            expr = new Binary(expr, op, powerOperand());
        }
        return expr;
    }

    // the exponent may carry its own sign: x^-1
    private ExprInterface powerOperand() {
        if (match(TokenType.MINUS, TokenType.PLUS, TokenType.TILDE)) {
            Token op = previous();
            return new Unary(op, powerOperand(), false);
        }
        return postfixExpression();
    }

    private ExprInterface postfixExpression() {
        ExprInterface expr = primary();
        while (true) {
            Token t = peek();
            boolean detached = inMatrix() && t.spaceBefore;
            if (t.type == TokenType.LEFT_PAREN && !detached) {
                advance();
                List<ExprInterface> args = subscripts(TokenType.RIGHT_PAREN);
                expr = callOrIndex(expr, args, previous());
            } else if (t.type == TokenType.LEFT_BRACE && !detached) {
                advance();
                List<ExprInterface> args = subscripts(TokenType.RIGHT_BRACE);
                expr = new CellIndex(expr, args, previous());
            } else if (t.type == TokenType.DOT && !detached) {
                advance();
                Token field = consume(TokenType.IDENTIFIER, "Expect field name after '.'.");
                expr = new FieldAccess(expr, field);
            } else if (t.type == TokenType.TRANSPOSE || t.type == TokenType.DOT_TRANSPOSE) {
                advance();
                expr = new Unary(t, expr, true);
            } else {
                return expr;
            }
        }
    }

    private ExprInterface callOrIndex(ExprInterface target, List<ExprInterface> args, Token close) {
        if (target instanceof Identifier) {
            Identifier id = (Identifier) target;
            if (resolver.isSolver(id.name())) return new SolverCall(id.name, args, close);
        }
        IndexOrCall node = new IndexOrCall(kinds.register(), target, args, close);
        resolver.resolve(node);
        return node;
    }

    private List<ExprInterface> subscripts(TokenType close) {
        spaceSeparates.push(false);
        subscriptDepth++;
        try {
            List<ExprInterface> args = new ArrayList<>();
            if (!check(close)) {
                do {
                    TokenType after = peekAt(1).type;
                    if (check(TokenType.COLON) && (after == TokenType.COMMA || after == close)) {
                        args.add(new Colon(advance()));
                    } else {
                        args.add(expression());
                    }
                } while (match(TokenType.COMMA));
            }
            consume(close, "Expect '" + spelling(close) + "' to close subscript.");
            return args;
        } finally {
            subscriptDepth--;
            spaceSeparates.pop();
        }
    }

    private ExprInterface primary() {
        Token t = peek();
        switch (t.type) {
            case NUMBER:
                advance();
                return new NumberLiteral(t);
            case STRING:
                advance();
                return new StringLiteral(t);
            case IDENTIFIER:
                advance();
                return new Identifier(t);
            case LEFT_PAREN:
                advance();
                spaceSeparates.push(false);
                try {
                    ExprInterface expr = expression();
                    consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
                    return expr;
                } finally {
                    spaceSeparates.pop();
                }
            case LEFT_BRACKET:
                advance();
                return matrix(t, TokenType.RIGHT_BRACKET, false);
            case LEFT_BRACE:
                advance();
                return matrix(t, TokenType.RIGHT_BRACE, true);
            case AT:
                advance();
                return functionHandle(t);
            case END:
                if (subscriptDepth > 0) {
                    advance();
                    return new EndIndex(t);
                }
                break;
            default:
                break;
        }
        throw error(t, "Expect expression.", "expression");
    }

    private ExprInterface functionHandle(Token at) {
        if (!match(TokenType.LEFT_PAREN)) {
            Token name = consume(TokenType.IDENTIFIER, "Expect function name after '@'.");
            return new FunctionHandle(at, name, Collections.emptyList(), null);
        }
        List<Token> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                params.add(consumeName("Expect parameter name."));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after anonymous function parameters.");
        resolver.enterScope("@anonymous");
        try {
            for (Token p : params) {
                if (p.type == TokenType.IDENTIFIER) resolver.declareVariable(p.lexeme);
            }
            ExprInterface body = expression();
            return new FunctionHandle(at, null, params, body);
        } finally {
            resolver.exitScope();
        }
    }

    private MatrixLiteral matrix(Token open, TokenType close, boolean cell) {
        List<List<ExprInterface>> rows = new ArrayList<>();
        spaceSeparates.push(true);
        try {
            skipRowSeparators();
            while (!check(close) && !isAtEnd()) {
                rows.add(matrixRow(close));
                if (!skipRowSeparators()) break;
            }
            Token end = consume(close, cell ? "Expect '}' to close cell array." : "Expect ']' to close matrix.");
            return new MatrixLiteral(rows, cell, open, end);
        } finally {
            spaceSeparates.pop();
        }
    }

    private List<ExprInterface> matrixRow(TokenType close) {
        List<ExprInterface> row = new ArrayList<>();
        row.add(expression());
        boolean commas = false;
        boolean spaces = false;
        while (true) {
            if (match(TokenType.COMMA)) {
                if (spaces) throw mixedSeparators(previous());
                commas = true;
                if (check(close) || check(TokenType.SEMICOLON) || check(TokenType.NEWLINE)) break;
                row.add(expression());
                continue;
            }
            if (check(close) || check(TokenType.SEMICOLON) || check(TokenType.NEWLINE) || isAtEnd()) break;
            Token next = peek();
            if (!next.spaceBefore) throw error(next, "Expect ',' or whitespace between matrix elements.", "','");
            if (commas) throw mixedSeparators(next);
            spaces = true;
            row.add(expression());
        }
        return row;
    }

    private boolean skipRowSeparators() {
        boolean any = false;
        while (match(TokenType.SEMICOLON, TokenType.NEWLINE)) any = true;
        return any;
    }

    private ParseError mixedSeparators(Token at) {
        return error(at, "Mixing ',' and whitespace as element separators in one matrix row is not supported.",
                "one separator style per row");
    }

    private boolean inMatrix() {
        Boolean top = spaceSeparates.peek();
        return top != null && top;
    }

    // "[a -b]" is two elements, "[a - b]" and "[a-b]" are one
    private boolean startsNewElement() {
        return inMatrix() && peek().spaceBefore && !peekAt(1).spaceBefore;
    }

    // -------------------------
    // Token helpers
    // -------------------------

    private Token consumeName(String message) {
        if (match(TokenType.IDENTIFIER, TokenType.TILDE)) return previous();
        throw error(peek(), message, "identifier");
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message, "'" + spelling(type) + "'");
    }

    private boolean check(TokenType type) {
        return peek().type == type;
    }

    private boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token peekAt(int offset) { return tokens.get(Math.min(current + offset, tokens.size() - 1)); }
    private Token previous() { return tokens.get(Math.max(current - 1, 0)); }

    private void record(ParseError e) {
        errors.add(e);
        Debug.get().w(TAG, e.describe());
    }

    private ParseError error(Token token, String message, String expected) {
        String found;
        switch (token.type) {
            case EOF: found = "end of input"; break;
            case NEWLINE: found = "newline"; break;
            default: found = token.lexeme; break;
        }
        return new ParseError(message + " Found '" + found + "'.", token.position, expected, found);
    }

    private static String spelling(TokenType type) {
        switch (type) {
            case LEFT_PAREN: return "(";
            case RIGHT_PAREN: return ")";
            case LEFT_BRACKET: return "[";
            case RIGHT_BRACKET: return "]";
            case LEFT_BRACE: return "{";
            case RIGHT_BRACE: return "}";
            case EQUAL: return "=";
            case END: return "end";
            case IDENTIFIER: return "identifier";
            default: return type.name().toLowerCase();
        }
    }
}
