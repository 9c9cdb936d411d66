package com.odebridge.matlab.parser;

import java.util.Collections;
import java.util.List;

import com.odebridge.matlab.parser.Expr.ExprInterface;
import com.odebridge.matlab.parser.Expr.Identifier;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);

        SourcePosition position();
    }

    public interface StmtVisitor {
        void visitExprStmt(ExprStmt stmt);
        void visitAssignment(Assignment stmt);
        void visitFunctionDef(FunctionDef stmt);
        void visitScriptBlock(ScriptBlock stmt);
        void visitControlStmt(ControlStmt stmt);
        void visitCommandStmt(CommandStmt stmt);
        void visitShellStmt(ShellStmt stmt);
        void visitDeclarationStmt(DeclarationStmt stmt);
        void visitKeywordStmt(KeywordStmt stmt);
    }

    /** A sequence of statements: the whole script, a function body or a control-clause body. */
    public static final class ScriptBlock implements Stmt {
        public final List<Stmt> statements;
        private final SourcePosition position;

        public ScriptBlock(List<Stmt> statements, SourcePosition position) {
            this.statements = Collections.unmodifiableList(statements);
            this.position = position;
        }

        public void accept(StmtVisitor visitor) { visitor.visitScriptBlock(this); }

        public SourcePosition position() { return position; }
    }

    public static final class ExprStmt implements Stmt {
        public final ExprInterface expression;

        ExprStmt(ExprInterface expression) { this.expression = expression; }

        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }

        public SourcePosition position() { return expression.position(); }
    }

    /**
     * target = value, x(i) = value, s.f = value or [a, ~, b] = value.
     * A '~' placeholder in a multi-output target list is an Identifier whose token is TILDE.
     */
    public static final class Assignment implements Stmt {
        public final List<ExprInterface> targets;
        public final boolean multiple;
        public final Token equals;
        public final ExprInterface value;

        Assignment(List<ExprInterface> targets, boolean multiple, Token equals, ExprInterface value) {
            this.targets = Collections.unmodifiableList(targets);
            this.multiple = multiple;
            this.equals = equals;
            this.value = value;
        }

        /** True for "name = value". */
        public boolean isPlain() {
            return !multiple && targets.size() == 1 && targets.get(0) instanceof Identifier;
        }

        /** Name assigned by a plain assignment, else null. */
        public String plainName() {
            return isPlain() ? ((Identifier) targets.get(0)).name() : null;
        }

        public static boolean isPlaceholder(ExprInterface target) {
            return target instanceof Identifier && ((Identifier) target).name.type == TokenType.TILDE;
        }

        public void accept(StmtVisitor visitor) { visitor.visitAssignment(this); }

        public SourcePosition position() {
            return SourcePosition.span(targets.get(0).position(), value.position());
        }
    }

    /** function [outputs] = name(params) ... end */
    public static final class FunctionDef implements Stmt {
        public final Token keyword;
        public final Token name;
        public final List<Token> outputs;
        public final List<Token> params; // may contain '~' placeholders
        public final ScriptBlock body;

        FunctionDef(Token keyword, Token name, List<Token> outputs, List<Token> params, ScriptBlock body) {
            this.keyword = keyword;
            this.name = name;
            this.outputs = Collections.unmodifiableList(outputs);
            this.params = Collections.unmodifiableList(params);
            this.body = body;
        }

        public String name() { return name.lexeme; }

        public void accept(StmtVisitor visitor) { visitor.visitFunctionDef(this); }

        public SourcePosition position() { return SourcePosition.span(keyword.position, name.position); }
    }

    /**
     * if/elseif/else, for, parfor, while, switch/case/otherwise and try/catch.
     * Retained in the tree but never interpreted.
     */
    public static final class ControlStmt implements Stmt {
        public final Token keyword;
        public final List<Clause> clauses;

        ControlStmt(Token keyword, List<Clause> clauses) {
            this.keyword = keyword;
            this.clauses = Collections.unmodifiableList(clauses);
        }

        public void accept(StmtVisitor visitor) { visitor.visitControlStmt(this); }

        public SourcePosition position() { return keyword.position; }
    }

    public static final class Clause {
        public final Token keyword;
        public final Token variable;       // loop variable or catch identifier, may be null
        public final ExprInterface header; // condition, loop range or case value, may be null
        public final ScriptBlock body;

        Clause(Token keyword, Token variable, ExprInterface header, ScriptBlock body) {
            this.keyword = keyword;
            this.variable = variable;
            this.header = header;
            this.body = body;
        }
    }

    /** Command syntax: "hold on", "clear all", "format long". */
    public static final class CommandStmt implements Stmt {
        public final Token name;
        public final List<String> words;

        CommandStmt(Token name, List<String> words) {
            this.name = name;
            this.words = Collections.unmodifiableList(words);
        }

        public void accept(StmtVisitor visitor) { visitor.visitCommandStmt(this); }

        public SourcePosition position() { return name.position; }
    }

    public static final class ShellStmt implements Stmt {
        public final Token command;

        ShellStmt(Token command) { this.command = command; }

        public void accept(StmtVisitor visitor) { visitor.visitShellStmt(this); }

        public SourcePosition position() { return command.position; }
    }

    /** global / persistent declarations. */
    public static final class DeclarationStmt implements Stmt {
        public final Token keyword;
        public final List<Token> names;

        DeclarationStmt(Token keyword, List<Token> names) {
            this.keyword = keyword;
            this.names = Collections.unmodifiableList(names);
        }

        public boolean isGlobal() { return keyword.type == TokenType.GLOBAL; }

        public void accept(StmtVisitor visitor) { visitor.visitDeclarationStmt(this); }

        public SourcePosition position() { return keyword.position; }
    }

    /** return, break, continue. */
    public static final class KeywordStmt implements Stmt {
        public final Token keyword;

        KeywordStmt(Token keyword) { this.keyword = keyword; }

        public void accept(StmtVisitor visitor) { visitor.visitKeywordStmt(this); }

        public SourcePosition position() { return keyword.position; }
    }
}
