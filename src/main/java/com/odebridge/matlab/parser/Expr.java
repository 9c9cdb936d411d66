package com.odebridge.matlab.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Expression nodes of the MATLAB subset. Every node exclusively owns its children.
 */
public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);

        SourcePosition position();
    }

    public interface ExprVisitor<R> {
        R visitNumberExpr(NumberLiteral expr);
        R visitStringExpr(StringLiteral expr);
        R visitIdentifierExpr(Identifier expr);
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitMatrixExpr(MatrixLiteral expr);
        R visitRangeExpr(Range expr);
        R visitIndexOrCallExpr(IndexOrCall expr);
        R visitCellIndexExpr(CellIndex expr);
        R visitFieldExpr(FieldAccess expr);
        R visitSolverCallExpr(SolverCall expr);
        R visitFunctionHandleExpr(FunctionHandle expr);
        R visitColonExpr(Colon expr);
        R visitEndExpr(EndIndex expr);
    }

    // -------------------------
    // Literals and names
    // -------------------------

    public static final class NumberLiteral implements ExprInterface {
        public final double value;
        public final Token token;

        public NumberLiteral(Token token) {
            this.token = token;
            this.value = (Double) token.literal;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitNumberExpr(this); }

        @Override
        public SourcePosition position() { return token.position; }
    }

    public static final class StringLiteral implements ExprInterface {
        public final String value;
        public final Token token;

        public StringLiteral(Token token) {
            this.token = token;
            this.value = (String) token.literal;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitStringExpr(this); }

        @Override
        public SourcePosition position() { return token.position; }
    }

    public static final class Identifier implements ExprInterface {
        public final Token name;

        public Identifier(Token name) {
            this.name = name;
        }

        public String name() { return name.lexeme; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitIdentifierExpr(this); }

        @Override
        public SourcePosition position() { return name.position; }
    }

    // -------------------------
    // Operators
    // -------------------------

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitBinaryExpr(this); }

        @Override
        public SourcePosition position() { return SourcePosition.span(left.position(), right.position()); }
    }

    /** Prefix -, +, ~ or postfix transpose. */
    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface operand;
        public final boolean postfix;

        public Unary(Token operator, ExprInterface operand, boolean postfix) {
            this.operator = operator;
            this.operand = operand;
            this.postfix = postfix;
        }

        public boolean isTranspose() {
            return operator.type == TokenType.TRANSPOSE || operator.type == TokenType.DOT_TRANSPOSE;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitUnaryExpr(this); }

        @Override
        public SourcePosition position() {
            return postfix
                    ? SourcePosition.span(operand.position(), operator.position)
                    : SourcePosition.span(operator.position, operand.position());
        }
    }

    /** Bracketed matrix "[...]" or cell array "{...}" literal, row major. */
    public static final class MatrixLiteral implements ExprInterface {
        public final List<List<ExprInterface>> rows;
        public final boolean cell;
        public final Token open;
        public final Token close;

        public MatrixLiteral(List<List<ExprInterface>> rows, boolean cell, Token open, Token close) {
            this.rows = rows;
            this.cell = cell;
            this.open = open;
            this.close = close;
        }

        public int elementCount() {
            int n = 0;
            for (List<ExprInterface> row : rows) n += row.size();
            return n;
        }

        /** True for a single row or a single column. */
        public boolean isVector() {
            if (rows.size() <= 1) return true;
            for (List<ExprInterface> row : rows) {
                if (row.size() != 1) return false;
            }
            return true;
        }

        /** Elements in row-major order. */
        public List<ExprInterface> elements() {
            List<ExprInterface> out = new ArrayList<>();
            for (List<ExprInterface> row : rows) out.addAll(row);
            return out;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitMatrixExpr(this); }

        @Override
        public SourcePosition position() { return SourcePosition.span(open.position, close.position); }
    }

    /** start:stop or start:step:stop. */
    public static final class Range implements ExprInterface {
        public final ExprInterface start;
        public final ExprInterface step; // may be null
        public final ExprInterface stop;

        public Range(ExprInterface start, ExprInterface step, ExprInterface stop) {
            this.start = start;
            this.step = step;
            this.stop = stop;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitRangeExpr(this); }

        @Override
        public SourcePosition position() { return SourcePosition.span(start.position(), stop.position()); }
    }

    // -------------------------
    // Postfix forms
    // -------------------------

    /**
     * name(args): a function call or an array reference, which MATLAB spells the same way.
     * Which one it is gets decided by the {@link KindResolver} and recorded in the
     * script's {@link KindTable} under {@link #nodeId}.
     */
    public static final class IndexOrCall implements ExprInterface {
        public final int nodeId;
        public final ExprInterface target;
        public final List<ExprInterface> args;
        public final Token close;

        public IndexOrCall(int nodeId, ExprInterface target, List<ExprInterface> args, Token close) {
            this.nodeId = nodeId;
            this.target = target;
            this.args = Collections.unmodifiableList(args);
            this.close = close;
        }

        /** Name of the called function or indexed array, or null when the target is not a plain name. */
        public String name() {
            return (target instanceof Identifier) ? ((Identifier) target).name() : null;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitIndexOrCallExpr(this); }

        @Override
        public SourcePosition position() { return SourcePosition.span(target.position(), close.position); }
    }

    /** c{args}: always an indexing operation. */
    public static final class CellIndex implements ExprInterface {
        public final ExprInterface target;
        public final List<ExprInterface> args;
        public final Token close;

        public CellIndex(ExprInterface target, List<ExprInterface> args, Token close) {
            this.target = target;
            this.args = Collections.unmodifiableList(args);
            this.close = close;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitCellIndexExpr(this); }

        @Override
        public SourcePosition position() { return SourcePosition.span(target.position(), close.position); }
    }

    public static final class FieldAccess implements ExprInterface {
        public final ExprInterface target;
        public final Token field;

        public FieldAccess(ExprInterface target, Token field) {
            this.target = target;
            this.field = field;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitFieldExpr(this); }

        @Override
        public SourcePosition position() { return SourcePosition.span(target.position(), field.position); }
    }

    /** A call of a registered ODE solver, e.g. ode45(@f, tspan, y0). */
    public static final class SolverCall implements ExprInterface {
        public final Token solver;
        public final List<ExprInterface> args;
        public final Token close;

        public SolverCall(Token solver, List<ExprInterface> args, Token close) {
            this.solver = solver;
            this.args = Collections.unmodifiableList(args);
            this.close = close;
        }

        public String name() { return solver.lexeme; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitSolverCallExpr(this); }

        @Override
        public SourcePosition position() { return SourcePosition.span(solver.position, close.position); }
    }

    /** @name or @(params) body. */
    public static final class FunctionHandle implements ExprInterface {
        public final Token at;
        public final Token name;          // null for anonymous handles
        public final List<Token> params;  // empty for named handles
        public final ExprInterface body;  // null for named handles

        public FunctionHandle(Token at, Token name, List<Token> params, ExprInterface body) {
            this.at = at;
            this.name = name;
            this.params = Collections.unmodifiableList(params);
            this.body = body;
        }

        public boolean isAnonymous() { return name == null; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitFunctionHandleExpr(this); }

        @Override
        public SourcePosition position() {
            return SourcePosition.span(at.position, isAnonymous() ? body.position() : name.position);
        }
    }

    /** Bare ':' used as a subscript ("all elements"). */
    public static final class Colon implements ExprInterface {
        public final Token token;

        public Colon(Token token) { this.token = token; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitColonExpr(this); }

        @Override
        public SourcePosition position() { return token.position; }
    }

    /** 'end' used inside a subscript. */
    public static final class EndIndex implements ExprInterface {
        public final Token token;

        public EndIndex(Token token) { this.token = token; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitEndExpr(this); }

        @Override
        public SourcePosition position() { return token.position; }
    }
}
