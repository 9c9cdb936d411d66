package com.odebridge.extract;

import java.util.ArrayList;
import java.util.List;

import com.odebridge.matlab.MatlabBuiltins;
import com.odebridge.matlab.MatlabBuiltins.MathFunction;
import com.odebridge.matlab.parser.CallKind;
import com.odebridge.matlab.parser.Expr.Binary;
import com.odebridge.matlab.parser.Expr.CellIndex;
import com.odebridge.matlab.parser.Expr.Colon;
import com.odebridge.matlab.parser.Expr.EndIndex;
import com.odebridge.matlab.parser.Expr.ExprInterface;
import com.odebridge.matlab.parser.Expr.ExprVisitor;
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
import com.odebridge.matlab.parser.KindTable;
import com.odebridge.matlab.parser.SourcePosition;
import com.odebridge.symbolic.SymExpr;

/**
 * Turns arithmetic syntax into {@link SymExpr}. What a name means is delegated to a
 * {@link Names} lookup, so the same lowering serves the ODE function body and the
 * parameter assignments around the solver call.
 *
 * Anything that is not arithmetic over scalars (strings, ranges, comparisons, cells,
 * fields, unknown calls) raises {@link ExtractionError}.
 */
public final class ExpressionLowering implements ExprVisitor<SymExpr> {

    /** Meaning of names in the code being lowered. */
    public interface Names {
        /** Expression a scalar name stands for, or null when the name is unknown here. */
        SymExpr scalar(String name, SourcePosition at);

        /** Elements of a vector-valued name, or null when the name is not a known vector. */
        List<SymExpr> vector(String name, SourcePosition at);
    }

    private final MatlabBuiltins builtins;
    private final KindTable kinds;
    private final Names names;

    public ExpressionLowering(MatlabBuiltins builtins, KindTable kinds, Names names) {
        this.builtins = builtins;
        this.kinds = kinds;
        this.names = names;
    }

    public SymExpr lower(ExprInterface expr) {
        return expr.accept(this);
    }

    /**
     * Elements of a vector-valued expression: a row or column literal (nested literals
     * are concatenated), a vector name, v' or v(:). Returns null for anything else.
     */
    public List<SymExpr> lowerVector(ExprInterface expr) {
        return lowerVector(expr, null);
    }

    /**
     * Like {@link #lowerVector(ExprInterface)}, but when errors is not null an element
     * that fails to lower is recorded there and stands as 0, so every element gets checked.
     */
    public List<SymExpr> lowerVector(ExprInterface expr, List<ExtractionError> errors) {
        if (expr instanceof MatrixLiteral) {
            MatrixLiteral m = (MatrixLiteral) expr;
            if (m.cell || !m.isVector()) return null;
            List<SymExpr> out = new ArrayList<>();
            for (ExprInterface element : m.elements()) {
                List<SymExpr> nested = (element instanceof MatrixLiteral) ? lowerVector(element, errors) : null;
                if (nested != null) {
                    out.addAll(nested);
                } else if (errors == null) {
                    out.add(lower(element));
                } else {
                    try {
                        out.add(lower(element));
                    } catch (ExtractionError e) {
                        errors.add(e);
                        out.add(SymExpr.ZERO);
                    }
                }
            }
            return out;
        }
        if (expr instanceof Unary && ((Unary) expr).isTranspose()) {
            return lowerVector(((Unary) expr).operand, errors);
        }
        if (expr instanceof Identifier) {
            Identifier id = (Identifier) expr;
            return names.vector(id.name(), id.position());
        }
        if (expr instanceof IndexOrCall) {
            IndexOrCall node = (IndexOrCall) expr;
            if (node.name() != null && node.args.size() == 1 && node.args.get(0) instanceof Colon) {
                return names.vector(node.name(), node.position());
            }
        }
        return null;
    }

    /** Integer value of a constant subscript such as the 2 in y(2). */
    public int constantIndex(ExprInterface expr) {
        SymExpr value = lower(expr);
        Double c = value.constantValue();
        if (c == null || c != Math.rint(c) || c < 1) {
            throw new ExtractionError("Subscript must be a positive integer constant, got '" + value + "'",
                    expr.position());
        }
        return c.intValue();
    }

    @Override
    public SymExpr visitNumberExpr(NumberLiteral expr) {
        return SymExpr.constant(expr.value);
    }

    @Override
    public SymExpr visitStringExpr(StringLiteral expr) {
        throw unsupported(expr, "a string");
    }

    @Override
    public SymExpr visitIdentifierExpr(Identifier expr) {
        String name = expr.name();
        SymExpr bound = names.scalar(name, expr.position());
        if (bound != null) return bound;
        Double constant = builtins.constant(name);
        if (constant != null) return SymExpr.constant(constant);
        if (names.vector(name, expr.position()) != null) {
            throw new ExtractionError("Vector '" + name + "' used where a scalar is required", expr.position(), name);
        }
        throw ExtractionError.unbound(name, expr.position());
    }

    @Override
    public SymExpr visitBinaryExpr(Binary expr) {
        SymExpr left = lower(expr.left);
        SymExpr right = lower(expr.right);
        switch (expr.operator.type) {
            case PLUS:
                return SymExpr.sum(left, right);
            case MINUS:
                return SymExpr.subtract(left, right);
            case STAR:
            case DOT_STAR:
                return SymExpr.product(left, right);
            case SLASH:
            case DOT_SLASH:
                return SymExpr.divide(left, right);
            case BACKSLASH:
            case DOT_BACKSLASH:
                return SymExpr.divide(right, left);
            case CARET:
            case DOT_CARET:
                return SymExpr.power(left, right);
            default:
                throw unsupported(expr, "operator '" + expr.operator.lexeme + "'");
        }
    }

    @Override
    public SymExpr visitUnaryExpr(Unary expr) {
        if (expr.isTranspose()) return lower(expr.operand); // scalars are their own transpose
        switch (expr.operator.type) {
            case MINUS:
                return SymExpr.negate(lower(expr.operand));
            case PLUS:
                return lower(expr.operand);
            default:
                throw unsupported(expr, "operator '" + expr.operator.lexeme + "'");
        }
    }

    @Override
    public SymExpr visitMatrixExpr(MatrixLiteral expr) {
        if (!expr.cell && expr.elementCount() == 1) return lower(expr.elements().get(0));
        throw unsupported(expr, "a matrix where a scalar is required");
    }

    @Override
    public SymExpr visitRangeExpr(Range expr) {
        throw unsupported(expr, "a range");
    }

    @Override
    public SymExpr visitIndexOrCallExpr(IndexOrCall expr) {
        String name = expr.name();
        if (name == null) throw unsupported(expr, "indexing of a computed value");

        List<SymExpr> vector = names.vector(name, expr.position());
        if (vector != null) return element(expr, name, vector);

        if (kinds.kindOf(expr) == CallKind.CALL) {
            MathFunction fn = builtins.math(name);
            if (fn == null) throw unsupported(expr, "a call of '" + name + "'");
            return apply(expr, fn);
        }

        // x(1) on a scalar
        SymExpr scalar = names.scalar(name, expr.position());
        if (scalar == null) throw ExtractionError.unbound(name, expr.position());
        List<SymExpr> single = new ArrayList<>();
        single.add(scalar);
        return element(expr, name, single);
    }

    private SymExpr element(IndexOrCall expr, String name, List<SymExpr> vector) {
        int index;
        if (expr.args.size() == 1) {
            ExprInterface arg = expr.args.get(0);
            index = (arg instanceof EndIndex) ? vector.size() : constantIndex(arg);
        } else if (expr.args.size() == 2) {
            // v(i, 1) or v(1, i)
            int a = constantIndex(expr.args.get(0));
            int b = constantIndex(expr.args.get(1));
            if (a != 1 && b != 1) throw unsupported(expr, "two-dimensional indexing");
            index = (a == 1) ? b : a;
        } else {
            throw unsupported(expr, "indexing with " + expr.args.size() + " subscripts");
        }
        if (index > vector.size()) {
            throw new ExtractionError("Index " + index + " exceeds the " + vector.size() + " element(s) of '" + name + "'",
                    expr.position(), name);
        }
        return vector.get(index - 1);
    }

    private SymExpr apply(IndexOrCall expr, MathFunction fn) {
        if (expr.args.size() != fn.arity) {
            throw new ExtractionError(fn.name + " expects " + fn.arity + " argument(s), got " + expr.args.size(),
                    expr.position(), fn.name);
        }
        List<SymExpr> args = new ArrayList<>(expr.args.size());
        boolean allConstant = true;
        for (ExprInterface a : expr.args) {
            SymExpr lowered = lower(a);
            allConstant &= lowered.isConstant();
            args.add(lowered);
        }
        if (allConstant) {
            double[] values = new double[args.size()];
            for (int i = 0; i < values.length; i++) values[i] = args.get(i).value();
            return SymExpr.constant(fn.apply(values));
        }
        // power(a, b) is just a^b
        if (fn.name.equals("power")) return SymExpr.power(args.get(0), args.get(1));
        return SymExpr.function(fn.name, args);
    }

    @Override
    public SymExpr visitCellIndexExpr(CellIndex expr) {
        throw unsupported(expr, "cell indexing");
    }

    @Override
    public SymExpr visitFieldExpr(FieldAccess expr) {
        throw unsupported(expr, "field access");
    }

    @Override
    public SymExpr visitSolverCallExpr(SolverCall expr) {
        throw unsupported(expr, "a solver call");
    }

    @Override
    public SymExpr visitFunctionHandleExpr(FunctionHandle expr) {
        throw unsupported(expr, "a function handle");
    }

    @Override
    public SymExpr visitColonExpr(Colon expr) {
        throw unsupported(expr, "':'");
    }

    @Override
    public SymExpr visitEndExpr(EndIndex expr) {
        throw unsupported(expr, "'end'");
    }

    private static ExtractionError unsupported(ExprInterface expr, String what) {
        return new ExtractionError("Cannot use " + what + " in a model expression", expr.position());
    }
}
