package com.odebridge.symbolic;

import java.util.List;

/**
 * Infix rendering of {@link SymExpr}: "a - b*x1", "k*x^2", "exp(-k*time)".
 * Parentheses appear only where precedence needs them. The time symbol prints as "time".
 */
public final class SymFormula {

    private static final int SUM = 1;
    private static final int NEGATION = 2;
    private static final int PRODUCT = 3;
    private static final int POWER = 4;
    private static final int ATOM = 5;

    public static final String TIME_SYMBOL = "time";

    private SymFormula() {}

    public static String format(SymExpr expr) {
        StringBuilder sb = new StringBuilder();
        write(sb, expr);
        return sb.toString();
    }

    /** Renders a number the way it would be written in a formula: "5", "0.25", "1.0E-6", "Inf". */
    public static String number(double v) {
        if (Double.isNaN(v)) return "NaN";
        if (Double.isInfinite(v)) return (v > 0) ? "Inf" : "-Inf";
        if (v == Math.rint(v) && Math.abs(v) < 1e15) return Long.toString((long) v);
        return Double.toString(v);
    }

    private static void write(StringBuilder sb, SymExpr e) {
        switch (e.kind()) {
            case CONSTANT:
                sb.append(number(e.value()));
                break;
            case VARIABLE:
                sb.append(e.name());
                break;
            case TIME:
                sb.append(TIME_SYMBOL);
                break;
            case SUM:
                writeSum(sb, e.args());
                break;
            case PRODUCT:
                writeProduct(sb, e.args());
                break;
            case POWER:
                writeOperand(sb, e.base(), ATOM);
                sb.append('^');
                writeOperand(sb, e.exponent(), ATOM);
                break;
            case NEGATION:
                sb.append('-');
                writeOperand(sb, e.operand(), PRODUCT);
                break;
            case FUNCTION:
                sb.append(e.name()).append('(');
                for (int i = 0; i < e.args().size(); i++) {
                    if (i > 0) sb.append(", ");
                    write(sb, e.args().get(i));
                }
                sb.append(')');
                break;
            default:
                throw new IllegalStateException("unhandled kind " + e.kind());
        }
    }

    private static void writeSum(StringBuilder sb, List<SymExpr> operands) {
        for (int i = 0; i < operands.size(); i++) {
            SymExpr op = operands.get(i);
            if (i == 0) {
                write(sb, op);
            } else if (op.kind() == SymExpr.Kind.NEGATION) {
                sb.append(" - ");
                writeOperand(sb, op.operand(), NEGATION + 1);
            } else if (op.isConstant() && op.value() < 0) {
                sb.append(" - ").append(number(-op.value()));
            } else {
                sb.append(" + ");
                write(sb, op);
            }
        }
    }

    private static void writeProduct(StringBuilder sb, List<SymExpr> operands) {
        for (int i = 0; i < operands.size(); i++) {
            SymExpr op = operands.get(i);
            boolean reciprocal = op.kind() == SymExpr.Kind.POWER
                    && op.exponent().isConstant() && op.exponent().value() == -1.0;
            if (reciprocal) {
                sb.append(i == 0 ? "1/" : "/");
                writeOperand(sb, op.base(), POWER);
                continue;
            }
            if (i > 0) sb.append('*');
            writeOperand(sb, op, PRODUCT);
        }
    }

    private static void writeOperand(StringBuilder sb, SymExpr e, int minLevel) {
        boolean parens = level(e) < minLevel;
        if (parens) sb.append('(');
        write(sb, e);
        if (parens) sb.append(')');
    }

    private static int level(SymExpr e) {
        switch (e.kind()) {
            case SUM: return SUM;
            case NEGATION: return NEGATION;
            case PRODUCT: return PRODUCT;
            case POWER: return POWER;
            case CONSTANT: return (e.value() < 0) ? NEGATION : ATOM;
            default: return ATOM;
        }
    }
}
