import com.odebridge.symbolic.SymExpr;
import com.odebridge.symbolic.SymFormula;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.odebridge.symbolic.SymExpr.constant;
import static com.odebridge.symbolic.SymExpr.divide;
import static com.odebridge.symbolic.SymExpr.negate;
import static com.odebridge.symbolic.SymExpr.power;
import static com.odebridge.symbolic.SymExpr.product;
import static com.odebridge.symbolic.SymExpr.subtract;
import static com.odebridge.symbolic.SymExpr.sum;
import static com.odebridge.symbolic.SymExpr.variable;
import static org.junit.jupiter.api.Assertions.*;

public class OdeBridgeSymbolicTest {

    private static final SymExpr a = variable("a");
    private static final SymExpr b = variable("b");
    private static final SymExpr x = variable("x");
    private static final SymExpr y = variable("y");

    @Test
    void sums_foldConstants() {
        assertEquals("3 + x", sum(constant(1), constant(2), x).toString());
        assertEquals("x + y", sum(x, constant(2), y, constant(-2)).toString());
        assertTrue(sum(constant(2), constant(-2)).isZero());
        assertEquals("x - 1", sum(x, constant(-1)).toString());
        assertEquals(x, sum(x));
    }

    @Test
    void products_pullOutCoefficientAndSign() {
        assertEquals("-2*x", product(constant(-2), x).toString());
        assertEquals("6*x*y", product(constant(2), x, constant(3), y).toString());
        assertEquals("-Y_1*Y_3*k2", product(negate(variable("Y_1")), variable("Y_3"), variable("k2")).toString());
        assertTrue(product(x, constant(0)).isZero());
        assertEquals(x, product(negate(x), constant(-1)));
    }

    @Test
    void division_printsAsQuotientOrScaledProduct() {
        assertEquals("0.25*x", divide(x, constant(4)).toString());
        assertEquals("a/b", divide(a, b).toString());
        assertEquals("x^(-1)", power(x, constant(-1)).toString());
        assertEquals("a*(x + y)^2", product(a, power(sum(x, y), constant(2))).toString());
    }

    @Test
    void powers_simplify() {
        assertEquals(SymExpr.ONE, power(x, constant(0)));
        assertEquals(x, power(x, constant(1)));
        assertEquals("8", power(constant(2), constant(3)).toString());
        assertEquals(SymExpr.ONE, power(constant(1), x));
    }

    @Test
    void subtraction_andGrouping() {
        assertEquals("a - b*x", subtract(a, product(b, x)).toString());
        assertEquals("a - (x + y)", subtract(a, sum(x, y)).toString());
        assertEquals("(a + b)*x", product(sum(a, b), x).toString());
        assertEquals(x, negate(negate(x)));
    }

    @Test
    void functions_andTime() {
        SymExpr decay = SymExpr.function("exp", List.of(negate(product(variable("k"), SymExpr.time()))));
        assertEquals("exp(-k*time)", decay.toString());
        assertTrue(decay.containsTime());
        assertFalse(product(a, x).containsTime());
        assertEquals(List.of("k"), List.copyOf(decay.variables()));
    }

    @Test
    void numbers_printLikeFormulaLiterals() {
        assertEquals("5", SymFormula.number(5.0));
        assertEquals("-3", SymFormula.number(-3.0));
        assertEquals("0.5", SymFormula.number(0.5));
        assertEquals("Inf", SymFormula.number(Double.POSITIVE_INFINITY));
        assertEquals("NaN", SymFormula.number(Double.NaN));
    }

    @Test
    void equality_isStructural_andOrderSensitive() {
        assertEquals(product(a, b), product(a, b));
        assertEquals(product(a, b).hashCode(), product(a, b).hashCode());
        assertNotEquals(product(a, b), product(b, a));
        assertEquals(sum(product(a, x), b), sum(product(a, x), b));
    }

    @Test
    void substitution_renormalizes() {
        assertEquals(constant(5), sum(x, y).substitute(Map.of("x", constant(2), "y", constant(3))));
        assertEquals("-k*y", product(variable("k"), x).substitute(Map.of("x", negate(y))).toString());
        assertEquals("a + y", sum(a, x).substitute(Map.of("x", y)).toString());
        assertEquals(List.of("a", "x"), List.copyOf(product(a, sum(x, a)).variables()));
    }

    @Test
    void emptyNames_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> variable(""));
        assertThrows(IllegalArgumentException.class, () -> SymExpr.function(null, List.of()));
    }
}
