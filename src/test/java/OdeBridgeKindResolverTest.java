import com.odebridge.matlab.parser.CallKind;
import com.odebridge.matlab.parser.Expr.Binary;
import com.odebridge.matlab.parser.Expr.IndexOrCall;
import com.odebridge.matlab.parser.Lexer;
import com.odebridge.matlab.parser.ParsedScript;
import com.odebridge.matlab.parser.Parser;
import com.odebridge.matlab.parser.Statement.Assignment;
import com.odebridge.matlab.parser.Statement.ScriptBlock;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class OdeBridgeKindResolverTest {

    private static ParsedScript parse(String src) {
        ParsedScript script = new Parser(new Lexer("test.m", src).tokenize()).parse();
        assertFalse(script.hasErrors(), () -> "unexpected errors: " + script.errors());
        return script;
    }

    private static Assignment assignment(ScriptBlock block, int i) {
        return (Assignment) block.statements.get(i);
    }

    private static IndexOrCall value(ScriptBlock block, int i) {
        return (IndexOrCall) assignment(block, i).value;
    }

    @Test
    void builtins_areCalls() {
        ParsedScript script = parse("y = exp(x);\nz = sin(2);");
        assertEquals(CallKind.CALL, script.kindOf(value(script.root, 0)));
        assertEquals(CallKind.CALL, script.kindOf(value(script.root, 1)));
    }

    @Test
    void knownVariables_areIndexed() {
        ParsedScript script = parse("v = [1 2 3];\nw = v(2);");
        assertEquals(CallKind.INDEX, script.kindOf(value(script.root, 1)));
    }

    @Test
    void laterPlainAssignment_reclassifiesEarlierUse() {
        ParsedScript script = parse("w = q(2);\nq = 5;\nu = helper(2);");
        assertEquals(CallKind.INDEX, script.kindOf(value(script.root, 0)));
        assertEquals(CallKind.CALL, script.kindOf(value(script.root, 2)));
    }

    @Test
    void indexedAssignment_doesNotReclassify() {
        ParsedScript script = parse("w = q(2);\nq(1) = 5;");
        assertEquals(CallKind.CALL, script.kindOf(value(script.root, 0)));
    }

    @Test
    void assignmentTargets_areIndexed() {
        ParsedScript script = parse("z(3) = 1;");
        IndexOrCall target = (IndexOrCall) assignment(script.root, 0).targets.get(0);
        assertEquals(CallKind.INDEX, script.kindOf(target));
    }

    @Test
    void colonAndEndSubscripts_forceIndex() {
        ParsedScript script = parse("b = a(:, 1);\nc = d(end);");
        assertEquals(CallKind.INDEX, script.kindOf(value(script.root, 0)));
        assertEquals(CallKind.INDEX, script.kindOf(value(script.root, 1)));
    }

    @Test
    void functionParameters_andDefinedFunctions() {
        ParsedScript script = parse(String.join("\n",
            "function r = g(x)",
            "  r = 2*x;",
            "end",
            "function dy = f(t, y)",
            "  dy = y(1) + g(2);",
            "end",
            "u = g(3);",
            ""));
        Binary sum = (Binary) assignment(script.function("f").body, 0).value;
        assertEquals(CallKind.INDEX, script.kindOf((IndexOrCall) sum.left));
        assertEquals(CallKind.CALL, script.kindOf((IndexOrCall) sum.right));
        assertEquals(CallKind.CALL, script.kindOf(value(script.root, 2)));
    }

    @Test
    void pendingNames_stayCalls_whenScopeCloses() {
        ParsedScript script = parse(String.join("\n",
            "function dy = f(t, y)",
            "  dy = helper(y);",
            "end",
            "helper = 3;",
            ""));
        assertEquals(CallKind.CALL, script.kindOf(value(script.function("f").body, 0)));
    }

    @Test
    void everyNode_isResolved_andRepeatable() {
        String src = String.join("\n",
            "k = [1 2];",
            "a = k(1) + f(2) + g(3);",
            "g = 4;",
            "[t, y] = ode45(@rhs, [0 1], k(2));",
            "function dy = rhs(t, y)",
            "  dy = -k(1) * y(1) + exp(y(1));",
            "end",
            "");
        ParsedScript first = parse(src);
        ParsedScript second = parse(src);
        assertTrue(first.kinds().isComplete());
        assertTrue(first.kinds().size() > 0);
        assertEquals(first.kinds().snapshot(), second.kinds().snapshot());
        assertFalse(first.kinds().snapshot().contains(CallKind.UNKNOWN));
    }
}
