import com.odebridge.ConversionError;
import com.odebridge.Diagnostic;
import com.odebridge.extract.ExtractionError;
import com.odebridge.extract.ModelExtractor;
import com.odebridge.extract.OdeSystem;
import com.odebridge.extract.ParameterBinding;
import com.odebridge.matlab.MatlabBuiltins;
import com.odebridge.matlab.parser.Lexer;
import com.odebridge.matlab.parser.ParsedScript;
import com.odebridge.matlab.parser.Parser;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OdeBridgeExtractorTest {

    static final String CYCLIC = String.join("\n",
        "k1 = 1;",
        "k2 = 5;",
        "k3 = 6;",
        "y0 = [1 0 0];",
        "[t, Y] = ode45(@cyclic, [0 10], y0);",
        "",
        "function dY = cyclic(t, Y)",
        "  dY = zeros(3, 1);",
        "  dY(1) = Y(2)*Y(3)*k1;",
        "  dY(2) = -Y(1)*Y(3)*k2;",
        "  dY(3) = Y(1)*Y(2)*k3;",
        "end",
        "");

    static final String TWO_POOLS = String.join("\n",
        "a = 1; b = 0.5; c = 0.3; d = 0.2;",
        "x0 = [0; 0];",
        "[t, x] = ode45(@rhs, [0 20], x0);",
        "function dx = rhs(t, x)",
        "  x1 = x(1);",
        "  x2 = x(2);",
        "  dx = [a - b*x1; c*x1 - d*x2];",
        "end",
        "");

    private static OdeSystem extract(String src, boolean strict) {
        ParsedScript script = new Parser(new Lexer("model.m", src).tokenize()).parse();
        assertFalse(script.hasErrors(), () -> "unexpected errors: " + script.errors());
        return new ModelExtractor(MatlabBuiltins.standard(), strict).extract(script);
    }

    private static OdeSystem extract(String src) {
        return extract(src, true);
    }

    private static ExtractionError failure(String src, boolean strict) {
        return assertThrows(ExtractionError.class, () -> extract(src, strict));
    }

    private static List<String> codes(OdeSystem system) {
        List<String> out = new ArrayList<>();
        for (Diagnostic d : system.diagnostics()) out.add(d.code);
        return out;
    }

    private static String rhs(String body) {
        return "k = 2;\n[t, y] = ode45(@f, [0 1], 1);\nfunction dy = f(t, y)\n" + body + "\nend\n";
    }

    @Test
    void cyclicScript_extractsThreeStates() {
        OdeSystem system = extract(CYCLIC);
        assertEquals(List.of("Y_1", "Y_2", "Y_3"), system.states());
        assertEquals("ode45", system.solver);
        assertEquals("cyclic", system.functionName);
        assertEquals("Y_2*Y_3*k1", system.derivative("Y_1").toString());
        assertEquals("-Y_1*Y_3*k2", system.derivative("Y_2").toString());
        assertEquals("Y_1*Y_2*k3", system.derivative("Y_3").toString());
        assertEquals(List.of("k1", "k2", "k3"), new ArrayList<>(system.parameters().keySet()));
        assertEquals(5.0, system.parameter("k2").value.value());
        assertEquals(1.0, system.initialValue("Y_1").value());
        assertTrue(system.initialValue("Y_3").isZero());
        assertTrue(system.diagnostics().isEmpty(), () -> system.diagnostics().toString());
    }

    @Test
    void stateAliases_nameTheStates() {
        OdeSystem system = extract(TWO_POOLS);
        assertEquals(List.of("x1", "x2"), system.states());
        assertEquals("a - b*x1", system.derivative("x1").toString());
        assertEquals("c*x1 - d*x2", system.derivative("x2").toString());
        assertEquals(List.of("a", "b", "c", "d"), new ArrayList<>(system.parameters().keySet()));
        assertEquals(0.5, system.parameter("b").value.value());
    }

    @Test
    void missingSolverCall_fails() {
        ExtractionError e = failure("x = 1;\ny = x + 2;\n", true);
        assertTrue(e.getMessage().contains("No call of an ODE solver"), e.getMessage());
        assertNull(e.position());
    }

    @Test
    void solverCall_hiddenInControlFlow() {
        ExtractionError e = failure("if 1\n  [t, y] = ode45(@f, [0 1], 1);\nend\n", true);
        assertTrue(e.getMessage().contains("outside of control-flow"), e.getMessage());
    }

    @Test
    void unboundIdentifier_isNamed() {
        ExtractionError e = failure(rhs("  dy = -q*y;"), true);
        assertEquals("q", e.identifier());
        assertNotNull(e.position());
        assertEquals(4, e.position().line);
    }

    private static List<String> identifiers(ExtractionError e) {
        List<String> out = new ArrayList<>();
        for (ConversionError c : e.errors()) out.add(((ExtractionError) c).identifier());
        return out;
    }

    @Test
    void unboundIdentifiers_inVectorLiteral_allReported() {
        String src = "[t, y] = ode45(@f, [0 1], [1 2]);\nfunction dy = f(t, y)\n  dy = [-a*y(1); -b*y(2)];\nend\n";
        ExtractionError e = failure(src, true);
        assertEquals(List.of("a", "b"), identifiers(e));
    }

    @Test
    void unboundIdentifiers_acrossStatements_allReported() {
        String src = String.join("\n",
            "[t, y] = ode45(@f, [0 1], [1 2]);",
            "function dy = f(t, y)",
            "  dy = zeros(2, 1);",
            "  dy(1) = -a*y(1);",
            "  dy(2) = -b*y(2);",
            "end",
            "");
        ExtractionError e = failure(src, true);
        assertEquals(List.of("a", "b"), identifiers(e));
        assertEquals(4, e.errors().get(0).position().line);
        assertEquals(5, e.errors().get(1).position().line);
    }

    @Test
    void assignmentAfterSolverCall_isReported_notBound() {
        OdeSystem system = extract("[t, y] = ode45(@f, [0 1], 1);\nk = 2;\nfunction dy = f(t, y)\n  dy = -y;\nend\n");
        assertTrue(codes(system).contains(ModelExtractor.IGNORED_STATEMENT));
        assertNull(system.parameter("k"));
        assertTrue(system.parameters().isEmpty());
    }

    @Test
    void undefinedOdeFunction_isNamed() {
        ExtractionError e = failure("[t, y] = ode45(@nothere, [0 1], 1);\n", true);
        assertEquals("nothere", e.identifier());
    }

    @Test
    void derivativeLength_mustMatchInitialCondition() {
        String src = "[t, y] = ode45(@f, [0 1], [1 2]);\nfunction dy = f(t, y)\n  dy = [-y(1); -y(2); 0];\nend\n";
        ExtractionError e = failure(src, true);
        assertEquals("dy", e.identifier());
    }

    @Test
    void output_mustBeAssigned() {
        ExtractionError e = failure(rhs("  z = 1;"), true);
        assertEquals("dy", e.identifier());
    }

    @Test
    void anonymousWrapper_passesExtraArguments() {
        OdeSystem system = extract(String.join("\n",
            "k = 0.3;",
            "f = @(t, y) decay(t, y, k);",
            "[t, y] = ode45(f, [0 5], 3);",
            "function dy = decay(t, y, k)",
            "  dy = -k*y;",
            "end",
            ""));
        assertEquals(List.of("y_1"), system.states());
        assertEquals("-k*y_1", system.derivative("y_1").toString());
        assertEquals(List.of("k"), new ArrayList<>(system.parameters().keySet()));
        assertEquals(3.0, system.initialValue("y_1").value());
    }

    @Test
    void legacyTrailingSolverArguments_bindFormals() {
        OdeSystem system = extract(String.join("\n",
            "k = 2;",
            "[t, y] = ode45(@decay, [0 5], 3, [], k);",
            "function dy = decay(t, y, k)",
            "  dy = -k*y;",
            "end",
            ""));
        assertEquals("-k*y_1", system.derivative("y_1").toString());
    }

    @Test
    void surplusArguments_areReported() {
        OdeSystem system = extract(String.join("\n",
            "k = 2;",
            "[t, y] = ode45(@decay, [0 5], 3, [], k, 7);",
            "function dy = decay(t, y, k)",
            "  dy = -k*y;",
            "end",
            ""));
        assertTrue(codes(system).contains(ModelExtractor.UNUSED_ARGUMENT));
    }

    @Test
    void vectorParameters_expandIntoElements() {
        OdeSystem system = extract(String.join("\n",
            "p = [2 3];",
            "[t, y] = ode45(@f, [0 1], [1; 1]);",
            "function dy = f(t, y)",
            "  dy = [-p(1)*y(1); p(2)*y(1) - y(2)];",
            "end",
            ""));
        assertEquals("-p_1*y_1", system.derivative("y_1").toString());
        assertEquals("p_2*y_1 - y_2", system.derivative("y_2").toString());
        ParameterBinding p2 = system.parameter("p_2");
        assertNotNull(p2);
        assertEquals(3.0, p2.value.value());
        assertNull(system.parameter("p"));
    }

    @Test
    void localConstants_becomeParameters_stateLocalsInlined() {
        OdeSystem system = extract(rhs("  kk = 2*k;\n  flux = kk*y;\n  dy = -flux;"));
        assertEquals("-kk*y_1", system.derivative("y_1").toString());
        assertEquals("2*k", system.parameter("kk").value.toString());
        assertNotNull(system.parameter("k"));
        assertNull(system.parameter("flux"));
    }

    @Test
    void timeArgument_becomesTimeSymbol() {
        OdeSystem system = extract(rhs("  dy = -k*y + t;"));
        assertTrue(system.derivative("y_1").containsTime());
    }

    @Test
    void controlFlow_insideOdeFunction() {
        String src = rhs("  if t > 1\n    z = 0;\n  end\n  dy = -k*y;");
        assertThrows(ExtractionError.class, () -> extract(src, true));
        OdeSystem lenient = extract(src, false);
        assertEquals("-k*y_1", lenient.derivative("y_1").toString());
        assertTrue(codes(lenient).contains(ModelExtractor.UNSUPPORTED_CONSTRUCT));
    }

    @Test
    void topLevelControlFlow_isIgnored() {
        OdeSystem system = extract(String.join("\n",
            "k = 1;",
            "if k > 0",
            "  k = 2;",
            "end",
            "[t, y] = ode45(@f, [0 1], 1);",
            "function dy = f(t, y)",
            "  dy = -k*y;",
            "end",
            ""));
        assertTrue(codes(system).contains(ModelExtractor.TOP_LEVEL_CONTROL_FLOW));
        assertEquals(1.0, system.parameter("k").value.value());
    }

    @Test
    void multipleSolverCalls_strictFails_lenientUsesFirst() {
        String src = String.join("\n",
            "k = 1;",
            "[t, y] = ode45(@f, [0 1], 1);",
            "[t2, y2] = ode15s(@f, [0 2], 2);",
            "function dy = f(t, y)",
            "  dy = -k*y;",
            "end",
            "");
        assertThrows(ExtractionError.class, () -> extract(src, true));
        OdeSystem lenient = extract(src, false);
        assertEquals("ode45", lenient.solver);
        assertEquals(1.0, lenient.initialValue("y_1").value());
        assertTrue(codes(lenient).contains(ModelExtractor.MULTIPLE_SOLVER_CALLS));
    }

    @Test
    void reassignment_andLocalShadowing() {
        OdeSystem system = extract(String.join("\n",
            "k = 1;",
            "k = 2;",
            "m = 4;",
            "[t, y] = ode45(@f, [0 1], 1);",
            "function dy = f(t, y)",
            "  m = 5;",
            "  dy = -k*m*y;",
            "end",
            ""));
        assertEquals(2.0, system.parameter("k").value.value());
        assertEquals(5.0, system.parameter("m").value.value());
        long shadowed = codes(system).stream().filter(ModelExtractor.SHADOWED_BINDING::equals).count();
        assertEquals(2, shadowed);
    }

    @Test
    void unassignedDerivativeElements_defaultToZero() {
        String src = "[t, y] = ode45(@f, [0 1], [1 1]);\nfunction dy = f(t, y)\n  dy(1) = -y(1);\nend\n";
        OdeSystem system = extract(src);
        assertTrue(system.derivative("y_2").isZero());
        assertTrue(codes(system).contains(ModelExtractor.UNASSIGNED_DERIVATIVE));
    }

    @Test
    void scriptsWithParseErrors_areRefused() {
        ParsedScript broken = new Parser(new Lexer("bad.m", "x = (1 +;\n").tokenize()).parse();
        ModelExtractor extractor = new ModelExtractor(MatlabBuiltins.standard(), true);
        assertThrows(IllegalArgumentException.class, () -> extractor.extract(broken));
    }
}
