import com.odebridge.ConversionResult;
import com.odebridge.OdeBridge;
import com.odebridge.OdeBridgeCli;
import com.odebridge.Stage;
import com.odebridge.extract.ExtractionError;
import com.odebridge.extract.ModelExtractor;
import com.odebridge.matlab.parser.ParseError;
import com.odebridge.model.Reaction;
import com.odebridge.model.Rule;
import com.odebridge.model.StructuredModel;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OdeBridgeScenarioTest {

    private static List<String> reactions(StructuredModel model) {
        List<String> out = new ArrayList<>();
        for (Reaction r : model.reactions()) out.add(r.toString());
        return out;
    }

    @Test
    void cyclicScript_becomesRateRules() {
        ConversionResult result = new OdeBridge().convert("cyclic.m", OdeBridgeExtractorTest.CYCLIC);
        assertTrue(result.isSuccess(), result::toString);
        StructuredModel model = result.model();
        assertEquals("cyclic", model.id);
        assertEquals(3, model.species().size());
        assertEquals(3, model.rules().size());
        assertEquals("Y_2*Y_3*k1", model.rule("Y_1").formula());
        assertEquals("-Y_1*Y_3*k2", model.rule("Y_2").formula());
        assertTrue(model.reactions().isEmpty());
        assertEquals(3, model.parameters().size());
        assertNull(result.failedStage());
    }

    @Test
    void twoPoolScript_becomesReactions() {
        ConversionResult result = new OdeBridge().convert("pools.m", OdeBridgeExtractorTest.TWO_POOLS);
        assertTrue(result.isSuccess(), result::toString);
        StructuredModel model = result.model();
        assertEquals(4, model.reactions().size());
        assertTrue(model.rules().isEmpty());
        assertEquals("c*x1", model.reaction("r3").formula());
        assertEquals(0.0, model.species("x1").initialConcentration());
        assertEquals(0.2, model.parameter("d").numericValue());
    }

    @Test
    void clockSpecies_inOtherEquation_assemblesWithRules() {
        String src = String.join("\n",
            "k = 0.1;",
            "[t, y] = ode45(@f, [0 1], [1; 0]);",
            "function dy = f(t, y)",
            "  dy = zeros(2, 1);",
            "  dy(1) = -k*y(1)*y(2);",
            "  dy(2) = t;",
            "end",
            "");
        ConversionResult result = new OdeBridge().convert("clock.m", src);
        assertTrue(result.isSuccess(), result::toString);
        StructuredModel model = result.model();
        assertEquals(Rule.Type.RATE, model.rule("y_1").type);
        assertEquals(Rule.Type.ASSIGNMENT, model.rule("y_2").type);
        assertTrue(model.reactions().isEmpty());
    }

    @Test
    void rateRuleMode_emitsOnlyRules() {
        OdeBridge bridge = new OdeBridge();
        bridge.setInferReactions(false);
        ConversionResult result = bridge.convert("pools.m", OdeBridgeExtractorTest.TWO_POOLS);
        assertTrue(result.model().reactions().isEmpty());
        assertEquals("a - b*x1", result.model().rule("x1").formula());
    }

    @Test
    void missingSolver_failsInExtraction() {
        ConversionResult result = new OdeBridge().convert("plain.m", "x = 1;\ndisp(x)\n");
        assertFalse(result.isSuccess());
        assertNull(result.model());
        assertEquals(Stage.EXTRACT, result.failedStage());
        assertTrue(result.errors().get(0) instanceof ExtractionError);
    }

    @Test
    void extractionFailure_listsEveryUnboundIdentifier() {
        String src = "[t, y] = ode45(@f, [0 1], [1 2]);\nfunction dy = f(t, y)\n  dy = [-a*y(1); -b*y(2)];\nend\n";
        ConversionResult result = new OdeBridge().convert("unbound.m", src);
        assertEquals(Stage.EXTRACT, result.failedStage());
        assertEquals(2, result.errors().size());
        assertEquals("a", ((ExtractionError) result.errors().get(0)).identifier());
        assertEquals("b", ((ExtractionError) result.errors().get(1)).identifier());
    }

    @Test
    void mixedSeparators_failInParsing() {
        ConversionResult result = new OdeBridge().convert("mixed.m", "y0 = [1, 2 -3 +4];\n[t, y] = ode45(@f, [0 1], y0);\n");
        assertEquals(Stage.PARSE, result.failedStage());
        ParseError e = (ParseError) result.errors().get(0);
        assertEquals(1, e.position().line);
        assertNull(result.system());
    }

    @Test
    void lexicalErrors_areReported() {
        ConversionResult result = new OdeBridge().convert("bad.m", "x = 'open\n");
        assertEquals(Stage.LEX, result.failedStage());
    }

    @Test
    void lenientMode_skipsUnsupportedStatements() {
        String src = String.join("\n",
            "k = 1;",
            "[t, y] = ode45(@f, [0 1], 1);",
            "function dy = f(t, y)",
            "  for i = 1:3",
            "    z = i;",
            "  end",
            "  dy = -k*y;",
            "end",
            "");
        OdeBridge bridge = new OdeBridge();
        assertEquals(Stage.EXTRACT, bridge.convert("loop.m", src).failedStage());
        bridge.setMode(OdeBridge.Mode.LENIENT);
        ConversionResult result = bridge.convert("loop.m", src);
        assertTrue(result.isSuccess(), result::toString);
        assertEquals(ModelExtractor.UNSUPPORTED_CONSTRUCT, result.diagnostics().get(0).code);
    }

    @Test
    void options_areValidated() {
        OdeBridge bridge = new OdeBridge();
        assertThrows(IllegalArgumentException.class, () -> bridge.setCoefficientTolerance(-0.5));
        assertThrows(IllegalArgumentException.class, () -> bridge.setCompartmentId("two words"));
        assertThrows(IllegalArgumentException.class, () -> bridge.convert("x.m", null));
        bridge.setCompartmentId("cell");
        assertEquals("cell", bridge.convert("pools.m", OdeBridgeExtractorTest.TWO_POOLS).model().compartments().get(0).id);
    }

    @Test
    void commandLine_roundTrip(@TempDir Path dir) throws Exception {
        Path script = dir.resolve("pools.m");
        Files.writeString(script, OdeBridgeExtractorTest.TWO_POOLS, StandardCharsets.UTF_8);

        PrintStream original = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        int code;
        try {
            System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
            code = OdeBridgeCli.run(new String[] { "--compartment", "cell", script.toString() });
        } finally {
            System.setOut(original);
        }
        assertEquals(0, code);
        String json = captured.toString(StandardCharsets.UTF_8);
        assertTrue(json.contains("\"ok\" : true"), json);
        assertTrue(json.contains("\"cell\""), json);

        assertEquals(2, OdeBridgeCli.run(new String[] { "--bogus" }));
        assertEquals(2, OdeBridgeCli.run(new String[0]));
        assertEquals(3, OdeBridgeCli.run(new String[] { dir.resolve("missing.m").toString() }));
    }
}
