import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.odebridge.ConversionResult;
import com.odebridge.OdeBridge;
import com.odebridge.protocol.ModelJson;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class OdeBridgeJsonTest {
    private static final ObjectMapper om = new ObjectMapper();

    @Test
    void successfulConversion_tree() {
        ConversionResult result = new OdeBridge().convert("pools.m", OdeBridgeExtractorTest.TWO_POOLS);
        JsonNode root = ModelJson.toJson(result);
        assertEquals("pools.m", root.get("source").asText());
        assertTrue(root.get("ok").asBoolean());
        assertEquals(0, root.get("errors").size());

        JsonNode model = root.get("model");
        assertEquals("pools", model.get("id").asText());
        assertEquals("comp", model.get("compartments").get(0).get("id").asText());
        assertEquals(3, model.get("compartments").get(0).get("spatialDimensions").asInt());

        JsonNode x1 = model.get("species").get(0);
        assertEquals("x1", x1.get("id").asText());
        assertEquals(0.0, x1.get("initialConcentration").asDouble());
        assertFalse(x1.get("boundaryCondition").asBoolean());

        assertEquals(4, model.get("parameters").size());
        assertEquals(0.5, model.get("parameters").get(1).get("value").asDouble());

        JsonNode r3 = model.get("reactions").get(2);
        assertEquals("r3", r3.get("id").asText());
        assertFalse(r3.get("reversible").asBoolean());
        assertEquals("x1", r3.get("reactants").get(0).get("species").asText());
        assertEquals(2, r3.get("products").size());
        assertEquals(1.0, r3.get("products").get(1).get("stoichiometry").asDouble());
        assertEquals("c*x1", r3.get("kineticLaw").get("formula").asText());
        assertEquals("c", r3.get("kineticLaw").get("variables").get(0).asText());
        assertEquals(0, r3.get("modifiers").size());
    }

    @Test
    void rules_andComputedValues() {
        String src = String.join("\n",
            "k = 2;",
            "y0 = 3*k;",
            "[t, y] = ode45(@f, [0 1], y0);",
            "function dy = f(t, y)",
            "  kk = k/2;",
            "  dy = -kk*y/(1 + y);",
            "end",
            "");
        JsonNode model = ModelJson.toJson(new OdeBridge().convert("sat.m", src)).get("model");
        JsonNode rule = model.get("rules").get(0);
        assertEquals("rateRule", rule.get("type").asText());
        assertEquals("y_1", rule.get("variable").asText());
        JsonNode kk = null;
        for (JsonNode p : model.get("parameters")) {
            if (p.get("id").asText().equals("kk")) kk = p;
        }
        assertNotNull(kk);
        assertTrue(kk.get("value").isNull());
        assertEquals("0.5*k", kk.get("expression").asText());
    }

    @Test
    void failedConversion_tree() throws Exception {
        ConversionResult result = new OdeBridge().convert("bad.m", "x = (1 + ;\n");
        String text = ModelJson.write(result);
        JsonNode root = om.readTree(text);
        assertFalse(root.get("ok").asBoolean());
        assertTrue(root.get("model").isNull());
        JsonNode error = root.get("errors").get(0);
        assertEquals("PARSE", error.get("stage").asText());
        assertEquals(1, error.get("line").asInt());
        assertEquals("expression", error.get("expected").asText());
    }

    @Test
    void diagnostics_areListed() {
        String src = String.join("\n",
            "k = 1;",
            "k = 2;",
            "[t, y] = ode45(@f, [0 1], 1);",
            "function dy = f(t, y)",
            "  dy = -k*y;",
            "end",
            "");
        JsonNode diagnostics = ModelJson.toJson(new OdeBridge().convert("twice.m", src)).get("diagnostics");
        assertEquals(1, diagnostics.size());
        JsonNode d = diagnostics.get(0);
        assertEquals("EXTRACT", d.get("stage").asText());
        assertEquals("WARNING", d.get("severity").asText());
        assertEquals("SHADOWED_BINDING", d.get("code").asText());
        assertEquals(2, d.get("line").asInt());
    }
}
