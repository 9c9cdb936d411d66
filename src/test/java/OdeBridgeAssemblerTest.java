import com.odebridge.extract.OdeSystem;
import com.odebridge.inference.InferenceOptions;
import com.odebridge.inference.InferenceResult;
import com.odebridge.inference.ReactionInference;
import com.odebridge.model.AssemblyError;
import com.odebridge.model.ModelAssembler;
import com.odebridge.model.Reaction;
import com.odebridge.model.Rule;
import com.odebridge.model.Species;
import com.odebridge.model.StructuredModel;
import com.odebridge.symbolic.SymExpr;

import org.junit.jupiter.api.Test;

import static com.odebridge.symbolic.SymExpr.constant;
import static com.odebridge.symbolic.SymExpr.negate;
import static com.odebridge.symbolic.SymExpr.product;
import static com.odebridge.symbolic.SymExpr.variable;
import static org.junit.jupiter.api.Assertions.*;

public class OdeBridgeAssemblerTest {

    private static OdeSystem decay(String sourceName, String extraParameter) {
        OdeSystem.Builder b = OdeSystem.builder(sourceName)
                .state("A", negate(product(variable("k"), variable("A"))), 2)
                .state("B", product(variable("k"), variable("A")), 0)
                .state("E", constant(0), 1)
                .parameter("k", 0.5)
                .parameter("k2", product(constant(2), variable("k")));
        if (extraParameter != null) b.parameter(extraParameter, 1);
        return b.build();
    }

    private static StructuredModel assemble(OdeSystem system) {
        return new ModelAssembler().assemble(system, new ReactionInference().infer(system));
    }

    @Test
    void assemble_speciesParametersAndReactions() {
        StructuredModel model = assemble(decay("decay.m", null));
        assertEquals("decay", model.id);
        assertEquals(1, model.compartments().size());
        assertEquals(ModelAssembler.DEFAULT_COMPARTMENT, model.compartments().get(0).id);
        assertEquals(3, model.compartments().get(0).spatialDimensions);

        Species a = model.species("A");
        assertEquals("comp", a.compartment);
        assertEquals(2.0, a.initialConcentration());
        assertFalse(a.constant);
        Species e = model.species("E");
        assertTrue(e.constant);
        assertTrue(e.boundaryCondition);

        assertFalse(model.parameter("k").isComputed());
        assertEquals(0.5, model.parameter("k").numericValue());
        assertTrue(model.parameter("k2").isComputed());
        assertNull(model.parameter("k2").numericValue());

        Reaction r = model.reaction("r1");
        assertFalse(r.reversible);
        assertEquals("A", r.reactants.get(0).species);
        assertEquals("B", r.products.get(0).species);
        assertEquals(1.0, r.products.get(0).stoichiometry);
        assertEquals("k*A", r.formula());
        assertTrue(model.rules().isEmpty());
    }

    @Test
    void rules_assignmentRulesComeFirst() {
        OdeSystem system = OdeSystem.builder("clock.m")
                .state("A", negate(product(variable("k"), variable("A"))), 1)
                .state("tau", SymExpr.time(), 0)
                .parameter("k", 1)
                .build();
        InferenceResult rulesOnly = new ReactionInference(InferenceOptions.defaults().withInferReactions(false)).infer(system);
        StructuredModel model = new ModelAssembler().assemble(system, rulesOnly);
        assertEquals(2, model.rules().size());
        assertEquals(Rule.Type.ASSIGNMENT, model.rules().get(0).type);
        assertEquals("tau", model.rules().get(0).variable);
        assertEquals("time", model.rules().get(0).formula());
        assertEquals(Rule.Type.RATE, model.rule("A").type);
        assertEquals("-k*A", model.rule("A").formula());
        assertTrue(model.reactions().isEmpty());
    }

    @Test
    void compartmentId_avoidsModelNames() {
        StructuredModel model = assemble(decay("decay.m", "comp"));
        assertEquals("comp_", model.compartments().get(0).id);
        assertEquals("comp_", model.species("A").compartment);
        assertNotNull(model.parameter("comp"));
    }

    @Test
    void customCompartment_mustBeIdentifier() {
        OdeSystem system = decay("decay.m", null);
        StructuredModel model = new ModelAssembler("cell").assemble(system, new ReactionInference().infer(system));
        assertEquals("cell", model.compartments().get(0).id);
        assertThrows(IllegalArgumentException.class, () -> new ModelAssembler("1cell"));
        assertThrows(IllegalArgumentException.class, () -> new ModelAssembler("my cell"));
        assertThrows(IllegalArgumentException.class, () -> new ModelAssembler(null));
    }

    @Test
    void modelId_comesFromFileName() {
        assertEquals("cyclic_v2", assemble(decay("models/cyclic-v2.m", null)).id);
        assertEquals("_2pools", assemble(decay("C:\\work\\2pools.m", null)).id);
        assertEquals("model", assemble(decay("", null)).id);
    }

    @Test
    void inconsistentInputs_areRejected() {
        OdeSystem system = decay("decay.m", null);
        InferenceResult rulesOnly = new ReactionInference(InferenceOptions.defaults().withInferReactions(false)).infer(system);
        OdeSystem other = OdeSystem.builder("other.m")
                .state("X", constant(1), 0)
                .build();
        AssemblyError e = assertThrows(AssemblyError.class, () -> new ModelAssembler().assemble(other, rulesOnly));
        assertTrue(e.getMessage().contains("'A'"), e.getMessage());
    }
}
