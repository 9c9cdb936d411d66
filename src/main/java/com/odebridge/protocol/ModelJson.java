package com.odebridge.protocol;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.odebridge.ConversionError;
import com.odebridge.ConversionResult;
import com.odebridge.Diagnostic;
import com.odebridge.matlab.parser.ParseError;
import com.odebridge.matlab.parser.SourcePosition;
import com.odebridge.model.Compartment;
import com.odebridge.model.Parameter;
import com.odebridge.model.Reaction;
import com.odebridge.model.Rule;
import com.odebridge.model.Species;
import com.odebridge.model.SpeciesReference;
import com.odebridge.model.StructuredModel;
import com.odebridge.symbolic.SymExpr;

/**
 * JSON view of a conversion, the hand-off format for exporters and the CLI.
 *
 * <pre>
 * { "source": "...", "ok": true,
 *   "model": { "id", "compartments", "species", "parameters", "rules", "reactions" },
 *   "errors": [ ... ], "diagnostics": [ ... ] }
 * </pre>
 *
 * Numbers that are not finite are written as the strings "Inf", "-Inf" and "NaN".
 */
public final class ModelJson {
    private static final ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private ModelJson() {}

    public static ObjectNode toJson(ConversionResult result) {
        ObjectNode root = om.createObjectNode();
        root.put("source", result.sourceName);
        root.put("ok", result.isSuccess());
        if (result.isSuccess()) root.set("model", toJson(result.model()));
        else root.putNull("model");

        ArrayNode errors = root.putArray("errors");
        for (ConversionError e : result.errors()) {
            ObjectNode n = errors.addObject();
            n.put("stage", e.stage().name());
            n.put("message", e.getMessage());
            position(n, e.position());
            if (e instanceof ParseError && ((ParseError) e).expected() != null) {
                n.put("expected", ((ParseError) e).expected());
            }
        }
        diagnostics(root.putArray("diagnostics"), result.diagnostics());
        return root;
    }

    public static ObjectNode toJson(StructuredModel model) {
        ObjectNode m = om.createObjectNode();
        m.put("id", model.id);

        ArrayNode compartments = m.putArray("compartments");
        for (Compartment c : model.compartments()) {
            ObjectNode n = compartments.addObject();
            n.put("id", c.id);
            n.put("size", c.size);
            n.put("spatialDimensions", c.spatialDimensions);
        }

        ArrayNode species = m.putArray("species");
        for (Species s : model.species()) {
            ObjectNode n = species.addObject();
            n.put("id", s.id);
            n.put("compartment", s.compartment);
            if (s.initialValue == null) {
                n.putNull("initialConcentration");
            } else if (s.initialConcentration() != null) {
                number(n, "initialConcentration", s.initialConcentration());
            } else {
                n.putNull("initialConcentration");
                n.put("initialExpression", s.initialValue.toString());
            }
            n.put("boundaryCondition", s.boundaryCondition);
            n.put("constant", s.constant);
        }

        ArrayNode parameters = m.putArray("parameters");
        for (Parameter p : model.parameters()) {
            ObjectNode n = parameters.addObject();
            n.put("id", p.id);
            if (p.isComputed()) {
                n.putNull("value");
                n.put("expression", p.value.toString());
            } else {
                number(n, "value", p.numericValue());
            }
            n.put("constant", true);
        }

        ArrayNode rules = m.putArray("rules");
        for (Rule r : model.rules()) {
            ObjectNode n = rules.addObject();
            n.put("type", r.type == Rule.Type.RATE ? "rateRule" : "assignmentRule");
            n.put("variable", r.variable);
            n.put("formula", r.formula());
            variables(n, r.math);
        }

        ArrayNode reactions = m.putArray("reactions");
        for (Reaction r : model.reactions()) {
            ObjectNode n = reactions.addObject();
            n.put("id", r.id);
            n.put("reversible", r.reversible);
            references(n.putArray("reactants"), r.reactants);
            references(n.putArray("products"), r.products);
            ArrayNode modifiers = n.putArray("modifiers");
            for (String s : r.modifiers) modifiers.add(s);
            ObjectNode law = n.putObject("kineticLaw");
            law.put("formula", r.formula());
            variables(law, r.kineticLaw);
        }
        return m;
    }

    public static String write(ConversionResult result) {
        try {
            return om.writeValueAsString(toJson(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot render conversion result: " + e.getMessage(), e);
        }
    }

    private static void references(ArrayNode out, List<SpeciesReference> refs) {
        for (SpeciesReference ref : refs) {
            ObjectNode n = out.addObject();
            n.put("species", ref.species);
            n.put("stoichiometry", ref.stoichiometry);
        }
    }

    private static void variables(ObjectNode n, SymExpr expr) {
        ArrayNode vars = n.putArray("variables");
        for (String v : expr.variables()) vars.add(v);
    }

    private static void diagnostics(ArrayNode out, List<Diagnostic> diagnostics) {
        for (Diagnostic d : diagnostics) {
            ObjectNode n = out.addObject();
            n.put("stage", d.stage.name());
            n.put("severity", d.severity.name());
            n.put("code", d.code);
            n.put("message", d.message);
            position(n, d.position);
        }
    }

    private static void position(ObjectNode n, SourcePosition p) {
        if (p == null) return;
        n.put("line", p.line);
        n.put("column", p.column);
    }

    private static void number(ObjectNode n, String field, double v) {
        if (Double.isNaN(v)) n.put(field, "NaN");
        else if (Double.isInfinite(v)) n.put(field, v > 0 ? "Inf" : "-Inf");
        else n.put(field, v);
    }
}
