package com.odebridge.matlab.parser;

import java.util.Collections;
import java.util.List;

import com.odebridge.matlab.parser.Expr.IndexOrCall;
import com.odebridge.matlab.parser.Statement.FunctionDef;
import com.odebridge.matlab.parser.Statement.ScriptBlock;

/**
 * Output of one parse: the statement tree, the call/index resolution of every
 * name(args) node, every function definition in source order and the errors the
 * parser recovered from.
 */
public final class ParsedScript {
    public final String sourceName;
    public final ScriptBlock root;

    private final KindTable kinds;
    private final List<FunctionDef> functions;
    private final List<ParseError> errors;

    ParsedScript(String sourceName, ScriptBlock root, KindTable kinds,
                 List<FunctionDef> functions, List<ParseError> errors) {
        this.sourceName = sourceName;
        this.root = root;
        this.kinds = kinds;
        this.functions = Collections.unmodifiableList(functions);
        this.errors = Collections.unmodifiableList(errors);
    }

    public boolean hasErrors() { return !errors.isEmpty(); }

    public List<ParseError> errors() { return errors; }

    public KindTable kinds() { return kinds; }

    public CallKind kindOf(IndexOrCall node) { return kinds.kindOf(node); }

    public List<FunctionDef> functions() { return functions; }

    /** First function definition with the given name, or null. */
    public FunctionDef function(String name) {
        for (FunctionDef f : functions) {
            if (f.name().equals(name)) return f;
        }
        return null;
    }
}
