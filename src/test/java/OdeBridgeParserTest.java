import com.odebridge.matlab.parser.Expr.Binary;
import com.odebridge.matlab.parser.Expr.FunctionHandle;
import com.odebridge.matlab.parser.Expr.MatrixLiteral;
import com.odebridge.matlab.parser.Expr.SolverCall;
import com.odebridge.matlab.parser.Expr.StringLiteral;
import com.odebridge.matlab.parser.Expr.Unary;
import com.odebridge.matlab.parser.Lexer;
import com.odebridge.matlab.parser.ParseError;
import com.odebridge.matlab.parser.ParsedScript;
import com.odebridge.matlab.parser.Parser;
import com.odebridge.matlab.parser.Statement.Assignment;
import com.odebridge.matlab.parser.Statement.CommandStmt;
import com.odebridge.matlab.parser.Statement.ControlStmt;
import com.odebridge.matlab.parser.Statement.DeclarationStmt;
import com.odebridge.matlab.parser.Statement.FunctionDef;
import com.odebridge.matlab.parser.Statement.ShellStmt;
import com.odebridge.matlab.parser.Statement.Stmt;
import com.odebridge.matlab.parser.TokenType;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OdeBridgeParserTest {

    private static ParsedScript parse(String src) {
        return new Parser(new Lexer("test.m", src).tokenize()).parse();
    }

    private static List<Stmt> statements(String src) {
        ParsedScript script = parse(src);
        assertFalse(script.hasErrors(), () -> "unexpected errors: " + script.errors());
        return script.root.statements;
    }

    private static MatrixLiteral matrix(String src) {
        Assignment a = (Assignment) statements("x = " + src + ";").get(0);
        return (MatrixLiteral) a.value;
    }

    @Test
    void mixedMatrixSeparators_areRejected() {
        ParsedScript script = parse("x = [1, 2 -3 +4];\ny = 2;");
        assertEquals(1, script.errors().size());
        ParseError e = script.errors().get(0);
        assertTrue(e.getMessage().contains("Mixing"), e.getMessage());
        assertEquals(1, e.position().line);
        // parsing resumes at the next statement
        assertEquals(1, script.root.statements.size());
        assertEquals("y", ((Assignment) script.root.statements.get(0)).plainName());
    }

    @Test
    void whitespace_decidesMatrixElements() {
        assertEquals(2, matrix("[1 -2]").elementCount());
        assertEquals(1, matrix("[1 - 2]").elementCount());
        assertEquals(1, matrix("[1-2]").elementCount());
        assertEquals(3, matrix("[1, -2, 3]").elementCount());
        assertEquals(2, matrix("[a' b']").elementCount());
        assertEquals(2, matrix("[f (1)]").elementCount());
    }

    @Test
    void matrixRows_splitOnSemicolonAndNewline() {
        MatrixLiteral m = matrix("[1 2; 3 4\n 5 6]");
        assertEquals(3, m.rows.size());
        assertFalse(m.isVector());
        assertTrue(matrix("[1; 2; 3]").isVector());
        assertEquals(0, matrix("[]").elementCount());
    }

    @Test
    void errors_collectedPerStatement() {
        ParsedScript script = parse("x = (1 + ;\ny = 2;\nz = ]\nw = 3;");
        assertEquals(2, script.errors().size());
        assertEquals(1, script.errors().get(0).position().line);
        assertEquals(3, script.errors().get(1).position().line);
        assertEquals(2, script.root.statements.size());
        assertEquals("expression", script.errors().get(1).expected());
        assertEquals("]", script.errors().get(1).found());
    }

    @Test
    void strayEnd_isAnError() {
        ParsedScript script = parse("x = 1;\nend\ny = 2;");
        assertEquals(1, script.errors().size());
        assertEquals(2, script.root.statements.size());
    }

    @Test
    void functionDefinitions_parse() {
        ParsedScript script = parse(String.join("\n",
            "function dy = f(t, y)",
            "  dy = -y;",
            "end",
            "function [a, b] = g(~, x)",
            "  a = x; b = x;",
            "end",
            ""));
        assertFalse(script.hasErrors());
        assertEquals(2, script.functions().size());
        FunctionDef f = script.function("f");
        assertEquals(List.of("t", "y"), List.of(f.params.get(0).lexeme, f.params.get(1).lexeme));
        assertEquals("dy", f.outputs.get(0).lexeme);
        assertEquals(1, f.body.statements.size());
        FunctionDef g = script.function("g");
        assertEquals(2, g.outputs.size());
        assertEquals(TokenType.TILDE, g.params.get(0).type);
        assertNull(script.function("h"));
    }

    @Test
    void functionBodies_mayOmitEnd() {
        ParsedScript script = parse(String.join("\n",
            "function a = f(x)",
            "a = x;",
            "function b = g(x)",
            "b = 2*x;",
            ""));
        assertFalse(script.hasErrors());
        assertEquals(2, script.functions().size());
        assertEquals(1, script.function("f").body.statements.size());
        assertEquals(1, script.function("g").body.statements.size());
    }

    @Test
    void multiOutputSolverCall_parses() {
        Assignment a = (Assignment) statements("[t, y] = ode45(@f, [0 1], 1);").get(0);
        assertTrue(a.multiple);
        assertEquals(2, a.targets.size());
        SolverCall call = (SolverCall) a.value;
        assertEquals("ode45", call.name());
        assertEquals(3, call.args.size());
        FunctionHandle h = (FunctionHandle) call.args.get(0);
        assertFalse(h.isAnonymous());
        assertEquals("f", h.name.lexeme);
    }

    @Test
    void placeholderOutputs_parse() {
        Assignment a = (Assignment) statements("[~, y] = ode23s('f', [0 1], [1 2]);").get(0);
        assertTrue(Assignment.isPlaceholder(a.targets.get(0)));
        assertFalse(Assignment.isPlaceholder(a.targets.get(1)));
        SolverCall call = (SolverCall) a.value;
        assertEquals("f", ((StringLiteral) call.args.get(0)).value);
    }

    @Test
    void anonymousFunctionHandle_parses() {
        Assignment a = (Assignment) statements("f = @(t, y) -k*y;").get(0);
        FunctionHandle h = (FunctionHandle) a.value;
        assertTrue(h.isAnonymous());
        assertEquals(2, h.params.size());
        assertTrue(h.body instanceof Binary);
    }

    @Test
    void controlBlocks_areKept() {
        List<Stmt> stmts = statements(String.join("\n",
            "if x > 1",
            "  y = 2;",
            "elseif x < 0",
            "  y = 3;",
            "else",
            "  y = 4;",
            "end",
            "for i = 1:10",
            "  z(i) = i;",
            "end",
            "while n > 0, n = n - 1; end",
            "switch mode",
            "  case 'a'",
            "    m = 1;",
            "  otherwise",
            "    m = 2;",
            "end",
            "try",
            "  q = 1;",
            "catch err",
            "  q = 2;",
            "end",
            ""));
        assertEquals(5, stmts.size());
        ControlStmt ifs = (ControlStmt) stmts.get(0);
        assertEquals(3, ifs.clauses.size());
        assertNull(ifs.clauses.get(2).header);
        ControlStmt loop = (ControlStmt) stmts.get(1);
        assertEquals("i", loop.clauses.get(0).variable.lexeme);
        assertEquals(3, ((ControlStmt) stmts.get(3)).clauses.size());
        assertEquals("err", ((ControlStmt) stmts.get(4)).clauses.get(1).variable.lexeme);
    }

    @Test
    void commandShellAndDeclarations_parse() {
        List<Stmt> stmts = statements("clear all\nhold on\n!ls\nglobal k1 k2\npersistent n\n");
        assertEquals(5, stmts.size());
        CommandStmt clear = (CommandStmt) stmts.get(0);
        assertEquals("clear", clear.name.lexeme);
        assertEquals(List.of("all"), clear.words);
        assertTrue(stmts.get(2) instanceof ShellStmt);
        DeclarationStmt global = (DeclarationStmt) stmts.get(3);
        assertTrue(global.isGlobal());
        assertEquals(2, global.names.size());
        assertFalse(((DeclarationStmt) stmts.get(4)).isGlobal());
    }

    @Test
    void power_isLeftAssociative_bindsTighterThanUnaryMinus() {
        Binary p = (Binary) ((Assignment) statements("x = 2^3^2;").get(0)).value;
        assertTrue(p.left instanceof Binary);
        Unary neg = (Unary) ((Assignment) statements("x = -a^2;").get(0)).value;
        assertTrue(neg.operand instanceof Binary);
        Binary signed = (Binary) ((Assignment) statements("x = a^-1;").get(0)).value;
        assertTrue(signed.right instanceof Unary);
    }

    @Test
    void shortCircuit_bindsTighterThanRange() {
        Assignment a = (Assignment) statements("x = a || b : c;").get(0);
        assertEquals("Range", a.value.getClass().getSimpleName());
    }

    @Test
    void invalidAssignmentTarget_isRejected() {
        ParsedScript script = parse("1 = x;");
        assertEquals(1, script.errors().size());
        assertTrue(script.errors().get(0).getMessage().contains("Invalid assignment target"));
    }

    @Test
    void unbalancedDelimiters_areRejected() {
        assertTrue(parse("x = (1 + 2;").hasErrors());
        assertTrue(parse("x = [1 2;").hasErrors());
        assertTrue(parse("x = f(1, 2;").hasErrors());
    }

    @Test
    void tokenList_mustEndWithEof() {
        assertThrows(IllegalArgumentException.class, () -> new Parser(List.of()));
    }
}
