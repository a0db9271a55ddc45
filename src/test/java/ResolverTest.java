import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.lux.script.parser.Diagnostic;
import com.lux.script.parser.Expr;
import com.lux.script.parser.Interpreter;
import com.lux.script.parser.Program;
import com.lux.script.parser.Resolver;
import com.lux.script.parser.Statement.Block;
import com.lux.script.parser.Statement.ExprStmt;
import com.lux.script.parser.Statement.FunctionStmt;
import com.lux.script.parser.Statement.PrintStmt;
import com.lux.script.parser.Statement.ReturnStmt;
import com.lux.script.parser.Statement.Stmt;
import com.lux.script.parser.Statement.VarStmt;

public class ResolverTest {

    private final Interpreter interpreter = new Interpreter(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));

    private List<Diagnostic> resolve(Program program) {
        assertFalse(program.hasErrors(), program.diagnostics().toString());
        return new Resolver(interpreter).resolve(program);
    }

    @Test
    void readingLocalInItsOwnInitializer() {
        List<Diagnostic> d = resolve(Program.parse("{ var a = a; }"));
        assertEquals(1, d.size());
        assertEquals("Can't read local variable 'a' in its own initializer.", d.get(0).message);
    }

    @Test
    void globalSelfReferenceIsNotAResolverError() {
        // no local scope: left to the runtime as an undefined global
        assertTrue(resolve(Program.parse("var a = a;")).isEmpty());
    }

    @Test
    void outerVariableInInitializerIsFine() {
        assertTrue(resolve(Program.parse("var a = 1; { var b = a; }")).isEmpty());
    }

    @Test
    void returnAtTopLevel() {
        List<Diagnostic> d = resolve(Program.parse("return 1;"));
        assertEquals(1, d.size());
        assertEquals("Can't return from top-level code.", d.get(0).message);

        assertTrue(resolve(Program.parse("fun f() { return 1; }")).isEmpty());
    }

    @Test
    void diagnosticsAreCollected_notFailFast() {
        List<Diagnostic> d = resolve(Program.parse("{ var a = a; } return; { var b = b; }"));
        assertEquals(3, d.size());
    }

    @Test
    void globalsGetNoEntry() {
        Program p = Program.parse("var g = 1; print g;");
        resolve(p);
        PrintStmt print = (PrintStmt) p.statements().get(1);
        assertNull(interpreter.resolvedDepth(print.expression));
    }

    @Test
    void depthCountsFramesOutward() {
        Program p = Program.parse("{ var a = 1; { print a; } }");
        resolve(p);
        Block outer = (Block) p.statements().get(0);
        Block inner = (Block) outer.statements.get(1);
        PrintStmt print = (PrintStmt) inner.statements.get(0);
        assertEquals(Integer.valueOf(1), interpreter.resolvedDepth(print.expression));
    }

    @Test
    void parametersLiveOneFrameOutsideTheBody() {
        Program p = Program.parse("fun f(x) { return x; }");
        resolve(p);
        FunctionStmt f = (FunctionStmt) p.statements().get(0);
        ReturnStmt ret = (ReturnStmt) ((Block) f.body).statements.get(0);
        assertEquals(Integer.valueOf(1), interpreter.resolvedDepth(ret.value));
    }

    @Test
    void assignmentTargetsAreResolved() {
        Program p = Program.parse("{ var a = 1; a = 2; }");
        resolve(p);
        Block block = (Block) p.statements().get(0);
        Expr.Assign assign = (Expr.Assign) ((ExprStmt) block.statements.get(1)).expression;
        assertEquals(Integer.valueOf(0), interpreter.resolvedDepth(assign));
    }

    @Test
    void sameNameDifferentReferences_keepTheirOwnDepth() {
        Program p = Program.parse(
                "fun outer() {\n"
              + "  var x = \"outer\";\n"
              + "  fun f() { print x; }\n"
              + "  { var x = \"block\"; print x; }\n"
              + "  f();\n"
              + "}\n");
        resolve(p);

        FunctionStmt outer = (FunctionStmt) p.statements().get(0);
        List<Stmt> body = ((Block) outer.body).statements;
        assertTrue(body.get(0) instanceof VarStmt);

        FunctionStmt f = (FunctionStmt) body.get(1);
        PrintStmt inF = (PrintStmt) ((Block) f.body).statements.get(0);
        PrintStmt inBlock = (PrintStmt) ((Block) body.get(2)).statements.get(1);

        // f body block, f params, outer body block
        assertEquals(Integer.valueOf(2), interpreter.resolvedDepth(inF.expression));
        assertEquals(Integer.valueOf(0), interpreter.resolvedDepth(inBlock.expression));
    }
}
