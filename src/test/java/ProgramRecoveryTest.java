import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.lux.script.parser.AstPrinter;
import com.lux.script.parser.Program;

public class ProgramRecoveryTest {

    @Test
    void validProgram() {
        Program p = Program.parse("var a = 1; print a;");
        assertFalse(p.hasErrors());
        assertEquals(2, p.statements().size());
    }

    @Test
    void topLevel_skipsToNextSemicolonAndKeepsGoing() {
        Program p = Program.parse("var = 1; print 2; var x = ; print 3;");
        assertEquals(2, p.diagnostics().size());
        assertEquals("(print 2)\n(print 3)", new AstPrinter().print(p.statements()));
    }

    @Test
    void insideBlock_oneBadStatementIsOneDiagnostic() {
        Program p = Program.parse("{ var a = ; print 1; }");
        assertEquals(1, p.diagnostics().size());
        assertEquals(1, p.statements().size());
        assertEquals("(block (print 1))", new AstPrinter().print(p.statements()));
    }

    @Test
    void insideBlock_recoveryStopsAtClosingBrace() {
        Program p = Program.parse("fun f() { print 1 } print 2;");
        assertEquals(1, p.diagnostics().size());
        assertEquals("Expected ; got }", p.diagnostics().get(0).message);
        assertEquals("(fun f () (block))\n(print 2)", new AstPrinter().print(p.statements()));
    }

    @Test
    void invalidAssignmentTarget_keepsTheStatement() {
        Program p = Program.parse("1 = 2; print 3;");
        assertEquals(1, p.diagnostics().size());
        assertEquals("(; 1)\n(print 3)", new AstPrinter().print(p.statements()));
    }

    @Test
    void errorAtEndOfInput() {
        Program p = Program.parse("print (1 + 2");
        assertEquals(1, p.diagnostics().size());
        assertEquals("Expected ) got EOF", p.diagnostics().get(0).message);
        assertTrue(p.statements().isEmpty());
    }

    @Test
    void emptySource() {
        Program p = Program.parse("");
        assertFalse(p.hasErrors());
        assertTrue(p.statements().isEmpty());
    }
}
