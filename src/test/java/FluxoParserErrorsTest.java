import com.fluxo.script.errors.FluxoError;
import com.fluxo.script.errors.FluxoSyntaxError;
import com.fluxo.script.parser.Program;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FluxoParserErrorsTest {

    @Test
    public void unterminatedString_isAnchoredToItsLine() {
        String src = String.join("\n",
                "local a = 1",
                "local b = \"never closed",
                "console.log(a)");

        FluxoSyntaxError e = assertThrows(FluxoSyntaxError.class, () -> Program.parse("/s.fxo", src));
        assertEquals("SyntaxError", e.kind());
        assertTrue(e.getMessage().contains("Unterminated string"), e.getMessage());
        assertEquals(2, e.line());
        assertEquals("/s.fxo", e.sourceFile());
    }

    @Test
    public void unclosedBrace_reportsTheOpeningLine() {
        String src = String.join("\n",
                "function f() {",
                "  if (true) {",
                "    console.log(1)",
                "}");

        FluxoError e = assertThrows(FluxoSyntaxError.class, () -> Program.parse("/s.fxo", src));
        assertTrue(e.getMessage().startsWith("Unclosed '{'"), e.getMessage());
        assertEquals(1, e.line());
    }

    @Test
    public void moduleBlock_onlyAtTopLevel() {
        String src = "function f() { module inner { } }";
        FluxoError e = assertThrows(FluxoSyntaxError.class, () -> Program.parse("/s.fxo", src));
        assertEquals(1, e.line());
    }

    @Test
    public void secondModuleBlock_isRejected() {
        String src = "module a { }\nmodule b { }";
        FluxoError e = assertThrows(FluxoSyntaxError.class, () -> Program.parse("/m.fxm", src));
        assertEquals(2, e.line());
    }

    @Test
    public void exportList_inScript_parsesButIsNotAParseError() {
        assertDoesNotThrow(() -> Program.parse("/s.fxo", "local a = 1\nexport { a }"));
    }

    @Test
    public void restParameter_mustBeLast() {
        assertThrows(FluxoSyntaxError.class, () -> Program.parse("/s.fxo", "function f(...rest, a) { }"));
    }

    @Test
    public void keywordsInsideStrings_areJustText() {
        Program p = Program.parse("/s.fxo", "console.log(\"module x { export function }\")");
        assertEquals(1, p.statements.size());
        assertNull(p.moduleDeclaration());
    }

    @Test
    public void semicolonsAreOptional_andCommentsIgnored() {
        String src = String.join("\n",
                "// line comment",
                "local a = 1;",
                "local b = 2 /* block",
                "   comment */",
                "console.log(a + b)");
        Program p = Program.parse("/s.fxo", src);
        assertEquals(3, p.statements.size());
    }
}
