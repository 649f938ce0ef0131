import com.fluxo.script.ExecuteResult;
import com.fluxo.script.FluxoScript;
import com.fluxo.script.SourceFile;
import com.fluxo.script.output.OutputEvent;
import com.fluxo.script.output.OutputKind;
import com.fluxo.script.parser.Value;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FluxoEvaluatorTest {

    private static List<String> messages(List<OutputEvent> events) {
        List<String> out = new ArrayList<>();
        for (OutputEvent e : events) out.add(e.message());
        return out;
    }

    @Test
    public void plus_concatenatesWhenEitherSideIsText() {
        FluxoScript es = new FluxoScript();
        List<OutputEvent> events = es.run(String.join("\n",
                "console.log(\"I'm \" + \"Taylor\")",
                "console.log(2 + 3)",
                "console.log(\"n=\" + 5)",
                "console.log(1 + 2 + \"x\")",
                "console.log(\"x\" + 1 + 2)",
                "function greet(n) { return \"hi \" + n }",
                "console.log(greet(true))"));

        assertEquals(List.of("I'm Taylor", "5", "n=5", "3x", "x12", "hi true"), messages(events));
    }

    @Test
    public void consoleLog_joinsArgumentsWithOneSpace() {
        List<OutputEvent> events = new FluxoScript().run(
                "console.log(\"a\", 1, true, null, [1, \"b\"], { k: 2 })");

        assertEquals(1, events.size());
        OutputEvent e = events.get(0);
        assertEquals(OutputKind.LOG, e.kind());
        assertEquals("a 1 true null [1,\"b\"] {\"k\":2}", e.message());
        assertEquals("/main.fxo", e.sourceFile());
        assertEquals(1, e.line());
    }

    @Test
    public void consoleKinds_mapToEventKinds() {
        List<OutputEvent> events = new FluxoScript().run(String.join("\n",
                "console.info(\"i\")",
                "console.warn(\"w\")",
                "console.error(\"e\")",
                "console.success(\"s\")"));

        assertEquals(OutputKind.LOG, events.get(0).kind());
        assertEquals(OutputKind.WARNING, events.get(1).kind());
        assertEquals(OutputKind.ERROR, events.get(2).kind());
        assertEquals(OutputKind.SUCCESS, events.get(3).kind());
    }

    @Test
    public void numbersPrintWithoutTrailingZeros() {
        List<OutputEvent> events = new FluxoScript().run(String.join("\n",
                "console.log(10 / 4)",
                "console.log(6 / 2)",
                "console.log(1 / 0)",
                "console.log(-7)"));
        assertEquals(List.of("2.5", "3", "Infinity", "-7"), messages(events));
    }

    @Test
    public void comparisons_numericAndLexicographic() {
        List<OutputEvent> events = new FluxoScript().run(String.join("\n",
                "console.log(2 < 10)",
                "console.log(\"2\" < \"10\")",
                "console.log(\"apple\" < \"banana\")",
                "console.log(1 == \"1\")",
                "console.log(null == undefined)"));
        assertEquals(List.of("true", "false", "true", "false", "true"), messages(events));
    }

    @Test
    public void closures_captureByReference() {
        List<OutputEvent> events = new FluxoScript().run(String.join("\n",
                "function counter() {",
                "  local n = 0",
                "  return function() { n = n + 1; return n }",
                "}",
                "local c = counter()",
                "c()",
                "c()",
                "console.log(c())"));
        assertEquals(List.of("3"), messages(events));
    }

    @Test
    public void restParameter_collectsRemainingArguments() {
        List<OutputEvent> events = new FluxoScript().run(String.join("\n",
                "function f(first, ...rest) { return first + \":\" + rest.length + \":\" + rest.join(\"-\") }",
                "console.log(f(1, 2, 3, 4))",
                "console.log(f(1))"));
        assertEquals(List.of("1:3:2-3-4", "1:0:"), messages(events));
    }

    @Test
    public void loops_forWhileBreakContinue() {
        List<OutputEvent> events = new FluxoScript().run(String.join("\n",
                "local s = 0",
                "for (local i = 0; i < 10; i = i + 1) {",
                "  if (i == 3) { continue }",
                "  if (i == 6) { break }",
                "  s = s + i",
                "}",
                "local k = 0",
                "while (k < 4) { k = k + 1 }",
                "console.log(s, k)"));
        assertEquals(List.of("12 4"), messages(events));
    }

    @Test
    public void functionDeclarations_areHoisted() {
        List<OutputEvent> events = new FluxoScript().run("console.log(twice(4))\nfunction twice(x) { return x * 2 }");
        assertEquals(List.of("8"), messages(events));
    }

    @Test
    public void wait_runsAfterFollowingStatements() {
        List<OutputEvent> events = new FluxoScript().run(
                "wait(1) { console.log(\"A\") }\nconsole.log(\"B\")");
        assertEquals(List.of("B", "A"), messages(events));
        assertTrue(events.get(1).timestamp() - events.get(0).timestamp() >= 1000);
    }

    @Test
    public void wait_nestedDelaysAreRelativeToTheirBlock() {
        List<OutputEvent> events = new FluxoScript().run(String.join("\n",
                "wait(1) {",
                "  console.log(\"outer\")",
                "  wait(0.5) { console.log(\"inner\") }",
                "}",
                "wait(1.2) { console.log(\"middle\") }",
                "wait(2) { console.log(\"last\") }"));
        // inner is due at 1.5s, after middle at 1.2s
        assertEquals(List.of("outer", "middle", "inner", "last"), messages(events));
    }

    @Test
    public void wait_bodySeesItsLexicalScope() {
        List<OutputEvent> events = new FluxoScript().run(String.join("\n",
                "local x = 1",
                "wait(0.1) { console.log(x) }",
                "x = 2"));
        assertEquals(List.of("2"), messages(events));
    }

    @Test
    public void strictMode_rejectsUndeclaredAssignment() {
        List<OutputEvent> events = new FluxoScript().run("y = 5\nconsole.log(\"after\")");

        assertEquals(1, events.size());
        assertEquals(OutputKind.ERROR, events.get(0).kind());
        assertTrue(events.get(0).message().startsWith("ReferenceError:"), events.get(0).message());
        assertEquals(1, events.get(0).line());
    }

    @Test
    public void compatMode_createsAGlobal() {
        FluxoScript es = new FluxoScript();
        es.setMode(FluxoScript.Mode.COMPAT);
        List<OutputEvent> events = es.run("function set() { y = 5 }\nset()\nconsole.log(y)");
        assertEquals(List.of("5"), messages(events));
    }

    @Test
    public void undefinedVariable_isReferenceError_andSiblingFilesStillRun() {
        ExecuteResult r = new FluxoScript().execute(List.of(
                new SourceFile("/a.fxo", "console.log(\"a1\")\nconsole.log(missing)\nconsole.log(\"a2\")"),
                new SourceFile("/b.fxo", "console.log(\"b\")")), "/a.fxo");

        assertEquals(List.of("a1", "ReferenceError: missing is not defined", "b"), messages(r.events()));
        OutputEvent err = r.events().get(1);
        assertEquals("/a.fxo", err.sourceFile());
        assertEquals(2, err.line());
        assertNull(r.error());
    }

    @Test
    public void callingNonFunction_isTypeError() {
        List<OutputEvent> events = new FluxoScript().run("local n = 3\nn()");
        assertEquals(1, events.size());
        assertTrue(events.get(0).message().startsWith("TypeError: n is not a function"), events.get(0).message());
    }

    @Test
    public void runawayRecursion_isReportedNotFatal() {
        FluxoScript es = new FluxoScript();
        es.setMaxCallDepth(50);
        List<OutputEvent> events = es.run("function f(n) { return f(n + 1) }\nf(0)");
        assertEquals(1, events.size());
        assertTrue(events.get(0).message().startsWith("RangeError:"), events.get(0).message());
    }

    @Test
    public void hostFunctions_areCallable_andFailuresBecomeHostErrors() {
        FluxoScript es = new FluxoScript();
        es.registerFunction("double", args -> Value.number(args.get(0).asNumber() * 2));
        es.registerFunction("boom", args -> { throw new IllegalStateException("nope"); });

        List<OutputEvent> events = es.run("console.log(double(21))\nboom()");
        assertEquals("42", events.get(0).message());
        assertEquals("HostError: boom() failed: nope", events.get(1).message());
    }

    @Test
    public void selectElementStub_logsHandlerRegistration() {
        List<OutputEvent> events = new FluxoScript().run(
                "local btn = selectElement(\"#go\")\nbtn.onClick(function() { console.log(\"clicked\") })");
        assertEquals(List.of("Event handler registered for #go: onClick"), messages(events));
    }

    @Test
    public void topLevelReturn_endsTheFileQuietly() {
        List<OutputEvent> events = new FluxoScript().run("console.log(1)\nreturn\nconsole.log(2)");
        assertEquals(List.of("1"), messages(events));
    }

    @Test
    public void textToNumber_acceptsOnlyNumericLiterals() {
        assertEquals(1000.0, Value.string(" 1e3 ").toNumber());
        assertEquals(-2.5, Value.string("-2.5").toNumber());
        assertEquals(0.5, Value.string(".5").toNumber());
        assertEquals(16.0, Value.string("0x10").toNumber());
        assertEquals(Double.POSITIVE_INFINITY, Value.string("Infinity").toNumber());
        assertEquals(0.0, Value.string("").toNumber());

        assertTrue(Double.isNaN(Value.string("1d").toNumber()));
        assertTrue(Double.isNaN(Value.string("2f").toNumber()));
        assertTrue(Double.isNaN(Value.string("0x1p3").toNumber()));
        assertTrue(Double.isNaN(Value.string("1_000").toNumber()));

        List<OutputEvent> events = new FluxoScript().run("console.log(\"1d\" - 0, \"4\" * \"2\")");
        assertEquals(List.of("NaN 8"), messages(events));
    }
}
