import static com.tenda.script.ast.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenda.debug.Debug;
import com.tenda.debug.DebugLevel;
import com.tenda.script.ExecutionResult;
import com.tenda.script.TendaCli;
import com.tenda.script.TendaScript;
import com.tenda.script.runtime.Diagnostic;
import com.tenda.script.runtime.DiagnosticKind;
import com.tenda.script.runtime.Value;

public class TendaScriptTest {

    private RecordingPlatform out;
    private TendaScript engine;

    @BeforeEach
    void setUp() {
        out = new RecordingPlatform();
        engine = new TendaScript();
        engine.setPlatform(out);
    }

    // ===================== FACADE =====================

    @Test
    void successfulRunExposesValueAndGlobals() {
        ExecutionResult r = engine.run(module("main",
                let("x", num(2)),
                fn("dobro", params("n"), ret(mul(var("n"), num(2)))),
                expr(call("dobro", var("x")))));

        assertTrue(r.isSuccess());
        assertEquals("main", r.moduleId());
        assertEquals(4.0, r.valueOrThrow().asNumber());
        assertEquals(2.0, r.globals().get("x").asNumber());
        assertTrue(r.globals().containsKey("dobro"));
        assertFalse(r.globals().containsKey("exiba"));
        assertThrows(UnsupportedOperationException.class, () -> r.globals().put("y", Value.nil()));
    }

    @Test
    void failedRunNotifiesTheListener() {
        List<String> seen = new ArrayList<>();
        engine.setDiagnosticListener((moduleId, d) -> seen.add(moduleId + ":" + d.kind.code));

        ExecutionResult r = engine.run(module("main", let("y", num(1)), expr(var("z"))));

        assertFalse(r.isSuccess());
        assertTrue(r.value().isNil());
        assertEquals(1.0, r.globals().get("y").asNumber());
        assertThrows(IllegalStateException.class, r::valueOrThrow);
        assertEquals(List.of("main:undefined_variable"), seen);

        engine.run(module("main", expr(num(1))));
        assertEquals(1, seen.size());
    }

    @Test
    void runsAreIndependent() {
        engine.run(program(let("x", num(1))));
        ExecutionResult second = engine.run(program(let("x", num(2)), expr(var("x"))));

        assertTrue(second.isSuccess(), second::toString);
        assertEquals(2.0, second.value().asNumber());
    }

    @Test
    void hostFunctionsAndValues() {
        engine.registerFunction("soma_tudo", args -> {
            double total = 0;
            for (Value v : args) total += v.asNumber();
            return Value.number(total);
        });
        engine.registerFunction("saudacao", (ctx, args) -> Value.string("Olá, " + args.get(0).display()), "nome");
        engine.registerValue("VERSAO", Value.string("1.0"));

        ExecutionResult r = engine.run(program(expr(list(
                call("soma_tudo", num(1), num(2), num(3)),
                call("soma_tudo"),
                call("saudacao", str("Ana")),
                var("VERSAO")))));

        assertTrue(r.isSuccess(), r::toString);
        List<Value> values = r.value().asList();
        assertEquals(6.0, values.get(0).asNumber());
        assertEquals(0.0, values.get(1).asNumber());
        assertEquals("Olá, Ana", values.get(2).asString());
        assertEquals("1.0", values.get(3).asString());

        Diagnostic arity = engine.run(program(expr(call("saudacao")))).diagnostic();
        assertEquals(DiagnosticKind.ARITY_MISMATCH, arity.kind);
    }

    @Test
    void preludeIsFrozenByTheFirstRun() {
        engine.registerValue("A", Value.number(1));
        engine.run(program());

        assertThrows(IllegalStateException.class, () -> engine.registerValue("B", Value.number(2)));
        assertThrows(IllegalStateException.class, () -> engine.registerFunction("f", args -> Value.nil()));
        assertThrows(IllegalArgumentException.class, () -> new TendaScript().registerValue("exiba", Value.nil()));
    }

    @Test
    void hostFunctionsCanCallBackIntoScripts() {
        engine.registerFunction("aplica", (ctx, args) -> ctx.call(args.get(0), List.of(args.get(1))), "f", "x");

        ExecutionResult r = engine.run(program(
                expr(call("aplica", lambda(params("n"), ret(add(var("n"), num(1)))), num(41)))));

        assertEquals(42.0, r.valueOrThrow().asNumber());
    }

    @Test
    void callDepthSetting() {
        assertEquals(512, engine.getMaxCallDepth());
        assertThrows(IllegalArgumentException.class, () -> engine.setMaxCallDepth(0));

        engine.setMaxCallDepth(10);
        ExecutionResult deep = engine.run(program(
                fn("desce", params("n"), ifThen(gt(var("n"), num(0)), ret(call("desce", sub(var("n"), num(1)))))),
                expr(call("desce", num(9)))));
        assertTrue(deep.isSuccess(), deep::toString);

        ExecutionResult tooDeep = engine.run(program(
                fn("desce", params("n"), ifThen(gt(var("n"), num(0)), ret(call("desce", sub(var("n"), num(1)))))),
                expr(call("desce", num(10)))));
        assertEquals(DiagnosticKind.STACK_OVERFLOW, tooDeep.diagnostic().kind);
        assertTrue(tooDeep.diagnostic().isFatal());
    }

    @Test
    void runsAreLoggedThroughTheDebugHub() {
        List<String> logged = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> logged.add(level + " " + tag + " " + message));
        Debug.get().setThreshold(DebugLevel.DEBUG);
        try {
            engine.run(module("main", expr(var("z"))));
        } finally {
            Debug.get().setSink(null);
            Debug.get().setThreshold(null);
        }

        assertTrue(logged.contains("DEBUG TendaScript run start: main (1 statements)"), logged::toString);
        assertTrue(logged.stream().anyMatch(l -> l.startsWith("WARN TendaScript run failed: main")), logged::toString);
        assertTrue(logged.stream().noneMatch(l -> l.startsWith("TRACE")), logged::toString);
    }

    // ===================== CLI =====================

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private PrintStream savedOut;
    private PrintStream savedErr;

    @BeforeEach
    void captureStreams() {
        savedOut = System.out;
        savedErr = System.err;
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(savedOut);
        System.setErr(savedErr);
    }

    private static String utf8(ByteArrayOutputStream s) {
        return s.toString(StandardCharsets.UTF_8).trim();
    }

    private static Path write(Path dir, String name, String json) throws IOException {
        return Files.write(dir.resolve(name), json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void cliPrintsTheFinalValue(@TempDir Path dir) throws IOException {
        write(dir, "util.json", """
            [{"type": "export", "declaration": {"type": "let", "name": "base", "value": {"type": "literal", "value": 40}}}]
            """);
        Path main = write(dir, "main.json", """
            [{"type": "import", "module": "util"},
             {"type": "expr", "expression": {"type": "list", "elements": [
               {"type": "binary", "operator": "+", "left": {"type": "var", "name": "base"}, "right": {"type": "literal", "value": 2}},
               {"type": "literal", "value": "ok"}]}}]
            """);

        int code = TendaCli.run(new String[] {"--program=" + main});

        assertEquals(0, code, utf8(stderr));
        assertEquals("[42,\"ok\"]", utf8(stdout));
    }

    @Test
    void cliReportsDiagnosticsAsJson(@TempDir Path dir) throws IOException {
        Path main = write(dir, "main.json", """
            [{"type": "raise", "value": {"type": "literal", "value": "quebrou"}, "span": {"start": 0, "end": 5}}]
            """);

        int code = TendaCli.run(new String[] {"--program=" + main});

        assertEquals(1, code);
        JsonNode d = new ObjectMapper().readTree(utf8(stderr));
        assertEquals("user_raised", d.get("kind").asText());
        assertEquals("quebrou", d.get("payload").get("valor").asText());
        assertEquals("main", d.get("span").get("source").asText());
    }

    @Test
    void cliReportsValuesWithoutAJsonForm(@TempDir Path dir) throws IOException {
        Path main = write(dir, "main.json", """
            [{"type": "expr", "expression": {"type": "map", "entries": [
               {"key": {"type": "literal", "value": "1"}, "value": {"type": "literal", "value": "texto"}},
               {"key": {"type": "literal", "value": 1}, "value": {"type": "literal", "value": "número"}}]}}]
            """);

        int code = TendaCli.run(new String[] {"--program=" + main});

        assertEquals(1, code);
        assertEquals("", utf8(stdout));
        assertEquals("invalid_argument", new ObjectMapper().readTree(utf8(stderr)).get("kind").asText());
    }

    @Test
    void cliPrintsACyclicListWithoutCrashing(@TempDir Path dir) throws IOException {
        Path main = write(dir, "main.json", """
            [{"type": "let", "name": "l", "value": {"type": "list", "elements": []}},
             {"type": "expr", "expression": {"type": "call",
               "callee": {"type": "index", "target": {"type": "var", "name": "Lista"}, "index": {"type": "literal", "value": "insira"}},
               "arguments": [{"type": "var", "name": "l"}, {"type": "var", "name": "l"}]}},
             {"type": "expr", "expression": {"type": "var", "name": "l"}}]
            """);

        int code = TendaCli.run(new String[] {"--program=" + main});

        assertEquals(0, code, utf8(stderr));
        assertEquals("[\"[...]\"]", utf8(stdout));
    }

    @Test
    void cliUsageAndInputErrors(@TempDir Path dir) throws IOException {
        assertEquals(2, TendaCli.run(new String[0]));
        assertEquals(2, TendaCli.run(new String[] {"--program=" + dir.resolve("ausente.json")}));

        Path broken = write(dir, "ruim.json", "[{\"type\": \"nada\"}]");
        assertEquals(2, TendaCli.run(new String[] {"--program=" + broken}));

        Path fine = write(dir, "bom.json", "[]");
        assertEquals(2, TendaCli.run(new String[] {"--program=" + fine, "--max-call-depth=0"}));
        assertEquals(2, TendaCli.run(new String[] {"--program=" + fine, "--max-call-depth=muitos"}));
        assertEquals(0, TendaCli.run(new String[] {"--program=" + fine, "--max-call-depth=5", "--pretty"}));
        assertTrue(utf8(stdout).endsWith("null"));
    }

    @Test
    void cliVerboseLogsToStderr(@TempDir Path dir) throws IOException {
        Path fine = write(dir, "bom.json", "[]");
        try {
            assertEquals(0, TendaCli.run(new String[] {"--program=" + fine, "--verbose"}));
        } finally {
            Debug.get().setSink(null);
            Debug.get().setThreshold(null);
        }
        assertTrue(utf8(stderr).contains("DEBUG [TendaScript] run start: bom"), utf8(stderr));
    }
}
