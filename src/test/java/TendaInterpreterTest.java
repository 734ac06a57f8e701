import static com.tenda.script.ast.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.tenda.script.ExecutionResult;
import com.tenda.script.TendaScript;
import com.tenda.script.ast.CaptureAnalyzer;
import com.tenda.script.ast.Expr;
import com.tenda.script.ast.Program;
import com.tenda.script.ast.SourceSpan;
import com.tenda.script.ast.Statement;
import com.tenda.script.ast.Statement.Stmt;
import com.tenda.script.runtime.AssociativeKey;
import com.tenda.script.runtime.ControlSignal;
import com.tenda.script.runtime.Diagnostic;
import com.tenda.script.runtime.DiagnosticKind;
import com.tenda.script.runtime.Environment;
import com.tenda.script.runtime.Interpreter;
import com.tenda.script.runtime.NativeFunction;
import com.tenda.script.runtime.Stack;
import com.tenda.script.runtime.Value;
import com.tenda.script.runtime.ValueCell;

public class TendaInterpreterTest {

    private final RecordingPlatform out = new RecordingPlatform();

    private ExecutionResult exec(Stmt... statements) {
        TendaScript engine = new TendaScript();
        engine.setPlatform(out);
        return engine.run(program(statements));
    }

    private Value ok(Stmt... statements) {
        ExecutionResult r = exec(statements);
        assertTrue(r.isSuccess(), r::toString);
        return r.value();
    }

    private Diagnostic fails(Stmt... statements) {
        ExecutionResult r = exec(statements);
        assertFalse(r.isSuccess(), "expected a failure, got " + r);
        return r.diagnostic();
    }

    // ===================== OPERATORS =====================

    @Test
    void arithmeticAndConcatenation() {
        assertEquals(7.0, ok(expr(add(num(3), mul(num(2), num(2))))).asNumber());
        assertEquals(1.0, ok(expr(mod(num(7), num(3)))).asNumber());
        assertEquals(8.0, ok(expr(binary(num(2), Expr.BinaryOperator.EXPONENT, num(3)))).asNumber());
        assertEquals("nota: 9.5", ok(expr(add(str("nota: "), num(9.5)))).asString());
        assertEquals("verdadeiro!", ok(expr(add(bool(true), str("!")))).asString());

        List<Value> joined = ok(expr(add(list(num(1)), list(num(2), num(3))))).asList();
        assertEquals(3, joined.size());
    }

    @Test
    void divisionAndModuloByZeroRaise() {
        assertEquals(DiagnosticKind.DIVISION_BY_ZERO, fails(expr(div(num(1), num(0)))).kind);
        assertEquals(DiagnosticKind.DIVISION_BY_ZERO, fails(expr(mod(num(1), num(0)))).kind);
    }

    @Test
    void incompatibleOperandsAreATypeMismatch() {
        Diagnostic d = fails(expr(sub(num(1), str("a"))));

        assertEquals(DiagnosticKind.TYPE_MISMATCH, d.kind);
        assertEquals("subtração", d.get("operação").asString());
        assertEquals("número", d.get("primeiro").asString());
        assertEquals("texto", d.get("segundo").asString());

        assertEquals(DiagnosticKind.TYPE_MISMATCH, fails(expr(lt(num(1), str("a")))).kind);
        assertEquals(DiagnosticKind.TYPE_MISMATCH, fails(expr(neg(str("a")))).kind);
        assertEquals(DiagnosticKind.TYPE_MISMATCH, fails(expr(call(num(1)))).kind);
    }

    @Test
    void comparisons() {
        assertTrue(ok(expr(lt(str("abacate"), str("banana")))).asBool());
        assertTrue(ok(expr(le(num(2), num(2)))).asBool());
        assertFalse(ok(expr(lt(var("NaN"), num(1)))).asBool());
        assertFalse(ok(expr(eq(var("NaN"), var("NaN")))).asBool());
        assertTrue(ok(expr(eq(list(num(1), list(num(2))), list(num(1), list(num(2)))))).asBool());
        assertTrue(ok(expr(eq(map(str("a"), num(1)), map(str("a"), num(1))))).asBool());
        assertFalse(ok(expr(eq(num(1), str("1")))).asBool());
    }

    @Test
    void logicalOperatorsShortCircuitAndYieldOperands() {
        assertEquals("x", ok(expr(or(nil(), str("x")))).asString());
        assertEquals(0.0, ok(expr(and(num(0), call("inexistente")))).asNumber());
        assertFalse(ok(expr(and(bool(false), call("inexistente")))).asBool());
        assertTrue(ok(expr(not(num(0)))).asBool());
        assertEquals("sim", ok(expr(cond(list(), str("sim"), str("não")))).asString());
    }

    @Test
    void membershipOperators() {
        assertTrue(ok(expr(binary(list(num(1), num(2)), Expr.BinaryOperator.HAS, num(2)))).asBool());
        assertTrue(ok(expr(binary(map(str("a"), num(1)), Expr.BinaryOperator.HAS, str("a")))).asBool());
        assertTrue(ok(expr(binary(list(), Expr.BinaryOperator.LACKS, num(1)))).asBool());
    }

    // ===================== INDEXING =====================

    @Test
    void indexingListsTextsAndMaps() {
        assertEquals(20.0, ok(expr(index(list(num(10), num(20)), num(1)))).asNumber());
        assertEquals("á", ok(expr(index(str("olá"), num(2)))).asString());
        assertEquals(1.0, ok(expr(field(map(str("a"), num(1), num(2), num(3)), "a"))).asNumber());
        assertEquals(3.0, ok(expr(index(map(str("a"), num(1), num(2), num(3)), num(2)))).asNumber());
    }

    @Test
    void badIndexesRaise() {
        Diagnostic out = fails(expr(index(list(num(1)), num(3))));
        assertEquals(DiagnosticKind.INDEX_OUT_OF_BOUNDS, out.kind);
        assertEquals(3.0, out.get("índice").asNumber());
        assertEquals(1.0, out.get("tamanho").asNumber());

        assertEquals(DiagnosticKind.INVALID_INDEX, fails(expr(index(list(num(1)), num(0.5)))).kind);
        assertEquals(DiagnosticKind.INVALID_INDEX, fails(expr(index(list(num(1)), num(-1)))).kind);
        assertEquals(DiagnosticKind.KEY_NOT_FOUND, fails(expr(field(map(), "ausente"))).kind);
        assertEquals(DiagnosticKind.INVALID_MAP_KEY, fails(expr(map(list(), num(1)))).kind);
    }

    @Test
    void indexAssignment() {
        Value v = ok(
                let("xs", list(num(1), num(2))),
                let("m", map()),
                expr(assignIndex(var("xs"), num(0), num(9))),
                expr(assignIndex(var("m"), str("k"), str("v"))),
                expr(list(index(var("xs"), num(0)), field(var("m"), "k"))));

        assertEquals(9.0, v.asList().get(0).asNumber());
        assertEquals("v", v.asList().get(1).asString());

        assertEquals(DiagnosticKind.IMMUTABLE_STRING,
                fails(let("t", str("abc")), expr(assignIndex(var("t"), num(0), str("z")))).kind);
        assertEquals(DiagnosticKind.INDEX_OUT_OF_BOUNDS,
                fails(let("xs", list()), expr(assignIndex(var("xs"), num(0), num(1)))).kind);
    }

    @Test
    void listsAreSharedByReference() {
        Value v = ok(
                let("a", list(num(1))),
                let("b", var("a")),
                expr(call(field(var("Lista"), "insira"), var("b"), num(2))),
                expr(call(field(var("Lista"), "tamanho"), var("a"))));

        assertEquals(2.0, v.asNumber());
    }

    // ===================== STATEMENTS =====================

    @Test
    void declarationsAndScopes() {
        Diagnostic twice = fails(let("x", num(1)), let("x", num(2)));
        assertEquals(DiagnosticKind.ALREADY_DECLARED, twice.kind);

        Value shadowed = ok(
                let("x", num(1)),
                block(let("x", num(2)), expr(assign("x", num(3)))),
                expr(var("x")));
        assertEquals(1.0, shadowed.asNumber());

        Diagnostic undefined = fails(expr(var("fantasma")));
        assertEquals(DiagnosticKind.UNDEFINED_VARIABLE, undefined.kind);
        assertEquals("fantasma", undefined.get("nome").asString());

        assertTrue(ok(let("x", null), expr(var("x"))).isNil());
    }

    @Test
    void loopsWithBreakAndContinue() {
        // soma dos ímpares até 7
        Value v = ok(
                let("i", num(0)),
                let("soma", num(0)),
                whileLoop(bool(true),
                        expr(assign("i", add(var("i"), num(1)))),
                        ifThen(gt(var("i"), num(7)), brk()),
                        ifThen(eq(mod(var("i"), num(2)), num(0)), cont()),
                        expr(assign("soma", add(var("soma"), var("i"))))),
                expr(var("soma")));

        assertEquals(16.0, v.asNumber());

        Value range = ok(
                let("total", num(0)),
                forEach("n", range(num(1), num(4)), expr(assign("total", add(var("total"), var("n"))))),
                expr(var("total")));
        assertEquals(10.0, range.asNumber());
    }

    @Test
    void forEachRejectsNonIterablesAndBadRanges() {
        assertEquals(DiagnosticKind.NOT_ITERABLE, fails(forEach("x", num(3))).kind);
        assertEquals(DiagnosticKind.INVALID_RANGE_BOUNDS, fails(expr(range(num(1), num(2.5)))).kind);
    }

    @Test
    void programResult() {
        assertTrue(ok().isNil());
        assertEquals(2.0, ok(expr(num(1)), expr(num(2)), let("x", num(3))).asNumber());
        assertEquals(7.0, ok(ret(num(7)), expr(num(8))).asNumber());
        // a stray interrompa just ends the program
        assertEquals(1.0, ok(expr(num(1)), brk(), expr(num(2))).asNumber());
    }

    // ===================== CALLS =====================

    @Test
    void defaultsAreEvaluatedInTheCallFrame() {
        Value v = ok(
                fn("f", signature(param("a"), param("b", mul(var("a"), num(2)))), ret(list(var("a"), var("b")))),
                expr(list(call("f", num(3)), call("f", num(3), num(1)))));

        assertEquals(6.0, v.asList().get(0).asList().get(1).asNumber());
        assertEquals(1.0, v.asList().get(1).asList().get(1).asNumber());
    }

    @Test
    void variadicParameterCollectsTheRest() {
        Value v = ok(
                fn("conta", signature(param("primeiro"), variadic("resto")), ret(var("resto"))),
                expr(list(call("conta", num(1), num(2), num(3)), call("conta", num(1)))));

        assertEquals(2, v.asList().get(0).asList().size());
        assertEquals(0, v.asList().get(1).asList().size());

        Diagnostic d = fails(
                fn("conta", signature(param("primeiro"), variadic("resto")), ret(var("resto"))),
                expr(call("conta")));
        assertEquals(DiagnosticKind.ARITY_MISMATCH, d.kind);
        assertTrue(d.get("esperado").isNil());
        assertEquals(1.0, d.get("mínimo").asNumber());
    }

    @Test
    void arityMismatchRunsNothingFromTheBody() {
        ExecutionResult r = exec(
                let("efeitos", num(0)),
                fn("f", params("a", "b"), expr(assign("efeitos", add(var("efeitos"), num(1))))),
                expr(call("f", num(1))));

        assertFalse(r.isSuccess());
        assertEquals(DiagnosticKind.ARITY_MISMATCH, r.diagnostic().kind);
        assertEquals(2.0, r.diagnostic().get("esperado").asNumber());
        assertEquals(1.0, r.diagnostic().get("encontrado").asNumber());
        assertEquals(0.0, r.globals().get("efeitos").asNumber());
    }

    @Test
    void functionWithoutReturnYieldsNada() {
        assertTrue(ok(fn("f", params()), expr(call("f"))).isNil());
    }

    // ===================== ERRORS =====================

    @Test
    void userRaisedValueIsBoundInTheHandler() {
        Value v = ok(
                let("capturado", nil()),
                tryCatch(block(raise(str("falhou")), expr(assign("capturado", str("não chega")))),
                        "erro", block(expr(assign("capturado", var("erro"))))),
                expr(var("capturado")));

        assertEquals("falhou", v.asString());
    }

    @Test
    void runtimeErrorsAreBoundAsMaps() {
        Value v = ok(
                let("capturado", nil()),
                tryCatch(block(expr(var("fantasma"))),
                        "erro", block(expr(assign("capturado", var("erro"))))),
                expr(var("capturado")));

        assertEquals("undefined_variable", v.asMap().get(AssociativeKey.of("tipo")).asString());
        assertEquals("fantasma", v.asMap().get(AssociativeKey.of("nome")).asString());
    }

    @Test
    void errorInsideALoopIsCaughtAndExecutionContinues() {
        Value v = ok(
                let("falhas", num(0)),
                let("soma", num(0)),
                forEach("i", range(num(1), num(4)),
                        tryCatch(block(
                                        ifThen(eq(mod(var("i"), num(2)), num(0)), raise(var("i"))),
                                        expr(assign("soma", add(var("soma"), var("i"))))),
                                "e", block(expr(assign("falhas", add(var("falhas"), var("e"))))))),
                expr(list(var("soma"), var("falhas"))));

        assertEquals(4.0, v.asList().get(0).asNumber());
        assertEquals(6.0, v.asList().get(1).asNumber());
    }

    @Test
    void recursionCeilingCannotBeCaught() {
        TendaScript engine = new TendaScript();
        engine.setPlatform(out);
        engine.setMaxCallDepth(50);

        ExecutionResult r = engine.run(program(
                let("tratado", bool(false)),
                let("depois", bool(false)),
                fn("r", params("n"), ret(call("r", add(var("n"), num(1))))),
                tryCatch(block(expr(call("r", num(0)))), "e", block(expr(assign("tratado", bool(true))))),
                expr(assign("depois", bool(true)))));

        assertFalse(r.isSuccess());
        assertEquals(DiagnosticKind.STACK_OVERFLOW, r.diagnostic().kind);
        assertEquals(50.0, r.diagnostic().get("limite").asNumber());
        assertEquals(50, r.diagnostic().stacktrace().size());
        assertFalse(r.globals().get("tratado").asBool());
        assertFalse(r.globals().get("depois").asBool());
    }

    @Test
    void defaultCeilingIsReachableByPlainRecursion() {
        Stmt soma = fn("soma", params("n"),
                ifElse(eq(var("n"), num(0)),
                        ret(num(0)),
                        ret(add(var("n"), call("soma", sub(var("n"), num(1)))))));
        TendaScript engine = new TendaScript();
        engine.setPlatform(out);
        assertEquals(Stack.DEFAULT_MAX_CALL_DEPTH, engine.getMaxCallDepth());

        // 511 nested calls
        ExecutionResult deep = engine.run(program(soma, expr(call("soma", num(510)))));
        assertTrue(deep.isSuccess(), () -> String.valueOf(deep.diagnostic()));
        assertEquals(130305.0, deep.value().asNumber());

        ExecutionResult over = engine.run(program(soma, expr(call("soma", num(600)))));
        assertFalse(over.isSuccess());
        assertEquals(DiagnosticKind.STACK_OVERFLOW, over.diagnostic().kind);
        assertEquals((double) Stack.DEFAULT_MAX_CALL_DEPTH, over.diagnostic().get("limite").asNumber());
        assertEquals(Stack.DEFAULT_MAX_CALL_DEPTH, over.diagnostic().stacktrace().size());
        assertEquals("soma", over.diagnostic().stacktrace().get(0).functionName);
    }

    @Test
    void zeroAndNegativeZeroAreOneValue() {
        Value zero = Value.number(0.0);
        Value negativeZero = ok(expr(neg(num(0))));

        assertEquals(zero, negativeZero);
        assertEquals(zero.hashCode(), negativeZero.hashCode());
        assertEquals(1, new HashSet<>(Arrays.asList(zero, negativeZero)).size());
    }

    @Test
    void hostExceptionsReachTheCaller() {
        TendaScript engine = new TendaScript();
        engine.setPlatform(out);
        engine.registerFunction("quebra_host", args -> {
            throw new UnsupportedOperationException("host");
        });

        UnsupportedOperationException e = assertThrows(UnsupportedOperationException.class,
                () -> engine.run(program(expr(call("quebra_host")))));
        assertEquals("host", e.getMessage());
    }

    @Test
    void tentePassesReturnThrough() {
        Value v = ok(
                fn("f", params(), tryCatch(block(ret(num(1))), "e", block(ret(num(2)))), ret(num(3))),
                expr(call("f")));
        assertEquals(1.0, v.asNumber());
    }

    @Test
    void diagnosticsCarryTheInnermostSpanAndACallTrace() {
        SourceSpan raiseAt = new SourceSpan(3, 8, "main");
        SourceSpan callAt = new SourceSpan(20, 30, "main");

        Diagnostic d = fails(
                fn("interna", params(), new Statement.RaiseStmt(str("x"), raiseAt)),
                fn("externa", params(), expr(new Expr.Call(var("interna"), new ArrayList<>(), callAt))),
                expr(call("externa")));

        assertEquals(DiagnosticKind.USER_RAISED, d.kind);
        assertEquals(raiseAt, d.span());
        assertEquals(2, d.stacktrace().size());
        assertEquals("interna", d.stacktrace().get(0).functionName);
        assertEquals(callAt, d.stacktrace().get(0).callSite);
        assertEquals("externa", d.stacktrace().get(1).functionName);
    }

    @Test
    void anonymousFunctionsAreNamedInTraces() {
        Diagnostic d = fails(
                let("f", lambda(params(), raise(num(1)))),
                expr(call("f")));
        assertEquals("<anônima>", d.stacktrace().get(0).functionName);
    }

    // ===================== FRAMES =====================

    @Test
    void framesBalanceOnEveryExitPath() {
        Environment base = new Environment();
        Stack stack = new Stack(base);
        List<Integer> depths = new ArrayList<>();
        base.declare("sonda", ValueCell.owned(Value.nativeFunction(NativeFunction.of("sonda", (ctx, args) -> {
            depths.add(stack.depth());
            return Value.nil();
        }))));
        Interpreter interpreter = new Interpreter(stack, out, null);

        Program p = program(
                fn("retorna_cedo", params(), whileLoop(bool(true), ret(num(1)))),
                fn("falha", params(), block(raise(str("x")))),
                whileLoop(bool(true), brk()),
                forEach("i", range(num(1), num(3)), cont()),
                expr(call("retorna_cedo")),
                tryCatch(block(expr(call("falha"))), "e", block(expr(call("sonda")))),
                block(block(expr(call("sonda")))));
        CaptureAnalyzer.annotate(p);

        ControlSignal sig = interpreter.run(p);

        assertTrue(sig.isNormal(), sig::toString);
        assertEquals(0, stack.depth());
        assertEquals(0, stack.callDepth());
        assertEquals(List.of(3, 3), depths);

        ControlSignal raised = interpreter.run(CaptureAnalyzer.annotate(program(expr(call("falha")))));
        assertTrue(raised.isRaised());
        assertEquals(0, stack.depth());
    }

    @Test
    void displayForms() {
        ok(
                expr(call("exiba", num(3))),
                expr(call("exiba", num(0.25))),
                expr(call("exiba", list(num(1), str("a"), nil(), bool(false)))),
                expr(call("exiba", map(str("a"), num(1), num(2), str("b")))),
                expr(call("exiba", range(num(1), num(3)))),
                fn("f", params()),
                expr(call("exiba", var("f"))),
                expr(call("exiba", div(num(1), var("infinito")))),
                expr(call("exiba", var("infinito"))));

        assertEquals(List.of(
                "3",
                "0.25",
                "[1, \"a\", Nada, falso]",
                "{ \"a\": 1, 2: \"b\" }",
                "1 até 3",
                "<função f>",
                "0",
                "infinito"), out.lines);
    }
}
