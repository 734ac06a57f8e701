import static com.tenda.script.ast.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Collections;

import org.junit.jupiter.api.Test;

import com.tenda.script.ast.CaptureAnalyzer;
import com.tenda.script.ast.Expr;
import com.tenda.script.ast.FunctionParam;
import com.tenda.script.ast.Program;
import com.tenda.script.ast.Statement;

public class TendaCaptureAnalyzerTest {

    @Test
    void localReferencesMarkNothing() {
        Statement.VarStmt x = let("x", num(1));
        Expr.Variable read = var("x");

        CaptureAnalyzer.annotate(program(x, block(expr(read))));

        assertFalse(x.captured);
        assertFalse(read.captured);
    }

    @Test
    void referenceFromANestedFunctionMarksTheDeclaration() {
        Statement.VarStmt x = let("x", num(1));
        Expr.Variable read = var("x");
        Statement.VarStmt y = let("y", num(2));

        CaptureAnalyzer.annotate(program(
                fn("externa", params(), x, y, expr(lambda(params(), ret(read))))));

        assertTrue(x.captured);
        assertTrue(read.captured);
        assertFalse(y.captured);
    }

    @Test
    void assignmentAlsoCaptures() {
        Statement.VarStmt total = let("total", num(0));
        CaptureAnalyzer.annotate(program(
                total,
                fn("soma", params("n"), expr(assign("total", add(var("total"), var("n")))))));

        assertTrue(total.captured);
    }

    @Test
    void parametersAndLoopItemsAreDeclarations() {
        FunctionParam n = param("n");
        FunctionParam unused = param("m");
        Statement.ForEach loop = forEach("i", range(num(1), num(3)), expr(lambda(params(), ret(var("i")))));

        CaptureAnalyzer.annotate(program(
                fn("f", signature(n, unused), ret(lambda(params(), ret(var("n"))))),
                loop));

        assertTrue(n.captured);
        assertFalse(unused.captured);
        assertTrue(loop.itemCaptured);
    }

    @Test
    void shadowingInsideTheClosureStopsTheSearch() {
        Statement.VarStmt outer = let("x", num(1));
        CaptureAnalyzer.annotate(program(
                outer,
                fn("f", params(), let("x", num(2)), ret(var("x")))));

        assertFalse(outer.captured);

        FunctionParam shadow = param("x");
        Statement.VarStmt again = let("x", num(1));
        CaptureAnalyzer.annotate(program(again, fn("g", signature(shadow), ret(var("x")))));
        assertFalse(again.captured);
    }

    @Test
    void forwardReferencesMarkNothing() {
        Statement.FunctionStmt later = fn("depois", params(), ret(num(1)));
        CaptureAnalyzer.annotate(program(
                fn("antes", params(), ret(call("depois"))),
                later));

        assertFalse(later.captured);
    }

    @Test
    void selfReferenceMarksTheFunctionsOwnBinding() {
        Statement.FunctionStmt direct = fn("f", params("n"), ret(call("f", var("n"))));
        CaptureAnalyzer.annotate(program(direct));
        // the body sees the self-name of its own frame
        assertFalse(direct.selfCaptured);

        Statement.FunctionStmt nested = fn("g", params(), ret(lambda(params(), ret(call("g")))));
        CaptureAnalyzer.annotate(program(nested));
        assertTrue(nested.selfCaptured);
    }

    @Test
    void handlerNameAndImportedNames() {
        Statement.TryStmt tente = tryCatch(block(raise(num(1))), "e",
                block(expr(lambda(params(), ret(var("e"))))));
        Statement.ImportStmt imp = importNames("util", "a", "b");

        CaptureAnalyzer.annotate(program(
                tente,
                imp,
                fn("usa", params(), ret(var("b")))));

        assertTrue(tente.errorCaptured);
        assertEquals(Collections.singleton("b"), imp.capturedNames);
    }

    @Test
    void annotatingTwiceIsHarmless() {
        Statement.VarStmt x = let("x", num(1));
        Program p = program(x, fn("f", params(), ret(var("x"))));

        assertSame(p, CaptureAnalyzer.annotate(p));
        assertSame(p, CaptureAnalyzer.annotate(p));
        assertTrue(x.captured);
    }
}
