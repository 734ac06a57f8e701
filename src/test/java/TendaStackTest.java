import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.tenda.script.runtime.DiagnosticKind;
import com.tenda.script.runtime.Environment;
import com.tenda.script.runtime.RuntimeError;
import com.tenda.script.runtime.Stack;
import com.tenda.script.runtime.StackFrame;
import com.tenda.script.runtime.Value;
import com.tenda.script.runtime.ValueCell;

public class TendaStackTest {

    private static ValueCell owned(double d) {
        return ValueCell.owned(Value.number(d));
    }

    @Test
    void nestedFrameMayShadowButNotRedeclare() {
        Stack stack = new Stack();
        stack.declare("x", owned(1));

        RuntimeError again = assertThrows(RuntimeError.class, () -> stack.declare("x", owned(9)));
        assertEquals(DiagnosticKind.ALREADY_DECLARED, again.diagnostic.kind);

        stack.push(StackFrame.block());
        stack.declare("x", owned(2));
        assertEquals(2.0, stack.lookup("x").asNumber());
        stack.pop();

        assertEquals(1.0, stack.lookup("x").asNumber());
        assertEquals(0, stack.depth());
    }

    @Test
    void assignmentReachesTheNearestBinding() {
        Stack stack = new Stack();
        stack.declare("x", owned(1));
        stack.push(StackFrame.block());
        stack.assign("x", Value.number(5));
        stack.pop();

        assertEquals(5.0, stack.lookup("x").asNumber());
    }

    @Test
    void callFrameDoesNotSeeTheCallersFrames() {
        Stack stack = new Stack();
        stack.declare("g", owned(1));
        stack.push(StackFrame.block());
        stack.declare("local", owned(5));

        stack.push(StackFrame.call("f", new Environment(), stack.globals()));
        assertNull(stack.resolve("local"));
        assertEquals(1.0, stack.lookup("g").asNumber());

        RuntimeError e = assertThrows(RuntimeError.class, () -> stack.lookup("local"));
        assertEquals(DiagnosticKind.UNDEFINED_VARIABLE, e.diagnostic.kind);
        assertEquals("local", e.diagnostic.get("nome").asString());

        stack.pop();
        assertEquals(5.0, stack.lookup("local").asNumber());
    }

    @Test
    void calleeResolvesGlobalsOfItsHomeModule() {
        Environment otherModule = new Environment();
        otherModule.declare("m", owned(7));

        Stack stack = new Stack();
        stack.push(StackFrame.call("importada", new Environment(), otherModule));

        assertEquals(7.0, stack.lookup("m").asNumber());
        assertSame(otherModule, stack.currentHome());
        assertEquals("importada", stack.currentFunctionName());
        assertFalse(stack.globals().has("m"));
    }

    @Test
    void baseBindingsCanBeShadowedButNotAssigned() {
        Environment base = new Environment();
        base.declare("pi", owned(3.14));
        Stack stack = new Stack(base);

        assertEquals(3.14, stack.lookup("pi").asNumber());

        RuntimeError e = assertThrows(RuntimeError.class, () -> stack.assign("pi", Value.number(3)));
        assertEquals(DiagnosticKind.REASSIGN_BUILTIN, e.diagnostic.kind);
        assertEquals(3.14, base.lookup("pi").read().asNumber());

        stack.declare("pi", owned(3));
        stack.assign("pi", Value.number(4));
        assertEquals(4.0, stack.lookup("pi").asNumber());
        assertEquals(3.14, base.lookup("pi").read().asNumber());
    }

    @Test
    void unknownNameIsUndefinedOnAssign() {
        Stack stack = new Stack();
        RuntimeError e = assertThrows(RuntimeError.class, () -> stack.assign("nada", Value.nil()));
        assertEquals(DiagnosticKind.UNDEFINED_VARIABLE, e.diagnostic.kind);
    }

    @Test
    void callDepthCeilingIsFatalAndPushesNothing() {
        Stack stack = new Stack(null, 2);
        stack.push(StackFrame.call("a", null, null));
        stack.push(StackFrame.block());
        stack.push(StackFrame.call("b", null, null));

        RuntimeError e = assertThrows(RuntimeError.class, () -> stack.push(StackFrame.call("c", null, null)));

        assertEquals(DiagnosticKind.STACK_OVERFLOW, e.diagnostic.kind);
        assertTrue(e.diagnostic.isFatal());
        assertEquals(2.0, e.diagnostic.get("limite").asNumber());
        assertEquals(3, stack.depth());
        assertEquals(2, stack.callDepth());

        // blocks are not bounded by the ceiling
        stack.push(StackFrame.block());
        assertEquals(4, stack.depth());
    }

    @Test
    void frameLifecycleMisuseIsRejected() {
        Stack stack = new Stack();
        assertThrows(IllegalStateException.class, stack::pop);
        assertThrows(IllegalArgumentException.class, () -> stack.push(StackFrame.global()));
        assertThrows(IllegalArgumentException.class, () -> new Stack(null, 0));
    }

    @Test
    void visibleEnvironmentsAreInnermostFirst() {
        Stack stack = new Stack();
        stack.push(StackFrame.block());
        Environment outerBlock = stack.innermost();
        stack.push(StackFrame.block());
        Environment innerBlock = stack.innermost();

        assertEquals(List.of(innerBlock, outerBlock, stack.globals()), stack.visibleEnvironments());

        Environment callEnv = new Environment();
        Environment home = new Environment();
        stack.push(StackFrame.call("f", callEnv, home));
        assertEquals(List.of(callEnv, home), stack.visibleEnvironments());
        assertEquals("f", stack.currentFunctionName());
    }
}
