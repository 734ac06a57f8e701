package com.tenda.script.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.tenda.debug.Debug;
import com.tenda.script.ast.Expr;
import com.tenda.script.ast.Expr.BinaryOperator;
import com.tenda.script.ast.Expr.ExprInterface;
import com.tenda.script.ast.Expr.ExprVisitor;
import com.tenda.script.ast.FunctionParam;
import com.tenda.script.ast.Program;
import com.tenda.script.ast.SourceSpan;
import com.tenda.script.ast.Statement;
import com.tenda.script.ast.Statement.Stmt;
import com.tenda.script.ast.Statement.StmtVisitor;

/**
 * Tree-walking evaluator for one module.
 *
 * <p>Statements return a {@link ControlSignal}; a non-NORMAL signal stops the
 * statement list it came from and travels up until a loop, a call, a
 * {@code tente} or the program consumes it. Expressions return a {@link Value}
 * or throw {@link RuntimeError}, which {@link #execute(Stmt)} turns into a
 * RAISED signal. Every frame pushed here is popped in a {@code finally}.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor<ControlSignal> {

    private static final String TAG = "Interpreter";

    private final Stack stack;
    private final Platform platform;
    private final ModuleRegistry modules;
    private final Set<String> exportedNames = new LinkedHashSet<>();

    public Interpreter(Stack stack, Platform platform, ModuleRegistry modules) {
        this.stack = stack;
        this.platform = (platform == null) ? new SystemPlatform() : platform;
        this.modules = modules;
    }

    public Stack stack() {
        return stack;
    }

    public Platform platform() {
        return platform;
    }

    /**
     * Runs the program's statements in the global frame.
     *
     * @return RAISED with the first unhandled diagnostic, RETURN for a top-level
     *         {@code retorna}, otherwise NORMAL carrying the value of the last
     *         expression statement (Nada when there is none)
     */
    public ControlSignal run(Program program) {
        Value last = Value.nil();
        for (Stmt s : program.statements) {
            ControlSignal sig = execute(s);
            switch (sig.kind) {
                case NORMAL:
                    if (sig.value != null) last = sig.value;
                    break;
                case RETURN:
                case RAISED:
                    return sig;
                default:
                    // stray interrompa/continue: nothing left to loop over
                    return ControlSignal.normal(last);
            }
        }
        return ControlSignal.normal(last);
    }

    /** Cells of the names this module exported, as bound when it finished. */
    public Map<String, ValueCell> exports() {
        Map<String, ValueCell> out = new LinkedHashMap<>();
        for (String name : exportedNames) {
            ValueCell cell = stack.globals().lookup(name);
            if (cell != null) out.put(name, cell);
        }
        return out;
    }

    // -------------------------
    // Entry points
    // -------------------------

    public ControlSignal execute(Stmt stmt) {
        try {
            return stmt.accept(this);
        } catch (RuntimeError e) {
            e.diagnostic.attachSpanIfMissing(stmt.span());
            return ControlSignal.raised(e.diagnostic);
        }
    }

    public Value evaluate(ExprInterface expr) {
        try {
            return expr.accept(this);
        } catch (RuntimeError e) {
            e.diagnostic.attachSpanIfMissing(expr.span());
            throw e;
        }
    }

    private ControlSignal executeInFrame(List<Stmt> statements, StackFrame frame) {
        stack.push(frame);
        try {
            for (Stmt s : statements) {
                ControlSignal sig = execute(s);
                if (!sig.isNormal()) return sig;
            }
            return ControlSignal.normal();
        } finally {
            stack.pop();
        }
    }

    private ControlSignal executeInFrame(Stmt stmt, StackFrame frame) {
        return executeInFrame(Collections.singletonList(stmt), frame);
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public ControlSignal visitExprStmt(Statement.ExprStmt stmt) {
        return ControlSignal.normal(evaluate(stmt.expression));
    }

    @Override
    public ControlSignal visitVarStmt(Statement.VarStmt stmt) {
        Value v = (stmt.initializer == null) ? Value.nil() : evaluate(stmt.initializer);
        stack.declare(stmt.name, ValueCell.of(v, stmt.captured));
        return ControlSignal.normal();
    }

    @Override
    public ControlSignal visitFunctionStmt(Statement.FunctionStmt stmt) {
        FunctionMetadata meta = FunctionMetadata.named(stmt.name, stmt.span, stmt.selfCaptured);
        Function f = ClosureBuilder.makeFunction(stack, stmt.params, stmt.body, meta);
        stack.declare(stmt.name, ValueCell.of(Value.function(f), stmt.captured));
        return ControlSignal.normal();
    }

    @Override
    public ControlSignal visitBlockStmt(Statement.Block stmt) {
        return executeInFrame(stmt.statements, StackFrame.block());
    }

    @Override
    public ControlSignal visitIfStmt(Statement.If stmt) {
        if (evaluate(stmt.condition).isTruthy()) return execute(stmt.thenBranch);
        if (stmt.elseBranch != null) return execute(stmt.elseBranch);
        return ControlSignal.normal();
    }

    @Override
    public ControlSignal visitWhileStmt(Statement.While stmt) {
        while (evaluate(stmt.condition).isTruthy()) {
            ControlSignal sig = execute(stmt.body);
            if (sig.kind == ControlSignal.Kind.BREAK) break;
            if (sig.kind == ControlSignal.Kind.CONTINUE || sig.isNormal()) continue;
            return sig;
        }
        return ControlSignal.normal();
    }

    @Override
    public ControlSignal visitForEachStmt(Statement.ForEach stmt) {
        Value iterable = evaluate(stmt.iterable);
        Iterable<Value> items;
        switch (iterable.type) {
            case LIST:
                // later changes to the list do not affect this loop
                items = new ArrayList<>(iterable.asList());
                break;
            case RANGE:
                items = iterable.asRange();
                break;
            default:
                throw new RuntimeError(Diagnostic.notIterable(iterable).attachSpanIfMissing(stmt.iterable.span()));
        }

        for (Value item : items) {
            StackFrame frame = StackFrame.block();
            frame.env.declare(stmt.item, ValueCell.of(item, stmt.itemCaptured));
            ControlSignal sig = executeInFrame(stmt.body, frame);
            if (sig.kind == ControlSignal.Kind.BREAK) break;
            if (sig.kind == ControlSignal.Kind.CONTINUE || sig.isNormal()) continue;
            return sig;
        }
        return ControlSignal.normal();
    }

    @Override
    public ControlSignal visitReturnStmt(Statement.ReturnStmt stmt) {
        Value v = (stmt.value == null) ? Value.nil() : evaluate(stmt.value);
        return ControlSignal.ret(v);
    }

    @Override
    public ControlSignal visitBreakStmt(Statement.BreakStmt stmt) {
        return ControlSignal.breakLoop();
    }

    @Override
    public ControlSignal visitContinueStmt(Statement.ContinueStmt stmt) {
        return ControlSignal.continueLoop();
    }

    @Override
    public ControlSignal visitTryStmt(Statement.TryStmt stmt) {
        ControlSignal sig = execute(stmt.body);
        if (!sig.isRaised() || sig.diagnostic.isFatal()) return sig;

        Debug.get().d(TAG, "handled: " + sig.diagnostic);
        StackFrame frame = StackFrame.block();
        frame.env.declare(stmt.errorName, ValueCell.of(sig.diagnostic.toHandlerValue(), stmt.errorCaptured));
        return executeInFrame(stmt.handler, frame);
    }

    @Override
    public ControlSignal visitRaiseStmt(Statement.RaiseStmt stmt) {
        Value v = evaluate(stmt.value);
        throw new RuntimeError(Diagnostic.userRaised(v));
    }

    @Override
    public ControlSignal visitImportStmt(Statement.ImportStmt stmt) {
        if (modules == null) throw new RuntimeError(Diagnostic.moduleNotFound(stmt.module));
        Map<String, ValueCell> exported = modules.load(stmt.module);

        List<String> names = stmt.names.isEmpty() ? new ArrayList<>(exported.keySet()) : stmt.names;
        for (String name : names) {
            ValueCell cell = exported.get(name);
            if (cell == null) throw new RuntimeError(Diagnostic.notExported(stmt.module, name));
            stack.declare(name, stmt.capturedNames.contains(name) ? cell.share() : cell);
        }
        return ControlSignal.normal();
    }

    @Override
    public ControlSignal visitExportStmt(Statement.ExportStmt stmt) {
        ControlSignal sig = execute(stmt.declaration);
        if (sig.isNormal()) exportedNames.add(stmt.exportedName());
        return sig;
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitLiteralExpr(Expr.Literal expr) {
        return Value.fromLiteral(expr.value);
    }

    @Override
    public Value visitVariableExpr(Expr.Variable expr) {
        return stack.lookup(expr.name);
    }

    @Override
    public Value visitAssignExpr(Expr.Assign expr) {
        if (expr.target instanceof Expr.Variable) {
            Value v = evaluate(expr.value);
            stack.assign(((Expr.Variable) expr.target).name, v);
            return v;
        }

        Expr.IndexExpr target = (Expr.IndexExpr) expr.target;
        Value container = evaluate(target.target);
        Value index = evaluate(target.index);
        Value v = evaluate(expr.value);

        switch (container.type) {
            case LIST: {
                List<Value> list = container.asList();
                long i = toIndex(index);
                if (i >= list.size()) {
                    throw new RuntimeError(Diagnostic.indexOutOfBounds(i, list.size()).attachSpanIfMissing(target.index.span()));
                }
                list.set((int) i, v);
                return v;
            }
            case MAP:
                container.asMap().put(AssociativeKey.from(index), v);
                return v;
            case STRING:
                throw new RuntimeError(Diagnostic.immutableString());
            default:
                throw new RuntimeError(Diagnostic.unexpectedType("atribuição indexada", Value.Type.LIST, container));
        }
    }

    @Override
    public Value visitBinaryExpr(Expr.Binary expr) {
        Value l = evaluate(expr.left);
        Value r = evaluate(expr.right);
        return applyBinary(expr.operator, l, r);
    }

    @Override
    public Value visitLogicalExpr(Expr.Logical expr) {
        Value l = evaluate(expr.left);
        switch (expr.operator) {
            case AND:
                return l.isTruthy() ? evaluate(expr.right) : l;
            case OR:
            default:
                return l.isTruthy() ? l : evaluate(expr.right);
        }
    }

    @Override
    public Value visitUnaryExpr(Expr.Unary expr) {
        Value v = evaluate(expr.right);
        switch (expr.operator) {
            case NEGATIVE:
                if (v.type != Value.Type.NUMBER) {
                    throw new RuntimeError(Diagnostic.unexpectedType("negação", Value.Type.NUMBER, v));
                }
                return Value.number(-v.asNumber());
            case NOT:
            default:
                return Value.bool(!v.isTruthy());
        }
    }

    @Override
    public Value visitCallExpr(Expr.Call expr) {
        Value callee = evaluate(expr.callee);
        List<Value> args = new ArrayList<>(expr.arguments.size());
        for (ExprInterface a : expr.arguments) args.add(evaluate(a));
        return call(callee, args, expr.span);
    }

    @Override
    public Value visitIndexExpr(Expr.IndexExpr expr) {
        Value container = evaluate(expr.target);
        Value index = evaluate(expr.index);

        switch (container.type) {
            case LIST: {
                List<Value> list = container.asList();
                long i = toIndex(index);
                if (i >= list.size()) {
                    throw new RuntimeError(Diagnostic.indexOutOfBounds(i, list.size()).attachSpanIfMissing(expr.index.span()));
                }
                return list.get((int) i);
            }
            case STRING: {
                String s = container.asString();
                long i = toIndex(index);
                int length = s.codePointCount(0, s.length());
                if (i >= length) {
                    throw new RuntimeError(Diagnostic.indexOutOfBounds(i, length).attachSpanIfMissing(expr.index.span()));
                }
                int at = s.offsetByCodePoints(0, (int) i);
                return Value.string(new String(Character.toChars(s.codePointAt(at))));
            }
            case MAP: {
                AssociativeKey key = AssociativeKey.from(index);
                Value v = container.asMap().get(key);
                if (v == null) throw new RuntimeError(Diagnostic.keyNotFound(key).attachSpanIfMissing(expr.index.span()));
                return v;
            }
            default:
                throw new RuntimeError(Diagnostic.unexpectedType("indexação", Value.Type.LIST, container));
        }
    }

    @Override
    public Value visitListLiteralExpr(Expr.ListLiteral expr) {
        List<Value> out = new ArrayList<>(expr.elements.size());
        for (ExprInterface e : expr.elements) out.add(evaluate(e));
        return Value.list(out);
    }

    @Override
    public Value visitMapLiteralExpr(Expr.MapLiteral expr) {
        Map<AssociativeKey, Value> out = new LinkedHashMap<>();
        for (Expr.MapEntry e : expr.entries) {
            AssociativeKey key = AssociativeKey.from(evaluate(e.key));
            out.put(key, evaluate(e.value));
        }
        return Value.map(out);
    }

    @Override
    public Value visitFunctionExpr(Expr.FunctionExpr expr) {
        Function f = ClosureBuilder.makeFunction(stack, expr.params, expr.body, FunctionMetadata.anonymous(expr.span));
        return Value.function(f);
    }

    @Override
    public Value visitConditionalExpr(Expr.Conditional expr) {
        return evaluate(expr.condition).isTruthy() ? evaluate(expr.thenBranch) : evaluate(expr.elseBranch);
    }

    // -------------------------
    // Calls
    // -------------------------

    /**
     * Invokes a function value with already evaluated arguments.
     *
     * @throws RuntimeError TYPE_MISMATCH for a non-callable, ARITY_MISMATCH, or
     *                      whatever the callee raised (with a trace entry for this call)
     */
    public Value call(Value callee, List<Value> args, SourceSpan callSite) {
        if (!callee.isCallable()) {
            throw new RuntimeError(Diagnostic.unexpectedType("chamada", Value.Type.FUNCTION, callee));
        }
        Callable target = callee.asCallable();
        target.checkArity(args.size());

        if (target instanceof Function) return callFunction((Function) target, args, callSite);
        return callNative((NativeFunction) target, args, callSite);
    }

    private Value callFunction(Function f, List<Value> args, SourceSpan callSite) {
        Environment env = ClosureBuilder.seedCallEnvironment(f);
        stack.push(StackFrame.call(f.name(), env, f.home));
        try {
            bindParams(f.params, args, env);

            ControlSignal sig = execute(f.body);
            switch (sig.kind) {
                case RETURN:
                    return sig.value;
                case RAISED:
                    throw new RuntimeError(sig.diagnostic);
                default:
                    return Value.nil();
            }
        } catch (RuntimeError e) {
            e.diagnostic.appendTrace(new TraceEntry(f.name(), callSite));
            throw e;
        } finally {
            stack.pop();
        }
    }

    /** Defaults are evaluated here, inside the new frame, after the parameters before them are bound. */
    private void bindParams(List<FunctionParam> params, List<Value> args, Environment env) {
        for (int i = 0; i < params.size(); i++) {
            FunctionParam p = params.get(i);
            Value v;
            if (p.variadic) {
                List<Value> rest = (i < args.size()) ? new ArrayList<>(args.subList(i, args.size())) : new ArrayList<>();
                v = Value.list(rest);
            } else if (i < args.size()) {
                v = args.get(i);
            } else if (p.defaultValue != null) {
                v = evaluate(p.defaultValue);
            } else {
                v = Value.nil();
            }
            env.upsert(p.name, ValueCell.of(v, p.captured));
        }
    }

    private Value callNative(NativeFunction nf, List<Value> args, SourceSpan callSite) {
        Environment env = new Environment();
        List<String> names = nf.params();
        for (int i = 0; i < names.size(); i++) {
            Value v;
            if (nf.isVariadic() && i == names.size() - 1) {
                v = Value.list((i < args.size()) ? new ArrayList<>(args.subList(i, args.size())) : new ArrayList<>());
            } else {
                v = (i < args.size()) ? args.get(i) : Value.nil();
            }
            env.upsert(names.get(i), ValueCell.owned(v));
        }

        stack.push(StackFrame.call(nf.name(), env, null));
        try {
            return nf.invoke(new NativeCallContext(nf.name()), Collections.unmodifiableList(args));
        } catch (RuntimeError e) {
            e.diagnostic.appendTrace(new TraceEntry(nf.name(), callSite));
            throw e;
        } finally {
            stack.pop();
        }
    }

    private final class NativeCallContext implements CallContext {
        private final String name;

        NativeCallContext(String name) {
            this.name = name;
        }

        @Override
        public Value call(Value callee, List<Value> args) {
            return Interpreter.this.call(callee, args, null);
        }

        @Override
        public Platform platform() {
            return platform;
        }

        @Override
        public String functionName() {
            return name;
        }
    }

    // -------------------------
    // Operators
    // -------------------------

    public static Value applyBinary(BinaryOperator op, Value l, Value r) {
        switch (op) {
            case ADD:
                if (isNumbers(l, r)) return Value.number(l.asNumber() + r.asNumber());
                if (l.type == Value.Type.STRING || r.type == Value.Type.STRING) {
                    return Value.string(l.display() + r.display());
                }
                if (l.type == Value.Type.LIST && r.type == Value.Type.LIST) {
                    List<Value> joined = new ArrayList<>(l.asList());
                    joined.addAll(r.asList());
                    return Value.list(joined);
                }
                throw new RuntimeError(Diagnostic.typeMismatch("soma", l, r));
            case SUBTRACT:
                requireNumbers("subtração", l, r);
                return Value.number(l.asNumber() - r.asNumber());
            case MULTIPLY:
                requireNumbers("multiplicação", l, r);
                return Value.number(l.asNumber() * r.asNumber());
            case DIVIDE:
                requireNumbers("divisão", l, r);
                if (r.asNumber() == 0.0) throw new RuntimeError(Diagnostic.divisionByZero());
                return Value.number(l.asNumber() / r.asNumber());
            case MODULO:
                requireNumbers("resto", l, r);
                if (r.asNumber() == 0.0) throw new RuntimeError(Diagnostic.divisionByZero());
                return Value.number(l.asNumber() % r.asNumber());
            case EXPONENT:
                requireNumbers("potência", l, r);
                return Value.number(Math.pow(l.asNumber(), r.asNumber()));
            case EQUALITY:
                return Value.bool(Value.equal(l, r));
            case INEQUALITY:
                return Value.bool(!Value.equal(l, r));
            case GREATER:
                return Value.bool(order(op, "maior que", l, r));
            case GREATER_OR_EQUAL:
                return Value.bool(order(op, "maior ou igual", l, r));
            case LESS:
                return Value.bool(order(op, "menor que", l, r));
            case LESS_OR_EQUAL:
                return Value.bool(order(op, "menor ou igual", l, r));
            case RANGE:
                requireNumbers("intervalo", l, r);
                return Value.range(rangeBound(l.asNumber()), rangeBound(r.asNumber()));
            case HAS:
                return Value.bool(contains("tem", l, r));
            case LACKS:
                return Value.bool(!contains("não tem", l, r));
            default:
                throw new IllegalStateException("Unhandled operator: " + op);
        }
    }

    private static boolean isNumbers(Value l, Value r) {
        return l.type == Value.Type.NUMBER && r.type == Value.Type.NUMBER;
    }

    private static void requireNumbers(String operation, Value l, Value r) {
        if (!isNumbers(l, r)) throw new RuntimeError(Diagnostic.typeMismatch(operation, l, r));
    }

    /** Numbers with numbers, texts with texts. Any ordering involving NaN is false. */
    private static boolean order(BinaryOperator op, String operation, Value l, Value r) {
        if (isNumbers(l, r)) {
            double a = l.asNumber();
            double b = r.asNumber();
            switch (op) {
                case GREATER: return a > b;
                case GREATER_OR_EQUAL: return a >= b;
                case LESS: return a < b;
                default: return a <= b;
            }
        }
        if (l.type == Value.Type.STRING && r.type == Value.Type.STRING) {
            int c = l.asString().compareTo(r.asString());
            switch (op) {
                case GREATER: return c > 0;
                case GREATER_OR_EQUAL: return c >= 0;
                case LESS: return c < 0;
                default: return c <= 0;
            }
        }
        throw new RuntimeError(Diagnostic.typeMismatch(operation, l, r));
    }

    private static long rangeBound(double d) {
        if (!Double.isFinite(d) || d != Math.rint(d)) throw new RuntimeError(Diagnostic.invalidRangeBounds(d));
        return (long) d;
    }

    private static boolean contains(String operation, Value container, Value item) {
        switch (container.type) {
            case LIST:
                for (Value v : container.asList()) {
                    if (Value.equal(v, item)) return true;
                }
                return false;
            case MAP:
                return container.asMap().containsKey(AssociativeKey.from(item));
            default:
                throw new RuntimeError(Diagnostic.typeMismatch(operation, container, item));
        }
    }

    /** Non-negative integral number, or INVALID_INDEX / TYPE_MISMATCH. */
    private static long toIndex(Value index) {
        if (index.type != Value.Type.NUMBER) {
            throw new RuntimeError(Diagnostic.unexpectedType("índice", Value.Type.NUMBER, index));
        }
        double d = index.asNumber();
        if (!Double.isFinite(d) || d != Math.rint(d) || d < 0) {
            throw new RuntimeError(Diagnostic.invalidIndex(d));
        }
        return (long) d;
    }
}
