package com.tenda.script;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.tenda.debug.Debug;
import com.tenda.script.ast.CaptureAnalyzer;
import com.tenda.script.ast.Program;
import com.tenda.script.json.AstJsonReader;
import com.tenda.script.prelude.Prelude;
import com.tenda.script.runtime.ControlSignal;
import com.tenda.script.runtime.Diagnostic;
import com.tenda.script.runtime.DiagnosticListener;
import com.tenda.script.runtime.Environment;
import com.tenda.script.runtime.Interpreter;
import com.tenda.script.runtime.ModuleLoader;
import com.tenda.script.runtime.ModuleRegistry;
import com.tenda.script.runtime.NativeFunction;
import com.tenda.script.runtime.Platform;
import com.tenda.script.runtime.Stack;
import com.tenda.script.runtime.SystemPlatform;
import com.tenda.script.runtime.Value;

/**
 * Tenda runtime engine.
 *
 * - Input: syntax trees from an external parser ({@link Program}, or JSON via {@link AstJsonReader})
 * - Types: número (double), lógico, texto, lista, dicionário, intervalo, função, Nada
 * - Closures: captured variables live in shared cells, everything else is owned by its frame
 * - Errors: a failed run yields a structured {@link Diagnostic}; nothing is thrown to the host
 *   except for host misuse (IllegalStateException, IllegalArgumentException)
 * - Built-ins: the standard prelude plus whatever the host registers before the first run
 *
 * Usage:
 *   TendaScript engine = new TendaScript();
 *   engine.registerFunction("dobro", args -> Value.number(args.get(0).asNumber() * 2));
 *   ExecutionResult r = engine.run(program);
 */
public class TendaScript {

    private static final String TAG = "TendaScript";

    // one Tenda call nests a few dozen JVM frames; this leaves wide headroom
    private static final long STACK_BYTES_PER_CALL = 64 * 1024;
    private static final long MIN_STACK_BYTES = 16L * 1024 * 1024;
    private static final long MAX_STACK_BYTES = 1024L * 1024 * 1024;

    /** Functional interface for host built-ins that take any number of arguments. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    private final Prelude prelude;
    private int maxCallDepth = Stack.DEFAULT_MAX_CALL_DEPTH;
    private Platform platform = new SystemPlatform();
    private ModuleLoader moduleLoader;
    private DiagnosticListener diagnosticListener;

    public TendaScript() {
        this(Prelude.standard());
    }

    /** Runs against a host-assembled prelude instead of the standard one. */
    public TendaScript(Prelude prelude) {
        this.prelude = prelude;
    }

    // ===================== CONFIGURATION =====================

    /** Ceiling on nested calls; exceeding it is a fatal stack_overflow. */
    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("maxCallDepth must be >= 1, got " + depth);
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    public void setPlatform(Platform platform) { this.platform = (platform == null) ? new SystemPlatform() : platform; }

    public void setModuleLoader(ModuleLoader loader) { this.moduleLoader = loader; }

    /** Notified with the diagnostic of every failed run. */
    public void setDiagnosticListener(DiagnosticListener listener) { this.diagnosticListener = listener; }

    public void registerFunction(String name, BuiltinFunction fn) {
        if (fn == null) throw new IllegalArgumentException("fn is required for " + name);
        prelude.define(name, Value.nativeFunction(NativeFunction.variadic(name, (ctx, args) -> fn.call(args), "argumentos")));
    }

    /** Arity-checked built-in; {@code params} name the arguments in diagnostics and traces. */
    public void registerFunction(String name, NativeFunction.Body body, String... params) {
        prelude.function(name, body, params);
    }

    public void registerValue(String name, Value value) {
        prelude.define(name, value);
    }

    public Prelude prelude() { return prelude; }

    // ===================== EXECUTION =====================

    /** Decodes a JSON syntax tree and runs it. */
    public ExecutionResult run(String programJson) {
        return run(new AstJsonReader().read(programJson, null));
    }

    /**
     * Runs one program to completion. The prelude is frozen by the first run;
     * every run starts from fresh globals and a fresh module cache.
     */
    public ExecutionResult run(Program program) {
        if (!prelude.isFrozen()) {
            prelude.freeze();
            Debug.get().t(TAG, "prelude frozen with " + prelude.bindings().size() + " names");
        }
        CaptureAnalyzer.annotate(program);

        Environment base = prelude.toEnvironment();
        ModuleRegistry modules = new ModuleRegistry(moduleLoader, base, platform, maxCallDepth);
        Interpreter interpreter = new Interpreter(new Stack(base, maxCallDepth), platform, modules);

        Debug.get().d(TAG, "run start: " + program.moduleId + " (" + program.statements.size() + " statements)");
        ControlSignal signal = evaluate(interpreter, modules, program);

        Map<String, Value> globals = Collections.unmodifiableMap(interpreter.stack().globals().snapshotValues());
        if (signal.isRaised()) {
            Debug.get().w(TAG, "run failed: " + program.moduleId + ": " + signal.diagnostic);
            if (diagnosticListener != null) diagnosticListener.onDiagnostic(program.moduleId, signal.diagnostic);
            return ExecutionResult.failed(program.moduleId, signal.diagnostic, globals);
        }
        Debug.get().d(TAG, "run end: " + program.moduleId + " -> " + signal.value);
        return ExecutionResult.completed(program.moduleId, signal.value, globals);
    }

    /**
     * Evaluates on a dedicated thread whose stack is sized from the call depth
     * ceiling, so the ceiling is reached before the JVM stack is.
     */
    private ControlSignal evaluate(Interpreter interpreter, ModuleRegistry modules, Program program) {
        final ControlSignal[] signal = new ControlSignal[1];
        final Throwable[] failure = new Throwable[1];

        Thread worker = new Thread(null, new Runnable() {
            @Override public void run() {
                modules.enter(program.moduleId);
                try {
                    signal[0] = interpreter.run(program);
                } catch (StackOverflowError e) {
                    Debug.get().e(TAG, "JVM stack exhausted before the call depth ceiling (" + maxCallDepth + ")", e);
                    signal[0] = ControlSignal.raised(Diagnostic.stackOverflow(maxCallDepth));
                } catch (RuntimeException | Error e) {
                    failure[0] = e;
                } finally {
                    modules.leave(program.moduleId);
                }
            }
        }, "tenda-" + program.moduleId, evaluationStackSize(maxCallDepth));

        worker.start();
        try {
            worker.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running " + program.moduleId, e);
        }

        // host natives may throw; rethrow on the caller's thread
        if (failure[0] instanceof RuntimeException) throw (RuntimeException) failure[0];
        if (failure[0] instanceof Error) throw (Error) failure[0];
        return signal[0];
    }

    static long evaluationStackSize(int maxCallDepth) {
        long size = (long) maxCallDepth * STACK_BYTES_PER_CALL;
        return Math.min(MAX_STACK_BYTES, Math.max(MIN_STACK_BYTES, size));
    }
}
