package com.tenda.script.runtime;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.tenda.script.ast.FunctionParam;
import com.tenda.script.ast.Statement.Stmt;

/** Turns a parameter list and a body into a {@link Function} over the current stack. */
public final class ClosureBuilder {

    private ClosureBuilder() {}

    /**
     * Captures every shared cell visible on {@code stack}, innermost scope first
     * (the nearest binding of a name wins), except names that are parameters of
     * the new function. Owned cells are left out: no nested function refers to
     * them, so they cannot be observed from the closure.
     */
    public static Function makeFunction(Stack stack, List<FunctionParam> params, Stmt body, FunctionMetadata metadata) {
        Set<String> paramNames = new HashSet<>();
        for (int i = 0; i < params.size(); i++) {
            FunctionParam p = params.get(i);
            if (!paramNames.add(p.name)) {
                throw new IllegalArgumentException("Duplicate parameter: " + p.name);
            }
            if (p.variadic && i != params.size() - 1) {
                throw new IllegalArgumentException("Only the last parameter can be variadic: " + p.name);
            }
        }

        Environment captured = new Environment();
        for (Environment env : stack.visibleEnvironments()) {
            for (Map.Entry<String, ValueCell> e : env) {
                String name = e.getKey();
                if (!e.getValue().isShared()) continue;
                if (paramNames.contains(name)) continue;
                if (captured.has(name)) continue;
                captured.upsert(name, e.getValue());
            }
        }

        Function f = new Function(params, body, captured, stack.currentHome());
        if (metadata != null) f.setMetadata(metadata);
        return f;
    }

    /**
     * Starting Environment of one call: the captured cells plus, for named
     * functions, the function itself under its own name. Parameters are bound
     * on top of this by the caller.
     */
    public static Environment seedCallEnvironment(Function f) {
        Environment env = new Environment(f.captured);
        FunctionMetadata m = f.metadata();
        if (m.bindSelf) {
            env.upsert(m.name, ValueCell.of(Value.function(f), m.selfCaptured));
        }
        return env;
    }
}
