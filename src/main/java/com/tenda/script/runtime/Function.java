package com.tenda.script.runtime;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import com.tenda.script.ast.FunctionParam;
import com.tenda.script.ast.Statement.Stmt;

/**
 * A closure: parameters, body, the shared cells captured when it was built, and
 * the globals of the module that built it. Built by {@link ClosureBuilder}.
 */
public final class Function implements Callable {
    private static final AtomicLong IDS = new AtomicLong(1);

    public final long id;
    public final List<FunctionParam> params;
    public final Stmt body;
    /** A separate snapshot, never the defining frame's own Environment. */
    public final Environment captured;
    public final Environment home;
    private FunctionMetadata metadata;

    Function(List<FunctionParam> params, Stmt body, Environment captured, Environment home) {
        this.id = IDS.getAndIncrement();
        this.params = Collections.unmodifiableList(params);
        this.body = body;
        this.captured = captured;
        this.home = home;
        this.metadata = FunctionMetadata.anonymous(null);
    }

    public FunctionMetadata metadata() {
        return metadata;
    }

    public void setMetadata(FunctionMetadata metadata) {
        this.metadata = (metadata == null) ? FunctionMetadata.anonymous(null) : metadata;
    }

    @Override
    public String name() {
        return metadata.name;
    }

    @Override
    public int requiredArity() {
        int n = 0;
        for (FunctionParam p : params) if (p.isRequired()) n++;
        return n;
    }

    @Override
    public int declaredArity() {
        int n = 0;
        for (FunctionParam p : params) if (!p.variadic) n++;
        return n;
    }

    @Override
    public boolean isVariadic() {
        return !params.isEmpty() && params.get(params.size() - 1).variadic;
    }

    @Override
    public String toString() {
        return "Function#" + id + "(" + (name() == null ? TraceEntry.ANONYMOUS : name()) + ")";
    }
}
