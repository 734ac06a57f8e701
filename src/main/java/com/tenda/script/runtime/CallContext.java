package com.tenda.script.runtime;

import java.util.List;

/** What a native function may reach while it runs. */
public interface CallContext {

    /**
     * Calls a function value back through the evaluator (arity check, frames,
     * traces), e.g. the callback handed to {@code Lista.mapeie}.
     */
    Value call(Value callee, List<Value> args);

    Platform platform();

    /** Name the native function was called under. */
    String functionName();
}
