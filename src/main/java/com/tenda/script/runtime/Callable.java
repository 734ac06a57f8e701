package com.tenda.script.runtime;

/** Anything a call expression can invoke: a closure or a native function. */
public interface Callable {

    /** Display/trace name; null for anonymous functions. */
    String name();

    /** Arguments that must be supplied. */
    int requiredArity();

    /** Named, non-variadic parameters. */
    int declaredArity();

    /** When true, any number of arguments above {@link #declaredArity()} is accepted. */
    boolean isVariadic();

    /** @throws RuntimeError ARITY_MISMATCH unless {@code required <= found <= declared} (no upper bound when variadic) */
    default void checkArity(int found) {
        boolean tooFew = found < requiredArity();
        boolean tooMany = !isVariadic() && found > declaredArity();
        if (tooFew || tooMany) {
            throw new RuntimeError(Diagnostic.arityMismatch(requiredArity(), declaredArity(), isVariadic(), found));
        }
    }
}
