package com.tenda.script.runtime;

import com.tenda.script.ast.Program;

/** Resolves {@code importe ... de "id"} to a syntax tree. */
public interface ModuleLoader {

    /** @return the module's program, or null when no module has that id */
    Program load(String id);
}
