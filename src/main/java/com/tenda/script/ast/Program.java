package com.tenda.script.ast;

import java.util.Collections;
import java.util.List;

import com.tenda.script.ast.Statement.Stmt;

/** One program unit: the top-level statements of a module, executed in a single Environment. */
public final class Program {
    public final String moduleId;
    public final List<Stmt> statements;
    boolean analyzed;

    public Program(String moduleId, List<Stmt> statements) {
        this.moduleId = (moduleId == null) ? "<principal>" : moduleId;
        this.statements = Collections.unmodifiableList(statements);
    }

    public boolean isAnalyzed() {
        return analyzed;
    }
}
