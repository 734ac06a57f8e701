package com.tenda.script.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.tenda.script.ast.Expr.ExprInterface;
import com.tenda.script.ast.Expr.ExprVisitor;
import com.tenda.script.ast.Statement.Stmt;
import com.tenda.script.ast.Statement.StmtVisitor;

/**
 * Static pass that decides which bindings become shared cells.
 *
 * <p>A declaration is marked {@code captured} when some function nested inside
 * its scope reads or writes it. Resolution is purely lexical and follows source
 * order: a name that is not declared yet at the point of reference (a global
 * declared further down, a built-in) marks nothing, since at run time it is
 * reached through the globals or the prelude rather than through a captured cell.
 *
 * <p>The pass only ever sets flags, so running it twice is harmless;
 * {@link #annotate(Program)} still skips programs it has already seen.
 */
public final class CaptureAnalyzer implements ExprVisitor<Void>, StmtVisitor<Void> {

    private static final class Declaration {
        final int functionDepth;
        final Runnable mark;

        Declaration(int functionDepth, Runnable mark) {
            this.functionDepth = functionDepth;
            this.mark = mark;
        }
    }

    private final Deque<Map<String, Declaration>> scopes = new ArrayDeque<>();
    private int functionDepth = 0;

    private CaptureAnalyzer() {}

    public static Program annotate(Program program) {
        if (program.analyzed) return program;
        CaptureAnalyzer analyzer = new CaptureAnalyzer();
        analyzer.beginScope();
        for (Stmt s : program.statements) analyzer.visit(s);
        analyzer.endScope();
        program.analyzed = true;
        return program;
    }

    // -------------------------
    // Scope bookkeeping
    // -------------------------

    private void beginScope() {
        scopes.push(new HashMap<>());
    }

    private void endScope() {
        scopes.pop();
    }

    private void declare(String name, Runnable mark) {
        scopes.peek().put(name, new Declaration(functionDepth, mark));
    }

    /** @return true when the name resolves to a declaration of an enclosing function */
    private boolean reference(String name) {
        for (Map<String, Declaration> scope : scopes) {
            Declaration d = scope.get(name);
            if (d == null) continue;
            if (d.functionDepth < functionDepth) {
                d.mark.run();
                return true;
            }
            return false;
        }
        return false;
    }

    private void visit(Stmt stmt) {
        if (stmt != null) stmt.accept(this);
    }

    private void visit(ExprInterface expr) {
        if (expr != null) expr.accept(this);
    }

    private void function(List<FunctionParam> params, Stmt body, Statement.FunctionStmt self) {
        functionDepth++;
        beginScope();
        try {
            if (self != null) declare(self.name, () -> self.selfCaptured = true);
            for (FunctionParam p : params) {
                // default runs in the call frame, after earlier parameters are bound
                visit(p.defaultValue);
                declare(p.name, () -> p.captured = true);
            }
            visit(body);
        } finally {
            endScope();
            functionDepth--;
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Void visitExprStmt(Statement.ExprStmt stmt) {
        visit(stmt.expression);
        return null;
    }

    @Override
    public Void visitVarStmt(Statement.VarStmt stmt) {
        visit(stmt.initializer);
        declare(stmt.name, () -> stmt.captured = true);
        return null;
    }

    @Override
    public Void visitFunctionStmt(Statement.FunctionStmt stmt) {
        declare(stmt.name, () -> stmt.captured = true);
        function(stmt.params, stmt.body, stmt);
        return null;
    }

    @Override
    public Void visitBlockStmt(Statement.Block stmt) {
        beginScope();
        try {
            for (Stmt s : stmt.statements) visit(s);
        } finally {
            endScope();
        }
        return null;
    }

    @Override
    public Void visitIfStmt(Statement.If stmt) {
        visit(stmt.condition);
        visit(stmt.thenBranch);
        visit(stmt.elseBranch);
        return null;
    }

    @Override
    public Void visitWhileStmt(Statement.While stmt) {
        visit(stmt.condition);
        visit(stmt.body);
        return null;
    }

    @Override
    public Void visitForEachStmt(Statement.ForEach stmt) {
        visit(stmt.iterable);
        beginScope();
        try {
            declare(stmt.item, () -> stmt.itemCaptured = true);
            visit(stmt.body);
        } finally {
            endScope();
        }
        return null;
    }

    @Override
    public Void visitReturnStmt(Statement.ReturnStmt stmt) {
        visit(stmt.value);
        return null;
    }

    @Override
    public Void visitBreakStmt(Statement.BreakStmt stmt) {
        return null;
    }

    @Override
    public Void visitContinueStmt(Statement.ContinueStmt stmt) {
        return null;
    }

    @Override
    public Void visitTryStmt(Statement.TryStmt stmt) {
        visit(stmt.body);
        beginScope();
        try {
            declare(stmt.errorName, () -> stmt.errorCaptured = true);
            visit(stmt.handler);
        } finally {
            endScope();
        }
        return null;
    }

    @Override
    public Void visitRaiseStmt(Statement.RaiseStmt stmt) {
        visit(stmt.value);
        return null;
    }

    @Override
    public Void visitImportStmt(Statement.ImportStmt stmt) {
        // a wildcard import binds names only known once the module has run
        for (String name : stmt.names) {
            declare(name, () -> stmt.capturedNames.add(name));
        }
        return null;
    }

    @Override
    public Void visitExportStmt(Statement.ExportStmt stmt) {
        visit(stmt.declaration);
        return null;
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Void visitLiteralExpr(Expr.Literal expr) {
        return null;
    }

    @Override
    public Void visitVariableExpr(Expr.Variable expr) {
        if (reference(expr.name)) expr.captured = true;
        return null;
    }

    @Override
    public Void visitAssignExpr(Expr.Assign expr) {
        visit(expr.value);
        visit(expr.target);
        return null;
    }

    @Override
    public Void visitBinaryExpr(Expr.Binary expr) {
        visit(expr.left);
        visit(expr.right);
        return null;
    }

    @Override
    public Void visitLogicalExpr(Expr.Logical expr) {
        visit(expr.left);
        visit(expr.right);
        return null;
    }

    @Override
    public Void visitUnaryExpr(Expr.Unary expr) {
        visit(expr.right);
        return null;
    }

    @Override
    public Void visitCallExpr(Expr.Call expr) {
        visit(expr.callee);
        for (ExprInterface a : expr.arguments) visit(a);
        return null;
    }

    @Override
    public Void visitIndexExpr(Expr.IndexExpr expr) {
        visit(expr.target);
        visit(expr.index);
        return null;
    }

    @Override
    public Void visitListLiteralExpr(Expr.ListLiteral expr) {
        for (ExprInterface e : expr.elements) visit(e);
        return null;
    }

    @Override
    public Void visitMapLiteralExpr(Expr.MapLiteral expr) {
        for (Expr.MapEntry e : expr.entries) {
            visit(e.key);
            visit(e.value);
        }
        return null;
    }

    @Override
    public Void visitFunctionExpr(Expr.FunctionExpr expr) {
        function(expr.params, expr.body, null);
        return null;
    }

    @Override
    public Void visitConditionalExpr(Expr.Conditional expr) {
        visit(expr.condition);
        visit(expr.thenBranch);
        visit(expr.elseBranch);
        return null;
    }
}
