package com.tenda.script.ast;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class Statement {

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);
        SourceSpan span();
    }

    public interface StmtVisitor<R> {
        R visitExprStmt(ExprStmt stmt);
        R visitVarStmt(VarStmt stmt);
        R visitFunctionStmt(FunctionStmt stmt);
        R visitBlockStmt(Block stmt);
        R visitIfStmt(If stmt);
        R visitWhileStmt(While stmt);
        R visitForEachStmt(ForEach stmt);
        R visitReturnStmt(ReturnStmt stmt);
        R visitBreakStmt(BreakStmt stmt);
        R visitContinueStmt(ContinueStmt stmt);
        R visitTryStmt(TryStmt stmt);
        R visitRaiseStmt(RaiseStmt stmt);
        R visitImportStmt(ImportStmt stmt);
        R visitExportStmt(ExportStmt stmt);
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;

        public ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }

        @Override public SourceSpan span() { return expression.span(); }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitExprStmt(this); }
    }

    /** {@code seja nome = valor} */
    public static final class VarStmt implements Stmt {
        public final String name;
        public final Expr.ExprInterface initializer;
        public final SourceSpan span;
        public boolean captured;

        public VarStmt(String name, Expr.ExprInterface initializer, SourceSpan span) {
            this.name = name;
            this.initializer = initializer;
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitVarStmt(this); }
    }

    /** {@code seja nome(params) = corpo} */
    public static final class FunctionStmt implements Stmt {
        public final String name;
        public final List<FunctionParam> params;
        public final Stmt body;
        public final SourceSpan span;
        // the binding made by this declaration
        public boolean captured;
        // the name as seen from inside its own body
        public boolean selfCaptured;

        public FunctionStmt(String name, List<FunctionParam> params, Stmt body, SourceSpan span) {
            this.name = name;
            this.params = Collections.unmodifiableList(params);
            this.body = body;
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitFunctionStmt(this); }
    }

    public static final class Block implements Stmt {
        public final List<Stmt> statements;
        public final SourceSpan span;

        public Block(List<Stmt> statements, SourceSpan span) {
            this.statements = Collections.unmodifiableList(statements);
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBlockStmt(this); }
    }

    public static final class If implements Stmt {
        public final Expr.ExprInterface condition;
        public final Stmt thenBranch;
        public final Stmt elseBranch; // may be null
        public final SourceSpan span;

        public If(Expr.ExprInterface condition, Stmt thenBranch, Stmt elseBranch, SourceSpan span) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        public final Expr.ExprInterface condition;
        public final Stmt body;
        public final SourceSpan span;

        public While(Expr.ExprInterface condition, Stmt body, SourceSpan span) {
            this.condition = condition;
            this.body = body;
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitWhileStmt(this); }
    }

    /** {@code para cada item em iteravel} */
    public static final class ForEach implements Stmt {
        public final String item;
        public final Expr.ExprInterface iterable;
        public final Stmt body;
        public final SourceSpan span;
        public boolean itemCaptured;

        public ForEach(String item, Expr.ExprInterface iterable, Stmt body, SourceSpan span) {
            this.item = item;
            this.iterable = iterable;
            this.body = body;
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitForEachStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        public final Expr.ExprInterface value; // may be null
        public final SourceSpan span;

        public ReturnStmt(Expr.ExprInterface value, SourceSpan span) {
            this.value = value;
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitReturnStmt(this); }
    }

    public static final class BreakStmt implements Stmt {
        public final SourceSpan span;

        public BreakStmt(SourceSpan span) { this.span = span; }

        @Override public SourceSpan span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBreakStmt(this); }
    }

    public static final class ContinueStmt implements Stmt {
        public final SourceSpan span;

        public ContinueStmt(SourceSpan span) { this.span = span; }

        @Override public SourceSpan span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitContinueStmt(this); }
    }

    /** {@code tente corpo capture erro tratamento} */
    public static final class TryStmt implements Stmt {
        public final Stmt body;
        public final String errorName;
        public final Stmt handler;
        public final SourceSpan span;
        public boolean errorCaptured;

        public TryStmt(Stmt body, String errorName, Stmt handler, SourceSpan span) {
            this.body = body;
            this.errorName = errorName;
            this.handler = handler;
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitTryStmt(this); }
    }

    /** {@code lance valor} */
    public static final class RaiseStmt implements Stmt {
        public final Expr.ExprInterface value;
        public final SourceSpan span;

        public RaiseStmt(Expr.ExprInterface value, SourceSpan span) {
            this.value = value;
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitRaiseStmt(this); }
    }

    /** {@code importe a, b de "modulo"}; an empty name list imports every export. */
    public static final class ImportStmt implements Stmt {
        public final String module;
        public final List<String> names;
        public final SourceSpan span;
        public final Set<String> capturedNames = new LinkedHashSet<>();

        public ImportStmt(String module, List<String> names, SourceSpan span) {
            this.module = module;
            this.names = Collections.unmodifiableList(names);
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitImportStmt(this); }
    }

    /** {@code exporte <declaração>} */
    public static final class ExportStmt implements Stmt {
        public final Stmt declaration;
        public final SourceSpan span;

        public ExportStmt(Stmt declaration, SourceSpan span) {
            if (!(declaration instanceof VarStmt) && !(declaration instanceof FunctionStmt)) {
                throw new IllegalArgumentException("Only declarations can be exported");
            }
            this.declaration = declaration;
            this.span = span;
        }

        public String exportedName() {
            return (declaration instanceof VarStmt)
                    ? ((VarStmt) declaration).name
                    : ((FunctionStmt) declaration).name;
        }

        @Override public SourceSpan span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitExportStmt(this); }
    }
}
