package com.tenda.script.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.tenda.script.ast.Expr.BinaryOperator;
import com.tenda.script.ast.Expr.ExprInterface;
import com.tenda.script.ast.Expr.LogicalOperator;
import com.tenda.script.ast.Expr.UnaryOperator;
import com.tenda.script.ast.Statement.Stmt;

/**
 * Builder for syntax trees without a parser. Nodes built here carry no span.
 *
 * <pre>
 * Program p = Ast.program(
 *     Ast.let("x", Ast.num(1)),
 *     Ast.expr(Ast.add(Ast.var("x"), Ast.num(2))));
 * </pre>
 */
public final class Ast {

    private Ast() {}

    // -------------------------
    // Programs
    // -------------------------

    public static Program program(Stmt... statements) {
        return new Program(null, Arrays.asList(statements));
    }

    public static Program module(String id, Stmt... statements) {
        return new Program(id, Arrays.asList(statements));
    }

    // -------------------------
    // Literals / names
    // -------------------------

    public static Expr.Literal num(double value) { return new Expr.Literal(value, null); }
    public static Expr.Literal str(String value) { return new Expr.Literal(value, null); }
    public static Expr.Literal bool(boolean value) { return new Expr.Literal(value, null); }
    public static Expr.Literal nil() { return new Expr.Literal(null, null); }

    public static Expr.Variable var(String name) { return new Expr.Variable(name, null); }

    public static Expr.Assign assign(String name, ExprInterface value) {
        return new Expr.Assign(var(name), value, null);
    }

    public static Expr.Assign assignIndex(ExprInterface target, ExprInterface index, ExprInterface value) {
        return new Expr.Assign(index(target, index), value, null);
    }

    // -------------------------
    // Operators
    // -------------------------

    public static Expr.Binary binary(ExprInterface left, BinaryOperator op, ExprInterface right) {
        return new Expr.Binary(left, op, right, null);
    }

    public static Expr.Binary add(ExprInterface l, ExprInterface r) { return binary(l, BinaryOperator.ADD, r); }
    public static Expr.Binary sub(ExprInterface l, ExprInterface r) { return binary(l, BinaryOperator.SUBTRACT, r); }
    public static Expr.Binary mul(ExprInterface l, ExprInterface r) { return binary(l, BinaryOperator.MULTIPLY, r); }
    public static Expr.Binary div(ExprInterface l, ExprInterface r) { return binary(l, BinaryOperator.DIVIDE, r); }
    public static Expr.Binary mod(ExprInterface l, ExprInterface r) { return binary(l, BinaryOperator.MODULO, r); }
    public static Expr.Binary eq(ExprInterface l, ExprInterface r) { return binary(l, BinaryOperator.EQUALITY, r); }
    public static Expr.Binary lt(ExprInterface l, ExprInterface r) { return binary(l, BinaryOperator.LESS, r); }
    public static Expr.Binary le(ExprInterface l, ExprInterface r) { return binary(l, BinaryOperator.LESS_OR_EQUAL, r); }
    public static Expr.Binary gt(ExprInterface l, ExprInterface r) { return binary(l, BinaryOperator.GREATER, r); }
    public static Expr.Binary range(ExprInterface l, ExprInterface r) { return binary(l, BinaryOperator.RANGE, r); }

    public static Expr.Logical and(ExprInterface l, ExprInterface r) {
        return new Expr.Logical(l, LogicalOperator.AND, r, null);
    }

    public static Expr.Logical or(ExprInterface l, ExprInterface r) {
        return new Expr.Logical(l, LogicalOperator.OR, r, null);
    }

    public static Expr.Unary neg(ExprInterface operand) { return new Expr.Unary(UnaryOperator.NEGATIVE, operand, null); }
    public static Expr.Unary not(ExprInterface operand) { return new Expr.Unary(UnaryOperator.NOT, operand, null); }

    public static Expr.Conditional cond(ExprInterface c, ExprInterface then, ExprInterface otherwise) {
        return new Expr.Conditional(c, then, otherwise, null);
    }

    // -------------------------
    // Calls / composites
    // -------------------------

    public static Expr.Call call(ExprInterface callee, ExprInterface... args) {
        return new Expr.Call(callee, Arrays.asList(args), null);
    }

    public static Expr.Call call(String callee, ExprInterface... args) {
        return call(var(callee), args);
    }

    public static Expr.IndexExpr index(ExprInterface target, ExprInterface index) {
        return new Expr.IndexExpr(target, index, null);
    }

    /** {@code target["key"]} */
    public static Expr.IndexExpr field(ExprInterface target, String key) {
        return index(target, str(key));
    }

    public static Expr.ListLiteral list(ExprInterface... elements) {
        return new Expr.ListLiteral(Arrays.asList(elements), null);
    }

    /** Alternating key, value expressions. */
    public static Expr.MapLiteral map(ExprInterface... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("map() needs key/value pairs");
        }
        List<Expr.MapEntry> entries = new ArrayList<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            entries.add(new Expr.MapEntry(keysAndValues[i], keysAndValues[i + 1]));
        }
        return new Expr.MapLiteral(entries, null);
    }

    public static Expr.FunctionExpr lambda(List<FunctionParam> params, Stmt... body) {
        return new Expr.FunctionExpr(params, block(body), null);
    }

    // -------------------------
    // Parameters
    // -------------------------

    public static List<FunctionParam> params(String... names) {
        List<FunctionParam> out = new ArrayList<>();
        for (String n : names) out.add(new FunctionParam(n));
        return out;
    }

    public static List<FunctionParam> signature(FunctionParam... params) {
        return new ArrayList<>(Arrays.asList(params));
    }

    public static FunctionParam param(String name) {
        return new FunctionParam(name);
    }

    public static FunctionParam param(String name, ExprInterface defaultValue) {
        return new FunctionParam(name, defaultValue, false, null);
    }

    public static FunctionParam variadic(String name) {
        return new FunctionParam(name, null, true, null);
    }

    // -------------------------
    // Statements
    // -------------------------

    public static Statement.ExprStmt expr(ExprInterface e) {
        return new Statement.ExprStmt(e);
    }

    public static Statement.VarStmt let(String name, ExprInterface initializer) {
        return new Statement.VarStmt(name, initializer, null);
    }

    public static Statement.FunctionStmt fn(String name, List<FunctionParam> params, Stmt... body) {
        return new Statement.FunctionStmt(name, params, block(body), null);
    }

    public static Statement.Block block(Stmt... statements) {
        return new Statement.Block(Arrays.asList(statements), null);
    }

    public static Statement.If ifThen(ExprInterface condition, Stmt then) {
        return new Statement.If(condition, then, null, null);
    }

    public static Statement.If ifElse(ExprInterface condition, Stmt then, Stmt otherwise) {
        return new Statement.If(condition, then, otherwise, null);
    }

    public static Statement.While whileLoop(ExprInterface condition, Stmt... body) {
        return new Statement.While(condition, block(body), null);
    }

    public static Statement.ForEach forEach(String item, ExprInterface iterable, Stmt... body) {
        return new Statement.ForEach(item, iterable, block(body), null);
    }

    public static Statement.ReturnStmt ret(ExprInterface value) {
        return new Statement.ReturnStmt(value, null);
    }

    public static Statement.ReturnStmt ret() {
        return new Statement.ReturnStmt(null, null);
    }

    public static Statement.BreakStmt brk() { return new Statement.BreakStmt(null); }
    public static Statement.ContinueStmt cont() { return new Statement.ContinueStmt(null); }

    public static Statement.TryStmt tryCatch(Stmt body, String errorName, Stmt handler) {
        return new Statement.TryStmt(body, errorName, handler, null);
    }

    public static Statement.RaiseStmt raise(ExprInterface value) {
        return new Statement.RaiseStmt(value, null);
    }

    public static Statement.ImportStmt importNames(String module, String... names) {
        return new Statement.ImportStmt(module, Arrays.asList(names), null);
    }

    public static Statement.ExportStmt export(Stmt declaration) {
        return new Statement.ExportStmt(declaration, null);
    }
}
