package com.tenda.script.ast;

import java.util.Collections;
import java.util.List;

import com.tenda.script.ast.Statement.Stmt;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
        SourceSpan span();
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitVariableExpr(Variable expr);
        R visitAssignExpr(Assign expr);
        R visitBinaryExpr(Binary expr);
        R visitLogicalExpr(Logical expr);
        R visitUnaryExpr(Unary expr);
        R visitCallExpr(Call expr);
        R visitIndexExpr(IndexExpr expr);
        R visitListLiteralExpr(ListLiteral expr);
        R visitMapLiteralExpr(MapLiteral expr);
        R visitFunctionExpr(FunctionExpr expr);
        R visitConditionalExpr(Conditional expr);
    }

    // -------------------------
    // Operators
    // -------------------------

    public enum BinaryOperator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        MODULO("%"),
        EXPONENT("^"),
        EQUALITY("=="),
        INEQUALITY("!="),
        GREATER(">"),
        GREATER_OR_EQUAL(">="),
        LESS("<"),
        LESS_OR_EQUAL("<="),
        RANGE("até"),
        HAS("tem"),
        LACKS("não tem");

        public final String symbol;

        BinaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public static BinaryOperator fromSymbol(String symbol) {
            for (BinaryOperator op : values()) {
                if (op.symbol.equals(symbol) || op.name().equals(symbol)) return op;
            }
            throw new IllegalArgumentException("Unknown binary operator: " + symbol);
        }
    }

    public enum LogicalOperator {
        AND("e"),
        OR("ou");

        public final String symbol;

        LogicalOperator(String symbol) {
            this.symbol = symbol;
        }

        public static LogicalOperator fromSymbol(String symbol) {
            for (LogicalOperator op : values()) {
                if (op.symbol.equals(symbol) || op.name().equals(symbol)) return op;
            }
            throw new IllegalArgumentException("Unknown logical operator: " + symbol);
        }
    }

    public enum UnaryOperator {
        NEGATIVE("-"),
        NOT("não");

        public final String symbol;

        UnaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public static UnaryOperator fromSymbol(String symbol) {
            for (UnaryOperator op : values()) {
                if (op.symbol.equals(symbol) || op.name().equals(symbol)) return op;
            }
            throw new IllegalArgumentException("Unknown unary operator: " + symbol);
        }
    }

    // -------------------------
    // Core expression nodes
    // -------------------------

    public static final class Literal implements ExprInterface {
        /** null, Boolean, Double or String. */
        public final Object value;
        public final SourceSpan span;

        public Literal(Object value, SourceSpan span) {
            if (value != null && !(value instanceof Boolean) && !(value instanceof Double) && !(value instanceof String)) {
                throw new IllegalArgumentException("Unsupported literal value: " + value.getClass().getName());
            }
            this.value = value;
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class Variable implements ExprInterface {
        public final String name;
        public final SourceSpan span;
        // true when this reference reaches a binding outside its own function
        public boolean captured;

        public Variable(String name, SourceSpan span) {
            this.name = name;
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    public static final class Assign implements ExprInterface {
        /** A {@link Variable} or an {@link IndexExpr}. */
        public final ExprInterface target;
        public final ExprInterface value;
        public final SourceSpan span;

        public Assign(ExprInterface target, ExprInterface value, SourceSpan span) {
            if (!(target instanceof Variable) && !(target instanceof IndexExpr)) {
                throw new IllegalArgumentException("Invalid assignment target");
            }
            this.target = target;
            this.value = value;
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAssignExpr(this);
        }
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final BinaryOperator operator;
        public final ExprInterface right;
        public final SourceSpan span;

        public Binary(ExprInterface left, BinaryOperator operator, ExprInterface right, SourceSpan span) {
            this.left = left;
            this.operator = operator;
            this.right = right;
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final LogicalOperator operator;
        public final ExprInterface right;
        public final SourceSpan span;

        public Logical(ExprInterface left, LogicalOperator operator, ExprInterface right, SourceSpan span) {
            this.left = left;
            this.operator = operator;
            this.right = right;
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final UnaryOperator operator;
        public final ExprInterface right;
        public final SourceSpan span;

        public Unary(UnaryOperator operator, ExprInterface right, SourceSpan span) {
            this.operator = operator;
            this.right = right;
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    // -------------------------
    // Calls
    // -------------------------

    public static final class Call implements ExprInterface {
        public final ExprInterface callee;
        public final List<ExprInterface> arguments;
        public final SourceSpan span;

        public Call(ExprInterface callee, List<ExprInterface> arguments, SourceSpan span) {
            this.callee = callee;
            this.arguments = (arguments == null) ? Collections.emptyList() : Collections.unmodifiableList(arguments);
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    // -------------------------
    // Index + composite values
    // -------------------------

    public static final class IndexExpr implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface index;
        public final SourceSpan span;

        public IndexExpr(ExprInterface target, ExprInterface index, SourceSpan span) {
            this.target = target;
            this.index = index;
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }
    }

    public static final class ListLiteral implements ExprInterface {
        public final List<ExprInterface> elements;
        public final SourceSpan span;

        public ListLiteral(List<ExprInterface> elements, SourceSpan span) {
            this.elements = Collections.unmodifiableList(elements);
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitListLiteralExpr(this);
        }
    }

    public static final class MapEntry {
        public final ExprInterface key;
        public final ExprInterface value;

        public MapEntry(ExprInterface key, ExprInterface value) {
            this.key = key;
            this.value = value;
        }
    }

    public static final class MapLiteral implements ExprInterface {
        public final List<MapEntry> entries; // deterministic order
        public final SourceSpan span;

        public MapLiteral(List<MapEntry> entries, SourceSpan span) {
            this.entries = Collections.unmodifiableList(entries);
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMapLiteralExpr(this);
        }
    }

    public static final class FunctionExpr implements ExprInterface {
        public final List<FunctionParam> params;
        public final Stmt body;
        public final SourceSpan span;

        public FunctionExpr(List<FunctionParam> params, Stmt body, SourceSpan span) {
            this.params = Collections.unmodifiableList(params);
            this.body = body;
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFunctionExpr(this);
        }
    }

    public static final class Conditional implements ExprInterface {
        public final ExprInterface condition;
        public final ExprInterface thenBranch;
        public final ExprInterface elseBranch;
        public final SourceSpan span;

        public Conditional(ExprInterface condition, ExprInterface thenBranch, ExprInterface elseBranch, SourceSpan span) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
            this.span = span;
        }

        @Override public SourceSpan span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConditionalExpr(this);
        }
    }
}
