package com.tenda.script.json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenda.script.ast.Expr;
import com.tenda.script.ast.Expr.ExprInterface;
import com.tenda.script.ast.FunctionParam;
import com.tenda.script.ast.Program;
import com.tenda.script.ast.SourceSpan;
import com.tenda.script.ast.Statement;
import com.tenda.script.ast.Statement.Stmt;

/**
 * Decodes syntax trees produced by an external parser.
 *
 * <p>A program is either an array of statements or
 * {@code {"module": "id", "statements": [...]}}. Every node is an object with a
 * {@code "type"} discriminator and an optional
 * {@code "span": {"start": 0, "end": 4, "source": "main"}}; spans without a
 * source take the module id.
 *
 * <pre>
 * {"type": "let", "name": "x", "value": {"type": "literal", "value": 1}}
 * {"type": "expr", "expression": {"type": "call",
 *     "callee": {"type": "var", "name": "exiba"},
 *     "arguments": [{"type": "var", "name": "x"}]}}
 * </pre>
 */
public final class AstJsonReader {

    private final ObjectMapper om;

    public AstJsonReader() {
        this(new ObjectMapper());
    }

    public AstJsonReader(ObjectMapper om) {
        this.om = om;
    }

    public Program read(String json, String moduleId) {
        JsonNode root;
        try {
            root = om.readTree(json);
        } catch (JsonProcessingException e) {
            throw new AstFormatException("", "invalid JSON: " + e.getOriginalMessage(), e);
        }
        return read(root, moduleId);
    }

    public Program read(Path file, String moduleId) throws IOException {
        return read(Files.readString(file), moduleId);
    }

    public Program read(JsonNode root, String moduleId) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new AstFormatException("", "empty document");
        }
        String id = moduleId;
        JsonNode statements = root;
        String path = "";
        if (root.isObject()) {
            if (root.hasNonNull("module")) id = root.get("module").asText();
            statements = root.get("statements");
            path = "/statements";
            if (statements == null) throw new AstFormatException(path, "missing");
        }
        return new Program(id, new Reader(id).stmts(statements, path));
    }

    /** Per-document state: the module id used for spans. */
    private static final class Reader {
        private final String sourceId;

        Reader(String sourceId) {
            this.sourceId = sourceId;
        }

        // -------------------------
        // Statements
        // -------------------------

        List<Stmt> stmts(JsonNode node, String path) {
            if (!node.isArray()) throw new AstFormatException(path, "expected an array of statements");
            List<Stmt> out = new ArrayList<>(node.size());
            for (int i = 0; i < node.size(); i++) {
                out.add(stmt(node.get(i), path + "/" + i));
            }
            return out;
        }

        Stmt stmt(JsonNode node, String path) {
            String type = type(node, path);
            SourceSpan span = span(node, path);
            try {
                switch (type) {
                    case "expr":
                        return new Statement.ExprStmt(expr(required(node, "expression", path), path + "/expression"));
                    case "let":
                        return new Statement.VarStmt(text(node, "name", path),
                                optionalExpr(node, "value", path), span);
                    case "function":
                        return new Statement.FunctionStmt(text(node, "name", path),
                                params(node.get("params"), path + "/params"),
                                stmt(required(node, "body", path), path + "/body"), span);
                    case "block":
                        return new Statement.Block(stmts(required(node, "statements", path), path + "/statements"), span);
                    case "if": {
                        JsonNode elseNode = node.get("else");
                        Stmt elseBranch = (elseNode == null || elseNode.isNull()) ? null : stmt(elseNode, path + "/else");
                        return new Statement.If(expr(required(node, "condition", path), path + "/condition"),
                                stmt(required(node, "then", path), path + "/then"), elseBranch, span);
                    }
                    case "while":
                        return new Statement.While(expr(required(node, "condition", path), path + "/condition"),
                                stmt(required(node, "body", path), path + "/body"), span);
                    case "forEach":
                        return new Statement.ForEach(text(node, "item", path),
                                expr(required(node, "iterable", path), path + "/iterable"),
                                stmt(required(node, "body", path), path + "/body"), span);
                    case "return":
                        return new Statement.ReturnStmt(optionalExpr(node, "value", path), span);
                    case "break":
                        return new Statement.BreakStmt(span);
                    case "continue":
                        return new Statement.ContinueStmt(span);
                    case "try":
                        return new Statement.TryStmt(stmt(required(node, "body", path), path + "/body"),
                                text(node, "error", path),
                                stmt(required(node, "handler", path), path + "/handler"), span);
                    case "raise":
                        return new Statement.RaiseStmt(expr(required(node, "value", path), path + "/value"), span);
                    case "import":
                        return new Statement.ImportStmt(text(node, "module", path), names(node.get("names"), path + "/names"), span);
                    case "export":
                        return new Statement.ExportStmt(stmt(required(node, "declaration", path), path + "/declaration"), span);
                    default:
                        throw new AstFormatException(path, "unknown statement type: " + type);
                }
            } catch (IllegalArgumentException e) {
                throw new AstFormatException(path, e.getMessage(), e);
            }
        }

        // -------------------------
        // Expressions
        // -------------------------

        ExprInterface expr(JsonNode node, String path) {
            String type = type(node, path);
            SourceSpan span = span(node, path);
            try {
                switch (type) {
                    case "literal":
                        return new Expr.Literal(literal(node.get("value"), path + "/value"), span);
                    case "var":
                        return new Expr.Variable(text(node, "name", path), span);
                    case "assign":
                        return new Expr.Assign(expr(required(node, "target", path), path + "/target"),
                                expr(required(node, "value", path), path + "/value"), span);
                    case "binary":
                        return new Expr.Binary(expr(required(node, "left", path), path + "/left"),
                                Expr.BinaryOperator.fromSymbol(text(node, "operator", path)),
                                expr(required(node, "right", path), path + "/right"), span);
                    case "logical":
                        return new Expr.Logical(expr(required(node, "left", path), path + "/left"),
                                Expr.LogicalOperator.fromSymbol(text(node, "operator", path)),
                                expr(required(node, "right", path), path + "/right"), span);
                    case "unary":
                        return new Expr.Unary(Expr.UnaryOperator.fromSymbol(text(node, "operator", path)),
                                expr(required(node, "operand", path), path + "/operand"), span);
                    case "call": {
                        List<ExprInterface> args = new ArrayList<>();
                        JsonNode argNodes = node.get("arguments");
                        if (argNodes != null) {
                            if (!argNodes.isArray()) throw new AstFormatException(path + "/arguments", "expected an array");
                            for (int i = 0; i < argNodes.size(); i++) {
                                args.add(expr(argNodes.get(i), path + "/arguments/" + i));
                            }
                        }
                        return new Expr.Call(expr(required(node, "callee", path), path + "/callee"), args, span);
                    }
                    case "index":
                        return new Expr.IndexExpr(expr(required(node, "target", path), path + "/target"),
                                expr(required(node, "index", path), path + "/index"), span);
                    case "list": {
                        JsonNode elements = required(node, "elements", path);
                        if (!elements.isArray()) throw new AstFormatException(path + "/elements", "expected an array");
                        List<ExprInterface> items = new ArrayList<>();
                        for (int i = 0; i < elements.size(); i++) {
                            items.add(expr(elements.get(i), path + "/elements/" + i));
                        }
                        return new Expr.ListLiteral(items, span);
                    }
                    case "map": {
                        JsonNode entries = required(node, "entries", path);
                        if (!entries.isArray()) throw new AstFormatException(path + "/entries", "expected an array");
                        List<Expr.MapEntry> out = new ArrayList<>();
                        for (int i = 0; i < entries.size(); i++) {
                            String p = path + "/entries/" + i;
                            JsonNode e = entries.get(i);
                            out.add(new Expr.MapEntry(expr(required(e, "key", p), p + "/key"),
                                    expr(required(e, "value", p), p + "/value")));
                        }
                        return new Expr.MapLiteral(out, span);
                    }
                    case "lambda":
                        return new Expr.FunctionExpr(params(node.get("params"), path + "/params"),
                                stmt(required(node, "body", path), path + "/body"), span);
                    case "ternary":
                        return new Expr.Conditional(expr(required(node, "condition", path), path + "/condition"),
                                expr(required(node, "then", path), path + "/then"),
                                expr(required(node, "else", path), path + "/else"), span);
                    default:
                        throw new AstFormatException(path, "unknown expression type: " + type);
                }
            } catch (IllegalArgumentException e) {
                throw new AstFormatException(path, e.getMessage(), e);
            }
        }

        private ExprInterface optionalExpr(JsonNode node, String field, String path) {
            JsonNode v = node.get(field);
            return (v == null || v.isNull()) ? null : expr(v, path + "/" + field);
        }

        private Object literal(JsonNode v, String path) {
            if (v == null || v.isNull()) return null;
            if (v.isBoolean()) return v.booleanValue();
            if (v.isNumber()) return v.doubleValue();
            if (v.isTextual()) return v.textValue();
            throw new AstFormatException(path, "literal must be null, a boolean, a number or a string");
        }

        // -------------------------
        // Parameters and names
        // -------------------------

        /** Each parameter is a bare name or {@code {"name", "default"?, "variadic"?}}. */
        private List<FunctionParam> params(JsonNode node, String path) {
            List<FunctionParam> out = new ArrayList<>();
            if (node == null || node.isNull()) return out;
            if (!node.isArray()) throw new AstFormatException(path, "expected an array");
            for (int i = 0; i < node.size(); i++) {
                JsonNode p = node.get(i);
                String pp = path + "/" + i;
                if (p.isTextual()) {
                    out.add(new FunctionParam(p.textValue()));
                } else if (p.isObject()) {
                    out.add(new FunctionParam(text(p, "name", pp),
                            optionalExpr(p, "default", pp),
                            p.path("variadic").asBoolean(false),
                            span(p, pp)));
                } else {
                    throw new AstFormatException(pp, "parameter must be a name or an object");
                }
            }
            return out;
        }

        private List<String> names(JsonNode node, String path) {
            List<String> out = new ArrayList<>();
            if (node == null || node.isNull()) return out;
            if (!node.isArray()) throw new AstFormatException(path, "expected an array of names");
            Iterator<JsonNode> it = node.elements();
            while (it.hasNext()) {
                JsonNode n = it.next();
                if (!n.isTextual()) throw new AstFormatException(path, "names must be strings");
                out.add(n.textValue());
            }
            return out;
        }

        // -------------------------
        // Helpers
        // -------------------------

        private String type(JsonNode node, String path) {
            if (node == null || !node.isObject()) throw new AstFormatException(path, "expected a node object");
            JsonNode t = node.get("type");
            if (t == null || !t.isTextual()) throw new AstFormatException(path, "missing \"type\"");
            return t.textValue();
        }

        private SourceSpan span(JsonNode node, String path) {
            JsonNode s = node.get("span");
            if (s == null || s.isNull()) return null;
            if (!s.isObject() || !s.path("start").canConvertToInt() || !s.path("end").canConvertToInt()) {
                throw new AstFormatException(path + "/span", "expected {\"start\", \"end\"}");
            }
            String source = s.hasNonNull("source") ? s.get("source").asText() : sourceId;
            try {
                return new SourceSpan(s.get("start").intValue(), s.get("end").intValue(), source);
            } catch (IllegalArgumentException e) {
                throw new AstFormatException(path + "/span", e.getMessage(), e);
            }
        }

        private JsonNode required(JsonNode node, String field, String path) {
            JsonNode v = node.get(field);
            if (v == null || v.isNull()) throw new AstFormatException(path + "/" + field, "missing");
            return v;
        }

        private String text(JsonNode node, String field, String path) {
            JsonNode v = required(node, field, path);
            if (!v.isTextual()) throw new AstFormatException(path + "/" + field, "expected a string");
            return v.textValue();
        }
    }
}
