package com.tenda.script.json;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenda.script.runtime.AssociativeKey;
import com.tenda.script.runtime.Diagnostic;
import com.tenda.script.runtime.RuntimeError;
import com.tenda.script.runtime.Value;

/**
 * Converts runtime values to and from Jackson trees.
 *
 * <ul>
 *   <li>números: integral values as JSON integers, others as doubles; infinito,
 *       -infinito and NaN as their display text</li>
 *   <li>dicionários: objects keyed by the unquoted key</li>
 *   <li>a list or dicionário nested inside itself: {@code "[...]"} or {@code "{...}"}</li>
 *   <li>intervalos: {@code {"início": a, "fim": b}}</li>
 *   <li>funções: their display text, e.g. {@code "<função soma>"}</li>
 * </ul>
 */
public final class ValueJson {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ValueJson() {}

    /**
     * @throws RuntimeError INVALID_ARGUMENT when a dicionário holds a text key and an
     *         integer key with the same spelling, e.g. "1" and 1
     */
    public static JsonNode toJson(Value v) {
        return toJson(v, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static JsonNode toJson(Value v, Set<Object> open) {
        switch (v.type) {
            case NIL:
                return NODES.nullNode();
            case BOOL:
                return NODES.booleanNode(v.asBool());
            case NUMBER: {
                double d = v.asNumber();
                if (!Double.isFinite(d)) return NODES.textNode(Value.formatNumber(d));
                if (d == Math.rint(d) && Math.abs(d) < 1e15) return NODES.numberNode((long) d);
                return NODES.numberNode(d);
            }
            case STRING:
                return NODES.textNode(v.asString());
            case LIST: {
                List<Value> items = v.asList();
                if (!open.add(items)) return NODES.textNode(Value.CYCLIC_LIST);
                ArrayNode arr = NODES.arrayNode();
                for (Value item : items) arr.add(toJson(item, open));
                open.remove(items);
                return arr;
            }
            case MAP: {
                Map<AssociativeKey, Value> m = v.asMap();
                if (!open.add(m)) return NODES.textNode(Value.CYCLIC_MAP);
                ObjectNode obj = NODES.objectNode();
                for (Map.Entry<AssociativeKey, Value> e : m.entrySet()) {
                    String name = e.getKey().name();
                    if (obj.has(name)) {
                        throw new RuntimeError(Diagnostic.invalidArgument("json",
                                "a chave " + name + " aparece como texto e como número"));
                    }
                    obj.set(name, toJson(e.getValue(), open));
                }
                open.remove(m);
                return obj;
            }
            case RANGE: {
                ObjectNode obj = NODES.objectNode();
                obj.put("início", v.asRange().start);
                obj.put("fim", v.asRange().end);
                return obj;
            }
            case FUNCTION:
            case NATIVE:
            default:
                return NODES.textNode(v.display());
        }
    }

    /** Objects become dicionários with text keys; arrays become lists. */
    public static Value fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return Value.nil();
        if (node.isBoolean()) return Value.bool(node.booleanValue());
        if (node.isNumber()) return Value.number(node.doubleValue());
        if (node.isTextual()) return Value.string(node.textValue());
        if (node.isArray()) {
            List<Value> items = new ArrayList<>(node.size());
            for (JsonNode item : node) items.add(fromJson(item));
            return Value.list(items);
        }
        if (node.isObject()) {
            Map<AssociativeKey, Value> m = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                m.put(AssociativeKey.of(f.getKey()), fromJson(f.getValue()));
            }
            return Value.map(m);
        }
        throw new IllegalArgumentException("Unsupported JSON node: " + node.getNodeType());
    }
}
