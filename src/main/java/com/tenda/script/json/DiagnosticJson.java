package com.tenda.script.json;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenda.script.ast.SourceSpan;
import com.tenda.script.runtime.Diagnostic;
import com.tenda.script.runtime.RuntimeError;
import com.tenda.script.runtime.TraceEntry;
import com.tenda.script.runtime.Value;

/**
 * Structured rendering of a {@link Diagnostic} for hosts and the reporting layer:
 * <pre>
 * {"kind": "undefined_variable", "fatal": false,
 *  "span": {"start": 4, "end": 5, "source": "main"},
 *  "payload": {"nome": "x"},
 *  "stacktrace": [{"function": "f", "span": null}]}
 * </pre>
 */
public final class DiagnosticJson {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private DiagnosticJson() {}

    public static ObjectNode toJson(Diagnostic d) {
        ObjectNode out = NODES.objectNode();
        out.put("kind", d.kind.code);
        out.put("fatal", d.isFatal());
        out.set("span", span(d.span()));

        ObjectNode payload = out.putObject("payload");
        for (Map.Entry<String, Value> e : d.payload().entrySet()) {
            payload.set(e.getKey(), payloadValue(e.getValue()));
        }

        ArrayNode trace = out.putArray("stacktrace");
        for (TraceEntry t : d.stacktrace()) {
            ObjectNode entry = trace.addObject();
            entry.put("function", t.functionName);
            entry.set("span", span(t.callSite));
        }
        return out;
    }

    // a raised value that has no JSON form is reported by its display text
    private static JsonNode payloadValue(Value v) {
        try {
            return ValueJson.toJson(v);
        } catch (RuntimeError e) {
            return NODES.textNode(v.display());
        }
    }

    static JsonNode span(SourceSpan s) {
        if (s == null) return NODES.nullNode();
        ObjectNode n = NODES.objectNode();
        n.put("start", s.start);
        n.put("end", s.end);
        if (s.sourceId != null) n.put("source", s.sourceId);
        return n;
    }
}
