package com.tenda.script.prelude;

import static com.tenda.script.prelude.Args.index;
import static com.tenda.script.prelude.Args.list;
import static com.tenda.script.prelude.Args.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import com.tenda.script.runtime.Diagnostic;
import com.tenda.script.runtime.RuntimeError;
import com.tenda.script.runtime.Value;

/**
 * The {@code Texto} dicionário and the global {@code texto} conversion.
 * Lengths and positions count code points, like text indexing does.
 */
public final class TextPrelude {

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private TextPrelude() {}

    public static void register(Prelude p) {
        p.function("texto", (ctx, args) -> Value.string(args.get(0).display()), "valor");

        Prelude.Namespace ns = Prelude.namespace("Texto");

        ns.function("tamanho", (ctx, args) -> {
            String t = text(ns.qualified("tamanho"), args, 0);
            return Value.number(t.codePointCount(0, t.length()));
        }, "texto");

        ns.function("vazio", (ctx, args) ->
                Value.bool(text(ns.qualified("vazio"), args, 0).isEmpty()), "texto");

        ns.function("subtexto", (ctx, args) -> {
            String fn = ns.qualified("subtexto");
            int[] cps = text(fn, args, 0).codePoints().toArray();
            int start = index(fn, args, 1);
            int len = index(fn, args, 2);
            if (start >= cps.length) throw new RuntimeError(Diagnostic.indexOutOfBounds(start, cps.length));
            if ((long) start + len > cps.length) {
                throw new RuntimeError(Diagnostic.indexOutOfBounds((long) start + len, cps.length));
            }
            return Value.string(new String(cps, start, len));
        }, "texto", "início", "tamanho");

        ns.function("para_lista", (ctx, args) -> codePoints(text(ns.qualified("para_lista"), args, 0)), "texto");

        ns.function("para_maiúsculas", (ctx, args) ->
                Value.string(text(ns.qualified("para_maiúsculas"), args, 0).toUpperCase(Locale.ROOT)), "texto");

        ns.function("para_minúsculas", (ctx, args) ->
                Value.string(text(ns.qualified("para_minúsculas"), args, 0).toLowerCase(Locale.ROOT)), "texto");

        ns.function("contém", (ctx, args) -> {
            String fn = ns.qualified("contém");
            return Value.bool(text(fn, args, 0).contains(text(fn, args, 1)));
        }, "texto", "subtexto");

        ns.function("começa_com", (ctx, args) -> {
            String fn = ns.qualified("começa_com");
            return Value.bool(text(fn, args, 0).startsWith(text(fn, args, 1)));
        }, "texto", "prefixo");

        ns.function("termina_com", (ctx, args) -> {
            String fn = ns.qualified("termina_com");
            return Value.bool(text(fn, args, 0).endsWith(text(fn, args, 1)));
        }, "texto", "sufixo");

        ns.function("índice_de", (ctx, args) -> {
            String fn = ns.qualified("índice_de");
            String t = text(fn, args, 0);
            int at = t.indexOf(text(fn, args, 1));
            return (at < 0) ? Value.nil() : Value.number(t.codePointCount(0, at));
        }, "texto", "subtexto");

        ns.function("repita", (ctx, args) -> {
            String fn = ns.qualified("repita");
            return Value.string(text(fn, args, 0).repeat(index(fn, args, 1)));
        }, "texto", "vezes");

        ns.function("substitua", (ctx, args) -> {
            String fn = ns.qualified("substitua");
            return Value.string(text(fn, args, 0).replace(text(fn, args, 1), text(fn, args, 2)));
        }, "texto", "antigo", "novo");

        ns.function("inverta", (ctx, args) ->
                Value.string(new StringBuilder(text(ns.qualified("inverta"), args, 0)).reverse().toString()), "texto");

        // an empty separator splits into code points
        ns.function("divida", (ctx, args) -> {
            String fn = ns.qualified("divida");
            String t = text(fn, args, 0);
            String sep = text(fn, args, 1);
            if (sep.isEmpty()) return codePoints(t);
            List<Value> out = new ArrayList<>();
            for (String part : t.split(Pattern.quote(sep), -1)) out.add(Value.string(part));
            return Value.list(out);
        }, "texto", "separador");

        ns.function("junte", (ctx, args) -> {
            String fn = ns.qualified("junte");
            List<Value> xs = list(fn, args, 0);
            String sep = text(fn, args, 1);
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < xs.size(); i++) {
                if (i > 0) sb.append(sep);
                sb.append(xs.get(i).display());
            }
            return Value.string(sb.toString());
        }, "lista", "separador");

        ns.function("remova_espaços_início_fim", (ctx, args) ->
                Value.string(text(ns.qualified("remova_espaços_início_fim"), args, 0).strip()), "texto");

        ns.function("para_número", (ctx, args) -> {
            String fn = ns.qualified("para_número");
            String t = text(fn, args, 0);
            if (!NUMBER.matcher(t).matches()) {
                throw new RuntimeError(Diagnostic.invalidArgument(fn, "texto não é um número: " + Value.string(t).repr()));
            }
            return Value.number(Double.parseDouble(t));
        }, "texto");

        p.define(ns);
    }

    static Value codePoints(String t) {
        List<Value> out = new ArrayList<>();
        t.codePoints().forEach(cp -> out.add(Value.string(new String(Character.toChars(cp)))));
        return Value.list(out);
    }
}
