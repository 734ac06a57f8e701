package com.tenda.script.prelude;

import static com.tenda.script.prelude.Args.callback;
import static com.tenda.script.prelude.Args.function;
import static com.tenda.script.prelude.Args.index;
import static com.tenda.script.prelude.Args.list;
import static com.tenda.script.prelude.Args.text;

import java.util.ArrayList;
import java.util.List;

import com.tenda.script.runtime.Diagnostic;
import com.tenda.script.runtime.RuntimeError;
import com.tenda.script.runtime.Value;

/**
 * The {@code Lista} dicionário. Lists are shared by reference, so the
 * mutating functions are visible through every alias.
 *
 * In scripts:
 *   Lista.insira(xs, 4)
 *   seja dobros = Lista.transforma(xs, função(x) retorna x * 2 fim)
 */
public final class ListPrelude {

    private ListPrelude() {}

    public static void register(Prelude p) {
        Prelude.Namespace ns = Prelude.namespace("Lista");

        ns.function("tamanho", (ctx, args) ->
                Value.number(list(ns.qualified("tamanho"), args, 0).size()), "lista");

        ns.function("insira", (ctx, args) -> {
            list(ns.qualified("insira"), args, 0).add(args.get(1));
            return Value.nil();
        }, "lista", "valor");

        ns.function("remova", (ctx, args) -> {
            List<Value> xs = list(ns.qualified("remova"), args, 0);
            int i = indexOf(xs, args.get(1));
            return (i < 0) ? Value.nil() : xs.remove(i);
        }, "lista", "valor");

        ns.function("remova_todos", (ctx, args) -> {
            Value target = args.get(1);
            list(ns.qualified("remova_todos"), args, 0).removeIf(v -> Value.equal(v, target));
            return Value.nil();
        }, "lista", "valor");

        ns.function("remova_por_índice", (ctx, args) -> {
            String fn = ns.qualified("remova_por_índice");
            List<Value> xs = list(fn, args, 0);
            int i = index(fn, args, 1);
            checkBounds(i, xs.size());
            return xs.remove(i);
        }, "lista", "índice");

        ns.function("obtenha", (ctx, args) -> {
            String fn = ns.qualified("obtenha");
            List<Value> xs = list(fn, args, 0);
            int i = index(fn, args, 1);
            checkBounds(i, xs.size());
            return xs.get(i);
        }, "lista", "índice");

        ns.function("índice_de", (ctx, args) -> {
            int i = indexOf(list(ns.qualified("índice_de"), args, 0), args.get(1));
            return (i < 0) ? Value.nil() : Value.number(i);
        }, "lista", "valor");

        ns.function("contém", (ctx, args) ->
                Value.bool(indexOf(list(ns.qualified("contém"), args, 0), args.get(1)) >= 0), "lista", "valor");

        ns.function("vazio", (ctx, args) ->
                Value.bool(list(ns.qualified("vazio"), args, 0).isEmpty()), "lista");

        ns.function("limpa", (ctx, args) -> {
            list(ns.qualified("limpa"), args, 0).clear();
            return Value.nil();
        }, "lista");

        // fim is inclusive
        ns.function("fatia", (ctx, args) -> {
            String fn = ns.qualified("fatia");
            List<Value> xs = list(fn, args, 0);
            int start = index(fn, args, 1);
            int end = index(fn, args, 2);
            if (start > end) throw new RuntimeError(Diagnostic.invalidRangeBounds(end));
            checkBounds(end, xs.size());
            return Value.list(new ArrayList<>(xs.subList(start, end + 1)));
        }, "lista", "início", "fim");

        ns.function("para_cada", (ctx, args) -> {
            String fn = ns.qualified("para_cada");
            List<Value> xs = new ArrayList<>(list(fn, args, 0));
            Value f = function(fn, args, 1);
            for (int i = 0; i < xs.size(); i++) {
                callback(ctx, f, xs.get(i), Value.number(i));
            }
            return Value.nil();
        }, "lista", "função");

        ns.function("transforma", (ctx, args) -> {
            String fn = ns.qualified("transforma");
            List<Value> xs = new ArrayList<>(list(fn, args, 0));
            Value f = function(fn, args, 1);
            List<Value> out = new ArrayList<>(xs.size());
            for (int i = 0; i < xs.size(); i++) {
                out.add(callback(ctx, f, xs.get(i), Value.number(i)));
            }
            return Value.list(out);
        }, "lista", "função");

        ns.function("filtra", (ctx, args) -> {
            String fn = ns.qualified("filtra");
            List<Value> xs = new ArrayList<>(list(fn, args, 0));
            Value f = function(fn, args, 1);
            List<Value> out = new ArrayList<>();
            for (int i = 0; i < xs.size(); i++) {
                if (callback(ctx, f, xs.get(i), Value.number(i)).isTruthy()) out.add(xs.get(i));
            }
            return Value.list(out);
        }, "lista", "função");

        ns.function("reduz", (ctx, args) -> {
            String fn = ns.qualified("reduz");
            List<Value> xs = new ArrayList<>(list(fn, args, 0));
            Value f = function(fn, args, 1);
            Value acc = args.get(2);
            for (Value x : xs) {
                acc = callback(ctx, f, acc, x);
            }
            return acc;
        }, "lista", "função", "inicial");

        ns.function("de_intervalo", (ctx, args) -> {
            Value r = args.get(0);
            if (r.type != Value.Type.RANGE) {
                throw new RuntimeError(Diagnostic.unexpectedType(ns.qualified("de_intervalo"), Value.Type.RANGE, r));
            }
            List<Value> out = new ArrayList<>();
            for (Value v : r.asRange()) out.add(v);
            return Value.list(out);
        }, "intervalo");

        ns.function("de_texto", (ctx, args) ->
                TextPrelude.codePoints(text(ns.qualified("de_texto"), args, 0)), "texto");

        p.define(ns);
    }

    static int indexOf(List<Value> xs, Value target) {
        for (int i = 0; i < xs.size(); i++) {
            if (Value.equal(xs.get(i), target)) return i;
        }
        return -1;
    }

    private static void checkBounds(int i, int size) {
        if (i >= size) throw new RuntimeError(Diagnostic.indexOutOfBounds(i, size));
    }
}
