package com.tenda.script.prelude;

import com.tenda.script.runtime.CallContext;
import com.tenda.script.runtime.NativeFunction;
import com.tenda.script.runtime.Value;

/**
 * Console input and output through the host {@link com.tenda.script.runtime.Platform}.
 *
 * In scripts:
 *   exiba("Olá")
 *   seja nome = leia("Seu nome: ")
 *   Saída.escreva("sem quebra de linha")
 */
public final class IoPrelude {

    private IoPrelude() {}

    public static void register(Prelude p) {
        NativeFunction.Body show = (ctx, args) -> {
            ctx.platform().println(args.get(0).display());
            return Value.nil();
        };
        NativeFunction.Body write = (ctx, args) -> {
            ctx.platform().print(args.get(0).display());
            return Value.nil();
        };
        NativeFunction.Body input = (ctx, args) -> readLine(ctx);
        NativeFunction.Body prompt = (ctx, args) -> {
            ctx.platform().print(args.get(0).display());
            return readLine(ctx);
        };

        p.function("exiba", show, "valor");
        p.function("entrada", input);
        p.function("leia", prompt, "mensagem");

        Prelude.Namespace out = Prelude.namespace("Saída");
        out.function("exiba", show, "valor");
        out.function("escreva", write, "valor");
        out.function("leia", prompt, "mensagem");
        out.function("entrada", input);
        p.define(out);
    }

    /** Nada at end of input. */
    private static Value readLine(CallContext ctx) {
        String line = ctx.platform().readLine();
        return (line == null) ? Value.nil() : Value.string(line);
    }
}
