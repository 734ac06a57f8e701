package com.tenda.script.prelude;

import static com.tenda.script.prelude.Args.num;

import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

import com.tenda.script.runtime.Diagnostic;
import com.tenda.script.runtime.RuntimeError;
import com.tenda.script.runtime.Value;

/**
 * MathPrelude
 *
 * The {@code Matemática} dicionário plus the global {@code infinito}.
 *
 * In scripts:
 *   seja h = Matemática.raiz_quadrada(a * a + b * b)
 *   seja x = Matemática.limita(v, 0, 1)
 */
public final class MathPrelude {

    private MathPrelude() {}

    public static void register(Prelude p) {
        p.define("infinito", Value.number(Double.POSITIVE_INFINITY));
        p.define("NaN", Value.number(Double.NaN));

        Prelude.Namespace ns = Prelude.namespace("Matemática");

        ns.value("maior_número", Value.number(Double.MAX_VALUE));
        ns.value("menor_número", Value.number(-Double.MAX_VALUE));
        ns.value("pi", Value.number(Math.PI));
        ns.value("e", Value.number(Math.E));

        unary(ns, "absoluto", Math::abs);
        unary(ns, "arredonda", MathPrelude::roundHalfAwayFromZero);
        unary(ns, "teto", Math::ceil);
        unary(ns, "piso", Math::floor);
        unary(ns, "trunca", d -> (d < 0) ? Math.ceil(d) : Math.floor(d));
        unary(ns, "sinal", Math::signum);
        unary(ns, "raiz_quadrada", Math::sqrt);
        unary(ns, "raiz_cúbica", Math::cbrt);
        unary(ns, "exponencial", Math::exp);
        unary(ns, "logaritmo_natural", Math::log);
        unary(ns, "logaritmo_10", Math::log10);
        unary(ns, "seno", Math::sin);
        unary(ns, "cosseno", Math::cos);
        unary(ns, "tangente", Math::tan);
        unary(ns, "arco_seno", Math::asin);
        unary(ns, "arco_cosseno", Math::acos);
        unary(ns, "arco_tangente", Math::atan);
        unary(ns, "graus_para_radianos", Math::toRadians);
        unary(ns, "radianos_para_graus", Math::toDegrees);

        binary(ns, "potência", Math::pow, "base", "expoente");
        binary(ns, "logaritmo", (x, base) -> Math.log(x) / Math.log(base), "número", "base");
        binary(ns, "máximo", Math::max, "número_1", "número_2");
        binary(ns, "mínimo", Math::min, "número_1", "número_2");
        binary(ns, "hipotenusa", Math::hypot, "número_1", "número_2");
        binary(ns, "arco_tangente2", Math::atan2, "y", "x");

        ns.function("limita", (ctx, args) -> {
            String fn = ns.qualified("limita");
            double x = num(fn, args, 0);
            double lo = num(fn, args, 1);
            double hi = num(fn, args, 2);
            if (x < lo) return Value.number(lo);
            if (x > hi) return Value.number(hi);
            return Value.number(x);
        }, "número", "mínimo", "máximo");

        ns.function("fatorial", (ctx, args) -> {
            String fn = ns.qualified("fatorial");
            double n = num(fn, args, 0);
            if (n < 0 || n != Math.rint(n) || Double.isInfinite(n)) {
                throw new RuntimeError(Diagnostic.invalidArgument(fn,
                        "esperado um inteiro não negativo, encontrado " + Value.formatNumber(n)));
            }
            double result = 1;
            for (long i = 2; i <= (long) n && Double.isFinite(result); i++) {
                result *= i;
            }
            return Value.number(result);
        }, "número");

        ns.function("aleatório", (ctx, args) -> {
            String fn = ns.qualified("aleatório");
            double lo = num(fn, args, 0);
            double hi = num(fn, args, 1);
            return Value.number(ctx.platform().random() * (hi - lo) + lo);
        }, "mínimo", "máximo");

        p.define(ns);
    }

    private static void unary(Prelude.Namespace ns, String name, DoubleUnaryOperator op) {
        String fn = ns.qualified(name);
        ns.function(name, (ctx, args) -> Value.number(op.applyAsDouble(num(fn, args, 0))), "número");
    }

    private static void binary(Prelude.Namespace ns, String name, DoubleBinaryOperator op, String a, String b) {
        String fn = ns.qualified(name);
        ns.function(name, (ctx, args) -> Value.number(op.applyAsDouble(num(fn, args, 0), num(fn, args, 1))), a, b);
    }

    // Math.round rounds -2.5 up to -2
    static double roundHalfAwayFromZero(double d) {
        if (!Double.isFinite(d)) return d;
        double r = Math.floor(Math.abs(d) + 0.5);
        return (d < 0 && r != 0) ? -r : r;
    }
}
