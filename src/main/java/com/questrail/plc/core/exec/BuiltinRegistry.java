package com.questrail.plc.core.exec;

import com.questrail.plc.api.IntValue;
import com.questrail.plc.api.Value;
import com.questrail.plc.core.EvaluationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * BuiltinRegistry
 * =============================================================================
 * Name → {@link Builtin} table consulted for every function call.
 *
 * <p>Names that are not registered resolve to a log-only handler, so programs
 * may call functions this runtime does not implement yet (timers, for example)
 * without failing to load. Registering a real builtin later does not change the
 * AST or the parser.</p>
 *
 * <p>{@link #standard()} provides the IEC 61131-3 numeric functions
 * {@code ABS}, {@code MIN}, {@code MAX} and {@code LIMIT}.</p>
 */
public final class BuiltinRegistry
{
    private static final Logger log = LoggerFactory.getLogger(BuiltinRegistry.class);

    private static final Builtin LOG_ONLY = (name, args) -> {
        log.debug("Function call: {}{}", name, args);
        return Evaluation.failed(EvaluationError.Kind.NO_VALUE, "Function '" + name + "' produces no value");
    };

    private final Map<String, Builtin> builtins = new HashMap<>();

    /**
     * An empty registry: every call is log-only.
     */
    public BuiltinRegistry() {
    }

    public static BuiltinRegistry standard() {
        BuiltinRegistry r = new BuiltinRegistry();
        r.register("ABS", numeric(1, args -> {
            Value x = args.get(0);
            if (x instanceof IntValue i) {
                return Value.ofInt(Math.abs(i.value()));
            }
            return Value.ofReal(Math.abs(x.asReal()));
        }));
        r.register("MIN", numeric(2, args ->
                args.get(0).asReal() <= args.get(1).asReal() ? args.get(0) : args.get(1)));
        r.register("MAX", numeric(2, args ->
                args.get(0).asReal() >= args.get(1).asReal() ? args.get(0) : args.get(1)));
        r.register("LIMIT", numeric(3, args -> {
            Value mn = args.get(0);
            Value in = args.get(1);
            Value mx = args.get(2);
            if (in.asReal() < mn.asReal()) {
                return mn;
            }
            return in.asReal() > mx.asReal() ? mx : in;
        }));
        return r;
    }

    /**
     * Registers or replaces a builtin.
     */
    public BuiltinRegistry register(String name, Builtin builtin) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(builtin, "builtin");
        builtins.put(name, builtin);
        return this;
    }

    public boolean isRegistered(String name) {
        return builtins.containsKey(name);
    }

    /**
     * Returns the builtin for the name, or the log-only handler.
     */
    public Builtin lookup(String name) {
        Objects.requireNonNull(name, "name");
        return builtins.getOrDefault(name, LOG_ONLY);
    }

    /**
     * Wraps a pure numeric function with arity and type checks.
     */
    private static Builtin numeric(int arity, Function<List<Value>, Value> body) {
        return (name, args) -> {
            if (args.size() != arity) {
                return Evaluation.failed(EvaluationError.Kind.BAD_ARGUMENTS,
                        name + " expects " + arity + " argument(s) but got " + args.size());
            }
            for (Value a : args) {
                if (!a.isNumeric()) {
                    return Evaluation.failed(EvaluationError.typeMismatch(name + " expects numeric arguments but got " + a));
                }
            }
            return Evaluation.ok(body.apply(args));
        };
    }
}
