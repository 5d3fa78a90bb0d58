/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import com.cloudway.rlisp.LispError.UnboundVar;
import static com.cloudway.rlisp.LispVal.*;

/**
 * A frame of symbol bindings chained to an optional outer frame. Frames are
 * shared: every closure created in a frame keeps it alive, and several
 * frames may have the same outer frame.
 *
 * <p>Frames are not safe for concurrent mutation. An interpreter session
 * must be confined to one thread or synchronized externally.</p>
 */
public final class Env {
    /**
     * Identifiers that can never be the target of {@code define} or
     * {@code set!}.
     */
    public static final ImmutableSet<String> RESERVED = ImmutableSet.of(
        "define", "lambda", "λ", "cond", "if", "let", "begin",
        "quote", "quasiquote", "unquote", "unquote-splicing",
        "define-struct", "define-macro", "define-macro-rule",
        "set!", "try", "import", "else", "nil", "empty", "_");

    private final Env outer;
    private final LispVal source;
    private final Map<Symbol, LispVal> bindings = new HashMap<>();

    /**
     * Construct a top-level environment.
     */
    public Env() {
        this(null, Nil);
    }

    private Env(Env outer, LispVal source) {
        this.outer = outer;
        this.source = source;
    }

    public Env getOuter() {
        return outer;
    }

    /**
     * Creates a child frame, used for {@code let} blocks.
     */
    public Env extend() {
        return new Env(this, Nil);
    }

    /**
     * Creates a child frame recording the procedure that was called to
     * enter it, for error call traces.
     */
    public Env extend(LispVal source) {
        return new Env(this, source);
    }

    public ImmutableList<LispVal> getCallTrace() {
        ImmutableList.Builder<LispVal> trace = ImmutableList.builder();
        for (Env env = this; env != null; env = env.outer) {
            if (env.source != Nil) {
                trace.add(env.source);
            }
        }
        return trace.build().reverse();
    }

    public static boolean isReserved(Symbol id) {
        return RESERVED.contains(id.name);
    }

    /**
     * Returns the value bound to the identifier in this frame or the nearest
     * outer frame, or null when no frame binds it.
     */
    public LispVal find(Symbol id) {
        for (Env env = this; env != null; env = env.outer) {
            LispVal val = env.bindings.get(id);
            if (val != null)
                return val;
        }
        return null;
    }

    /**
     * Resolves an identifier.
     *
     * @throws UnboundVar if no frame binds the identifier
     */
    public LispVal lookup(Symbol id) {
        LispVal val = find(id);
        if (val == null)
            throw new UnboundVar(id.name);
        return val;
    }

    public boolean isBound(Symbol id) {
        return find(id) != null;
    }

    /**
     * Binds an identifier in this frame, shadowing any outer binding.
     *
     * @throws LispError with code 028 for a reserved identifier
     */
    public void define(Symbol id, LispVal value) {
        if (isReserved(id))
            throw new LispError(ErrorCode.RESERVED_IDENTIFIER, id.name);
        bindings.put(id, value);
    }

    /**
     * Replaces the value of an existing binding in the frame that owns it.
     *
     * @throws UnboundVar if no frame binds the identifier
     */
    public void set(Symbol id, LispVal value) {
        if (isReserved(id))
            throw new LispError(ErrorCode.RESERVED_IDENTIFIER, id.name);
        for (Env env = this; env != null; env = env.outer) {
            if (env.bindings.containsKey(id)) {
                env.bindings.put(id, value);
                return;
            }
        }
        throw new UnboundVar(id.name);
    }

    /**
     * Binds an identifier in this frame without the reserved name check.
     * Used for parameters, builtins and interpreter owned bindings.
     */
    public void put(Symbol id, LispVal value) {
        bindings.put(id, value);
    }

    public void put(String name, LispVal value) {
        put(new Symbol(name), value);
    }

    /**
     * Returns a snapshot of every binding visible from this frame, inner
     * bindings taking precedence.
     */
    public ImmutableMap<Symbol, LispVal> getBindings() {
        Map<Symbol, LispVal> all = new LinkedHashMap<>();
        for (Env env = this; env != null; env = env.outer) {
            for (Map.Entry<Symbol, LispVal> e : env.bindings.entrySet()) {
                all.putIfAbsent(e.getKey(), e.getValue());
            }
        }
        return ImmutableMap.copyOf(all);
    }
}
