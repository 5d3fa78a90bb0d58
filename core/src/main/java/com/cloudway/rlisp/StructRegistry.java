/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;

import com.cloudway.rlisp.LispError.BadSyntax;
import com.cloudway.rlisp.LispError.NumArgs;
import com.cloudway.rlisp.LispError.TypeMismatch;
import static com.cloudway.rlisp.LispVal.*;

/**
 * Registry of the struct types defined in one interpreter session. The
 * registry only grows and refuses new types once it holds {@code capacity}
 * of them.
 */
public final class StructRegistry {
    private static final Logger logger = Logger.getLogger(StructRegistry.class.getName());

    private final int capacity;
    private final Map<String, StructType> types = new LinkedHashMap<>();

    public StructRegistry(int capacity) {
        if (capacity < 0)
            throw new IllegalArgumentException("negative struct capacity: " + capacity);
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }

    public int size() {
        return types.size();
    }

    public StructType lookup(String name) {
        return types.get(name);
    }

    /**
     * Handles {@code (define-struct name [field ...])}: registers the type
     * and binds its constructor, predicate and accessors in the given
     * environment.
     */
    public StructType define(Env env, Pair form) {
        ImmutableList<LispVal> args = Pair.toList(form.tail);
        if (args.size() != 2)
            throw new NumArgs(2, args.size());

        LispVal name = args.get(0);
        if (!(name instanceof Symbol))
            throw new TypeMismatch("symbol", name);

        LispVal fieldList = args.get(1);
        if (!fieldList.isList())
            throw new BadSyntax(ErrorCode.BINDING_LIST, fieldList);

        ImmutableList.Builder<String> fields = ImmutableList.builder();
        for (LispVal f : Pair.toList(fieldList)) {
            if (!(f instanceof Symbol))
                throw new BadSyntax(ErrorCode.BINDING_IDENTIFIER, f);
            fields.add(((Symbol)f).name);
        }

        StructType type = register(((Symbol)name).name, fields.build());
        bind(env, type);
        return type;
    }

    /**
     * Adds a struct type. Redefining an existing name replaces it without
     * consuming capacity.
     *
     * @throws LispError with code 030 when the registry is full
     */
    public StructType register(String name, ImmutableList<String> fields) {
        if (!types.containsKey(name) && types.size() >= capacity) {
            throw new LispError(ErrorCode.TOO_MANY_STRUCTS,
                                "limit of " + capacity + " reached defining " + name);
        }

        StructType type = new StructType(name, fields);
        types.put(name, type);
        logger.fine(() -> "registered struct " + name + " " + fields);
        return type;
    }

    private static void bind(Env env, StructType type) {
        String name = type.name;

        env.define(new Symbol("make-" + name), new Prim("make-" + name, (e, args) ->
            type.make(Pair.toList(args))));

        env.define(new Symbol("is-" + name + "?"), new Prim("is-" + name + "?", (e, args) -> {
            LispVal x = single(args);
            return Bool.valueOf(x instanceof StructInstance && ((StructInstance)x).type == type);
        }));

        for (String field : type.fields) {
            String accessor = name + "-" + field;
            env.define(new Symbol(accessor), new Prim(accessor, (e, args) ->
                access(type, field, single(args))));
        }
    }

    private static LispVal single(LispVal args) {
        int n = Pair.length(args);
        if (n != 1)
            throw new NumArgs(1, n);
        return ((Pair)args).head;
    }

    private static LispVal access(StructType type, String field, LispVal x) {
        if (!(x instanceof StructInstance))
            throw new TypeMismatch(type.name, x);

        StructInstance inst = (StructInstance)x;
        if (inst.type != type && inst.type.hasField(field))
            throw new TypeMismatch(type.name, inst);
        return inst.get(field);
    }

    /**
     * Returns true if the identifier starts with the name of a registered
     * struct followed by {@code -}.
     */
    public boolean hasAccessorPrefix(String identifier) {
        for (String name : types.keySet()) {
            if (identifier.length() > name.length() + 1 && identifier.startsWith(name + "-"))
                return true;
        }
        return false;
    }

    /**
     * Returns true if the identifier has the form {@code <struct>-<field>}
     * where the value is an instance of the registered struct and the
     * struct declares no such field.
     */
    public boolean isMissingField(String identifier, LispVal value) {
        if (!(value instanceof StructInstance))
            return false;

        StructType type = ((StructInstance)value).type;
        String prefix = type.name + "-";
        return types.get(type.name) == type
            && identifier.length() > prefix.length()
            && identifier.startsWith(prefix)
            && !type.hasField(identifier.substring(prefix.length()));
    }
}
