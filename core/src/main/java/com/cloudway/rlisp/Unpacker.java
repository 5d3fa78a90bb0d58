/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import com.cloudway.rlisp.LispError.TypeMismatch;
import static com.cloudway.rlisp.LispVal.*;

/**
 * Convert Lisp value to the Java type of a primitive parameter.
 */
@FunctionalInterface
interface Unpacker {
    Object apply(Class<?> type, LispVal val);

    static Unpacker get(Class<?> type) {
        for (Map.Entry<Class<?>, Unpacker> e : Impl.unpackers) {
            if (e.getKey().isAssignableFrom(type))
                return e.getValue();
        }
        throw new IllegalArgumentException("Unrecognized java type: " + type.getName());
    }

    /**
     * Returns the name a parameter type is reported as in signature
     * mismatch errors.
     */
    static String typeName(Class<?> type) {
        String name = Impl.typeNames.get(type);
        return name != null ? name : type.getSimpleName().toLowerCase();
    }

    final class Impl {
        private Impl() {}

        static final ImmutableList<Map.Entry<Class<?>, Unpacker>> unpackers = ImmutableList.of(
            entry(CharSequence.class,   Impl::unpackString),
            entry(Boolean.class,        Impl::unpackBoolean),
            entry(Boolean.TYPE,         Impl::unpackBoolean),
            entry(Integer.class,        Impl::unpackInt),
            entry(Integer.TYPE,         Impl::unpackInt),
            entry(Long.class,           Impl::unpackLong),
            entry(Long.TYPE,            Impl::unpackLong),
            entry(Double.class,         Impl::unpackDouble),
            entry(Double.TYPE,          Impl::unpackDouble),
            entry(LispVal.class,        Impl::unpackLispVal)
        );

        static final ImmutableMap<Class<?>, String> typeNames = ImmutableMap.<Class<?>, String>builder()
            .put(String.class,         "string")
            .put(Text.class,           "string")
            .put(Boolean.class,        "bool")
            .put(Boolean.TYPE,         "bool")
            .put(Bool.class,           "bool")
            .put(Integer.class,        "integer")
            .put(Integer.TYPE,         "integer")
            .put(Long.class,           "integer")
            .put(Long.TYPE,            "integer")
            .put(Int.class,            "integer")
            .put(Double.class,         "num")
            .put(Double.TYPE,          "num")
            .put(Num.class,            "num")
            .put(Quat.class,           "quaternion")
            .put(Symbol.class,         "symbol")
            .put(Pair.class,           "cons")
            .put(ErrorVal.class,       "error")
            .put(StructInstance.class, "struct")
            .put(Func.class,           "procedure")
            .put(Prim.class,           "procedure")
            .put(LispVal.class,        "any")
            .build();

        private static Map.Entry<Class<?>, Unpacker> entry(Class<?> type, Unpacker unpacker) {
            return new SimpleImmutableEntry<>(type, unpacker);
        }

        static Object unpackString(Class<?> type, LispVal val) {
            if (val instanceof Text)
                return ((Text)val).value;
            throw new TypeMismatch("string", val);
        }

        static Object unpackBoolean(Class<?> type, LispVal val) {
            if (val instanceof Bool)
                return ((Bool)val).value;
            throw new TypeMismatch("bool", val);
        }

        static Object unpackInt(Class<?> type, LispVal val) {
            if (val instanceof Int) {
                long i = ((Int)val).value;
                if ((int)i == i)
                    return (int)i;
            }
            throw new TypeMismatch("32 bit integer", val);
        }

        static Object unpackLong(Class<?> type, LispVal val) {
            if (val instanceof Int)
                return ((Int)val).value;
            throw new TypeMismatch("integer", val);
        }

        static Object unpackDouble(Class<?> type, LispVal val) {
            if (val instanceof Num)
                return ((Num)val).doubleValue();
            throw new TypeMismatch("num", val);
        }

        static Object unpackLispVal(Class<?> type, LispVal val) {
            if (type.isInstance(val))
                return val;
            throw new TypeMismatch(typeName(type), val);
        }
    }
}
