/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import static com.cloudway.rlisp.LispVal.*;

/**
 * Convert the Java result of a primitive to a Lisp value.
 */
@FunctionalInterface
interface Packer {
    LispVal apply(Object obj);

    static Packer get(Class<?> type) {
        if (type == Void.TYPE)
            return obj -> Nil;
        if (LispVal.class.isAssignableFrom(type))
            return obj -> obj == null ? Nil : (LispVal)obj;
        if (type == Boolean.TYPE || type == Boolean.class)
            return obj -> Bool.valueOf((Boolean)obj);
        if (type == Long.TYPE || type == Long.class || type == Integer.TYPE || type == Integer.class)
            return obj -> Num.make(((Number)obj).longValue());
        if (type == Double.TYPE || type == Double.class)
            return obj -> Num.make((Double)obj);
        if (CharSequence.class.isAssignableFrom(type))
            return obj -> obj == null ? Nil : new Text(obj.toString());
        throw new IllegalArgumentException("Unrecognized java type: " + type.getName());
    }
}
