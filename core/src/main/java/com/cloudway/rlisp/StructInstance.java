/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import com.google.common.collect.ImmutableList;

/**
 * A value of a user defined struct. Holds exactly one value per declared
 * field, in declaration order.
 */
public final class StructInstance implements LispVal {
    public final StructType type;
    private final ImmutableList<LispVal> values;

    StructInstance(StructType type, ImmutableList<LispVal> values) {
        this.type = type;
        this.values = values;
    }

    /**
     * Returns the value of a field.
     *
     * @throws LispError with code 029 if the struct has no such field
     */
    public LispVal get(String field) {
        int i = type.indexOf(field);
        if (i < 0)
            throw new LispError(ErrorCode.NO_SUCH_FIELD, type.name + "-" + field);
        return values.get(i);
    }

    public ImmutableList<LispVal> values() {
        return values;
    }

    @Override
    public String typeName() {
        return type.name;
    }

    @Override
    public String show() {
        StringBuilder buf = new StringBuilder();
        buf.append("(make-").append(type.name);
        for (LispVal v : values) {
            buf.append(' ').append(v.show());
        }
        return buf.append(')').toString();
    }

    public String toString() {
        return "#Struct" + show();
    }

    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (obj instanceof StructInstance) {
            StructInstance other = (StructInstance)obj;
            return type == other.type && values.equals(other.values);
        }
        return false;
    }

    public int hashCode() {
        return type.name.hashCode() * 31 + values.hashCode();
    }
}
