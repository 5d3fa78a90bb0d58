/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * The shape of a user defined struct: a name and an ordered list of field
 * names.
 */
public final class StructType implements LispVal {
    public final String name;
    public final ImmutableList<String> fields;

    StructType(String name, ImmutableList<String> fields) {
        this.name = name;
        this.fields = fields;
    }

    public int indexOf(String field) {
        return fields.indexOf(field);
    }

    public boolean hasField(String field) {
        return fields.contains(field);
    }

    /**
     * Creates an instance of this struct.
     *
     * @throws LispError.NumArgs if the number of values differs from the
     *         number of fields
     */
    public StructInstance make(ImmutableList<LispVal> values) {
        if (values.size() != fields.size())
            throw new LispError.NumArgs(fields.size(), values.size());
        return new StructInstance(this, values);
    }

    @Override
    public String typeName() {
        return "struct";
    }

    @Override
    public String show() {
        return "#<struct:" + name + ">";
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("name", name)
            .add("fields", fields)
            .toString();
    }
}
