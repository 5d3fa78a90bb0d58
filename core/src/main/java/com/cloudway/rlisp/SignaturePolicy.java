/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

/**
 * How {@code check-type} compares an expected type name with the type of a
 * value.
 */
public enum SignaturePolicy {
    /**
     * The expected name must equal the value's {@code type-of} name.
     */
    NOMINAL {
        @Override
        boolean matchStruct(StructType expected, StructInstance value) {
            return false;
        }
    },

    /**
     * Like {@link #NOMINAL}, but a struct value also matches another struct
     * type that declares the same field names in the same order.
     */
    STRUCTURAL {
        @Override
        boolean matchStruct(StructType expected, StructInstance value) {
            return expected.fields.equals(value.type.fields);
        }
    };

    abstract boolean matchStruct(StructType expected, StructInstance value);

    public boolean matches(StructRegistry structs, String expected, LispVal value) {
        if ("any".equals(expected) || expected.equals(value.typeName()))
            return true;

        if (value instanceof StructInstance) {
            StructType type = structs.lookup(expected);
            return type != null && matchStruct(type, (StructInstance)value);
        }
        return false;
    }
}
