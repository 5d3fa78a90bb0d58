/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import org.junit.Test;
import static org.junit.Assert.*;

public class ErrorCodeTest {
    @Test
    public void catalogIsClosedAndContiguous() {
        ErrorCode[] codes = ErrorCode.values();
        assertEquals(32, codes.length);
        for (int i = 0; i < codes.length; i++) {
            assertEquals(i + 1, codes[i].code());
            assertSame(codes[i], ErrorCode.valueOf(i + 1));
        }
        assertFalse(ErrorCode.isValid(0));
        assertFalse(ErrorCode.isValid(33));
        assertTrue(ErrorCode.isValid(32));
    }

    @Test
    public void canonicalText() {
        assertEquals("004", ErrorCode.ARITY_MISMATCH.tag());
        assertEquals("error(004): arity mismatch", ErrorCode.ARITY_MISMATCH.format(null));
        assertEquals("error(029): struct does not contain specified field: point-z",
                     ErrorCode.NO_SUCH_FIELD.format("point-z"));
        assertEquals("failed to define new struct; too many structs",
                     ErrorCode.valueOf(30).description());
        assertEquals("unclosed expression while interpolating string",
                     ErrorCode.UNCLOSED_INTERPOLATION.description());
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownCode() {
        ErrorCode.valueOf(40);
    }

    @Test
    public void errorValuesCarryTheCatalogCode() {
        LispError ex = new LispError.NumArgs(2, 3);
        LispVal.ErrorVal val = ex.toErrorValue();
        assertEquals(ErrorCode.ARITY_MISMATCH, val.code);
        assertEquals("arity mismatch", val.description);
        assertEquals("error(004): arity mismatch: expected 2, found 3", val.show());
        assertEquals(val.show(), ex.getMessage());
    }
}
