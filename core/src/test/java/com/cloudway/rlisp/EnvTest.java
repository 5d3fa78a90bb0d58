/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import static org.junit.Assert.*;

import static com.cloudway.rlisp.LispVal.*;

public class EnvTest {
    private static final Symbol X = new Symbol("x");

    @Test
    public void innerFramesShadowOuterOnes() {
        Env global = new Env();
        global.define(X, new Int(1));

        Env inner = global.extend();
        assertEquals(new Int(1), inner.lookup(X));

        inner.define(X, new Int(2));
        assertEquals(new Int(2), inner.lookup(X));
        assertEquals(new Int(1), global.lookup(X));
        assertEquals(new Int(2), inner.getBindings().get(X));
    }

    @Test
    public void setUpdatesTheOwningFrame() {
        Env global = new Env();
        global.define(X, new Int(1));
        Env inner = global.extend().extend();

        inner.set(X, new Int(5));
        assertEquals(new Int(5), global.lookup(X));
        assertNull(inner.getOuter().getOuter().getOuter());
    }

    @Test
    public void unboundIdentifiers() {
        Env env = new Env();
        assertNull(env.find(X));
        assertFalse(env.isBound(X));

        try {
            env.lookup(X);
            fail();
        } catch (LispError.UnboundVar ex) {
            assertEquals(ErrorCode.UNDEFINED_IDENTIFIER, ex.getCode());
            assertEquals("x", ex.varname);
        }

        try {
            env.set(X, Nil);
            fail();
        } catch (LispError ex) {
            assertEquals(ErrorCode.UNDEFINED_IDENTIFIER, ex.getCode());
        }
    }

    @Test
    public void reservedIdentifiersCannotBeBound() {
        Env env = new Env();
        for (String name : new String[] {"define", "lambda", "cond", "else", "_"}) {
            try {
                env.define(new Symbol(name), Nil);
                fail(name);
            } catch (LispError ex) {
                assertEquals(ErrorCode.RESERVED_IDENTIFIER, ex.getCode());
            }
        }

        // interpreter owned bindings bypass the check
        env.put("_", new Int(3));
        assertEquals(new Int(3), env.lookup(new Symbol("_")));
    }

    @Test
    public void callTraceListsCallersOutermostFirst() {
        Func outer = new Func(ImmutableList.of(), Nil, null);
        Func inner = new Func(ImmutableList.of(), Nil, null);

        Env env = new Env().extend(outer).extend().extend(inner);
        assertEquals(ImmutableList.of(outer, inner), env.getCallTrace());
        assertTrue(new Env().getCallTrace().isEmpty());
    }
}
