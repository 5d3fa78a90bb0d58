/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import org.junit.Test;
import static org.hamcrest.CoreMatchers.containsString;
import static org.junit.Assert.*;

public class StructTest {
    private final Evaluator evaluator = new Evaluator();

    private LispVal eval(String expr) {
        return evaluator.evaluate(expr);
    }

    private static LispError failure(Evaluator evaluator, String expr) {
        try {
            evaluator.evaluate(expr);
        } catch (LispError ex) {
            return ex;
        }
        fail("evaluation should fail: " + expr);
        return null;
    }

    private void assertFails(ErrorCode expected, String expr) {
        assertEquals(expr, expected, failure(evaluator, expr).getCode());
    }

    @Test
    public void constructorAccessorsAndPredicate() {
        eval("(define-struct point [x y])");
        eval("(define p (make-point 1 2))");

        assertEquals("1", eval("(point-x p)").show());
        assertEquals("2", eval("(point-y p)").show());
        assertEquals("#t", eval("(is-point? p)").show());
        assertEquals("#f", eval("(is-point? 5)").show());
        assertEquals("point", eval("(type-of p)").show());
        assertEquals("(make-point 1 2)", eval("p").show());
        assertEquals("#t", eval("(eq? p (make-point 1 2))").show());
    }

    @Test
    public void unknownFieldIsReported() {
        eval("(define-struct point [x y])");
        eval("(define p (make-point 1 2))");

        LispError ex = failure(evaluator, "(point-z p)");
        assertEquals(ErrorCode.NO_SUCH_FIELD, ex.getCode());
        assertThat(ex.getMessage(), containsString("point-z"));
    }

    @Test
    public void unboundNamesSharingStructPrefixAreUndefined() {
        eval("(define-struct node [value])");
        eval("(define-struct make [a])");

        assertFails(ErrorCode.UNDEFINED_IDENTIFIER, "(node-count 1)");
        assertFails(ErrorCode.UNDEFINED_IDENTIFIER, "(make-foo 1)");
        assertFails(ErrorCode.UNDEFINED_IDENTIFIER, "node-count");
        assertFails(ErrorCode.UNDEFINED_IDENTIFIER, "(node-count (make-make 1))");
        assertFails(ErrorCode.NO_SUCH_FIELD, "(node-count (make-node 1))");
    }

    @Test
    public void wrongUse() {
        eval("(define-struct point [x y])");
        eval("(define-struct pair [x])");

        assertFails(ErrorCode.ARITY_MISMATCH, "(make-point 1)");
        assertFails(ErrorCode.SIGNATURE_MISMATCH, "(point-x 5)");
        assertFails(ErrorCode.SIGNATURE_MISMATCH, "(point-x (make-pair 1))");
        assertFails(ErrorCode.ARITY_MISMATCH, "(point-x)");
    }

    @Test
    public void malformedDefinitions() {
        assertFails(ErrorCode.ARITY_MISMATCH, "(define-struct point)");
        assertFails(ErrorCode.SIGNATURE_MISMATCH, "(define-struct 5 [x])");
        assertFails(ErrorCode.BINDING_LIST, "(define-struct point x)");
        assertFails(ErrorCode.BINDING_IDENTIFIER, "(define-struct point [x 1])");
    }

    @Test
    public void defaultCapacity() {
        StructRegistry structs = evaluator.getStructRegistry();
        assertEquals(Config.DEFAULT_STRUCT_CAPACITY, structs.capacity());

        for (int i = 0; i < Config.DEFAULT_STRUCT_CAPACITY; i++) {
            eval("(define-struct s" + i + " [a])");
        }
        assertEquals(1024, structs.size());
        assertFails(ErrorCode.TOO_MANY_STRUCTS, "(define-struct one-too-many [a])");

        // redefinition does not need a free slot
        eval("(define-struct s0 [a b])");
        assertEquals("2", eval("(s0-b (make-s0 1 2))").show());
    }

    @Test
    public void configuredCapacity() {
        Evaluator small = new Evaluator(Config.getDefault().with(Config.STRUCT_CAPACITY, "2"));
        small.evaluate("(define-struct a [x]) (define-struct b [x])");

        LispError ex = failure(small, "(define-struct c [x])");
        assertEquals(ErrorCode.TOO_MANY_STRUCTS, ex.getCode());
        assertEquals(2, small.getStructRegistry().size());
        assertNull(small.getStructRegistry().lookup("c"));
    }
}
