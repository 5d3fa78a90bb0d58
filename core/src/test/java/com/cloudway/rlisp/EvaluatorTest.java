/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

public class EvaluatorTest {
    private final Evaluator evaluator = new Evaluator();

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private LispVal eval(String expr) {
        return evaluator.evaluate(expr);
    }

    private LispError failure(String expr) {
        try {
            evaluator.evaluate(expr);
        } catch (LispError ex) {
            return ex;
        }
        fail("evaluation should fail: " + expr);
        return null;
    }

    private void assertFails(ErrorCode expected, String expr) {
        assertEquals(expr, expected, failure(expr).getCode());
    }

    @Test
    public void recursion() {
        String fib =
            "(define (fib n)\n" +
            "  (cond [{n < 2} n]\n" +
            "        [else (+ (fib (- n 1)) (fib (- n 2)))]))\n" +
            "(fib 10)";
        assertEquals("55", eval(fib).show());

        String factorial =
            "(define (factorial n)\n" +
            "  (if {n <= 0} 1 {n * (factorial (- n 1))}))\n" +
            "(factorial 10)";
        assertEquals("3628800", eval(factorial).show());
    }

    @Test
    public void tailCallsRunInConstantStack() {
        String loop =
            "(define (loop n acc)\n" +
            "  (cond [(= n 0) acc]\n" +
            "        [else (loop (- n 1) (+ acc 1))]))\n" +
            "(loop 100000 0)";
        assertEquals("100000", eval(loop).show());

        String count =
            "(define (count n)\n" +
            "  (if (= n 0) 'done (begin (+ 1 1) (count (- n 1)))))\n" +
            "(count 100000)";
        assertEquals("done", eval(count).show());
    }

    @Test
    public void listAccess() {
        assertEquals("20", eval("(head (tail '(10 20 30)))").show());
        assertFails(ErrorCode.HEAD_OF_EMPTY_LIST, "(head '())");
        assertFails(ErrorCode.TAIL_OF_EMPTY_LIST, "(tail nil)");
    }

    @Test
    public void lookupAndApplication() {
        assertFails(ErrorCode.UNDEFINED_IDENTIFIER, "undefined-thing");
        assertFails(ErrorCode.NOT_CALLABLE, "(1 2)");
        assertFails(ErrorCode.NO_FUNCTION, "()");
        assertFails(ErrorCode.ARITY_MISMATCH, "((lambda [x] x) 1 2)");
        assertFails(ErrorCode.ARITY_MISMATCH, "(define (id x) x) (id)");
    }

    @Test
    public void closures() {
        assertEquals("7", eval("(define (adder n) (lambda [x] (+ x n))) ((adder 3) 4)").show());
        assertEquals("6", eval("((λ [a b] {a * b}) 2 3)").show());
        assertEquals("#<procedure:square>", eval("(define (square x) {x * x}) square").show());
    }

    @Test
    public void lambdaSyntax() {
        assertFails(ErrorCode.LAMBDA_SYNTAX, "(lambda x x)");
        assertFails(ErrorCode.LAMBDA_SYNTAX, "(lambda [x])");
        assertFails(ErrorCode.PARAMETER_NOT_SYMBOL, "(lambda [1] 1)");
    }

    @Test
    public void reservedParameterNames() {
        assertFails(ErrorCode.RESERVED_IDENTIFIER, "((lambda [nil] nil) 5)");
        assertFails(ErrorCode.RESERVED_IDENTIFIER, "(lambda [x else] x)");
        assertFails(ErrorCode.RESERVED_IDENTIFIER, "(define (f if) if)");
        assertFails(ErrorCode.UNDEFINED_IDENTIFIER, "f");
    }

    @Test
    public void conditionals() {
        assertEquals("2", eval("(cond [#f 1] [#t 2])").show());
        assertEquals("3", eval("(cond [#f 1] [else 3])").show());
        assertEquals("()", eval("(cond [#f 1])").show());
        assertFails(ErrorCode.COND_NOT_BOOLEAN, "(cond [1 2])");
        assertFails(ErrorCode.COND_CASE_LENGTH, "(cond [#t])");
        assertFails(ErrorCode.COND_CASE_LENGTH, "(cond [#t 1 2])");
        assertFails(ErrorCode.COND_CASE_NOT_LIST, "(cond 5)");

        assertEquals("1", eval("(if #t 1 2)").show());
        assertEquals("2", eval("(if false 1 2)").show());
        assertFails(ErrorCode.SIGNATURE_MISMATCH, "(if 1 2 3)");
        assertFails(ErrorCode.ARITY_MISMATCH, "(if #t 1)");
    }

    @Test
    public void let() {
        assertEquals("2", eval("(let [[x 1] [y {x + 1}]] y)").show());
        assertEquals("3", eval("(let [(x 1)] (define y 2) {x + y})").show());
        assertFails(ErrorCode.BINDING_LIST, "(let 5 1)");
        assertFails(ErrorCode.BINDING_IDENTIFIER, "(let [[1 2]] 1)");
        assertFails(ErrorCode.BINDING_SHAPE, "(let [[x]] x)");
        assertFails(ErrorCode.BINDING_SHAPE, "(let [x] x)");
        assertFails(ErrorCode.LET_BODY_MISSING, "(let [[x 1]])");
    }

    @Test
    public void letDoesNotLeakBindings() {
        eval("(let [[inner 1]] inner)");
        assertFails(ErrorCode.UNDEFINED_IDENTIFIER, "inner");
    }

    @Test
    public void define() {
        assertEquals("()", eval("(define x 10)").show());
        assertEquals("10", eval("x").show());

        assertFails(ErrorCode.VALUE_NOT_BOUND_TO_SYMBOL, "(define 5 6)");
        assertFails(ErrorCode.VALUE_NOT_BOUND_TO_SYMBOL, "(define (5 x) x)");
        assertFails(ErrorCode.DEFINE_SHAPE, "(define x)");
        assertFails(ErrorCode.DEFINE_SHAPE, "(define (f x))");
        assertFails(ErrorCode.DEFINE_SHAPE, "(define x 1 2)");
        assertFails(ErrorCode.PARAMETER_NOT_SYMBOL, "(define (f 1) 1)");
        assertFails(ErrorCode.RESERVED_IDENTIFIER, "(define if 1)");
        assertFails(ErrorCode.RESERVED_IDENTIFIER, "(define (lambda x) x)");
    }

    @Test
    public void setReplacesExistingBinding() {
        assertEquals("2", eval("(define x 1) (set! x 2) x").show());
        assertEquals("5", eval("(define y 1) ((lambda [] (set! y 5))) y").show());
        assertFails(ErrorCode.UNDEFINED_IDENTIFIER, "(set! not-defined 1)");
        assertFails(ErrorCode.SIGNATURE_MISMATCH, "(set! 1 2)");
        assertFails(ErrorCode.RESERVED_IDENTIFIER, "(set! nil 1)");
    }

    @Test
    public void quasiquote() {
        assertEquals("(1 2 3 4)", eval("`(1 ,(+ 1 1) ,@(list 3 4))").show());
        assertEquals("(a b)", eval("(define x 'b) `(a ,x)").show());
        assertEquals("'x", eval("''x").show());
        assertFails(ErrorCode.PARSE_FAILED, ",x");
    }

    @Test
    public void tryHandler() {
        assertEquals("10", eval("(try (head '()) (lambda [e] (error-code e)))").show());
        assertEquals("1", eval("(try (raise (make-error 4 \"custom\" 1)) (lambda [e] (error-payload e)))").show());
        assertEquals("5", eval("(try 5 (lambda [e] 0))").show());
        assertFails(ErrorCode.NOT_CALLABLE, "(try 1 5)");
    }

    @Test
    public void formatLiteral() {
        assertEquals("hello world!", eval("(define name \"world\") #\"hello #{name}!\"").display());
        assertEquals("1 + 2 = 3", eval("#\"1 + 2 = #{{1 + 2}}\"").display());
    }

    @Test
    public void callTrace() {
        LispError ex = failure("(define (f x) (head x)) (f nil)");
        assertEquals(ErrorCode.HEAD_OF_EMPTY_LIST, ex.getCode());
        assertFalse(ex.getCallTrace().isEmpty());
        assertThat(ex.formatTrace(), containsString("(f x)"));
        assertThat(ex.formatTrace(), containsString("#<primitive:head>"));
    }

    @Test
    public void messageFormat() {
        assertEquals("error(010): cannot get the head of an empty list",
                     failure("(head nil)").getMessage());
        assertThat(failure("nope").getMessage(), is("error(001): undefined identifier: nope"));
    }

    @Test
    public void importLoadsFileOnce() throws IOException {
        File lib = tmp.newFile("lib.rl");
        Files.write(lib.toPath(), "(set! counter {counter + 1})\n(define imported-x 42)\n"
                                      .getBytes(StandardCharsets.UTF_8));
        String path = lib.getAbsolutePath().replace("\\", "\\\\");

        eval("(define counter 0)");
        eval("(import \"" + path + "\")");
        eval("(import \"" + path + "\")");
        assertEquals("42", eval("imported-x").show());
        assertEquals("1", eval("counter").show());
    }

    @Test
    public void importFailures() {
        assertFails(ErrorCode.READ_FILE_FAILED, "(import \"/no/such/file.rl\")");
        assertFails(ErrorCode.SIGNATURE_MISMATCH, "(import 42)");
    }

    @Test
    public void evaluatesFormsInOrder() {
        LispError ex = failure("(define before 1) (head nil) (define after 2)");
        assertEquals(ErrorCode.HEAD_OF_EMPTY_LIST, ex.getCode());
        assertEquals("1", eval("before").show());
        assertFails(ErrorCode.UNDEFINED_IDENTIFIER, "after");
    }

    @Test
    public void earlierFormsRunBeforeSyntaxError() {
        assertFails(ErrorCode.UNCLOSED_LIST, "(define early 1) (+ 1");
        assertEquals("1", eval("early").show());
    }
}
