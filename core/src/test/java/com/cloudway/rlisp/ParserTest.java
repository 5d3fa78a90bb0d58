/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import java.util.Iterator;

import org.junit.Test;
import static org.junit.Assert.*;

import static com.cloudway.rlisp.LispVal.*;

public class ParserTest {
    private final LispParser parser = new LispParser();

    private LispVal read(String text) {
        return parser.parse(text).get(0);
    }

    private LispError.Parser failure(String text) {
        try {
            parser.parse("test", text);
        } catch (LispError.Parser ex) {
            return ex;
        }
        fail("parsing should fail: " + text);
        return null;
    }

    private void assertFails(ErrorCode expected, String text) {
        assertEquals(text, expected, failure(text).getCode());
    }

    private void nfx(String expression, String expected) {
        assertEquals(expected, read(expression).show());
    }

    @Test
    public void atoms() {
        assertEquals(new Int(42), read("42"));
        assertEquals(new Int(-3), read("-3"));
        assertEquals(new Real(4.5), read("4.5"));
        assertSame(Bool.TRUE, read("#t"));
        assertSame(Bool.FALSE, read("false"));
        assertEquals(new Symbol("-"), read("-"));
        assertEquals(new Symbol("set!"), read("set!"));
        assertEquals(new Text("a\nb\"c"), read("\"a\\nb\\\"c\""));
    }

    @Test
    public void lists() {
        assertEquals("(a b c)", read("(a b c)").show());
        assertEquals("(let ((x 1)) x)", read("(let [[x 1]] x)").show());
        assertSame(Nil, read("()"));
        assertEquals(3, parser.parse("a ; comment\n b\n;; another\nc").size());
    }

    @Test
    public void abbreviations() {
        assertEquals(read("(quote x)"), read("'x"));
        assertEquals(read("(quasiquote (a (unquote b) (unquote-splicing c)))"), read("`(a ,b ,@c)"));
        assertEquals("'(1 2)", read("'(1 2)").show());
    }

    @Test
    public void curlyInfix() {
        nfx("{1 + 2 + 3}", "(+ 1 2 3)");
        nfx("{a * b}", "(* a b)");
        nfx("{1 + {2 * 3}}", "(+ 1 (* 2 3))");
        nfx("{(f x) eq? y}", "(eq? (f x) y)");
        nfx("{}", "()");
        nfx("{x}", "x");
        assertEquals(read("(+ 1 2 3)"), read("{1 + 2 + 3}"));
    }

    @Test
    public void formatString() {
        nfx("#\"a #{x} b\"", "(str \"a \" x \" b\")");
        nfx("#\"#{(f 1)}\"", "(str (f 1))");
        nfx("#\"#{\"}\"}!\"", "(str \"}\" \"!\")");
    }

    @Test
    public void syntaxErrors() {
        assertFails(ErrorCode.UNCLOSED_LIST, "(1 2");
        assertFails(ErrorCode.UNCLOSED_LIST, "[1 (2 3)");
        assertFails(ErrorCode.INFIX_OPERATORS_DIFFER, "{1 + 2 - 3}");
        assertFails(ErrorCode.UNCLOSED_INFIX_LIST, "{1 + 2");
        assertFails(ErrorCode.UNCLOSED_STRING, "\"abc");
        assertFails(ErrorCode.UNCLOSED_STRING, "#\"abc #{x}");
        assertFails(ErrorCode.PARSE_FAILED, "{1 +}");
        assertFails(ErrorCode.PARSE_FAILED, ")");
        assertFails(ErrorCode.PARSE_FAILED, "(1 2]");
        assertFails(ErrorCode.PARSE_FAILED, "'");
        assertFails(ErrorCode.PARSE_FAILED, "#\"#{a b}\"");
        assertFails(ErrorCode.FORMAT_WITHOUT_EXPRESSION, "#\"no expression\"");
        assertFails(ErrorCode.UNCLOSED_INTERPOLATION, "#\"a #{x\"");
    }

    @Test
    public void errorPosition() {
        LispError.Parser ex = failure("(1\n  (2");
        assertEquals("test", ex.filename);
        assertEquals(2, ex.line);
        assertEquals(3, ex.column);
        assertEquals("error(005): unclosed list: \"test\" (line 2, column 3)", ex.getMessage());
    }

    @Test
    public void readIsLazy() {
        Iterator<LispVal> forms = parser.read("", "(define a 1) (");
        assertTrue(forms.hasNext());
        assertEquals("(define a 1)", forms.next().show());
        try {
            forms.hasNext();
            fail("unclosed list should be reported");
        } catch (LispError ex) {
            assertEquals(ErrorCode.UNCLOSED_LIST, ex.getCode());
        }
    }

    @Test
    public void runtimeFormat() {
        assertEquals("(str \"x=\" y)", parser.parseFormat("format", "x=#{y}").show());
        assertEquals("(str \"say \\\"\" 1 \"\\\"\")", parser.parseFormat("format", "say \"#{1}\"").show());
        try {
            parser.parseFormat("format", "plain");
            fail();
        } catch (LispError ex) {
            assertEquals(ErrorCode.FORMAT_WITHOUT_EXPRESSION, ex.getCode());
        }
    }
}
