/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

import com.cloudway.rlisp.Lexer.Interpolation;
import com.cloudway.rlisp.Lexer.Span;
import com.cloudway.rlisp.Lexer.Token;
import static com.cloudway.rlisp.LispVal.*;

public class LexerTest {
    private static List<LispVal> tokens(Lexer lexer) {
        List<LispVal> res = new ArrayList<>();
        while (lexer.hasNext())
            res.add(lexer.next());
        return res;
    }

    @Test
    public void punctuation() {
        List<LispVal> toks = tokens(new Lexer("", "( ) [ ] { } ' ` , ,@"));
        assertArrayEquals(new LispVal[] {
            Token.LP, Token.RP, Token.LB, Token.RB, Token.LC, Token.RC,
            Token.QUOTE, Token.QUASIQUOTE, Token.UNQUOTE, Token.UNQUOTE_SPLICING
        }, toks.toArray());
    }

    @Test
    public void symbolsAndPositions() {
        Lexer lexer = new Lexer("", "(foo\n  bar-baz?)");
        assertSame(Token.LP, lexer.next());

        assertSame(Token.SYMBOL, lexer.next());
        assertEquals("foo", lexer.text());
        assertEquals(1, lexer.line());
        assertEquals(2, lexer.column());

        assertSame(Token.SYMBOL, lexer.next());
        assertEquals("bar-baz?", lexer.text());
        assertEquals(2, lexer.line());
        assertEquals(3, lexer.column());

        assertSame(Token.RP, lexer.next());
        assertFalse(lexer.hasNext());
    }

    @Test
    public void numbers() {
        List<LispVal> toks = tokens(new Lexer("", "1 -2 +3 1.5 .5 1e3 99999999999999999999"));
        assertEquals(new Int(1), toks.get(0));
        assertEquals(new Int(-2), toks.get(1));
        assertEquals(new Int(3), toks.get(2));
        assertEquals(new Real(1.5), toks.get(3));
        assertEquals(new Real(0.5), toks.get(4));
        assertEquals(new Real(1000), toks.get(5));
        assertTrue(toks.get(6) instanceof Real);
    }

    @Test
    public void restartRereadsFromTheBeginning() throws IOException {
        Lexer lexer = Lexer.of("", new StringReader("a b"));
        lexer.next();
        lexer.next();
        assertFalse(lexer.hasNext());

        Lexer again = lexer.restart();
        assertEquals(2, tokens(again).size());
    }

    @Test
    public void interpolation() {
        LispVal tok = new Lexer("", "#\"x = #{(+ 1 2)}, y = #{y}\"").next();
        assertTrue(tok instanceof Interpolation);

        List<Span> spans = ((Interpolation)tok).spans;
        assertEquals(4, spans.size());
        assertFalse(spans.get(0).expression);
        assertEquals("x = ", spans.get(0).text);
        assertTrue(spans.get(1).expression);
        assertEquals("(+ 1 2)", spans.get(1).text);
        assertEquals(", y = ", spans.get(2).text);
        assertEquals("y", spans.get(3).text);
    }

    @Test
    public void unclosedString() {
        try {
            tokens(new Lexer("", "(display \"abc)"));
            fail();
        } catch (LispError ex) {
            assertEquals(ErrorCode.UNCLOSED_STRING, ex.getCode());
        }
    }
}
