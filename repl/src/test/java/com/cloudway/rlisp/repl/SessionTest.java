/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp.repl;

import java.io.PrintWriter;
import java.io.StringWriter;

import org.junit.Test;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.not;
import static org.junit.Assert.*;

import com.cloudway.rlisp.LispError;
import com.cloudway.rlisp.LispVal;

public class SessionTest {
    private final Session session = new Session();
    private final StringWriter buffer = new StringWriter();
    private final PrintWriter out = new PrintWriter(buffer);

    private LispVal eval(String text) {
        LispVal result = LispVal.Nil;
        for (LispVal form : session.parse(text)) {
            result = session.eval(form);
        }
        return result;
    }

    private static boolean incomplete(Session session, String text) {
        try {
            session.parse(text);
            return false;
        } catch (LispError ex) {
            return Session.isIncomplete(ex);
        }
    }

    @Test
    public void lastValueIsBoundToUnderscore() {
        assertTrue(session.getLast().isNil());

        eval("(+ 1 2)");
        assertEquals("3", session.getLast().show());

        eval("(define y 1)");
        assertEquals("3", session.getLast().show());

        assertEquals("4", eval("(+ _ 1)").show());
        assertEquals("4", session.getLast().show());
    }

    @Test
    public void interactPrintsResultsAndStopsAtFirstFailure() {
        assertFalse(session.interact(session.parse("(define a 1) (+ a 1) (head nil) (define b 2)"), out));

        String text = buffer.toString();
        assertThat(text, containsString("2\n"));
        assertThat(text, containsString("error(010): cannot get the head of an empty list"));
        assertThat(text, not(containsString("()")));
        assertNull(session.getEnv().find(new LispVal.Symbol("b")));
    }

    @Test
    public void interactSeparatesResultsFromFailures() {
        StringWriter errors = new StringWriter();
        PrintWriter err = new PrintWriter(errors);

        assertTrue(session.interact(session.parse("(+ 1 2)"), out, err));
        assertFalse(session.interact(session.parse("(* 2 3) (head nil)"), out, err));

        assertThat(buffer.toString(), containsString("3"));
        assertThat(buffer.toString(), containsString("6"));
        assertThat(buffer.toString(), not(containsString("error(")));
        assertThat(errors.toString(), containsString("error(010)"));
        assertThat(errors.toString(), not(containsString("6")));
    }

    @Test
    public void scriptsContinueAfterEvaluationFailures() {
        int failures = session.runScript("script", "(define a 1) (head nil) (undefined) (define b 2)", out);

        assertEquals(2, failures);
        assertEquals("2", eval("b").show());
        assertThat(buffer.toString(), containsString("error(010)"));
        assertThat(buffer.toString(), containsString("error(001): undefined identifier: undefined"));
    }

    @Test
    public void scriptsStopAtSyntaxErrors() {
        int failures = session.runScript("script", "(define c 1) (+ 1 2", out);

        assertEquals(1, failures);
        assertEquals("1", eval("c").show());
        assertThat(buffer.toString(), containsString("error(005): unclosed list"));
    }

    @Test
    public void incompleteInputIsRecognized() {
        assertTrue(incomplete(session, "(define x"));
        assertTrue(incomplete(session, "{1 + 2"));
        assertTrue(incomplete(session, "\"abc"));
        assertTrue(incomplete(session, "#\"a #{x"));
        assertFalse(incomplete(session, ")"));
        assertFalse(incomplete(session, "{1 + 2 - 3}"));
        assertFalse(incomplete(session, "(+ 1 2)"));
    }

    @Test
    public void promptComesFromConfiguration() {
        assertEquals("> ", session.getPrompt());
    }
}
