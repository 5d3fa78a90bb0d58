/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp.repl;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import com.cloudway.rlisp.Config;
import com.cloudway.rlisp.Env;
import com.cloudway.rlisp.ErrorCode;
import com.cloudway.rlisp.Evaluator;
import com.cloudway.rlisp.LispError;
import com.cloudway.rlisp.LispVal;

/**
 * One interactive or batch session: an evaluator, its global environment,
 * the prompt, and the last non-nil result, which is kept bound to {@code _}.
 */
public class Session {
    private static final Logger logger = Logger.getLogger(Session.class.getName());

    private static final String LAST = "_";

    // Parse failures that mean the input simply stopped early.
    private static final ImmutableSet<ErrorCode> INCOMPLETE = ImmutableSet.of(
        ErrorCode.UNCLOSED_LIST,
        ErrorCode.UNCLOSED_INFIX_LIST,
        ErrorCode.UNCLOSED_STRING,
        ErrorCode.UNCLOSED_INTERPOLATION);

    private final Evaluator evaluator;
    private final Env env;
    private final String prompt;

    public Session() {
        this(new Evaluator());
    }

    public Session(Config config) {
        this(new Evaluator(config));
    }

    public Session(Evaluator evaluator) {
        this.evaluator = evaluator;
        this.env = evaluator.getGlobalEnv();
        this.prompt = evaluator.getConfig().get(Config.PROMPT, "> ");
    }

    public Evaluator getEvaluator() {
        return evaluator;
    }

    public Env getEnv() {
        return env;
    }

    public String getPrompt() {
        return prompt;
    }

    /**
     * Returns the last non-nil result, or nil before the first one.
     */
    public LispVal getLast() {
        LispVal last = env.find(new LispVal.Symbol(LAST));
        return last != null ? last : LispVal.Nil;
    }

    /**
     * Returns true if the failure only means more input is needed to finish
     * the current form.
     */
    public static boolean isIncomplete(LispError ex) {
        return ex instanceof LispError.Parser && INCOMPLETE.contains(ex.getCode());
    }

    /**
     * Parses a complete chunk of interactive input.
     */
    public ImmutableList<LispVal> parse(String text) {
        return evaluator.getParser().parse(text);
    }

    /**
     * Evaluates one form in the global environment and records a non-nil
     * result as the last value.
     */
    public LispVal eval(LispVal form) {
        LispVal result = evaluator.eval(form, env);
        if (!result.isNil())
            env.put(LAST, result);
        return result;
    }

    /**
     * Evaluates forms read from the console, printing each non-nil result.
     * The first failure is reported and the remaining forms are skipped.
     *
     * @return {@code false} if a failure was reported
     */
    public boolean interact(List<LispVal> forms, PrintWriter out) {
        return interact(forms, out, out);
    }

    /**
     * Like {@link #interact(List, PrintWriter)}, but reports the failure to
     * a separate writer.
     */
    public boolean interact(List<LispVal> forms, PrintWriter out, PrintWriter err) {
        try {
            for (LispVal form : forms) {
                LispVal result = eval(form);
                if (!result.isNil())
                    out.println(result.show());
            }
            return true;
        } catch (LispError ex) {
            report(ex, err);
            return false;
        } finally {
            out.flush();
            err.flush();
        }
    }

    /**
     * Evaluates every top-level form of a script in order. An evaluation
     * failure is reported and evaluation continues with the next form; a
     * syntax error ends the script since no later form can be located.
     *
     * @return the number of failures reported
     */
    public int runScript(String name, String text, PrintWriter err) {
        int failures = 0;
        Iterator<LispVal> forms = evaluator.getParser().read(name, text);
        for (;;) {
            LispVal form;
            try {
                if (!forms.hasNext())
                    break;
                form = forms.next();
            } catch (LispError ex) {
                report(ex, err);
                failures++;
                break;
            }

            try {
                eval(form);
            } catch (LispError ex) {
                report(ex, err);
                failures++;
            }
        }
        err.flush();
        return failures;
    }

    public int runFile(String filename, PrintWriter err) throws IOException {
        String text = new String(Files.readAllBytes(Paths.get(filename)), StandardCharsets.UTF_8);
        return runScript(filename, text, err);
    }

    private static void report(LispError ex, PrintWriter out) {
        out.println(ex.getMessage());
        logger.fine(ex::formatTrace);
    }
}
