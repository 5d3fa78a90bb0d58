/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;

import com.cloudway.rlisp.LispError.BadSyntax;
import com.cloudway.rlisp.LispError.NumArgs;
import com.cloudway.rlisp.LispError.TypeMismatch;
import com.cloudway.rlisp.LispVal.Macro.Kind;
import static com.cloudway.rlisp.LispVal.*;

/**
 * Defines and expands macros. Expansion rewrites a call-site term into a
 * new term that the evaluator then evaluates in the call-site environment.
 *
 * <p>Expansion is not hygienic: identifiers introduced by a macro body can
 * capture, or be captured by, identifiers at the call site.</p>
 */
final class MacroExpander {
    private static final Logger logger = Logger.getLogger(MacroExpander.class.getName());

    private final Evaluator evaluator;

    MacroExpander(Evaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Handles {@code (define-macro (name param ...) body ...)} and
     * {@code (define-macro-rule (name pattern ...) template)}.
     */
    Macro define(Env env, Pair form, Kind kind) {
        LispVal rest = form.tail;
        if (!rest.isPair() || !rest.isList())
            throw new BadSyntax(ErrorCode.INVALID_MACRO, form);

        LispVal signature = ((Pair)rest).head;
        LispVal body = ((Pair)rest).tail;

        if (!signature.isPair() || !signature.isList() || !((Pair)signature).head.isSymbol())
            throw new BadSyntax(ErrorCode.INVALID_MACRO, form);
        if (body.isNil())
            throw new BadSyntax(ErrorCode.INVALID_MACRO, form);

        Symbol name = (Symbol)((Pair)signature).head;
        LispVal pattern = ((Pair)signature).tail;

        if (kind == Kind.TEMPLATE) {
            for (LispVal p : Pair.toList(pattern)) {
                if (!p.isSymbol())
                    throw new BadSyntax(ErrorCode.PARAMETER_NOT_SYMBOL, p);
                if (Env.isReserved((Symbol)p))
                    throw new LispError(ErrorCode.RESERVED_IDENTIFIER, ((Symbol)p).name);
            }
        } else {
            if (!((Pair)body).tail.isNil())
                throw new BadSyntax(ErrorCode.INVALID_MACRO, form);
            body = ((Pair)body).head;
        }

        Macro macro = new Macro(kind, name.name, pattern, body, env);
        env.define(name, macro);
        logger.fine(() -> "defined " + kind.name().toLowerCase() + " macro " + name.name);
        return macro;
    }

    /**
     * Rewrites a macro call. The arguments are the unevaluated call-site
     * terms.
     */
    LispVal expand(Macro macro, LispVal args) {
        switch (macro.kind) {
        case TEMPLATE:
            return expandTemplate(macro, args);
        case RULE:
            return expandRule(macro, args);
        default:
            throw new IllegalStateException(macro.kind.name());
        }
    }

    // Evaluates the body with each parameter bound to its call-site term.
    // The body is normally a quasiquote whose unquoted holes refer to the
    // parameters, so the result is the call-site terms spliced into the
    // template.
    private LispVal expandTemplate(Macro macro, LispVal args) {
        ImmutableList<LispVal> params = Pair.toList(macro.pattern);
        ImmutableList<LispVal> terms = Pair.toList(args);
        if (params.size() != terms.size())
            throw new NumArgs(params.size(), terms.size());

        Env ext = macro.closure.extend(macro);
        for (int i = 0; i < params.size(); i++) {
            ext.put((Symbol)params.get(i), terms.get(i));
        }

        LispVal result = Nil;
        for (LispVal x : Pair.toList(macro.body)) {
            result = evaluator.eval(x, ext);
        }
        return result;
    }

    private static LispVal expandRule(Macro macro, LispVal args) {
        int expected = Pair.length(macro.pattern);
        int found = Pair.length(args);
        if (expected != found)
            throw new NumArgs(expected, found);

        Map<Symbol, LispVal> matches = new HashMap<>();
        match(macro.pattern, args, matches);
        return substitute(macro.body, matches);
    }

    private static void match(LispVal pattern, LispVal input, Map<Symbol, LispVal> matches) {
        if (pattern instanceof Symbol) {
            matches.put((Symbol)pattern, input);
        } else if (pattern.isPair()) {
            if (!input.isPair() || Pair.length(pattern) != Pair.length(input))
                throw new TypeMismatch(pattern.show(), input.show());
            LispVal p = pattern, x = input;
            while (p.isPair()) {
                match(((Pair)p).head, ((Pair)x).head, matches);
                p = ((Pair)p).tail;
                x = ((Pair)x).tail;
            }
        } else if (!pattern.equals(input)) {
            throw new TypeMismatch(pattern.show(), input.show());
        }
    }

    static LispVal substitute(LispVal term, Map<Symbol, LispVal> matches) {
        if (term instanceof Symbol) {
            LispVal val = matches.get(term);
            return val != null ? val : term;
        }
        if (term.isPair()) {
            Pair p = (Pair)term;
            return Pair.cons(substitute(p.head, matches), substitute(p.tail, matches));
        }
        return term;
    }
}
