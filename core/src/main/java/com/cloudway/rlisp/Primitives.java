/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.cloudway.rlisp.LispError.Condition;
import com.cloudway.rlisp.LispError.TypeMismatch;
import static com.cloudway.rlisp.LispVal.*;

/**
 * List, string, boolean, reflection and error primitives.
 */
@SuppressWarnings("unused")
public final class Primitives {
    private Primitives() {}

    @Name("eq?")
    public static boolean eq(LispVal... xs) {
        for (int i = 1; i < xs.length; i++) {
            if (!xs[i - 1].equals(xs[i]))
                return false;
        }
        return true;
    }

    // ---------------------------------------------------------------------

    @Name({"and", "&&"})
    public static boolean and(Bool... xs) {
        for (Bool x : xs) {
            if (!x.value)
                return false;
        }
        return true;
    }

    @Name({"or", "||"})
    public static boolean or(Bool... xs) {
        for (Bool x : xs) {
            if (x.value)
                return true;
        }
        return false;
    }

    public static boolean not(boolean x) {
        return !x;
    }

    // ---------------------------------------------------------------------

    @Name({"cons", ":"})
    public static LispVal cons(LispVal x, LispVal xs) {
        return Pair.cons(x, xs);
    }

    public static LispVal head(LispVal xs) {
        if (xs.isNil())
            throw new LispError(ErrorCode.HEAD_OF_EMPTY_LIST);
        if (!xs.isPair())
            throw new TypeMismatch("cons", xs);
        return ((Pair)xs).head;
    }

    public static LispVal tail(LispVal xs) {
        if (xs.isNil())
            throw new LispError(ErrorCode.TAIL_OF_EMPTY_LIST);
        if (!xs.isPair())
            throw new TypeMismatch("cons", xs);
        return ((Pair)xs).tail;
    }

    @Name("empty?")
    public static boolean isEmpty(LispVal xs) {
        return xs.isNil();
    }

    @VarArgs
    public static LispVal list(LispVal args) {
        return args;
    }

    public static long length(LispVal xs) {
        if (!xs.isList())
            throw new TypeMismatch("cons", xs);
        return Pair.length(xs);
    }

    public static LispVal reverse(LispVal xs) {
        return Pair.reverse(xs);
    }

    /**
     * Concatenates strings, or lists when the first argument is not a string.
     */
    @Name({"append", "++"})
    @VarArgs
    public static LispVal append(LispVal args) {
        if (args.isNil())
            return Nil;

        if (((Pair)args).head instanceof Text) {
            StringBuilder buf = new StringBuilder();
            for (LispVal x : Pair.toList(args)) {
                if (!(x instanceof Text))
                    throw new TypeMismatch("string", x);
                buf.append(((Text)x).value);
            }
            return new Text(buf.toString());
        }

        List<LispVal> lists = Pair.toList(args);
        LispVal result = Nil;
        for (int i = lists.size(); --i >= 0; ) {
            LispVal xs = lists.get(i);
            if (!xs.isList())
                throw new TypeMismatch("cons", xs);
            result = Pair.append(xs, result);
        }
        return result;
    }

    // ---------------------------------------------------------------------

    /**
     * Concatenates the display forms of the arguments. Format strings are
     * compiled into calls of this primitive.
     */
    @VarArgs
    public static String str(LispVal args) {
        StringBuilder buf = new StringBuilder();
        for (LispVal t = args; t.isPair(); t = ((Pair)t).tail) {
            buf.append(((Pair)t).head.display());
        }
        return buf.toString();
    }

    public static LispVal chars(String s) {
        List<LispVal> res = new ArrayList<>(s.length());
        s.codePoints().forEach(c -> res.add(new Text(new String(Character.toChars(c)))));
        return Pair.fromList(res);
    }

    public static long string_length(String s) {
        return s.codePointCount(0, s.length());
    }

    public static LispVal format(Evaluator me, Env env, String template) {
        return me.eval(me.getParser().parseFormat("format", template), env);
    }

    // ---------------------------------------------------------------------

    public static LispVal type_of(LispVal x) {
        return new Symbol(x.typeName());
    }

    public static LispVal eval(Evaluator me, Env env, LispVal term) {
        return me.eval(term, env);
    }

    /**
     * Reads the first form of a string, or nil for a blank string.
     */
    public static LispVal parse(Evaluator me, String text) {
        List<LispVal> forms = me.getParser().parse("parse", text);
        return forms.isEmpty() ? Nil : forms.get(0);
    }

    /**
     * Returns the value bound to a symbol, or nil when it is unbound.
     */
    public static LispVal env(Env env, Symbol name) {
        LispVal val = env.find(name);
        return val != null ? val : Nil;
    }

    // ---------------------------------------------------------------------

    public static LispVal make_error(long code, String description, Optional<LispVal> payload) {
        if (!ErrorCode.isValid(code))
            throw new TypeMismatch("error code between 1 and 32", Long.toString(code));
        return new ErrorVal(ErrorCode.valueOf((int)code), description, payload.orElse(Nil));
    }

    public static LispVal raise(ErrorVal error) {
        throw new Condition(error);
    }

    @Name("is-error?")
    public static boolean isError(LispVal x) {
        return x instanceof ErrorVal;
    }

    public static long error_code(ErrorVal error) {
        return error.code.code();
    }

    public static String error_description(ErrorVal error) {
        return error.description;
    }

    public static LispVal error_payload(ErrorVal error) {
        return error.payload;
    }

    /**
     * Returns the value if it conforms to the named type under the
     * configured signature policy.
     */
    public static LispVal check_type(Evaluator me, LispVal expected, LispVal value) {
        String name;
        if (expected instanceof Symbol) {
            name = ((Symbol)expected).name;
        } else if (expected instanceof Text) {
            name = ((Text)expected).value;
        } else {
            throw new TypeMismatch("symbol", expected);
        }

        SignaturePolicy policy = me.getConfig().getSignaturePolicy();
        if (!policy.matches(me.getStructRegistry(), name, value))
            throw new TypeMismatch(name, value);
        return value;
    }
}
