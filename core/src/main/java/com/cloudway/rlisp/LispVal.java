/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Represents a Lisp value. Parsed terms and computed results share this
 * representation.
 */
@SuppressWarnings("EqualsAndHashcode")
public interface LispVal {
    /**
     * Returns the printed representation of the value, the form read back
     * by the parser where one exists.
     */
    String show();

    /**
     * Returns the representation used by {@code display}. Differs from
     * {@link #show()} only for strings, which are written without quotes.
     */
    default String display() {
        return show();
    }

    /**
     * Returns the name reported by {@code type-of}.
     */
    String typeName();

    default boolean isSymbol() {
        return this instanceof Symbol;
    }

    default boolean isPair() {
        return this instanceof Pair;
    }

    /**
     * Returns true if this value is a proper list, including the empty list.
     */
    default boolean isList() {
        return false;
    }

    default boolean isNil() {
        return this == Nil;
    }

    default boolean isCallable() {
        return false;
    }

    // -----------------------------------------------------------------------
    // Constructors

    class Symbol implements LispVal {
        public final String name;

        public Symbol(String name) {
            this.name = name;
        }

        @Override
        public String show() {
            return name;
        }

        @Override
        public String typeName() {
            return "symbol";
        }

        public String toString() {
            return "#Symbol('" + name + "')";
        }

        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (obj instanceof Symbol)
                return name.equals(((Symbol)obj).name);
            return false;
        }

        public int hashCode() {
            return name.hashCode();
        }
    }

    final class Text implements LispVal {
        public final String value;

        public Text(String value) {
            this.value = value;
        }

        @Override
        public String show() {
            StringBuilder buf = new StringBuilder(value.length() + 2);
            buf.append('"');
            for (int i = 0, len = value.length(); i < len; i++) {
                char c = value.charAt(i);
                switch (c) {
                case '\t': buf.append("\\t"); break;
                case '\r': buf.append("\\r"); break;
                case '\n': buf.append("\\n"); break;
                case '\\': buf.append("\\\\"); break;
                case '"':  buf.append("\\\""); break;
                default:   buf.append(c);
                }
            }
            buf.append('"');
            return buf.toString();
        }

        @Override
        public String display() {
            return value;
        }

        @Override
        public String typeName() {
            return "string";
        }

        public String toString() {
            return "#Text(\"" + value + "\")";
        }

        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (obj instanceof Text)
                return value.equals(((Text)obj).value);
            return false;
        }

        public int hashCode() {
            return value.hashCode();
        }
    }

    final class Bool implements LispVal {
        public static final Bool TRUE  = new Bool(true);
        public static final Bool FALSE = new Bool(false);

        public static Bool valueOf(boolean value) {
            return value ? TRUE : FALSE;
        }

        public final boolean value;

        private Bool(boolean value) {
            this.value = value;
        }

        @Override
        public String show() {
            return value ? "#t" : "#f";
        }

        @Override
        public String typeName() {
            return "bool";
        }

        public String toString() {
            return "#Bool(" + value + ")";
        }
    }

    /**
     * Numbers are either exact 64-bit integers or doubles. Mixed arithmetic
     * promotes to double.
     */
    interface Num extends LispVal {
        double doubleValue();

        boolean isExact();

        @Override
        default String typeName() {
            return "num";
        }

        static Num make(long value) {
            return new Int(value);
        }

        static Num make(double value) {
            return new Real(value);
        }
    }

    final class Int implements Num {
        public final long value;

        public Int(long value) {
            this.value = value;
        }

        @Override
        public double doubleValue() {
            return value;
        }

        @Override
        public boolean isExact() {
            return true;
        }

        @Override
        public String show() {
            return Long.toString(value);
        }

        public String toString() {
            return "#Int(" + value + ")";
        }

        @SuppressWarnings("FloatingPointEquality")
        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (obj instanceof Int)
                return value == ((Int)obj).value;
            if (obj instanceof Real)
                return (double)value == ((Real)obj).value;
            return false;
        }

        public int hashCode() {
            return Double.hashCode(value);
        }
    }

    final class Real implements Num {
        public final double value;

        public Real(double value) {
            this.value = value;
        }

        @Override
        public double doubleValue() {
            return value;
        }

        @Override
        public boolean isExact() {
            return false;
        }

        @Override
        public String show() {
            return Double.toString(value);
        }

        public String toString() {
            return "#Real(" + value + ")";
        }

        @SuppressWarnings("FloatingPointEquality")
        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (obj instanceof Num)
                return value == ((Num)obj).doubleValue();
            return false;
        }

        public int hashCode() {
            return Double.hashCode(value);
        }
    }

    LispVal Nil = new LispVal() {
        @Override
        public boolean isList() {
            return true;
        }

        @Override
        public String show() {
            return "()";
        }

        @Override
        public String typeName() {
            return "cons";
        }

        public String toString() {
            return "#Nil";
        }
    };

    final class Pair implements LispVal {
        public final LispVal head, tail;

        private Pair(LispVal head, LispVal tail) {
            this.head = head;
            this.tail = tail;
        }

        public static Pair cons(LispVal hd, LispVal tl) {
            return new Pair(hd, tl);
        }

        public static LispVal list(LispVal x) {
            return cons(x, Nil);
        }

        public static LispVal list(LispVal x, LispVal y) {
            return cons(x, cons(y, Nil));
        }

        public static LispVal list(LispVal x, LispVal y, LispVal z) {
            return cons(x, cons(y, cons(z, Nil)));
        }

        public static LispVal fromList(List<? extends LispVal> vals) {
            return fromList(vals, Nil);
        }

        public static LispVal fromList(List<? extends LispVal> vals, LispVal tail) {
            LispVal res = tail;
            for (int i = vals.size(); --i >= 0; ) {
                res = cons(vals.get(i), res);
            }
            return res;
        }

        /**
         * Copies the elements of a proper list into a Java list.
         *
         * @throws LispError.TypeMismatch if the value is not a proper list
         */
        public static ImmutableList<LispVal> toList(LispVal xs) {
            ImmutableList.Builder<LispVal> res = ImmutableList.builder();
            LispVal t = xs;
            while (t.isPair()) {
                Pair p = (Pair)t;
                res.add(p.head);
                t = p.tail;
            }
            if (!t.isNil())
                throw new LispError.TypeMismatch("list", xs);
            return res.build();
        }

        public static int length(LispVal xs) {
            int n = 0;
            for (LispVal t = xs; t.isPair(); t = ((Pair)t).tail)
                n++;
            return n;
        }

        public static LispVal append(LispVal xs, LispVal ys) {
            if (xs.isNil())
                return ys;
            if (ys.isNil())
                return xs;
            return fromList(toList(xs), ys);
        }

        public static LispVal reverse(LispVal xs) {
            LispVal res = Nil;
            LispVal t = xs;
            while (t.isPair()) {
                Pair p = (Pair)t;
                res = cons(p.head, res);
                t = p.tail;
            }
            if (!t.isNil())
                throw new LispError.TypeMismatch("list", xs);
            return res;
        }

        @Override
        public boolean isList() {
            LispVal t = tail;
            while (t.isPair())
                t = ((Pair)t).tail;
            return t.isNil();
        }

        @Override
        public String typeName() {
            return "cons";
        }

        @Override
        public String show() {
            StringBuilder buf = new StringBuilder();
            show(buf);
            return buf.toString();
        }

        private void show(StringBuilder buf) {
            String abbrev = abbreviation();
            if (abbrev != null && tail.isPair() && ((Pair)tail).tail.isNil()) {
                buf.append(abbrev).append(((Pair)tail).head.show());
                return;
            }

            buf.append('(').append(head.show());
            LispVal t = tail;
            while (t.isPair()) {
                Pair p = (Pair)t;
                buf.append(' ').append(p.head.show());
                t = p.tail;
            }
            if (!t.isNil()) {
                buf.append(" . ").append(t.show());
            }
            buf.append(')');
        }

        private String abbreviation() {
            if (head.isSymbol()) {
                switch (((Symbol)head).name) {
                case "quote":
                    return "'";
                case "quasiquote":
                    return "`";
                case "unquote":
                    return ",";
                case "unquote-splicing":
                    return ",@";
                }
            }
            return null;
        }

        public String toString() {
            return "#Pair(" + show() + ")";
        }

        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Pair))
                return false;

            LispVal x = this, y = (LispVal)obj;
            while (x.isPair() && y.isPair()) {
                if (!((Pair)x).head.equals(((Pair)y).head))
                    return false;
                x = ((Pair)x).tail;
                y = ((Pair)y).tail;
            }
            return x.equals(y);
        }

        public int hashCode() {
            int h = 1;
            LispVal t = this;
            while (t.isPair()) {
                h = 31 * h + ((Pair)t).head.hashCode();
                t = ((Pair)t).tail;
            }
            return 31 * h + (t.isNil() ? 0 : t.hashCode());
        }
    }

    /**
     * A builtin operation. The procedure receives the environment of the call
     * site and the evaluated arguments as a proper list.
     */
    final class Prim implements LispVal {
        @FunctionalInterface
        public interface Proc {
            LispVal apply(Env env, LispVal args);
        }

        public final String name;
        public final Proc proc;

        public Prim(String name, Proc proc) {
            this.name = name;
            this.proc = proc;
        }

        @Override
        public boolean isCallable() {
            return true;
        }

        @Override
        public String typeName() {
            return "procedure";
        }

        @Override
        public String show() {
            return "#<primitive:" + name + ">";
        }

        public String toString() {
            return show();
        }
    }

    /**
     * A closure pairing a parameter list and a body with the environment in
     * which the lambda was evaluated.
     */
    final class Func implements LispVal {
        public String name = "";
        public final ImmutableList<Symbol> params;
        public final LispVal body;
        public final Env closure;

        public Func(ImmutableList<Symbol> params, LispVal body, Env closure) {
            this.params = params;
            this.body = body;
            this.closure = closure;
        }

        @Override
        public boolean isCallable() {
            return true;
        }

        @Override
        public String typeName() {
            return "procedure";
        }

        @Override
        public String show() {
            return name.isEmpty() ? "#<procedure>" : "#<procedure:" + name + ">";
        }

        public String toString() {
            return show();
        }
    }

    /**
     * A term rewriting transformer. The two kinds are kept apart: a template
     * macro evaluates its quasiquoted body with the parameters bound to the
     * unevaluated call-site terms, a rule macro substitutes the call-site
     * terms for the pattern names inside its template without evaluation.
     */
    final class Macro implements LispVal {
        public enum Kind { TEMPLATE, RULE }

        public final Kind kind;
        public final String name;
        public final LispVal pattern;
        public final LispVal body;
        public final Env closure;

        public Macro(Kind kind, String name, LispVal pattern, LispVal body, Env closure) {
            this.kind = kind;
            this.name = name;
            this.pattern = pattern;
            this.body = body;
            this.closure = closure;
        }

        @Override
        public String typeName() {
            return "procedure";
        }

        @Override
        public String show() {
            return "#<macro:" + name + ">";
        }

        public String toString() {
            return show();
        }
    }

    /**
     * A first-class error value. Produced by {@code make-error} and handed to
     * {@code try} handlers when evaluation fails.
     */
    final class ErrorVal implements LispVal {
        public final ErrorCode code;
        public final String description;
        public final LispVal payload;

        public ErrorVal(ErrorCode code, String description, LispVal payload) {
            this.code = code;
            this.description = description;
            this.payload = payload;
        }

        public ErrorVal(ErrorCode code) {
            this(code, code.description(), Nil);
        }

        @Override
        public String typeName() {
            return "error";
        }

        @Override
        public String show() {
            StringBuilder buf = new StringBuilder();
            buf.append("error(").append(code.tag()).append("): ").append(description);
            if (!payload.isNil()) {
                buf.append(": ").append(payload.display());
            }
            return buf.toString();
        }

        public String toString() {
            return "#Error(" + show() + ")";
        }

        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (obj instanceof ErrorVal) {
                ErrorVal other = (ErrorVal)obj;
                return code == other.code
                    && description.equals(other.description)
                    && payload.equals(other.payload);
            }
            return false;
        }

        public int hashCode() {
            return code.hashCode() * 31 + description.hashCode();
        }
    }
}
