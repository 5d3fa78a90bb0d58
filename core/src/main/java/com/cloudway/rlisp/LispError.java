/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import java.util.List;

import com.google.common.collect.ImmutableList;
import static com.cloudway.rlisp.LispVal.*;
import static java.util.Objects.requireNonNull;

/**
 * The single failure type of the interpreter. Each error carries a catalog
 * code, an optional detail text and the call trace active when it was raised.
 */
@SuppressWarnings("serial")
public class LispError extends RuntimeException {
    private static final int MAX_TRACE = 1000;

    private final ErrorCode code;
    private final String detail;
    private ImmutableList<LispVal> trace = ImmutableList.of();

    public LispError(ErrorCode code) {
        this(code, null);
    }

    public LispError(ErrorCode code, String detail) {
        this.code = requireNonNull(code);
        this.detail = detail;
    }

    public LispError(ErrorCode code, String detail, Throwable cause) {
        super(cause);
        this.code = requireNonNull(code);
        this.detail = detail;
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getDetail() {
        return getRawMessage();
    }

    public List<LispVal> getCallTrace() {
        return trace;
    }

    public LispError setCallTrace(List<LispVal> trace) {
        this.trace = ImmutableList.copyOf(trace);
        return this;
    }

    /**
     * Returns the canonical one line message: {@code error(NNN): description}
     * optionally followed by the detail.
     */
    @Override
    public String getMessage() {
        return code.format(getRawMessage());
    }

    protected String getRawMessage() {
        return detail;
    }

    /**
     * Returns the value handed to a {@code try} handler for this failure.
     */
    public ErrorVal toErrorValue() {
        String raw = getRawMessage();
        return new ErrorVal(code, code.description(), raw == null ? Nil : new Text(raw));
    }

    /**
     * Renders the call history, compressing consecutive repeats of the same
     * frame. Returns an empty string when no trace was recorded.
     */
    public String formatTrace() {
        StringBuilder buf = new StringBuilder();
        if (!trace.isEmpty()) {
            buf.append("Call history:\n");

            LispVal previous = trace.get(0);
            int repeats = 1;
            int total = 0;
            int i = 1;

            for (; i < trace.size() && total < MAX_TRACE; i++) {
                LispVal x = trace.get(i);
                if (x == previous) {
                    repeats++;
                } else {
                    formatSource(buf, previous, repeats);
                    previous = x;
                    repeats = 1;
                    total++;
                }
            }

            if (i < trace.size()) {
                buf.append("\t...\n");
            } else {
                formatSource(buf, previous, repeats);
            }
        }
        return buf.toString();
    }

    private static void formatSource(StringBuilder buf, LispVal x, int repeats) {
        if (x instanceof Prim) {
            buf.append("\t#<primitive:").append(((Prim)x).name).append(">");
        } else if (x instanceof Macro) {
            buf.append("\t#<macro:").append(((Macro)x).name).append(">");
        } else if (x instanceof Func) {
            Func fn = (Func)x;
            buf.append("\t(").append(fn.name.isEmpty() ? "lambda" : fn.name);
            for (Symbol p : fn.params) {
                buf.append(' ').append(p.name);
            }
            buf.append(")");
        } else {
            return;
        }

        if (repeats == 1) {
            buf.append("\n");
        } else {
            buf.append("\t(... repeated ").append(repeats).append(" times ...)\n");
        }
    }

    public static class NumArgs extends LispError {
        public final int expected;
        public final int found;

        public NumArgs(int expected, int found) {
            super(ErrorCode.ARITY_MISMATCH);
            this.expected = expected;
            this.found = found;
        }

        @Override
        protected String getRawMessage() {
            return "expected " + expected + ", found " + found;
        }
    }

    public static class TypeMismatch extends LispError {
        public final String expected;
        public final String found;

        public TypeMismatch(String expected, String found) {
            super(ErrorCode.SIGNATURE_MISMATCH);
            this.expected = expected;
            this.found = found;
        }

        public TypeMismatch(String expected, LispVal found) {
            this(expected, found.typeName());
        }

        @Override
        protected String getRawMessage() {
            return "expected " + expected + ", found " + found;
        }
    }

    public static class UnboundVar extends LispError {
        public final String varname;

        public UnboundVar(String varname) {
            super(ErrorCode.UNDEFINED_IDENTIFIER);
            this.varname = varname;
        }

        @Override
        protected String getRawMessage() {
            return varname;
        }
    }

    public static class NotFunction extends LispError {
        public final LispVal value;

        public NotFunction(LispVal value) {
            super(ErrorCode.NOT_CALLABLE);
            this.value = value;
        }

        @Override
        protected String getRawMessage() {
            return value.show();
        }
    }

    public static class BadSyntax extends LispError {
        public final LispVal form;

        public BadSyntax(ErrorCode code, LispVal form) {
            super(code);
            this.form = form;
        }

        @Override
        protected String getRawMessage() {
            return form.show();
        }
    }

    public static class Parser extends LispError {
        public final String filename;
        public final int line, column;
        private final String message;

        public Parser(ErrorCode code, String filename, int line, int column, String message) {
            super(code);
            this.filename = filename;
            this.line = line;
            this.column = column;
            this.message = message;
        }

        @Override
        protected String getRawMessage() {
            StringBuilder sb = new StringBuilder();
            if (filename != null && !filename.isEmpty()) {
                sb.append('"').append(filename).append("\" ");
            }
            if (line != -1 && column != -1) {
                sb.append("(line ").append(line);
                sb.append(", column ").append(column);
                sb.append(")");
            }
            if (message != null) {
                if (sb.length() != 0)
                    sb.append(' ');
                sb.append(message);
            }
            return sb.length() == 0 ? null : sb.toString();
        }
    }

    /**
     * An error value raised by the program itself.
     */
    public static class Condition extends LispError {
        public final ErrorVal value;

        public Condition(ErrorVal value) {
            super(value.code);
            this.value = value;
        }

        @Override
        public String getMessage() {
            return value.show();
        }

        @Override
        protected String getRawMessage() {
            return value.description;
        }

        @Override
        public ErrorVal toErrorValue() {
            return value;
        }
    }
}
