/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

/**
 * The closed catalog of numbered error conditions. Every failure raised by
 * the interpreter, and every error value built by a program, carries exactly
 * one of these codes. The descriptions are part of the external contract and
 * must not be reworded.
 */
public enum ErrorCode {
    UNDEFINED_IDENTIFIER        (1,  "undefined identifier"),
    NOT_CALLABLE                (2,  "not a callable value"),
    NO_FUNCTION                 (3,  "no function to call"),
    ARITY_MISMATCH              (4,  "arity mismatch"),
    UNCLOSED_LIST               (5,  "unclosed list"),
    INFIX_OPERATORS_DIFFER      (6,  "infix functions must be identical"),
    UNCLOSED_INFIX_LIST         (7,  "unclosed infix list"),
    UNCLOSED_STRING             (8,  "unclosed string literal"),
    SIGNATURE_MISMATCH          (9,  "signature mismatch"),
    HEAD_OF_EMPTY_LIST          (10, "cannot get the head of an empty list"),
    TAIL_OF_EMPTY_LIST          (11, "cannot get the tail of an empty list"),
    FLUSH_FAILED                (12, "could not flush stdout"),
    INVALID_MACRO               (13, "invalid macro definition"),
    READ_FILE_FAILED            (14, "could not read file"),
    READ_STDIN_FAILED           (15, "failed to read stdin"),
    PARSE_FAILED                (16, "could not parse expression"),
    LAMBDA_SYNTAX               (17, "(lambda [args...] body)"),
    COND_NOT_BOOLEAN            (18, "cond condition must be a boolean"),
    COND_CASE_LENGTH            (19, "condition case must contain 2 elements"),
    COND_CASE_NOT_LIST          (20, "condition case must be a list"),
    BINDING_LIST                (21, "binding list must be a list of bindings"),
    BINDING_IDENTIFIER          (22, "identifier in binding must be a symbol"),
    BINDING_SHAPE               (23, "binding must be a list containing a symbol and a value"),
    LET_BODY_MISSING            (24, "let body not found"),
    VALUE_NOT_BOUND_TO_SYMBOL   (25, "value must be bound to a symbol"),
    DEFINE_SHAPE                (26, "define must bind either a function or a symbol"),
    PARAMETER_NOT_SYMBOL        (27, "function parameters must be symbols"),
    RESERVED_IDENTIFIER         (28, "reserved identifier"),
    NO_SUCH_FIELD               (29, "struct does not contain specified field"),
    TOO_MANY_STRUCTS            (30, "failed to define new struct; too many structs"),
    FORMAT_WITHOUT_EXPRESSION   (31, "format string must contain expression to interpolate"),
    UNCLOSED_INTERPOLATION      (32, "unclosed expression while interpolating string");

    private static final ErrorCode[] BY_CODE = new ErrorCode[values().length + 1];

    static {
        for (ErrorCode ec : values()) {
            BY_CODE[ec.code] = ec;
        }
    }

    private final int code;
    private final String description;

    ErrorCode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int code() {
        return code;
    }

    public String description() {
        return description;
    }

    /**
     * Returns the three digit rendering of the code, e.g. {@code "004"}.
     */
    public String tag() {
        return String.format("%03d", code);
    }

    /**
     * Formats the canonical message for this code, appending the detail
     * text when one is given.
     */
    public String format(String detail) {
        StringBuilder buf = new StringBuilder();
        buf.append("error(").append(tag()).append("): ").append(description);
        if (detail != null && !detail.isEmpty()) {
            buf.append(": ").append(detail);
        }
        return buf.toString();
    }

    public static boolean isValid(long code) {
        return code >= 1 && code < BY_CODE.length;
    }

    /**
     * Returns the catalog entry for a numeric code.
     *
     * @throws IllegalArgumentException if the code is outside the catalog
     */
    public static ErrorCode valueOf(int code) {
        if (!isValid(code))
            throw new IllegalArgumentException("no such error code: " + code);
        return BY_CODE[code];
    }
}
