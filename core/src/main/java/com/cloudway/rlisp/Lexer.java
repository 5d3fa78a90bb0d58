/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableList;
import com.google.common.io.CharStreams;

import static com.cloudway.rlisp.LispVal.*;

/**
 * Turns source text into tokens. Atoms (numbers, strings and booleans) are
 * returned as their values, punctuation and symbols as {@link Token}
 * constants, and format strings as {@link Interpolation} values.
 */
public final class Lexer implements Scanner<LispVal> {
    public enum Token implements LispVal {
        EOI("end of input"),

        SYMBOL("symbol"),

        LP("("), RP(")"),
        LB("["), RB("]"),
        LC("{"), RC("}"),

        QUOTE("'"),
        QUASIQUOTE("`"),
        UNQUOTE(","),
        UNQUOTE_SPLICING(",@");

        private final String name;

        Token(String name) {
            this.name = name;
        }

        @Override
        public String show() {
            return name;
        }

        @Override
        public String typeName() {
            return "token";
        }

        public String toString() {
            return name;
        }
    }

    /**
     * One piece of a format string: either literal text or the source of an
     * embedded expression.
     */
    public static final class Span {
        public final boolean expression;
        public final String text;
        public final int line, column;

        Span(boolean expression, String text, int line, int column) {
            this.expression = expression;
            this.text = text;
            this.line = line;
            this.column = column;
        }
    }

    /**
     * A lexed {@code #"..."} format string.
     */
    public static final class Interpolation implements LispVal {
        public final ImmutableList<Span> spans;

        Interpolation(List<Span> spans) {
            this.spans = ImmutableList.copyOf(spans);
        }

        @Override
        public String show() {
            StringBuilder buf = new StringBuilder("#\"");
            for (Span s : spans) {
                if (s.expression) {
                    buf.append("#{").append(s.text).append('}');
                } else {
                    buf.append(s.text);
                }
            }
            return buf.append('"').toString();
        }

        @Override
        public String typeName() {
            return "token";
        }
    }

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern FLOAT =
        Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");

    private static final String DELIMITERS = "()[]{}\";'`,";

    private final String source;
    private final String input;
    private final int firstLine, firstColumn;

    private int pos;
    private int line, col;

    private int tokLine, tokCol;
    private String lexeme = "";

    public Lexer(String source, String input) {
        this(source, input, 1, 1);
    }

    /**
     * Constructs a lexer over a fragment of a larger source, reporting
     * positions relative to where the fragment starts.
     */
    public Lexer(String source, String input, int line, int column) {
        this.source = source;
        this.input = input;
        this.firstLine = line;
        this.firstColumn = column;
        this.line = line;
        this.col = column;
    }

    public static Lexer of(String source, Reader reader) throws IOException {
        return new Lexer(source, CharStreams.toString(reader));
    }

    @Override
    public Lexer restart() {
        return new Lexer(source, input, firstLine, firstColumn);
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public String text() {
        return lexeme;
    }

    @Override
    public int line() {
        return tokLine;
    }

    @Override
    public int column() {
        return tokCol;
    }

    @Override
    public boolean hasNext() {
        skipBlanks();
        return pos < input.length();
    }

    @Override
    public LispVal next() {
        if (!hasNext())
            throw new NoSuchElementException();

        tokLine = line;
        tokCol = col;
        int start = pos;
        LispVal tok = scan();
        lexeme = input.substring(start, pos);
        return tok;
    }

    private void skipBlanks() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == ';') {
                while (pos < input.length() && input.charAt(pos) != '\n')
                    advance();
            } else {
                break;
            }
        }
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        return c;
    }

    private int peek() {
        return pos < input.length() ? input.charAt(pos) : -1;
    }

    private LispVal scan() {
        char c = advance();
        switch (c) {
        case '(':  return Token.LP;
        case ')':  return Token.RP;
        case '[':  return Token.LB;
        case ']':  return Token.RB;
        case '{':  return Token.LC;
        case '}':  return Token.RC;
        case '\'': return Token.QUOTE;
        case '`':  return Token.QUASIQUOTE;

        case ',':
            if (peek() == '@') {
                advance();
                return Token.UNQUOTE_SPLICING;
            }
            return Token.UNQUOTE;

        case '"':
            return scanString();

        case '#':
            if (peek() == '"') {
                advance();
                return scanFormat(true);
            }
            return scanAtom();

        default:
            return scanAtom();
        }
    }

    private LispVal scanAtom() {
        int start = pos - 1;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c) || DELIMITERS.indexOf(c) != -1)
                break;
            advance();
        }

        String text = input.substring(start, pos);
        switch (text) {
        case "#t": case "true":
            return Bool.TRUE;
        case "#f": case "false":
            return Bool.FALSE;
        }

        if (INTEGER.matcher(text).matches()) {
            try {
                return Num.make(Long.parseLong(text));
            } catch (NumberFormatException ex) {
                return Num.make(Double.parseDouble(text));
            }
        }
        if (FLOAT.matcher(text).matches()) {
            return Num.make(Double.parseDouble(text));
        }
        return Token.SYMBOL;
    }

    private LispVal scanString() {
        StringBuilder buf = new StringBuilder();
        while (pos < input.length()) {
            char c = advance();
            if (c == '"')
                return new Text(buf.toString());
            if (c == '\\') {
                if (pos >= input.length())
                    break;
                buf.append(unescape(advance()));
            } else {
                buf.append(c);
            }
        }
        throw error(ErrorCode.UNCLOSED_STRING, tokLine, tokCol, null);
    }

    private static char unescape(char c) {
        switch (c) {
        case 'n': return '\n';
        case 'r': return '\r';
        case 't': return '\t';
        default:  return c;
        }
    }

    /**
     * Scans the whole remaining input as the body of a format string, as if
     * it had been written between {@code #"} and the closing quote. Quotes
     * in the body are literal text.
     *
     * @throws LispError with code 031 if the body embeds no expression, or
     *         032 for an unclosed embedded expression
     */
    public Interpolation scanTemplate() {
        tokLine = line;
        tokCol = col;
        return scanFormat(false);
    }

    private Interpolation scanFormat(boolean quoted) {
        List<Span> spans = new ArrayList<>();
        StringBuilder buf = new StringBuilder();
        int litLine = line, litCol = col;
        boolean embedded = false;

        while (pos < input.length()) {
            char c = advance();
            if (quoted && c == '"')
                return finishFormat(spans, buf, embedded, litLine, litCol);

            if (c == '\\') {
                if (pos >= input.length())
                    break;
                buf.append(unescape(advance()));
            } else if (c == '#' && peek() == '{') {
                int exprLine = line, exprCol = col;
                advance();
                if (buf.length() != 0)
                    spans.add(new Span(false, buf.toString(), litLine, litCol));
                buf.setLength(0);
                spans.add(scanEmbedded(exprLine, exprCol));
                embedded = true;
                litLine = line;
                litCol = col;
            } else {
                buf.append(c);
            }
        }
        if (quoted)
            throw error(ErrorCode.UNCLOSED_STRING, tokLine, tokCol, null);
        return finishFormat(spans, buf, embedded, litLine, litCol);
    }

    private Interpolation finishFormat(List<Span> spans, StringBuilder buf, boolean embedded,
                                       int litLine, int litCol) {
        if (buf.length() != 0)
            spans.add(new Span(false, buf.toString(), litLine, litCol));
        if (!embedded)
            throw error(ErrorCode.FORMAT_WITHOUT_EXPRESSION, tokLine, tokCol, null);
        return new Interpolation(spans);
    }

    // Reads the source of an embedded expression up to the brace that
    // balances the opening "#{". Braces inside nested string literals
    // are not counted.
    private Span scanEmbedded(int startLine, int startCol) {
        int start = pos;
        int textLine = line, textCol = col;
        int depth = 1;

        while (pos < input.length()) {
            char c = advance();
            if (c == '"') {
                skipNestedString(startLine, startCol);
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (--depth == 0) {
                    return new Span(true, input.substring(start, pos - 1), textLine, textCol);
                }
            }
        }
        throw error(ErrorCode.UNCLOSED_INTERPOLATION, startLine, startCol, null);
    }

    private void skipNestedString(int startLine, int startCol) {
        while (pos < input.length()) {
            char c = advance();
            if (c == '"')
                return;
            if (c == '\\' && pos < input.length())
                advance();
        }
        throw error(ErrorCode.UNCLOSED_INTERPOLATION, startLine, startCol, null);
    }

    private LispError error(ErrorCode code, int line, int column, String message) {
        return new LispError.Parser(code, source, line, column, message);
    }
}
