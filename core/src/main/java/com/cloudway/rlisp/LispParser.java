/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.google.common.collect.ImmutableList;

import com.cloudway.rlisp.Lexer.Interpolation;
import com.cloudway.rlisp.Lexer.Span;
import com.cloudway.rlisp.Lexer.Token;
import static com.cloudway.rlisp.Lexer.Token.*;
import static com.cloudway.rlisp.LispVal.*;

// @formatter:off

/**
 * Reads terms from source text. Curly infix groups are rewritten into prefix
 * applications and format strings into calls of {@code str}, so the
 * evaluator only ever sees atoms and lists.
 */
public class LispParser {
    public static final Symbol STR = new Symbol("str");

    /**
     * Parses every top-level form of the input.
     *
     * @throws LispError if any form is malformed
     */
    public ImmutableList<LispVal> parse(String input) {
        return parse("", input);
    }

    public ImmutableList<LispVal> parse(String name, String input) {
        return ImmutableList.copyOf(read(name, input));
    }

    /**
     * Returns a lazy sequence of the top-level forms in the input. A form is
     * only read when requested, so a syntax error in a later form surfaces
     * after the earlier forms have been consumed.
     */
    public Iterator<LispVal> read(String name, String input) {
        return read(new Lexer(name, input));
    }

    public Iterator<LispVal> read(Scanner<LispVal> scanner) {
        Parser parser = new Parser(scanner);
        return new Iterator<LispVal>() {
            private LispVal next;
            private boolean done;

            @Override
            public boolean hasNext() {
                if (next == null && !done) {
                    next = parser.p_top_level();
                    done = next == null;
                }
                return next != null;
            }

            @Override
            public LispVal next() {
                if (!hasNext())
                    throw new NoSuchElementException();
                LispVal res = next;
                next = null;
                return res;
            }
        };
    }

    /**
     * Compiles the body of a format string supplied at run time into the
     * equivalent {@code (str ...)} term.
     */
    public LispVal parseFormat(String name, String template) {
        Lexer lexer = new Lexer(name, template);
        return new Parser(lexer).p_format(lexer.scanTemplate());
    }

    private final class Parser {
        private final Scanner<LispVal> scanner;
        private LispVal token = EOI;

        // Greater than zero while inside a list. At the top level no token
        // is read past the end of the current form.
        private int nested = 0;

        Parser(Scanner<LispVal> scanner) {
            this.scanner = scanner;
        }

        private void advance() {
            if (scanner.hasNext()) {
                token = scanner.next();
            } else {
                token = EOI;
            }
        }

        private void more() {
            if (nested > 0) {
                advance();
            }
        }

        private <A> A error(ErrorCode code, String message) {
            throw error(code, scanner.line(), scanner.column(), message);
        }

        private LispError error(ErrorCode code, int line, int column, String message) {
            return new LispError.Parser(code, scanner.source(), line, column, message);
        }

        private <A> A unexpected() {
            return error(ErrorCode.PARSE_FAILED, "unexpected " + token.show());
        }

        LispVal p_top_level() {
            advance();
            return token == EOI ? null : p_expression();
        }

        private LispVal p_expression() {
            if (token instanceof Token) {
                switch ((Token)token) {
                case SYMBOL:
                    return p_symbol();

                case QUOTE:
                case QUASIQUOTE:
                case UNQUOTE:
                case UNQUOTE_SPLICING:
                    return p_abbreviation();

                case LP:
                    return p_list(RP);

                case LB:
                    return p_list(RB);

                case LC:
                    return p_curly_infix_list();

                default:
                    return unexpected();
                }
            } else if (token instanceof Interpolation) {
                LispVal res = p_format((Interpolation)token);
                more();
                return res;
            } else {
                LispVal val = token;
                more();
                return val;
            }
        }

        private LispVal p_symbol() {
            String name = scanner.text();
            more();
            return new Symbol(name);
        }

        private LispVal p_abbreviation() {
            String tag;

            switch ((Token)token) {
            case QUOTE:
                tag = "quote";
                break;

            case QUASIQUOTE:
                tag = "quasiquote";
                break;

            case UNQUOTE:
                tag = "unquote";
                break;

            case UNQUOTE_SPLICING:
                tag = "unquote-splicing";
                break;

            default:
                throw new IllegalStateException();
            }

            advance();
            if (token == EOI)
                return unexpected();
            return Pair.list(new Symbol(tag), p_expression());
        }

        private List<LispVal> p_elements(Token delim, ErrorCode unclosed) {
            int line = scanner.line(), column = scanner.column();
            List<LispVal> elems = new ArrayList<>();

            nested++;
            advance();
            while (token != delim) {
                if (token == EOI)
                    throw error(unclosed, line, column, null);
                if (token == RP || token == RB || token == RC)
                    return unexpected();
                elems.add(p_expression());
            }
            nested--;
            more();
            return elems;
        }

        private LispVal p_list(Token delim) {
            return Pair.fromList(p_elements(delim, ErrorCode.UNCLOSED_LIST));
        }

        private LispVal p_curly_infix_list() {
            int line = scanner.line(), column = scanner.column();
            List<LispVal> elems = p_elements(RC, ErrorCode.UNCLOSED_INFIX_LIST);
            return transform_infix(elems, line, column);
        }

        // {a op b op c} => (op a b c), every op being the same term
        private LispVal transform_infix(List<LispVal> elems, int line, int column) {
            int len = elems.size();
            if (len == 0)
                return Nil;
            if (len == 1)
                return elems.get(0);
            if (len % 2 == 0)
                throw error(ErrorCode.PARSE_FAILED, line, column,
                            "infix list must alternate operands and operators");

            LispVal operator = elems.get(1);
            List<LispVal> operands = new ArrayList<>();
            operands.add(elems.get(0));
            for (int i = 1; i < len; i += 2) {
                if (!operator.equals(elems.get(i))) {
                    throw error(ErrorCode.INFIX_OPERATORS_DIFFER, line, column,
                                operator.show() + " and " + elems.get(i).show());
                }
                operands.add(elems.get(i + 1));
            }
            return Pair.cons(operator, Pair.fromList(operands));
        }

        // #"a #{x} b" => (str "a " x " b")
        private LispVal p_format(Interpolation fmt) {
            List<LispVal> parts = new ArrayList<>();
            for (Span span : fmt.spans) {
                if (span.expression) {
                    parts.add(p_embedded(span));
                } else {
                    parts.add(new Text(span.text));
                }
            }
            return Pair.cons(STR, Pair.fromList(parts));
        }

        private LispVal p_embedded(Span span) {
            Lexer lexer = new Lexer(scanner.source(), span.text, span.line, span.column);
            ImmutableList<LispVal> forms = ImmutableList.copyOf(read(lexer));
            if (forms.size() != 1) {
                throw error(ErrorCode.PARSE_FAILED, span.line, span.column,
                            "interpolated expression must be a single form");
            }
            return forms.get(0);
        }
    }
}
