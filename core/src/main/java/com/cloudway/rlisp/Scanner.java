/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import java.util.Iterator;

/**
 * A lazy token stream over one source text. Position queries refer to the
 * token most recently returned by {@link #next()}.
 *
 * @param <T> the token type
 */
public interface Scanner<T> extends Iterator<T> {
    /**
     * The name of the source being scanned, used in error positions.
     */
    String source();

    /**
     * The lexeme of the current token.
     */
    String text();

    /**
     * One-based line of the current token.
     */
    int line();

    /**
     * One-based column of the current token.
     */
    int column();

    /**
     * Returns a new scanner positioned at the beginning of the same input.
     */
    Scanner<T> restart();
}
