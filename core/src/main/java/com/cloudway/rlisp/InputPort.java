/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import java.io.IOException;

/**
 * The source read by {@code readline}.
 */
public interface InputPort {
    /**
     * Reads one line without its terminator.
     *
     * @return the line, or null at end of input
     * @throws IOException if an I/O error occurs
     */
    String readLine() throws IOException;
}
