/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import java.io.IOException;

/**
 * The sink written by the display primitives.
 */
public interface OutputPort {
    /**
     * Writes a string.
     *
     * @param s String to be written
     * @throws IOException if an I/O error occurs
     */
    void write(String s) throws IOException;

    /**
     * Flushes the output port.
     *
     * @throws IOException if an I/O error occurs
     */
    void flush() throws IOException;
}
