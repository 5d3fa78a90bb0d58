/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;

import com.google.common.collect.ImmutableMap;

import static com.cloudway.rlisp.LispVal.*;

// @formatter:off

/**
 * Console and file primitives. Output goes through the evaluator's
 * {@link OutputPort} and is flushed after every call, input comes from its
 * {@link InputPort}.
 */
@SuppressWarnings("unused")
public final class IOPrimitives {
    private IOPrimitives() {}

    public static final class WriterPort implements OutputPort {
        private final Writer writer;

        public WriterPort(Writer writer) {
            this.writer = writer;
        }

        @Override
        public void write(String s) throws IOException {
            writer.write(s);
        }

        @Override
        public void flush() throws IOException {
            writer.flush();
        }
    }

    public static final class ReaderPort implements InputPort {
        private final BufferedReader reader;

        public ReaderPort(Reader reader) {
            this.reader = reader instanceof BufferedReader
                ? (BufferedReader)reader
                : new BufferedReader(reader);
        }

        @Override
        public String readLine() throws IOException {
            return reader.readLine();
        }
    }

    static OutputPort stdout() {
        return new WriterPort(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
    }

    static InputPort stdin() {
        return new ReaderPort(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    }

    private static void write(Evaluator me, String s) {
        OutputPort out = me.getOutputPort();
        try {
            out.write(s);
            out.flush();
        } catch (IOException ex) {
            throw new LispError(ErrorCode.FLUSH_FAILED, ex.getMessage(), ex);
        }
    }

    @VarArgs
    public static void display(Evaluator me, LispVal args) {
        StringBuilder buf = new StringBuilder();
        for (LispVal t = args; t.isPair(); t = ((Pair)t).tail) {
            buf.append(((Pair)t).head.display());
        }
        write(me, buf.toString());
    }

    /**
     * Writes the printed forms of the arguments separated by spaces.
     */
    @VarArgs
    public static void display_debug(Evaluator me, LispVal args) {
        StringBuilder buf = new StringBuilder();
        for (LispVal t = args; t.isPair(); t = ((Pair)t).tail) {
            if (buf.length() != 0)
                buf.append(' ');
            buf.append(((Pair)t).head.show());
        }
        write(me, buf.toString());
    }

    private static final ImmutableMap<String, String> COLORS = ImmutableMap.of(
        "red",    "31",
        "green",  "32",
        "yellow", "33",
        "blue",   "34",
        "none",   "39");

    private static final ImmutableMap<String, String> STYLES = ImmutableMap.of(
        "bold",   "1",
        "normal", "22");

    /**
     * Writes text wrapped in ANSI terminal escapes for the given color and
     * style, for example {@code (display-pretty 'red 'bold "failed")}.
     */
    public static void display_pretty(Evaluator me, Symbol color, Symbol style, String text) {
        String fg = COLORS.get(color.name);
        if (fg == null)
            throw new LispError(ErrorCode.SIGNATURE_MISMATCH, "color not found: " + color.name);
        String attr = STYLES.get(style.name);
        if (attr == null)
            throw new LispError(ErrorCode.SIGNATURE_MISMATCH, "style not found: " + style.name);
        write(me, "\u001b[" + attr + ";" + fg + "m" + text + "\u001b[0m");
    }

    public static void newline(Evaluator me) {
        write(me, "\n");
    }

    public static void flush(Evaluator me) {
        write(me, "");
    }

    /**
     * Reads one line from the input port, or returns nil at end of input.
     */
    public static LispVal readline(Evaluator me) {
        try {
            String line = me.getInputPort().readLine();
            return line == null ? Nil : new Text(line);
        } catch (IOException ex) {
            throw new LispError(ErrorCode.READ_STDIN_FAILED, ex.getMessage(), ex);
        }
    }

    public static String readfile(String name) {
        try {
            return new String(Files.readAllBytes(Paths.get(name)), StandardCharsets.UTF_8);
        } catch (IOException | InvalidPathException ex) {
            throw new LispError(ErrorCode.READ_FILE_FAILED, name, ex);
        }
    }
}
