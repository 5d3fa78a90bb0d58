/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp.repl;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

import com.google.common.collect.ImmutableList;
import jline.Completor;
import jline.ConsoleReader;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionBuilder;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.PosixParser;

import com.cloudway.rlisp.Env;
import com.cloudway.rlisp.ErrorCode;
import com.cloudway.rlisp.LispError;
import com.cloudway.rlisp.LispVal;
import com.cloudway.rlisp.LispVal.Symbol;

/**
 * The rlisp command line: runs scripts, evaluates expressions given on the
 * command line, and provides an interactive read-eval-print loop with tab
 * completion.
 */
public class REPL implements Completor {
    private static final Logger logger = Logger.getLogger(REPL.class.getName());

    private static final String CONTINUATION = "... ";

    private final Session session;

    public REPL(Session session) {
        this.session = session;
    }

    public void runREPL() throws IOException {
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        ConsoleReader console = new ConsoleReader(System.in, out);
        console.addCompletor(this);

        StringBuilder pending = new StringBuilder();
        String line;
        while ((line = console.readLine(pending.length() == 0 ? session.getPrompt() : CONTINUATION)) != null) {
            if (pending.length() == 0) {
                if ("quit".equals(line.trim()))
                    break;
                if (line.trim().isEmpty())
                    continue;
            }
            pending.append(line).append('\n');

            ImmutableList<LispVal> forms;
            try {
                forms = session.parse(pending.toString());
            } catch (LispError ex) {
                if (Session.isIncomplete(ex))
                    continue;
                out.println(ex.getMessage());
                out.flush();
                pending.setLength(0);
                continue;
            }

            pending.setLength(0);
            session.interact(forms, out);
        }
        out.flush();
    }

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public int complete(String buffer, int cursor, List candidates) {
        String prefix = scanSymbol(buffer, cursor, 0);
        if (!prefix.isEmpty())
            completeKeywords(prefix, candidates);
        completeDefinitions(prefix, candidates);
        Collections.sort(candidates);
        return cursor - prefix.length();
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static void completeKeywords(String prefix, List candidates) {
        for (String key : Env.RESERVED) {
            if (key.startsWith(prefix) && !candidates.contains(key + " ")) {
                candidates.add(key + " ");
            }
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private void completeDefinitions(String prefix, List candidates) {
        for (Symbol var : session.getEnv().getBindings().keySet()) {
            String name = var.name;
            if (name.startsWith(prefix) && !candidates.contains(name + " ")) {
                candidates.add(name + " ");
            }
        }
    }

    static String scanSymbol(String str, int from, int to) {
        int start = -1;
        for (int i = from; --i >= to; ) {
            char ch = str.charAt(i);
            if (isSymbolChar(ch)) {
                start = i;
            } else {
                break;
            }
        }
        return start == -1 ? "" : str.substring(start, from);
    }

    private static boolean isSymbolChar(char ch) {
        return ch >= 'a' && ch <= 'z' ||
               ch >= 'A' && ch <= 'Z' ||
               ch >= '0' && ch <= '9' ||
               "!$%&*+\\-/:.<=>?@^_~|".indexOf(ch) != -1;
    }

    // -----------------------------------------------------------------------

    @SuppressWarnings("all")
    private static Option[] OPTIONS = {
        OptionBuilder.withDescription("Enter the interactive loop after running scripts")
                     .create('i'),
        OptionBuilder.withArgName("FILE")
                     .withDescription("Load a source file before anything else")
                     .hasArgs()
                     .create('L'),
        OptionBuilder.withArgName("EXPR")
                     .withDescription("Evaluate an expression and print the result")
                     .hasArg()
                     .create('e'),
        OptionBuilder.withDescription("Print this help")
                     .create('h')
    };

    private static void printHelp(Options options) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp("rlisp [OPTION]... [FILE]...", options);
    }

    private static void setupLogging() {
        if (System.getProperty("java.util.logging.config.file") != null)
            return;
        try (InputStream in = REPL.class.getResourceAsStream("/logging.properties")) {
            if (in != null)
                LogManager.getLogManager().readConfiguration(in);
        } catch (IOException ex) {
            logger.log(Level.WARNING, "cannot read logging configuration", ex);
        }
    }

    private static int runFile(Session session, String filename, PrintWriter err) {
        try {
            return session.runFile(filename, err);
        } catch (IOException ex) {
            logger.log(Level.FINE, "cannot read " + filename, ex);
            err.println(new LispError(ErrorCode.READ_FILE_FAILED, filename, ex).getMessage());
            err.flush();
            return 1;
        }
    }

    public static void main(String[] args) throws IOException {
        setupLogging();

        Options options = new Options();
        Stream.of(OPTIONS).forEach(options::addOption);

        CommandLine cmd;
        try {
            CommandLineParser parser = new PosixParser();
            cmd = parser.parse(options, args);
        } catch (ParseException ex) {
            System.err.println(ex.getMessage());
            printHelp(options);
            System.exit(1);
            return;
        }

        if (cmd.hasOption('h')) {
            printHelp(options);
            return;
        }

        Session session = new Session();
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        PrintWriter err = new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8));
        int failures = 0;

        String[] libs = cmd.getOptionValues('L');
        if (libs != null) {
            for (String lib : libs) {
                failures += runFile(session, lib, err);
            }
        }

        String[] scripts = cmd.getArgs();
        for (String script : scripts) {
            failures += runFile(session, script, err);
        }

        String expr = cmd.getOptionValue('e');
        if (expr != null) {
            try {
                if (!session.interact(session.parse(expr), out, err))
                    failures++;
            } catch (LispError ex) {
                err.println(ex.getMessage());
                err.flush();
                failures++;
            }
        }

        boolean interactive = cmd.hasOption('i') || (scripts.length == 0 && expr == null);
        if (interactive) {
            new REPL(session).runREPL();
        } else if (failures != 0) {
            System.exit(1);
        }
    }
}
