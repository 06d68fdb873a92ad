/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package reglex;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.Lists;
import com.google.common.io.CharSource;
import com.google.common.io.CharStreams;
import com.google.common.io.Files;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionBuilder;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.PosixParser;

import com.cloudway.reglex.compiler.CompiledLexer;
import com.cloudway.reglex.compiler.CompiledParser;
import com.cloudway.reglex.compiler.Config;
import com.cloudway.reglex.compiler.LexerCompiler;
import com.cloudway.reglex.compiler.automaton.AutomatonPrinter;
import com.cloudway.reglex.compiler.codegen.JavaLexerGenerator;
import com.cloudway.reglex.compiler.spec.LexerSpecification;
import com.cloudway.reglex.compiler.spec.SpecError;
import com.cloudway.reglex.compiler.spec.SpecificationParser;
import com.cloudway.reglex.runtime.Location;

/**
 * The reglex command line tool. Reads a lexer specification from the
 * given files, or the standard input, and writes the Java source of the
 * generated lexer.
 */
public final class Main {
    private static final String USAGE = "reglex [OPTION]... [FILE]...";

    // hold a strong reference so the configured level is not lost
    private static final Logger rootLogger = Logger.getLogger("com.cloudway.reglex");

    @SuppressWarnings("all")
    private static final Option[] OPTIONS = {
        OptionBuilder.withLongOpt("help")
                     .withDescription("Print this help and exit")
                     .create('h'),
        OptionBuilder.withLongOpt("version")
                     .withDescription("Print version information and exit")
                     .create('v'),
        OptionBuilder.withArgName("FILE")
                     .withLongOpt("output")
                     .withDescription("Write the generated lexer to FILE")
                     .hasArg()
                     .create('o'),
        OptionBuilder.withLongOpt("debug")
                     .withDescription("Log build statistics and dump the automata")
                     .create('d')
    };

    private final InputStream stdin;
    private final PrintStream out;
    private final PrintStream err;

    private Main(InputStream stdin, PrintStream out, PrintStream err) {
        this.stdin = stdin;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /**
     * Run the tool and returns the exit status.
     */
    public static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
        return new Main(stdin, out, err).run(args);
    }

    @SuppressWarnings("deprecation")
    private int run(String[] args) {
        Options options = new Options();
        for (Option opt : OPTIONS)
            options.addOption(opt);

        CommandLine cmd;
        try {
            CommandLineParser parser = new PosixParser();
            cmd = parser.parse(options, args);
        } catch (ParseException ex) {
            err.println("reglex: " + ex.getMessage());
            printHelp(options, err);
            return 1;
        }

        if (cmd.hasOption('h')) {
            printHelp(options, out);
            return 0;
        }

        if (cmd.hasOption('v')) {
            out.println("reglex " + Config.VERSION.get());
            return 0;
        }

        boolean debug = cmd.hasOption('d');
        if (debug)
            enableDebugLogging();

        String output = cmd.getOptionValue('o');
        JavaLexerGenerator generator;
        try {
            generator = new JavaLexerGenerator()
                .packageName(Config.PACKAGE.get())
                .className(output != null ? className(output) : Config.CLASS_NAME.get())
                .inputName(Config.INPUT_NAME.get())
                .version(Config.VERSION.get());
        } catch (IllegalArgumentException ex) {
            err.println("reglex: " + ex.getMessage());
            return 1;
        }

        List<Input> inputs;
        try {
            inputs = readInputs(cmd.getArgs());
        } catch (IOException | UncheckedIOException ex) {
            err.println("reglex: " + ex.getMessage());
            return 2;
        }

        try {
            String text = CharSource.concat(Lists.transform(inputs, in -> in.source)).read();
            LexerSpecification spec = SpecificationParser.parse(text);
            CompiledLexer lexer = LexerCompiler.compile(spec);

            if (debug) {
                PrintWriter dump = new PrintWriter(err);
                for (CompiledParser parser : lexer.parsers()) {
                    dump.println("parser " + parser.name());
                    AutomatonPrinter.print(parser.automaton(), dump);
                }
                dump.flush();
            }

            if (output != null) {
                try (Writer writer = Files.asCharSink(new File(output), StandardCharsets.UTF_8).openBufferedStream()) {
                    generator.generate(lexer, writer);
                }
            } else {
                PrintWriter writer = new PrintWriter(out);
                generator.generate(lexer, writer);
            }
            return 0;
        } catch (SpecError ex) {
            err.println(locate(inputs, ex.getLocation()) + ": " + ex.getReason());
            return 2;
        } catch (IOException | UncheckedIOException ex) {
            err.println("reglex: " + ex.getMessage());
            return 2;
        }
    }

    private static void printHelp(Options options, PrintStream stream) {
        HelpFormatter formatter = new HelpFormatter();
        PrintWriter writer = new PrintWriter(stream);
        formatter.printHelp(writer, formatter.getWidth(), USAGE, null, options,
                            formatter.getLeftPadding(), formatter.getDescPadding(), null);
        writer.flush();
    }

    private static void enableDebugLogging() {
        if (rootLogger.getLevel() == Level.FINE)
            return;
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        rootLogger.addHandler(handler);
        rootLogger.setLevel(Level.FINE);
    }

    /**
     * Derive the generated class name from the output file name.
     */
    static String className(String output) {
        String name = new File(output).getName();
        int i = name.lastIndexOf('.');
        return i > 0 ? name.substring(0, i) : name;
    }

    /*------------------------------------------------------------------------
     * Input files
     */

    private static final class Input {
        final String name;
        final CharSource source;
        final Location start;   /* location just before the first character */

        Input(String name, CharSource source, Location start) {
            this.name = name;
            this.source = source;
            this.start = start;
        }
    }

    /**
     * Read all input files, "-" stands for the standard input. Returns
     * the inputs with the location where each input starts in the
     * concatenated text. An input that does not end with a newline shares
     * its last line with the first line of the next input.
     */
    private List<Input> readInputs(String[] args) throws IOException {
        List<Input> inputs = new ArrayList<>();
        Location pos = Location.START;

        if (args.length == 0)
            args = new String[] { "-" };

        for (String arg : args) {
            String name, text;
            if ("-".equals(arg)) {
                name = Config.INPUT_NAME.get();
                text = CharStreams.toString(new InputStreamReader(stdin, StandardCharsets.UTF_8));
            } else {
                name = arg;
                text = Files.asCharSource(new File(arg), StandardCharsets.UTF_8).read();
            }

            inputs.add(new Input(name, CharSource.wrap(text), pos));
            for (int i = 0; i < text.length(); i++)
                pos = pos.advance(text.charAt(i));
        }
        return inputs;
    }

    /**
     * Map a location in the concatenated text to a location in one input.
     */
    private static String locate(List<Input> inputs, Location loc) {
        Input in = inputs.get(0);
        for (Input next : inputs) {
            if (next.start.compareTo(loc) >= 0)
                break;
            in = next;
        }

        // the location of the first character of the input
        Location first = in.start.advance(' ');
        int line = loc.getLine() - first.getLine() + 1;
        int column = loc.getLine() == first.getLine()
            ? loc.getColumn() - first.getColumn() + 1
            : loc.getColumn();
        return in.name + ":" + line + ":" + column;
    }
}
