package org.extractfx.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.extractfx.cli.config.ConfigLoader;
import org.extractfx.cli.config.LoggingConfigurator;
import org.extractfx.rewriter.Rewriter;
import org.extractfx.rewriter.api.RewriteException;
import org.extractfx.rewriter.api.RewriteOptions;
import org.extractfx.rewriter.selftest.SelfTest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "extract-fx",
    mixinStandardHelpOptions = true,
    version = "extract-fx 1.0",
    description = {
        "Rewrites f/x extraction literals in C++ source into plain literals followed by their arguments.",
        "Reads standard input if no INPUT is given and writes standard output if no OUTPUT is given."
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    // Bytes map one-to-one onto chars, so text outside extraction literals is copied byte for byte.
    private static final Charset SOURCE_CHARSET = StandardCharsets.ISO_8859_1;
    private static final String STDIN_NAME = "<stdin>";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Option(
        names = {"-n", "--name"},
        description = "Function called for f literals; a trailing * is replaced by the argument count (default: std::format)"
    )
    private String functionName;

    @Option(
        names = {"-l", "--line-markers"},
        description = "Emit #line markers so diagnostics point back into the input"
    )
    private boolean lineMarkers;

    @Option(
        names = "--test",
        description = "Run the built-in self test; the exit code is the number of failing cases"
    )
    private boolean selfTest;

    @Parameters(index = "0", arity = "0..1", paramLabel = "INPUT", description = "Source file to read")
    private Path input;

    @Parameters(index = "1", arity = "0..1", paramLabel = "OUTPUT", description = "File to write")
    private Path output;

    @Spec
    private CommandSpec spec;

    private final InputStream stdin;
    private final OutputStream stdout;

    public CommandLineInterface() {
        this(System.in, System.out);
    }

    /**
     * @param stdin Read when no input file is given.
     * @param stdout Written when no output file is given.
     */
    public CommandLineInterface(InputStream stdin, OutputStream stdout) {
        this.stdin = stdin;
        this.stdout = stdout;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("extract-fx");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws IOException {
        final Config config;
        try {
            config = ConfigLoader.load(configFile);
        } catch (ConfigException e) {
            spec.commandLine().getErr().println("Failed to load or parse configuration: " + e.getMessage());
            return 1;
        }
        LoggingConfigurator.configure(config);

        if (selfTest) {
            spec.commandLine().getErr().println("Performing self test");
            SelfTest.Report report = new SelfTest().run();
            report.failures().forEach(spec.commandLine().getErr()::println);
            spec.commandLine().getErr().println(report);
            return report.failures().size();
        }

        RewriteOptions options = buildOptions(config);
        LOG.debug("Rewriting {} with function name '{}'", options.sourcePath(), options.functionName());

        final Reader reader;
        try {
            reader = openInput();
        } catch (IOException e) {
            return fail("Could not open input file " + input, e);
        }
        final Writer writer;
        try {
            writer = openOutput();
        } catch (IOException e) {
            reader.close();
            return fail("Could not open output file " + output, e);
        }

        try (reader; writer) {
            new Rewriter(options).rewrite(reader, writer);
        } catch (RewriteException e) {
            return fail(e.getMessage(), e);
        } catch (IOException e) {
            return fail("I/O error while rewriting " + options.sourcePath() + ": " + e.getMessage(), e);
        }
        return 0;
    }

    // One line for the user; the details go to the debug log.
    private int fail(final String message, final Exception cause) {
        LOG.debug("Rewrite failed: {}", message, cause);
        spec.commandLine().getErr().println(message);
        return 1;
    }

    RewriteOptions buildOptions(final Config config) {
        final Config section = config.hasPath("extractfx") ? config.getConfig("extractfx") : ConfigFactory.empty();
        RewriteOptions options = RewriteOptions.fromConfig(section, input != null ? input.toString() : STDIN_NAME);
        if (functionName != null) {
            options = options.withFunctionName(functionName);
        }
        if (lineMarkers) {
            options = options.withLocationMarkers(true);
        }
        return options;
    }

    private Reader openInput() throws IOException {
        if (input == null) {
            return new InputStreamReader(nonClosing(stdin), SOURCE_CHARSET);
        }
        return Files.newBufferedReader(input, SOURCE_CHARSET);
    }

    private Writer openOutput() throws IOException {
        if (output == null) {
            return new OutputStreamWriter(nonClosing(stdout), SOURCE_CHARSET);
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.newBufferedWriter(output, SOURCE_CHARSET);
    }

    private static InputStream nonClosing(InputStream in) {
        return new java.io.FilterInputStream(in) {
            @Override
            public void close() {
                // The process streams stay open.
            }
        };
    }

    private static OutputStream nonClosing(OutputStream out) {
        return new java.io.FilterOutputStream(out) {
            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                out.write(b, off, len);
            }

            @Override
            public void close() throws IOException {
                flush();
            }
        };
    }
}
