package com.logprog.dumper;

import com.logprog.MalformedTreeException;
import com.logprog.Unparser;
import com.logprog.ast.Node;
import com.logprog.json.AstJsonException;
import com.logprog.json.AstJsonProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

/**
 * Prints the program text for syntax trees dumped as JSON by a parser.
 *
 * Two modes of operation:
 * 1. Source mode: unparses each tree and prints the program text
 * 2. JSON mode: re-serializes each tree as normalized, indented JSON
 *
 * Usage:
 *   java -cp quill-jackson.jar:... com.logprog.dumper.AstDumper [options] <json-files...>
 *
 * Options:
 *   --mode=source|json    Mode of operation (default: source)
 *   --provider=NAME       JSON provider to use (default: first on the classpath)
 *   --output-dir=PATH     Write one file per input instead of printing to stdout
 *   --verbose             Log each file as it is processed
 *
 * A file name of "-" reads the tree from stdin. With --output-dir, an input
 * whose output file was already written by an earlier input fails instead
 * of overwriting it.
 */
public class AstDumper {

    private static final Logger log = LoggerFactory.getLogger(AstDumper.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_USAGE = 2;

    private final Config config;
    private final AstJsonProvider provider;
    private final InputStream stdin;
    private final PrintStream out;
    private final Unparser unparser = new Unparser();
    private final Map<Path, String> written = new HashMap<>();

    private int processedFiles = 0;
    private int failedFiles = 0;

    public static void main(String[] args) {
        Config config = Config.parse(args);
        if (config == null) {
            printUsage(System.err);
            System.exit(EXIT_USAGE);
        }
        if (config.help) {
            printUsage(System.out);
            System.exit(EXIT_OK);
        }

        AstJsonProvider provider;
        try {
            provider = config.provider == null
                ? AstJsonProvider.getProvider()
                : AstJsonProvider.getProvider(config.provider);
        } catch (IllegalStateException e) {
            log.error(e.getMessage());
            System.exit(EXIT_USAGE);
            return;
        }

        AstDumper dumper = new AstDumper(config, provider, System.in, System.out);
        System.exit(dumper.run());
    }

    public AstDumper(Config config, AstJsonProvider provider, InputStream stdin, PrintStream out) {
        this.config = config;
        this.provider = provider;
        this.stdin = stdin;
        this.out = out;
    }

    /**
     * Processes every input in order. A failing input is logged and skipped.
     *
     * @return the process exit code
     */
    public int run() {
        log.debug("Using {} provider in {} mode for {} input(s)",
            provider.getName(), config.mode, config.inputs.size());

        if (config.outputDir != null) {
            try {
                Files.createDirectories(config.outputDir);
            } catch (IOException e) {
                log.error("Cannot create output directory {}", config.outputDir, e);
                return EXIT_FAILURES;
            }
        }

        for (String input : config.inputs) {
            processedFiles++;
            try {
                processInput(input);
            } catch (AstJsonException e) {
                failedFiles++;
                log.error("{}: {}", input, e.getMessage());
                log.debug("Caused by", e.getCause());
            } catch (MalformedTreeException e) {
                failedFiles++;
                log.error("{}: malformed tree in {}: {}", input, e.getVariant(), e.getMessage());
            } catch (IOException e) {
                failedFiles++;
                log.error("{}: cannot read or write: {}", input, e.getMessage());
            }
        }

        if (failedFiles > 0) {
            log.warn("{} of {} input(s) failed", failedFiles, processedFiles);
            return EXIT_FAILURES;
        }
        if (config.verbose) {
            log.info("Processed {} input(s)", processedFiles);
        }
        return EXIT_OK;
    }

    private void processInput(String input) throws IOException {
        Path target = null;
        if (config.outputDir != null) {
            target = config.outputDir.resolve(outputName(input, config.mode));
            String previous = written.get(target);
            if (previous != null) {
                throw new FileAlreadyExistsException(target.toString(), previous, "already written for another input");
            }
        }

        String json = read(input);
        Node tree = provider.getDeserializer().deserializeNode(json);

        String text = config.mode == Mode.SOURCE
            ? unparser.unparse(tree)
            : provider.getSerializer().serializePretty(tree);
        if (!text.isEmpty() && !text.endsWith("\n")) {
            text += "\n";
        }

        if (target == null) {
            out.print(text);
            out.flush();
            if (config.verbose) {
                log.info("{}: {} rendered", input, tree.type());
            }
        } else {
            Files.writeString(target, text, StandardCharsets.UTF_8);
            written.put(target, input);
            if (config.verbose) {
                log.info("{} -> {}", input, target);
            }
        }
    }

    private String read(String input) throws IOException {
        if (input.equals("-")) {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(input), StandardCharsets.UTF_8);
    }

    /**
     * File name written for {@code input} under the output directory.
     */
    static String outputName(String input, Mode mode) {
        String name = input.equals("-") ? "stdin" : Path.of(input).getFileName().toString();
        if (name.endsWith(".json")) {
            name = name.substring(0, name.length() - ".json".length());
        }
        return name + (mode == Mode.SOURCE ? ".mtail" : ".ast.json");
    }

    int getProcessedFiles() {
        return processedFiles;
    }

    int getFailedFiles() {
        return failedFiles;
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Usage: AstDumper [options] <json-files...>");
        stream.println();
        stream.println("Options:");
        stream.println("  --mode=source|json    Mode of operation (default: source)");
        stream.println("  --provider=NAME       JSON provider to use (default: first on the classpath)");
        stream.println("  --output-dir=PATH     Write one file per input instead of printing to stdout");
        stream.println("  --verbose             Log each file as it is processed");
        stream.println("  --help                Show this help");
        stream.println();
        stream.println("A file name of - reads the tree from stdin.");
        stream.println("Two inputs that map to the same output file are an error.");
        stream.println();
        stream.println("Examples:");
        stream.println("  AstDumper program.json");
        stream.println("  AstDumper --mode=json --output-dir=out dumps/*.json");
    }

    // ========== Inner classes ==========

    public enum Mode {
        SOURCE, JSON
    }

    public static class Config {
        Mode mode = Mode.SOURCE;
        String provider = null;
        Path outputDir = null;
        List<String> inputs = new ArrayList<>();
        boolean verbose = false;
        boolean help = false;

        /**
         * Parses command-line arguments.
         *
         * @return the configuration, or null if the arguments are invalid
         */
        public static Config parse(String[] args) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    config.help = true;
                    return config;
                } else if (arg.startsWith("--mode=")) {
                    String mode = arg.substring(7).toUpperCase(Locale.ROOT);
                    try {
                        config.mode = Mode.valueOf(mode);
                    } catch (IllegalArgumentException e) {
                        log.error("Invalid mode: {}", arg.substring(7));
                        return null;
                    }
                } else if (arg.startsWith("--provider=")) {
                    config.provider = arg.substring(11);
                } else if (arg.startsWith("--output-dir=")) {
                    config.outputDir = Path.of(arg.substring(13));
                } else if (arg.equals("--verbose") || arg.equals("-v")) {
                    config.verbose = true;
                } else if (arg.equals("-") || !arg.startsWith("-")) {
                    config.inputs.add(arg);
                } else {
                    log.error("Unknown option: {}", arg);
                    return null;
                }
            }

            if (config.inputs.isEmpty()) {
                log.error("No input files specified");
                return null;
            }

            return config;
        }
    }
}
