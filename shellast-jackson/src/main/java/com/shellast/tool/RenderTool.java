package com.shellast.tool;

import com.shellast.ast.File;
import com.shellast.ast.MalformedTreeException;
import com.shellast.jackson.JacksonAstJsonProvider;
import com.shellast.json.AstJsonException;
import com.shellast.json.AstJsonProvider;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Renders shell ASTs stored as JSON back into shell source.
 *
 * Two modes of operation:
 * 1. Render mode: prints the source of each tree, or writes it next to the
 *    tree's name under the output directory
 * 2. Check mode: verifies that rendering survives a JSON round trip unchanged
 *
 * Usage:
 *   java -cp ... com.shellast.tool.RenderTool [options] <files-or-dirs...>
 *
 * Options:
 *   --mode=render|check   Mode of operation (default: render)
 *   --output-dir=PATH     Write .sh files here instead of printing (render mode)
 *   --extensions=ext,...  File extensions to pick up in directories (default: json)
 *   --verbose             Enable verbose output
 */
public class RenderTool {

    private static final Logger LOG = Logger.getLogger(RenderTool.class.getName());

    private final Config config;
    private final AstJsonProvider provider;
    private final PrintStream out;
    private final PrintStream err;

    private int processed;
    private int failed;

    public RenderTool(Config config, AstJsonProvider provider, PrintStream out, PrintStream err) {
        this.config = config;
        this.provider = provider;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        if (Config.wantsHelp(args)) {
            printUsage(System.out);
            System.exit(0);
        }
        Config config = Config.parse(args, System.err);
        if (config == null) {
            printUsage(System.out);
            System.exit(2);
        }

        AstJsonProvider provider = AstJsonProvider.isProviderAvailable()
            ? AstJsonProvider.getProvider()
            : new JacksonAstJsonProvider();
        RenderTool tool = new RenderTool(config, provider, System.out, System.err);
        try {
            System.exit(tool.run());
        } catch (IOException e) {
            System.err.println("Fatal error: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Processes every input and returns the process exit code: 0 when all
     * inputs rendered (and, in check mode, were stable), 1 otherwise.
     */
    public int run() throws IOException {
        List<Path> inputs = collectInputs();
        LOG.fine(() -> "Collected " + inputs.size() + " input files");
        if (config.outputDir != null && config.mode == Mode.RENDER) {
            Files.createDirectories(config.outputDir);
        }

        for (Path input : inputs) {
            processed++;
            try {
                String json = Files.readString(input, StandardCharsets.UTF_8);
                if (config.mode == Mode.CHECK) {
                    check(input, json);
                } else {
                    render(input, json);
                }
            } catch (AstJsonException | MalformedTreeException e) {
                failed++;
                err.println("FAIL " + input + ": " + describe(e));
            } catch (IOException e) {
                failed++;
                err.println("FAIL " + input + ": cannot read (" + e + ")");
            }
        }

        if (config.verbose || config.mode == Mode.CHECK) {
            err.println("Processed " + processed + " files, " + failed + " failed");
        }
        return failed == 0 ? 0 : 1;
    }

    private void render(Path input, String json) throws IOException {
        File file = provider.getDeserializer().deserializeFile(json);
        String source = file.render();
        if (config.outputDir == null) {
            out.print(terminated(source, System.lineSeparator()));
            return;
        }
        Path target = config.outputDir.resolve(outputName(input, file));
        Files.writeString(target, terminated(source, "\n"), StandardCharsets.UTF_8);
        if (config.verbose) {
            err.println("Wrote " + target);
        }
    }

    private void check(Path input, String json) {
        File first = provider.getDeserializer().deserializeFile(json);
        String rendered = first.render();

        String again = provider.getSerializer().serialize(first);
        File second = provider.getDeserializer().deserializeFile(again);
        String rerendered = second.render();

        if (!rendered.equals(rerendered) || !first.equals(second)) {
            failed++;
            err.println("MISMATCH " + input);
            if (config.verbose) {
                err.println("  first:  " + rendered.replace("\n", "\\n"));
                err.println("  second: " + rerendered.replace("\n", "\\n"));
            }
        } else if (config.verbose) {
            err.println("OK " + input);
        }
    }

    /**
     * Ends the source with exactly one line break; a trailing heredoc already
     * brings its own.
     */
    static String terminated(String source, String lineSeparator) {
        if (source.endsWith("\n")) {
            return source;
        }
        return source + lineSeparator;
    }

    private List<Path> collectInputs() throws IOException {
        List<Path> result = new ArrayList<>();
        for (Path path : config.inputs) {
            if (Files.isDirectory(path)) {
                try (Stream<Path> walk = Files.walk(path)) {
                    result.addAll(walk
                        .filter(Files::isRegularFile)
                        .filter(this::hasWantedExtension)
                        .sorted()
                        .collect(Collectors.toList()));
                }
            } else {
                result.add(path);
            }
        }
        return result;
    }

    private boolean hasWantedExtension(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && config.extensions.contains(name.substring(dot + 1));
    }

    static String outputName(Path input, File file) {
        String base = file.name() != null && !file.name().isEmpty()
            ? Path.of(file.name()).getFileName().toString()
            : input.getFileName().toString();
        int dot = base.lastIndexOf('.');
        if (dot > 0) {
            base = base.substring(0, dot);
        }
        return base + ".sh";
    }

    private static String describe(Exception e) {
        if (e.getCause() != null && e.getCause().getMessage() != null) {
            return e.getMessage() + " (" + e.getCause().getMessage().lines().findFirst().orElse("") + ")";
        }
        return e.getMessage();
    }

    private static void printUsage(PrintStream ps) {
        ps.println("Usage: RenderTool [options] <files-or-dirs...>");
        ps.println();
        ps.println("Options:");
        ps.println("  --mode=render|check   Mode of operation (default: render)");
        ps.println("  --output-dir=PATH     Write .sh files here instead of printing (render mode)");
        ps.println("  --extensions=ext,...  File extensions to pick up in directories (default: json)");
        ps.println("  --verbose             Enable verbose output");
        ps.println("  --help                Show this help");
        ps.println();
        ps.println("Examples:");
        ps.println("  RenderTool tree.json");
        ps.println("  RenderTool --mode=check ./trees");
    }

    // ========== Inner classes ==========

    public enum Mode {
        RENDER, CHECK
    }

    public static class Config {
        Mode mode = Mode.RENDER;
        Path outputDir;
        List<String> extensions = List.of("json");
        List<Path> inputs = new ArrayList<>();
        boolean verbose = false;

        public static boolean wantsHelp(String[] args) {
            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return true;
                }
            }
            return false;
        }

        /**
         * Parses command-line arguments, returning null (after reporting the
         * problem to {@code err}) when they are invalid or help was requested.
         */
        public static Config parse(String[] args, PrintStream err) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return null;
                } else if (arg.startsWith("--mode=")) {
                    String mode = arg.substring(7).toUpperCase(Locale.ROOT);
                    try {
                        config.mode = Mode.valueOf(mode);
                    } catch (IllegalArgumentException e) {
                        err.println("Invalid mode: " + mode);
                        return null;
                    }
                } else if (arg.startsWith("--output-dir=")) {
                    config.outputDir = Path.of(arg.substring(13));
                } else if (arg.startsWith("--extensions=")) {
                    config.extensions = Arrays.asList(arg.substring(13).split(","));
                } else if (arg.equals("--verbose") || arg.equals("-v")) {
                    config.verbose = true;
                } else if (!arg.startsWith("-")) {
                    config.inputs.add(Path.of(arg));
                } else {
                    err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.inputs.isEmpty()) {
                err.println("Error: No input files specified");
                return null;
            }

            return config;
        }

        public Mode mode() {
            return mode;
        }

        public Path outputDir() {
            return outputDir;
        }

        public List<String> extensions() {
            return extensions;
        }

        public List<Path> inputs() {
            return inputs;
        }

        public boolean verbose() {
            return verbose;
        }
    }
}
