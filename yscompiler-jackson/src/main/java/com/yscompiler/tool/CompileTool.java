package com.yscompiler.tool;

import com.yscompiler.CompileException;
import com.yscompiler.Compiler;
import com.yscompiler.ast.RawNode;
import com.yscompiler.ast.Top;
import com.yscompiler.json.AstJsonException;
import com.yscompiler.json.AstJsonProvider;
import com.yscompiler.util.SearchPath;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line front end: compiles parser output stored as tagged JSON.
 *
 * Two modes of operation:
 * 1. Code mode: prints the Clojure source for each input
 * 2. AST mode: prints the lowered AST as tagged JSON
 *
 * Usage:
 *   java -cp ... com.yscompiler.tool.CompileTool [options] <files...>
 *
 * Options:
 *   --mode=code|ast       What to emit (default: code)
 *   --output-dir=PATH     Write one file per input instead of standard output
 *   --verbose             Enable debug logging
 */
public class CompileTool {

    private static final Logger LOG = Logger.getLogger(CompileTool.class);

    private final Config config;
    private final PrintStream out;
    private final AstJsonProvider json;

    public static void main(String[] args) {
        Config config = Config.parse(args);
        if (config == null) {
            printUsage();
            System.exit(1);
        }

        CompileTool tool = new CompileTool(config, System.out);
        System.exit(tool.run());
    }

    public CompileTool(Config config, PrintStream out) {
        this.config = config;
        this.out = out;
        this.json = AstJsonProvider.getProvider();
        LOG.debug("JSON binding: " + json.getName());
    }

    /**
     * Compiles every input file. A failing file is reported and skipped.
     *
     * @return 0 when every file compiled, 1 otherwise
     */
    public int run() {
        if (config.verbose) {
            Logger.getLogger("com.yscompiler").setLevel(Level.DEBUG);
        }

        Compiler compiler = new Compiler();

        if (config.outputDir != null) {
            try {
                Files.createDirectories(config.outputDir);
            } catch (IOException e) {
                LOG.error("Cannot create output directory " + config.outputDir + ": " + e.getMessage());
                return 1;
            }
        }

        int failed = 0;
        for (Path file : config.files) {
            try {
                processFile(compiler, file);
            } catch (IOException e) {
                failed++;
                LOG.error(file + ": IO error: " + e.getMessage());
            } catch (AstJsonException e) {
                failed++;
                LOG.error(file + ": invalid input: " + e.getMessage());
            } catch (CompileException e) {
                failed++;
                LOG.error(file + ": compile error: " + e.getMessage());
            }
        }

        LOG.info(String.format("Compiled %d of %d files", config.files.size() - failed, config.files.size()));
        return failed > 0 ? 1 : 0;
    }

    private void processFile(Compiler compiler, Path file) throws IOException {
        if (LOG.isDebugEnabled()) {
            LOG.debug(file + ": search path " + SearchPath.resolve(file.toString()));
        }
        String source = Files.readString(file, StandardCharsets.UTF_8);
        RawNode document = json.getDeserializer().deserializeRaw(source);

        String result;
        String extension;
        if (config.mode == Mode.AST) {
            Top top = compiler.construct(document);
            result = json.getSerializer().serializePretty(top);
            extension = ".ast.json";
        } else {
            result = compiler.compile(document);
            extension = ".clj";
        }

        if (config.outputDir == null) {
            out.println(result);
        } else {
            Path target = config.outputDir.resolve(baseName(file) + extension);
            Files.writeString(target, result + "\n", StandardCharsets.UTF_8);
            LOG.debug(file + " -> " + target);
        }
    }

    static String baseName(Path file) {
        String name = file.getFileName().toString();
        if (name.endsWith(".json")) {
            name = name.substring(0, name.length() - ".json".length());
        }
        if (name.endsWith(".ys")) {
            name = name.substring(0, name.length() - ".ys".length());
        }
        return name;
    }

    private static void printUsage() {
        System.out.println("Usage: CompileTool [options] <files...>");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --mode=code|ast       What to emit (default: code)");
        System.out.println("  --output-dir=PATH     Write <name>.clj or <name>.ast.json files (default: stdout)");
        System.out.println("  --verbose             Enable debug logging");
        System.out.println("  --help                Show this help");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  CompileTool hello.ys.json");
        System.out.println("  CompileTool --mode=ast --output-dir=out ./programs/*.ys.json");
    }

    // ========== Inner classes ==========

    public enum Mode {
        CODE, AST
    }

    public static class Config {
        Mode mode = Mode.CODE;
        Path outputDir = null;
        List<Path> files = new ArrayList<>();
        boolean verbose = false;

        public static Config parse(String[] args) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return null;
                } else if (arg.startsWith("--mode=")) {
                    String mode = arg.substring(7).toUpperCase();
                    try {
                        config.mode = Mode.valueOf(mode);
                    } catch (IllegalArgumentException e) {
                        System.err.println("Invalid mode: " + mode);
                        return null;
                    }
                } else if (arg.startsWith("--output-dir=")) {
                    config.outputDir = Path.of(arg.substring(13));
                } else if (arg.equals("--verbose") || arg.equals("-v")) {
                    config.verbose = true;
                } else if (!arg.startsWith("-")) {
                    config.files.add(Path.of(arg));
                } else {
                    System.err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.files.isEmpty()) {
                System.err.println("Error: No input files specified");
                return null;
            }

            return config;
        }
    }
}
