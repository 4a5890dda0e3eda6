package no.cantara.worldview;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line interface for Worldview validation.
 * Usage: java -jar worldview-parser.jar [--tokens &lt;tokens.yaml&gt;] &lt;file.wvf&gt;... | --stdin
 */
public class WorldviewCli {

    static final String VERSION = "0.1.0";

    static final String LOGBACK_CONFIG_PROPERTY = "logback.configurationFile";
    static final String CLI_LOGBACK_CONFIG = "worldview/logback-cli.xml";

    public static void main(String[] args) {
        // Diagnostics go to stderr, warnings only; an explicit -Dlogback.configurationFile wins.
        if (System.getProperty(LOGBACK_CONFIG_PROPERTY) == null) {
            System.setProperty(LOGBACK_CONFIG_PROPERTY, CLI_LOGBACK_CONFIG);
        }
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        List<Path> files = new ArrayList<>();
        boolean stdin = false;
        Path tokensPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> {
                    printUsage(out);
                    return 0;
                }
                case "--version", "-V" -> {
                    out.println("worldview-validate " + VERSION);
                    return 0;
                }
                case "--stdin" -> stdin = true;
                case "--tokens" -> {
                    if (i + 1 >= args.length) {
                        err.println("Error: --tokens requires a file argument");
                        return 1;
                    }
                    tokensPath = Path.of(args[++i]);
                }
                default -> {
                    if (args[i].startsWith("-")) {
                        err.println("Error: unknown option " + args[i]);
                        printUsage(err);
                        return 1;
                    }
                    files.add(Path.of(args[i]));
                }
            }
        }

        if (!stdin && files.isEmpty()) {
            printUsage(err);
            return 1;
        }

        TokenTable tokens;
        try {
            tokens = tokensPath != null ? TokenTable.load(tokensPath) : TokenTable.defaults();
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: could not load token table: " + e.getMessage());
            return 1;
        }

        if (stdin) {
            try {
                String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                WorldviewValidator.ValidationResult result = WorldviewValidator.validate(text, tokens);
                out.print(result.render());
                return result.isValid() ? 0 : 1;
            } catch (IOException e) {
                err.println("Error reading from stdin: " + e.getMessage());
                return 1;
            }
        }

        boolean allValid = true;
        for (Path path : files) {
            if (files.size() > 1) {
                out.println(path + ":");
            }
            if (!Files.exists(path)) {
                err.println("Error: file not found: " + path);
                allValid = false;
            } else {
                if (!path.getFileName().toString().toLowerCase().endsWith(".wvf")) {
                    err.println("Warning: " + path + " does not have a .wvf extension");
                }
                try {
                    WorldviewValidator.ValidationResult result = WorldviewValidator.validateFile(path, tokens);
                    out.print(result.render());
                    allValid &= result.isValid();
                } catch (IOException e) {
                    err.println("Error reading " + path + ": " + e.getMessage());
                    allValid = false;
                }
            }
            if (files.size() > 1) {
                out.println();
            }
        }
        return allValid ? 0 : 1;
    }

    private static void printUsage(PrintStream ps) {
        ps.println("Usage: worldview-validate [--tokens <tokens.yaml>] <file.wvf>...");
        ps.println("       worldview-validate --stdin");
        ps.println();
        ps.println("Validates Worldview files for structural and syntactic correctness.");
        ps.println();
        ps.println("Options:");
        ps.println("  --stdin           Read a single document from standard input");
        ps.println("  --tokens <file>   Use an alternative token table");
        ps.println("  --help            Show this help message");
        ps.println("  --version         Show version information");
    }
}
