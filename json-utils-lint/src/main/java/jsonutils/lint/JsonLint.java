package jsonutils.lint;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import jsonutils.json.InvalidJsonException;
import jsonutils.json.Json;
import jsonutils.json.JsonNode;

/// CLI entry point that checks JSON documents for grammar violations and
/// duplicate object keys.
///
/// Usage:
/// `java -jar json-utils-lint.jar [--quiet] <file|-> ...`
///
/// Exit status is 0 when every document is clean, 1 when any document is
/// invalid or repeats a key, and 2 on a usage or I/O error.
public final class JsonLint {

    private static final Logger LOG = Logger.getLogger(JsonLint.class.getName());

    static final int EXIT_CLEAN = 0;
    static final int EXIT_FINDINGS = 1;
    static final int EXIT_ERROR = 2;

    static final String STDIN = "-";
    static final String USAGE = "Usage: java -jar json-utils-lint.jar [--quiet] <file|-> ...";

    private final InputStream stdin;
    private final PrintWriter out;
    private final PrintWriter err;

    JsonLint(InputStream stdin, PrintWriter out, PrintWriter err) {
        this.stdin = Objects.requireNonNull(stdin);
        this.out = Objects.requireNonNull(out);
        this.err = Objects.requireNonNull(err);
    }

    public static void main(String[] args) {
        final var out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        final var err = new PrintWriter(System.err, true, StandardCharsets.UTF_8);
        System.exit(new JsonLint(System.in, out, err).run(args == null ? List.of() : List.of(args)));
    }

    int run(List<String> args) {
        boolean quiet = false;
        final List<String> inputs = new ArrayList<>();
        for (String arg : args) {
            if ("--quiet".equals(arg) || "-q".equals(arg)) {
                quiet = true;
            } else if (arg.startsWith("-") && !STDIN.equals(arg)) {
                err.println("Unknown option: " + arg);
                err.println(USAGE);
                return EXIT_ERROR;
            } else {
                inputs.add(arg);
            }
        }
        if (inputs.isEmpty()) {
            err.println(USAGE);
            return EXIT_ERROR;
        }

        int status = EXIT_CLEAN;
        for (String input : inputs) {
            status = Math.max(status, check(input, quiet));
        }
        LOG.fine(() -> "Checked " + inputs.size() + " inputs");
        return status;
    }

    private int check(String input, boolean quiet) {
        final String name = STDIN.equals(input) ? "<stdin>" : input;
        final JsonNode root;
        try {
            root = STDIN.equals(input) ? Json.parse(stdin) : Json.parse(Path.of(input));
        } catch (InvalidJsonException e) {
            out.println(name + ":" + e.line() + ": invalid JSON: " + e.reason());
            return EXIT_FINDINGS;
        } catch (NoSuchFileException e) {
            err.println(name + ": no such file");
            return EXIT_ERROR;
        } catch (IOException | UncheckedIOException e) {
            err.println(name + ": cannot read: " + e.getMessage());
            return EXIT_ERROR;
        }

        final List<DuplicateKey> duplicates = DuplicateKeyFinder.find(root);
        for (DuplicateKey d : duplicates) {
            out.println("%s:%d: duplicate key \"%s\" at \"%s\" (first defined at line %d)"
                    .formatted(name, d.line(), d.key(), d.pointer(), d.firstLine()));
        }
        if (!duplicates.isEmpty()) {
            return EXIT_FINDINGS;
        }
        if (!quiet) {
            out.println("OK " + name);
        }
        return EXIT_CLEAN;
    }
}
