package no.cantara.mnoda;

import no.cantara.mnoda.model.Document;
import no.cantara.mnoda.model.MnodaFormatException;
import no.cantara.mnoda.model.RecordLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line interface for Mnoda document validation.
 *
 * <pre>
 * Usage: java -jar mnoda-cli.jar [--strict] [--print] &lt;document.json&gt;
 * </pre>
 *
 * {@code --strict} fails on warnings as well as errors; {@code --print}
 * writes the document back out as formatted JSON after validating it.
 */
public class MnodaCli {

    private static final Logger LOGGER = LoggerFactory.getLogger(MnodaCli.class);

    static final String USAGE = "Usage: java -jar mnoda-cli.jar [--strict] [--print] <document.json>";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * @return the process exit code: 0 when the document is valid, 1 otherwise
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        boolean strict = false;
        boolean print = false;
        Path path = null;

        for (String arg : args) {
            switch (arg) {
                case "--strict" -> strict = true;
                case "--print" -> print = true;
                default -> {
                    if (arg.startsWith("-") || path != null) {
                        err.println(USAGE);
                        return 1;
                    }
                    path = Path.of(arg);
                }
            }
        }
        if (path == null) {
            err.println(USAGE);
            return 1;
        }
        if (!Files.exists(path)) {
            err.println("Error: file not found: " + path);
            return 1;
        }

        Document document;
        try {
            document = MnodaDocuments.load(path, RecordLoader.withAllKnownTypes());
        } catch (IOException e) {
            LOGGER.debug("Failed to read {}", path, e);
            err.println("Read error: " + e.getMessage());
            return 1;
        } catch (MnodaFormatException e) {
            LOGGER.debug("Failed to decode {}", path, e);
            err.println("Format error: " + e.getMessage());
            return 1;
        }

        MnodaValidator.ValidationResult result = MnodaValidator.validate(document);
        if (result.hasWarnings()) {
            result.warnings().forEach(w -> err.println("  ⚠ " + w));
        }
        if (!result.isValid()) {
            err.println("Validation failed: " + result.errors().size() + " error(s):");
            result.errors().forEach(e -> err.println("  • " + e));
            return 1;
        }
        if (strict && result.hasWarnings()) {
            err.println("Validation failed: " + result.warnings().size() + " warning(s) in strict mode");
            return 1;
        }

        if (print) {
            out.println(MnodaDocuments.toJsonString(document, true));
        } else {
            out.printf("✓ %s is valid: %d record(s), %d relationship(s)%n",
                    path,
                    document.getRecords().size(),
                    document.getRelationships().size());
        }
        return 0;
    }
}
