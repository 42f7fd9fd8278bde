package app.signaltrust.keys.cli;

import app.signaltrust.keys.config.ValidationProps;
import app.signaltrust.keys.error.CredentialException;
import app.signaltrust.keys.secret.KeyManager;
import app.signaltrust.keys.secret.KeyResolution;
import app.signaltrust.keys.secret.MaskedSecret;
import app.signaltrust.keys.validation.KeyValidator;
import app.signaltrust.keys.validation.ValidationReport;
import app.signaltrust.keys.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class KeysCommands {

    private static final Logger log = LoggerFactory.getLogger(KeysCommands.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_VALIDATION_FAILED = 1;
    public static final int EXIT_ERROR = 2;
    public static final int EXIT_USAGE = 64;

    private final KeyManager keyManager;
    private final KeyValidator keyValidator;
    private final ValidationProps validationProps;

    public KeysCommands(KeyManager keyManager, KeyValidator keyValidator, ValidationProps validationProps) {
        this.keyManager = keyManager;
        this.keyValidator = keyValidator;
        this.validationProps = validationProps;
    }

    public int execute(String command, List<String> arguments, boolean testConnection, PrintStream out) {
        try {
            return switch (command) {
                case "list" -> list(out);
                case "validate" -> validate(testConnection, out);
                case "import-env" -> importEnv(arguments, out);
                default -> {
                    out.println("Unknown command: " + command);
                    out.println("Usage: list | validate [--test-connection] | import-env [NAME...]");
                    yield EXIT_USAGE;
                }
            };
        } catch (CredentialException ex) {
            log.error("Command failed command={} errorType={}", command, ex.getClass().getSimpleName());
            out.println("Error: " + ex.getMessage());
            return EXIT_ERROR;
        }
    }

    int list(PrintStream out) {
        List<MaskedSecret> secrets = keyManager.listKeys();
        if (secrets.isEmpty()) {
            out.println("No keys stored");
            return EXIT_OK;
        }
        out.printf("%-28s %-14s %-8s %s%n", "NAME", "PREVIEW", "VERSION", "UPDATED");
        for (MaskedSecret secret : secrets) {
            out.printf("%-28s %-14s %-8d %s%n",
                    secret.name(),
                    secret.preview(),
                    secret.version(),
                    secret.rotatedAt() == null ? secret.createdAt() : secret.rotatedAt());
        }
        return EXIT_OK;
    }

    int validate(boolean testConnection, PrintStream out) {
        Set<String> required = new LinkedHashSet<>(requiredKeys());
        Set<String> names = new LinkedHashSet<>(required);
        names.addAll(keyValidator.registry().knownKeyNames());
        names.addAll(keyManager.storedNames());

        Map<String, KeyResolution> resolutions = new LinkedHashMap<>();
        Map<String, String> present = new LinkedHashMap<>();
        for (String name : names) {
            KeyResolution resolution = keyManager.resolve(name);
            resolutions.put(name, resolution);
            resolution.valueOptional().ifPresent(value -> present.put(name, value));
        }
        ValidationReport report = keyValidator.validateAllKeys(present, testConnection);

        boolean failed = false;
        out.printf("%-28s %-9s %-12s %-7s %-11s %s%n", "NAME", "REQUIRED", "SOURCE", "FORMAT", "CONNECTION", "DETAIL");
        for (String name : names) {
            KeyResolution resolution = resolutions.get(name);
            ValidationResult result = report.results().get(name);
            boolean isRequired = required.contains(name);
            String format = result == null ? "MISSING" : (result.formatValid() ? "PASS" : "FAIL");
            String connection = result == null || result.connectionValid() == null
                    ? "-"
                    : (result.connectionValid() ? "PASS" : (Boolean.TRUE.equals(result.retryable()) ? "RETRY" : "FAIL"));
            String detail = result != null && result.error() != null
                    ? result.error()
                    : (resolution.hasWarning() ? resolution.warning() : "");
            out.printf("%-28s %-9s %-12s %-7s %-11s %s%n",
                    name,
                    isRequired ? "yes" : "no",
                    resolution.source(),
                    format,
                    connection,
                    detail);
            if (isRequired && (result == null || !result.formatValid())) {
                failed = true;
            }
        }
        out.printf("Checked %d keys in %dms%n", report.results().size(), report.elapsed().toMillis());
        return failed ? EXIT_VALIDATION_FAILED : EXIT_OK;
    }

    int importEnv(List<String> arguments, PrintStream out) {
        int imported = arguments.isEmpty()
                ? keyManager.importFromEnv()
                : keyManager.importFromEnv(arguments);
        out.println("Imported " + imported + " keys from environment");
        return EXIT_OK;
    }

    private List<String> requiredKeys() {
        return validationProps.requiredKeys() == null ? List.of() : validationProps.requiredKeys();
    }
}
