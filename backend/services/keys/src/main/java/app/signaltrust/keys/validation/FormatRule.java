package app.signaltrust.keys.validation;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Offline syntactic check of a credential. Failure messages describe the rule, never the value.
 */
public record FormatRule(
        String description,
        Pattern pattern,
        int minLength
) {

    public static FormatRule pattern(String description, String regex) {
        return new FormatRule(description, Pattern.compile(regex), 1);
    }

    public static FormatRule minLength(int minLength) {
        return new FormatRule("at least " + minLength + " characters", null, minLength);
    }

    public Optional<String> check(String value) {
        if (value == null || value.isEmpty()) {
            return Optional.of("Key value is empty");
        }
        if (value.length() < minLength) {
            return Optional.of("Key is too short (expected " + description + ")");
        }
        if (pattern != null && !pattern.matcher(value).matches()) {
            return Optional.of("Format invalid (expected " + description + ")");
        }
        return Optional.empty();
    }
}
