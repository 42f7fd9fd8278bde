package app.signaltrust.keys.validation;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public record ValidationReport(
        Map<String, ValidationResult> results,
        Duration elapsed
) {

    public boolean allValid() {
        return results.values().stream().allMatch(ValidationResult::valid);
    }

    public List<ValidationResult> failures() {
        return results.values().stream()
                .filter(result -> !result.valid())
                .toList();
    }
}
