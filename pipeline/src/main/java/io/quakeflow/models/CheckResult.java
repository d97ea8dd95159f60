package io.quakeflow.models;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one quality check: pass flag, violations in the order found,
 * and an optional informational message for passing checks.
 */
public final class CheckResult {

    @JsonProperty("passed")
    private final boolean passed;

    @JsonProperty("violations")
    private final List<String> violations;

    @JsonProperty("message")
    private final String message;

    private CheckResult(boolean passed, List<String> violations, String message) {
        this.passed = passed;
        this.violations = Collections.unmodifiableList(violations);
        this.message = message;
    }

    public static CheckResult passed(String message) {
        return new CheckResult(true, List.of(), message);
    }

    public static CheckResult of(List<String> violations) {
        return new CheckResult(violations.isEmpty(), List.copyOf(violations), null);
    }

    public boolean isPassed() { return passed; }
    public List<String> getViolations() { return violations; }
    public String getMessage() { return message; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CheckResult)) return false;
        CheckResult that = (CheckResult) o;
        return passed == that.passed
                && violations.equals(that.violations)
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(passed, violations, message);
    }
}
