package contractnet.validation;

import java.util.List;
import java.util.Objects;

/** Outcome of a network check with one detail line per violation. */
public record ValidationResult(boolean passed, String message, List<String> details) {

  public ValidationResult {
    Objects.requireNonNull(message, "message");
    details = details == null ? List.of() : List.copyOf(details);
  }

  public static ValidationResult pass(String message) {
    return new ValidationResult(true, message, List.of());
  }

  public static ValidationResult fail(String message, List<String> details) {
    return new ValidationResult(false, message, details);
  }

  @Override
  public String toString() {
    StringBuilder out = new StringBuilder(passed ? "PASSED: " : "FAILED: ").append(message);
    for (String detail : details) {
      out.append("\n  - ").append(detail);
    }
    return out.toString();
  }
}
