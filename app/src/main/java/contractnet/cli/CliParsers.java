package contractnet.cli;

import com.google.common.base.Splitter;
import contractnet.engine.AssumptionMergePolicy;
import contractnet.scenario.ScenarioCatalog;
import java.util.List;
import java.util.Locale;

/** Shared helpers for CLI argument parsing. */
final class CliParsers {

  private CliParsers() {}

  static int parseInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static long parseLong(String raw, long defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid long for " + optionName + ": " + raw);
    }
  }

  static AssumptionMergePolicy parseMergePolicy(String raw) {
    if (raw == null || raw.isBlank()) {
      return AssumptionMergePolicy.UNION_INCREMENTAL;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "union", "union-incremental", "incremental" -> AssumptionMergePolicy.UNION_INCREMENTAL;
      case "intersect", "intersect-across-edges" -> AssumptionMergePolicy.INTERSECT_ACROSS_EDGES;
      default -> throw new IllegalArgumentException("Invalid merge policy: " + raw);
    };
  }

  /** Lower-case, dashes folded to underscores. */
  static String normalizeScenarioName(String raw) {
    return raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
  }

  /** Comma-separated scenario names; {@code all} or an empty value selects every scenario. */
  static List<String> parseScenarioList(String raw) {
    if (raw == null || raw.isBlank() || "all".equalsIgnoreCase(raw.trim())) {
      return List.copyOf(ScenarioCatalog.names());
    }
    List<String> names =
        Splitter.on(',')
            .trimResults()
            .omitEmptyStrings()
            .splitToStream(raw)
            .map(CliParsers::normalizeScenarioName)
            .toList();
    if (names.isEmpty()) {
      throw new IllegalArgumentException("No scenarios provided.");
    }
    for (String name : names) {
      if (!ScenarioCatalog.contains(name)) {
        throw new IllegalArgumentException(
            "Unknown scenario: " + name + " (available: " + ScenarioCatalog.names() + ")");
      }
    }
    return names;
  }
}
