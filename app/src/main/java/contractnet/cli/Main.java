package contractnet.cli;

import contractnet.scenario.Scenario;
import contractnet.scenario.ScenarioCatalog;
import java.io.IOException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code run --scenario motor_degradation [--max-iterations N] [--merge-policy union]
 *       [--time-limit-ms MS] [--report out.json] [--text-report out.txt] [--trace]}
 *   <li>{@code batch [--scenarios a,b|all] [--output-dir results]}
 *   <li>{@code list}: built-in scenarios with their networks
 * </ul>
 *
 * <p>Exit codes: 0 converged, 1 usage or I/O error, 2 solver failure, 3 no fixpoint within the
 * iteration cap or an infeasible contract.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  private Main() {}

  public static void main(String[] args) {
    int code = run(args);
    if (code != 0) {
      System.exit(code);
    }
  }

  static int run(String[] args) {
    String command =
        args != null && args.length > 0 ? args[0].toLowerCase(Locale.ROOT) : "help";
    try {
      return switch (command) {
        case "run", "evolve" -> new RunCommand().execute(args);
        case "batch" -> new BatchCommand().execute(args);
        case "list" -> list();
        case "help", "--help", "-h" -> {
          System.out.println(usage());
          yield 0;
        }
        default -> {
          if (command.startsWith("--")) {
            yield new RunCommand().execute(args);
          }
          throw new IllegalArgumentException("Unknown command: " + args[0]);
        }
      };
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      System.err.println(usage());
      return 1;
    } catch (IOException ex) {
      LOG.error("I/O failure: {}", ex.getMessage(), ex);
      return 1;
    }
  }

  private static int list() {
    for (String name : ScenarioCatalog.names()) {
      Scenario scenario = ScenarioCatalog.load(name);
      System.out.printf(
          "%-20s %-18s target=%s%n", name, scenario.name(), scenario.targetComponent());
      System.out.println("  " + scenario.description());
    }
    System.out.println();
    String first = ScenarioCatalog.names().iterator().next();
    System.out.print(ScenarioCatalog.load(first).network().describe());
    return 0;
  }

  static String usage() {
    return String.join(
        System.lineSeparator(),
        "Usage: contractnet <command> [options]",
        "  run    --scenario NAME [--max-iterations N] [--merge-policy union|intersect]",
        "         [--time-limit-ms MS] [--report FILE.json] [--text-report FILE.txt] [--trace]",
        "  batch  [--scenarios NAME,NAME|all] [--output-dir DIR] [--max-iterations N]",
        "         [--merge-policy union|intersect] [--time-limit-ms MS]",
        "  list",
        "Scenarios: " + ScenarioCatalog.names());
  }
}
