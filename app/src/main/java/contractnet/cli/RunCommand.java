package contractnet.cli;

import contractnet.cli.ScenarioExecutor.ScenarioReport;
import contractnet.engine.EvolutionOptions;
import contractnet.engine.EvolutionResult;
import contractnet.scenario.Scenario;
import contractnet.scenario.ScenarioCatalog;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the primary `run` command: one scenario, optional JSON and text reports. */
final class RunCommand {
  private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

  private final ScenarioExecutor executor;

  RunCommand() {
    this(new ScenarioExecutor());
  }

  RunCommand(ScenarioExecutor executor) {
    this.executor = executor;
  }

  int execute(String[] args) throws IOException {
    CliOptions cliOptions = parseRunArgs(args);
    Scenario scenario = ScenarioCatalog.load(cliOptions.scenarioName());
    ScenarioReport report = executor.execute(scenario, cliOptions.evolutionOptions());

    logSummary(report);
    TextReportWriter text = new TextReportWriter();
    if (cliOptions.trace()) {
      System.out.println(text.contractTrace(report));
    }
    if (cliOptions.hasTextReport()) {
      write(cliOptions.textReport(), text.evolutionReport(report));
    }
    if (cliOptions.hasJsonReport()) {
      write(cliOptions.jsonReport(), new JsonReportBuilder().build(report));
    }
    report
        .result()
        .failureReport()
        .ifPresent(failure -> System.err.println(failure.formatReport()));
    return report.exitCode();
  }

  CliOptions parseRunArgs(String[] args) {
    String[] effectiveArgs = stripCommand(args);
    CliOptions.Builder builder = CliOptions.builder();
    Map<String, OptionSpec> specs = optionSpecs();

    for (int i = 0; i < effectiveArgs.length; i++) {
      ParsedArg parsed = ParsedArg.parse(effectiveArgs[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + effectiveArgs[i]);
      }

      String value = parsed.value();
      if (spec.requiresValue()) {
        if (value == null || value.isBlank()) {
          if (i + 1 >= effectiveArgs.length) {
            throw new IllegalArgumentException("Missing value for " + parsed.option());
          }
          value = effectiveArgs[++i];
        }
      }
      spec.apply(builder, value);
    }

    return builder.build();
  }

  private Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--scenario", OptionSpec.withValue((b, raw) -> b.scenarioName(raw)));
    specs.put(
        "--max-iterations",
        OptionSpec.withValue(
            (b, raw) ->
                b.maxIterations(
                    CliParsers.parseInt(
                        raw, EvolutionOptions.defaults().maxIterations(), "--max-iterations"))));
    specs.put(
        "--merge-policy",
        OptionSpec.withValue((b, raw) -> b.mergePolicy(CliParsers.parseMergePolicy(raw))));
    specs.put(
        "--time-limit-ms",
        OptionSpec.withValue(
            (b, raw) ->
                b.solverTimeLimitMs(
                    CliParsers.parseLong(
                        raw, EvolutionOptions.defaults().solverTimeLimitMs(), "--time-limit-ms"))));
    specs.put("--report", OptionSpec.withValue((b, raw) -> b.jsonReport(Path.of(raw))));
    specs.put("--text-report", OptionSpec.withValue((b, raw) -> b.textReport(Path.of(raw))));
    specs.put("--trace", OptionSpec.flag(b -> b.trace(true)));
    return specs;
  }

  private String[] stripCommand(String[] args) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    String first = args[0];
    if ("run".equalsIgnoreCase(first) || "evolve".equalsIgnoreCase(first)) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }

  private void logSummary(ScenarioReport report) {
    EvolutionResult result = report.result();
    LOG.info("Scenario {} finished: {}", result.scenarioName(), result.outcome());
    LOG.info(
        "Iterations: {} (expected at least {})",
        result.iterations(),
        report.scenario().minIterationsExpected());
    LOG.info("MILP solves: {} in {} ms", result.solves(), result.elapsedMillis());
    LOG.info("Deviated components: {}", result.deviatedComponents());
    if (report.systemCheck() != null) {
      LOG.info(
          "System level: {} (gaps {}, violations {})",
          report.systemCheck().satisfied() ? "satisfied" : "not satisfied",
          report.systemCheck().gaps().size(),
          report.systemCheck().violations().size());
    }
  }

  static void write(Path target, String content) throws IOException {
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(target, content, StandardCharsets.UTF_8);
    LOG.info("Wrote {}", target);
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
