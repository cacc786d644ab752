package contractnet.cli;

import contractnet.cli.ScenarioExecutor.ScenarioReport;
import contractnet.engine.AssumptionMergePolicy;
import contractnet.engine.EvolutionOptions;
import contractnet.scenario.ScenarioCatalog;
import contractnet.util.Timing;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs several scenarios in one JVM and writes one JSON and one text report per scenario. */
final class BatchCommand {
  private static final Logger LOG = LoggerFactory.getLogger(BatchCommand.class);

  private final ScenarioExecutor executor;

  BatchCommand() {
    this(new ScenarioExecutor());
  }

  BatchCommand(ScenarioExecutor executor) {
    this.executor = executor;
  }

  int execute(String[] args) throws IOException {
    BatchOptions options = parseArgs(args);
    Files.createDirectories(options.outputDir());
    EvolutionOptions evolutionOptions =
        new EvolutionOptions(
            options.maxIterations(), options.mergePolicy(), options.solverTimeLimitMs());

    int worst = 0;
    Timing timer = Timing.start();
    for (String name : options.scenarios()) {
      try {
        ScenarioReport report = executor.execute(ScenarioCatalog.load(name), evolutionOptions);
        writeReports(options.outputDir(), name, report);
        LOG.info(
            "{}: {} after {} iteration(s), {} solves",
            name,
            report.result().outcome(),
            report.result().iterations(),
            report.result().solves());
        worst = Math.max(worst, report.exitCode());
      } catch (RuntimeException ex) {
        worst = Math.max(worst, 1);
        LOG.error("Batch run failed for {}: {}", name, ex.getMessage(), ex);
      }
    }
    LOG.info(
        "Batch of {} scenario(s) took {} ms", options.scenarios().size(), timer.elapsedMillis());
    return worst;
  }

  private void writeReports(Path outputDir, String name, ScenarioReport report)
      throws IOException {
    TextReportWriter text = new TextReportWriter();
    RunCommand.write(outputDir.resolve(name + "_report.txt"), text.evolutionReport(report));
    RunCommand.write(outputDir.resolve(name + "_trace.txt"), text.contractTrace(report));
    RunCommand.write(outputDir.resolve(name + ".json"), new JsonReportBuilder().build(report));
  }

  BatchOptions parseArgs(String[] args) {
    String[] effectiveArgs = stripCommand(args);
    Map<String, OptionSpec> specs = optionSpecs();
    BatchOptions.Builder builder = BatchOptions.builder();

    for (int i = 0; i < effectiveArgs.length; i++) {
      ParsedArg parsed = ParsedArg.parse(effectiveArgs[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + effectiveArgs[i]);
      }

      String value = parsed.value();
      if (value == null || value.isBlank()) {
        if (i + 1 >= effectiveArgs.length) {
          throw new IllegalArgumentException("Missing value for " + parsed.option());
        }
        value = effectiveArgs[++i];
      }
      spec.apply(builder, value);
    }

    return builder.build();
  }

  private String[] stripCommand(String[] args) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if ("batch".equalsIgnoreCase(args[0])) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }

  private Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put(
        "--scenarios",
        OptionSpec.withValue((b, raw) -> b.scenarios(CliParsers.parseScenarioList(raw))));
    specs.put("--output-dir", OptionSpec.withValue((b, raw) -> b.outputDir(Path.of(raw))));
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
    return specs;
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

  private record OptionSpec(BiConsumer<BatchOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<BatchOptions.Builder, String> consumer) {
      return new OptionSpec(consumer);
    }

    void apply(BatchOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }

  record BatchOptions(
      List<String> scenarios,
      Path outputDir,
      int maxIterations,
      AssumptionMergePolicy mergePolicy,
      long solverTimeLimitMs) {

    BatchOptions {
      scenarios =
          scenarios == null || scenarios.isEmpty()
              ? List.copyOf(ScenarioCatalog.names())
              : List.copyOf(scenarios);
      outputDir = outputDir == null ? Path.of("results") : outputDir;
      maxIterations =
          maxIterations > 0 ? maxIterations : EvolutionOptions.defaults().maxIterations();
      mergePolicy = mergePolicy == null ? EvolutionOptions.defaults().mergePolicy() : mergePolicy;
      solverTimeLimitMs =
          solverTimeLimitMs > 0
              ? solverTimeLimitMs
              : EvolutionOptions.defaults().solverTimeLimitMs();
    }

    static Builder builder() {
      return new Builder();
    }

    static final class Builder {
      private List<String> scenarios = List.copyOf(ScenarioCatalog.names());
      private Path outputDir = Path.of("results");
      private int maxIterations = EvolutionOptions.defaults().maxIterations();
      private AssumptionMergePolicy mergePolicy = EvolutionOptions.defaults().mergePolicy();
      private long solverTimeLimitMs = EvolutionOptions.defaults().solverTimeLimitMs();

      Builder scenarios(List<String> scenarios) {
        if (scenarios != null && !scenarios.isEmpty()) {
          this.scenarios = List.copyOf(scenarios);
        }
        return this;
      }

      Builder outputDir(Path outputDir) {
        this.outputDir = outputDir;
        return this;
      }

      Builder maxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
        return this;
      }

      Builder mergePolicy(AssumptionMergePolicy mergePolicy) {
        this.mergePolicy = mergePolicy;
        return this;
      }

      Builder solverTimeLimitMs(long solverTimeLimitMs) {
        this.solverTimeLimitMs = solverTimeLimitMs;
        return this;
      }

      BatchOptions build() {
        return new BatchOptions(
            scenarios, outputDir, maxIterations, mergePolicy, solverTimeLimitMs);
      }
    }
  }
}
