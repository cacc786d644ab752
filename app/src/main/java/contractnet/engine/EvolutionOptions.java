package contractnet.engine;

/**
 * Configuration for the fixpoint evolution engine.
 *
 * @param coverageTolerance slack allowed when deciding whether a reachable box is already
 *     accepted by an assumption; bounds themselves are never rounded
 */
public record EvolutionOptions(
    int maxIterations,
    AssumptionMergePolicy mergePolicy,
    long solverTimeLimitMs,
    double coverageTolerance) {

  public static final double DEFAULT_COVERAGE_TOLERANCE = 1e-6;

  public EvolutionOptions(
      int maxIterations, AssumptionMergePolicy mergePolicy, long solverTimeLimitMs) {
    this(maxIterations, mergePolicy, solverTimeLimitMs, DEFAULT_COVERAGE_TOLERANCE);
  }

  public static EvolutionOptions defaults() {
    return new EvolutionOptions(
        100, AssumptionMergePolicy.UNION_INCREMENTAL, 30_000L, DEFAULT_COVERAGE_TOLERANCE);
  }

  public static EvolutionOptions normalize(EvolutionOptions options) {
    if (options == null) {
      return defaults();
    }
    EvolutionOptions defaults = defaults();
    int maxIterations =
        options.maxIterations() > 0 ? options.maxIterations() : defaults.maxIterations();
    AssumptionMergePolicy mergePolicy =
        options.mergePolicy() != null ? options.mergePolicy() : defaults.mergePolicy();
    long solverTimeLimitMs =
        options.solverTimeLimitMs() > 0
            ? options.solverTimeLimitMs()
            : defaults.solverTimeLimitMs();
    double coverageTolerance =
        options.coverageTolerance() >= 0 && Double.isFinite(options.coverageTolerance())
            ? options.coverageTolerance()
            : defaults.coverageTolerance();
    return new EvolutionOptions(maxIterations, mergePolicy, solverTimeLimitMs, coverageTolerance);
  }

  public EvolutionOptions withMaxIterations(int maxIterations) {
    return new EvolutionOptions(maxIterations, mergePolicy, solverTimeLimitMs, coverageTolerance);
  }

  public EvolutionOptions withMergePolicy(AssumptionMergePolicy mergePolicy) {
    return new EvolutionOptions(maxIterations, mergePolicy, solverTimeLimitMs, coverageTolerance);
  }

  public EvolutionOptions withSolverTimeLimitMs(long solverTimeLimitMs) {
    return new EvolutionOptions(maxIterations, mergePolicy, solverTimeLimitMs, coverageTolerance);
  }

  public EvolutionOptions withCoverageTolerance(double coverageTolerance) {
    return new EvolutionOptions(maxIterations, mergePolicy, solverTimeLimitMs, coverageTolerance);
  }
}
