package contractnet.engine;

/** How a consumer with several incoming interfaces folds their relaxations into its assumption. */
public enum AssumptionMergePolicy {
  /** Each incoming edge's relaxation is unioned into the pending assumption as it is processed. */
  UNION_INCREMENTAL,
  /**
   * Each incoming edge yields a candidate from the iteration-start assumption; the candidates are
   * intersected and applied once, after all edges of the iteration.
   */
  INTERSECT_ACROSS_EDGES
}
