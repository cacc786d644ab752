package contractnet.diagnostics;

/** The four directions in which a contract can move away from its baseline. */
public enum DeviationClass {
  ASSUMPTION_RELAXATION("ΔA_rel"),
  ASSUMPTION_STRENGTHENING("ΔA_str"),
  GUARANTEE_RELAXATION("ΔG_rel"),
  GUARANTEE_STRENGTHENING("ΔG_str");

  private final String symbol;

  DeviationClass(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  static DeviationClass of(boolean assumptionSide, boolean relaxation) {
    if (assumptionSide) {
      return relaxation ? ASSUMPTION_RELAXATION : ASSUMPTION_STRENGTHENING;
    }
    return relaxation ? GUARANTEE_RELAXATION : GUARANTEE_STRENGTHENING;
  }
}
