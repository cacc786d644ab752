package contractnet.milp;

/** Optimization direction of an objective. */
public enum Direction {
  MINIMIZE("min"),
  MAXIMIZE("max");

  private final String label;

  Direction(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
