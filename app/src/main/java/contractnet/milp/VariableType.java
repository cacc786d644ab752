package contractnet.milp;

/** Domain of a MILP decision variable. */
public enum VariableType {
  CONTINUOUS,
  INTEGER,
  BINARY;

  public boolean isIntegral() {
    return this != CONTINUOUS;
  }
}
