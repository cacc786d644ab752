package contractnet.model;

/** Value domain of a contract variable. */
public enum VariableDomain {
  CONTINUOUS,
  INTEGER
}
