package contractnet.transform;

/** Direction of a contract transformer. */
public enum TransformerKind {
  /** Image of a supplier's guarantee through its behavior model. */
  POST("post"),
  /** Requirement a consumer's assumption and model place on its inputs. */
  PRE("pre");

  private final String label;

  TransformerKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
