package contractnet.transform;

import contractnet.model.ContractInterface;

/**
 * Where a transformer call happens, copied into failure reports.
 *
 * @param iteration fixpoint iteration index, or {@code null} outside a run
 * @param edge interface being propagated, or {@code null} when the call is not tied to an edge
 */
public record TransformContext(Integer iteration, ContractInterface edge) {

  public static TransformContext standalone() {
    return new TransformContext(null, null);
  }

  public static TransformContext of(int iteration, ContractInterface edge) {
    return new TransformContext(iteration, edge);
  }
}
