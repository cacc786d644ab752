package contractnet.testing;

import contractnet.model.Component;
import contractnet.model.Contract;
import contractnet.model.ContractNetwork;
import contractnet.model.Deviation;
import contractnet.model.Variable;
import contractnet.region.Box;
import contractnet.region.Region;
import contractnet.scenario.Scenario;
import java.util.List;

/**
 * Producer writes {@code V}, consumer reads it. Both start at {@code V ∈ [0, 10]}; the scenario
 * widens the producer's guarantee to {@code [0, 15]}.
 */
public final class TwoComponentNetwork {
  public static final String PRODUCER = "Producer";
  public static final String CONSUMER = "Consumer";
  public static final String V = "V";

  private TwoComponentNetwork() {}

  public static Box v(double lower, double upper) {
    return Box.builder().bound(V, lower, upper).build();
  }

  public static Component producer() {
    return new Component(
        PRODUCER,
        List.of(),
        List.of(Variable.continuous(V, "V")),
        problem -> problem.constrain("producer_limit").term(V).atMost(20.0));
  }

  public static Component consumer() {
    return new Component(
        CONSUMER,
        List.of(Variable.continuous(V, "V")),
        List.of(),
        problem -> problem.constrain("consumer_floor").term(V).atLeast(0.0));
  }

  public static ContractNetwork network() {
    return ContractNetwork.builder()
        .component(producer(), Contract.of(v(0, 10), v(0, 10)))
        .component(consumer(), Contract.of(v(0, 10), v(0, 10)))
        .connect(PRODUCER, CONSUMER, V)
        .build();
  }

  public static Scenario widenedProducer() {
    return Scenario.of(
        "TwoComponent",
        network(),
        Deviation.ofGuarantee(PRODUCER, Region.of(v(0, 15)), "producer guarantee widened"));
  }
}
