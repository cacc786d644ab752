package contractnet.diagnostics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import contractnet.milp.Direction;
import contractnet.milp.MilpProblem;
import contractnet.milp.Objective;
import contractnet.milp.SolveStatus;
import contractnet.model.ComponentState;
import contractnet.model.Contract;
import contractnet.region.Box;
import contractnet.region.Region;
import contractnet.transform.FailureReport;
import contractnet.transform.TransformerKind;
import java.util.List;
import org.junit.jupiter.api.Test;

final class SnapshotRecorderTest {

  private static Box v(double lower, double upper) {
    return Box.builder().bound("V", lower, upper).build();
  }

  private static FailureReport failure() {
    MilpProblem.Builder problem = MilpProblem.builder("C/post");
    problem.continuous("V", 0, 10);
    return new FailureReport(
        "C",
        TransformerKind.POST,
        "V",
        Direction.MAXIMIZE,
        SolveStatus.INFEASIBLE,
        "test",
        null,
        problem.build(Objective.maximize("V")),
        v(0, 10),
        null,
        1);
  }

  @Test
  void snapshotsCaptureContractsAndDeviation() {
    ComponentState state = ComponentState.atBaseline("C", Contract.of(v(0, 10), v(0, 10)));
    SnapshotRecorder recorder = new SnapshotRecorder();
    state.evolve(0, Region.of(v(0, 10)), Region.of(v(0, 12)));
    IterationSnapshot snapshot =
        recorder.recordIteration(
            0, List.of(state), new IterationMetrics(0, 1, 4, 0, List.of("C")));

    assertEquals(1, recorder.snapshots().size());
    assertEquals(Region.of(v(0, 12)), snapshot.component("C").guarantee());
    assertEquals(2.0, snapshot.totalMagnitude());
    assertEquals(2.0, snapshot.classTotals().get(DeviationClass.GUARANTEE_RELAXATION));
    assertEquals(0.0, snapshot.classTotals().get(DeviationClass.ASSUMPTION_RELAXATION));
  }

  @Test
  void laterEvolutionDoesNotAlterEarlierSnapshots() {
    ComponentState state = ComponentState.atBaseline("C", Contract.of(v(0, 10), v(0, 10)));
    SnapshotRecorder recorder = new SnapshotRecorder();
    recorder.recordIteration(0, List.of(state), new IterationMetrics(0, 0, 0, 0, List.of()));
    state.evolve(1, Region.of(v(0, 20)), Region.of(v(0, 10)));
    recorder.recordIteration(1, List.of(state), new IterationMetrics(1, 1, 0, 0, List.of("C")));

    assertEquals(Region.of(v(0, 10)), recorder.snapshots().get(0).component("C").assumption());
    assertEquals(Region.of(v(0, 20)), recorder.snapshots().get(1).component("C").assumption());
  }

  @Test
  void failureIsRecordedOnceAndClosesTheRecorder() {
    SnapshotRecorder recorder = new SnapshotRecorder();
    recorder.recordFailure(failure());
    assertTrue(recorder.hasFailed());
    assertEquals("C", recorder.failure().orElseThrow().component());
    assertThrows(IllegalStateException.class, () -> recorder.recordFailure(failure()));
    assertThrows(
        IllegalStateException.class,
        () -> recorder.recordIteration(2, List.of(), new IterationMetrics(2, 0, 0, 0, List.of())));
  }

  @Test
  void unknownComponentLookupFails() {
    IterationSnapshot snapshot =
        new IterationSnapshot(0, List.of(), new IterationMetrics(0, 0, 0, 0, List.of()));
    assertThrows(IllegalArgumentException.class, () -> snapshot.component("missing"));
  }
}
