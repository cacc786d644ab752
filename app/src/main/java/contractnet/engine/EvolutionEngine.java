package contractnet.engine;

import contractnet.diagnostics.IterationMetrics;
import contractnet.diagnostics.IterationSnapshot;
import contractnet.milp.MilpSolver;
import contractnet.milp.OjAlgoMilpSolver;
import contractnet.model.Component;
import contractnet.model.ComponentState;
import contractnet.model.Contract;
import contractnet.model.ContractInterface;
import contractnet.region.Box;
import contractnet.region.Region;
import contractnet.scenario.Scenario;
import contractnet.transform.ContractTransformer;
import contractnet.transform.FailureReport;
import contractnet.transform.MilpTransformException;
import contractnet.transform.TransformContext;
import contractnet.util.Timing;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixpoint iteration over a contract network.
 *
 * <p>Every iteration visits the interfaces in declaration order. For an edge supplier → consumer
 * over interface variables I:
 *
 * <ol>
 *   <li>forward: {@code post} at the supplier over its guarantee gives the reachable region on I,
 *       which relaxes the consumer's assumption;
 *   <li>absorption: the consumer's guarantee absorbs the image of every newly added assumption box
 *       through {@code post} over the consumer's outputs;
 *   <li>backward: {@code pre} at the consumer over its assumption gives the requirement on I,
 *       which narrows the supplier's guarantee.
 * </ol>
 *
 * <p>Each edge reads and writes a pending copy of the contracts, so the next edge sees its
 * result. Every component state is evolved once, when the iteration ends. The run stops at the
 * first iteration that changes nothing, at the iteration cap, when a contract side becomes empty,
 * or at the first non-optimal solve.
 */
public final class EvolutionEngine {
  private static final Logger LOG = LoggerFactory.getLogger(EvolutionEngine.class);

  private final MilpSolver solver;
  private final EvolutionOptions options;

  public EvolutionEngine(MilpSolver solver, EvolutionOptions options) {
    this.solver = Objects.requireNonNull(solver, "solver");
    this.options = EvolutionOptions.normalize(options);
  }

  /** Engine on the ojAlgo backend with the configured solver time limit. */
  public static EvolutionEngine withOjAlgo(EvolutionOptions options) {
    EvolutionOptions normalized = EvolutionOptions.normalize(options);
    return new EvolutionEngine(
        new OjAlgoMilpSolver(normalized.solverTimeLimitMs()), normalized);
  }

  public EvolutionOptions options() {
    return options;
  }

  public EvolutionResult evolve(Scenario scenario) {
    EvolutionContext context =
        EvolutionContext.initialize(
            scenario, options, ContractTransformer.reusingSolutions(solver));
    Timing timer = Timing.start();
    LOG.info(
        "Evolving scenario {} (deviation on {}, {} components, {} interfaces, max {} iterations)",
        scenario.name(),
        scenario.targetComponent(),
        scenario.network().components().size(),
        scenario.network().interfaces().size(),
        options.maxIterations());

    try {
      for (int i = 0; i < options.maxIterations(); i++) {
        IterationSnapshot snapshot = iterate(context);
        int k = snapshot.iteration();
        LOG.info(
            "Iteration {}: magnitude {}, {} propagations, {} solves, changed {}",
            k,
            snapshot.totalMagnitude(),
            snapshot.metrics().propagations(),
            snapshot.metrics().solves(),
            snapshot.metrics().changedComponents());
        String infeasible = context.firstInfeasibleComponent();
        if (infeasible != null) {
          LOG.warn("Component {} has an empty contract side after iteration {}", infeasible, k);
          return result(context, EvolutionOutcome.INFEASIBLE_CONTRACT, null, infeasible, timer);
        }
        if (!snapshot.metrics().changed()) {
          LOG.info("Fixpoint reached at iteration {}", k);
          return result(context, EvolutionOutcome.CONVERGED, null, null, timer);
        }
      }
    } catch (MilpTransformException ex) {
      FailureReport report = ex.report();
      context.recorder().recordFailure(report);
      LOG.error("Run {} aborted: {}", scenario.name(), report.message());
      return result(context, EvolutionOutcome.FAILED, report, null, timer);
    }
    LOG.warn(
        "Scenario {} did not converge within {} iterations",
        scenario.name(),
        options.maxIterations());
    return result(context, EvolutionOutcome.NON_CONVERGENCE, null, null, timer);
  }

  /** Runs one full iteration and records its snapshot. */
  IterationSnapshot iterate(EvolutionContext context) {
    int k = context.beginIteration();
    Timing timer = Timing.start();
    long solvesBefore = context.transformer().solveCount();
    Iteration pass = new Iteration(context, k);
    for (ContractInterface edge : context.network().interfaces()) {
      pass.propagate(edge);
    }
    pass.settleDeferredAssumptions();

    List<String> changed = new ArrayList<>();
    for (ComponentState state : context.states()) {
      Contract next = pass.pending.get(state.component());
      if (state.evolve(k, next.assumption(), next.guarantee())) {
        changed.add(state.component());
      }
    }
    IterationMetrics metrics =
        new IterationMetrics(
            k,
            pass.propagations,
            context.transformer().solveCount() - solvesBefore,
            timer.elapsedMillis(),
            changed);
    return context.recorder().recordIteration(k, context.states(), metrics);
  }

  private EvolutionResult result(
      EvolutionContext context,
      EvolutionOutcome outcome,
      FailureReport failure,
      String infeasibleComponent,
      Timing timer) {
    return new EvolutionResult(
        context.scenario().name(),
        outcome,
        context.recorder().snapshots(),
        context.baselineContracts(),
        context.initialContracts(),
        context.currentContracts(),
        failure,
        infeasibleComponent,
        context.transformer().solveCount(),
        timer.elapsedMillis());
  }

  /** Pending contracts of one iteration. */
  private static final class Iteration {
    private final EvolutionContext context;
    private final int index;
    private final Map<String, Contract> pending = new LinkedHashMap<>();
    private final Map<String, List<Region>> candidates = new LinkedHashMap<>();
    private int propagations;

    Iteration(EvolutionContext context, int index) {
      this.context = context;
      this.index = index;
      for (ComponentState state : context.states()) {
        pending.put(state.component(), state.current());
      }
    }

    void propagate(ContractInterface edge) {
      Component supplier = context.component(edge.supplier());
      Component consumer = context.component(edge.consumer());
      List<String> variables = edge.variables();
      ContractTransformer transformer = context.transformer();
      TransformContext where = TransformContext.of(index, edge);
      double tolerance = context.options().coverageTolerance();

      Region reachable =
          transformer.post(supplier, pending.get(supplier.name()).guarantee(), variables, where);
      if (context.options().mergePolicy() == AssumptionMergePolicy.UNION_INCREMENTAL) {
        Region before = pending.get(consumer.name()).assumption();
        Region relaxed = ContractMerge.relax(before, reachable, variables, tolerance);
        if (updateAssumption(consumer.name(), relaxed)) {
          absorb(consumer, relaxed.boxesNotIn(before), where);
        }
      } else {
        Region start = context.state(consumer.name()).assumption();
        candidates
            .computeIfAbsent(consumer.name(), name -> new ArrayList<>())
            .add(ContractMerge.relax(start, reachable, variables, tolerance));
      }

      Region required =
          transformer.pre(consumer, pending.get(consumer.name()).assumption(), variables, where);
      Region narrowed =
          ContractMerge.narrow(pending.get(supplier.name()).guarantee(), required, variables);
      updateGuarantee(supplier.name(), narrowed);
    }

    /** Applies intersected candidates; a no-op under incremental union. */
    void settleDeferredAssumptions() {
      for (Map.Entry<String, List<Region>> entry : candidates.entrySet()) {
        Component consumer = context.component(entry.getKey());
        Region before = pending.get(consumer.name()).assumption();
        Region merged = ContractMerge.intersectAll(entry.getValue());
        if (updateAssumption(consumer.name(), merged)) {
          absorb(consumer, merged.boxesNotIn(before), TransformContext.of(index, null));
        }
      }
    }

    private void absorb(Component consumer, List<Box> fresh, TransformContext where) {
      if (fresh.isEmpty() || consumer.outputs().isEmpty()) {
        return;
      }
      Region image =
          context
              .transformer()
              .post(consumer, Region.of(fresh), consumer.outputNames(), where);
      Region guarantee = pending.get(consumer.name()).guarantee();
      updateGuarantee(
          consumer.name(),
          ContractMerge.absorb(guarantee, image, context.options().coverageTolerance()));
    }

    private boolean updateAssumption(String component, Region assumption) {
      Contract current = pending.get(component);
      if (current.assumption().equals(assumption)) {
        return false;
      }
      pending.put(component, current.withAssumption(assumption));
      propagations++;
      return true;
    }

    private boolean updateGuarantee(String component, Region guarantee) {
      Contract current = pending.get(component);
      if (current.guarantee().equals(guarantee)) {
        return false;
      }
      pending.put(component, current.withGuarantee(guarantee));
      propagations++;
      return true;
    }
  }
}
