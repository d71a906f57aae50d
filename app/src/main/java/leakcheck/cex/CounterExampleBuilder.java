package leakcheck.cex;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import leakcheck.program.BlockGraph;
import leakcheck.program.Program;
import leakcheck.program.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles a {@link CounterExample} from the traces of two compositions.
 *
 * <p>Only blocks visited by at least one composition are copied. Every program transition between
 * two copied blocks is kept, so the direction a composition did not take stays visible.
 */
public final class CounterExampleBuilder {
  private static final Logger LOG = LoggerFactory.getLogger(CounterExampleBuilder.class);

  private final Program program;

  public CounterExampleBuilder(Program program) {
    this.program = Objects.requireNonNull(program, "program");
  }

  /**
   * Builds the counterexample for two compositions that part ways at {@code branchBlock}.
   *
   * @param branchBlock block at which the compositions part ways
   * @param divergence human-readable description of the observable difference
   */
  public CounterExample build(
      int branchBlock, CompositionTrace first, CompositionTrace second, String divergence) {
    if (first.composition() == second.composition()) {
      throw new IllegalArgumentException("both traces belong to " + first.composition());
    }
    BlockGraph graph = program.graph();
    ControlFlowGraph cfg = new ControlFlowGraph();

    Set<Integer> touched = new LinkedHashSet<>();
    Set<Integer> executedNormally = new HashSet<>();
    for (CompositionTrace trace : List.of(first, second)) {
      for (TraceStep step : trace.steps()) {
        touched.add(step.block());
        if (!step.transientStep()) {
          executedNormally.add(step.block());
        }
      }
    }
    touched.add(branchBlock);
    for (int index : touched) {
      AnnotatedBlock block = new AnnotatedBlock(graph.block(index));
      block.setTransient(!executedNormally.contains(index) && index != branchBlock);
      cfg.addBlock(block);
    }
    for (Transition transition : graph.edges()) {
      if (touched.contains(transition.head()) && touched.contains(transition.tail())) {
        cfg.addEdge(new AnnotatedEdge(transition.edge(), transition.guard()));
      }
    }

    CounterExample counterExample = new CounterExample(cfg);
    for (CompositionTrace trace : List.of(first, second)) {
      addTrace(cfg, trace);
      counterExample.setInputs(trace.composition(), trace.inputs());
      counterExample.setFinalState(trace.composition(), trace.finalState());
      counterExample.setObservations(trace.composition(), trace.observations());
    }
    cfg.block(branchBlock).markDivergence(divergence);
    LOG.debug(
        "Built counterexample with {} blocks and {} edges", cfg.vertexCount(), cfg.edgeCount());
    return counterExample;
  }

  private static void addTrace(ControlFlowGraph cfg, CompositionTrace trace) {
    Composition composition = trace.composition();
    List<TraceStep> steps = trace.steps();
    for (int i = 0; i < steps.size(); i++) {
      TraceStep step = steps.get(i);
      AnnotatedBlock.Annotation annotation = cfg.block(step.block()).annotationFor(composition);
      annotation.markExecuted();
      step.effects().forEach(annotation::addEffect);
      if (i > 0) {
        int head = steps.get(i - 1).block();
        cfg.edge(head, step.block())
            .ifPresent(
                edge -> {
                  edge.markExecuted(composition);
                  if (step.transientStep()) {
                    edge.setTransient(true);
                  }
                });
      }
    }
  }
}
