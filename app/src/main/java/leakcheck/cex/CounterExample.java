package leakcheck.cex;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import leakcheck.ir.Assignment;
import leakcheck.uarch.MicroarchitecturalState;

/**
 * Evidence of a leak: the annotated control-flow graph walked by two compositions, their concrete
 * inputs, the cache accesses they made and the observable states they ended in.
 */
public final class CounterExample {
  private final ControlFlowGraph controlFlowGraph;
  private final Map<Composition, Assignment> inputs = new EnumMap<>(Composition.class);
  private final Map<Composition, MicroarchitecturalState> finalStates =
      new EnumMap<>(Composition.class);
  private final Map<Composition, List<Observation>> observations =
      new EnumMap<>(Composition.class);

  public CounterExample(ControlFlowGraph controlFlowGraph) {
    this.controlFlowGraph = Objects.requireNonNull(controlFlowGraph, "controlFlowGraph");
  }

  public ControlFlowGraph controlFlowGraph() {
    return controlFlowGraph;
  }

  public void setInputs(Composition composition, Assignment assignment) {
    inputs.put(composition, Objects.requireNonNull(assignment, "assignment"));
  }

  public Optional<Assignment> inputs(Composition composition) {
    return Optional.ofNullable(inputs.get(composition));
  }

  public Map<Composition, Assignment> allInputs() {
    return Collections.unmodifiableMap(inputs);
  }

  public void setFinalState(Composition composition, MicroarchitecturalState state) {
    finalStates.put(composition, Objects.requireNonNull(state, "state"));
  }

  public Optional<MicroarchitecturalState> finalState(Composition composition) {
    return Optional.ofNullable(finalStates.get(composition));
  }

  public void setObservations(Composition composition, List<Observation> accesses) {
    observations.put(composition, List.copyOf(accesses));
  }

  /** Cache accesses of {@code composition} in execution order; empty if none were recorded. */
  public List<Observation> observations(Composition composition) {
    return observations.getOrDefault(composition, List.of());
  }

  /**
   * Graph followed by the inputs and final cache contents of both compositions, then the cache
   * accesses where the two compositions part ways.
   */
  public String report() {
    StringBuilder sb = new StringBuilder(controlFlowGraph.toString());
    for (Composition composition : Composition.values()) {
      sb.append("composition ").append(composition);
      inputs(composition).ifPresent(assignment -> sb.append(" inputs ").append(assignment));
      finalState(composition).ifPresent(state -> sb.append(" cache ").append(state.cache()));
      sb.append('\n');
    }
    List<Observation> first = observations(Composition.A);
    List<Observation> second = observations(Composition.B);
    int shared = 0;
    while (shared < first.size()
        && shared < second.size()
        && first.get(shared).equals(second.get(shared))) {
      shared++;
    }
    if (shared < first.size() || shared < second.size()) {
      sb.append("accesses after ").append(shared).append(" shared:\n");
      appendAccesses(sb, Composition.A, first.subList(shared, first.size()));
      appendAccesses(sb, Composition.B, second.subList(shared, second.size()));
    }
    return sb.toString();
  }

  private static void appendAccesses(
      StringBuilder sb, Composition composition, List<Observation> accesses) {
    for (Observation access : accesses) {
      sb.append("  ").append(composition).append(' ').append(access).append('\n');
    }
  }

  @Override
  public String toString() {
    return controlFlowGraph.toString();
  }
}
