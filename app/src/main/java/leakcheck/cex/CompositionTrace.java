package leakcheck.cex;

import java.util.List;
import java.util.Objects;
import leakcheck.ir.Assignment;
import leakcheck.uarch.MicroarchitecturalState;

/**
 * Everything one composition did: its concrete inputs, the blocks it visited, the cache accesses
 * it made and the state it ended in.
 */
public record CompositionTrace(
    Composition composition,
    Assignment inputs,
    List<TraceStep> steps,
    List<Observation> observations,
    MicroarchitecturalState finalState) {

  public CompositionTrace {
    Objects.requireNonNull(composition, "composition");
    Objects.requireNonNull(inputs, "inputs");
    steps = List.copyOf(steps);
    observations = List.copyOf(observations);
    Objects.requireNonNull(finalState, "finalState");
  }
}
