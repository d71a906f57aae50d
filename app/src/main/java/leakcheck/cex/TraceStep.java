package leakcheck.cex;

import java.util.List;

/** A block visited by one composition, with the effects it caused there. */
public record TraceStep(int block, boolean transientStep, List<Effect> effects) {

  public TraceStep {
    effects = List.copyOf(effects);
  }
}
