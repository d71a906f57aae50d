package leakcheck.uarch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** The hardware state a path carries: cache, branch predictor (with its PHT and BTB) and memory. */
public record MicroarchitecturalState(Cache cache, Predictor predictor, Memory memory) {

  public MicroarchitecturalState {
    Objects.requireNonNull(cache, "cache");
    Objects.requireNonNull(predictor, "predictor");
    Objects.requireNonNull(memory, "memory");
  }

  public MicroarchitecturalState copy() {
    return new MicroarchitecturalState(cache.copy(), predictor.copy(), memory.copy());
  }

  /**
   * Names of the observable components that differ from {@code other}. The cache is always
   * observable; the branch target buffer and pattern history table only when requested.
   */
  public List<String> diff(MicroarchitecturalState other, boolean observeBtb, boolean observePht) {
    List<String> differing = new ArrayList<>(3);
    if (!cache.equals(other.cache)) {
      differing.add("cache");
    }
    if (observeBtb && !predictor.btb().equals(other.predictor.btb())) {
      differing.add("btb");
    }
    if (observePht && !predictor.pht().equals(other.predictor.pht())) {
      differing.add("pht");
    }
    return differing;
  }
}
