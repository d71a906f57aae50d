package leakcheck.uarch;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/** Branch predictor built from a pattern history table, a global history register and a BTB. */
public final class Predictor {
  private final PatternHistoryTable pht;
  private final BranchTargetBuffer btb;
  private final PredictorStrategy strategy;
  private long history;

  public Predictor(PatternHistoryTable pht, BranchTargetBuffer btb, PredictorStrategy strategy) {
    this.pht = Objects.requireNonNull(pht, "pht");
    this.btb = btb;
    this.strategy = Objects.requireNonNull(strategy, "strategy");
  }

  public PatternHistoryTable pht() {
    return pht;
  }

  public Optional<BranchTargetBuffer> btb() {
    return Optional.ofNullable(btb);
  }

  public PredictorStrategy strategy() {
    return strategy;
  }

  public long history() {
    return history;
  }

  public Prediction predict(long branchAddress) {
    OptionalLong target = btb == null ? OptionalLong.empty() : btb.predict(branchAddress);
    return new Prediction(pht.predict(branchAddress, history), target);
  }

  /** Whether the branch at {@code branchAddress} may be speculated in the wrong direction. */
  public boolean mayMispredict(long branchAddress, boolean actuallyTaken) {
    return strategy == PredictorStrategy.ALWAYS_MISPREDICT
        || predict(branchAddress).taken() != actuallyTaken;
  }

  /** Trains the predictor with a resolved branch. */
  public void update(long branchAddress, boolean taken, long target) {
    pht.update(branchAddress, history, taken);
    long mask = (1L << pht.historyBits()) - 1;
    history = ((history << 1) | (taken ? 1 : 0)) & mask;
    if (btb != null) {
      btb.update(branchAddress, target);
    }
  }

  public Predictor copy() {
    Predictor copy = new Predictor(pht.copy(), btb == null ? null : btb.copy(), strategy);
    copy.history = history;
    return copy;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Predictor other)) {
      return false;
    }
    return history == other.history
        && strategy == other.strategy
        && pht.equals(other.pht)
        && Objects.equals(btb, other.btb);
  }

  @Override
  public int hashCode() {
    return Objects.hash(pht, btb, strategy, history);
  }

  @Override
  public String toString() {
    return "predictor{history="
        + Long.toBinaryString(history)
        + ", pht="
        + pht
        + ", btb="
        + btb
        + "}";
  }
}
