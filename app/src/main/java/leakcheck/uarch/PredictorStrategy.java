package leakcheck.uarch;

/** How the executor decides which branch directions may be mispredicted. */
public enum PredictorStrategy {
  /** Speculate only where the modeled pattern history table predicts the wrong direction. */
  MODEL,
  /** Assume an attacker-trained predictor: every branch may be mispredicted. */
  ALWAYS_MISPREDICT
}
