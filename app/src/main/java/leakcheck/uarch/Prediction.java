package leakcheck.uarch;

import java.util.OptionalLong;

/** Predicted direction and, when the branch target buffer knows it, the predicted target. */
public record Prediction(boolean taken, OptionalLong target) {}
