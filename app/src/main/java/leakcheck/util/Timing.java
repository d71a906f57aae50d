package leakcheck.util;

import java.time.Duration;

/** Stopwatch for phase and pass durations. */
public final class Timing {
  private final long startedAt;

  private Timing(long startedAt) {
    this.startedAt = startedAt;
  }

  public static Timing start() {
    return new Timing(System.nanoTime());
  }

  public long elapsedMillis() {
    return elapsedNanos() / 1_000_000L;
  }

  public long elapsedNanos() {
    return System.nanoTime() - startedAt;
  }

  /** True once {@code budget} has passed; a zero or negative budget never expires. */
  public boolean exceeded(Duration budget) {
    return !budget.isZero() && !budget.isNegative() && elapsedNanos() >= budget.toNanos();
  }
}
