package leakcheck.exec;

import java.util.concurrent.atomic.LongAdder;

/** Counters shared by all exploration workers. */
public final class ExplorationStats {
  private final LongAdder pathsCompleted = new LongAdder();
  private final LongAdder pathsAbandoned = new LongAdder();
  private final LongAdder blocksExecuted = new LongAdder();
  private final LongAdder branches = new LongAdder();
  private final LongAdder speculativeRuns = new LongAdder();
  private final LongAdder divergenceChecks = new LongAdder();
  private final LongAdder divergences = new LongAdder();
  private final LongAdder cacheHits = new LongAdder();
  private final LongAdder cacheMisses = new LongAdder();
  private final LongAdder undecidedQueries = new LongAdder();

  /** Point-in-time copy of the counters. */
  public record Snapshot(
      long pathsCompleted,
      long pathsAbandoned,
      long blocksExecuted,
      long branches,
      long speculativeRuns,
      long divergenceChecks,
      long divergences,
      long cacheHits,
      long cacheMisses,
      long undecidedQueries) {}

  void pathCompleted() {
    pathsCompleted.increment();
  }

  void pathAbandoned() {
    pathsAbandoned.increment();
  }

  void blockExecuted() {
    blocksExecuted.increment();
  }

  void branch() {
    branches.increment();
  }

  void speculativeRun() {
    speculativeRuns.increment();
  }

  void divergenceCheck() {
    divergenceChecks.increment();
  }

  void divergence() {
    divergences.increment();
  }

  void cacheAccess(boolean hit) {
    (hit ? cacheHits : cacheMisses).increment();
  }

  void undecidedQuery() {
    undecidedQueries.increment();
  }

  long undecidedQueries() {
    return undecidedQueries.sum();
  }

  public Snapshot snapshot() {
    return new Snapshot(
        pathsCompleted.sum(),
        pathsAbandoned.sum(),
        blocksExecuted.sum(),
        branches.sum(),
        speculativeRuns.sum(),
        divergenceChecks.sum(),
        divergences.sum(),
        cacheHits.sum(),
        cacheMisses.sum(),
        undecidedQueries.sum());
  }
}
