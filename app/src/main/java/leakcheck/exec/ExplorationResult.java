package leakcheck.exec;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a path exploration.
 *
 * @param findings leaks in deterministic order
 * @param terminationReason why exploration stopped before covering every path, if it did
 */
public record ExplorationResult(
    List<Finding> findings,
    ExplorationStats.Snapshot stats,
    Optional<String> terminationReason,
    long elapsedMillis) {

  public ExplorationResult {
    findings = List.copyOf(findings);
    Objects.requireNonNull(stats, "stats");
    Objects.requireNonNull(terminationReason, "terminationReason");
  }

  public boolean leakFound() {
    return !findings.isEmpty();
  }

  public boolean complete() {
    return terminationReason.isEmpty();
  }
}
