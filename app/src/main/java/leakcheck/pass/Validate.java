package leakcheck.pass;

import leakcheck.diagnostics.AnalysisException;

/**
 * Read-only well-formedness check.
 *
 * <p>Implementations must not mutate the receiver, so validating twice yields the same outcome.
 * Containers validate their owned parts recursively and stop at the first failure.
 */
@FunctionalInterface
public interface Validate {
  void validate() throws AnalysisException;
}
