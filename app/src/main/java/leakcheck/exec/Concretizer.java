package leakcheck.exec;

import java.util.OptionalLong;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.ir.Expression;

/** Decides the concrete values a block needs while it executes on a {@link PathState}. */
interface Concretizer {

  /**
   * Picks the address a memory access goes to, or returns empty when no address is consistent with
   * the path.
   */
  OptionalLong address(Expression address, PathState state) throws SortMismatchException;

  /** Applies an {@code assume} or {@code assert}; false ends the run. */
  boolean assume(Expression condition, PathState state) throws SortMismatchException;
}
