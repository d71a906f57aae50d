package leakcheck.solver;

import java.util.List;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.ir.Expression;

/**
 * Decides satisfiability of a conjunction of Boolean assertions.
 *
 * <p>Callers validate assertions before handing them over; implementations still reject
 * non-Boolean assertions.
 */
public interface Solver {

  SolverResult check(List<Expression> assertions) throws SortMismatchException;

  /** Name used in logs and reports. */
  String name();
}
