package leakcheck.solver;

import leakcheck.config.Environment;
import leakcheck.config.SolverBackend;
import leakcheck.solver.z3.Z3Solver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Picks the solver an environment asks for. */
public final class Solvers {
  private static final Logger LOG = LoggerFactory.getLogger(Solvers.class);

  private Solvers() {}

  /**
   * Z3 when requested and loadable, the enumerating solver otherwise. A positive time budget also
   * bounds every single Z3 query.
   */
  public static Solver create(Environment environment) {
    SolverBackend backend = environment.analysis().solver();
    if (backend == SolverBackend.Z3) {
      if (Z3Solver.isAvailable()) {
        long budget = environment.analysis().timeBudgetMs();
        int timeoutMs = (int) Math.min(Integer.MAX_VALUE, Math.max(0, budget));
        return new Z3Solver(environment.architecture().addressWidth(), timeoutMs);
      }
      LOG.warn("Z3 is unavailable, using the enumerating solver; wide inputs may stay undecided");
    }
    return EnumeratingSolver.defaults();
  }
}
