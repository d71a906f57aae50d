package leakcheck.solver;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.LongAdder;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.ir.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Caps the number of queries in flight on a delegate solver; callers block while it is full. */
public final class BoundedSolver implements Solver {
  private static final Logger LOG = LoggerFactory.getLogger(BoundedSolver.class);

  private final Solver delegate;
  private final Semaphore permits;
  private final LongAdder queries = new LongAdder();

  public BoundedSolver(Solver delegate, int maxInFlight) {
    if (maxInFlight < 1) {
      throw new IllegalArgumentException("maxInFlight must be positive: " + maxInFlight);
    }
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.permits = new Semaphore(maxInFlight, true);
  }

  @Override
  public String name() {
    return delegate.name();
  }

  @Override
  public SolverResult check(List<Expression> assertions) throws SortMismatchException {
    try {
      permits.acquire();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      LOG.warn("Interrupted while waiting for a solver slot");
      return SolverResult.unknown();
    }
    try {
      queries.increment();
      return delegate.check(assertions);
    } finally {
      permits.release();
    }
  }

  public long queries() {
    return queries.sum();
  }
}
