package leakcheck.solver.z3;

import com.microsoft.z3.Context;
import com.microsoft.z3.Params;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import java.util.List;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.ir.Expression;
import leakcheck.solver.Solver;
import leakcheck.solver.SolverResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides queries with Z3 over the theories of bit-vectors and arrays.
 *
 * <p>Every query gets a fresh {@link Context}, since a context must not be shared between threads.
 * A query Z3 gives up on, or fails on, is {@code UNKNOWN}.
 */
public final class Z3Solver implements Solver {
  private static final Logger LOG = LoggerFactory.getLogger(Z3Solver.class);

  private final int addressWidth;
  private final int timeoutMs;

  /**
   * @param addressWidth width of memory addresses
   * @param timeoutMs per-query limit, or zero for none
   */
  public Z3Solver(int addressWidth, int timeoutMs) {
    if (addressWidth < 1 || addressWidth > 64) {
      throw new IllegalArgumentException("address width must be in [1, 64]: " + addressWidth);
    }
    if (timeoutMs < 0) {
      throw new IllegalArgumentException("timeout must not be negative: " + timeoutMs);
    }
    this.addressWidth = addressWidth;
    this.timeoutMs = timeoutMs;
  }

  public static Z3Solver defaults() {
    return new Z3Solver(64, 0);
  }

  /** Whether the native Z3 library loads on this machine. */
  public static boolean isAvailable() {
    return NativeLibrary.LOADED;
  }

  @Override
  public String name() {
    return "z3";
  }

  @Override
  public SolverResult check(List<Expression> assertions) throws SortMismatchException {
    for (Expression assertion : assertions) {
      assertion.validate();
      assertion.sort().expectBool();
    }
    try (Context context = new Context()) {
      com.microsoft.z3.Solver solver = context.mkSolver();
      if (timeoutMs > 0) {
        Params params = context.mkParams();
        params.add("timeout", timeoutMs);
        solver.setParameters(params);
      }
      Z3Terms terms = new Z3Terms(context, addressWidth);
      for (Expression assertion : assertions) {
        solver.add(terms.assertion(assertion));
      }
      Status status = solver.check();
      if (status == Status.SATISFIABLE) {
        return SolverResult.sat(terms.assignment(solver.getModel()));
      }
      if (status == Status.UNSATISFIABLE) {
        return SolverResult.unsat();
      }
      LOG.debug("Z3 gave up: {}", solver.getReasonUnknown());
      return SolverResult.unknown();
    } catch (Z3Exception ex) {
      LOG.warn("Z3 failed on a query of {} assertion(s): {}", assertions.size(), ex.getMessage());
      return SolverResult.unknown();
    }
  }

  private static final class NativeLibrary {
    static final boolean LOADED = load();

    private static boolean load() {
      try (Context context = new Context()) {
        LOG.debug("Loaded Z3 {}", com.microsoft.z3.Version.getString());
        return true;
      } catch (UnsatisfiedLinkError | ExceptionInInitializerError | NoClassDefFoundError ex) {
        LOG.warn("Z3 native library unavailable: {}", ex.toString());
        return false;
      }
    }
  }
}
