package leakcheck.solver;

import java.util.Objects;
import java.util.Optional;
import leakcheck.ir.Assignment;

/** Verdict of a satisfiability query; a model accompanies every {@code SAT} verdict. */
public record SolverResult(Status status, Optional<Assignment> model) {

  public enum Status {
    SAT,
    UNSAT,
    UNKNOWN
  }

  public SolverResult {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(model, "model");
    if ((status == Status.SAT) != model.isPresent()) {
      throw new IllegalArgumentException("a model must accompany exactly the SAT verdicts");
    }
  }

  public static SolverResult sat(Assignment model) {
    return new SolverResult(Status.SAT, Optional.of(model));
  }

  public static SolverResult unsat() {
    return new SolverResult(Status.UNSAT, Optional.empty());
  }

  public static SolverResult unknown() {
    return new SolverResult(Status.UNKNOWN, Optional.empty());
  }

  public boolean isSat() {
    return status == Status.SAT;
  }

  /** The solver gave up without a verdict. */
  public boolean isUnknown() {
    return status == Status.UNKNOWN;
  }

  /** True unless the query was proven unsatisfiable. */
  public boolean maybeSat() {
    return status != Status.UNSAT;
  }
}
