package leakcheck.exec;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import leakcheck.cex.CounterExample;
import leakcheck.ir.Expression;

/**
 * A divergence accepted by the leak policy, with its counterexample.
 *
 * @param query the self-composed solver query whose model produced the two compositions
 */
public record Finding(
    CounterExample counterExample, Divergence divergence, List<Expression> query) {

  /** Deterministic report order, independent of thread scheduling. */
  public static final Comparator<Finding> ORDER =
      Comparator.<Finding>comparingInt(f -> f.divergence().branchBlock())
          .thenComparing(f -> f.divergence().kind())
          .thenComparingInt(f -> f.divergence().leakingSuccessor())
          .thenComparingInt(f -> f.divergence().referenceSuccessor())
          .thenComparingInt(f -> f.divergence().first().steps().size());

  public Finding {
    Objects.requireNonNull(counterExample, "counterExample");
    Objects.requireNonNull(divergence, "divergence");
    query = List.copyOf(query);
  }
}
