package leakcheck.solver;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.ir.Assignment;
import leakcheck.ir.Constant;
import leakcheck.ir.Expression;
import leakcheck.ir.ExpressionEvaluator;
import leakcheck.ir.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reference solver that searches assignments by enumeration.
 *
 * <p>Boolean variables and bit-vectors up to {@code exhaustiveWidth} bits are enumerated
 * completely. Wider bit-vectors only try boundary values and the constants of the query (and their
 * neighbours). The verdict is {@code UNSAT} only when the whole search space was covered and every
 * assertion could be evaluated; otherwise an unsuccessful search ends in {@code UNKNOWN}.
 */
public final class EnumeratingSolver implements Solver {
  private static final Logger LOG = LoggerFactory.getLogger(EnumeratingSolver.class);

  private final int exhaustiveWidth;
  private final long maxCandidates;

  public EnumeratingSolver(int exhaustiveWidth, long maxCandidates) {
    if (exhaustiveWidth < 0 || exhaustiveWidth > 16) {
      throw new IllegalArgumentException("exhaustiveWidth must be in [0, 16]: " + exhaustiveWidth);
    }
    if (maxCandidates < 1) {
      throw new IllegalArgumentException("maxCandidates must be positive: " + maxCandidates);
    }
    this.exhaustiveWidth = exhaustiveWidth;
    this.maxCandidates = maxCandidates;
  }

  public static EnumeratingSolver defaults() {
    return new EnumeratingSolver(8, 1L << 20);
  }

  @Override
  public String name() {
    return "enumerating";
  }

  @Override
  public SolverResult check(List<Expression> assertions) throws SortMismatchException {
    SortedSet<Variable> variables = new TreeSet<>();
    for (Expression assertion : assertions) {
      assertion.sort().expectBool();
      variables.addAll(assertion.variables());
    }
    boolean complete = true;
    List<Variable> order = new ArrayList<>();
    List<List<Constant>> domains = new ArrayList<>();
    Set<Constant> queryConstants = constantsOf(assertions);
    for (Variable variable : variables) {
      if (variable.sort().isMemory()) {
        // Memory contents are not enumerated; loads evaluate to unknown.
        complete = false;
        continue;
      }
      Domain domain = domainOf(variable, queryConstants);
      complete &= domain.exhaustive();
      order.add(variable);
      domains.add(domain.values());
    }

    int[] cursor = new int[order.size()];
    long tried = 0;
    while (true) {
      if (tried++ >= maxCandidates) {
        LOG.debug("Gave up after {} candidate assignments", maxCandidates);
        return SolverResult.unknown();
      }
      Map<Variable, Constant> values = new LinkedHashMap<>();
      for (int i = 0; i < cursor.length; i++) {
        values.put(order.get(i), domains.get(i).get(cursor[i]));
      }
      Assignment candidate = Assignment.of(values);
      Verdict verdict = evaluate(assertions, candidate);
      if (verdict == Verdict.TRUE) {
        return SolverResult.sat(candidate);
      }
      complete &= verdict != Verdict.UNKNOWN;
      if (!advance(cursor, domains)) {
        return complete ? SolverResult.unsat() : SolverResult.unknown();
      }
    }
  }

  private enum Verdict {
    TRUE,
    FALSE,
    UNKNOWN
  }

  private static Verdict evaluate(List<Expression> assertions, Assignment candidate) {
    boolean unknown = false;
    for (Expression assertion : assertions) {
      Optional<Constant> value = ExpressionEvaluator.evaluate(assertion, candidate);
      if (value.isEmpty()) {
        unknown = true;
      } else if (!value.get().booleanValue()) {
        return Verdict.FALSE;
      }
    }
    return unknown ? Verdict.UNKNOWN : Verdict.TRUE;
  }

  // Odometer increment over the candidate domains; false once every combination was visited.
  private static boolean advance(int[] cursor, List<List<Constant>> domains) {
    for (int i = cursor.length - 1; i >= 0; i--) {
      if (++cursor[i] < domains.get(i).size()) {
        return true;
      }
      cursor[i] = 0;
    }
    return false;
  }

  private record Domain(List<Constant> values, boolean exhaustive) {}

  private Domain domainOf(Variable variable, Set<Constant> queryConstants) {
    if (variable.sort().isBool()) {
      return new Domain(List.of(Constant.FALSE, Constant.TRUE), true);
    }
    int width = variable.sort().width();
    if (width <= exhaustiveWidth) {
      List<Constant> values = new ArrayList<>(1 << width);
      for (long value = 0; value < 1L << width; value++) {
        values.add(Constant.bitVector(value, width));
      }
      return new Domain(values, true);
    }
    Set<Constant> values = new LinkedHashSet<>();
    values.add(Constant.zero(width));
    values.add(Constant.truncating(1, width));
    values.add(Constant.truncating(-1, width));
    for (Constant constant : queryConstants) {
      if (constant.isBitVector()) {
        BigInteger value = constant.value();
        values.add(Constant.truncating(value, width));
        values.add(Constant.truncating(value.add(BigInteger.ONE), width));
        values.add(Constant.truncating(value.subtract(BigInteger.ONE), width));
      }
    }
    return new Domain(List.copyOf(values), false);
  }

  private static Set<Constant> constantsOf(List<Expression> assertions) {
    Set<Constant> constants = new LinkedHashSet<>();
    for (Expression assertion : assertions) {
      collectConstants(assertion, constants);
    }
    return constants;
  }

  private static void collectConstants(Expression expression, Set<Constant> into) {
    if (expression.isConstant()) {
      into.add(expression.constant());
      return;
    }
    for (Expression operand : expression.operands()) {
      collectConstants(operand, into);
    }
  }
}
