package leakcheck.exec;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import leakcheck.config.SecurityPolicy;
import leakcheck.ir.Assignment;
import leakcheck.ir.Constant;
import leakcheck.ir.Expression;
import leakcheck.ir.ExpressionEvaluator;
import leakcheck.ir.Variable;

/**
 * Concrete inputs of one composition.
 *
 * <p>Starts from a solver model. Inputs the model leaves open are fixed on first use: low inputs
 * get zero in both compositions, high inputs get zero in A and all ones in B, so the two
 * compositions disagree on every secret nobody constrained.
 */
final class CompositionModel implements Concretizer {
  private final Map<Variable, Constant> values;
  private final SecurityPolicy policy;
  private final boolean secretsAllOnes;

  CompositionModel(Assignment model, SecurityPolicy policy, boolean secretsAllOnes) {
    this.values = new LinkedHashMap<>(model.values());
    this.policy = policy;
    this.secretsAllOnes = secretsAllOnes;
  }

  Optional<Constant> evaluate(Expression expression) {
    return ExpressionEvaluator.evaluate(expression, this::valueOf);
  }

  /** Whether {@code guard} holds; an undecidable guard counts as false. */
  boolean decide(Expression guard) {
    return evaluate(guard).map(Constant::booleanValue).orElse(false);
  }

  @Override
  public OptionalLong address(Expression address, PathState state) {
    Optional<Constant> value = evaluate(address);
    return value.isPresent()
        ? OptionalLong.of(value.get().value().longValue())
        : OptionalLong.empty();
  }

  @Override
  public boolean assume(Expression condition, PathState state) {
    return decide(condition);
  }

  /** Every input this composition has read so far. */
  Assignment inputs() {
    return Assignment.of(values);
  }

  private Optional<Constant> valueOf(Variable variable) {
    if (variable.sort().isMemory()) {
      return Optional.empty();
    }
    return Optional.of(values.computeIfAbsent(variable, this::defaultValue));
  }

  private Constant defaultValue(Variable variable) {
    boolean ones = secretsAllOnes && policy.isHigh(variable);
    if (variable.sort().isBool()) {
      return Constant.bool(ones);
    }
    int width = variable.sort().width();
    return ones
        ? Constant.bitVector(BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE), width)
        : Constant.zero(width);
  }
}
