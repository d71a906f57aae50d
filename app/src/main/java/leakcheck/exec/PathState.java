package leakcheck.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import leakcheck.cex.Observation;
import leakcheck.cex.TraceStep;
import leakcheck.ir.Expression;
import leakcheck.ir.Variable;
import leakcheck.uarch.MicroarchitecturalState;

/**
 * Everything one explored path owns: register bindings, path condition, the blocks walked so far,
 * the cache accesses made so far and the hardware state. Forking a path copies it; IR values are
 * shared.
 */
public final class PathState {
  private final Map<Variable, Expression> bindings;
  private final List<Expression> pathCondition;
  private final List<TraceStep> trace;
  private final List<Observation> observations;
  private MicroarchitecturalState hardware;

  public PathState(MicroarchitecturalState hardware) {
    this(new HashMap<>(), new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), hardware);
  }

  private PathState(
      Map<Variable, Expression> bindings,
      List<Expression> pathCondition,
      List<TraceStep> trace,
      List<Observation> observations,
      MicroarchitecturalState hardware) {
    this.bindings = bindings;
    this.pathCondition = pathCondition;
    this.trace = trace;
    this.observations = observations;
    this.hardware = Objects.requireNonNull(hardware, "hardware");
  }

  public PathState copy() {
    return new PathState(
        new HashMap<>(bindings),
        new ArrayList<>(pathCondition),
        new ArrayList<>(trace),
        new ArrayList<>(observations),
        hardware.copy());
  }

  /** Rewrites {@code expression} in terms of program inputs. */
  public Expression resolve(Expression expression) {
    return expression.substitute(bindings);
  }

  public void bind(Variable variable, Expression value) {
    bindings.put(variable, value);
  }

  public Map<Variable, Expression> bindings() {
    return Collections.unmodifiableMap(bindings);
  }

  public void addCondition(Expression condition) {
    pathCondition.add(condition);
  }

  public List<Expression> pathCondition() {
    return Collections.unmodifiableList(pathCondition);
  }

  public void addStep(TraceStep step) {
    trace.add(step);
  }

  /** Blocks completed so far, excluding the one currently executing. */
  public List<TraceStep> trace() {
    return Collections.unmodifiableList(trace);
  }

  public int length() {
    return trace.size();
  }

  public void observe(Observation observation) {
    observations.add(observation);
  }

  public List<Observation> observations() {
    return Collections.unmodifiableList(observations);
  }

  public MicroarchitecturalState hardware() {
    return hardware;
  }

  public void setHardware(MicroarchitecturalState hardware) {
    this.hardware = Objects.requireNonNull(hardware, "hardware");
  }
}
