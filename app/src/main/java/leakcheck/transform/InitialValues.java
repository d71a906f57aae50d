package leakcheck.transform;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.diagnostics.TransformException;
import leakcheck.ir.Constant;
import leakcheck.ir.Variable;
import leakcheck.pass.Transform;
import leakcheck.program.Block;
import leakcheck.program.BlockGraph;
import leakcheck.program.Operation;
import leakcheck.program.Program;

/** Binds configured registers to fixed values at the top of the entry block. */
public final class InitialValues implements Transform<Program> {
  private final Map<String, BigInteger> values;

  public InitialValues(Map<String, BigInteger> values) {
    this.values = new LinkedHashMap<>(Objects.requireNonNull(values, "values"));
  }

  @Override
  public String name() {
    return "initial-values";
  }

  @Override
  public String description() {
    return "bind configured registers to fixed values at the entry";
  }

  @Override
  public void transform(Program program) throws TransformException {
    if (values.isEmpty()) {
      return;
    }
    BlockGraph graph = program.graph();
    if (!graph.hasEntry() || !graph.containsVertex(graph.entry())) {
      throw new TransformException(name(), "program " + program.name() + " has no entry block");
    }
    List<Operation> bindings = new ArrayList<>(values.size());
    for (Map.Entry<String, BigInteger> entry : values.entrySet()) {
      Variable variable =
          find(program, entry.getKey())
              .orElseThrow(
                  () ->
                      new TransformException(
                          name(),
                          "variable `" + entry.getKey() + "` does not occur in the program"));
      if (!variable.sort().isBitVector()) {
        throw new TransformException(
            name(), "variable " + variable + " is not a bit-vector register");
      }
      try {
        Constant value = Constant.bitVector(entry.getValue(), variable.sort().width());
        bindings.add(Operation.let(variable, value.toExpression()));
      } catch (IllegalArgumentException | SortMismatchException ex) {
        throw new TransformException(
            name(),
            "cannot assign " + entry.getValue() + " to " + variable + ": " + ex.getMessage(),
            ex);
      }
    }
    Block entryBlock = graph.block(graph.entry());
    bindings.addAll(entryBlock.operations());
    graph.replaceBlock(entryBlock.withOperations(bindings));
  }

  private static Optional<Variable> find(Program program, String name) {
    return program.variables().stream().filter(v -> v.name().equals(name)).findFirst();
  }
}
