package leakcheck.program;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import leakcheck.diagnostics.AnalysisException;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.ir.Expression;
import leakcheck.ir.Variable;
import leakcheck.pass.Validate;

/** A named program: the single owner of its block graph. Transforms mutate it in place. */
public final class Program implements Validate {
  private final String name;
  private BlockGraph graph;

  public Program(String name, BlockGraph graph) {
    this.name = Objects.requireNonNull(name, "name");
    this.graph = Objects.requireNonNull(graph, "graph");
  }

  public String name() {
    return name;
  }

  public BlockGraph graph() {
    return graph;
  }

  /** Independent snapshot; later mutations of either program do not affect the other. */
  public Program copy() {
    return new Program(name, graph.copy());
  }

  /** Puts this program back into the state captured by {@code snapshot}. */
  public void restore(Program snapshot) {
    this.graph = snapshot.graph.copy();
  }

  @Override
  public void validate() throws AnalysisException {
    validate(false);
  }

  /**
   * Validates the graph structure first, then the operations of every block, the sorts of the
   * transition guards and finally that no variable name is used with two sorts.
   */
  public void validate(boolean strict) throws AnalysisException {
    graph.validate(strict);
    for (Block block : graph.vertices().values()) {
      try {
        block.validate();
      } catch (SortMismatchException ex) {
        throw new SortMismatchException("block " + block.index() + ": " + ex.getMessage());
      }
    }
    for (Transition transition : graph.edges()) {
      if (transition.guard().isPresent()) {
        Expression guard = transition.guard().get();
        guard.validate();
        if (!guard.sort().isBool()) {
          throw new SortMismatchException(
              "guard of edge "
                  + transition.edge()
                  + " must be Bool but is "
                  + guard.sort().describe());
        }
      }
    }
    checkVariableSorts();
  }

  private void checkVariableSorts() throws SortMismatchException {
    Map<String, Variable> seen = new HashMap<>();
    for (Variable variable : variables()) {
      Variable previous = seen.putIfAbsent(variable.name(), variable);
      if (previous != null && !previous.sort().equals(variable.sort())) {
        throw new SortMismatchException(
            "variable `"
                + variable.name()
                + "` is used both as "
                + previous.sort().describe()
                + " and as "
                + variable.sort().describe());
      }
    }
  }

  /** Every variable read, written or tested anywhere in the program. */
  public SortedSet<Variable> variables() {
    SortedSet<Variable> result = new TreeSet<>();
    for (Block block : graph.vertices().values()) {
      for (Operation operation : block.operations()) {
        operation.target().ifPresent(result::add);
        result.addAll(operation.usedVariables());
      }
    }
    for (Transition transition : graph.edges()) {
      transition.guard().ifPresent(guard -> result.addAll(guard.variables()));
    }
    return result;
  }

  @Override
  public String toString() {
    return "program " + name + "\n" + graph;
  }
}
