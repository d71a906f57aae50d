package leakcheck.transform;

import java.util.ArrayList;
import java.util.List;
import leakcheck.diagnostics.TransformException;
import leakcheck.ir.Expression;
import leakcheck.ir.ExpressionSimplifier;
import leakcheck.pass.Transform;
import leakcheck.program.Block;
import leakcheck.program.BlockGraph;
import leakcheck.program.Operation;
import leakcheck.program.Program;
import leakcheck.program.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simplifies every operation and guard. Guards that fold to {@code true} are dropped and
 * transitions whose guard folds to {@code false} are removed.
 */
public final class ConstantFolding implements Transform<Program> {
  private static final Logger LOG = LoggerFactory.getLogger(ConstantFolding.class);

  @Override
  public String name() {
    return "constant-folding";
  }

  @Override
  public String description() {
    return "fold constant sub-expressions and decided branch guards";
  }

  @Override
  public void transform(Program program) throws TransformException {
    BlockGraph graph = program.graph();
    try {
      for (Block block : List.copyOf(graph.vertices().values())) {
        List<Operation> folded = new ArrayList<>(block.operations().size());
        for (Operation operation : block.operations()) {
          folded.add(operation.mapExpressions(ExpressionSimplifier::simplify));
        }
        if (!folded.equals(block.operations())) {
          graph.replaceBlock(block.withOperations(folded));
        }
      }
      int removed = 0;
      for (Transition transition : graph.edges()) {
        if (transition.guard().isEmpty()) {
          continue;
        }
        Expression guard = ExpressionSimplifier.simplify(transition.guard().get());
        if (guard.isConstant() && !guard.constant().booleanValue()) {
          graph.removeEdge(transition.head(), transition.tail());
          removed++;
        } else if (guard.isConstant()) {
          graph.putEdge(transition.withGuard(null));
        } else if (!guard.equals(transition.guard().get())) {
          graph.putEdge(transition.withGuard(guard));
        }
      }
      LOG.debug("Removed {} infeasible transitions from {}", removed, program.name());
    } catch (IllegalArgumentException ex) {
      throw new TransformException(name(), ex.getMessage(), ex);
    }
  }
}
