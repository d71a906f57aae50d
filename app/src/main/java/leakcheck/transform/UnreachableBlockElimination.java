package leakcheck.transform;

import java.util.List;
import java.util.Set;
import leakcheck.diagnostics.TransformException;
import leakcheck.pass.Transform;
import leakcheck.program.BlockGraph;
import leakcheck.program.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Removes blocks that cannot be reached from the entry. */
public final class UnreachableBlockElimination implements Transform<Program> {
  private static final Logger LOG = LoggerFactory.getLogger(UnreachableBlockElimination.class);

  @Override
  public String name() {
    return "unreachable-block-elimination";
  }

  @Override
  public String description() {
    return "remove blocks unreachable from the entry";
  }

  @Override
  public void transform(Program program) throws TransformException {
    BlockGraph graph = program.graph();
    if (!graph.hasEntry() || !graph.containsVertex(graph.entry())) {
      throw new TransformException(name(), "program " + program.name() + " has no entry block");
    }
    Set<Integer> reachable = graph.reachableFrom(graph.entry());
    int removed = 0;
    for (int index : List.copyOf(graph.vertices().keySet())) {
      if (!reachable.contains(index)) {
        graph.removeBlock(index);
        removed++;
      }
    }
    if (removed > 0) {
      LOG.info("Removed {} unreachable block(s) from {}", removed, program.name());
    }
  }
}
