package leakcheck.cex;

import java.util.ArrayList;
import java.util.List;
import leakcheck.graph.DirectedGraph;
import leakcheck.report.DotWriter;
import leakcheck.report.RenderGraph;

/** The graph of a counterexample: touched blocks and the transitions between them. */
public final class ControlFlowGraph extends DirectedGraph<AnnotatedBlock, AnnotatedEdge>
    implements RenderGraph {
  private static final String UNEXECUTED = "#34343433";

  public void addBlock(AnnotatedBlock block) {
    addVertex(block.index(), block);
  }

  public AnnotatedBlock block(int index) {
    return vertex(index)
        .orElseThrow(() -> new IllegalArgumentException("no block with index " + index));
  }

  public AnnotatedEdge edgeBetween(int head, int tail) {
    return edge(head, tail)
        .orElseThrow(
            () -> new IllegalArgumentException("no edge from " + head + " to " + tail));
  }

  public ControlFlowGraph copy() {
    return copyInto(new ControlFlowGraph(), AnnotatedBlock::copy, AnnotatedEdge::copy);
  }

  @Override
  public String renderToString() {
    DotWriter dot = new DotWriter("counterexample");
    dot.graphAttributes(DotWriter.attributes("rankdir", "TB"))
        .nodeDefaults(
            DotWriter.attributes("shape", "box", "style", "filled", "fontname", "monospace"));
    for (AnnotatedBlock block : vertices().values()) {
      dot.node(
          Integer.toString(block.index()),
          DotWriter.attributes(
              "label",
              block.toString(),
              "fillcolor",
              block.fillColor(),
              "fontcolor",
              block.fontColor()));
    }
    for (AnnotatedEdge edge : edges()) {
      dot.edge(
          Integer.toString(edge.head()),
          Integer.toString(edge.tail()),
          DotWriter.attributes(
              "color", edgeColor(edge), "style", edge.isTransient() ? "dashed" : "solid"));
    }
    return dot.render();
  }

  private static String edgeColor(AnnotatedEdge edge) {
    List<String> colors = new ArrayList<>(2);
    for (Composition composition : Composition.values()) {
      if (edge.executedBy(composition)) {
        colors.add(composition.color());
      }
    }
    return colors.isEmpty() ? UNEXECUTED : String.join(":", colors);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (AnnotatedBlock block : vertices().values()) {
      sb.append(block).append('\n');
    }
    for (AnnotatedEdge edge : edges()) {
      sb.append("edge ").append(edge).append('\n');
    }
    return sb.toString();
  }
}
