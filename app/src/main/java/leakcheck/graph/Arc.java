package leakcheck.graph;

/** Anything stored as an edge of a {@link DirectedGraph}; identified by its structural edge. */
public interface Arc {

  Edge edge();

  default int head() {
    return edge().head();
  }

  default int tail() {
    return edge().tail();
  }
}
