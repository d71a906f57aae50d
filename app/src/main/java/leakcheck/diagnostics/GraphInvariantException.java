package leakcheck.diagnostics;

/** A graph references missing blocks, lacks its entry, or contains unreachable blocks. */
public class GraphInvariantException extends AnalysisException {
  private static final long serialVersionUID = 1L;

  public GraphInvariantException(String message) {
    super(ErrorKind.GRAPH_INVARIANT, message);
  }
}
