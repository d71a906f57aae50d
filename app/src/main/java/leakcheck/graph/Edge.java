package leakcheck.graph;

import java.util.Locale;

/** Directed connection between two vertex indices. Two edges are equal iff both ends are. */
public record Edge(int head, int tail) implements Arc {

  @Override
  public Edge edge() {
    return this;
  }

  @Override
  public String toString() {
    return "(0x" + hex(head) + "->0x" + hex(tail) + ")";
  }

  private static String hex(int index) {
    return Integer.toHexString(index).toUpperCase(Locale.ROOT);
  }
}
