package leakcheck.cex;

/**
 * A cache access as a timing observer sees it.
 *
 * @param block block performing the access
 * @param address the address actually accessed
 * @param line cache line of {@code address}
 * @param hit whether the line was cached
 * @param transientAccess whether the access happened under speculation
 */
public record Observation(
    int block, long address, long line, boolean hit, boolean transientAccess) {

  /** What the observer can tell apart: the line and whether it hit. */
  public boolean looksLike(Observation other) {
    return line == other.line && hit == other.hit;
  }

  @Override
  public String toString() {
    return "block "
        + block
        + " 0x"
        + Long.toHexString(address)
        + " line 0x"
        + Long.toHexString(line)
        + (hit ? " hit" : " miss")
        + (transientAccess ? " transient" : "");
  }
}
