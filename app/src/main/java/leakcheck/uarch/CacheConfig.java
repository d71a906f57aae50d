package leakcheck.uarch;

/**
 * Geometry of a set-associative cache.
 *
 * @param lineBits log2 of the line size in bytes
 * @param setBits log2 of the number of sets
 * @param ways lines per set
 */
public record CacheConfig(int lineBits, int setBits, int ways) {

  public CacheConfig {
    if (lineBits < 0 || lineBits > 16) {
      throw new IllegalArgumentException("lineBits must be in [0, 16]: " + lineBits);
    }
    if (setBits < 0 || setBits > 16) {
      throw new IllegalArgumentException("setBits must be in [0, 16]: " + setBits);
    }
    if (ways < 1) {
      throw new IllegalArgumentException("ways must be positive: " + ways);
    }
  }

  /** Fully associative cache of {@code lines} lines. */
  public static CacheConfig fullyAssociative(int lineBits, int lines) {
    return new CacheConfig(lineBits, 0, lines);
  }

  public int sets() {
    return 1 << setBits;
  }

  public long capacity() {
    return (long) sets() * ways;
  }

  public long lineOf(long address) {
    return address >>> lineBits;
  }

  public int setOf(long line) {
    return (int) (line & (sets() - 1));
  }
}
