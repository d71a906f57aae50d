package leakcheck.uarch;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Saturating counters indexed by branch address and global history.
 *
 * <p>Counters start weakly not-taken at {@code 2^(b-1) - 1}. A branch is predicted taken iff its
 * counter is at least {@code 2^(b-1)}.
 */
public final class PatternHistoryTable {

  /** Counter key; the history is already masked to the table's history width. */
  public record Key(long address, long history) implements Comparable<Key> {
    @Override
    public int compareTo(Key other) {
      int byAddress = Long.compare(address, other.address);
      return byAddress != 0 ? byAddress : Long.compare(history, other.history);
    }
  }

  private final int counterBits;
  private final int historyBits;
  private final Map<Key, Integer> counters = new TreeMap<>();

  public PatternHistoryTable(int counterBits, int historyBits) {
    if (counterBits < 1 || counterBits > 8) {
      throw new IllegalArgumentException("counterBits must be in [1, 8]: " + counterBits);
    }
    if (historyBits < 0 || historyBits > 32) {
      throw new IllegalArgumentException("historyBits must be in [0, 32]: " + historyBits);
    }
    this.counterBits = counterBits;
    this.historyBits = historyBits;
  }

  public int counterBits() {
    return counterBits;
  }

  public int historyBits() {
    return historyBits;
  }

  public int initialCounter() {
    return (1 << (counterBits - 1)) - 1;
  }

  public int maxCounter() {
    return (1 << counterBits) - 1;
  }

  private Key key(long address, long history) {
    return new Key(address, history & ((1L << historyBits) - 1));
  }

  public int counter(long address, long history) {
    return counters.getOrDefault(key(address, history), initialCounter());
  }

  public boolean predict(long address, long history) {
    return counter(address, history) >= 1 << (counterBits - 1);
  }

  public void update(long address, long history, boolean taken) {
    int current = counter(address, history);
    int next = taken ? Math.min(current + 1, maxCounter()) : Math.max(current - 1, 0);
    counters.put(key(address, history), next);
  }

  /** Counters that have been trained, in key order. */
  public Map<Key, Integer> counters() {
    return Collections.unmodifiableMap(counters);
  }

  public PatternHistoryTable copy() {
    PatternHistoryTable copy = new PatternHistoryTable(counterBits, historyBits);
    copy.counters.putAll(counters);
    return copy;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PatternHistoryTable other)) {
      return false;
    }
    return counterBits == other.counterBits
        && historyBits == other.historyBits
        && counters.equals(other.counters);
  }

  @Override
  public int hashCode() {
    return Objects.hash(counterBits, historyBits, counters);
  }

  @Override
  public String toString() {
    return counters.toString();
  }
}
