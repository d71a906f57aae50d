package leakcheck.uarch;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import leakcheck.util.CompactRanges;

/**
 * Set-associative cache with least-recently-used replacement in every set.
 *
 * <p>Each set keeps its lines from least to most recently used. Equality compares which lines are
 * cached, since that is all a timing observer can learn.
 */
public final class Cache {
  private final CacheConfig config;
  // set index -> lines from least to most recently used
  private final Map<Integer, LinkedHashSet<Long>> sets = new TreeMap<>();

  public Cache(CacheConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  public CacheConfig config() {
    return config;
  }

  public CacheAccess read(long address) {
    return access(config.lineOf(address));
  }

  /** Write-allocate: a store fills its line like a read does. */
  public CacheAccess write(long address) {
    return access(config.lineOf(address));
  }

  private CacheAccess access(long line) {
    LinkedHashSet<Long> set = sets.computeIfAbsent(config.setOf(line), k -> new LinkedHashSet<>());
    boolean hit = set.remove(line);
    OptionalLong evicted = OptionalLong.empty();
    if (!hit && set.size() >= config.ways()) {
      Iterator<Long> lru = set.iterator();
      evicted = OptionalLong.of(lru.next());
      lru.remove();
    }
    set.add(line);
    return new CacheAccess(hit, line, evicted);
  }

  public boolean contains(long address) {
    long line = config.lineOf(address);
    LinkedHashSet<Long> set = sets.get(config.setOf(line));
    return set != null && set.contains(line);
  }

  /**
   * Fills every set with lines from the top of an {@code addressWidth}-bit address space, the
   * same lines in every copy. Program accesses then evict them in LRU order.
   */
  public void prime(int addressWidth) {
    if (addressWidth < 1 || addressWidth > 64) {
      throw new IllegalArgumentException("address width must be in [1, 64]: " + addressWidth);
    }
    long lastLine = (addressWidth == 64 ? -1L : (1L << addressWidth) - 1) >>> config.lineBits();
    long lastTag = lastLine >>> config.setBits();
    sets.clear();
    for (int set = 0; set < config.sets(); set++) {
      for (int way = config.ways() - 1; way >= 0; way--) {
        access(((lastTag - way) << config.setBits()) | set);
      }
    }
  }

  public void flush() {
    sets.clear();
  }

  public SortedSet<Long> cachedLines() {
    SortedSet<Long> lines = new TreeSet<>();
    for (LinkedHashSet<Long> set : sets.values()) {
      lines.addAll(set);
    }
    return lines;
  }

  public Cache copy() {
    Cache copy = new Cache(config);
    sets.forEach((index, set) -> copy.sets.put(index, new LinkedHashSet<>(set)));
    return copy;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Cache other)) {
      return false;
    }
    return config.equals(other.config) && cachedLines().equals(other.cachedLines());
  }

  @Override
  public int hashCode() {
    return Objects.hash(config, cachedLines());
  }

  @Override
  public String toString() {
    return CompactRanges.renderHex(cachedLines());
  }
}
