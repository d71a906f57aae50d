package leakcheck.uarch;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;
import java.util.StringJoiner;

/** Maps branch addresses to their last target, evicting the least recently updated entry. */
public final class BranchTargetBuffer {
  private final int capacity;
  private final LinkedHashMap<Long, Long> entries = new LinkedHashMap<>();

  public BranchTargetBuffer(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("BTB capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
  }

  public int capacity() {
    return capacity;
  }

  public OptionalLong predict(long address) {
    Long target = entries.get(address);
    return target == null ? OptionalLong.empty() : OptionalLong.of(target);
  }

  public void update(long address, long target) {
    entries.remove(address);
    if (entries.size() >= capacity) {
      Iterator<Long> lru = entries.keySet().iterator();
      lru.next();
      lru.remove();
    }
    entries.put(address, target);
  }

  /** Entries from least to most recently updated. */
  public Map<Long, Long> entries() {
    return Collections.unmodifiableMap(entries);
  }

  public BranchTargetBuffer copy() {
    BranchTargetBuffer copy = new BranchTargetBuffer(capacity);
    copy.entries.putAll(entries);
    return copy;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BranchTargetBuffer other)) {
      return false;
    }
    return capacity == other.capacity && entries.equals(other.entries);
  }

  @Override
  public int hashCode() {
    return 31 * capacity + entries.hashCode();
  }

  @Override
  public String toString() {
    StringJoiner joiner = new StringJoiner(", ", "{", "}");
    entries.forEach((address, target) -> joiner.add(hex(address) + " -> " + hex(target)));
    return joiner.toString();
  }

  private static String hex(long value) {
    return "0x" + Long.toHexString(value).toUpperCase(Locale.ROOT);
  }
}
