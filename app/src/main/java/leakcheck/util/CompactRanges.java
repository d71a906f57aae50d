package leakcheck.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;
import java.util.TreeSet;

/** Collapses runs of consecutive values into inclusive ranges. */
public final class CompactRanges {
  private CompactRanges() {}

  /** An inclusive range {@code [first, last]}. */
  public record Range(long first, long last) {
    public Range {
      if (last < first) {
        throw new IllegalArgumentException("empty range [" + first + ", " + last + "]");
      }
    }

    public boolean isSingleton() {
      return first == last;
    }
  }

  public static List<Range> compact(Collection<Long> values) {
    List<Range> ranges = new ArrayList<>();
    Long start = null;
    long previous = 0;
    for (long value : new TreeSet<>(values)) {
      if (start == null) {
        start = value;
      } else if (value != previous + 1) {
        ranges.add(new Range(start, previous));
        start = value;
      }
      previous = value;
    }
    if (start != null) {
      ranges.add(new Range(start, previous));
    }
    return ranges;
  }

  /** Renders e.g. {@code {0x0…0x3, 0x8}}. */
  public static String renderHex(Collection<Long> values) {
    StringJoiner joiner = new StringJoiner(", ", "{", "}");
    for (Range range : compact(values)) {
      if (range.isSingleton()) {
        joiner.add(hex(range.first()));
      } else {
        joiner.add(hex(range.first()) + "…" + hex(range.last()));
      }
    }
    return joiner.toString();
  }

  private static String hex(long value) {
    return "0x" + Long.toHexString(value).toUpperCase(Locale.ROOT);
  }
}
