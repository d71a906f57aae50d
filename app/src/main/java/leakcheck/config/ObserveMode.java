package leakcheck.config;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * When the attacker looks at the hardware.
 *
 * <p>The hardware state left behind by a run is always observable. A {@code PARALLEL} attacker
 * also watches every cache access while it happens; a {@code LOCATIONS} attacker watches only the
 * accesses made by blocks at the listed addresses.
 */
public record ObserveMode(Kind kind, SortedSet<Long> locations) {

  public enum Kind {
    SEQUENTIAL,
    PARALLEL,
    LOCATIONS
  }

  public ObserveMode {
    Objects.requireNonNull(kind, "kind");
    locations = Collections.unmodifiableSortedSet(new TreeSet<>(locations));
    if (kind != Kind.LOCATIONS && !locations.isEmpty()) {
      throw new IllegalArgumentException("only the locations mode takes addresses");
    }
  }

  public static ObserveMode sequential() {
    return new ObserveMode(Kind.SEQUENTIAL, Collections.emptySortedSet());
  }

  public static ObserveMode parallel() {
    return new ObserveMode(Kind.PARALLEL, Collections.emptySortedSet());
  }

  public static ObserveMode locations(Collection<Long> addresses) {
    return new ObserveMode(Kind.LOCATIONS, new TreeSet<>(addresses));
  }

  /** Accepts {@code sequential}, {@code parallel} and {@code locations}. */
  public static ObserveMode parse(String text, Collection<Long> addresses) {
    return switch (text.trim().toLowerCase(Locale.ROOT)) {
      case "sequential" -> sequential();
      case "parallel" -> parallel();
      case "locations" -> locations(addresses);
      default -> throw new IllegalArgumentException("unknown observe mode: " + text);
    };
  }

  /** Whether accesses made by the block at {@code blockAddress} are seen as they happen. */
  public boolean watchesAccessesAt(long blockAddress) {
    return switch (kind) {
      case SEQUENTIAL -> false;
      case PARALLEL -> true;
      case LOCATIONS -> locations.contains(blockAddress);
    };
  }

  public String label() {
    return kind.name().toLowerCase(Locale.ROOT);
  }
}
