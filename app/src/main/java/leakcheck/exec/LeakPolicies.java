package leakcheck.exec;

import java.util.Locale;

/** Bundled leak policies. */
public final class LeakPolicies {
  private LeakPolicies() {}

  /** Every observable difference is a leak. */
  public static LeakPolicy anyDifference() {
    return divergence -> !divergence.components().isEmpty();
  }

  /** Only differences in cache contents are leaks; predictor state is ignored. */
  public static LeakPolicy cacheOnly() {
    return divergence -> divergence.components().contains("cache");
  }

  public static LeakPolicy byName(String name) {
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "any", "any-difference" -> anyDifference();
      case "cache", "cache-only" -> cacheOnly();
      default -> throw new IllegalArgumentException("unknown leak policy: " + name);
    };
  }
}
