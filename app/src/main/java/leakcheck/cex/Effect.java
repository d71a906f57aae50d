package leakcheck.cex;

import java.util.Locale;
import java.util.Objects;

/**
 * A microarchitectural side effect of executing a block.
 *
 * @param kind what was touched
 * @param location fetched address for cache effects, branch address otherwise
 * @param value bit width of a fetch, branch target, or {@code 1}/{@code 0} for taken/not taken
 */
public record Effect(Kind kind, long location, long value) {

  public enum Kind {
    /** Memory at the location was fetched into the cache. */
    CACHE_FETCH,
    /** The branch target was tracked in the branch target buffer. */
    BRANCH_TARGET,
    /** The branch outcome was tracked in the pattern history table. */
    BRANCH_CONDITION
  }

  public Effect {
    Objects.requireNonNull(kind, "kind");
  }

  public static Effect cacheFetch(long address, int width) {
    return new Effect(Kind.CACHE_FETCH, address, width);
  }

  public static Effect branchTarget(long location, long target) {
    return new Effect(Kind.BRANCH_TARGET, location, target);
  }

  public static Effect branchCondition(long location, boolean taken) {
    return new Effect(Kind.BRANCH_CONDITION, location, taken ? 1 : 0);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case CACHE_FETCH -> "cache_fetch(" + hex(location) + ", " + value + ")";
      case BRANCH_TARGET -> "branch_target(" + hex(location) + ", " + hex(value) + ")";
      case BRANCH_CONDITION ->
          "branch_condition(" + hex(location) + ", " + (value != 0 ? "taken" : "not-taken") + ")";
    };
  }

  private static String hex(long value) {
    return "0x" + Long.toHexString(value).toUpperCase(Locale.ROOT);
  }
}
