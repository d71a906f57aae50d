package leakcheck.config;

import java.util.Locale;

/** Which kinds of divergence the analysis looks for. */
public enum CheckMode {
  NORMAL_ONLY,
  TRANSIENT_ONLY,
  ALL;

  public boolean checksNormal() {
    return this != TRANSIENT_ONLY;
  }

  public boolean checksTransient() {
    return this != NORMAL_ONLY;
  }

  /** Accepts {@code normal}, {@code transient}, {@code all} and the enum names. */
  public static CheckMode parse(String text) {
    String normalized = text.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    return switch (normalized) {
      case "normal", "only_normal", "normal_only" -> NORMAL_ONLY;
      case "transient", "only_transient", "transient_only" -> TRANSIENT_ONLY;
      case "all" -> ALL;
      default -> throw new IllegalArgumentException("unknown check mode: " + text);
    };
  }
}
