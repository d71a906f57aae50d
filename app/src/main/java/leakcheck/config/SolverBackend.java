package leakcheck.config;

import java.util.Locale;

/** Which decision procedure answers the exploration's queries. */
public enum SolverBackend {
  /** Z3 through its Java bindings, or {@link #ENUMERATING} where the native library is missing. */
  Z3,
  /** Built-in search over candidate assignments; exhaustive only for narrow inputs. */
  ENUMERATING;

  public static SolverBackend parse(String text) {
    String normalized = text.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "z3" -> Z3;
      case "enumerating", "enumerate", "builtin" -> ENUMERATING;
      default -> throw new IllegalArgumentException("unknown solver: " + text);
    };
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
