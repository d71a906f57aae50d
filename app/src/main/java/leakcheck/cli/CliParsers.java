package leakcheck.cli;

import com.google.common.base.Splitter;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import leakcheck.uarch.PredictorStrategy;

/** Shared helpers for CLI argument parsing. */
final class CliParsers {
  private static final Splitter NAME_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private CliParsers() {}

  static int parseInt(String raw, String optionName) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static int parsePositiveInt(String raw, String optionName) {
    int value = parseInt(raw, optionName);
    if (value < 1) {
      throw new IllegalArgumentException(optionName + " must be positive: " + raw);
    }
    return value;
  }

  static long parseLong(String raw, String optionName) {
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid long for " + optionName + ": " + raw);
    }
  }

  static Set<String> parseNames(String raw) {
    if (raw == null || raw.isBlank()) {
      return Set.of();
    }
    return new LinkedHashSet<>(NAME_SPLITTER.splitToList(raw));
  }

  static PredictorStrategy parsePredictor(String raw) {
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "model", "pht" -> PredictorStrategy.MODEL;
      case "always-mispredict", "mispredict", "adversarial" -> PredictorStrategy.ALWAYS_MISPREDICT;
      default -> throw new IllegalArgumentException("Invalid predictor: " + raw);
    };
  }
}
