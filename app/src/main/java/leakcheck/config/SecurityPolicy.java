package leakcheck.config;

import java.util.Set;
import java.util.TreeSet;
import leakcheck.ir.Variable;
import leakcheck.uarch.Memory;

/**
 * Classifies program inputs as public (low) or secret (high).
 *
 * <p>Explicit names win; otherwise registers fall back to {@code registerDefault} and bytes of
 * initial memory to {@code memoryDefault}.
 */
public record SecurityPolicy(
    Level registerDefault, Level memoryDefault, Set<String> low, Set<String> high) {

  public enum Level {
    LOW,
    HIGH
  }

  public static SecurityPolicy defaults() {
    return new SecurityPolicy(Level.LOW, Level.HIGH, Set.of(), Set.of());
  }

  public static SecurityPolicy normalize(SecurityPolicy policy) {
    if (policy == null) {
      return defaults();
    }
    SecurityPolicy defaults = defaults();
    Level registers =
        policy.registerDefault() != null ? policy.registerDefault() : defaults.registerDefault();
    Level memory =
        policy.memoryDefault() != null ? policy.memoryDefault() : defaults.memoryDefault();
    Set<String> low = policy.low() != null ? Set.copyOf(policy.low()) : Set.of();
    Set<String> high = policy.high() != null ? Set.copyOf(policy.high()) : Set.of();
    Set<String> both = new TreeSet<>(low);
    both.retainAll(high);
    if (!both.isEmpty()) {
      throw new IllegalArgumentException("inputs declared both low and high: " + both);
    }
    return new SecurityPolicy(registers, memory, low, high);
  }

  /** The same policy with {@code names} additionally declared secret. */
  public SecurityPolicy withSecrets(Set<String> names) {
    Set<String> newHigh = new TreeSet<>(high);
    newHigh.addAll(names);
    Set<String> newLow = new TreeSet<>(low);
    newLow.removeAll(names);
    return new SecurityPolicy(registerDefault, memoryDefault, newLow, newHigh);
  }

  public Level levelOf(Variable variable) {
    String name = variable.name();
    if (high.contains(name)) {
      return Level.HIGH;
    }
    if (low.contains(name)) {
      return Level.LOW;
    }
    if (variable.sort().isMemory() || name.startsWith(Memory.BYTE_PREFIX)) {
      return memoryDefault;
    }
    return registerDefault;
  }

  public boolean isHigh(Variable variable) {
    return levelOf(variable) == Level.HIGH;
  }
}
