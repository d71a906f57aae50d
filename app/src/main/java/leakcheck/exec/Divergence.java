package leakcheck.exec;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import leakcheck.cex.CompositionTrace;

/**
 * Two compositions that agree on public inputs but end in observably different hardware states.
 *
 * <p>For a normal divergence composition A follows {@code leakingSuccessor} and B follows {@code
 * referenceSuccessor}. For a transient divergence both actually go to {@code referenceSuccessor}
 * but speculatively execute {@code leakingSuccessor} first. For a store-bypass divergence {@code
 * branchBlock} holds the bypassed store and both successors name that block.
 */
public record Divergence(
    int branchBlock,
    int leakingSuccessor,
    int referenceSuccessor,
    Kind kind,
    List<String> components,
    CompositionTrace first,
    CompositionTrace second) {

  public enum Kind {
    NORMAL,
    TRANSIENT,
    STORE_BYPASS;

    public String label() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  public Divergence {
    Objects.requireNonNull(kind, "kind");
    components = List.copyOf(components);
    Objects.requireNonNull(first, "first");
    Objects.requireNonNull(second, "second");
  }

  /** Whether the difference only arises under speculation. */
  public boolean transientDivergence() {
    return kind != Kind.NORMAL;
  }

  public String describe() {
    String where =
        kind == Kind.STORE_BYPASS
            ? " at store in block " + branchBlock
            : " at block "
                + branchBlock
                + " towards "
                + leakingSuccessor
                + " (reference "
                + referenceSuccessor
                + ")";
    return kind.label().replace('_', '-')
        + " divergence"
        + where
        + ": "
        + String.join(", ", components)
        + " differ; A cache "
        + first.finalState().cache()
        + ", B cache "
        + second.finalState().cache();
  }

  @Override
  public String toString() {
    return describe();
  }
}
