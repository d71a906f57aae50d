package leakcheck.program;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import leakcheck.graph.Arc;
import leakcheck.graph.Edge;
import leakcheck.ir.Expression;

/**
 * Control-flow edge of a {@link BlockGraph}, optionally guarded by a Boolean expression.
 *
 * <p>The guard is what tells the taken and fall-through edges of a branch apart; an absent guard
 * means the transition is always enabled.
 */
public final class Transition implements Arc {
  private final Edge edge;
  private final BranchKind kind;
  private final Expression guard;

  private Transition(Edge edge, BranchKind kind, Expression guard) {
    this.edge = Objects.requireNonNull(edge, "edge");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.guard = guard;
  }

  public static Transition unconditional(int head, int tail) {
    return new Transition(new Edge(head, tail), BranchKind.UNCONDITIONAL, null);
  }

  public static Transition guarded(int head, int tail, BranchKind kind, Expression guard) {
    if (kind == BranchKind.UNCONDITIONAL) {
      throw new IllegalArgumentException("an unconditional transition has no guard");
    }
    return new Transition(new Edge(head, tail), kind, Objects.requireNonNull(guard, "guard"));
  }

  @Override
  public Edge edge() {
    return edge;
  }

  public BranchKind kind() {
    return kind;
  }

  public Optional<Expression> guard() {
    return Optional.ofNullable(guard);
  }

  public boolean isConditional() {
    return guard != null;
  }

  /** Same edge and kind with another guard; {@code null} drops the guard. */
  public Transition withGuard(Expression replacement) {
    if (replacement == null) {
      return new Transition(edge, BranchKind.UNCONDITIONAL, null);
    }
    BranchKind newKind = kind == BranchKind.UNCONDITIONAL ? BranchKind.CONDITIONAL : kind;
    return new Transition(edge, newKind, replacement);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Transition other)) {
      return false;
    }
    return edge.equals(other.edge) && kind == other.kind && Objects.equals(guard, other.guard);
  }

  @Override
  public int hashCode() {
    return Objects.hash(edge, kind, guard);
  }

  @Override
  public String toString() {
    if (guard == null) {
      return edge.toString();
    }
    return edge + " " + kind.name().toLowerCase(Locale.ROOT) + " if " + guard;
  }
}
