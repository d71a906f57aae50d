package leakcheck.cex;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import leakcheck.graph.Arc;
import leakcheck.graph.Edge;
import leakcheck.ir.Expression;

/** A program transition inside a counterexample, marked with the compositions that took it. */
public final class AnnotatedEdge implements Arc {
  private final Edge edge;
  private final Expression guard;
  private final Set<Composition> executedBy = EnumSet.noneOf(Composition.class);
  private boolean transientEdge;

  public AnnotatedEdge(Edge edge, Optional<Expression> guard) {
    this.edge = Objects.requireNonNull(edge, "edge");
    this.guard = guard.orElse(null);
  }

  @Override
  public Edge edge() {
    return edge;
  }

  public Optional<Expression> guard() {
    return Optional.ofNullable(guard);
  }

  public void markExecuted(Composition composition) {
    executedBy.add(composition);
  }

  public boolean executedBy(Composition composition) {
    return executedBy.contains(composition);
  }

  public boolean executed() {
    return !executedBy.isEmpty();
  }

  public boolean isTransient() {
    return transientEdge;
  }

  public void setTransient(boolean transientEdge) {
    this.transientEdge = transientEdge;
  }

  public AnnotatedEdge copy() {
    AnnotatedEdge copy = new AnnotatedEdge(edge, guard());
    copy.executedBy.addAll(executedBy);
    copy.transientEdge = transientEdge;
    return copy;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(edge.toString());
    if (guard != null) {
      sb.append(" if ").append(guard);
    }
    if (!executedBy.isEmpty()) {
      sb.append(" executed by ").append(executedBy);
    }
    if (transientEdge) {
      sb.append(" (transient)");
    }
    return sb.toString();
  }
}
