package leakcheck.diagnostics;

import java.util.Locale;

/** Enumerates the categories of failures an analysis stage can report. */
public enum ErrorKind {
  /** An expression's sort conflicts with an operator signature or a guard is not Boolean. */
  SORT_MISMATCH,
  /** Dangling edge, missing entry or exit, or an unreachable block in strict mode. */
  GRAPH_INVARIANT,
  /** A source construct has no mapping in the target representation. */
  TRANSLATION,
  /** A transform's precondition was violated. */
  TRANSFORM,
  /** Reserved. The bundled models treat every key as cold instead of rejecting it. */
  MODEL_CAPACITY,
  /** Report or dump writes. */
  IO;

  public String label() {
    return name().toLowerCase(Locale.ROOT).replace('_', '-');
  }
}
