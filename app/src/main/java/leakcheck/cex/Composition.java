package leakcheck.cex;

/**
 * One of the two executions compared by a counterexample. Both agree on public inputs; A takes
 * the leaking direction and B the reference direction.
 */
public enum Composition {
  A("#ed403cff"),
  B("#0465b2ff");

  private final String color;

  Composition(String color) {
    this.color = color;
  }

  /** DOT color used to draw this composition's path. */
  public String color() {
    return color;
  }

  public int number() {
    return ordinal() + 1;
  }
}
