package leakcheck.ir;

import java.util.Objects;

/**
 * A named symbolic value of a fixed sort.
 *
 * <p>Two variables with the same sort but different names are distinct. Name uniqueness inside a
 * program is checked by the program, not here.
 */
public record Variable(String name, Sort sort) implements Comparable<Variable> {

  public Variable {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(sort, "sort");
    if (name.isBlank()) {
      throw new IllegalArgumentException("variable name must not be blank");
    }
  }

  public static Variable bool(String name) {
    return new Variable(name, Sort.bool());
  }

  public static Variable bitVector(String name, int width) {
    return new Variable(name, Sort.bitVector(width));
  }

  public Expression toExpression() {
    return Expression.variable(this);
  }

  @Override
  public int compareTo(Variable other) {
    int byName = name.compareTo(other.name);
    return byName != 0 ? byName : sort.describe().compareTo(other.sort.describe());
  }

  @Override
  public String toString() {
    return name + ":" + sort;
  }
}
