package leakcheck.ir;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.StringJoiner;
import java.util.TreeMap;

/** Immutable mapping from variables to concrete values, as produced by a solver model. */
public final class Assignment {
  private static final Assignment EMPTY = new Assignment(new TreeMap<>());

  private final SortedMap<Variable, Constant> values;

  private Assignment(SortedMap<Variable, Constant> values) {
    this.values = Collections.unmodifiableSortedMap(values);
  }

  public static Assignment empty() {
    return EMPTY;
  }

  public static Assignment of(Map<Variable, Constant> values) {
    Objects.requireNonNull(values, "values");
    SortedMap<Variable, Constant> copy = new TreeMap<>();
    for (Map.Entry<Variable, Constant> entry : values.entrySet()) {
      checkSort(entry.getKey(), entry.getValue());
      copy.put(entry.getKey(), entry.getValue());
    }
    return new Assignment(copy);
  }

  private static void checkSort(Variable variable, Constant value) {
    if (!variable.sort().equals(value.sort())) {
      throw new IllegalArgumentException(
          "cannot assign " + value + " to " + variable + " of sort " + variable.sort().describe());
    }
  }

  public Optional<Constant> get(Variable variable) {
    return Optional.ofNullable(values.get(variable));
  }

  public boolean contains(Variable variable) {
    return values.containsKey(variable);
  }

  public Assignment with(Variable variable, Constant value) {
    checkSort(variable, value);
    SortedMap<Variable, Constant> copy = new TreeMap<>(values);
    copy.put(variable, value);
    return new Assignment(copy);
  }

  public SortedMap<Variable, Constant> values() {
    return values;
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Assignment other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    StringJoiner joiner = new StringJoiner(", ", "{", "}");
    values.forEach((variable, value) -> joiner.add(variable.name() + " = " + value));
    return joiner.toString();
  }
}
