package leakcheck.program;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.pass.Validate;

/**
 * Straight-line sequence of operations.
 *
 * @param index key of the block in its graph
 * @param address program location, used to key predictor and branch-target-buffer entries
 * @param operations operations in execution order
 */
public record Block(int index, long address, List<Operation> operations) implements Validate {

  public Block {
    if (index < 0) {
      throw new IllegalArgumentException("block index must be non-negative: " + index);
    }
    operations = List.copyOf(Objects.requireNonNull(operations, "operations"));
  }

  public static Block of(int index, Operation... operations) {
    return new Block(index, index, List.of(operations));
  }

  public Block withOperations(List<Operation> replacement) {
    return new Block(index, address, replacement);
  }

  @Override
  public void validate() throws SortMismatchException {
    for (Operation operation : operations) {
      operation.validate();
    }
  }

  public String label() {
    return "0x" + Long.toHexString(address).toUpperCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("block ").append(index).append(" @ ").append(label());
    for (Operation operation : operations) {
      sb.append("\n  ").append(operation);
    }
    return sb.toString();
  }
}
