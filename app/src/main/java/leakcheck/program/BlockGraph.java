package leakcheck.program;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import leakcheck.diagnostics.GraphInvariantException;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.graph.DirectedGraph;
import leakcheck.ir.Expression;
import leakcheck.pass.Validate;

/** Control-flow graph of blocks with a designated entry and a set of exits. */
public final class BlockGraph extends DirectedGraph<Block, Transition> implements Validate {
  private Integer entry;
  private final SortedSet<Integer> exits = new TreeSet<>();

  public void addBlock(Block block) {
    addVertex(block.index(), block);
  }

  public void replaceBlock(Block block) {
    replaceVertex(block.index(), block);
  }

  /** Removes a block, its incident transitions and its exit mark. */
  public void removeBlock(int index) {
    removeVertex(index);
    exits.remove(index);
  }

  public Block block(int index) {
    return vertex(index)
        .orElseThrow(() -> new IllegalArgumentException("no block with index " + index));
  }

  public void addEdge(int head, int tail) {
    addEdge(Transition.unconditional(head, tail));
  }

  public void addConditionalEdge(int head, int tail, Expression guard)
      throws SortMismatchException {
    guard.sort().expectBool();
    addEdge(Transition.guarded(head, tail, BranchKind.CONDITIONAL, guard));
  }

  /**
   * Adds a two-way branch: the taken edge guarded by {@code condition} and the fall-through edge
   * guarded by its negation. Both targets being the same block yields one unconditional edge.
   */
  public void addBranch(int head, int taken, int fallThrough, Expression condition)
      throws SortMismatchException {
    condition.sort().expectBool();
    if (taken == fallThrough) {
      addEdge(head, taken);
      return;
    }
    addEdge(Transition.guarded(head, taken, BranchKind.TAKEN, condition));
    addEdge(
        Transition.guarded(
            head, fallThrough, BranchKind.FALL_THROUGH, Expression.not(condition)));
  }

  public void setEntry(int index) {
    entry = index;
  }

  public boolean hasEntry() {
    return entry != null;
  }

  public int entry() {
    if (entry == null) {
      throw new IllegalStateException("block graph has no entry");
    }
    return entry;
  }

  public void addExit(int index) {
    exits.add(index);
  }

  public Set<Integer> exits() {
    return Collections.unmodifiableSortedSet(exits);
  }

  public boolean isExit(int index) {
    return exits.contains(index);
  }

  @Override
  public void validate() throws GraphInvariantException {
    validate(false);
  }

  /**
   * Checks structural invariants; strict mode also rejects blocks that cannot be reached from the
   * entry.
   */
  public void validate(boolean strict) throws GraphInvariantException {
    if (entry == null) {
      throw new GraphInvariantException("block graph has no entry");
    }
    if (!containsVertex(entry)) {
      throw new GraphInvariantException("entry " + entry + " is not a block");
    }
    for (Transition transition : edges()) {
      if (!containsVertex(transition.head())) {
        throw new GraphInvariantException(
            "edge " + transition.edge() + " starts at missing block " + transition.head());
      }
      if (!containsVertex(transition.tail())) {
        throw new GraphInvariantException(
            "edge " + transition.edge() + " ends at missing block " + transition.tail());
      }
    }
    for (int exit : exits) {
      if (!containsVertex(exit)) {
        throw new GraphInvariantException("exit " + exit + " is not a block");
      }
    }
    if (strict) {
      Set<Integer> reachable = reachableFrom(entry);
      for (int index : vertices().keySet()) {
        if (!reachable.contains(index)) {
          throw new GraphInvariantException(
              "block " + index + " is unreachable from entry " + entry);
        }
      }
    }
  }

  /** Blocks and transitions are immutable, so the copy shares them. */
  public BlockGraph copy() {
    BlockGraph copy = copyInto(new BlockGraph(), block -> block, transition -> transition);
    copy.entry = entry;
    copy.exits.addAll(exits);
    return copy;
  }

  @Override
  public String toString() {
    return "entry: " + entry + ", exits: " + exits + "\n" + super.toString();
  }
}
