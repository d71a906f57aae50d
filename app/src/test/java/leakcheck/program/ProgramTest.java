package leakcheck.program;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import leakcheck.diagnostics.AnalysisException;
import leakcheck.diagnostics.ErrorKind;
import leakcheck.diagnostics.GraphInvariantException;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.ir.Expression;
import leakcheck.ir.Operator.Opcode;
import leakcheck.ir.Variable;
import org.junit.jupiter.api.Test;

final class ProgramTest {

  @Test
  void danglingEdgeIsAGraphInvariantViolation() {
    BlockGraph graph = new BlockGraph();
    graph.addBlock(Block.of(0));
    graph.addEdge(0, 5);
    graph.setEntry(0);
    Program program = new Program("dangling", graph);

    GraphInvariantException ex =
        assertThrows(GraphInvariantException.class, program::validate, "Edge to missing block");
    assertEquals(ErrorKind.GRAPH_INVARIANT, ex.kind(), "Reported as a graph invariant");
    assertTrue(ex.getMessage().contains("5"), "Message names the missing block");
    assertTrue(
        ex.diagnostic().startsWith("error[graph-invariant]: "), "Diagnostic carries the label");
  }

  @Test
  void validationLeavesTheProgramUntouched() throws AnalysisException {
    BlockGraph graph = new BlockGraph();
    Variable flag = Variable.bool("flag");
    graph.addBlock(Block.of(0, Operation.assume(flag.toExpression())));
    graph.addBlock(Block.of(1));
    graph.addBlock(Block.of(2));
    graph.addBranch(0, 1, 2, flag.toExpression());
    graph.setEntry(0);
    graph.addExit(1);
    graph.addExit(2);
    Program program = new Program("stable", graph);
    Program before = program.copy();

    program.validate(true);
    program.validate(true);

    assertEquals(before.graph().vertices(), program.graph().vertices(), "Same blocks");
    assertEquals(before.graph().edges(), program.graph().edges(), "Same transitions");
    assertEquals(before.graph().entry(), program.graph().entry(), "Same entry");
  }

  @Test
  void missingEntryIsRejected() {
    BlockGraph graph = new BlockGraph();
    graph.addBlock(Block.of(0));
    assertThrows(GraphInvariantException.class, graph::validate, "No entry block set");
  }

  @Test
  void strictModeRejectsUnreachableBlocks() throws AnalysisException {
    BlockGraph graph = new BlockGraph();
    graph.addBlock(Block.of(0));
    graph.addBlock(Block.of(1));
    graph.setEntry(0);
    Program program = new Program("island", graph);

    program.validate(false);
    assertThrows(
        GraphInvariantException.class, () -> program.validate(true), "Block 1 is unreachable");
  }

  @Test
  void illSortedOperationIsRejected() throws SortMismatchException {
    Expression word = Variable.bitVector("word", 64).toExpression();
    BlockGraph graph = new BlockGraph();
    graph.addBlock(Block.of(0, Operation.assume(Expression.apply(Opcode.AND, word, word))));
    graph.setEntry(0);
    Program program = new Program("ill-sorted", graph);

    SortMismatchException ex =
        assertThrows(SortMismatchException.class, program::validate, "`and` on bit-vectors");
    assertTrue(ex.getMessage().startsWith("block 0: "), "Message names the block");
  }

  @Test
  void variableUsedWithTwoSortsIsRejected() throws SortMismatchException {
    BlockGraph graph = new BlockGraph();
    graph.addBlock(
        Block.of(
            0,
            Operation.let(Variable.bitVector("r", 8), Expression.bitVector(1, 8)),
            Operation.let(
                Variable.bitVector("s", 16), Variable.bitVector("r", 16).toExpression())));
    graph.setEntry(0);
    Program program = new Program("two-sorts", graph);

    SortMismatchException ex =
        assertThrows(SortMismatchException.class, program::validate, "r is 8 and 16 bits wide");
    assertTrue(ex.getMessage().contains("`r`"), "Message names the variable");
  }

  @Test
  void nonBooleanConditionCannotGuardABranch() {
    BlockGraph graph = new BlockGraph();
    graph.addBlock(Block.of(0));
    graph.addBlock(Block.of(1));
    graph.addBlock(Block.of(2));
    Expression word = Variable.bitVector("word", 64).toExpression();
    assertThrows(
        SortMismatchException.class,
        () -> graph.addBranch(0, 1, 2, word),
        "Branch conditions are Boolean");
    assertEquals(0, graph.edgeCount(), "Nothing was added");
  }

  @Test
  void branchAddsComplementaryGuards() throws SortMismatchException {
    BlockGraph graph = new BlockGraph();
    graph.addBlock(Block.of(0));
    graph.addBlock(Block.of(1));
    graph.addBlock(Block.of(2));
    Expression flag = Variable.bool("flag").toExpression();
    graph.addBranch(0, 1, 2, flag);

    Transition taken = graph.edge(0, 1).orElseThrow();
    Transition fallThrough = graph.edge(0, 2).orElseThrow();
    assertEquals(BranchKind.TAKEN, taken.kind(), "First target is the taken edge");
    assertEquals(flag, taken.guard().orElseThrow(), "Taken edge is guarded by the condition");
    assertEquals(
        Expression.not(flag), fallThrough.guard().orElseThrow(), "Fall-through is negated");
    assertTrue(taken.isConditional(), "Branch edges are conditional");
  }

  @Test
  void copyIsIndependentAndRestoreRollsBack() {
    BlockGraph graph = new BlockGraph();
    graph.addBlock(Block.of(0));
    graph.addBlock(Block.of(1));
    graph.addEdge(0, 1);
    graph.setEntry(0);
    Program program = new Program("copy", graph);

    Program snapshot = program.copy();
    program.graph().removeBlock(1);
    assertFalse(program.graph().containsVertex(1), "Block removed from the original");
    assertTrue(snapshot.graph().containsVertex(1), "Snapshot keeps the block");

    program.restore(snapshot);
    assertTrue(program.graph().containsEdge(0, 1), "Restore brings the edge back");
  }
}
