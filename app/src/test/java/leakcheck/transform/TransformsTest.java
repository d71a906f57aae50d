package leakcheck.transform;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.Map;
import leakcheck.diagnostics.AnalysisException;
import leakcheck.diagnostics.TransformException;
import leakcheck.ir.Expression;
import leakcheck.ir.Variable;
import leakcheck.program.Block;
import leakcheck.program.BlockGraph;
import leakcheck.program.Operation;
import leakcheck.program.Program;
import org.junit.jupiter.api.Test;

final class TransformsTest {

  @Test
  void constantFoldingDropsInfeasibleEdges() throws AnalysisException {
    Variable r = Variable.bitVector("r", 8);
    BlockGraph graph = new BlockGraph();
    graph.addBlock(
        Block.of(
            0,
            Operation.let(
                r, Expression.add(Expression.bitVector(1, 8), Expression.bitVector(2, 8)))));
    graph.addBlock(Block.of(1));
    graph.addBlock(Block.of(2));
    graph.addBranch(
        0, 1, 2, Expression.equal(Expression.bitVector(1, 8), Expression.bitVector(2, 8)));
    graph.setEntry(0);
    Program program = new Program("fold", graph);

    new ConstantFolding().transform(program);

    assertEquals(
        Expression.bitVector(3, 8),
        program.graph().block(0).operations().get(0).expression(),
        "1 + 2 folds to 3");
    assertFalse(program.graph().containsEdge(0, 1), "Edge guarded by false is removed");
    assertTrue(
        program.graph().edge(0, 2).orElseThrow().guard().isEmpty(),
        "Edge guarded by true becomes unconditional");
    program.validate();
  }

  @Test
  void unreachableBlocksAreRemoved() throws AnalysisException {
    BlockGraph graph = new BlockGraph();
    graph.addBlock(Block.of(0));
    graph.addBlock(Block.of(1));
    graph.addBlock(Block.of(2));
    graph.addBlock(Block.of(3));
    graph.addEdge(0, 1);
    graph.addEdge(2, 3);
    graph.setEntry(0);
    graph.addExit(3);
    Program program = new Program("islands", graph);

    new UnreachableBlockElimination().transform(program);

    assertEquals(2, program.graph().vertexCount(), "Blocks 2 and 3 are gone");
    assertTrue(program.graph().exits().isEmpty(), "Exit mark removed with its block");
    program.validate(true);
  }

  @Test
  void initialValuesBindRegistersAtTheEntry() throws AnalysisException {
    Variable rsp = Variable.bitVector("rsp", 64);
    Variable top = Variable.bitVector("top", 64);
    BlockGraph graph = new BlockGraph();
    graph.addBlock(Block.of(0, Operation.let(top, rsp.toExpression())));
    graph.setEntry(0);
    Program program = new Program("init", graph);

    new InitialValues(Map.of("rsp", BigInteger.valueOf(0x1000))).transform(program);

    Operation first = program.graph().block(0).operations().get(0);
    assertEquals(Operation.Kind.LET, first.kind(), "Binding prepended");
    assertEquals(rsp, first.target().orElseThrow(), "Binds rsp");
    assertEquals(Expression.bitVector(0x1000, 64), first.expression(), "To the given value");
    assertEquals(2, program.graph().block(0).operations().size(), "Original code kept");
  }

  @Test
  void initialValuesRejectUnknownRegisters() throws TransformException {
    BlockGraph graph = new BlockGraph();
    graph.addBlock(Block.of(0));
    graph.setEntry(0);
    Program program = new Program("empty", graph);

    assertThrows(
        TransformException.class,
        () -> new InitialValues(Map.of("ghost", BigInteger.ONE)).transform(program),
        "Unknown register");
    assertTrue(
        program.graph().block(0).operations().isEmpty(), "A rejected binding leaves no trace");

    new InitialValues(Map.of()).transform(program);
    assertTrue(
        program.graph().block(0).operations().isEmpty(), "No values leave the entry block as is");
  }
}
