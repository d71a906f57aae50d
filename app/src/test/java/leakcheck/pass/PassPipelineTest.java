package leakcheck.pass;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import leakcheck.diagnostics.AnalysisException;
import leakcheck.diagnostics.ErrorKind;
import leakcheck.diagnostics.TransformException;
import leakcheck.pass.PassPipeline.PassTiming;
import leakcheck.program.Block;
import leakcheck.program.BlockGraph;
import leakcheck.program.Program;
import org.junit.jupiter.api.Test;

final class PassPipelineTest {

  @Test
  void passesRunInOrderWithTimings() throws AnalysisException {
    List<String> order = new ArrayList<>();
    PassPipeline<List<String>> pipeline =
        new PassPipeline<>(
            List.of(recording("first", order), recording("second", order)),
            ArrayList::new,
            null,
            false);

    List<PassTiming> timings = pipeline.run(new ArrayList<>());
    assertEquals(List.of("first", "second"), order, "Declaration order");
    assertEquals(
        List.of("first", "second"),
        timings.stream().map(PassTiming::pass).toList(),
        "One timing per pass");
    assertTrue(timings.stream().allMatch(t -> t.millis() >= 0), "Non-negative durations");
  }

  @Test
  void failingPassRestoresTheSnapshot() {
    Program program = twoBlocks();
    Transform<Program> breaking =
        new Transform<>() {
          @Override
          public String name() {
            return "break-entry";
          }

          @Override
          public String description() {
            return "removes the entry block";
          }

          @Override
          public void transform(Program target) {
            target.graph().removeBlock(0);
          }
        };
    PassPipeline<Program> pipeline =
        new PassPipeline<>(List.of(breaking), Program::copy, Program::restore, true);

    TransformException ex =
        assertThrows(TransformException.class, () -> pipeline.run(program), "Invalid result");
    assertEquals(ErrorKind.TRANSFORM, ex.kind(), "Wrapped as a transform failure");
    assertTrue(ex.getMessage().startsWith("break-entry: "), "Message names the pass");
    assertTrue(program.graph().containsVertex(0), "Entry block restored");
    assertTrue(program.graph().containsEdge(0, 1), "Edge restored");
  }

  @Test
  void failureWithoutRestorerLeavesTheTarget() {
    List<String> target = new ArrayList<>();
    Transform<List<String>> throwing =
        new Transform<>() {
          @Override
          public String name() {
            return "half-done";
          }

          @Override
          public String description() {
            return "adds an entry, then fails";
          }

          @Override
          public void transform(List<String> list) throws TransformException {
            list.add("partial");
            throw new TransformException(name(), "gave up");
          }
        };
    PassPipeline<List<String>> pipeline =
        new PassPipeline<>(List.of(throwing), ArrayList::new, null, false);

    assertThrows(TransformException.class, () -> pipeline.run(target), "Failure propagates");
    assertEquals(List.of("partial"), target, "No restorer, no rollback");
  }

  private static Transform<List<String>> recording(String name, List<String> order) {
    return new Transform<>() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public String description() {
        return "records its name";
      }

      @Override
      public void transform(List<String> target) {
        order.add(name);
      }
    };
  }

  private static Program twoBlocks() {
    BlockGraph graph = new BlockGraph();
    graph.addBlock(Block.of(0));
    graph.addBlock(Block.of(1));
    graph.addEdge(0, 1);
    graph.setEntry(0);
    return new Program("two-blocks", graph);
  }
}
