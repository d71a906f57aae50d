package leakcheck.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import leakcheck.config.AnalysisOptions;
import leakcheck.config.CheckMode;
import leakcheck.config.Environment;
import leakcheck.config.SolverBackend;
import leakcheck.diagnostics.AnalysisException;
import leakcheck.diagnostics.GraphInvariantException;
import leakcheck.diagnostics.TransformException;
import leakcheck.lift.MuasmParser;
import leakcheck.pass.PassPipeline.PassTiming;
import leakcheck.solver.z3.Z3Solver;
import leakcheck.testing.TestPrograms;
import org.junit.jupiter.api.Test;

final class AnalysisPipelineTest {

  @Test
  void runsTransformsThenExplores() throws AnalysisException {
    AnalysisPipeline pipeline = new AnalysisPipeline(TestPrograms.environment(CheckMode.ALL));
    AnalysisResult result = pipeline.analyze(TestPrograms.secretBranch());

    assertEquals(
        List.of("initial-values", "constant-folding", "unreachable-block-elimination"),
        result.passTimings().stream().map(PassTiming::pass).toList(),
        "Transforms run in a fixed order");
    assertTrue(result.leakFound(), "Secret branch leaks");
    assertEquals(result.exploration().findings(), result.findings(), "Findings passed through");
    assertTrue(result.solverQueries() > 0, "Queries are counted");
    assertEquals("secret-branch", result.program().name(), "Program kept");
  }

  @Test
  void spectreGadgetFromSource() throws AnalysisException {
    assumeTrue(Z3Solver.isAvailable(), "Z3 native library loads");
    AnalysisPipeline pipeline =
        new AnalysisPipeline(TestPrograms.defaultEnvironment(CheckMode.ALL));
    AnalysisResult result = pipeline.analyze(MuasmParser.parse("v1", TestPrograms.SPECTRE_V1));
    assertTrue(result.leakFound(), "Transient leak found");
    assertTrue(result.exploration().complete(), "Small program explored completely");
  }

  @Test
  void enumeratingSolverLeavesWideQueriesUndecided() throws AnalysisException {
    Environment base = TestPrograms.defaultEnvironment(CheckMode.ALL);
    Environment enumerating =
        base.withAnalysis(base.analysis().withSolver(SolverBackend.ENUMERATING));
    AnalysisResult result =
        new AnalysisPipeline(enumerating).analyze(MuasmParser.parse("v1", TestPrograms.SPECTRE_V1));

    assertTrue(result.leakFound(), "Transient leak still found");
    assertFalse(result.exploration().complete(), "64-bit index cannot be enumerated");
    assertTrue(
        result.exploration().terminationReason().orElseThrow().contains("undecided"),
        "Reason names the undecided queries");
    assertTrue(result.exploration().stats().undecidedQueries() > 0, "Undecided queries counted");
  }

  @Test
  void pinnedIndexRemovesTheLeak() throws AnalysisException {
    Environment base = TestPrograms.defaultEnvironment(CheckMode.ALL);
    Environment pinned =
        new Environment(
            base.analysis(),
            base.architecture(),
            base.policy(),
            Map.of("idx", BigInteger.TWO));
    AnalysisResult result =
        new AnalysisPipeline(pinned).analyze(MuasmParser.parse("v1", TestPrograms.SPECTRE_V1));
    assertFalse(result.leakFound(), "An in-bounds index cannot reach the secret");
  }

  @Test
  void unknownInitialRegisterFailsTheTransform() {
    Environment base = TestPrograms.defaultEnvironment(CheckMode.ALL);
    Environment broken =
        new Environment(
            base.analysis(), base.architecture(), base.policy(), Map.of("ghost", BigInteger.ONE));
    assertThrows(
        TransformException.class,
        () -> new AnalysisPipeline(broken).analyze(MuasmParser.parse("v1", "skip")),
        "ghost does not occur in the program");
  }

  @Test
  void strictModeRejectsUnreachableCode() {
    Environment base = TestPrograms.defaultEnvironment(CheckMode.ALL);
    AnalysisOptions a = base.analysis();
    Environment strict =
        base.withAnalysis(
            new AnalysisOptions(
                a.checkMode(),
                a.predictorStrategy(),
                a.maxPaths(),
                a.maxPathLength(),
                a.timeBudgetMs(),
                a.parallelism(),
                a.divergenceHorizon(),
                a.stopAtFirstLeak(),
                a.solverInFlight(),
                true,
                a.spectrePht(),
                a.spectreStl(),
                a.startWithEmptyCache(),
                a.observe(),
                a.solver()));
    assertThrows(
        GraphInvariantException.class,
        () -> new AnalysisPipeline(strict).analyze(MuasmParser.parse("spin", "top: jmp top")),
        "The exit block after an endless loop is unreachable");
  }
}
