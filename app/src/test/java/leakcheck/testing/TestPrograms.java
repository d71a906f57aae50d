package leakcheck.testing;

import java.util.Map;
import java.util.Set;
import leakcheck.config.AnalysisOptions;
import leakcheck.config.ArchitectureOptions;
import leakcheck.config.CheckMode;
import leakcheck.config.Environment;
import leakcheck.config.ObserveMode;
import leakcheck.config.SecurityPolicy;
import leakcheck.config.SecurityPolicy.Level;
import leakcheck.config.SolverBackend;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.ir.Expression;
import leakcheck.ir.Variable;
import leakcheck.program.Block;
import leakcheck.program.BlockGraph;
import leakcheck.program.Operation;
import leakcheck.program.Program;
import leakcheck.uarch.PredictorStrategy;

/** Small programs and environments shared by the executor, pipeline and CLI tests. */
public final class TestPrograms {

  /** Bounds-checked array read followed by a secret-dependent load: the Spectre v1 gadget. */
  public static final String SPECTRE_V1 =
      String.join(
          "\n",
          "# if (idx < 4) { v = a[idx]; w = b[v * 64]; }",
          "  cond <- idx < 4",
          "  beqz cond, end",
          "  load v, idx",
          "  load w, v * 64 + 4096",
          "end:");

  /** The same gadget with a speculation barrier after the bounds check. */
  public static final String SPECTRE_V1_FENCED =
      String.join(
          "\n",
          "  cond <- idx < 4",
          "  beqz cond, end",
          "  spbarr",
          "  load v, idx",
          "  load w, v * 64 + 4096",
          "end:");

  private TestPrograms() {}

  /**
   * Block 0 branches on the secret Boolean {@code x}; the taken successor loads address 0x40, the
   * other one does nothing.
   */
  public static Program secretBranch() throws SortMismatchException {
    Variable x = Variable.bool("x");
    Variable y = Variable.bitVector("y", 64);
    BlockGraph graph = new BlockGraph();
    graph.addBlock(Block.of(0));
    graph.addBlock(Block.of(1, Operation.load(y, Expression.bitVector(0x40, 64))));
    graph.addBlock(Block.of(2));
    graph.addBranch(0, 1, 2, x.toExpression());
    graph.setEntry(0);
    graph.addExit(1);
    graph.addExit(2);
    return new Program("secret-branch", graph);
  }

  /**
   * Block 0 branches on {@code k + 7 == 100} for the 64-bit secret {@code k}; only {@code k = 93}
   * takes the successor that loads address 0x40.
   */
  public static Program wideSecretBranch() throws SortMismatchException {
    Expression k = Variable.bitVector("k", 64).toExpression();
    Variable y = Variable.bitVector("y", 64);
    BlockGraph graph = new BlockGraph();
    graph.addBlock(Block.of(0));
    graph.addBlock(Block.of(1, Operation.load(y, Expression.bitVector(0x40, 64))));
    graph.addBlock(Block.of(2));
    Expression sum = Expression.add(k, Expression.bitVector(7, 64));
    graph.addBranch(0, 1, 2, Expression.equal(sum, Expression.bitVector(100, 64)));
    graph.setEntry(0);
    graph.addExit(1);
    graph.addExit(2);
    return new Program("wide-secret-branch", graph);
  }

  /**
   * Like {@link #secretBranch()}, but both successors end by loading address 0x80, so a one-line
   * cache ends up the same either way. Only the taken successor loads 0x40 first.
   */
  public static Program secretBranchSameFinalCache() throws SortMismatchException {
    Variable x = Variable.bool("x");
    Variable y = Variable.bitVector("y", 64);
    Variable z = Variable.bitVector("z", 64);
    BlockGraph graph = new BlockGraph();
    graph.addBlock(Block.of(0));
    graph.addBlock(
        Block.of(
            1,
            Operation.load(y, Expression.bitVector(0x40, 64)),
            Operation.load(z, Expression.bitVector(0x80, 64))));
    graph.addBlock(Block.of(2, Operation.load(z, Expression.bitVector(0x80, 64))));
    graph.addBranch(0, 1, 2, x.toExpression());
    graph.setEntry(0);
    graph.addExit(1);
    graph.addExit(2);
    return new Program("secret-branch-same-final-cache", graph);
  }

  /**
   * A single block that overwrites the secret word at 0x100 with zero, reads it back into {@code
   * v} and loads {@code v * 64 + 4096}. Architecturally {@code v} is always zero.
   */
  public static Program overwrittenSecret() throws SortMismatchException {
    Variable v = Variable.bitVector("v", 64);
    Variable w = Variable.bitVector("w", 64);
    Expression secret = Expression.bitVector(0x100, 64);
    Expression line =
        Expression.add(
            Expression.mul(v.toExpression(), Expression.bitVector(64, 64)),
            Expression.bitVector(4096, 64));
    BlockGraph graph = new BlockGraph();
    graph.addBlock(
        Block.of(
            0,
            Operation.store(secret, Expression.bitVector(0, 64)),
            Operation.load(v, secret),
            Operation.load(w, line)));
    graph.setEntry(0);
    graph.addExit(0);
    return new Program("overwritten-secret", graph);
  }

  /** Single-line, single-set cache; {@code x} secret; every branch may be mispredicted. */
  public static Environment environment(CheckMode checkMode) {
    return environment(checkMode, "x");
  }

  /** Like {@link #environment(CheckMode)} with the given registers secret. */
  public static Environment environment(CheckMode checkMode, String... secrets) {
    return new Environment(
        new AnalysisOptions(
            checkMode,
            PredictorStrategy.ALWAYS_MISPREDICT,
            100,
            100,
            0,
            1,
            8,
            false,
            1,
            false,
            true,
            false,
            true,
            ObserveMode.sequential(),
            SolverBackend.Z3),
        new ArchitectureOptions(6, 0, 1, 16, 2, 2, 4, false, false, 64, -1),
        new SecurityPolicy(Level.LOW, Level.HIGH, Set.of(), Set.of(secrets)),
        Map.of());
  }

  /** Default hardware with a single worker and every branch mispredictable. */
  public static Environment defaultEnvironment(CheckMode checkMode) {
    Environment defaults = Environment.defaults();
    AnalysisOptions analysis = defaults.analysis();
    return defaults.withAnalysis(
        new AnalysisOptions(
            checkMode,
            PredictorStrategy.ALWAYS_MISPREDICT,
            analysis.maxPaths(),
            analysis.maxPathLength(),
            0,
            1,
            analysis.divergenceHorizon(),
            false,
            1,
            false,
            analysis.spectrePht(),
            analysis.spectreStl(),
            analysis.startWithEmptyCache(),
            analysis.observe(),
            analysis.solver()));
  }
}
