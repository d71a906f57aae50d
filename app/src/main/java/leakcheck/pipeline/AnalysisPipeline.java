package leakcheck.pipeline;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import leakcheck.config.Environment;
import leakcheck.diagnostics.AnalysisException;
import leakcheck.exec.ExplorationResult;
import leakcheck.exec.LeakPolicies;
import leakcheck.exec.LeakPolicy;
import leakcheck.exec.SymbolicExecutor;
import leakcheck.lift.AssemblyProgram;
import leakcheck.lift.MuasmParser;
import leakcheck.pass.PassPipeline;
import leakcheck.pass.PassPipeline.PassTiming;
import leakcheck.pass.Transform;
import leakcheck.program.Program;
import leakcheck.solver.BoundedSolver;
import leakcheck.solver.Solver;
import leakcheck.solver.Solvers;
import leakcheck.transform.ConstantFolding;
import leakcheck.transform.InitialValues;
import leakcheck.transform.UnreachableBlockElimination;
import leakcheck.util.Timing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an analysis from source to findings: parse, translate, validate, transform, explore.
 *
 * <p>Every stage fails with an {@link AnalysisException}; a failed transform leaves the program as
 * it was before that pass.
 */
public final class AnalysisPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(AnalysisPipeline.class);

  private final Environment environment;
  private final Solver solver;
  private final LeakPolicy leakPolicy;

  public AnalysisPipeline(Environment environment) {
    this(environment, Solvers.create(environment), LeakPolicies.anyDifference());
  }

  public AnalysisPipeline(Environment environment, Solver solver, LeakPolicy leakPolicy) {
    this.environment = Objects.requireNonNull(environment, "environment");
    this.solver = Objects.requireNonNull(solver, "solver");
    this.leakPolicy = Objects.requireNonNull(leakPolicy, "leakPolicy");
  }

  public Environment environment() {
    return environment;
  }

  public AnalysisResult analyze(Path source) throws AnalysisException {
    LOG.info("Parsing {}", source);
    return analyze(MuasmParser.parse(source));
  }

  public AnalysisResult analyze(AssemblyProgram assembly) throws AnalysisException {
    LOG.info(
        "Translating {} ({} instructions)", assembly.name(), assembly.instructions().size());
    return analyze(assembly.tryTranslateInto());
  }

  /** Transforms {@code program} in place and explores it. */
  public AnalysisResult analyze(Program program) throws AnalysisException {
    Timing timing = Timing.start();
    boolean strict = environment.analysis().strict();
    program.validate(strict);

    PassPipeline<Program> passes =
        new PassPipeline<>(transforms(), Program::copy, Program::restore, true);
    List<PassTiming> passTimings = passes.run(program);
    program.validate(strict);
    LOG.info(
        "Transforms done in {} ms; {} blocks, {} edges remain",
        timing.elapsedMillis(),
        program.graph().vertexCount(),
        program.graph().edgeCount());

    BoundedSolver bounded = new BoundedSolver(solver, environment.analysis().solverInFlight());
    ExplorationResult exploration =
        new SymbolicExecutor(program, environment, bounded, leakPolicy).explore();
    LOG.info(
        "Analysis of {} finished in {} ms with {} solver queries: {}",
        program.name(),
        timing.elapsedMillis(),
        bounded.queries(),
        exploration.leakFound() ? exploration.findings().size() + " leak(s)" : "no leak");
    return new AnalysisResult(
        program, passTimings, exploration, bounded.queries(), timing.elapsedMillis());
  }

  private List<Transform<Program>> transforms() {
    return List.of(
        new InitialValues(environment.initialValues()),
        new ConstantFolding(),
        new UnreachableBlockElimination());
  }
}
