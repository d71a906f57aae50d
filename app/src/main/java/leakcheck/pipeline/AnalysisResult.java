package leakcheck.pipeline;

import java.util.List;
import java.util.Objects;
import leakcheck.exec.ExplorationResult;
import leakcheck.exec.Finding;
import leakcheck.pass.PassPipeline.PassTiming;
import leakcheck.program.Program;

/**
 * Everything one analysis run produced.
 *
 * @param program the program as explored, after every transform ran
 * @param solverQueries number of queries sent to the solver
 */
public record AnalysisResult(
    Program program,
    List<PassTiming> passTimings,
    ExplorationResult exploration,
    long solverQueries,
    long elapsedMillis) {

  public AnalysisResult {
    Objects.requireNonNull(program, "program");
    passTimings = List.copyOf(passTimings);
    Objects.requireNonNull(exploration, "exploration");
  }

  public boolean leakFound() {
    return exploration.leakFound();
  }

  public List<Finding> findings() {
    return exploration.findings();
  }
}
