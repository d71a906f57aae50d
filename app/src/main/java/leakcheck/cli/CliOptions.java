package leakcheck.cli;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;
import leakcheck.config.AnalysisOptions;
import leakcheck.config.CheckMode;
import leakcheck.config.Environment;
import leakcheck.config.SolverBackend;
import leakcheck.uarch.PredictorStrategy;

/** Parsed arguments of the {@code analyze} command. Null means "keep the environment's value". */
record CliOptions(
    Path file,
    Path environmentFile,
    Path counterExampleFile,
    Path dotFile,
    Path jsonFile,
    Path smtFile,
    CheckMode checkMode,
    PredictorStrategy predictor,
    Integer speculationWindow,
    Integer parallelism,
    Integer maxPaths,
    Long timeBudgetMs,
    Set<String> secrets,
    String leakPolicy,
    SolverBackend solver,
    boolean spectreStl,
    boolean stopAtFirstLeak,
    boolean strict) {

  CliOptions {
    Objects.requireNonNull(file, "file");
    secrets = secrets == null ? Set.of() : Set.copyOf(secrets);
    leakPolicy = leakPolicy == null ? "any" : leakPolicy;
  }

  /** Applies the command-line overrides on top of {@code base}. */
  Environment applyTo(Environment base) {
    AnalysisOptions analysis = base.analysis();
    AnalysisOptions overridden =
        new AnalysisOptions(
            checkMode != null ? checkMode : analysis.checkMode(),
            predictor != null ? predictor : analysis.predictorStrategy(),
            maxPaths != null ? maxPaths : analysis.maxPaths(),
            analysis.maxPathLength(),
            timeBudgetMs != null ? timeBudgetMs : analysis.timeBudgetMs(),
            parallelism != null ? parallelism : analysis.parallelism(),
            analysis.divergenceHorizon(),
            stopAtFirstLeak || analysis.stopAtFirstLeak(),
            analysis.solverInFlight(),
            strict || analysis.strict(),
            analysis.spectrePht(),
            spectreStl || analysis.spectreStl(),
            analysis.startWithEmptyCache(),
            analysis.observe(),
            solver != null ? solver : analysis.solver());
    Environment result = base.withAnalysis(overridden);
    if (speculationWindow != null) {
      result =
          result.withArchitecture(result.architecture().withSpeculationWindow(speculationWindow));
    }
    if (!secrets.isEmpty()) {
      result = result.withPolicy(result.policy().withSecrets(secrets));
    }
    return result;
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private Path file;
    private Path environmentFile;
    private Path counterExampleFile;
    private Path dotFile;
    private Path jsonFile;
    private Path smtFile;
    private CheckMode checkMode;
    private PredictorStrategy predictor;
    private Integer speculationWindow;
    private Integer parallelism;
    private Integer maxPaths;
    private Long timeBudgetMs;
    private Set<String> secrets = Set.of();
    private String leakPolicy;
    private SolverBackend solver;
    private boolean spectreStl;
    private boolean stopAtFirstLeak;
    private boolean strict;

    Builder file(Path file) {
      this.file = file;
      return this;
    }

    Builder environmentFile(Path environmentFile) {
      this.environmentFile = environmentFile;
      return this;
    }

    Builder counterExampleFile(Path counterExampleFile) {
      this.counterExampleFile = counterExampleFile;
      return this;
    }

    Builder dotFile(Path dotFile) {
      this.dotFile = dotFile;
      return this;
    }

    Builder jsonFile(Path jsonFile) {
      this.jsonFile = jsonFile;
      return this;
    }

    Builder smtFile(Path smtFile) {
      this.smtFile = smtFile;
      return this;
    }

    Builder checkMode(CheckMode checkMode) {
      this.checkMode = checkMode;
      return this;
    }

    Builder predictor(PredictorStrategy predictor) {
      this.predictor = predictor;
      return this;
    }

    Builder speculationWindow(int speculationWindow) {
      if (speculationWindow < 0) {
        throw new IllegalArgumentException("--window must not be negative");
      }
      this.speculationWindow = speculationWindow;
      return this;
    }

    Builder parallelism(int parallelism) {
      this.parallelism = parallelism;
      return this;
    }

    Builder maxPaths(int maxPaths) {
      this.maxPaths = maxPaths;
      return this;
    }

    Builder timeBudgetMs(long timeBudgetMs) {
      this.timeBudgetMs = timeBudgetMs;
      return this;
    }

    Builder secrets(Set<String> secrets) {
      if (secrets != null) {
        this.secrets = Set.copyOf(secrets);
      }
      return this;
    }

    Builder leakPolicy(String leakPolicy) {
      this.leakPolicy = leakPolicy;
      return this;
    }

    Builder solver(SolverBackend solver) {
      this.solver = solver;
      return this;
    }

    Builder spectreStl(boolean spectreStl) {
      this.spectreStl = spectreStl;
      return this;
    }

    Builder stopAtFirstLeak(boolean stopAtFirstLeak) {
      this.stopAtFirstLeak = stopAtFirstLeak;
      return this;
    }

    Builder strict(boolean strict) {
      this.strict = strict;
      return this;
    }

    CliOptions build() {
      if (file == null) {
        throw new IllegalArgumentException("Missing required option --file");
      }
      return new CliOptions(
          file,
          environmentFile,
          counterExampleFile,
          dotFile,
          jsonFile,
          smtFile,
          checkMode,
          predictor,
          speculationWindow,
          parallelism,
          maxPaths,
          timeBudgetMs,
          secrets,
          leakPolicy,
          solver,
          spectreStl,
          stopAtFirstLeak,
          strict);
    }
  }
}
