package leakcheck.config;

import leakcheck.uarch.PredictorStrategy;

/**
 * Budgets and switches of the path exploration.
 *
 * @param spectrePht speculate past mispredicted conditional branches
 * @param spectreStl speculate past stores, letting later loads read the memory they overwrite
 * @param startWithEmptyCache start from an empty cache instead of one primed with foreign lines
 */
public record AnalysisOptions(
    CheckMode checkMode,
    PredictorStrategy predictorStrategy,
    int maxPaths,
    int maxPathLength,
    long timeBudgetMs,
    int parallelism,
    int divergenceHorizon,
    boolean stopAtFirstLeak,
    int solverInFlight,
    boolean strict,
    boolean spectrePht,
    boolean spectreStl,
    boolean startWithEmptyCache,
    ObserveMode observe,
    SolverBackend solver) {

  public static AnalysisOptions defaults() {
    return new AnalysisOptions(
        CheckMode.ALL,
        PredictorStrategy.ALWAYS_MISPREDICT,
        10_000,
        1_000,
        0,
        Runtime.getRuntime().availableProcessors(),
        8,
        false,
        Runtime.getRuntime().availableProcessors(),
        false,
        true,
        false,
        true,
        ObserveMode.sequential(),
        SolverBackend.Z3);
  }

  public static AnalysisOptions normalize(AnalysisOptions options) {
    if (options == null) {
      return defaults();
    }
    AnalysisOptions defaults = defaults();
    CheckMode checkMode = options.checkMode() != null ? options.checkMode() : defaults.checkMode();
    PredictorStrategy strategy =
        options.predictorStrategy() != null
            ? options.predictorStrategy()
            : defaults.predictorStrategy();
    int maxPaths = options.maxPaths() > 0 ? options.maxPaths() : defaults.maxPaths();
    int maxPathLength =
        options.maxPathLength() > 0 ? options.maxPathLength() : defaults.maxPathLength();
    long timeBudgetMs = Math.max(0, options.timeBudgetMs());
    int parallelism = options.parallelism() > 0 ? options.parallelism() : defaults.parallelism();
    int horizon =
        options.divergenceHorizon() > 0
            ? options.divergenceHorizon()
            : defaults.divergenceHorizon();
    int inFlight =
        options.solverInFlight() > 0 ? options.solverInFlight() : defaults.solverInFlight();
    return new AnalysisOptions(
        checkMode,
        strategy,
        maxPaths,
        maxPathLength,
        timeBudgetMs,
        parallelism,
        horizon,
        options.stopAtFirstLeak(),
        inFlight,
        options.strict(),
        options.spectrePht(),
        options.spectreStl(),
        options.startWithEmptyCache(),
        options.observe() != null ? options.observe() : defaults.observe(),
        options.solver() != null ? options.solver() : defaults.solver());
  }

  public AnalysisOptions withSpeculation(boolean pht, boolean stl) {
    return new AnalysisOptions(
        checkMode,
        predictorStrategy,
        maxPaths,
        maxPathLength,
        timeBudgetMs,
        parallelism,
        divergenceHorizon,
        stopAtFirstLeak,
        solverInFlight,
        strict,
        pht,
        stl,
        startWithEmptyCache,
        observe,
        solver);
  }

  public AnalysisOptions withObserve(ObserveMode mode) {
    return new AnalysisOptions(
        checkMode,
        predictorStrategy,
        maxPaths,
        maxPathLength,
        timeBudgetMs,
        parallelism,
        divergenceHorizon,
        stopAtFirstLeak,
        solverInFlight,
        strict,
        spectrePht,
        spectreStl,
        startWithEmptyCache,
        mode,
        solver);
  }

  public AnalysisOptions withStartWithEmptyCache(boolean empty) {
    return new AnalysisOptions(
        checkMode,
        predictorStrategy,
        maxPaths,
        maxPathLength,
        timeBudgetMs,
        parallelism,
        divergenceHorizon,
        stopAtFirstLeak,
        solverInFlight,
        strict,
        spectrePht,
        spectreStl,
        empty,
        observe,
        solver);
  }

  public AnalysisOptions withSolver(SolverBackend backend) {
    return new AnalysisOptions(
        checkMode,
        predictorStrategy,
        maxPaths,
        maxPathLength,
        timeBudgetMs,
        parallelism,
        divergenceHorizon,
        stopAtFirstLeak,
        solverInFlight,
        strict,
        spectrePht,
        spectreStl,
        startWithEmptyCache,
        observe,
        backend);
  }
}
