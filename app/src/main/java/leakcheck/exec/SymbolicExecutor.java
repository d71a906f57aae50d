package leakcheck.exec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveAction;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import leakcheck.cex.Composition;
import leakcheck.cex.CompositionTrace;
import leakcheck.cex.CounterExample;
import leakcheck.cex.CounterExampleBuilder;
import leakcheck.cex.Effect;
import leakcheck.cex.Observation;
import leakcheck.cex.TraceStep;
import leakcheck.config.AnalysisOptions;
import leakcheck.config.ArchitectureOptions;
import leakcheck.config.Environment;
import leakcheck.config.ObserveMode;
import leakcheck.config.SecurityPolicy;
import leakcheck.diagnostics.AnalysisException;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.ir.Assignment;
import leakcheck.ir.Constant;
import leakcheck.ir.Expression;
import leakcheck.ir.ExpressionEvaluator;
import leakcheck.ir.ExpressionSimplifier;
import leakcheck.ir.Variable;
import leakcheck.program.Block;
import leakcheck.program.BlockGraph;
import leakcheck.program.BranchKind;
import leakcheck.program.Program;
import leakcheck.program.Transition;
import leakcheck.solver.Solver;
import leakcheck.solver.SolverResult;
import leakcheck.uarch.MicroarchitecturalState;
import leakcheck.util.Timing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Explores the paths of a program symbolically and checks every conditional branch for leaks.
 *
 * <p>Paths run as fork/join tasks; a conditional branch forks one task per feasible successor. At
 * each branch two self-composed checks run. The normal check asks for two inputs that agree on
 * public values but take different successors; the transient check asks for two such inputs that
 * take the same successor while the other one is speculated. With store bypass enabled, every
 * block with stores is also checked with each of its stores skipped under speculation. Both
 * compositions are then run concretely and their observable hardware states are compared.
 *
 * <p>A query the solver cannot decide is skipped and recorded; the result is then incomplete.
 *
 * <p>An executor explores once; create a new instance per run.
 */
public final class SymbolicExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(SymbolicExecutor.class);

  /** Suffix of the second composition's copy of a high input. */
  static final String SECOND_COPY = "#B";

  private final Program program;
  private final BlockGraph graph;
  private final AnalysisOptions analysis;
  private final ArchitectureOptions architecture;
  private final SecurityPolicy policy;
  private final Solver solver;
  private final LeakPolicy leakPolicy;
  private final CounterExampleBuilder counterExamples;

  private final ExplorationStats stats = new ExplorationStats();
  private final BlockInterpreter interpreter = new BlockInterpreter(stats);
  private final ConcurrentLinkedQueue<Finding> findings = new ConcurrentLinkedQueue<>();
  private final AtomicInteger pathsStarted = new AtomicInteger();
  private final AtomicReference<String> stopReason = new AtomicReference<>();
  private final AtomicReference<String> truncation = new AtomicReference<>();
  private final AtomicReference<AnalysisException> failure = new AtomicReference<>();
  private Timing timing = Timing.start();

  public SymbolicExecutor(
      Program program, Environment environment, Solver solver, LeakPolicy leakPolicy) {
    this.program = Objects.requireNonNull(program, "program");
    this.graph = program.graph();
    this.analysis = environment.analysis();
    this.architecture = environment.architecture();
    this.policy = environment.policy();
    this.solver = Objects.requireNonNull(solver, "solver");
    this.leakPolicy = Objects.requireNonNull(leakPolicy, "leakPolicy");
    this.counterExamples = new CounterExampleBuilder(program);
  }

  /**
   * Explores the program from its entry block.
   *
   * @throws AnalysisException if the program is invalid or a query is ill-sorted
   */
  public ExplorationResult explore() throws AnalysisException {
    program.validate(analysis.strict());
    LOG.info(
        "Exploring {} ({} blocks) with {} worker(s), checks {}, window {}, solver {}",
        program.name(),
        graph.vertexCount(),
        analysis.parallelism(),
        analysis.checkMode(),
        architecture.speculationWindow(),
        solver.name());
    timing = Timing.start();
    pathsStarted.set(1);
    MicroarchitecturalState hardware = architecture.initialState(analysis.predictorStrategy());
    if (!analysis.startWithEmptyCache()) {
      hardware.cache().prime(architecture.addressWidth());
    }
    PathState initial = new PathState(hardware);
    ForkJoinPool pool = new ForkJoinPool(analysis.parallelism());
    try {
      pool.invoke(new PathTask(initial, graph.entry()));
    } finally {
      pool.shutdown();
    }
    if (failure.get() != null) {
      throw failure.get();
    }

    List<Finding> sorted = new ArrayList<>(findings);
    sorted.sort(Finding.ORDER);
    ExplorationStats.Snapshot snapshot = stats.snapshot();
    Optional<String> reason =
        Optional.ofNullable(stopReason.get())
            .or(() -> Optional.ofNullable(truncation.get()))
            .or(() -> undecided(snapshot.undecidedQueries()));
    reason.ifPresent(r -> LOG.warn("Exploration stopped early: {}", r));
    LOG.info(
        "Explored {} path(s) ({} abandoned), {} branch(es), {} finding(s) in {} ms",
        snapshot.pathsCompleted(),
        snapshot.pathsAbandoned(),
        snapshot.branches(),
        sorted.size(),
        timing.elapsedMillis());
    return new ExplorationResult(sorted, snapshot, reason, timing.elapsedMillis());
  }

  public ExplorationStats stats() {
    return stats;
  }

  private static Optional<String> undecided(long queries) {
    if (queries == 0) {
      return Optional.empty();
    }
    String noun = queries == 1 ? "query" : "queries";
    return Optional.of("solver left " + queries + " " + noun + " undecided");
  }

  private final class PathTask extends RecursiveAction {
    private static final long serialVersionUID = 1L;

    private final transient PathState state;
    private final int start;

    PathTask(PathState state, int start) {
      this.state = state;
      this.start = start;
    }

    @Override
    protected void compute() {
      try {
        walk();
      } catch (AnalysisException ex) {
        failure.compareAndSet(null, ex);
        stop("analysis failed: " + ex.getMessage());
      }
    }

    private void walk() throws AnalysisException {
      int index = start;
      while (true) {
        if (stopped()) {
          stats.pathAbandoned();
          return;
        }
        if (state.length() >= analysis.maxPathLength()) {
          LOG.debug("Path reached the length bound at block {}", index);
          truncate("path length bound of " + analysis.maxPathLength() + " reached");
          stats.pathAbandoned();
          return;
        }
        Block block = graph.block(index);
        if (checksStoreBypass()) {
          checkStoreBypasses(block, state);
        }
        List<Effect> effects = new ArrayList<>();
        BlockInterpreter.Outcome outcome =
            interpreter.execute(block, state, false, explorationConcretizer(), effects);
        if (outcome == BlockInterpreter.Outcome.STOPPED) {
          LOG.debug("Path infeasible in block {}", index);
          stats.pathAbandoned();
          return;
        }

        List<Successor> successors = successors(block, state);
        if (successors.isEmpty()) {
          state.addStep(new TraceStep(index, false, effects));
          stats.pathCompleted();
          return;
        }
        if (successors.size() == 1 && !successors.get(0).conditional()) {
          state.addStep(new TraceStep(index, false, effects));
          index = successors.get(0).tail();
          continue;
        }
        branch(block, effects, successors);
        return;
      }
    }

    private void branch(Block block, List<Effect> effects, List<Successor> successors)
        throws AnalysisException {
      stats.branch();
      Map<Successor, Assignment> feasible = new HashMap<>();
      for (Successor successor : successors) {
        SolverResult result = decide(with(state.pathCondition(), successor.guard()));
        if (result.isSat()) {
          feasible.put(successor, result.model().orElseThrow());
        }
      }
      checkDivergences(block, state, effects, successors, feasible);

      List<PathTask> children = new ArrayList<>();
      for (Successor successor : successors) {
        Assignment model = feasible.get(successor);
        if (model == null) {
          continue;
        }
        if (!children.isEmpty() && !reservePath()) {
          stats.pathAbandoned();
          continue;
        }
        PathState child = state.copy();
        child.addCondition(successor.guard());
        speculate(block, child, successor, successors, model);
        List<Effect> branchEffects = new ArrayList<>(effects);
        resolveBranch(block, child, successor, branchEffects);
        child.addStep(new TraceStep(block.index(), false, branchEffects));
        children.add(new PathTask(child, successor.tail()));
      }
      if (children.isEmpty()) {
        stats.pathAbandoned();
        return;
      }
      invokeAll(children);
    }
  }

  /** Runs every mispredictable wrong successor transiently and keeps what it left in the cache. */
  private void speculate(
      Block block,
      PathState path,
      Successor actual,
      List<Successor> successors,
      Assignment model)
      throws SortMismatchException {
    if (!checksBranchSpeculation()) {
      return;
    }
    if (!path.hardware().predictor().mayMispredict(block.address(), actual.taken())) {
      return;
    }
    for (Successor wrong : successors) {
      if (wrong.equals(actual)) {
        continue;
      }
      stats.speculativeRun();
      PathState transientPath = path.copy();
      CompositionModel inputs = new CompositionModel(model, policy, false);
      run(transientPath, wrong.tail(), architecture.speculationWindow(), true, inputs, -1);
      MicroarchitecturalState hardware = path.hardware();
      path.setHardware(
          new MicroarchitecturalState(
              transientPath.hardware().cache(), hardware.predictor(), hardware.memory()));
    }
  }

  private void checkDivergences(
      Block block,
      PathState state,
      List<Effect> effects,
      List<Successor> successors,
      Map<Successor, Assignment> feasible)
      throws AnalysisException {
    for (Successor leaking : successors) {
      for (Successor reference : successors) {
        if (leaking.equals(reference) || stopped()) {
          continue;
        }
        if (analysis.checkMode().checksNormal()
            && feasible.containsKey(leaking)
            && feasible.containsKey(reference)) {
          checkNormal(block, state, effects, leaking, reference);
        }
        if (checksBranchSpeculation()
            && feasible.containsKey(reference)
            && state.hardware().predictor().mayMispredict(block.address(), reference.taken())) {
          checkTransient(block, state, effects, leaking, reference);
        }
      }
    }
  }

  /** Composition A takes {@code leaking}, B takes {@code reference}. */
  private void checkNormal(
      Block block, PathState state, List<Effect> effects, Successor leaking, Successor reference)
      throws AnalysisException {
    stats.divergenceCheck();
    List<Expression> query = with(state.pathCondition(), leaking.guard());
    for (Expression condition : with(state.pathCondition(), reference.guard())) {
      query.add(secondCopy(condition));
    }
    SolverResult result = decide(query);
    if (!result.isSat()) {
      return;
    }
    Assignment[] models = split(result.model().orElseThrow());
    CompositionTrace first =
        normalRun(block, state, effects, leaking, Composition.A, models[0]);
    CompositionTrace second =
        normalRun(block, state, effects, reference, Composition.B, models[1]);
    compare(
        block, leaking.tail(), reference.tail(), Divergence.Kind.NORMAL, first, second, query);
  }

  private CompositionTrace normalRun(
      Block block,
      PathState state,
      List<Effect> effects,
      Successor successor,
      Composition composition,
      Assignment model)
      throws SortMismatchException {
    CompositionModel inputs = new CompositionModel(model, policy, composition == Composition.B);
    PathState run = state.copy();
    List<TraceStep> steps = new ArrayList<>(run.trace());
    List<Effect> branchEffects = new ArrayList<>(effects);
    resolveBranch(block, run, successor, branchEffects);
    steps.add(new TraceStep(block.index(), false, branchEffects));
    steps.addAll(run(run, successor.tail(), analysis.divergenceHorizon(), false, inputs, -1));
    return new CompositionTrace(
        composition, inputs.inputs(), steps, run.observations(), run.hardware());
  }

  /** Both compositions actually take {@code reference} but first speculate {@code leaking}. */
  private void checkTransient(
      Block block, PathState state, List<Effect> effects, Successor leaking, Successor reference)
      throws AnalysisException {
    stats.divergenceCheck();
    Optional<SolvedQuery> solved =
        solveSelfComposed(with(state.pathCondition(), reference.guard()));
    if (solved.isEmpty()) {
      return;
    }
    Assignment[] models = split(solved.get().model());
    CompositionTrace first = transientRun(block, state, effects, leaking, Composition.A, models[0]);
    CompositionTrace second =
        transientRun(block, state, effects, leaking, Composition.B, models[1]);
    compare(
        block,
        leaking.tail(),
        reference.tail(),
        Divergence.Kind.TRANSIENT,
        first,
        second,
        solved.get().assertions());
  }

  /**
   * Solves {@code shared} for both compositions, preferring a model in which some secret differs.
   * Empty when neither query is satisfiable; an undecided answer is recorded.
   */
  private Optional<SolvedQuery> solveSelfComposed(List<Expression> shared)
      throws SortMismatchException {
    List<Expression> query = new ArrayList<>(shared);
    for (Expression condition : shared) {
      query.add(secondCopy(condition));
    }
    List<Expression> apart = withSecretsApart(query);
    SolverResult result = solver.check(apart);
    if (result.isSat()) {
      return Optional.of(new SolvedQuery(apart, result.model().orElseThrow()));
    }
    boolean unknown = result.isUnknown();
    if (apart.size() != query.size()) {
      SolverResult relaxed = solver.check(query);
      if (relaxed.isSat()) {
        return Optional.of(new SolvedQuery(query, relaxed.model().orElseThrow()));
      }
      unknown |= relaxed.isUnknown();
    }
    if (unknown) {
      stats.undecidedQuery();
    }
    return Optional.empty();
  }

  /**
   * Checks every store of {@code block}: both compositions run from the block start with that
   * store skipped under speculation. A difference counts only when the same runs without the
   * bypass agree.
   */
  private void checkStoreBypasses(Block block, PathState state) throws AnalysisException {
    int stores = BlockInterpreter.storeCount(block);
    if (stores == 0 || stopped()) {
      return;
    }
    stats.divergenceCheck();
    Optional<SolvedQuery> solved = solveSelfComposed(state.pathCondition());
    if (solved.isEmpty()) {
      return;
    }
    Assignment[] models = split(solved.get().model());
    if (!differences(
            bypassRun(block, state, -1, Composition.A, models[0]),
            bypassRun(block, state, -1, Composition.B, models[1]))
        .isEmpty()) {
      return;
    }
    for (int store = 0; store < stores && !stopped(); store++) {
      CompositionTrace first = bypassRun(block, state, store, Composition.A, models[0]);
      CompositionTrace second = bypassRun(block, state, store, Composition.B, models[1]);
      compare(
          block,
          block.index(),
          block.index(),
          Divergence.Kind.STORE_BYPASS,
          first,
          second,
          solved.get().assertions());
    }
  }

  private CompositionTrace bypassRun(
      Block block, PathState state, int store, Composition composition, Assignment model)
      throws SortMismatchException {
    stats.speculativeRun();
    CompositionModel inputs = new CompositionModel(model, policy, composition == Composition.B);
    PathState run = state.copy();
    List<TraceStep> steps = new ArrayList<>(run.trace());
    steps.addAll(
        run(run, block.index(), architecture.speculationWindow(), true, inputs, store));
    return new CompositionTrace(
        composition, inputs.inputs(), steps, run.observations(), run.hardware());
  }

  private CompositionTrace transientRun(
      Block block,
      PathState state,
      List<Effect> effects,
      Successor speculated,
      Composition composition,
      Assignment model)
      throws SortMismatchException {
    stats.speculativeRun();
    CompositionModel inputs = new CompositionModel(model, policy, composition == Composition.B);
    PathState run = state.copy();
    List<TraceStep> steps = new ArrayList<>(run.trace());
    steps.add(new TraceStep(block.index(), false, effects));
    steps.addAll(
        run(run, speculated.tail(), architecture.speculationWindow(), true, inputs, -1));
    return new CompositionTrace(
        composition, inputs.inputs(), steps, run.observations(), run.hardware());
  }

  private void compare(
      Block block,
      int leakingTail,
      int referenceTail,
      Divergence.Kind kind,
      CompositionTrace first,
      CompositionTrace second,
      List<Expression> query) {
    List<String> components = differences(first, second);
    if (components.isEmpty()) {
      return;
    }
    stats.divergence();
    Divergence divergence =
        new Divergence(
            block.index(), leakingTail, referenceTail, kind, components, first, second);
    if (!leakPolicy.isLeak(divergence)) {
      LOG.debug("Ignoring {}", divergence.describe());
      return;
    }
    LOG.info("Leak found: {}", divergence.describe());
    CounterExample counterExample =
        counterExamples.build(block.index(), first, second, divergence.describe());
    findings.add(new Finding(counterExample, divergence, query));
    if (analysis.stopAtFirstLeak()) {
      stop("stopped at first leak");
    }
  }

  /** The observable components in which the two compositions end up different. */
  private List<String> differences(CompositionTrace first, CompositionTrace second) {
    List<String> components =
        new ArrayList<>(
            first
                .finalState()
                .diff(second.finalState(), architecture.observeBtb(), architecture.observePht()));
    if (!looksAlike(watched(first.observations()), watched(second.observations()))) {
      components.add("accesses");
    }
    return components;
  }

  /** The cache accesses the attacker watches as they happen; empty when only the end is seen. */
  private List<Observation> watched(List<Observation> observations) {
    ObserveMode observe = analysis.observe();
    List<Observation> seen = new ArrayList<>();
    for (Observation observation : observations) {
      if (observe.watchesAccessesAt(graph.block(observation.block()).address())) {
        seen.add(observation);
      }
    }
    return seen;
  }

  private static boolean looksAlike(List<Observation> first, List<Observation> second) {
    if (first.size() != second.size()) {
      return false;
    }
    for (int i = 0; i < first.size(); i++) {
      if (!first.get(i).looksLike(second.get(i))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Runs at most {@code maxBlocks} blocks concretely under {@code inputs}. A speculative run stops
   * at a barrier and leaves the predictor alone; a normal run trains it at every branch. The store
   * with ordinal {@code bypassedStore} in the first block is skipped.
   */
  private List<TraceStep> run(
      PathState state,
      int start,
      int maxBlocks,
      boolean speculative,
      CompositionModel inputs,
      int bypassedStore)
      throws SortMismatchException {
    List<TraceStep> steps = new ArrayList<>();
    int index = start;
    for (int i = 0; i < maxBlocks; i++) {
      Block block = graph.block(index);
      List<Effect> effects = new ArrayList<>();
      int bypass = i == 0 ? bypassedStore : -1;
      if (interpreter.execute(block, state, speculative, inputs, effects, bypass)
          == BlockInterpreter.Outcome.STOPPED) {
        steps.add(new TraceStep(index, speculative, effects));
        break;
      }
      Successor next = null;
      List<Successor> successors = successors(block, state);
      for (Successor successor : successors) {
        if (!successor.conditional() || inputs.decide(successor.guard())) {
          next = successor;
          break;
        }
      }
      if (next != null && next.conditional() && !speculative) {
        resolveBranch(block, state, next, effects);
      }
      steps.add(new TraceStep(index, speculative, effects));
      if (next == null) {
        break;
      }
      index = next.tail();
    }
    return steps;
  }

  /** Records the branch outcome and trains the predictor with it. */
  private static void resolveBranch(
      Block block, PathState state, Successor successor, List<Effect> effects) {
    effects.add(Effect.branchCondition(block.address(), successor.taken()));
    effects.add(Effect.branchTarget(block.address(), successor.targetAddress()));
    state
        .hardware()
        .predictor()
        .update(block.address(), successor.taken(), successor.targetAddress());
  }

  private List<Successor> successors(Block block, PathState state) {
    List<Successor> successors = new ArrayList<>();
    for (Transition transition : graph.edgesOut(block.index())) {
      Expression guard =
          transition
              .guard()
              .map(g -> ExpressionSimplifier.simplify(state.resolve(g)))
              .orElse(Expression.bool(true));
      long target = graph.block(transition.tail()).address();
      successors.add(
          new Successor(
              transition.tail(),
              target,
              transition.kind() != BranchKind.FALL_THROUGH,
              transition.isConditional(),
              guard));
    }
    return successors;
  }

  private Concretizer explorationConcretizer() {
    return new Concretizer() {
      @Override
      public OptionalLong address(Expression address, PathState state)
          throws SortMismatchException {
        if (address.isConstant()) {
          return OptionalLong.of(address.constant().value().longValue());
        }
        SolverResult result = decide(state.pathCondition());
        if (!result.isSat()) {
          return OptionalLong.empty();
        }
        Assignment model = result.model().orElseThrow();
        Optional<Constant> value =
            ExpressionEvaluator.evaluate(address, v -> model.get(v).or(() -> zero(v)));
        if (value.isEmpty()) {
          return OptionalLong.empty();
        }
        state.addCondition(Expression.equal(address, Expression.constant(value.get())));
        return OptionalLong.of(value.get().value().longValue());
      }

      @Override
      public boolean assume(Expression condition, PathState state) {
        if (condition.isConstant()) {
          return condition.constant().booleanValue();
        }
        state.addCondition(condition);
        return true;
      }
    };
  }

  /** Value of an input the model left open; memory has none. */
  private static Optional<Constant> zero(Variable variable) {
    if (variable.sort().isMemory()) {
      return Optional.empty();
    }
    return Optional.of(
        variable.sort().isBool() ? Constant.FALSE : Constant.zero(variable.sort().width()));
  }

  /** Renames every high input of {@code expression} to its second copy. */
  private Expression secondCopy(Expression expression) {
    Map<Variable, Expression> renaming = new HashMap<>();
    for (Variable variable : expression.variables()) {
      if (policy.isHigh(variable)) {
        renaming.put(variable, secondCopy(variable).toExpression());
      }
    }
    return renaming.isEmpty() ? expression : expression.substitute(renaming);
  }

  private static Variable secondCopy(Variable variable) {
    return new Variable(variable.name() + SECOND_COPY, variable.sort());
  }

  /** Adds the requirement that at least one high input differs between the two copies. */
  private List<Expression> withSecretsApart(List<Expression> query) throws SortMismatchException {
    Set<Variable> highs = new LinkedHashSet<>();
    for (Expression condition : query) {
      for (Variable variable : condition.variables()) {
        if (!variable.name().endsWith(SECOND_COPY)
            && !variable.sort().isMemory()
            && policy.isHigh(variable)) {
          highs.add(variable);
        }
      }
    }
    if (highs.isEmpty()) {
      return query;
    }
    Expression apart = null;
    for (Variable high : highs) {
      Expression differs =
          Expression.unequal(high.toExpression(), secondCopy(high).toExpression());
      apart = apart == null ? differs : Expression.or(apart, differs);
    }
    List<Expression> result = new ArrayList<>(query);
    result.add(apart);
    return result;
  }

  /** Splits a self-composed model into the inputs of A (index 0) and B (index 1). */
  private Assignment[] split(Assignment model) {
    Map<Variable, Constant> first = new HashMap<>();
    Map<Variable, Constant> second = new HashMap<>();
    model
        .values()
        .forEach(
            (variable, value) -> {
              String name = variable.name();
              if (name.endsWith(SECOND_COPY)) {
                String original = name.substring(0, name.length() - SECOND_COPY.length());
                second.put(new Variable(original, variable.sort()), value);
              } else {
                first.put(variable, value);
                if (!policy.isHigh(variable)) {
                  second.put(variable, value);
                }
              }
            });
    return new Assignment[] {Assignment.of(first), Assignment.of(second)};
  }

  /** Asks the solver and records a query it could not decide. */
  private SolverResult decide(List<Expression> query) throws SortMismatchException {
    SolverResult result = solver.check(query);
    if (result.isUnknown()) {
      LOG.debug("Solver left a query of {} assertion(s) undecided", query.size());
      stats.undecidedQuery();
    }
    return result;
  }

  private boolean checksBranchSpeculation() {
    return analysis.checkMode().checksTransient()
        && analysis.spectrePht()
        && architecture.speculationWindow() > 0;
  }

  private boolean checksStoreBypass() {
    return analysis.checkMode().checksTransient()
        && analysis.spectreStl()
        && architecture.speculationWindow() > 0;
  }

  private static List<Expression> with(List<Expression> conditions, Expression extra) {
    List<Expression> result = new ArrayList<>(conditions);
    result.add(extra);
    return result;
  }

  private boolean reservePath() {
    if (pathsStarted.incrementAndGet() <= analysis.maxPaths()) {
      return true;
    }
    pathsStarted.decrementAndGet();
    truncate("path budget of " + analysis.maxPaths() + " exhausted");
    return false;
  }

  private boolean stopped() {
    if (stopReason.get() != null) {
      return true;
    }
    long budget = analysis.timeBudgetMs();
    if (budget > 0 && timing.exceeded(Duration.ofMillis(budget))) {
      stop("time budget of " + budget + " ms exhausted");
      return true;
    }
    return false;
  }

  private void stop(String reason) {
    if (stopReason.compareAndSet(null, reason)) {
      LOG.debug("Stopping exploration: {}", reason);
    }
  }

  private void truncate(String reason) {
    truncation.compareAndSet(null, reason);
  }

  private record SolvedQuery(List<Expression> assertions, Assignment model) {}

  /** An outgoing transition with its guard rewritten over program inputs. */
  private record Successor(
      int tail, long targetAddress, boolean taken, boolean conditional, Expression guard) {}
}
