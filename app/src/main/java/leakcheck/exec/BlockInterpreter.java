package leakcheck.exec;

import java.util.List;
import java.util.OptionalLong;
import leakcheck.cex.Effect;
import leakcheck.cex.Observation;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.ir.Constant;
import leakcheck.ir.Expression;
import leakcheck.ir.ExpressionSimplifier;
import leakcheck.ir.Variable;
import leakcheck.program.Block;
import leakcheck.program.Operation;
import leakcheck.uarch.CacheAccess;
import leakcheck.uarch.MicroarchitecturalState;

/** Executes the operations of one block against a path state. */
final class BlockInterpreter {

  /** How a block execution ended. */
  enum Outcome {
    COMPLETED,
    /** An assumption failed, an address had no value or speculation hit a barrier. */
    STOPPED
  }

  private final ExplorationStats stats;

  BlockInterpreter(ExplorationStats stats) {
    this.stats = stats;
  }

  /**
   * Runs every operation of {@code block} in order and appends the cache fetches it performs to
   * {@code effects}.
   */
  Outcome execute(
      Block block,
      PathState state,
      boolean speculative,
      Concretizer concretizer,
      List<Effect> effects)
      throws SortMismatchException {
    return execute(block, state, speculative, concretizer, effects, -1);
  }

  /**
   * Like {@link #execute(Block, PathState, boolean, Concretizer, List)}, but the store with the
   * given ordinal among the block's stores has not happened yet: it neither fills the cache nor
   * changes memory, so later loads of its address read the older contents. A negative ordinal
   * bypasses nothing.
   */
  Outcome execute(
      Block block,
      PathState state,
      boolean speculative,
      Concretizer concretizer,
      List<Effect> effects,
      int bypassedStore)
      throws SortMismatchException {
    stats.blockExecuted();
    int stores = 0;
    for (Operation operation : block.operations()) {
      if (operation.kind() == Operation.Kind.STORE && stores++ == bypassedStore) {
        continue;
      }
      if (!execute(block, operation, state, speculative, concretizer, effects)) {
        return Outcome.STOPPED;
      }
    }
    return Outcome.COMPLETED;
  }

  /** Number of store operations in {@code block}. */
  static int storeCount(Block block) {
    int stores = 0;
    for (Operation operation : block.operations()) {
      if (operation.kind() == Operation.Kind.STORE) {
        stores++;
      }
    }
    return stores;
  }

  private boolean execute(
      Block block,
      Operation operation,
      PathState state,
      boolean speculative,
      Concretizer concretizer,
      List<Effect> effects)
      throws SortMismatchException {
    MicroarchitecturalState hardware = state.hardware();
    switch (operation.kind()) {
      case LET -> {
        Variable target = operation.target().orElseThrow();
        state.bind(target, evaluate(state, operation.expression()));
        return true;
      }
      case ASSUME, ASSERT -> {
        return concretizer.assume(evaluate(state, operation.expression()), state);
      }
      case LOAD -> {
        Variable target = operation.target().orElseThrow();
        Expression address = evaluate(state, operation.address());
        OptionalLong concrete = concretizer.address(address, state);
        if (concrete.isEmpty()) {
          return false;
        }
        long location = concrete.getAsLong();
        CacheAccess access = hardware.cache().read(location);
        observe(block, location, access, speculative, state);
        int width = target.sort().width();
        effects.add(Effect.cacheFetch(location, width));
        state.bind(target, hardware.memory().load(constantAddress(address, location), width));
        return true;
      }
      case STORE -> {
        Expression address = evaluate(state, operation.address());
        Expression value = evaluate(state, operation.value());
        OptionalLong concrete = concretizer.address(address, state);
        if (concrete.isEmpty()) {
          return false;
        }
        long location = concrete.getAsLong();
        CacheAccess access = hardware.cache().write(location);
        observe(block, location, access, speculative, state);
        effects.add(Effect.cacheFetch(location, value.sort().width()));
        hardware.memory().store(constantAddress(address, location), value);
        return true;
      }
      case BARRIER -> {
        return !speculative;
      }
      case FLUSH -> {
        hardware.cache().flush();
        return true;
      }
      default -> throw new IllegalStateException("unknown operation kind " + operation.kind());
    }
  }

  private void observe(
      Block block, long location, CacheAccess access, boolean speculative, PathState state) {
    stats.cacheAccess(access.hit());
    state.observe(
        new Observation(block.index(), location, access.line(), access.hit(), speculative));
  }

  private static Expression evaluate(PathState state, Expression expression) {
    return ExpressionSimplifier.simplify(state.resolve(expression));
  }

  private static Expression constantAddress(Expression address, long location) {
    return Expression.constant(Constant.truncating(location, address.sort().width()));
  }
}
