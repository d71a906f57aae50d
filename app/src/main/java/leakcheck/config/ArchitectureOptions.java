package leakcheck.config;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Optional;
import leakcheck.uarch.BranchTargetBuffer;
import leakcheck.uarch.Cache;
import leakcheck.uarch.CacheConfig;
import leakcheck.uarch.Memory;
import leakcheck.uarch.MicroarchitecturalState;
import leakcheck.uarch.PatternHistoryTable;
import leakcheck.uarch.Predictor;
import leakcheck.uarch.PredictorStrategy;

/**
 * Parameters of the modeled hardware.
 *
 * <p>{@code defaultMemoryByte} below zero leaves unwritten memory symbolic.
 *
 * <p>{@link #normalize} replaces unset values by defaults and rejects values the hardware models
 * cannot represent with an {@link IllegalArgumentException}.
 */
public record ArchitectureOptions(
    int cacheLineBits,
    int cacheSetBits,
    int cacheWays,
    int btbCapacity,
    int phtCounterBits,
    int phtHistoryBits,
    int speculationWindow,
    boolean observeBtb,
    boolean observePht,
    int addressWidth,
    int defaultMemoryByte) {

  public static ArchitectureOptions defaults() {
    return new ArchitectureOptions(6, 0, 8, 16, 2, 2, 100, false, false, 64, -1);
  }

  public static ArchitectureOptions normalize(ArchitectureOptions options) {
    if (options == null) {
      return defaults();
    }
    ArchitectureOptions defaults = defaults();
    checkArgument(
        options.cacheLineBits() <= 16,
        "cache line bits must be at most 16: %s",
        options.cacheLineBits());
    checkArgument(
        options.cacheSetBits() <= 16,
        "cache set bits must be at most 16: %s",
        options.cacheSetBits());
    checkArgument(
        options.phtCounterBits() <= 8,
        "pattern history counter bits must be at most 8: %s",
        options.phtCounterBits());
    checkArgument(
        options.phtHistoryBits() <= 32,
        "pattern history bits must be at most 32: %s",
        options.phtHistoryBits());
    checkArgument(
        options.addressWidth() <= 64,
        "address width must be at most 64: %s",
        options.addressWidth());
    checkArgument(
        options.defaultMemoryByte() <= 0xFF,
        "default memory byte must be at most 255: %s",
        options.defaultMemoryByte());
    return new ArchitectureOptions(
        options.cacheLineBits() >= 0 ? options.cacheLineBits() : defaults.cacheLineBits(),
        options.cacheSetBits() >= 0 ? options.cacheSetBits() : defaults.cacheSetBits(),
        options.cacheWays() > 0 ? options.cacheWays() : defaults.cacheWays(),
        options.btbCapacity() > 0 ? options.btbCapacity() : defaults.btbCapacity(),
        options.phtCounterBits() > 0 ? options.phtCounterBits() : defaults.phtCounterBits(),
        options.phtHistoryBits() >= 0 ? options.phtHistoryBits() : defaults.phtHistoryBits(),
        Math.max(0, options.speculationWindow()),
        options.observeBtb(),
        options.observePht(),
        options.addressWidth() > 0 ? options.addressWidth() : defaults.addressWidth(),
        options.defaultMemoryByte());
  }

  public ArchitectureOptions withSpeculationWindow(int window) {
    return new ArchitectureOptions(
        cacheLineBits,
        cacheSetBits,
        cacheWays,
        btbCapacity,
        phtCounterBits,
        phtHistoryBits,
        window,
        observeBtb,
        observePht,
        addressWidth,
        defaultMemoryByte);
  }

  public CacheConfig cacheConfig() {
    return new CacheConfig(cacheLineBits, cacheSetBits, cacheWays);
  }

  /** Fresh hardware state: empty cache, untrained predictor, untouched memory. */
  public MicroarchitecturalState initialState(PredictorStrategy strategy) {
    Predictor predictor =
        new Predictor(
            new PatternHistoryTable(phtCounterBits, phtHistoryBits),
            new BranchTargetBuffer(btbCapacity),
            strategy);
    Optional<Integer> defaultByte =
        defaultMemoryByte < 0 ? Optional.empty() : Optional.of(defaultMemoryByte);
    return new MicroarchitecturalState(
        new Cache(cacheConfig()), predictor, new Memory(addressWidth, defaultByte));
  }
}
