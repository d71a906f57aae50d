package leakcheck.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import leakcheck.diagnostics.AnalysisException;
import leakcheck.diagnostics.ErrorKind;
import leakcheck.uarch.PredictorStrategy;

/**
 * The complete analysis configuration: exploration options, hardware parameters, security policy
 * and fixed initial register values.
 *
 * <p>Read from JSON. Every section and field is optional and falls back to its default:
 *
 * <pre>
 * {
 *   "analysis": {"check": "all", "predictorStrategy": "always_mispredict", "maxPaths": 100,
 *                "spectreStl": true, "observe": "locations", "observeLocations": ["0x10"],
 *                "solver": "z3"},
 *   "architecture": {"cache": {"lineBits": 6, "setBits": 0, "ways": 8}, "speculationWindow": 20},
 *   "policy": {"registers": "low", "memory": "high", "high": ["key"]},
 *   "initialValues": {"rsp": "0x7fff0000"}
 * }
 * </pre>
 */
public final class Environment {
  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

  private final AnalysisOptions analysis;
  private final ArchitectureOptions architecture;
  private final SecurityPolicy policy;
  private final Map<String, BigInteger> initialValues;

  public Environment(
      AnalysisOptions analysis,
      ArchitectureOptions architecture,
      SecurityPolicy policy,
      Map<String, BigInteger> initialValues) {
    this.analysis = AnalysisOptions.normalize(analysis);
    this.architecture = ArchitectureOptions.normalize(architecture);
    this.policy = SecurityPolicy.normalize(policy);
    this.initialValues =
        Collections.unmodifiableMap(
            new LinkedHashMap<>(Objects.requireNonNull(initialValues, "initialValues")));
  }

  public static Environment defaults() {
    return new Environment(
        AnalysisOptions.defaults(),
        ArchitectureOptions.defaults(),
        SecurityPolicy.defaults(),
        Map.of());
  }

  public static Environment load(Path path) throws AnalysisException {
    try {
      return parse(Files.readString(path, StandardCharsets.UTF_8));
    } catch (IOException ex) {
      throw new AnalysisException(
          ErrorKind.IO, "cannot read environment " + path + ": " + ex.getMessage(), ex);
    }
  }

  public static Environment parse(String json) throws AnalysisException {
    try {
      EnvironmentFile file = GSON.fromJson(json, EnvironmentFile.class);
      return file == null ? defaults() : file.toEnvironment();
    } catch (JsonParseException | IllegalArgumentException | ArithmeticException ex) {
      throw new AnalysisException(
          ErrorKind.IO, "malformed environment: " + ex.getMessage(), ex);
    }
  }

  public AnalysisOptions analysis() {
    return analysis;
  }

  public ArchitectureOptions architecture() {
    return architecture;
  }

  public SecurityPolicy policy() {
    return policy;
  }

  public Map<String, BigInteger> initialValues() {
    return initialValues;
  }

  public Environment withAnalysis(AnalysisOptions replacement) {
    return new Environment(replacement, architecture, policy, initialValues);
  }

  public Environment withArchitecture(ArchitectureOptions replacement) {
    return new Environment(analysis, replacement, policy, initialValues);
  }

  public Environment withPolicy(SecurityPolicy replacement) {
    return new Environment(analysis, architecture, replacement, initialValues);
  }

  public String toJson() {
    return GSON.toJson(EnvironmentFile.from(this));
  }

  static BigInteger parseValue(String text) {
    String trimmed = text.trim().toLowerCase(Locale.ROOT).replace("_", "");
    if (trimmed.startsWith("0x")) {
      return new BigInteger(trimmed.substring(2), 16);
    }
    return new BigInteger(trimmed);
  }

  // JSON shape with nullable fields, so that absent entries fall back to defaults.
  private static final class EnvironmentFile {
    AnalysisSection analysis;
    ArchitectureSection architecture;
    PolicySection policy;
    Map<String, String> initialValues;

    Environment toEnvironment() {
      AnalysisOptions a = AnalysisOptions.defaults();
      if (analysis != null) {
        a =
            new AnalysisOptions(
                analysis.check != null ? CheckMode.parse(analysis.check) : a.checkMode(),
                analysis.predictorStrategy != null
                    ? strategy(analysis.predictorStrategy)
                    : a.predictorStrategy(),
                or(analysis.maxPaths, a.maxPaths()),
                or(analysis.maxPathLength, a.maxPathLength()),
                analysis.timeBudgetMs != null ? analysis.timeBudgetMs : a.timeBudgetMs(),
                or(analysis.parallelism, a.parallelism()),
                or(analysis.divergenceHorizon, a.divergenceHorizon()),
                analysis.stopAtFirstLeak != null ? analysis.stopAtFirstLeak : a.stopAtFirstLeak(),
                or(analysis.solverInFlight, a.solverInFlight()),
                analysis.strict != null ? analysis.strict : a.strict(),
                analysis.spectrePht != null ? analysis.spectrePht : a.spectrePht(),
                analysis.spectreStl != null ? analysis.spectreStl : a.spectreStl(),
                analysis.startWithEmptyCache != null
                    ? analysis.startWithEmptyCache
                    : a.startWithEmptyCache(),
                analysis.observe != null ? observe(analysis) : a.observe(),
                analysis.solver != null ? SolverBackend.parse(analysis.solver) : a.solver());
      }
      ArchitectureOptions arch = ArchitectureOptions.defaults();
      if (architecture != null) {
        CacheSection cache = architecture.cache != null ? architecture.cache : new CacheSection();
        PhtSection pht = architecture.pht != null ? architecture.pht : new PhtSection();
        arch =
            new ArchitectureOptions(
                or(cache.lineBits, arch.cacheLineBits()),
                or(cache.setBits, arch.cacheSetBits()),
                or(cache.ways, arch.cacheWays()),
                or(architecture.btbCapacity, arch.btbCapacity()),
                or(pht.counterBits, arch.phtCounterBits()),
                or(pht.historyBits, arch.phtHistoryBits()),
                or(architecture.speculationWindow, arch.speculationWindow()),
                architecture.observeBtb != null ? architecture.observeBtb : arch.observeBtb(),
                architecture.observePht != null ? architecture.observePht : arch.observePht(),
                or(architecture.addressWidth, arch.addressWidth()),
                or(architecture.defaultMemoryByte, arch.defaultMemoryByte()));
      }
      SecurityPolicy p = SecurityPolicy.defaults();
      if (policy != null) {
        p =
            new SecurityPolicy(
                policy.registers != null ? level(policy.registers) : p.registerDefault(),
                policy.memory != null ? level(policy.memory) : p.memoryDefault(),
                policy.low != null ? Set.copyOf(policy.low) : p.low(),
                policy.high != null ? Set.copyOf(policy.high) : p.high());
      }
      Map<String, BigInteger> values = new LinkedHashMap<>();
      if (initialValues != null) {
        initialValues.forEach((name, value) -> values.put(name, parseValue(value)));
      }
      return new Environment(a, arch, p, values);
    }

    static EnvironmentFile from(Environment environment) {
      EnvironmentFile file = new EnvironmentFile();
      AnalysisOptions a = environment.analysis;
      file.analysis = new AnalysisSection();
      file.analysis.check = a.checkMode().name().toLowerCase(Locale.ROOT);
      file.analysis.predictorStrategy = a.predictorStrategy().name().toLowerCase(Locale.ROOT);
      file.analysis.maxPaths = a.maxPaths();
      file.analysis.maxPathLength = a.maxPathLength();
      file.analysis.timeBudgetMs = a.timeBudgetMs();
      file.analysis.parallelism = a.parallelism();
      file.analysis.divergenceHorizon = a.divergenceHorizon();
      file.analysis.stopAtFirstLeak = a.stopAtFirstLeak();
      file.analysis.solverInFlight = a.solverInFlight();
      file.analysis.strict = a.strict();
      file.analysis.spectrePht = a.spectrePht();
      file.analysis.spectreStl = a.spectreStl();
      file.analysis.startWithEmptyCache = a.startWithEmptyCache();
      file.analysis.observe = a.observe().label();
      if (!a.observe().locations().isEmpty()) {
        file.analysis.observeLocations =
            a.observe().locations().stream().map(l -> "0x" + Long.toHexString(l)).toList();
      }
      file.analysis.solver = a.solver().label();
      ArchitectureOptions arch = environment.architecture;
      file.architecture = new ArchitectureSection();
      file.architecture.cache = new CacheSection();
      file.architecture.cache.lineBits = arch.cacheLineBits();
      file.architecture.cache.setBits = arch.cacheSetBits();
      file.architecture.cache.ways = arch.cacheWays();
      file.architecture.btbCapacity = arch.btbCapacity();
      file.architecture.pht = new PhtSection();
      file.architecture.pht.counterBits = arch.phtCounterBits();
      file.architecture.pht.historyBits = arch.phtHistoryBits();
      file.architecture.speculationWindow = arch.speculationWindow();
      file.architecture.observeBtb = arch.observeBtb();
      file.architecture.observePht = arch.observePht();
      file.architecture.addressWidth = arch.addressWidth();
      file.architecture.defaultMemoryByte = arch.defaultMemoryByte();
      SecurityPolicy p = environment.policy;
      file.policy = new PolicySection();
      file.policy.registers = p.registerDefault().name().toLowerCase(Locale.ROOT);
      file.policy.memory = p.memoryDefault().name().toLowerCase(Locale.ROOT);
      file.policy.low = List.copyOf(p.low());
      file.policy.high = List.copyOf(p.high());
      file.initialValues = new LinkedHashMap<>();
      environment.initialValues.forEach(
          (name, value) -> file.initialValues.put(name, "0x" + value.toString(16)));
      return file;
    }

    private static int or(Integer value, int fallback) {
      return value != null ? value : fallback;
    }

    private static ObserveMode observe(AnalysisSection analysis) {
      List<Long> addresses = new ArrayList<>();
      if (analysis.observeLocations != null) {
        for (String location : analysis.observeLocations) {
          addresses.add(parseValue(location).longValueExact());
        }
      }
      return ObserveMode.parse(analysis.observe, addresses);
    }

    private static PredictorStrategy strategy(String text) {
      return PredictorStrategy.valueOf(text.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }

    private static SecurityPolicy.Level level(String text) {
      return SecurityPolicy.Level.valueOf(text.trim().toUpperCase(Locale.ROOT));
    }
  }

  private static final class AnalysisSection {
    String check;
    String predictorStrategy;
    Integer maxPaths;
    Integer maxPathLength;
    Long timeBudgetMs;
    Integer parallelism;
    Integer divergenceHorizon;
    Boolean stopAtFirstLeak;
    Integer solverInFlight;
    Boolean strict;
    Boolean spectrePht;
    Boolean spectreStl;
    Boolean startWithEmptyCache;
    String observe;
    List<String> observeLocations;
    String solver;
  }

  private static final class ArchitectureSection {
    CacheSection cache;
    Integer btbCapacity;
    PhtSection pht;
    Integer speculationWindow;
    Boolean observeBtb;
    Boolean observePht;
    Integer addressWidth;
    Integer defaultMemoryByte;
  }

  private static final class CacheSection {
    Integer lineBits;
    Integer setBits;
    Integer ways;
  }

  private static final class PhtSection {
    Integer counterBits;
    Integer historyBits;
  }

  private static final class PolicySection {
    String registers;
    String memory;
    List<String> low;
    List<String> high;
  }
}
