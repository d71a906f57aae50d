package leakcheck.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import leakcheck.config.SecurityPolicy.Level;
import leakcheck.diagnostics.AnalysisException;
import leakcheck.diagnostics.ErrorKind;
import leakcheck.ir.Variable;
import leakcheck.uarch.Memory;
import leakcheck.uarch.PredictorStrategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class EnvironmentTest {

  @Test
  void absentSectionsFallBackToDefaults() throws AnalysisException {
    Environment environment = Environment.parse("{}");
    ArchitectureOptions defaults = ArchitectureOptions.defaults();

    assertEquals(defaults, environment.architecture(), "Default hardware");
    assertEquals(CheckMode.ALL, environment.analysis().checkMode(), "Both checks by default");
    assertTrue(environment.initialValues().isEmpty(), "No initial values");
  }

  @Test
  void parsesEverySection() throws AnalysisException {
    Environment environment =
        Environment.parse(
            String.join(
                "\n",
                "{",
                "  \"analysis\": {\"check\": \"transient\", \"predictorStrategy\": \"model\",",
                "               \"maxPaths\": 7, \"stopAtFirstLeak\": true},",
                "  \"architecture\": {\"cache\": {\"ways\": 2}, \"speculationWindow\": 20,",
                "                   \"pht\": {\"historyBits\": 4}},",
                "  \"policy\": {\"registers\": \"high\", \"low\": [\"idx\"]},",
                "  \"initialValues\": {\"rsp\": \"0x7fff_0000\", \"n\": \"12\"}",
                "}"));

    AnalysisOptions analysis = environment.analysis();
    assertEquals(CheckMode.TRANSIENT_ONLY, analysis.checkMode(), "check");
    assertEquals(PredictorStrategy.MODEL, analysis.predictorStrategy(), "predictor strategy");
    assertEquals(7, analysis.maxPaths(), "maxPaths");
    assertTrue(analysis.stopAtFirstLeak(), "stopAtFirstLeak");

    ArchitectureOptions architecture = environment.architecture();
    assertEquals(2, architecture.cacheWays(), "ways");
    assertEquals(6, architecture.cacheLineBits(), "line bits keep their default");
    assertEquals(20, architecture.speculationWindow(), "window");
    assertEquals(4, architecture.phtHistoryBits(), "history bits");

    SecurityPolicy policy = environment.policy();
    assertEquals(Level.HIGH, policy.levelOf(Variable.bitVector("key", 64)), "Registers high");
    assertEquals(Level.LOW, policy.levelOf(Variable.bitVector("idx", 64)), "Explicitly low");
    assertEquals(
        BigInteger.valueOf(0x7fff0000L), environment.initialValues().get("rsp"), "Hex value");
    assertEquals(BigInteger.valueOf(12), environment.initialValues().get("n"), "Decimal value");
  }

  @Test
  void malformedInputIsAnAnalysisError() {
    AnalysisException syntax =
        assertThrows(
            AnalysisException.class, () -> Environment.parse("{\"analysis\": "), "Bad JSON");
    assertEquals(ErrorKind.IO, syntax.kind(), "Configuration errors are input errors");

    assertThrows(
        AnalysisException.class,
        () -> Environment.parse("{\"analysis\": {\"check\": \"sometimes\"}}"),
        "Unknown check mode");
    assertThrows(
        AnalysisException.class,
        () -> Environment.parse("{\"policy\": {\"low\": [\"k\"], \"high\": [\"k\"]}}"),
        "An input cannot be both low and high");
  }

  @Test
  void cacheGeometryOutOfRangeIsAnInputError() {
    AnalysisException lines =
        assertThrows(
            AnalysisException.class,
            () -> Environment.parse("{\"architecture\": {\"cache\": {\"lineBits\": 17}}}"),
            "Lines of 2^17 bytes");
    assertEquals(ErrorKind.IO, lines.kind(), "Reported like any malformed environment");
    assertTrue(lines.getMessage().contains("17"), lines.getMessage());

    assertThrows(
        AnalysisException.class,
        () -> Environment.parse("{\"architecture\": {\"cache\": {\"setBits\": 40}}}"),
        "2^40 sets");
    assertThrows(
        IllegalArgumentException.class,
        () ->
            ArchitectureOptions.normalize(
                new ArchitectureOptions(6, 0, 8, 16, 2, 2, 100, false, false, 65, -1)),
        "Addresses wider than 64 bits");
  }

  @Test
  void jsonRoundTripKeepsTheConfiguration(@TempDir Path dir)
      throws IOException, AnalysisException {
    Environment original =
        Environment.defaults()
            .withPolicy(SecurityPolicy.defaults().withSecrets(Set.of("key")))
            .withArchitecture(ArchitectureOptions.defaults().withSpeculationWindow(5));
    Path file = dir.resolve("env.json");
    Files.writeString(file, original.toJson());

    Environment loaded = Environment.load(file);
    assertEquals(original.architecture(), loaded.architecture(), "Hardware survives");
    assertEquals(original.policy(), loaded.policy(), "Policy survives");
    assertEquals(original.analysis(), loaded.analysis(), "Analysis options survive");
  }

  @Test
  void speculationObserverAndSolverOptions(@TempDir Path dir)
      throws IOException, AnalysisException {
    AnalysisOptions defaults = Environment.parse("{}").analysis();
    assertTrue(defaults.spectrePht(), "Branch speculation on by default");
    assertFalse(defaults.spectreStl(), "Store bypass off by default");
    assertTrue(defaults.startWithEmptyCache(), "Empty cache by default");
    assertEquals(ObserveMode.sequential(), defaults.observe(), "Final state only");
    assertEquals(SolverBackend.Z3, defaults.solver(), "Z3 by default");

    AnalysisOptions analysis =
        Environment.parse(
                String.join(
                    "\n",
                    "{\"analysis\": {\"spectrePht\": false, \"spectreStl\": true,",
                    "              \"startWithEmptyCache\": false, \"observe\": \"locations\",",
                    "              \"observeLocations\": [\"0x10\", \"32\"],",
                    "              \"solver\": \"enumerating\"}}"))
            .analysis();
    assertFalse(analysis.spectrePht(), "spectrePht");
    assertTrue(analysis.spectreStl(), "spectreStl");
    assertFalse(analysis.startWithEmptyCache(), "startWithEmptyCache");
    assertEquals(ObserveMode.locations(List.of(0x10L, 32L)), analysis.observe(), "Locations");
    assertTrue(analysis.observe().watchesAccessesAt(0x20), "Decimal location");
    assertFalse(analysis.observe().watchesAccessesAt(0x30), "Unlisted location");
    assertEquals(SolverBackend.ENUMERATING, analysis.solver(), "solver");

    Environment original = Environment.defaults().withAnalysis(analysis);
    Path file = dir.resolve("env.json");
    Files.writeString(file, original.toJson());
    assertEquals(analysis, Environment.load(file).analysis(), "New options survive a round trip");

    assertThrows(
        AnalysisException.class,
        () -> Environment.parse("{\"analysis\": {\"solver\": \"cvc9\"}}"),
        "Unknown solver");
    assertThrows(
        AnalysisException.class,
        () ->
            Environment.parse(
                "{\"analysis\": {\"observe\": \"parallel\", \"observeLocations\": [\"1\"]}}"),
        "Locations only make sense in locations mode");
  }

  @Test
  void policyDefaultsSeparateRegistersFromMemory() {
    SecurityPolicy policy = SecurityPolicy.defaults();
    assertFalse(policy.isHigh(Variable.bitVector("r1", 64)), "Registers are public");
    assertTrue(policy.isHigh(Memory.byteVariable(0x40)), "Initial memory is secret");
    assertTrue(
        policy.withSecrets(Set.of("r1")).isHigh(Variable.bitVector("r1", 64)),
        "Declared secrets are high");
  }

  @Test
  void checkModesParseLeniently() {
    assertEquals(CheckMode.NORMAL_ONLY, CheckMode.parse(" Normal "), "Case and space");
    assertEquals(CheckMode.TRANSIENT_ONLY, CheckMode.parse("transient-only"), "Dashed name");
    assertFalse(CheckMode.NORMAL_ONLY.checksTransient(), "Normal only");
    assertThrows(IllegalArgumentException.class, () -> CheckMode.parse("x"), "Unknown mode");
  }
}
