package leakcheck.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Set;
import leakcheck.config.CheckMode;
import leakcheck.config.Environment;
import leakcheck.config.SecurityPolicy.Level;
import leakcheck.config.SolverBackend;
import leakcheck.ir.Variable;
import leakcheck.uarch.PredictorStrategy;
import org.junit.jupiter.api.Test;

final class AnalyzeCommandTest {

  private final AnalyzeCommand command = new AnalyzeCommand();

  @Test
  void parsesSeparateAndInlineValues() {
    CliOptions options =
        command.parseArgs(
            new String[] {
              "--file",
              "prog.muasm",
              "--check=transient",
              "--predictor",
              "model",
              "--window=12",
              "--max-paths",
              "50",
              "--secrets",
              "k1, k2,",
              "--policy=cache",
              "--stop-at-first"
            });

    assertEquals(Path.of("prog.muasm"), options.file(), "file");
    assertEquals(CheckMode.TRANSIENT_ONLY, options.checkMode(), "check mode");
    assertEquals(PredictorStrategy.MODEL, options.predictor(), "predictor");
    assertEquals(12, options.speculationWindow(), "window");
    assertEquals(50, options.maxPaths(), "path budget");
    assertEquals(Set.of("k1", "k2"), options.secrets(), "secrets split on commas");
    assertEquals("cache", options.leakPolicy(), "policy");
    assertTrue(options.stopAtFirstLeak(), "flag");
    assertNull(options.parallelism(), "unset options stay null");
  }

  @Test
  void rejectsBadValues() {
    assertThrows(
        IllegalArgumentException.class,
        () -> command.parseArgs(new String[] {"--file", "p", "--window", "-1"}),
        "negative window");
    assertThrows(
        IllegalArgumentException.class,
        () -> command.parseArgs(new String[] {"--file", "p", "--parallelism", "0"}),
        "zero workers");
    assertThrows(
        IllegalArgumentException.class,
        () -> command.parseArgs(new String[] {"--file", "p", "--max-paths", "many"}),
        "non-numeric budget");
    assertThrows(
        IllegalArgumentException.class,
        () -> command.parseArgs(new String[] {"--file"}),
        "missing value");
    IllegalArgumentException missing =
        assertThrows(
            IllegalArgumentException.class,
            () -> command.parseArgs(new String[] {"--strict"}),
            "missing file");
    assertEquals("Missing required option --file", missing.getMessage(), "message");
  }

  @Test
  void overridesApplyOnTopOfTheEnvironment() {
    CliOptions options =
        command.parseArgs(
            new String[] {
              "--file", "p", "--check", "normal", "--window", "3", "--secrets", "key", "--strict"
            });
    Environment base = Environment.defaults();

    Environment applied = options.applyTo(base);

    assertEquals(CheckMode.NORMAL_ONLY, applied.analysis().checkMode(), "check mode");
    assertEquals(3, applied.architecture().speculationWindow(), "window");
    assertTrue(applied.analysis().strict(), "strict");
    assertEquals(
        base.analysis().maxPaths(), applied.analysis().maxPaths(), "untouched values kept");
    assertEquals(
        Level.HIGH, applied.policy().levelOf(Variable.bitVector("key", 64)), "secret register");
    assertEquals(
        Level.LOW, applied.policy().levelOf(Variable.bitVector("other", 64)), "default register");
    assertEquals(base.analysis().solver(), applied.analysis().solver(), "solver kept");
    assertFalse(applied.analysis().spectreStl(), "store bypass stays off");
  }

  @Test
  void solverAndStoreBypassOverrides() {
    CliOptions options =
        command.parseArgs(
            new String[] {"--file", "p", "--solver", "enumerating", "--spectre-stl"});

    Environment applied = options.applyTo(Environment.defaults());

    assertEquals(SolverBackend.ENUMERATING, applied.analysis().solver(), "solver");
    assertTrue(applied.analysis().spectreStl(), "store bypass");
    assertTrue(applied.analysis().spectrePht(), "branch speculation stays on");
    assertThrows(
        IllegalArgumentException.class,
        () -> command.parseArgs(new String[] {"--file", "p", "--solver", "cvc9"}),
        "unknown solver");
  }
}
