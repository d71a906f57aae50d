package leakcheck.cli;

import java.util.Arrays;
import java.util.Locale;
import leakcheck.diagnostics.AnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entrypoint.
 *
 * <p>Exit codes: {@value #EXIT_NO_LEAK} no leak, {@value #EXIT_LEAK} leak found, {@value
 * #EXIT_ERROR} analysis error, {@value #EXIT_USAGE} usage error.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_NO_LEAK = 0;
  static final int EXIT_LEAK = 1;
  static final int EXIT_ERROR = 2;
  static final int EXIT_USAGE = 64;

  static final String USAGE =
      String.join(
          "\n",
          "usage: leakcheck analyze --file PROGRAM.muasm [options]",
          "  --env FILE             environment (JSON)",
          "  --cex FILE             write the first counterexample as text",
          "  --dot FILE             write the first counterexample as a Graphviz graph",
          "  --json FILE            write a JSON report",
          "  --smt FILE             write the solver query of the first leak as SMT-LIB",
          "  --check MODE           normal | transient | all",
          "  --predictor STRATEGY   model | always-mispredict",
          "  --window N             speculation window in blocks",
          "  --parallelism N        exploration workers",
          "  --max-paths N          path budget",
          "  --time-budget-ms N     wall-clock budget, 0 for none",
          "  --secrets a,b          registers holding secrets",
          "  --policy NAME          any | cache",
          "  --solver NAME          z3 | enumerating",
          "  --spectre-stl          also speculate past stores",
          "  --stop-at-first        stop at the first leak",
          "  --strict               reject unreachable blocks");

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    if (args == null || args.length == 0) {
      LOG.error(USAGE);
      return EXIT_USAGE;
    }
    String command = args[0].toLowerCase(Locale.ROOT);
    if (command.equals("help") || command.equals("--help") || command.equals("-h")) {
      LOG.info(USAGE);
      return EXIT_NO_LEAK;
    }
    String[] rest = Arrays.copyOfRange(args, 1, args.length);
    try {
      return switch (command) {
        case "analyze" -> new AnalyzeCommand().execute(rest);
        default -> throw new IllegalArgumentException("Unknown command: " + args[0]);
      };
    } catch (IllegalArgumentException ex) {
      LOG.error("usage error: {}", ex.getMessage());
      LOG.error(USAGE);
      return EXIT_USAGE;
    } catch (AnalysisException ex) {
      LOG.error("{}", ex.diagnostic());
      LOG.debug("Analysis failed", ex);
      return EXIT_ERROR;
    }
  }
}
