package leakcheck.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import leakcheck.config.CheckMode;
import leakcheck.config.Environment;
import leakcheck.config.SolverBackend;
import leakcheck.diagnostics.AnalysisException;
import leakcheck.diagnostics.ErrorKind;
import leakcheck.exec.Finding;
import leakcheck.exec.LeakPolicies;
import leakcheck.pipeline.AnalysisPipeline;
import leakcheck.pipeline.AnalysisResult;
import leakcheck.report.DumpToFile;
import leakcheck.report.JsonReportBuilder;
import leakcheck.solver.Solvers;
import leakcheck.solver.smt.SmtLibScript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the {@code analyze} command. */
final class AnalyzeCommand {
  private static final Logger LOG = LoggerFactory.getLogger(AnalyzeCommand.class);

  int execute(String[] args) throws AnalysisException {
    CliOptions options = parseArgs(args);
    Environment base =
        options.environmentFile() != null
            ? Environment.load(options.environmentFile())
            : Environment.defaults();
    Environment environment = options.applyTo(base);
    AnalysisPipeline pipeline =
        new AnalysisPipeline(
            environment, Solvers.create(environment), LeakPolicies.byName(options.leakPolicy()));

    AnalysisResult result = pipeline.analyze(options.file());
    logSummary(result);
    writeReports(result, options);
    return result.leakFound() ? Main.EXIT_LEAK : Main.EXIT_NO_LEAK;
  }

  CliOptions parseArgs(String[] args) {
    CliOptions.Builder builder = CliOptions.builder();
    Map<String, OptionSpec> specs = optionSpecs();

    for (int i = 0; i < args.length; i++) {
      ParsedArg parsed = ParsedArg.parse(args[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + args[i]);
      }

      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        if (i + 1 >= args.length) {
          throw new IllegalArgumentException("Missing value for " + parsed.option());
        }
        value = args[++i];
      }
      spec.apply(builder, value);
    }
    return builder.build();
  }

  private Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--file", OptionSpec.withValue((b, raw) -> b.file(Path.of(raw))));
    specs.put("--env", OptionSpec.withValue((b, raw) -> b.environmentFile(Path.of(raw))));
    specs.put("--cex", OptionSpec.withValue((b, raw) -> b.counterExampleFile(Path.of(raw))));
    specs.put("--dot", OptionSpec.withValue((b, raw) -> b.dotFile(Path.of(raw))));
    specs.put("--json", OptionSpec.withValue((b, raw) -> b.jsonFile(Path.of(raw))));
    specs.put("--smt", OptionSpec.withValue((b, raw) -> b.smtFile(Path.of(raw))));
    specs.put("--check", OptionSpec.withValue((b, raw) -> b.checkMode(CheckMode.parse(raw))));
    specs.put(
        "--predictor",
        OptionSpec.withValue((b, raw) -> b.predictor(CliParsers.parsePredictor(raw))));
    specs.put(
        "--window",
        OptionSpec.withValue(
            (b, raw) -> b.speculationWindow(CliParsers.parseInt(raw, "--window"))));
    specs.put(
        "--parallelism",
        OptionSpec.withValue(
            (b, raw) -> b.parallelism(CliParsers.parsePositiveInt(raw, "--parallelism"))));
    specs.put(
        "--max-paths",
        OptionSpec.withValue(
            (b, raw) -> b.maxPaths(CliParsers.parsePositiveInt(raw, "--max-paths"))));
    specs.put(
        "--time-budget-ms",
        OptionSpec.withValue(
            (b, raw) -> b.timeBudgetMs(CliParsers.parseLong(raw, "--time-budget-ms"))));
    specs.put("--secrets", OptionSpec.withValue((b, raw) -> b.secrets(CliParsers.parseNames(raw))));
    specs.put("--policy", OptionSpec.withValue((b, raw) -> b.leakPolicy(raw)));
    specs.put("--solver", OptionSpec.withValue((b, raw) -> b.solver(SolverBackend.parse(raw))));
    specs.put("--spectre-stl", OptionSpec.flag(b -> b.spectreStl(true)));
    specs.put("--stop-at-first", OptionSpec.flag(b -> b.stopAtFirstLeak(true)));
    specs.put("--strict", OptionSpec.flag(b -> b.strict(true)));
    return specs;
  }

  private void logSummary(AnalysisResult result) {
    LOG.info(
        "{}: {} in {} ms",
        result.program().name(),
        result.leakFound() ? result.findings().size() + " leak(s) found" : "no leak found",
        result.elapsedMillis());
    result
        .exploration()
        .terminationReason()
        .ifPresent(reason -> LOG.warn("Result is incomplete: {}", reason));
    for (Finding finding : result.findings()) {
      LOG.info("  {}", finding.divergence().describe());
    }
  }

  private void writeReports(AnalysisResult result, CliOptions options) throws AnalysisException {
    try {
      if (options.jsonFile() != null) {
        DumpToFile.dump(new JsonReportBuilder().build(result), options.jsonFile());
        LOG.info("Wrote JSON report to {}", options.jsonFile());
      }
      if (result.findings().isEmpty()) {
        if (options.counterExampleFile() != null
            || options.dotFile() != null
            || options.smtFile() != null) {
          LOG.info("No counterexample to write");
        }
        return;
      }
      Finding first = result.findings().get(0);
      if (options.counterExampleFile() != null) {
        DumpToFile.dump(first.counterExample().report(), options.counterExampleFile());
        LOG.info("Wrote counterexample to {}", options.counterExampleFile());
      } else {
        LOG.info("Counterexample:\n{}", first.counterExample().report());
      }
      if (options.dotFile() != null) {
        first.counterExample().controlFlowGraph().renderToFile(options.dotFile());
        LOG.info("Wrote counterexample graph to {}", options.dotFile());
      }
      if (options.smtFile() != null) {
        DumpToFile.dump(SmtLibScript.of(first.query()).render(), options.smtFile());
        LOG.info("Wrote leak query to {}", options.smtFile());
      }
    } catch (IOException ex) {
      throw new AnalysisException(ErrorKind.IO, "cannot write report: " + ex.getMessage(), ex);
    }
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
