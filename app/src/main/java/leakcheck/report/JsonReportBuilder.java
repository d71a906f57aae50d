package leakcheck.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import leakcheck.cex.CompositionTrace;
import leakcheck.cex.Effect;
import leakcheck.cex.Observation;
import leakcheck.cex.TraceStep;
import leakcheck.exec.Divergence;
import leakcheck.exec.ExplorationResult;
import leakcheck.exec.ExplorationStats;
import leakcheck.exec.Finding;
import leakcheck.ir.Assignment;
import leakcheck.pass.PassPipeline.PassTiming;
import leakcheck.pipeline.AnalysisResult;
import leakcheck.uarch.MicroarchitecturalState;

/** Machine-readable summary of an analysis run. */
public final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

  public String build(AnalysisResult result) {
    ExplorationResult exploration = result.exploration();
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(result));
    root.put("leak_found", exploration.leakFound());
    root.put("exploration", stats(exploration.stats()));
    root.put("passes", passes(result.passTimings()));
    root.put("findings", findings(exploration.findings()));
    exploration.terminationReason().ifPresent(reason -> root.put("termination_reason", reason));
    return gson.toJson(root);
  }

  private Map<String, Object> meta(AnalysisResult result) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("program", result.program().name());
    meta.put("time_ms", result.elapsedMillis());
    meta.put("block_count", result.program().graph().vertexCount());
    meta.put("edge_count", result.program().graph().edgeCount());
    meta.put("solver_queries", result.solverQueries());
    meta.put("complete", result.exploration().complete());
    return meta;
  }

  private Map<String, Object> stats(ExplorationStats.Snapshot stats) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("paths_completed", stats.pathsCompleted());
    map.put("paths_abandoned", stats.pathsAbandoned());
    map.put("blocks_executed", stats.blocksExecuted());
    map.put("branches", stats.branches());
    map.put("speculative_runs", stats.speculativeRuns());
    map.put("divergence_checks", stats.divergenceChecks());
    map.put("divergences", stats.divergences());
    map.put("cache_hits", stats.cacheHits());
    map.put("cache_misses", stats.cacheMisses());
    map.put("undecided_queries", stats.undecidedQueries());
    return map;
  }

  private List<Map<String, Object>> passes(List<PassTiming> timings) {
    List<Map<String, Object>> list = new ArrayList<>();
    for (PassTiming timing : timings) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("pass", timing.pass());
      map.put("time_ms", timing.millis());
      list.add(map);
    }
    return list;
  }

  private List<Map<String, Object>> findings(List<Finding> findings) {
    List<Map<String, Object>> list = new ArrayList<>();
    for (Finding finding : findings) {
      Divergence divergence = finding.divergence();
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("kind", divergence.kind().label());
      map.put("branch_block", divergence.branchBlock());
      map.put("leaking_successor", divergence.leakingSuccessor());
      map.put("reference_successor", divergence.referenceSuccessor());
      map.put("components", divergence.components());
      map.put("description", divergence.describe());
      map.put("compositions", List.of(trace(divergence.first()), trace(divergence.second())));
      list.add(map);
    }
    return list;
  }

  private Map<String, Object> trace(CompositionTrace trace) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("composition", trace.composition().name());
    map.put("inputs", inputs(trace.inputs()));
    List<Map<String, Object>> steps = new ArrayList<>();
    for (TraceStep step : trace.steps()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("block", step.block());
      entry.put("transient", step.transientStep());
      entry.put("effects", step.effects().stream().map(Effect::toString).toList());
      steps.add(entry);
    }
    map.put("steps", steps);
    List<Map<String, Object>> observations = new ArrayList<>();
    for (Observation observation : trace.observations()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("block", observation.block());
      entry.put("address", observation.address());
      entry.put("line", observation.line());
      entry.put("hit", observation.hit());
      entry.put("transient", observation.transientAccess());
      observations.add(entry);
    }
    map.put("observations", observations);
    map.put("final_state", state(trace.finalState()));
    return map;
  }

  private Map<String, String> inputs(Assignment inputs) {
    Map<String, String> map = new LinkedHashMap<>();
    inputs.values().forEach((variable, value) -> map.put(variable.name(), value.toString()));
    return map;
  }

  private Map<String, Object> state(MicroarchitecturalState state) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("cache", state.cache().toString());
    map.put("cached_lines", new ArrayList<>(state.cache().cachedLines()));
    state.predictor().btb().ifPresent(btb -> map.put("btb", btb.toString()));
    map.put("pht", state.predictor().pht().toString());
    return map;
  }
}
