package leakcheck.cex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import leakcheck.config.CheckMode;
import leakcheck.diagnostics.AnalysisException;
import leakcheck.pipeline.AnalysisPipeline;
import leakcheck.pipeline.AnalysisResult;
import leakcheck.testing.TestPrograms;
import org.junit.jupiter.api.Test;

final class CounterExampleTest {

  @Test
  void reportListsTheAccessesWhereCompositionsPart() throws AnalysisException {
    AnalysisResult result =
        new AnalysisPipeline(TestPrograms.environment(CheckMode.NORMAL_ONLY))
            .analyze(TestPrograms.secretBranch());
    CounterExample counterExample = result.findings().get(0).counterExample();

    assertEquals(
        List.of(new Observation(1, 0x40, 1, false, false)),
        counterExample.observations(Composition.A),
        "A loads 0x40 once");
    assertTrue(counterExample.observations(Composition.B).isEmpty(), "B touches no memory");

    String report = counterExample.report();
    assertTrue(report.contains("accesses after 0 shared:"), report);
    assertTrue(report.contains("A block 1 0x40 line 0x1 miss"), report);
  }

  @Test
  void observerTellsAccessesApartByLineAndHit() {
    Observation load = new Observation(1, 0x40, 1, false, false);
    assertTrue(load.looksLike(new Observation(2, 0x7f, 1, false, true)), "Same line, both miss");
    assertFalse(load.looksLike(new Observation(1, 0x40, 1, true, false)), "A hit looks different");
  }
}
