package leakcheck.uarch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class PredictorTest {

  @Test
  void countersSaturate() {
    PatternHistoryTable pht = new PatternHistoryTable(2, 0);
    assertEquals(1, pht.initialCounter(), "Weakly not taken");
    assertFalse(pht.predict(0x10, 0), "Initial prediction is not taken");

    for (int i = 0; i < 5; i++) {
      pht.update(0x10, 0, true);
    }
    assertEquals(pht.maxCounter(), pht.counter(0x10, 0), "Counter saturates at the top");
    assertTrue(pht.predict(0x10, 0), "Trained towards taken");

    for (int i = 0; i < 5; i++) {
      pht.update(0x10, 0, false);
    }
    assertEquals(0, pht.counter(0x10, 0), "Counter saturates at zero");
  }

  @Test
  void historySelectsTheCounter() {
    Predictor predictor =
        new Predictor(
            new PatternHistoryTable(2, 2), new BranchTargetBuffer(4), PredictorStrategy.MODEL);
    predictor.update(0x20, true, 0x40);
    assertEquals(1L, predictor.history(), "One taken branch in the history");
    assertEquals(
        2, predictor.pht().counter(0x20, 0), "Counter of the empty history was trained");
    assertEquals(
        1, predictor.pht().counter(0x20, 1), "Counter of the new history is untouched");
    assertEquals(0x40L, predictor.predict(0x20).target().orElseThrow(), "BTB learned the target");
  }

  @Test
  void modelStrategyMispredictsOnlyAgainstTheTable() {
    Predictor model =
        new Predictor(new PatternHistoryTable(2, 0), null, PredictorStrategy.MODEL);
    assertTrue(model.mayMispredict(0x30, true), "Predicted not taken, actually taken");
    assertFalse(model.mayMispredict(0x30, false), "Prediction matches");

    Predictor adversarial =
        new Predictor(new PatternHistoryTable(2, 0), null, PredictorStrategy.ALWAYS_MISPREDICT);
    assertTrue(adversarial.mayMispredict(0x30, false), "Every direction may be mispredicted");
  }

  @Test
  void branchTargetBufferEvictsTheOldestEntry() {
    BranchTargetBuffer btb = new BranchTargetBuffer(2);
    btb.update(1, 10);
    btb.update(2, 20);
    btb.update(3, 30);

    assertTrue(btb.predict(1).isEmpty(), "Oldest entry evicted");
    assertEquals(30L, btb.predict(3).getAsLong(), "Newest entry present");
  }
}
