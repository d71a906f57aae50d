package leakcheck.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;

import leakcheck.config.Environment;
import leakcheck.config.SolverBackend;
import leakcheck.solver.z3.Z3Solver;
import org.junit.jupiter.api.Test;

final class SolversTest {

  @Test
  void environmentPicksTheBackend() {
    Environment defaults = Environment.defaults();
    Environment enumerating =
        defaults.withAnalysis(defaults.analysis().withSolver(SolverBackend.ENUMERATING));
    assertEquals("enumerating", Solvers.create(enumerating).name(), "Requested explicitly");

    String expected = Z3Solver.isAvailable() ? "z3" : "enumerating";
    assertEquals(expected, Solvers.create(defaults).name(), "Z3 unless it cannot load");
  }

  @Test
  void backendNamesParseLeniently() {
    assertEquals(SolverBackend.Z3, SolverBackend.parse(" Z3 "), "Case and space");
    assertEquals(SolverBackend.ENUMERATING, SolverBackend.parse("builtin"), "Alias");
    assertEquals("enumerating", SolverBackend.ENUMERATING.label(), "Label");
  }
}
