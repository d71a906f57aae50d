package leakcheck.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.ir.Constant;
import leakcheck.ir.Expression;
import leakcheck.ir.ExpressionEvaluator;
import leakcheck.ir.Variable;
import leakcheck.solver.SolverResult.Status;
import org.junit.jupiter.api.Test;

final class EnumeratingSolverTest {
  private final EnumeratingSolver solver = EnumeratingSolver.defaults();

  @Test
  void findsAModelForNarrowVariables() throws SortMismatchException {
    Variable a = Variable.bitVector("a", 8);
    Variable flag = Variable.bool("flag");
    List<Expression> query =
        List.of(
            Expression.equal(
                Expression.add(a.toExpression(), Expression.bitVector(3, 8)),
                Expression.bitVector(10, 8)),
            flag.toExpression());

    SolverResult result = solver.check(query);
    assertEquals(Status.SAT, result.status(), "a = 7 satisfies the query");
    assertEquals(
        Constant.bitVector(7, 8), result.model().orElseThrow().get(a).orElseThrow(), "a = 7");
    for (Expression assertion : query) {
      assertTrue(
          ExpressionEvaluator.holds(assertion, result.model().orElseThrow()),
          "The model satisfies " + assertion);
    }
  }

  @Test
  void exhaustiveSearchProvesUnsatisfiability() throws SortMismatchException {
    Expression flag = Variable.bool("flag").toExpression();
    SolverResult result = solver.check(List.of(flag, Expression.not(flag)));
    assertEquals(Status.UNSAT, result.status(), "flag and not flag");
  }

  @Test
  void wideSearchWithoutModelIsUnknown() throws SortMismatchException {
    Expression wide = Variable.bitVector("wide", 64).toExpression();
    Expression product = Expression.mul(wide, Expression.bitVector(3, 64));
    SolverResult result =
        solver.check(List.of(Expression.equal(product, Expression.bitVector(0x1234567, 64))));
    assertEquals(
        Status.UNKNOWN, result.status(), "Boundary values do not cover 64-bit variables");
  }

  @Test
  void wideVariablesTryQueryConstants() throws SortMismatchException {
    Variable index = Variable.bitVector("index", 64);
    SolverResult result =
        solver.check(
            List.of(
                Expression.not(Expression.ult(index.toExpression(), Expression.bitVector(4, 64))),
                Expression.ult(index.toExpression(), Expression.bitVector(100, 64))));
    assertEquals(Status.SAT, result.status(), "A neighbour of 4 lies in [4, 100)");
  }

  @Test
  void nonBooleanAssertionIsRejected() {
    assertThrows(
        SortMismatchException.class,
        () -> solver.check(List.of(Expression.bitVector(1, 8))),
        "Assertions must be Boolean");
  }

  @Test
  void boundedSolverCountsQueries() throws SortMismatchException {
    BoundedSolver bounded = new BoundedSolver(solver, 2);
    bounded.check(List.of(Expression.bool(true)));
    bounded.check(List.of(Expression.bool(false)));
    assertEquals(2L, bounded.queries(), "Every check is counted");
    assertEquals("enumerating", bounded.name(), "Delegate name");
    assertThrows(
        IllegalArgumentException.class, () -> new BoundedSolver(solver, 0), "No permits");
  }
}
