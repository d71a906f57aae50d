package leakcheck.uarch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;
import leakcheck.diagnostics.SortMismatchException;
import leakcheck.ir.Assignment;
import leakcheck.ir.Constant;
import leakcheck.ir.Expression;
import leakcheck.ir.ExpressionEvaluator;
import leakcheck.ir.Variable;
import org.junit.jupiter.api.Test;

final class MemoryTest {

  @Test
  void wordsAreStoredLittleEndian() throws SortMismatchException {
    Memory memory = new Memory(64, Optional.empty());
    memory.store(Expression.bitVector(0x100, 64), Expression.bitVector(0x1122, 16));

    assertEquals(
        Expression.bitVector(0x22, 8),
        memory.load(Expression.bitVector(0x100, 64), 8),
        "Low byte first");
    assertEquals(
        Expression.bitVector(0x1122, 16),
        memory.load(Expression.bitVector(0x100, 64), 16),
        "Two bytes read back as the stored word");
  }

  @Test
  void untouchedBytesAreInputs() throws SortMismatchException {
    Memory memory = new Memory(64, Optional.empty());
    Expression value = memory.load(Expression.bitVector(0x10, 64), 8);

    assertEquals(Memory.byteVariable(0x10).toExpression(), value, "Initial byte variable");
    assertTrue(
        value.variable().name().startsWith(Memory.BYTE_PREFIX), "Named after its address");

    Memory zeroed = new Memory(64, Optional.of(0));
    assertEquals(
        Expression.bitVector(0, 8),
        zeroed.load(Expression.bitVector(0x10, 64), 8),
        "Configured default byte");
  }

  @Test
  void symbolicStoreMayAlias() throws SortMismatchException {
    Memory memory = new Memory(64, Optional.of(0));
    Variable pointer = Variable.bitVector("p", 64);
    memory.store(pointer.toExpression(), Expression.bitVector(0xAB, 8));
    Expression value = memory.load(Expression.bitVector(0x20, 64), 8);

    Assignment aliasing = Assignment.of(Map.of(pointer, Constant.bitVector(0x20, 64)));
    Assignment apart = Assignment.of(Map.of(pointer, Constant.bitVector(0x21, 64)));
    assertEquals(
        Constant.bitVector(0xAB, 8),
        ExpressionEvaluator.evaluate(value, aliasing).orElseThrow(),
        "Read sees the store when the pointer matches");
    assertEquals(
        Constant.bitVector(0, 8),
        ExpressionEvaluator.evaluate(value, apart).orElseThrow(),
        "Read sees the default byte otherwise");
  }
}
