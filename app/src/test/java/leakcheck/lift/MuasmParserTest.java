package leakcheck.lift;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import leakcheck.diagnostics.AnalysisException;
import leakcheck.diagnostics.ErrorKind;
import leakcheck.diagnostics.TranslationException;
import leakcheck.ir.Assignment;
import leakcheck.ir.Constant;
import leakcheck.ir.ExpressionEvaluator;
import leakcheck.ir.Variable;
import leakcheck.lift.AssemblyInstruction.Opcode;
import leakcheck.testing.TestPrograms;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class MuasmParserTest {

  @Test
  void parsesTheSpectreGadget() throws TranslationException {
    AssemblyProgram program = MuasmParser.parse("v1", TestPrograms.SPECTRE_V1);

    assertEquals(4, program.instructions().size(), "Comment and label lines carry no code");
    assertEquals(Map.of("end", 4), program.labels(), "Trailing label marks the exit");
    List<Opcode> opcodes =
        program.instructions().stream().map(AssemblyInstruction::opcode).toList();
    assertEquals(
        List.of(Opcode.ASSIGN, Opcode.BRANCH_IF_ZERO, Opcode.LOAD, Opcode.LOAD),
        opcodes,
        "One instruction per line");
    assertEquals(3, program.instructions().get(1).line(), "Line numbers are kept");
  }

  @Test
  void tokenizerSplitsOperatorsAndSkipsComments() throws TranslationException {
    assertEquals(
        List.of("r", "<-", "a", ">>>", "0x1F", "<=", "b"),
        MuasmParser.tokenize("r <- a >>> 0x1F <= b  // trailing", 1),
        "Longest operator wins");
    assertEquals(List.of(), MuasmParser.tokenize("# whole line", 1), "Comment-only line");
  }

  @Test
  void precedenceFollowsC() throws TranslationException {
    AssemblyProgram program = MuasmParser.parse("p", "r <- 1 + 2 * 3 == 7 ? 10 : 20 - 1");
    Constant value =
        ExpressionEvaluator.evaluate(
                program.instructions().get(0).expression().orElseThrow(), Assignment.empty())
            .orElseThrow();
    assertEquals(Constant.bitVector(10, 64), value, "Multiplication binds tighter than equality");
  }

  @Test
  void comparisonsAreUnsignedFlags() throws TranslationException {
    AssemblyProgram program = MuasmParser.parse("p", "r <- a < 1");
    Variable a = Variable.bitVector("a", 64);
    Assignment minusOne = Assignment.of(Map.of(a, Constant.truncating(-1, 64)));
    assertEquals(
        Constant.zero(64),
        ExpressionEvaluator.evaluate(
                program.instructions().get(0).expression().orElseThrow(), minusOne)
            .orElseThrow(),
        "All ones is the largest unsigned value");
  }

  @Test
  void conditionalMoveAndStoreParse() throws TranslationException {
    AssemblyProgram program =
        MuasmParser.parse("p", "cmov c > 2, r <- r + 1\nstore r, base + 8\nspbarr\nflush\nskip");
    AssemblyInstruction cmov = program.instructions().get(0);
    assertEquals(Opcode.CONDITIONAL_ASSIGN, cmov.opcode(), "cmov");
    assertEquals("r", cmov.register().orElseThrow().name(), "cmov target register");
    assertTrue(cmov.condition().isPresent(), "cmov keeps its condition");
    assertEquals(Opcode.STORE, program.instructions().get(1).opcode(), "store");
    assertEquals(Opcode.BARRIER, program.instructions().get(2).opcode(), "spbarr");
    assertEquals(Opcode.FLUSH, program.instructions().get(3).opcode(), "flush");
    assertEquals(Opcode.SKIP, program.instructions().get(4).opcode(), "skip");
  }

  @Test
  void errorsNameTheLine() {
    TranslationException missingArrow =
        assertThrows(
            TranslationException.class,
            () -> MuasmParser.parse("p", "skip\nfrob r1"),
            "Unknown mnemonic reads as a broken assignment");
    assertTrue(missingArrow.getMessage().startsWith("line 2: "), missingArrow.getMessage());

    TranslationException duplicate =
        assertThrows(
            TranslationException.class,
            () -> MuasmParser.parse("p", "l:\nskip\nl: skip"),
            "Labels are unique");
    assertTrue(duplicate.getMessage().contains("duplicate label `l`"), duplicate.getMessage());

    TranslationException tooWide =
        assertThrows(
            TranslationException.class,
            () -> MuasmParser.parse("p", "r <- 0x1_0000_0000_0000_0000"),
            "Literals are 64-bit");
    assertTrue(tooWide.getMessage().startsWith("line 1: number"), tooWide.getMessage());

    assertThrows(
        TranslationException.class,
        () -> MuasmParser.parse("p", "r <- a @ b"),
        "Unknown character");
    assertThrows(
        TranslationException.class, () -> MuasmParser.parse("p", "skip skip"), "Trailing tokens");
  }

  @Test
  void readsFilesAndNamesProgramsAfterThem(@TempDir Path dir)
      throws IOException, AnalysisException {
    Path file = dir.resolve("gadget.muasm");
    Files.writeString(file, TestPrograms.SPECTRE_V1);
    assertEquals("gadget", MuasmParser.parse(file).name(), "Extension dropped");

    AnalysisException missing =
        assertThrows(
            AnalysisException.class,
            () -> MuasmParser.parse(dir.resolve("absent.muasm")),
            "Missing file");
    assertEquals(ErrorKind.IO, missing.kind(), "Reported as an I/O error");
  }
}
