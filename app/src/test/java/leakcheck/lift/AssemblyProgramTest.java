package leakcheck.lift;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import leakcheck.diagnostics.AnalysisException;
import leakcheck.diagnostics.TranslationException;
import leakcheck.pass.TryTranslateFrom;
import leakcheck.program.BlockGraph;
import leakcheck.program.BranchKind;
import leakcheck.program.Operation;
import leakcheck.program.Program;
import leakcheck.testing.TestPrograms;
import org.junit.jupiter.api.Test;

final class AssemblyProgramTest {

  @Test
  void everyInstructionBecomesABlock() throws AnalysisException {
    Program program = MuasmParser.parse("v1", TestPrograms.SPECTRE_V1).tryTranslateInto();
    BlockGraph graph = program.graph();

    assertEquals(5, graph.vertexCount(), "Four instructions plus the exit block");
    assertEquals(0, graph.entry(), "Entry is the first instruction");
    assertTrue(graph.isExit(4), "Appended block is the exit");
    assertEquals(BranchKind.TAKEN, graph.edge(1, 4).orElseThrow().kind(), "beqz jumps to end");
    assertEquals(
        BranchKind.FALL_THROUGH, graph.edge(1, 2).orElseThrow().kind(), "beqz falls through");
    assertTrue(graph.containsEdge(0, 1), "Straight-line code falls through");
    assertEquals(
        Operation.Kind.LOAD,
        graph.block(2).operations().get(0).kind(),
        "load becomes a load operation");
    program.validate(true);
  }

  @Test
  void jumpsResolveLabelsAndAddresses() throws TranslationException {
    Program program =
        MuasmParser.parse("loop", "top:\n  skip\n  jmp top\n  jmp 0\n").tryTranslateInto();
    assertTrue(program.graph().containsEdge(1, 0), "Label target");
    assertTrue(program.graph().containsEdge(2, 0), "Numeric target");
    assertFalse(program.graph().containsEdge(1, 2), "Jumps do not fall through");
  }

  @Test
  void unknownTargetsAreRejected() throws TranslationException {
    AssemblyProgram unknown = MuasmParser.parse("p", "skip\njmp nowhere");
    TranslationException ex =
        assertThrows(TranslationException.class, unknown::tryTranslateInto, "Unknown label");
    assertTrue(ex.getMessage().startsWith("line 2: unknown label `nowhere`"), ex.getMessage());

    AssemblyProgram outside = MuasmParser.parse("p", "jmp 9");
    assertThrows(TranslationException.class, outside::tryTranslateInto, "Target past the exit");
  }

  @Test
  void derivedTranslationMatchesTheDirectOne() throws TranslationException {
    AssemblyProgram assembly = MuasmParser.parse("v1", TestPrograms.SPECTRE_V1);
    TryTranslateFrom<AssemblyProgram, Program> from = TryTranslateFrom.derived();

    Program direct = assembly.tryTranslateInto();
    Program derived = from.tryTranslateFrom(assembly);
    assertEquals(direct.graph().vertices(), derived.graph().vertices(), "Same blocks");
    assertEquals(direct.graph().edges(), derived.graph().edges(), "Same transitions");
  }

  @Test
  void derivedTranslationFailsLikeTheDirectOne() throws TranslationException {
    AssemblyProgram outside = MuasmParser.parse("p", "jmp 9");
    TryTranslateFrom<AssemblyProgram, Program> from = TryTranslateFrom.derived();

    TranslationException direct =
        assertThrows(TranslationException.class, outside::tryTranslateInto, "Direct direction");
    TranslationException derived =
        assertThrows(
            TranslationException.class, () -> from.tryTranslateFrom(outside), "Derived direction");
    assertEquals(direct.getMessage(), derived.getMessage(), "Same diagnosis");
  }

  @Test
  void printsBackAsAssembly() throws TranslationException {
    String text = MuasmParser.parse("p", "top: beqz r, top\nspbarr").toString();
    assertTrue(text.startsWith("top:\n  beqz r, top\n"), text);
    assertTrue(text.contains("  spbarr\n"), text);
  }
}
