package leakcheck.program;

/** Role of a transition at the end of its head block. */
public enum BranchKind {
  UNCONDITIONAL,
  TAKEN,
  FALL_THROUGH,
  CONDITIONAL
}
