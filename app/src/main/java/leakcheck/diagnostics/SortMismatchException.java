package leakcheck.diagnostics;

/** An operand or guard has a sort other than the one its context requires. */
public class SortMismatchException extends AnalysisException {
  private static final long serialVersionUID = 1L;

  public SortMismatchException(String message) {
    super(ErrorKind.SORT_MISMATCH, message);
  }
}
