package leakcheck.diagnostics;

/** A transform pass could not be applied. The target is left in an unspecified state. */
public class TransformException extends AnalysisException {
  private static final long serialVersionUID = 1L;

  private final String pass;

  public TransformException(String pass, String message) {
    super(ErrorKind.TRANSFORM, pass + ": " + message);
    this.pass = pass;
  }

  public TransformException(String pass, String message, Throwable cause) {
    super(ErrorKind.TRANSFORM, pass + ": " + message, cause);
    this.pass = pass;
  }

  public String pass() {
    return pass;
  }
}
