package leakcheck.diagnostics;

/** A construct of the source representation could not be expressed in the target one. */
public class TranslationException extends AnalysisException {
  private static final long serialVersionUID = 1L;

  public TranslationException(String message) {
    super(ErrorKind.TRANSLATION, message);
  }

  public TranslationException(String message, Throwable cause) {
    super(ErrorKind.TRANSLATION, message, cause);
  }
}
