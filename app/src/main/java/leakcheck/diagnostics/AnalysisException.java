package leakcheck.diagnostics;

import java.util.Objects;

/**
 * Checked failure raised by validation, translation, transformation and reporting stages.
 *
 * <p>The message names the offending IR entity by its display rendering together with the violated
 * expectation.
 */
public class AnalysisException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;

  public AnalysisException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public AnalysisException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() {
    return kind;
  }

  /** Renders the failure as a one-line diagnostic, e.g. {@code error[sort-mismatch]: ...}. */
  public String diagnostic() {
    return "error[" + kind.label() + "]: " + getMessage();
  }
}
