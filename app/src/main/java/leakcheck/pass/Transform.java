package leakcheck.pass;

import leakcheck.diagnostics.TransformException;

/**
 * A pass that mutates its target in place.
 *
 * <p>When {@link #transform} fails the target is in an unspecified state; callers that need to fall
 * back keep their own snapshot (see {@link PassPipeline}).
 */
public interface Transform<T> {

  /** Short name used in logs and diagnostics. */
  String name();

  /** One-line description of what the pass does. */
  String description();

  void transform(T target) throws TransformException;
}
