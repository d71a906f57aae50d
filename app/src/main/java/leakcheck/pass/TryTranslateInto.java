package leakcheck.pass;

import leakcheck.diagnostics.TranslationException;

/**
 * Fallible conversion of the receiver into another representation.
 *
 * <p>The target only exists on success; a failed translation produces nothing.
 */
@FunctionalInterface
public interface TryTranslateInto<T> {
  T tryTranslateInto() throws TranslationException;
}
