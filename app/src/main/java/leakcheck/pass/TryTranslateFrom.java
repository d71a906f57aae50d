package leakcheck.pass;

import leakcheck.diagnostics.TranslationException;

/**
 * Fallible conversion from a source representation.
 *
 * <p>Implement {@link TryTranslateInto} on the source type and obtain this direction through
 * {@link #derived()}; there is no per-pair implementation of the reverse direction.
 */
@FunctionalInterface
public interface TryTranslateFrom<S, T> {

  T tryTranslateFrom(S source) throws TranslationException;

  /** Returns the "from" direction for every source that knows how to translate itself. */
  static <S extends TryTranslateInto<T>, T> TryTranslateFrom<S, T> derived() {
    return TryTranslateInto::tryTranslateInto;
  }
}
