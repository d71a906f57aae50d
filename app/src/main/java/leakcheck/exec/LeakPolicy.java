package leakcheck.exec;

/** Decides whether an observed divergence counts as a leak worth reporting. */
@FunctionalInterface
public interface LeakPolicy {
  boolean isLeak(Divergence divergence);
}
