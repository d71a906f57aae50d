package leakcheck.pass;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.UnaryOperator;
import leakcheck.diagnostics.AnalysisException;
import leakcheck.diagnostics.TransformException;
import leakcheck.util.Timing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs transforms in order over one target.
 *
 * <p>A snapshot is taken before every pass. When a pass fails, or leaves a {@link Validate} target
 * invalid while {@code validateAfterEachPass} is set, the target is restored from that snapshot
 * (if a restorer was given) and the failure is rethrown.
 */
public final class PassPipeline<T> {
  private static final Logger LOG = LoggerFactory.getLogger(PassPipeline.class);

  /** Wall-clock time of a single pass. */
  public record PassTiming(String pass, long millis) {}

  private final List<Transform<T>> passes;
  private final UnaryOperator<T> snapshotter;
  private final BiConsumer<T, T> restorer;
  private final boolean validateAfterEachPass;

  public PassPipeline(
      List<Transform<T>> passes,
      UnaryOperator<T> snapshotter,
      BiConsumer<T, T> restorer,
      boolean validateAfterEachPass) {
    this.passes = List.copyOf(Objects.requireNonNull(passes, "passes"));
    this.snapshotter = Objects.requireNonNull(snapshotter, "snapshotter");
    this.restorer = restorer;
    this.validateAfterEachPass = validateAfterEachPass;
  }

  public List<Transform<T>> passes() {
    return passes;
  }

  public List<PassTiming> run(T target) throws AnalysisException {
    List<PassTiming> timings = new ArrayList<>(passes.size());
    for (Transform<T> pass : passes) {
      T snapshot = snapshotter.apply(target);
      Timing timing = Timing.start();
      LOG.debug("Running pass {}: {}", pass.name(), pass.description());
      try {
        pass.transform(target);
        if (validateAfterEachPass && target instanceof Validate validatable) {
          validatable.validate();
        }
      } catch (TransformException ex) {
        rollback(pass, target, snapshot, ex);
        throw ex;
      } catch (AnalysisException ex) {
        rollback(pass, target, snapshot, ex);
        throw new TransformException(
            pass.name(), "left the target invalid: " + ex.getMessage(), ex);
      }
      long millis = timing.elapsedMillis();
      timings.add(new PassTiming(pass.name(), millis));
      LOG.info("Pass {} finished in {} ms", pass.name(), millis);
    }
    return timings;
  }

  private void rollback(Transform<T> pass, T target, T snapshot, AnalysisException cause) {
    if (restorer == null) {
      LOG.warn("Pass {} failed, target left as is: {}", pass.name(), cause.getMessage());
      return;
    }
    restorer.accept(target, snapshot);
    LOG.warn("Pass {} failed, target restored: {}", pass.name(), cause.getMessage());
  }
}
