package leakcheck.cex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import leakcheck.program.Block;
import leakcheck.program.Operation;

/** A program block inside a counterexample, annotated per composition. */
public final class AnnotatedBlock {

  /** What one composition did in this block. */
  public static final class Annotation {
    private boolean executed;
    private final List<Effect> effects = new ArrayList<>();

    public boolean executed() {
      return executed;
    }

    public void markExecuted() {
      executed = true;
    }

    public List<Effect> effects() {
      return Collections.unmodifiableList(effects);
    }

    public void addEffect(Effect effect) {
      effects.add(Objects.requireNonNull(effect, "effect"));
    }

    Annotation copy() {
      Annotation copy = new Annotation();
      copy.executed = executed;
      copy.effects.addAll(effects);
      return copy;
    }
  }

  private final Block block;
  private boolean transientBlock;
  private String divergence;
  private final Map<Composition, Annotation> annotations = new EnumMap<>(Composition.class);

  public AnnotatedBlock(Block block) {
    this.block = Objects.requireNonNull(block, "block");
  }

  public int index() {
    return block.index();
  }

  public Block block() {
    return block;
  }

  public boolean isTransient() {
    return transientBlock;
  }

  public void setTransient(boolean transientBlock) {
    this.transientBlock = transientBlock;
  }

  public Optional<Annotation> annotation(Composition composition) {
    return Optional.ofNullable(annotations.get(composition));
  }

  public Annotation annotationFor(Composition composition) {
    return annotations.computeIfAbsent(composition, c -> new Annotation());
  }

  /** Executed by at least one composition. */
  public boolean executed() {
    return annotations.values().stream().anyMatch(Annotation::executed);
  }

  public Optional<String> divergence() {
    return Optional.ofNullable(divergence);
  }

  public void markDivergence(String description) {
    this.divergence = Objects.requireNonNull(description, "description");
  }

  public String fillColor() {
    if (executed()) {
      return transientBlock ? "#e1e1e1ff" : "#ffddccff";
    }
    return transientBlock ? "#e1e1e155" : "#ffddcc55";
  }

  public String fontColor() {
    return executed() ? "#343434ff" : "#34343455";
  }

  public AnnotatedBlock copy() {
    AnnotatedBlock copy = new AnnotatedBlock(block);
    copy.transientBlock = transientBlock;
    copy.divergence = divergence;
    annotations.forEach(
        (composition, annotation) -> copy.annotations.put(composition, annotation.copy()));
    return copy;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("[ Block: ").append(block.label());
    if (transientBlock) {
      sb.append(", Transient");
    }
    sb.append(" ]\n");
    for (Operation operation : block.operations()) {
      sb.append(operation).append('\n');
    }
    annotations.forEach(
        (composition, annotation) -> {
          for (Effect effect : annotation.effects()) {
            sb.append(composition).append(": ").append(effect).append('\n');
          }
        });
    if (divergence != null) {
      sb.append("divergence: ").append(divergence).append('\n');
    }
    return sb.toString();
  }
}
