package io.b2mash.rental.leaseflow.proofing;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A {@link ProofRecord} together with its steps, answering ordering questions. Steps complete
 * strictly in {@link ProofStepName} order, so the completed steps always form a prefix.
 */
public final class ProofSequence {

  private final ProofRecord record;
  private final Map<ProofStepName, ProofStep> steps = new EnumMap<>(ProofStepName.class);

  public ProofSequence(ProofRecord record, List<ProofStep> steps) {
    this.record = Objects.requireNonNull(record, "record must not be null");
    steps.stream()
        .sorted(Comparator.comparingInt(ProofStep::getPosition))
        .forEach(step -> this.steps.put(step.getStepName(), step));
    if (this.steps.size() != ProofStepName.values().length) {
      throw new IllegalStateException(
          "Proof record " + record.getId() + " has " + this.steps.size() + " steps, expected 4");
    }
  }

  public ProofRecord record() {
    return record;
  }

  public ProofStep step(ProofStepName name) {
    return steps.get(name);
  }

  public List<ProofStep> steps() {
    return List.copyOf(steps.values());
  }

  public boolean isRecorded(ProofStepName name) {
    return steps.get(name).isCompleted();
  }

  /** The first step not yet completed, or null when all four are. */
  public ProofStepName nextExpectedStep() {
    for (var name : ProofStepName.values()) {
      if (!steps.get(name).isCompleted()) {
        return name;
      }
    }
    return null;
  }

  public int completedCount() {
    return (int) steps.values().stream().filter(ProofStep::isCompleted).count();
  }

  public boolean allStepsCompleted() {
    return nextExpectedStep() == null;
  }
}
