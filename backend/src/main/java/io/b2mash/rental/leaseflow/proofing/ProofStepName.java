package io.b2mash.rental.leaseflow.proofing;

import io.b2mash.rental.leaseflow.exception.InvalidStateException;
import java.util.Locale;

/** The four identity-proofing sub-steps, declared in the order every party must complete them. */
public enum ProofStepName {
  FACE,
  DOCUMENT,
  VOICE,
  SIGNATURE;

  /** 1-based position in the sequence. */
  public int position() {
    return ordinal() + 1;
  }

  /** Parses a step name case-insensitively ({@code "face"} and {@code "FACE"} both work). */
  public static ProofStepName parse(String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidStateException("Invalid step", "Step name is required");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException("Invalid step", "Unknown proofing step: " + value);
    }
  }
}
