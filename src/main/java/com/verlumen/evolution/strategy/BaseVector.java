package com.verlumen.evolution.strategy;

/** Where the mutant vector starts from. */
public enum BaseVector {
  BEST("best"),
  RAND("rand"),
  RAND_TO_BEST("rand-to-best");

  private final String label;

  BaseVector(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  static BaseVector fromLabel(String label) {
    for (BaseVector base : values()) {
      if (base.label.equals(label)) {
        return base;
      }
    }
    throw new IllegalArgumentException("Unknown base vector: " + label);
  }
}
