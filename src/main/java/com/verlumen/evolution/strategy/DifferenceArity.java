package com.verlumen.evolution.strategy;

/** Number of difference vectors added to the base vector. */
public enum DifferenceArity {
  ONE(1),
  TWO(2);

  private final int count;

  DifferenceArity(int count) {
    this.count = count;
  }

  public int count() {
    return count;
  }

  static DifferenceArity fromCount(int count) {
    for (DifferenceArity arity : values()) {
      if (arity.count == count) {
        return arity;
      }
    }
    throw new IllegalArgumentException("Unsupported number of difference vectors: " + count);
  }
}
