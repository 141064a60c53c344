package com.verlumen.evolution.bounding;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;

/** Enforces per-dimension constraints on a candidate. */
public interface Bounder {
  /**
   * Returns the bounded copy of {@code candidate}. The input list is never modified.
   *
   * @param candidate the candidate to bound
   * @return a candidate of the same length whose genes satisfy the constraints
   */
  ImmutableList<Double> bound(List<Double> candidate);

  /** Per-dimension lower bounds for a candidate of the given length, empty when unbounded. */
  Optional<ImmutableList<Double>> lowerBounds(int dimensions);

  /** Per-dimension upper bounds for a candidate of the given length, empty when unbounded. */
  Optional<ImmutableList<Double>> upperBounds(int dimensions);
}
