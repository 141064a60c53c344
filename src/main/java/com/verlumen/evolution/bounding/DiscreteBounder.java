package com.verlumen.evolution.bounding;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Snaps every gene to the nearest member of a fixed list of attainable values. When a gene is
 * equally far from several values, the one listed first wins.
 *
 * <p>With values {@code [1, 4, 8, 16]} the candidate {@code [6, 10, 13, 3, 4, 0, 1, 12, 2]} becomes
 * {@code [4, 8, 16, 4, 4, 1, 1, 8, 1]}.
 */
public final class DiscreteBounder implements Bounder {
  private final ImmutableList<Double> values;
  private final double lowest;
  private final double highest;

  private DiscreteBounder(ImmutableList<Double> values) {
    this.values = values;
    this.lowest = Collections.min(values);
    this.highest = Collections.max(values);
  }

  public static DiscreteBounder of(List<Double> values) {
    checkNotNull(values, "Values cannot be null");
    checkArgument(!values.isEmpty(), "At least one attainable value is required");
    return new DiscreteBounder(ImmutableList.copyOf(values));
  }

  public ImmutableList<Double> values() {
    return values;
  }

  @Override
  public ImmutableList<Double> bound(List<Double> candidate) {
    checkNotNull(candidate, "Candidate cannot be null");
    ImmutableList.Builder<Double> bounded = ImmutableList.builderWithExpectedSize(candidate.size());
    for (double gene : candidate) {
      bounded.add(closest(gene));
    }
    return bounded.build();
  }

  @Override
  public Optional<ImmutableList<Double>> lowerBounds(int dimensions) {
    return Optional.of(ImmutableList.copyOf(Collections.nCopies(dimensions, lowest)));
  }

  @Override
  public Optional<ImmutableList<Double>> upperBounds(int dimensions) {
    return Optional.of(ImmutableList.copyOf(Collections.nCopies(dimensions, highest)));
  }

  private double closest(double target) {
    double best = values.get(0);
    double bestDistance = Math.abs(best - target);
    for (int i = 1; i < values.size(); i++) {
      double distance = Math.abs(values.get(i) - target);
      // Strict comparison keeps the earliest value on ties.
      if (distance < bestDistance) {
        best = values.get(i);
        bestDistance = distance;
      }
    }
    return best;
  }

  @Override
  public String toString() {
    return "DiscreteBounder" + values;
  }
}
