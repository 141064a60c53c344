package com.verlumen.evolution.bounding;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;

/**
 * Clamps every gene into {@code [lower, upper]}.
 *
 * <p>Each side is either a scalar, broadcast to the candidate length, or an explicit per-dimension
 * list. If either side is missing the bounder leaves candidates unchanged. Genes beyond the length
 * of an explicit list are left untouched.
 */
public final class RangeBounder implements Bounder {
  private final Limit lower;
  private final Limit upper;

  private RangeBounder(Limit lower, Limit upper) {
    this.lower = lower;
    this.upper = upper;
  }

  public static RangeBounder of(double lower, double upper) {
    checkArgument(lower <= upper, "Lower bound %s exceeds upper bound %s", lower, upper);
    return new RangeBounder(Limit.scalar(lower), Limit.scalar(upper));
  }

  public static RangeBounder of(List<Double> lower, List<Double> upper) {
    checkArgument(
        lower.size() == upper.size(),
        "Bound lists differ in length: %s vs %s",
        lower.size(),
        upper.size());
    for (int i = 0; i < lower.size(); i++) {
      checkArgument(
          lower.get(i) <= upper.get(i),
          "Lower bound %s exceeds upper bound %s at dimension %s",
          lower.get(i),
          upper.get(i),
          i);
    }
    return new RangeBounder(Limit.perDimension(lower), Limit.perDimension(upper));
  }

  /** Only a lower bound; clamping is a no-op until an upper bound exists as well. */
  public static RangeBounder lowerOnly(double lower) {
    return new RangeBounder(Limit.scalar(lower), null);
  }

  /** Only an upper bound; clamping is a no-op until a lower bound exists as well. */
  public static RangeBounder upperOnly(double upper) {
    return new RangeBounder(null, Limit.scalar(upper));
  }

  public static RangeBounder unbounded() {
    return new RangeBounder(null, null);
  }

  public boolean isBounded() {
    return lower != null && upper != null;
  }

  @Override
  public ImmutableList<Double> bound(List<Double> candidate) {
    checkNotNull(candidate, "Candidate cannot be null");
    if (!isBounded()) {
      return ImmutableList.copyOf(candidate);
    }
    int limit = Math.min(lower.length(candidate.size()), upper.length(candidate.size()));
    ImmutableList.Builder<Double> bounded = ImmutableList.builderWithExpectedSize(candidate.size());
    for (int i = 0; i < candidate.size(); i++) {
      double gene = candidate.get(i);
      if (i < limit) {
        gene = Math.max(Math.min(gene, upper.at(i)), lower.at(i));
      }
      bounded.add(gene);
    }
    return bounded.build();
  }

  @Override
  public Optional<ImmutableList<Double>> lowerBounds(int dimensions) {
    return isBounded() ? Optional.of(lower.expand(dimensions)) : Optional.empty();
  }

  @Override
  public Optional<ImmutableList<Double>> upperBounds(int dimensions) {
    return isBounded() ? Optional.of(upper.expand(dimensions)) : Optional.empty();
  }

  @Override
  public String toString() {
    return isBounded() ? "RangeBounder[" + lower + ", " + upper + "]" : "RangeBounder[unbounded]";
  }

  /** One side of the range. */
  private static final class Limit {
    private final Double scalar;
    private final ImmutableList<Double> values;

    private Limit(Double scalar, ImmutableList<Double> values) {
      this.scalar = scalar;
      this.values = values;
    }

    static Limit scalar(double value) {
      return new Limit(value, ImmutableList.of());
    }

    static Limit perDimension(List<Double> values) {
      return new Limit(null, ImmutableList.copyOf(values));
    }

    int length(int dimensions) {
      return scalar != null ? dimensions : values.size();
    }

    double at(int index) {
      return scalar != null ? scalar : values.get(index);
    }

    ImmutableList<Double> expand(int dimensions) {
      if (scalar == null) {
        return values;
      }
      ImmutableList.Builder<Double> expanded = ImmutableList.builderWithExpectedSize(dimensions);
      for (int i = 0; i < dimensions; i++) {
        expanded.add(scalar);
      }
      return expanded.build();
    }

    @Override
    public String toString() {
      return scalar != null ? scalar.toString() : values.toString();
    }
  }
}
