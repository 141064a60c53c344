package com.verlumen.evolution.evaluation;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.OptionalDouble;

/** The outcome of evaluating a single candidate. */
@AutoValue
public abstract class Evaluation {
  /** Empty when the candidate could not be evaluated. */
  public abstract OptionalDouble fitness();

  /** Named auxiliary outputs reported alongside the fitness. */
  public abstract ImmutableMap<String, Double> responses();

  public static Evaluation of(double fitness) {
    return of(fitness, ImmutableMap.of());
  }

  /** A NaN fitness is treated as undefined. */
  public static Evaluation of(double fitness, Map<String, Double> responses) {
    if (Double.isNaN(fitness)) {
      return undefined();
    }
    return new AutoValue_Evaluation(OptionalDouble.of(fitness), ImmutableMap.copyOf(responses));
  }

  public static Evaluation undefined() {
    return new AutoValue_Evaluation(OptionalDouble.empty(), ImmutableMap.of());
  }

  public boolean isDefined() {
    return fitness().isPresent();
  }
}
