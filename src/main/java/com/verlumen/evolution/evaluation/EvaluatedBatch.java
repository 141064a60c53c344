package com.verlumen.evolution.evaluation;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.OptionalDouble;

/** Fitness values and responses of a batch, index-aligned with the submitted candidates. */
@AutoValue
public abstract class EvaluatedBatch {
  public abstract ImmutableList<OptionalDouble> fitnesses();

  public abstract ImmutableList<ImmutableMap<String, Double>> responses();

  public static EvaluatedBatch of(List<Evaluation> evaluations) {
    ImmutableList.Builder<OptionalDouble> fitnesses = ImmutableList.builder();
    ImmutableList.Builder<ImmutableMap<String, Double>> responses = ImmutableList.builder();
    for (Evaluation evaluation : evaluations) {
      fitnesses.add(evaluation.fitness());
      responses.add(evaluation.responses());
    }
    return new AutoValue_EvaluatedBatch(fitnesses.build(), responses.build());
  }

  public int size() {
    return fitnesses().size();
  }
}
