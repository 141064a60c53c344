package com.verlumen.evolution.population;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/** Static helpers over ordered collections of individuals. */
public final class Populations {
  /**
   * Returns the best individual. Fails with {@link java.util.NoSuchElementException} on an empty
   * population, and with {@link com.verlumen.evolution.ComparisonException} when an individual has
   * no fitness.
   */
  public static Individual best(List<Individual> population) {
    return Collections.max(population);
  }

  public static Individual worst(List<Individual> population) {
    return Collections.min(population);
  }

  /** Sorts from best to worst. The sort is stable, so equally fit individuals keep their order. */
  public static ImmutableList<Individual> rankBestFirst(List<Individual> population) {
    return ImmutableList.sortedCopyOf(Collections.reverseOrder(), population);
  }

  /** Builds evaluated individuals, skipping candidates whose fitness is undefined. */
  public static ImmutableList<Individual> evaluatedOnly(List<Individual> individuals) {
    ImmutableList.Builder<Individual> evaluated = ImmutableList.builder();
    for (Individual individual : individuals) {
      if (individual.hasFitness()) {
        evaluated.add(individual);
      }
    }
    return evaluated.build();
  }

  /** Builds one individual per candidate; an empty fitness leaves the individual unevaluated. */
  public static ImmutableList<Individual> fromBatch(
      List<ImmutableList<Double>> candidates,
      List<OptionalDouble> fitnesses,
      List<? extends Map<String, Double>> responses,
      boolean maximize) {
    checkArgument(
        candidates.size() == fitnesses.size() && candidates.size() == responses.size(),
        "Evaluation results are not aligned with %s candidates",
        candidates.size());
    ImmutableList.Builder<Individual> individuals =
        ImmutableList.builderWithExpectedSize(candidates.size());
    for (int i = 0; i < candidates.size(); i++) {
      OptionalDouble fitness = fitnesses.get(i);
      individuals.add(
          fitness.isPresent()
              ? Individual.evaluated(
                  candidates.get(i), maximize, fitness.getAsDouble(), responses.get(i))
              : Individual.create(candidates.get(i), maximize));
    }
    return individuals.build();
  }

  private Populations() {}
}
