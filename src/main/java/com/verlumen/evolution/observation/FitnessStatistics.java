package com.verlumen.evolution.observation;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.math.Stats;
import com.verlumen.evolution.population.Individual;
import com.verlumen.evolution.population.Populations;
import java.util.Arrays;
import java.util.List;

/** Fitness summary of one population. */
@AutoValue
public abstract class FitnessStatistics {
  /** Fitness of the worst individual, respecting the maximize flag. */
  public abstract double worst();

  /** Fitness of the best individual, respecting the maximize flag. */
  public abstract double best();

  public abstract double median();

  public abstract double mean();

  /** Population standard deviation. */
  public abstract double standardDeviation();

  public static FitnessStatistics of(List<Individual> population) {
    checkArgument(!population.isEmpty(), "Cannot summarize an empty population");
    double[] fitnesses = new double[population.size()];
    for (int i = 0; i < fitnesses.length; i++) {
      fitnesses[i] = population.get(i).requireFitness();
    }
    Stats stats = Stats.of(fitnesses);
    return new AutoValue_FitnessStatistics(
        Populations.worst(population).requireFitness(),
        Populations.best(population).requireFitness(),
        median(fitnesses),
        stats.mean(),
        stats.populationStandardDeviation());
  }

  private static double median(double[] values) {
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    int middle = sorted.length / 2;
    return sorted.length % 2 == 1 ? sorted[middle] : (sorted[middle - 1] + sorted[middle]) / 2;
  }

  @Override
  public final String toString() {
    return String.format(
        "worst=%s best=%s median=%s mean=%s std=%s",
        worst(), best(), median(), mean(), standardDeviation());
  }
}
