package com.verlumen.evolution.variation;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.bounding.Bounder;
import com.verlumen.evolution.population.Individual;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Redraws each gene, with the mutation rate's probability, uniformly between the bounder's limits
 * for that dimension. Needs a bounder with both limits; genes past the bounder's last dimension
 * are kept.
 */
public final class UniformMutation implements Variator {
  private final double mutationRate;

  public UniformMutation(double mutationRate) {
    checkArgument(
        mutationRate >= 0 && mutationRate <= 1, "Mutation rate must be in [0, 1]: %s", mutationRate);
    this.mutationRate = mutationRate;
  }

  @Override
  public ImmutableList<Individual> vary(
      ImmutableList<Individual> parents, Bounder bounder, Random random) {
    ImmutableList.Builder<Individual> mutants = ImmutableList.builderWithExpectedSize(parents.size());
    for (Individual parent : parents) {
      int dimensions = parent.candidate().size();
      Optional<ImmutableList<Double>> lower = bounder.lowerBounds(dimensions);
      Optional<ImmutableList<Double>> upper = bounder.upperBounds(dimensions);
      if (!lower.isPresent() || !upper.isPresent()) {
        throw new IllegalStateException("Uniform mutation needs lower and upper bounds");
      }
      List<Double> genes = new ArrayList<>(parent.candidate());
      int limit = Math.min(dimensions, Math.min(lower.get().size(), upper.get().size()));
      for (int j = 0; j < limit; j++) {
        if (random.nextDouble() <= mutationRate) {
          double lo = lower.get().get(j);
          double hi = upper.get().get(j);
          genes.set(j, lo + random.nextDouble() * (hi - lo));
        }
      }
      mutants.add(Individual.create(genes, parent.maximize()));
    }
    return mutants.build();
  }
}
