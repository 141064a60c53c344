package com.verlumen.evolution.variation;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.bounding.Bounder;
import com.verlumen.evolution.population.Individual;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/** Adds Gaussian noise to each gene with the mutation rate's probability, then bounds. */
public final class GaussianMutation implements Variator {
  private final double mutationRate;
  private final double mean;
  private final double stdev;

  public GaussianMutation(double mutationRate, double mean, double stdev) {
    checkArgument(
        mutationRate >= 0 && mutationRate <= 1, "Mutation rate must be in [0, 1]: %s", mutationRate);
    checkArgument(stdev >= 0, "Standard deviation cannot be negative: %s", stdev);
    this.mutationRate = mutationRate;
    this.mean = mean;
    this.stdev = stdev;
  }

  @Override
  public ImmutableList<Individual> vary(
      ImmutableList<Individual> parents, Bounder bounder, Random random) {
    ImmutableList.Builder<Individual> mutants = ImmutableList.builderWithExpectedSize(parents.size());
    for (Individual parent : parents) {
      List<Double> genes = new ArrayList<>(parent.candidate());
      for (int j = 0; j < genes.size(); j++) {
        if (random.nextDouble() < mutationRate) {
          genes.set(j, genes.get(j) + mean + stdev * random.nextGaussian());
        }
      }
      mutants.add(Individual.create(bounder.bound(genes), parent.maximize()));
    }
    return mutants.build();
  }
}
