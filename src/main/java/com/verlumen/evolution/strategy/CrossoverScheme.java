package com.verlumen.evolution.strategy;

import java.util.Random;

/** Decides which genes of the target receive the mutated value. */
public enum CrossoverScheme {
  /**
   * Walks forward from a random gene, wrapping around, and mutates a contiguous run. The walk stops
   * as soon as a uniform draw exceeds the crossover rate, so at least one and at most all genes
   * are mutated.
   */
  EXPONENTIAL("exp") {
    @Override
    void cross(
        double[] trial, Donors donors, MutationRule rule, double scale, double rate, Random random) {
      int dimensions = trial.length;
      int n = random.nextInt(dimensions);
      int walked = 0;
      while (walked < dimensions) {
        trial[n] = rule.mutate(n, trial, donors, scale);
        n = (n + 1) % dimensions;
        walked++;
        if (rate < random.nextDouble()) {
          break;
        }
      }
    }
  },

  /**
   * Picks one random gene and, for each of the D steps, overwrites that same gene when a uniform
   * draw falls below the crossover rate. The last step always overwrites it.
   */
  BINOMIAL("bin") {
    @Override
    void cross(
        double[] trial, Donors donors, MutationRule rule, double scale, double rate, Random random) {
      int dimensions = trial.length;
      int n = random.nextInt(dimensions);
      for (int step = 0; step < dimensions; step++) {
        double draw = random.nextDouble();
        if (draw < rate || step + 1 == dimensions) {
          trial[n] = rule.mutate(n, trial, donors, scale);
        }
      }
    }
  };

  private final String label;

  CrossoverScheme(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  abstract void cross(
      double[] trial, Donors donors, MutationRule rule, double scale, double rate, Random random);

  static CrossoverScheme fromLabel(String label) {
    for (CrossoverScheme scheme : values()) {
      if (scheme.label.equals(label)) {
        return scheme;
      }
    }
    throw new IllegalArgumentException("Unknown crossover scheme: " + label);
  }
}
