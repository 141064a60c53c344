package com.verlumen.evolution.replacement;

import com.verlumen.evolution.population.Individual;

/** How {@link PositionalReplacer} decides whether the parent keeps its slot. */
public enum SlotComparison {
  /**
   * Compares absolute fitness values. Under maximization the parent survives when its magnitude is
   * strictly larger, under minimization when it is strictly smaller. This ignores sign, so it only
   * agrees with the fitness ordering for non-negative fitness values.
   */
  MAGNITUDE {
    @Override
    boolean parentSurvives(Individual parent, Individual offspring) {
      double parentMagnitude = Math.abs(parent.requireFitness());
      double offspringMagnitude = Math.abs(offspring.requireFitness());
      return parent.maximize()
          ? parentMagnitude > offspringMagnitude
          : parentMagnitude < offspringMagnitude;
    }
  },

  /** The parent survives when it is strictly better under the maximize-aware ordering. */
  FITNESS {
    @Override
    boolean parentSurvives(Individual parent, Individual offspring) {
      return parent.isBetterThan(offspring);
    }
  };

  abstract boolean parentSurvives(Individual parent, Individual offspring);
}
