package com.verlumen.evolution.replacement;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.population.Individual;

/**
 * One-to-one greedy replacement: slot {@code i} holds either the parent or the offspring created
 * for that slot. Slot identity is preserved across generations, which index-based donor sampling
 * relies on.
 */
public final class PositionalReplacer implements Replacer {
  private final SlotComparison comparison;

  public PositionalReplacer(SlotComparison comparison) {
    this.comparison = checkNotNull(comparison, "Slot comparison cannot be null");
  }

  public SlotComparison comparison() {
    return comparison;
  }

  @Override
  public ImmutableList<Individual> replace(
      ImmutableList<Individual> population, ImmutableList<Individual> offspring) {
    checkArgument(
        population.size() == offspring.size(),
        "Positional replacement needs one offspring per slot: %s parents, %s offspring",
        population.size(),
        offspring.size());
    ImmutableList.Builder<Individual> next = ImmutableList.builderWithExpectedSize(population.size());
    for (int i = 0; i < population.size(); i++) {
      Individual parent = population.get(i);
      Individual child = offspring.get(i);
      if (!child.hasFitness() || comparison.parentSurvives(parent, child)) {
        next.add(parent);
      } else {
        next.add(child);
      }
    }
    return next.build();
  }
}
