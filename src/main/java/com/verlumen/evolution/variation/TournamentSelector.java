package com.verlumen.evolution.variation;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.population.Individual;
import com.verlumen.evolution.population.Populations;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Runs one tournament per selected parent. Contestants are drawn without replacement; a tournament
 * larger than the population uses the whole population.
 */
public final class TournamentSelector implements Selector {
  private final int numSelected;
  private final int tournamentSize;

  public TournamentSelector(int numSelected, int tournamentSize) {
    checkArgument(numSelected > 0, "Number selected must be positive: %s", numSelected);
    checkArgument(tournamentSize > 0, "Tournament size must be positive: %s", tournamentSize);
    this.numSelected = numSelected;
    this.tournamentSize = tournamentSize;
  }

  @Override
  public ImmutableList<Individual> select(ImmutableList<Individual> population, Random random) {
    checkArgument(!population.isEmpty(), "Cannot select from an empty population");
    int size = Math.min(tournamentSize, population.size());
    List<Individual> contestants = new ArrayList<>(population);
    ImmutableList.Builder<Individual> selected = ImmutableList.builderWithExpectedSize(numSelected);
    for (int i = 0; i < numSelected; i++) {
      Collections.shuffle(contestants, random);
      selected.add(Populations.best(contestants.subList(0, size)));
    }
    return selected.build();
  }
}
