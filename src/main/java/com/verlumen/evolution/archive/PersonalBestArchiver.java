package com.verlumen.evolution.archive;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.population.Individual;

/**
 * Keeps one entry per slot: the best individual that slot has ever held. The current individual
 * replaces the stored one unless it is strictly worse.
 */
public final class PersonalBestArchiver implements Archiver {
  @Override
  public ImmutableList<Individual> archive(
      ImmutableList<Individual> population, ImmutableList<Individual> archive) {
    if (archive.isEmpty()) {
      return population;
    }
    checkArgument(
        archive.size() == population.size(),
        "Archive holds %s entries for a population of %s",
        archive.size(),
        population.size());
    ImmutableList.Builder<Individual> updated = ImmutableList.builderWithExpectedSize(archive.size());
    for (int i = 0; i < population.size(); i++) {
      Individual current = population.get(i);
      Individual stored = archive.get(i);
      updated.add(current.isWorseThan(stored) ? stored : current);
    }
    return updated.build();
  }
}
