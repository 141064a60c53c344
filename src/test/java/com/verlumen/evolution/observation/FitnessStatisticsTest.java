package com.verlumen.evolution.observation;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.verlumen.evolution.ComparisonException;
import com.verlumen.evolution.population.Individual;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FitnessStatisticsTest {
  @Test
  public void of_minimize_reportsBestAsLowest() {
    FitnessStatistics statistics = FitnessStatistics.of(population(false, 4.0, 1.0, 3.0, 2.0));

    assertThat(statistics.best()).isEqualTo(1.0);
    assertThat(statistics.worst()).isEqualTo(4.0);
    assertThat(statistics.median()).isEqualTo(2.5);
    assertThat(statistics.mean()).isEqualTo(2.5);
    assertThat(statistics.standardDeviation()).isWithin(1e-12).of(Math.sqrt(1.25));
  }

  @Test
  public void of_maximize_reportsBestAsHighest() {
    FitnessStatistics statistics = FitnessStatistics.of(population(true, 4.0, 1.0, 3.0));

    assertThat(statistics.best()).isEqualTo(4.0);
    assertThat(statistics.worst()).isEqualTo(1.0);
    assertThat(statistics.median()).isEqualTo(3.0);
  }

  @Test
  public void of_unevaluatedIndividual_throwsComparisonException() {
    ImmutableList<Individual> population =
        ImmutableList.of(Individual.create(ImmutableList.of(0.0), true));

    assertThrows(ComparisonException.class, () -> FitnessStatistics.of(population));
  }

  @Test
  public void of_emptyPopulation_throwsIllegalArgumentException() {
    assertThrows(IllegalArgumentException.class, () -> FitnessStatistics.of(ImmutableList.of()));
  }

  private static ImmutableList<Individual> population(boolean maximize, double... fitnesses) {
    ImmutableList.Builder<Individual> population = ImmutableList.builder();
    for (double fitness : fitnesses) {
      population.add(
          Individual.evaluated(ImmutableList.of(fitness), maximize, fitness, ImmutableMap.of()));
    }
    return population.build();
  }
}
