package com.verlumen.evolution.replacement;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.verlumen.evolution.population.Individual;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class GenerationalReplacerTest {
  @Test
  public void replace_evaluatedOffspringReplaceParentsEvenWhenWorse() {
    Individual parent0 = individual(0.0, 10.0);
    Individual parent1 = individual(1.0, 10.0);
    Individual child0 = individual(0.5, 1.0);
    Individual child1 = Individual.create(ImmutableList.of(1.5), true);

    ImmutableList<Individual> next =
        new GenerationalReplacer()
            .replace(ImmutableList.of(parent0, parent1), ImmutableList.of(child0, child1));

    assertThat(next).containsExactly(child0, parent1).inOrder();
  }

  private static Individual individual(double gene, double fitness) {
    return Individual.evaluated(ImmutableList.of(gene), true, fitness, ImmutableMap.of());
  }
}
