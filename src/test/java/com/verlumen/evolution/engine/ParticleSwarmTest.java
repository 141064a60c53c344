package com.verlumen.evolution.engine;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.benchmark.StyblinskiTang;
import com.verlumen.evolution.evaluation.SerialEvaluator;
import com.verlumen.evolution.generation.UniformGenerator;
import com.verlumen.evolution.observation.StatisticsLog;
import com.verlumen.evolution.population.Individual;
import com.verlumen.evolution.population.Populations;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParticleSwarmTest {
  private static final StyblinskiTang STYBLINSKI_TANG = new StyblinskiTang(2);

  @Test
  public void evolve_particlesStayWithinBounds() {
    EvolutionResult result = run(config(40, 3));

    for (Individual particle : result.population()) {
      for (double gene : particle.candidate()) {
        assertThat(gene).isAtLeast(0.0);
        assertThat(gene).isAtMost(1.0);
      }
    }
  }

  @Test
  public void evolve_archiveHoldsPersonalBests() {
    EvolutionResult result = run(config(25, 8));
    RunState state = result.finalState();

    assertThat(state.archive()).hasSize(state.population().size());
    for (int i = 0; i < state.population().size(); i++) {
      assertThat(state.archive().get(i).isWorseThan(state.population().get(i))).isFalse();
    }
  }

  @Test
  public void evolve_findsRegionOfGlobalMinimum() {
    EvolutionResult result = run(config(60, 17));

    Individual best = Populations.best(result.finalState().archive());

    // Basin minima in two dimensions are about -78.3, -64.2 and -50.1.
    assertThat(best.requireFitness()).isLessThan(-60.0);
  }

  @Test
  public void evolve_sameSeed_identicalRuns() {
    EvolutionConfig config = config(10, 5);

    assertThat(run(config).population()).isEqualTo(run(config).population());
  }

  private static EvolutionConfig config(int generations, long seed) {
    return EvolutionConfig.builder()
        .setAlgorithm(Algorithm.PARTICLE_SWARM)
        .setPopulationSize(20)
        .setMaximize(false)
        .setMaxGenerations(generations)
        .setSeed(seed)
        .build();
  }

  private static EvolutionResult run(EvolutionConfig config) {
    return new ParticleSwarm(
            config,
            new SerialEvaluator(STYBLINSKI_TANG),
            config.defaultTerminator(new StatisticsLog()),
            ImmutableList.of(),
            config.newRandom(),
            STYBLINSKI_TANG.bounder())
        .evolve(new UniformGenerator(2, STYBLINSKI_TANG.bounder()));
  }
}
