package com.verlumen.evolution.engine;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.archive.Archiver;
import com.verlumen.evolution.archive.PersonalBestArchiver;
import com.verlumen.evolution.bounding.Bounder;
import com.verlumen.evolution.evaluation.Evaluator;
import com.verlumen.evolution.observation.Observer;
import com.verlumen.evolution.population.Individual;
import com.verlumen.evolution.population.Populations;
import com.verlumen.evolution.replacement.GenerationalReplacer;
import com.verlumen.evolution.replacement.Replacer;
import com.verlumen.evolution.termination.Terminator;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Particle swarm optimization with a star topology. Velocity is implicit: the move of a particle is
 * the difference between its current and previous positions, scaled by the inertia. The archive
 * holds each particle's personal best and the neighborhood best is the best of the archive.
 */
public final class ParticleSwarm extends EvolutionaryComputation {
  private final Bounder bounder;
  private final GenerationalReplacer replacer = new GenerationalReplacer();
  private final PersonalBestArchiver archiver = new PersonalBestArchiver();
  private ImmutableList<Individual> previousPopulation = ImmutableList.of();

  public ParticleSwarm(
      EvolutionConfig config,
      Evaluator evaluator,
      Terminator terminator,
      List<? extends Observer> observers,
      Random random,
      Bounder bounder) {
    super(config, evaluator, terminator, observers, random);
    this.bounder = bounder;
  }

  @Override
  protected void reset() {
    previousPopulation = ImmutableList.of();
  }

  @Override
  protected ImmutableList<ImmutableList<Double>> createOffspring(RunState state, Random random) {
    ImmutableList<Individual> population = state.population();
    ImmutableList<Individual> previous =
        previousPopulation.size() == population.size() ? previousPopulation : population;
    List<Double> neighborhoodBest = Populations.best(state.archive()).candidate();

    ImmutableList.Builder<ImmutableList<Double>> particles =
        ImmutableList.builderWithExpectedSize(population.size());
    for (int i = 0; i < population.size(); i++) {
      List<Double> position = population.get(i).candidate();
      List<Double> previousPosition = previous.get(i).candidate();
      List<Double> personalBest = state.archive().get(i).candidate();
      List<Double> moved = new ArrayList<>(position.size());
      for (int j = 0; j < position.size(); j++) {
        double x = position.get(j);
        moved.add(
            x
                + config.inertia() * (x - previousPosition.get(j))
                + config.cognitiveRate() * random.nextDouble() * (personalBest.get(j) - x)
                + config.socialRate() * random.nextDouble() * (neighborhoodBest.get(j) - x));
      }
      particles.add(bounder.bound(moved));
    }
    previousPopulation = population;
    return particles.build();
  }

  @Override
  protected Replacer replacer() {
    return replacer;
  }

  @Override
  protected Archiver archiver() {
    return archiver;
  }
}
