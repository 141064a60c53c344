package com.verlumen.evolution.engine;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.archive.Archiver;
import com.verlumen.evolution.bounding.Bounder;
import com.verlumen.evolution.evaluation.Evaluator;
import com.verlumen.evolution.observation.Observer;
import com.verlumen.evolution.population.Individual;
import com.verlumen.evolution.replacement.Replacer;
import com.verlumen.evolution.termination.Terminator;
import com.verlumen.evolution.variation.Variator;
import java.util.List;
import java.util.Random;

/** Selection followed by a pipeline of variators, then replacement and archiving. */
public final class OperatorEvolution extends EvolutionaryComputation {
  private final Bounder bounder;
  private final Operators operators;

  public OperatorEvolution(
      EvolutionConfig config,
      Evaluator evaluator,
      Terminator terminator,
      List<? extends Observer> observers,
      Random random,
      Bounder bounder,
      Operators operators) {
    super(config, evaluator, terminator, observers, random);
    this.bounder = bounder;
    this.operators = operators;
  }

  @Override
  protected ImmutableList<ImmutableList<Double>> createOffspring(RunState state, Random random) {
    ImmutableList<Individual> current = operators.selector().select(state.population(), random);
    for (Variator variator : operators.variators()) {
      current = variator.vary(current, bounder, random);
    }
    ImmutableList.Builder<ImmutableList<Double>> candidates =
        ImmutableList.builderWithExpectedSize(current.size());
    for (Individual individual : current) {
      candidates.add(individual.candidate());
    }
    return candidates.build();
  }

  @Override
  protected Replacer replacer() {
    return operators.replacer();
  }

  @Override
  protected Archiver archiver() {
    return operators.archiver();
  }
}
