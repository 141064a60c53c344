package com.verlumen.evolution.engine;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.archive.Archiver;
import com.verlumen.evolution.archive.GlobalBestArchiver;
import com.verlumen.evolution.evaluation.Evaluator;
import com.verlumen.evolution.observation.Observer;
import com.verlumen.evolution.replacement.PositionalReplacer;
import com.verlumen.evolution.replacement.Replacer;
import com.verlumen.evolution.strategy.StrategyEngine;
import com.verlumen.evolution.termination.Terminator;
import java.util.List;
import java.util.Random;

/**
 * Differential evolution. Each slot gets one trial vector from the configured strategy, and the
 * trial competes only with the parent in its own slot. The archive holds the global best, which
 * serves as base vector for the best-based strategies.
 */
public final class DifferentialEvolution extends EvolutionaryComputation {
  private final StrategyEngine strategyEngine;
  private final PositionalReplacer replacer;
  private final GlobalBestArchiver archiver = new GlobalBestArchiver();

  public DifferentialEvolution(
      EvolutionConfig config,
      Evaluator evaluator,
      Terminator terminator,
      List<? extends Observer> observers,
      Random random) {
    super(config, evaluator, terminator, observers, random);
    this.strategyEngine =
        new StrategyEngine(config.strategy(), config.mutationScale(), config.crossoverRate());
    this.replacer = new PositionalReplacer(config.slotComparison());
  }

  @Override
  protected ImmutableList<ImmutableList<Double>> createOffspring(RunState state, Random random) {
    return strategyEngine.createOffspring(state.population(), state.archive().get(0), random);
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
