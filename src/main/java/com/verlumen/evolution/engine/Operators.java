package com.verlumen.evolution.engine;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.archive.Archiver;
import com.verlumen.evolution.archive.GlobalBestArchiver;
import com.verlumen.evolution.replacement.RankedReplacer;
import com.verlumen.evolution.replacement.Replacer;
import com.verlumen.evolution.variation.GaussianMutation;
import com.verlumen.evolution.variation.HeuristicCrossover;
import com.verlumen.evolution.variation.Selector;
import com.verlumen.evolution.variation.TournamentSelector;
import com.verlumen.evolution.variation.Variator;

/** The pluggable stages of an {@link OperatorEvolution}. */
@AutoValue
public abstract class Operators {
  public abstract Selector selector();

  /** Applied in order; each variator receives the previous one's output. */
  public abstract ImmutableList<Variator> variators();

  public abstract Replacer replacer();

  public abstract Archiver archiver();

  public static Operators create(
      Selector selector, ImmutableList<Variator> variators, Replacer replacer, Archiver archiver) {
    return new AutoValue_Operators(selector, variators, replacer, archiver);
  }

  /**
   * Tournament selection, heuristic crossover then Gaussian mutation, ranked replacement and a
   * global-best archive, parameterized by {@code config}.
   */
  public static Operators defaults(EvolutionConfig config) {
    return create(
        new TournamentSelector(config.numSelected(), config.tournamentSize()),
        ImmutableList.of(
            new HeuristicCrossover(config.crossoverRate()),
            new GaussianMutation(
                config.mutationRate(), config.gaussianMean(), config.gaussianStdev())),
        new RankedReplacer(),
        new GlobalBestArchiver());
  }
}
