package com.verlumen.evolution.strategy;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;
import com.verlumen.evolution.population.Individual;
import java.util.List;
import java.util.Random;

/**
 * Builds one offspring candidate per population slot with a {@link DeStrategy}.
 *
 * <p>Slots are processed in ascending order. For each slot the engine draws five distinct donor
 * indices other than the slot itself, picks the start gene, runs the crossover walk, then repairs
 * genes outside {@code [0, 1]}. That order fixes how the random stream is consumed, so two engines
 * fed identically seeded streams produce identical offspring.
 */
public final class StrategyEngine {
  /** Donor indices drawn per slot, whatever the strategy actually reads. */
  public static final int DONOR_COUNT = 5;

  private static final double REPAIR_PRECISION = 1000.0;

  private final DeStrategy strategy;
  private final MutationRule rule;
  private final double mutationScale;
  private final double crossoverRate;

  public StrategyEngine(DeStrategy strategy, double mutationScale, double crossoverRate) {
    this.strategy = checkNotNull(strategy, "Strategy cannot be null");
    this.rule = strategy.mutationRule();
    this.mutationScale = mutationScale;
    this.crossoverRate = crossoverRate;
  }

  public DeStrategy strategy() {
    return strategy;
  }

  /**
   * Creates the offspring candidates.
   *
   * @param population the current population, at least six individuals
   * @param best the global best, base vector of the best-based strategies
   * @param random the run's random stream
   * @return exactly one candidate per slot, in slot order
   */
  public ImmutableList<ImmutableList<Double>> createOffspring(
      List<Individual> population, Individual best, Random random) {
    checkArgument(
        population.size() > DONOR_COUNT,
        "Strategy %s needs more than %s individuals, got %s",
        strategy,
        DONOR_COUNT,
        population.size());
    double[][] parents = new double[population.size()][];
    for (int i = 0; i < parents.length; i++) {
      parents[i] = Doubles.toArray(population.get(i).candidate());
    }
    double[] bestVector = Doubles.toArray(best.candidate());

    ImmutableList.Builder<ImmutableList<Double>> offspring =
        ImmutableList.builderWithExpectedSize(parents.length);
    for (int i = 0; i < parents.length; i++) {
      int[] picks = IndexSampler.sampleExcluding(parents.length, DONOR_COUNT, i, random);
      double[] trial = parents[i].clone();
      strategy
          .crossover()
          .cross(
              trial,
              new Donors(bestVector, parents, picks),
              rule,
              mutationScale,
              crossoverRate,
              random);
      repairUnitInterval(trial, random);
      offspring.add(ImmutableList.copyOf(Doubles.asList(trial)));
    }
    return offspring.build();
  }

  /** Replaces genes outside [0, 1] with a uniform draw rounded to three decimals. */
  static void repairUnitInterval(double[] trial, Random random) {
    for (int i = 0; i < trial.length; i++) {
      if (trial[i] > 1 || trial[i] < 0) {
        trial[i] = Math.round(random.nextDouble() * REPAIR_PRECISION) / REPAIR_PRECISION;
      }
    }
  }
}
