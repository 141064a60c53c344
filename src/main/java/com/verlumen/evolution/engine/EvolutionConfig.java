package com.verlumen.evolution.engine;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.verlumen.evolution.ConfigurationException;
import com.verlumen.evolution.evaluation.EvaluationContext;
import com.verlumen.evolution.observation.StatisticsLog;
import com.verlumen.evolution.replacement.SlotComparison;
import com.verlumen.evolution.strategy.DeStrategy;
import com.verlumen.evolution.strategy.StrategyEngine;
import com.verlumen.evolution.termination.ConvergenceTermination;
import com.verlumen.evolution.termination.MaxEvaluationsTermination;
import com.verlumen.evolution.termination.MaxGenerationsTermination;
import com.verlumen.evolution.termination.TerminationClause;
import com.verlumen.evolution.termination.Terminator;
import java.io.Serializable;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Random;

/**
 * Options of a run. Every option is named, typed and defaulted; anything else the objective needs
 * goes into {@link #extensions()}, which is forwarded to every evaluation. The whole configuration
 * is validated once, in {@link Builder#build()}.
 */
@AutoValue
public abstract class EvolutionConfig {
  public abstract Algorithm algorithm();

  /** Nominal population size NP. */
  public abstract int populationSize();

  public abstract boolean maximize();

  /** DE mutation scale F, in (0, 2]. */
  public abstract double mutationScale();

  /** DE crossover rate CR, in [0, 1]. Also the heuristic crossover probability. */
  public abstract double crossoverRate();

  public abstract DeStrategy strategy();

  public abstract SlotComparison slotComparison();

  public abstract int workerPoolSize();

  public abstract OptionalInt maxEvaluations();

  public abstract OptionalInt maxGenerations();

  /** Relative tolerance of the convergence clause; the clause is off when empty. */
  public abstract OptionalDouble convergenceTolerance();

  /** Seed of the run's random stream; a time-based seed is used when empty. */
  public abstract OptionalLong seed();

  public abstract int numSelected();

  public abstract int tournamentSize();

  /** Per-gene probability of the Gaussian and uniform mutations. */
  public abstract double mutationRate();

  public abstract double gaussianMean();

  public abstract double gaussianStdev();

  public abstract double inertia();

  public abstract double cognitiveRate();

  public abstract double socialRate();

  public abstract ImmutableMap<String, Serializable> extensions();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_EvolutionConfig.Builder()
        .setAlgorithm(Algorithm.DIFFERENTIAL_EVOLUTION)
        .setPopulationSize(EvolutionDefaults.POPULATION_SIZE)
        .setMaximize(true)
        .setMutationScale(EvolutionDefaults.MUTATION_SCALE)
        .setCrossoverRate(EvolutionDefaults.CROSSOVER_RATE)
        .setStrategyName(EvolutionDefaults.STRATEGY)
        .setSlotComparison(SlotComparison.MAGNITUDE)
        .setWorkerPoolSize(Runtime.getRuntime().availableProcessors())
        .setNumSelected(EvolutionDefaults.NUM_SELECTED)
        .setTournamentSize(EvolutionDefaults.TOURNAMENT_SIZE)
        .setMutationRate(EvolutionDefaults.MUTATION_RATE)
        .setGaussianMean(EvolutionDefaults.GAUSSIAN_MEAN)
        .setGaussianStdev(EvolutionDefaults.GAUSSIAN_STDEV)
        .setInertia(EvolutionDefaults.INERTIA)
        .setCognitiveRate(EvolutionDefaults.COGNITIVE_RATE)
        .setSocialRate(EvolutionDefaults.SOCIAL_RATE)
        .setExtensions(ImmutableMap.of());
  }

  /** A fresh random stream, seeded from {@link #seed()} when present. */
  public Random newRandom() {
    return seed().isPresent() ? new Random(seed().getAsLong()) : new Random();
  }

  public EvaluationContext evaluationContext() {
    return EvaluationContext.of(extensions());
  }

  /**
   * Builds the termination clauses implied by the thresholds: max evaluations, then max
   * generations, then convergence.
   *
   * @throws ConfigurationException if no threshold is set
   */
  public Terminator defaultTerminator(StatisticsLog statisticsLog) {
    ImmutableList.Builder<TerminationClause> clauses = ImmutableList.builder();
    maxEvaluations().ifPresent(max -> clauses.add(new MaxEvaluationsTermination(max)));
    maxGenerations().ifPresent(max -> clauses.add(new MaxGenerationsTermination(max)));
    convergenceTolerance()
        .ifPresent(
            tolerance ->
                clauses.add(new ConvergenceTermination(statisticsLog, tolerance, maximize())));
    ImmutableList<TerminationClause> built = clauses.build();
    if (built.isEmpty()) {
      throw new ConfigurationException(
          "No termination threshold configured: set max evaluations, max generations or a"
              + " convergence tolerance");
    }
    return Terminator.anyOf(built);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setAlgorithm(Algorithm algorithm);

    public abstract Builder setPopulationSize(int populationSize);

    public abstract Builder setMaximize(boolean maximize);

    public abstract Builder setMutationScale(double mutationScale);

    public abstract Builder setCrossoverRate(double crossoverRate);

    public abstract Builder setStrategy(DeStrategy strategy);

    /** Sets the strategy from its canonical name, e.g. {@code DE/best/1/bin}. */
    public Builder setStrategyName(String name) {
      return setStrategy(DeStrategy.parse(name));
    }

    public abstract Builder setSlotComparison(SlotComparison slotComparison);

    public abstract Builder setWorkerPoolSize(int workerPoolSize);

    public abstract Builder setMaxEvaluations(int maxEvaluations);

    public abstract Builder setMaxGenerations(int maxGenerations);

    public abstract Builder setConvergenceTolerance(double convergenceTolerance);

    public abstract Builder setSeed(long seed);

    public abstract Builder setNumSelected(int numSelected);

    public abstract Builder setTournamentSize(int tournamentSize);

    public abstract Builder setMutationRate(double mutationRate);

    public abstract Builder setGaussianMean(double gaussianMean);

    public abstract Builder setGaussianStdev(double gaussianStdev);

    public abstract Builder setInertia(double inertia);

    public abstract Builder setCognitiveRate(double cognitiveRate);

    public abstract Builder setSocialRate(double socialRate);

    public abstract Builder setExtensions(Map<String, Serializable> extensions);

    abstract EvolutionConfig autoBuild();

    /**
     * Builds and validates the configuration.
     *
     * @throws ConfigurationException if an option is out of range
     */
    public EvolutionConfig build() {
      EvolutionConfig config = autoBuild();
      validate(config);
      return config;
    }

    private static void validate(EvolutionConfig config) {
      require(config.populationSize() > 0, "Population size must be positive: %s",
          config.populationSize());
      if (config.algorithm() == Algorithm.DIFFERENTIAL_EVOLUTION) {
        require(
            config.populationSize() > StrategyEngine.DONOR_COUNT,
            "Differential evolution needs more than five individuals: %s",
            config.populationSize());
      }
      require(
          config.mutationScale() > 0 && config.mutationScale() <= EvolutionDefaults.MAX_MUTATION_SCALE,
          "Mutation scale must be in (0, 2]: %s",
          config.mutationScale());
      require(
          config.crossoverRate() >= 0 && config.crossoverRate() <= 1,
          "Crossover rate must be in [0, 1]: %s",
          config.crossoverRate());
      require(config.workerPoolSize() > 0, "Worker pool size must be positive: %s",
          config.workerPoolSize());
      config.maxEvaluations().ifPresent(
          max -> require(max > 0, "Max evaluations must be positive: %s", max));
      config.maxGenerations().ifPresent(
          max -> require(max >= 0, "Max generations cannot be negative: %s", max));
      config.convergenceTolerance().ifPresent(
          tolerance -> require(tolerance >= 0, "Tolerance cannot be negative: %s", tolerance));
      require(config.numSelected() > 0, "Number selected must be positive: %s",
          config.numSelected());
      require(config.tournamentSize() > 0, "Tournament size must be positive: %s",
          config.tournamentSize());
      require(
          config.mutationRate() >= 0 && config.mutationRate() <= 1,
          "Mutation rate must be in [0, 1]: %s",
          config.mutationRate());
      require(config.gaussianStdev() >= 0, "Gaussian deviation cannot be negative: %s",
          config.gaussianStdev());
      try {
        config.evaluationContext();
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("Extensions cannot be sent to evaluation workers", e);
      }
    }

    private static void require(boolean condition, String template, Object value) {
      if (!condition) {
        throw new ConfigurationException(String.format(template, value));
      }
    }
  }
}
