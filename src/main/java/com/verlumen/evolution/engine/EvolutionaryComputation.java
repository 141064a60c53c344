package com.verlumen.evolution.engine;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.verlumen.evolution.ConfigurationException;
import com.verlumen.evolution.EvolutionExit;
import com.verlumen.evolution.archive.Archiver;
import com.verlumen.evolution.evaluation.EvaluatedBatch;
import com.verlumen.evolution.evaluation.EvaluationContext;
import com.verlumen.evolution.evaluation.Evaluator;
import com.verlumen.evolution.generation.CandidateGenerator;
import com.verlumen.evolution.observation.Observer;
import com.verlumen.evolution.population.Individual;
import com.verlumen.evolution.population.Populations;
import com.verlumen.evolution.replacement.Replacer;
import com.verlumen.evolution.termination.Terminator;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Generational loop shared by the engines: initialize, then create offspring, evaluate, replace,
 * archive and notify until a termination clause fires.
 *
 * <p>Subclasses only decide how offspring are created and which replacer and archiver apply.
 */
public abstract class EvolutionaryComputation {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  protected final EvolutionConfig config;
  private final Evaluator evaluator;
  private final Terminator terminator;
  private final ImmutableList<Observer> observers;
  private final Random random;
  private final EvaluationContext context;

  protected EvolutionaryComputation(
      EvolutionConfig config,
      Evaluator evaluator,
      Terminator terminator,
      List<? extends Observer> observers,
      Random random) {
    if (config == null) {
      throw new ConfigurationException("An evolution config is required");
    }
    if (evaluator == null) {
      throw new ConfigurationException("An evaluator is required");
    }
    if (terminator == null) {
      throw new ConfigurationException("A terminator is required");
    }
    this.config = config;
    this.evaluator = evaluator;
    this.terminator = terminator;
    this.observers = ImmutableList.copyOf(observers);
    this.random = random == null ? config.newRandom() : random;
    this.context = config.evaluationContext();
  }

  public final EvolutionResult evolve(CandidateGenerator generator) {
    return evolve(generator, ImmutableList.of());
  }

  /**
   * Runs the engine to termination.
   *
   * @param generator produces the candidates not covered by {@code seeds}
   * @param seeds candidates placed in the initial population before any generated one
   * @throws EvolutionExit if an objective or observer exits before the initial population exists
   */
  public final EvolutionResult evolve(
      CandidateGenerator generator, List<? extends List<Double>> seeds) {
    if (generator == null) {
      throw new ConfigurationException("A candidate generator is required");
    }
    logger.atInfo().log(
        "Starting %s with population size %d and %d seeds",
        getClass().getSimpleName(), config.populationSize(), seeds.size());
    Stopwatch stopwatch = Stopwatch.createStarted();
    reset();

    RunState state = null;
    try {
      state = initialize(generator, seeds);
      notifyObservers(state);
      Optional<String> cause = terminator.check(state, context);
      while (!cause.isPresent()) {
        state = nextGeneration(state);
        notifyObservers(state);
        cause = terminator.check(state, context);
      }
      logger.atInfo().log(
          "%s terminated by %s after %d generations and %d evaluations in %s",
          getClass().getSimpleName(),
          cause.get(),
          state.generation(),
          state.evaluations(),
          stopwatch);
      return EvolutionResult.completed(state, cause.get());
    } catch (EvolutionExit e) {
      if (state == null) {
        throw e;
      }
      logger.atWarning().withCause(e).log(
          "Run stopped early at generation %d; the returned population is provisional",
          state.generation());
      return EvolutionResult.aborted(state);
    }
  }

  /** Candidates of the next generation, created from {@code state}. */
  protected abstract ImmutableList<ImmutableList<Double>> createOffspring(
      RunState state, Random random);

  protected abstract Replacer replacer();

  protected abstract Archiver archiver();

  /** Clears per-run state before {@link #evolve} starts. */
  protected void reset() {}

  private RunState initialize(CandidateGenerator generator, List<? extends List<Double>> seeds) {
    ImmutableList.Builder<ImmutableList<Double>> initial = ImmutableList.builder();
    for (List<Double> seed : seeds) {
      initial.add(ImmutableList.copyOf(seed));
    }
    int generated = Math.max(config.populationSize() - seeds.size(), 0);
    logger.atFine().log("Generating %d initial candidates", generated);
    for (int i = 0; i < generated; i++) {
      initial.add(generator.generate(random, context));
    }
    ImmutableList<ImmutableList<Double>> candidates = initial.build();

    EvaluatedBatch batch = evaluate(candidates);
    ImmutableList<Individual> individuals = toIndividuals(candidates, batch);
    ImmutableList<Individual> population = Populations.evaluatedOnly(individuals);
    if (population.size() < individuals.size()) {
      logger.atWarning().log(
          "Excluded %d initial candidates with undefined fitness; population size is %d",
          individuals.size() - population.size(), population.size());
    }
    ImmutableList<Individual> archive = archiver().archive(population, ImmutableList.of());
    return RunState.create(population, archive, 0, batch.size());
  }

  private RunState nextGeneration(RunState state) {
    ImmutableList<ImmutableList<Double>> candidates = createOffspring(state, random);
    logger.atFine().log(
        "Created %d offspring at generation %d", candidates.size(), state.generation());
    EvaluatedBatch batch = evaluate(candidates);
    ImmutableList<Individual> offspring = toIndividuals(candidates, batch);
    int excluded = offspring.size() - Populations.evaluatedOnly(offspring).size();
    if (excluded > 0) {
      logger.atWarning().log(
          "Excluded %d offspring with undefined fitness at generation %d",
          excluded, state.generation() + 1);
    }

    ImmutableList<Individual> population = replacer().replace(state.population(), offspring);
    ImmutableList<Individual> archive = archiver().archive(population, state.archive());
    return RunState.create(
        population, archive, state.generation() + 1, state.evaluations() + batch.size());
  }

  private EvaluatedBatch evaluate(ImmutableList<ImmutableList<Double>> candidates) {
    EvaluatedBatch batch = evaluator.evaluate(candidates, context);
    checkState(
        batch.size() == candidates.size(),
        "Evaluator returned %s results for %s candidates",
        batch.size(),
        candidates.size());
    return batch;
  }

  private ImmutableList<Individual> toIndividuals(
      ImmutableList<ImmutableList<Double>> candidates, EvaluatedBatch batch) {
    return Populations.fromBatch(
        candidates, batch.fitnesses(), batch.responses(), config.maximize());
  }

  private void notifyObservers(RunState state) {
    for (Observer observer : observers) {
      observer.observe(state, context);
    }
  }
}
