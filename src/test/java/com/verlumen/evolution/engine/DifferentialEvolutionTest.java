package com.verlumen.evolution.engine;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.ConfigurationException;
import com.verlumen.evolution.EvolutionExit;
import com.verlumen.evolution.benchmark.SumOfSquares;
import com.verlumen.evolution.evaluation.Evaluation;
import com.verlumen.evolution.evaluation.Evaluator;
import com.verlumen.evolution.evaluation.ObjectiveFunction;
import com.verlumen.evolution.evaluation.ParallelEvaluator;
import com.verlumen.evolution.evaluation.SerialEvaluator;
import com.verlumen.evolution.generation.UniformGenerator;
import com.verlumen.evolution.observation.Observer;
import com.verlumen.evolution.observation.StatisticsLog;
import com.verlumen.evolution.observation.StatisticsObserver;
import com.verlumen.evolution.population.Individual;
import com.verlumen.evolution.strategy.DeStrategy;
import com.verlumen.evolution.termination.Terminator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DifferentialEvolutionTest {
  private static final SumOfSquares SUM_OF_SQUARES = new SumOfSquares(2);

  @Test
  public void evolve_sameSeed_identicalRuns() {
    EvolutionConfig config =
        EvolutionConfig.builder()
            .setPopulationSize(6)
            .setMaximize(false)
            .setStrategyName("DE/best/1/bin")
            .setMutationScale(0.5)
            .setCrossoverRate(0.9)
            .setMaxGenerations(10)
            .setSeed(1234)
            .build();

    EvolutionResult first = run(config, SUM_OF_SQUARES);
    EvolutionResult second = run(config, SUM_OF_SQUARES);

    assertThat(first.finalState().generation()).isEqualTo(10);
    assertThat(first.finalState().evaluations()).isEqualTo(66);
    assertThat(first.terminationCause()).isEqualTo("MaxGenerationsTermination");
    assertThat(candidates(first.population())).isEqualTo(candidates(second.population()));
    assertThat(first.best().fitness()).isEqualTo(second.best().fitness());
  }

  @Test
  public void evolve_maxEvaluations_overshootsByLessThanOneBatch() {
    EvolutionConfig config =
        EvolutionConfig.builder()
            .setPopulationSize(12)
            .setMaximize(false)
            .setMaxEvaluations(100)
            .setSeed(7)
            .build();

    EvolutionResult result = run(config, SUM_OF_SQUARES);

    assertThat(result.finalState().evaluations()).isEqualTo(108);
    assertThat(result.finalState().generation()).isEqualTo(8);
    assertThat(result.terminationCause()).isEqualTo("MaxEvaluationsTermination");
  }

  @Test
  public void evolve_nonNegativeMinimization_bestNeverWorsens() {
    EvolutionConfig config =
        EvolutionConfig.builder()
            .setPopulationSize(10)
            .setMaximize(false)
            .setStrategyName("DE/rand/1/exp")
            .setMaxGenerations(30)
            .setSeed(99)
            .build();
    StatisticsLog log = new StatisticsLog();

    EvolutionResult result =
        new DifferentialEvolution(
                config,
                new SerialEvaluator(SUM_OF_SQUARES),
                config.defaultTerminator(log),
                ImmutableList.of(new StatisticsObserver(log)),
                config.newRandom())
            .evolve(new UniformGenerator(2, SUM_OF_SQUARES.bounder()));

    assertThat(log.size()).isEqualTo(31);
    assertThat(log.bestFitnessHistory()).isInOrder(Comparator.<Double>reverseOrder());
    assertThat(result.best().requireFitness()).isLessThan(log.bestFitnessHistory().get(0));
  }

  @Test
  public void evolve_everyStrategy_completes() {
    for (DeStrategy strategy : DeStrategy.all()) {
      EvolutionConfig config =
          EvolutionConfig.builder()
              .setPopulationSize(6)
              .setMaximize(false)
              .setStrategy(strategy)
              .setMaxGenerations(3)
              .setSeed(5)
              .build();

      EvolutionResult result = run(config, SUM_OF_SQUARES);

      assertThat(result.finalState().generation()).isEqualTo(3);
      assertThat(result.population()).hasSize(6);
    }
  }

  @Test
  public void evolve_seeds_placedFirstInInitialPopulation() {
    EvolutionConfig config =
        EvolutionConfig.builder()
            .setPopulationSize(6)
            .setMaximize(false)
            .setMaxGenerations(0)
            .setSeed(3)
            .build();
    ImmutableList<ImmutableList<Double>> seeds =
        ImmutableList.of(ImmutableList.of(0.1, 0.2), ImmutableList.of(0.3, 0.4));

    EvolutionResult result =
        engine(config, new SerialEvaluator(SUM_OF_SQUARES), ImmutableList.of())
            .evolve(new UniformGenerator(2, SUM_OF_SQUARES.bounder()), seeds);

    assertThat(result.population()).hasSize(6);
    assertThat(result.population().get(0).candidate()).isEqualTo(seeds.get(0));
    assertThat(result.population().get(1).candidate()).isEqualTo(seeds.get(1));
    assertThat(result.finalState().evaluations()).isEqualTo(6);
  }

  @Test
  public void evolve_undefinedInitialFitness_shrinksPopulation() {
    EvolutionConfig config =
        EvolutionConfig.builder()
            .setPopulationSize(8)
            .setMaximize(false)
            .setMaxGenerations(3)
            .setSeed(11)
            .build();
    ObjectiveFunction failing =
        (candidate, context) ->
            candidate.get(0) == 0.99 ? Evaluation.undefined() : Evaluation.of(candidate.get(0));
    ImmutableList<ImmutableList<Double>> seeds =
        ImmutableList.of(ImmutableList.of(0.99, 0.5), ImmutableList.of(0.99, 0.6));

    EvolutionResult result =
        engine(config, new SerialEvaluator(failing), ImmutableList.of())
            .evolve(new UniformGenerator(2, SUM_OF_SQUARES.bounder()), seeds);

    assertThat(result.population()).hasSize(6);
    assertThat(result.finalState().evaluations()).isEqualTo(8 + 3 * 6);
  }

  @Test
  public void evolve_observerFails_propagatesFailure() {
    EvolutionConfig config = smallConfig();
    Observer failing =
        (state, context) -> {
          if (state.generation() == 2) {
            throw new IllegalStateException("disk full");
          }
        };

    assertThrows(
        IllegalStateException.class,
        () ->
            engine(config, new SerialEvaluator(SUM_OF_SQUARES), ImmutableList.of(failing))
                .evolve(new UniformGenerator(2, SUM_OF_SQUARES.bounder())));
  }

  @Test
  public void evolve_observerDerivesIndividuals_runUnaffected() {
    EvolutionConfig config = smallConfig();
    List<RunState> initialStates = new ArrayList<>();
    Observer deriving =
        (state, context) -> {
          if (state.generation() == 0) {
            initialStates.add(state);
            state.population().get(0).withCandidate(ImmutableList.of(0.5, 0.5));
          }
        };

    EvolutionResult observed =
        engine(config, new SerialEvaluator(SUM_OF_SQUARES), ImmutableList.of(deriving))
            .evolve(new UniformGenerator(2, SUM_OF_SQUARES.bounder()));
    EvolutionResult plain = run(config, SUM_OF_SQUARES);

    assertThat(observed.finalState().generation()).isEqualTo(5);
    assertThat(candidates(observed.population())).isEqualTo(candidates(plain.population()));
    RunState initial = initialStates.get(0);
    assertThat(initial.population()).hasSize(6);
    for (Individual individual : initial.population()) {
      Evaluation expected =
          SUM_OF_SQUARES.evaluate(individual.candidate(), config.evaluationContext());
      assertThat(individual.fitness()).isEqualTo(expected.fitness());
    }
  }

  @Test
  public void evolve_exitDuringRun_returnsAbortedResult() {
    EvolutionConfig config = smallConfig();
    Observer exiting =
        (state, context) -> {
          if (state.generation() == 3) {
            throw new EvolutionExit("user stop");
          }
        };

    EvolutionResult result =
        engine(config, new SerialEvaluator(SUM_OF_SQUARES), ImmutableList.of(exiting))
            .evolve(new UniformGenerator(2, SUM_OF_SQUARES.bounder()));

    assertThat(result.aborted()).isTrue();
    assertThat(result.terminationCause()).isEqualTo(EvolutionResult.EXIT_CAUSE);
    assertThat(result.finalState().generation()).isEqualTo(3);
    assertThat(result.population()).hasSize(6);
  }

  @Test
  public void evolve_exitBeforeInitialPopulation_propagatesExit() {
    EvolutionConfig config = smallConfig();
    ObjectiveFunction exiting =
        (candidate, context) -> {
          throw new EvolutionExit("user stop");
        };

    assertThrows(
        EvolutionExit.class,
        () ->
            engine(config, new SerialEvaluator(exiting), ImmutableList.of())
                .evolve(new UniformGenerator(2, SUM_OF_SQUARES.bounder())));
  }

  @Test
  public void constructor_missingEvaluator_throwsConfigurationException() {
    EvolutionConfig config = smallConfig();

    assertThrows(
        ConfigurationException.class,
        () ->
            new DifferentialEvolution(
                config,
                null,
                config.defaultTerminator(new StatisticsLog()),
                ImmutableList.of(),
                null));
  }

  @Test
  public void evolve_parallelEvaluator_matchesSerialEvaluation() {
    EvolutionConfig config = smallConfig();
    EvolutionResult serial = run(config, SUM_OF_SQUARES);

    EvolutionResult parallel;
    try (ParallelEvaluator evaluator = new ParallelEvaluator(SUM_OF_SQUARES, 3)) {
      parallel =
          engine(config, evaluator, ImmutableList.of())
              .evolve(new UniformGenerator(2, SUM_OF_SQUARES.bounder()));
    }

    assertThat(candidates(parallel.population())).isEqualTo(candidates(serial.population()));
  }

  private static EvolutionConfig smallConfig() {
    return EvolutionConfig.builder()
        .setPopulationSize(6)
        .setMaximize(false)
        .setMaxGenerations(5)
        .setSeed(21)
        .build();
  }

  private static EvolutionResult run(EvolutionConfig config, SumOfSquares objective) {
    return engine(config, new SerialEvaluator(objective), ImmutableList.of())
        .evolve(new UniformGenerator(objective.dimensions(), objective.bounder()));
  }

  private static DifferentialEvolution engine(
      EvolutionConfig config,
      Evaluator evaluator,
      List<Observer> observers) {
    Terminator terminator = config.defaultTerminator(new StatisticsLog());
    return new DifferentialEvolution(config, evaluator, terminator, observers, config.newRandom());
  }

  private static ImmutableList<ImmutableList<Double>> candidates(List<Individual> population) {
    ImmutableList.Builder<ImmutableList<Double>> candidates = ImmutableList.builder();
    population.forEach(individual -> candidates.add(individual.candidate()));
    return candidates.build();
  }
}
