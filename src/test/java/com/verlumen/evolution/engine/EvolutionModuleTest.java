package com.verlumen.evolution.engine;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import com.verlumen.evolution.ConfigurationException;
import com.verlumen.evolution.WorkerPoolException;
import com.verlumen.evolution.benchmark.StyblinskiTang;
import com.verlumen.evolution.evaluation.Evaluator;
import com.verlumen.evolution.evaluation.ParallelEvaluator;
import com.verlumen.evolution.generation.UniformGenerator;
import com.verlumen.evolution.observation.StatisticsLog;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class EvolutionModuleTest {
  private static final StyblinskiTang STYBLINSKI_TANG = new StyblinskiTang(2);

  private Injector injector;

  @After
  public void tearDown() {
    if (injector != null) {
      injector.getInstance(EvolutionOrchestrator.class).close();
    }
  }

  @Test
  public void optimize_everyAlgorithm_runsToMaxGenerations(@TestParameter Algorithm algorithm) {
    injector =
        Guice.createInjector(
            EvolutionModule.create(config(algorithm), STYBLINSKI_TANG, STYBLINSKI_TANG.bounder()));

    EvolutionResult result =
        injector
            .getInstance(EvolutionOrchestrator.class)
            .optimize(new UniformGenerator(2, STYBLINSKI_TANG.bounder()), ImmutableList.of());

    assertThat(result.finalState().generation()).isEqualTo(12);
    assertThat(result.aborted()).isFalse();
    // One statistics entry per generation, including the initial population.
    assertThat(injector.getInstance(StatisticsLog.class).size()).isEqualTo(13);
  }

  @Test
  public void evaluator_isSharedParallelEvaluator() {
    injector =
        Guice.createInjector(
            EvolutionModule.create(config(Algorithm.DIFFERENTIAL_EVOLUTION), STYBLINSKI_TANG));

    assertThat(injector.getInstance(Evaluator.class))
        .isSameInstanceAs(injector.getInstance(ParallelEvaluator.class));
  }

  @Test
  public void optimize_noTerminationThreshold_throwsConfigurationException() {
    EvolutionConfig config =
        EvolutionConfig.builder().setPopulationSize(8).setWorkerPoolSize(2).build();
    injector = Guice.createInjector(EvolutionModule.create(config, STYBLINSKI_TANG));
    EvolutionOrchestrator orchestrator = injector.getInstance(EvolutionOrchestrator.class);

    assertThrows(
        ConfigurationException.class,
        () ->
            orchestrator.optimize(
                new UniformGenerator(2, STYBLINSKI_TANG.bounder()), ImmutableList.of()));
  }

  @Test
  public void close_shutsDownSharedWorkerPool() {
    injector =
        Guice.createInjector(
            EvolutionModule.create(config(Algorithm.DIFFERENTIAL_EVOLUTION), STYBLINSKI_TANG));
    EvolutionOrchestrator orchestrator = injector.getInstance(EvolutionOrchestrator.class);

    orchestrator.close();

    assertThrows(
        WorkerPoolException.class,
        () ->
            orchestrator.optimize(
                new UniformGenerator(2, STYBLINSKI_TANG.bounder()), ImmutableList.of()));
  }

  private static EvolutionConfig config(Algorithm algorithm) {
    return EvolutionConfig.builder()
        .setAlgorithm(algorithm)
        .setPopulationSize(8)
        .setMaximize(false)
        .setMaxGenerations(12)
        .setWorkerPoolSize(2)
        .setSeed(31)
        .build();
  }
}
