package com.verlumen.evolution.engine;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.verlumen.evolution.bounding.Bounder;
import com.verlumen.evolution.bounding.RangeBounder;
import com.verlumen.evolution.evaluation.Evaluator;
import com.verlumen.evolution.evaluation.ObjectiveFunction;
import com.verlumen.evolution.evaluation.ParallelEvaluator;
import com.verlumen.evolution.observation.LoggingObserver;
import com.verlumen.evolution.observation.Observer;
import com.verlumen.evolution.observation.StatisticsLog;
import com.verlumen.evolution.observation.StatisticsObserver;
import java.util.Random;

@AutoValue
public abstract class EvolutionModule extends AbstractModule {
  public static EvolutionModule create(EvolutionConfig config, ObjectiveFunction objective) {
    return create(config, objective, RangeBounder.unbounded());
  }

  public static EvolutionModule create(
      EvolutionConfig config, ObjectiveFunction objective, Bounder bounder) {
    return new AutoValue_EvolutionModule(config, objective, bounder);
  }

  abstract EvolutionConfig config();

  abstract ObjectiveFunction objective();

  abstract Bounder bounder();

  @Override
  protected void configure() {
    bind(EngineFactory.class).to(EngineFactoryImpl.class);
    bind(EvolutionOrchestrator.class).to(EvolutionOrchestratorImpl.class);
    bind(StatisticsLog.class).in(Singleton.class);
  }

  @Provides
  EvolutionConfig provideEvolutionConfig() {
    return config();
  }

  @Provides
  ObjectiveFunction provideObjectiveFunction() {
    return objective();
  }

  @Provides
  Bounder provideBounder() {
    return bounder();
  }

  @Provides
  @Singleton
  ParallelEvaluator provideParallelEvaluator(EvolutionConfig config, ObjectiveFunction objective) {
    return new ParallelEvaluator(objective, config.workerPoolSize());
  }

  @Provides
  Evaluator provideEvaluator(ParallelEvaluator evaluator) {
    return evaluator;
  }

  @Provides
  ImmutableList<Observer> provideObservers(
      LoggingObserver loggingObserver, StatisticsObserver statisticsObserver) {
    return ImmutableList.of(loggingObserver, statisticsObserver);
  }

  @Provides
  Random provideRandom(EvolutionConfig config) {
    return config.newRandom();
  }
}
