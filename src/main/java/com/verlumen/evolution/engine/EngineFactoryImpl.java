package com.verlumen.evolution.engine;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Provider;
import com.verlumen.evolution.bounding.Bounder;
import com.verlumen.evolution.evaluation.Evaluator;
import com.verlumen.evolution.observation.Observer;
import com.verlumen.evolution.observation.StatisticsLog;
import com.verlumen.evolution.termination.Terminator;
import java.util.Random;

final class EngineFactoryImpl implements EngineFactory {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final EvolutionConfig config;
  private final Evaluator evaluator;
  private final Bounder bounder;
  private final StatisticsLog statisticsLog;
  private final Provider<Random> randomProvider;
  private final ImmutableList<Observer> observers;

  @Inject
  EngineFactoryImpl(
      EvolutionConfig config,
      Evaluator evaluator,
      Bounder bounder,
      StatisticsLog statisticsLog,
      Provider<Random> randomProvider,
      ImmutableList<Observer> observers) {
    this.config = config;
    this.evaluator = evaluator;
    this.bounder = bounder;
    this.statisticsLog = statisticsLog;
    this.randomProvider = randomProvider;
    this.observers = observers;
  }

  @Override
  public EvolutionaryComputation createEngine() {
    logger.atFine().log("Creating %s engine", config.algorithm());
    // Not a provider: Guice would wrap a ConfigurationException in a ProvisionException.
    Terminator terminator = config.defaultTerminator(statisticsLog);
    Random random = randomProvider.get();
    switch (config.algorithm()) {
      case DIFFERENTIAL_EVOLUTION:
        return new DifferentialEvolution(config, evaluator, terminator, observers, random);
      case OPERATOR_PIPELINE:
        return new OperatorEvolution(
            config, evaluator, terminator, observers, random, bounder, Operators.defaults(config));
      case PARTICLE_SWARM:
        return new ParticleSwarm(config, evaluator, terminator, observers, random, bounder);
    }
    throw new IllegalStateException("Unsupported algorithm: " + config.algorithm());
  }
}
