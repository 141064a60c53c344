package com.verlumen.evolution.engine;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.evolution.evaluation.Evaluator;
import com.verlumen.evolution.generation.CandidateGenerator;
import java.util.List;

/**
 * Coordinates a run: asks the factory for a fresh engine, evolves it and reports the best
 * individual.
 */
final class EvolutionOrchestratorImpl implements EvolutionOrchestrator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final EngineFactory engineFactory;
  private final Evaluator evaluator;

  @Inject
  EvolutionOrchestratorImpl(EngineFactory engineFactory, Evaluator evaluator) {
    this.engineFactory = engineFactory;
    this.evaluator = evaluator;
  }

  @Override
  public EvolutionResult optimize(
      CandidateGenerator generator, List<? extends List<Double>> seeds) {
    checkNotNull(generator, "Candidate generator cannot be null");
    checkNotNull(seeds, "Seeds cannot be null");

    EvolutionResult result = engineFactory.createEngine().evolve(generator, seeds);
    if (result.population().isEmpty()) {
      logger.atWarning().log("Run ended with an empty population");
    } else {
      logger.atInfo().log(
          "Best fitness %s after %d generations (%s)",
          result.best().fitness(), result.finalState().generation(), result.terminationCause());
    }
    return result;
  }

  @Override
  public void close() {
    logger.atInfo().log("Closing evaluator");
    evaluator.close();
  }
}
