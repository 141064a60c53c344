package com.verlumen.evolution.engine;

import com.verlumen.evolution.generation.CandidateGenerator;
import java.util.List;

/**
 * Runs complete optimizations with the injected configuration and objective.
 *
 * <p>The orchestrator owns the evaluation workers of its injector. Close it once no further runs
 * are needed; {@link #optimize} must not be called afterwards.
 */
public interface EvolutionOrchestrator extends AutoCloseable {
  /**
   * Runs one optimization.
   *
   * @param generator produces the initial candidates not covered by {@code seeds}
   * @param seeds candidates placed first in the initial population
   * @return the final state of the run; {@link EvolutionResult#best()} is the best individual
   */
  EvolutionResult optimize(CandidateGenerator generator, List<? extends List<Double>> seeds);

  /** Shuts down the evaluation workers. */
  @Override
  void close();
}
