package com.verlumen.evolution.engine;

/** Creates the engine selected by {@link EvolutionConfig#algorithm()}. */
interface EngineFactory {
  /**
   * Creates a fresh engine. Engines keep per-run state, so each run gets its own.
   *
   * @return an engine wired with the injected evaluator, terminator and observers
   */
  EvolutionaryComputation createEngine();
}
