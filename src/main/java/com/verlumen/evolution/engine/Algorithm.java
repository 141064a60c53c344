package com.verlumen.evolution.engine;

/** The generational engines available through {@link EvolutionOrchestrator}. */
public enum Algorithm {
  /** Strategy-driven DE with positional replacement. */
  DIFFERENTIAL_EVOLUTION,
  /** Tournament selection, heuristic crossover, Gaussian mutation and ranked replacement. */
  OPERATOR_PIPELINE,
  /** Particle swarm with a star topology. */
  PARTICLE_SWARM
}
