package com.verlumen.evolution.engine;

/** Default values of the {@link EvolutionConfig} options. */
final class EvolutionDefaults {
  static final int POPULATION_SIZE = 100;
  static final double MUTATION_SCALE = 0.5;
  static final double MAX_MUTATION_SCALE = 2.0;
  static final double CROSSOVER_RATE = 0.9;
  static final String STRATEGY = "DE/rand/1/bin";
  static final int NUM_SELECTED = 2;
  static final int TOURNAMENT_SIZE = 2;
  static final double MUTATION_RATE = 0.1;
  static final double GAUSSIAN_MEAN = 0.0;
  static final double GAUSSIAN_STDEV = 1.0;
  static final double INERTIA = 0.5;
  static final double COGNITIVE_RATE = 2.1;
  static final double SOCIAL_RATE = 2.1;

  private EvolutionDefaults() {}
}
