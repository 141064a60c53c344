package com.verlumen.evolution.strategy;

/** The vectors a mutation rule may read for one target slot. */
final class Donors {
  final double[] best;
  final double[] r1;
  final double[] r2;
  final double[] r3;
  final double[] r4;
  final double[] r5;

  Donors(double[] best, double[][] population, int[] picks) {
    this.best = best;
    this.r1 = population[picks[0]];
    this.r2 = population[picks[1]];
    this.r3 = population[picks[2]];
    this.r4 = population[picks[3]];
    this.r5 = population[picks[4]];
  }
}
