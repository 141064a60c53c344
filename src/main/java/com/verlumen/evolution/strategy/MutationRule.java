package com.verlumen.evolution.strategy;

/**
 * Computes the mutated value of one gene.
 *
 * <p>{@code trial} is the offspring under construction, so rules reading it see genes already
 * overwritten earlier in the same crossover walk.
 */
@FunctionalInterface
interface MutationRule {
  double mutate(int gene, double[] trial, Donors donors, double scale);

  static MutationRule forVariant(BaseVector base, DifferenceArity arity) {
    switch (base) {
      case BEST:
        return arity == DifferenceArity.ONE
            ? (n, x, d, f) -> d.best[n] + f * (d.r2[n] - d.r3[n])
            : (n, x, d, f) -> d.best[n] + (d.r1[n] + d.r2[n] - d.r3[n] - d.r4[n]) * f;
      case RAND:
        return arity == DifferenceArity.ONE
            ? (n, x, d, f) -> d.r1[n] + f * (d.r2[n] - d.r3[n])
            : (n, x, d, f) -> d.r5[n] + (d.r1[n] + d.r2[n] - d.r3[n] - d.r4[n]) * f;
      case RAND_TO_BEST:
        if (arity == DifferenceArity.ONE) {
          return (n, x, d, f) -> x[n] + f * (d.best[n] - x[n]) + f * (d.r1[n] - d.r2[n]);
        }
        break;
    }
    throw new IllegalArgumentException(
        "No mutation rule for " + base.label() + "/" + arity.count());
  }
}
