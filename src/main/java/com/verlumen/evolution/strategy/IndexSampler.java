package com.verlumen.evolution.strategy;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Random;

/** Draws distinct indices without replacement using a partial Fisher-Yates shuffle. */
final class IndexSampler {
  /**
   * Returns {@code count} distinct indices from {@code [0, bound)}, none equal to {@code excluded}.
   * Consumes exactly {@code count} draws from {@code random}.
   *
   * @throws IllegalArgumentException if fewer than {@code count} indices are available
   */
  static int[] sampleExcluding(int bound, int count, int excluded, Random random) {
    boolean excludes = excluded >= 0 && excluded < bound;
    int available = excludes ? bound - 1 : bound;
    checkArgument(
        available >= count,
        "Cannot draw %s distinct indices from a population of %s excluding slot %s",
        count,
        bound,
        excluded);
    int[] pool = new int[available];
    for (int i = 0, next = 0; i < bound; i++) {
      if (i != excluded) {
        pool[next++] = i;
      }
    }
    int[] picks = new int[count];
    for (int j = 0; j < count; j++) {
      int k = j + random.nextInt(available - j);
      int swap = pool[j];
      pool[j] = pool[k];
      pool[k] = swap;
      picks[j] = pool[j];
    }
    return picks;
  }

  private IndexSampler() {}
}
