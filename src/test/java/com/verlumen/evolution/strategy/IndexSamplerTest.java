package com.verlumen.evolution.strategy;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.primitives.Ints;
import java.util.Random;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class IndexSamplerTest {
  @Test
  public void sampleExcluding_returnsDistinctIndicesOtherThanExcluded() {
    Random random = new Random(42);
    for (int trial = 0; trial < 200; trial++) {
      int[] picks = IndexSampler.sampleExcluding(6, 5, 3, random);

      assertThat(Ints.asList(picks)).containsNoDuplicates();
      assertThat(Ints.asList(picks)).doesNotContain(3);
      for (int pick : picks) {
        assertThat(pick).isAtLeast(0);
        assertThat(pick).isLessThan(6);
      }
    }
  }

  @Test
  public void sampleExcluding_sameSeed_sameIndices() {
    int[] first = IndexSampler.sampleExcluding(20, 5, 0, new Random(9));
    int[] second = IndexSampler.sampleExcluding(20, 5, 0, new Random(9));

    assertThat(first).isEqualTo(second);
  }

  @Test
  public void sampleExcluding_tooFewIndices_throwsIllegalArgumentException() {
    assertThrows(
        IllegalArgumentException.class,
        () -> IndexSampler.sampleExcluding(5, 5, 0, new Random(1)));
  }
}
