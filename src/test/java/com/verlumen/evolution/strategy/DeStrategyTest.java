package com.verlumen.evolution.strategy;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.verlumen.evolution.ConfigurationException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DeStrategyTest {
  @Test
  public void all_hasTenDistinctStrategies() {
    assertThat(DeStrategy.all()).hasSize(10);
    assertThat(DeStrategy.all()).containsNoDuplicates();
  }

  @Test
  public void parse_everyCanonicalName_roundTrips() {
    for (DeStrategy strategy : DeStrategy.all()) {
      assertThat(DeStrategy.parse(strategy.name())).isEqualTo(strategy);
    }
  }

  @Test
  public void parse_randToBest_readsAllComponents() {
    DeStrategy strategy = DeStrategy.parse("DE/rand-to-best/1/exp");

    assertThat(strategy.baseVector()).isEqualTo(BaseVector.RAND_TO_BEST);
    assertThat(strategy.arity()).isEqualTo(DifferenceArity.ONE);
    assertThat(strategy.crossover()).isEqualTo(CrossoverScheme.EXPONENTIAL);
    assertThat(strategy.toString()).isEqualTo("DE/rand-to-best/1/exp");
  }

  @Test
  public void parse_randToBestWithTwoDifferences_throwsConfigurationException() {
    assertThrows(ConfigurationException.class, () -> DeStrategy.parse("DE/rand-to-best/2/bin"));
  }

  @Test
  public void parse_unknownComponents_throwConfigurationException() {
    assertThrows(ConfigurationException.class, () -> DeStrategy.parse("DE/worst/1/bin"));
    assertThrows(ConfigurationException.class, () -> DeStrategy.parse("DE/best/3/bin"));
    assertThrows(ConfigurationException.class, () -> DeStrategy.parse("DE/best/one/bin"));
    assertThrows(ConfigurationException.class, () -> DeStrategy.parse("DE/best/1/uniform"));
    assertThrows(ConfigurationException.class, () -> DeStrategy.parse("GA/best/1/bin"));
    assertThrows(ConfigurationException.class, () -> DeStrategy.parse("DE/best/1"));
  }
}
