package com.verlumen.evolution.benchmark;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.evaluation.Evaluation;
import com.verlumen.evolution.evaluation.EvaluationContext;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class BenchmarkTest {
  @Test
  public void sumOfSquares_addsSquaredGenes() {
    Evaluation evaluation =
        new SumOfSquares(3).evaluate(ImmutableList.of(1.0, 2.0, 0.5), EvaluationContext.empty());

    assertThat(evaluation.fitness().getAsDouble()).isEqualTo(5.25);
  }

  @Test
  public void styblinskiTang_optimumInNormalizedSpace() {
    double gene = StyblinskiTang.normalize(StyblinskiTang.OPTIMUM_INPUT);

    Evaluation evaluation =
        new StyblinskiTang(2).evaluate(ImmutableList.of(gene, gene), EvaluationContext.empty());

    assertThat(evaluation.fitness().getAsDouble()).isWithin(1e-3).of(-78.332);
  }

  @Test
  public void styblinskiTang_reportsDerivedResponses() {
    // Gene 0.5 maps to x = 0, where f = 0.
    Evaluation evaluation =
        new StyblinskiTang(2).evaluate(ImmutableList.of(0.5, 0.5), EvaluationContext.empty());

    assertThat(evaluation.fitness().getAsDouble()).isEqualTo(0.0);
    assertThat(evaluation.responses()).containsExactly("r1", -5.0, "r2", 0.0);
  }

  @Test
  public void styblinskiTang_mapsUnitIntervalToDomain() {
    assertThat(StyblinskiTang.denormalize(0.0)).isEqualTo(-5.0);
    assertThat(StyblinskiTang.denormalize(1.0)).isEqualTo(5.0);
    assertThat(new StyblinskiTang(4).toString()).isEqualTo("StyblinskiTang (4 dimensions)");
    assertThat(new StyblinskiTang(4).maximize()).isFalse();
  }
}
