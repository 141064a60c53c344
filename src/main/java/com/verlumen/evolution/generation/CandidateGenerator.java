package com.verlumen.evolution.generation;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.evaluation.EvaluationContext;
import java.util.Random;

/** Supplies initial candidates, one call per population slot not covered by a seed. */
@FunctionalInterface
public interface CandidateGenerator {
  ImmutableList<Double> generate(Random random, EvaluationContext context);
}
