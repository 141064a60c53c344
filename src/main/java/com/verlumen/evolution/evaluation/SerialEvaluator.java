package com.verlumen.evolution.evaluation;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.evolution.EvolutionExit;

/** Evaluates candidates one after another in the calling thread. */
public final class SerialEvaluator implements Evaluator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ObjectiveFunction objective;

  @Inject
  public SerialEvaluator(ObjectiveFunction objective) {
    this.objective = checkNotNull(objective, "Objective function cannot be null");
  }

  @Override
  public EvaluatedBatch evaluate(
      ImmutableList<ImmutableList<Double>> candidates, EvaluationContext context) {
    ImmutableList.Builder<Evaluation> evaluations =
        ImmutableList.builderWithExpectedSize(candidates.size());
    for (ImmutableList<Double> candidate : candidates) {
      evaluations.add(evaluateSafely(objective, candidate, context));
    }
    return EvaluatedBatch.of(evaluations.build());
  }

  /** Runs one objective call, turning any failure other than a user exit into an undefined fitness. */
  static Evaluation evaluateSafely(
      ObjectiveFunction objective, ImmutableList<Double> candidate, EvaluationContext context) {
    try {
      Evaluation evaluation = objective.evaluate(candidate, context);
      return evaluation != null ? evaluation : Evaluation.undefined();
    } catch (EvolutionExit e) {
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.atWarning().withCause(e).log("Evaluation of %s was interrupted", candidate);
      return Evaluation.undefined();
    } catch (Exception e) {
      logger.atWarning().withCause(e).log("Evaluation of %s failed", candidate);
      return Evaluation.undefined();
    }
  }
}
