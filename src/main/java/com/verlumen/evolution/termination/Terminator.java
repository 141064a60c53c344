package com.verlumen.evolution.termination;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.verlumen.evolution.engine.RunState;
import com.verlumen.evolution.evaluation.EvaluationContext;
import java.util.List;
import java.util.Optional;

/**
 * Logical OR of termination clauses. Clauses are tested in declaration order and testing stops at
 * the first one that fires.
 */
public final class Terminator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ImmutableList<TerminationClause> clauses;

  private Terminator(ImmutableList<TerminationClause> clauses) {
    this.clauses = clauses;
  }

  public static Terminator anyOf(TerminationClause... clauses) {
    return anyOf(ImmutableList.copyOf(clauses));
  }

  public static Terminator anyOf(List<? extends TerminationClause> clauses) {
    checkArgument(!clauses.isEmpty(), "At least one termination clause is required");
    return new Terminator(ImmutableList.copyOf(clauses));
  }

  public ImmutableList<TerminationClause> clauses() {
    return clauses;
  }

  /** Returns the name of the first clause that fires, or empty to keep going. */
  public Optional<String> check(RunState state, EvaluationContext context) {
    for (TerminationClause clause : clauses) {
      logger.atFine().log(
          "Termination test using %s at generation %d and evaluation %d",
          clause.name(), state.generation(), state.evaluations());
      if (clause.shouldTerminate(state, context)) {
        logger.atFine().log(
            "Termination from %s at generation %d and evaluation %d",
            clause.name(), state.generation(), state.evaluations());
        return Optional.of(clause.name());
      }
    }
    return Optional.empty();
  }
}
