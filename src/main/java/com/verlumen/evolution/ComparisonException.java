package com.verlumen.evolution;

/**
 * Thrown when two individuals are ranked while at least one of them has no fitness. This means an
 * unevaluated individual leaked into a population, archive or selection.
 */
public final class ComparisonException extends EvolutionException {
  private static final long serialVersionUID = 1L;

  public ComparisonException(String message) {
    super(message);
  }
}
