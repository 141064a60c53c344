package com.verlumen.evolution;

/** Base type for every failure raised by the evolution engine. */
public class EvolutionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public EvolutionException(String message) {
    super(message);
  }

  public EvolutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
