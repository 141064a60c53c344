package com.verlumen.evolution;

/**
 * Thrown when the evaluation worker pool itself fails (rejected submission, interruption, or a
 * worker dying from an {@link Error}). Failures of a single objective call are not reported this
 * way; they surface as an undefined fitness for that candidate.
 */
public final class WorkerPoolException extends EvolutionException {
  private static final long serialVersionUID = 1L;

  public WorkerPoolException(String message, Throwable cause) {
    super(message, cause);
  }
}
