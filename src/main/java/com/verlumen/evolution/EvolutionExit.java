package com.verlumen.evolution;

/**
 * May be thrown by any collaborator (objective, observer, termination clause) to stop a run early.
 *
 * <p>The engine catches it and returns the last complete population, flagged as aborted. That
 * population was not necessarily re-evaluated after the interruption and should be treated as
 * provisional by the caller.
 */
public class EvolutionExit extends EvolutionException {
  private static final long serialVersionUID = 1L;

  public EvolutionExit(String message) {
    super(message);
  }
}
