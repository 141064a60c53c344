package com.verlumen.evolution;

/**
 * Thrown when a run is configured with a missing or invalid option. Always raised before any
 * candidate is generated or evaluated.
 */
public final class ConfigurationException extends EvolutionException {
  private static final long serialVersionUID = 1L;

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
