package io.github.fiserro.growhab;

import lombok.Getter;

/**
 * Invalid growspace setup: priors, thresholds, dwell, profiles or likelihood bounds. Raised when a
 * growspace is configured, never while evaluating evidence.
 */
@Getter
public class ConfigurationException extends RuntimeException {

  /** Growspace the setup belongs to; null for shared data such as the profile table. */
  private final String growspaceId;

  public ConfigurationException(String message) {
    this(null, message);
  }

  public ConfigurationException(String growspaceId, String message) {
    super(growspaceId == null ? message : "[" + growspaceId + "] " + message);
    this.growspaceId = growspaceId;
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
    this.growspaceId = null;
  }
}
