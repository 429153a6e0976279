package io.github.fiserro.growhab;

import java.util.Arrays;
import java.util.Locale;

/**
 * Cultivation lifecycle stage of a growspace. Set by the plant/growspace records and pushed to the
 * engine on every transition; the engine never changes it.
 */
public enum GrowthStage {
  SEEDLING,
  CLONE,
  MOTHER,
  VEG,
  FLOWER,
  DRY,
  CURE;

  /** Lower-case key used in profile data and openHAB item states, e.g. {@code "flower"}. */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Drying and curing happen without living plants under lights. */
  public boolean isPostHarvest() {
    return this == DRY || this == CURE;
  }

  /**
   * Parses a stage key (case-insensitive).
   *
   * @throws IllegalArgumentException if the key names no stage
   */
  public static GrowthStage fromKey(String key) {
    if (key == null) {
      throw new IllegalArgumentException("Growth stage key must not be null");
    }
    String normalized = key.trim().toUpperCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(stage -> stage.name().equals(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown growth stage: " + key));
  }
}
