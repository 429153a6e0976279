package io.github.fiserro.growhab.bayes;

import lombok.experimental.UtilityClass;

/**
 * Vapour pressure deficit from air temperature and relative humidity (Tetens equation), with the
 * leaf assumed {@code leafOffset} degrees off the air temperature.
 */
@UtilityClass
public class VpdCalculator {

  /** Saturation vapour pressure in kPa at the given temperature in Celsius. */
  public double saturationVaporPressure(double temperatureC) {
    return 0.6108 * Math.exp(17.27 * temperatureC / (temperatureC + 237.3));
  }

  /**
   * @return leaf VPD in kPa, never negative
   */
  public double vpd(double airTemperatureC, double relativeHumidity, double leafOffset) {
    double rh = Math.max(0, Math.min(100, relativeHumidity));
    double leafSvp = saturationVaporPressure(airTemperatureC + leafOffset);
    double actualVp = saturationVaporPressure(airTemperatureC) * rh / 100;
    return Math.max(0, leafSvp - actualVp);
  }
}
