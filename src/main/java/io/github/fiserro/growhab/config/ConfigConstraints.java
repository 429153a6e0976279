package io.github.fiserro.growhab.config;

import io.github.fiserro.growhab.ConfigurationException;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import lombok.experimental.UtilityClass;

/**
 * Enforces {@link NotNull}, {@link DecimalMin} and {@link DecimalMax} on the components of a
 * settings record. Constraints are read from the accessor methods, where the compiler propagates
 * record component annotations.
 */
@UtilityClass
public class ConfigConstraints {

  /**
   * @throws ConfigurationException naming the first violated component
   */
  public void check(Record settings, String growspaceId) {
    for (RecordComponent component : settings.getClass().getRecordComponents()) {
      Method accessor = component.getAccessor();
      Object value = read(accessor, settings);
      String name = settings.getClass().getSimpleName() + "." + component.getName();

      if (value == null) {
        if (accessor.isAnnotationPresent(NotNull.class)) {
          throw new ConfigurationException(growspaceId, name + " must not be null");
        }
        continue;
      }
      if (!(value instanceof Number number)) {
        continue;
      }
      DecimalMin min = accessor.getAnnotation(DecimalMin.class);
      DecimalMax max = accessor.getAnnotation(DecimalMax.class);
      if (min == null && max == null) {
        continue;
      }
      double raw = number.doubleValue();
      if (Double.isNaN(raw) || Double.isInfinite(raw)) {
        throw new ConfigurationException(growspaceId, name + " must be a finite number");
      }
      BigDecimal decimal = BigDecimal.valueOf(raw);

      if (min != null) {
        int cmp = decimal.compareTo(new BigDecimal(min.value()));
        if (cmp < 0 || (cmp == 0 && !min.inclusive())) {
          throw new ConfigurationException(
              growspaceId,
              String.format(
                  "%s = %s must be %s %s",
                  name, number, min.inclusive() ? ">=" : ">", min.value()));
        }
      }
      if (max != null) {
        int cmp = decimal.compareTo(new BigDecimal(max.value()));
        if (cmp > 0 || (cmp == 0 && !max.inclusive())) {
          throw new ConfigurationException(
              growspaceId,
              String.format(
                  "%s = %s must be %s %s",
                  name, number, max.inclusive() ? "<=" : "<", max.value()));
        }
      }
    }
  }

  private Object read(Method accessor, Record settings) {
    try {
      return accessor.invoke(settings);
    } catch (IllegalAccessException | InvocationTargetException e) {
      throw new ConfigurationException("Cannot read " + accessor.getName(), e);
    }
  }
}
