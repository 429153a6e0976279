package io.github.fiserro.growhab.openhab;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.Multimap;
import io.github.fiserro.growhab.SensorVariable;
import io.github.fiserro.growhab.config.GrowspaceConfig;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import lombok.Builder;

/**
 * Which openHAB items feed which growspace. One item may feed several growspaces, e.g. a shared
 * room thermometer.
 */
@Builder(builderClassName = "GrowspaceItemBindingsBuilder")
public record GrowspaceItemBindings(
    Multimap<String, SensorBinding> sensors, Multimap<String, String> lights) {

  /** Sensor item bound to a variable of a growspace. */
  public record SensorBinding(String growspaceId, SensorVariable variable) {}

  public static class GrowspaceItemBindingsBuilder {

    public GrowspaceItemBindingsBuilder() {
      sensors = HashMultimap.create();
      lights = HashMultimap.create();
    }

    public GrowspaceItemBindingsBuilder sensor(
        String itemName, String growspaceId, SensorVariable variable) {
      sensors.put(itemName, new SensorBinding(growspaceId, variable));
      return this;
    }

    public GrowspaceItemBindingsBuilder light(String itemName, String growspaceId) {
      lights.put(itemName, growspaceId);
      return this;
    }
  }

  public Collection<SensorBinding> sensorBindings(String itemName) {
    return sensors.get(itemName);
  }

  /** Growspaces the item is the light sensor of. */
  public Collection<String> lightBindings(String itemName) {
    return lights.get(itemName);
  }

  public boolean isBound(String itemName) {
    return sensors.containsKey(itemName) || lights.containsKey(itemName);
  }

  public Set<SensorVariable> boundVariables(String growspaceId) {
    Set<SensorVariable> variables = EnumSet.noneOf(SensorVariable.class);
    sensors.values().stream()
        .filter(binding -> binding.growspaceId().equals(growspaceId))
        .forEach(binding -> variables.add(binding.variable()));
    return variables;
  }

  public boolean hasLight(String growspaceId) {
    return lights.containsValue(growspaceId);
  }

  /** Copies the bound sensors and light of the growspace into its config. */
  public GrowspaceConfig applyTo(GrowspaceConfig config) {
    return config.toBuilder()
        .boundSensors(boundVariables(config.growspaceId()))
        .lightSensorBound(hasLight(config.growspaceId()))
        .build();
  }
}
