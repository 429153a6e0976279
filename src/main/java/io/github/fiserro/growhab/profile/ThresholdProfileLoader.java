package io.github.fiserro.growhab.profile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.fiserro.growhab.ConfigurationException;
import io.github.fiserro.growhab.DayNightPhase;
import io.github.fiserro.growhab.GrowthStage;
import io.github.fiserro.growhab.SensorVariable;
import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads threshold profiles from JSON.
 *
 * <pre>
 * {
 *   "veg": {
 *     "day":   { "temperature": { "low": 22, "high": 26, "tolerance": 2 }, ... },
 *     "night": { ... }
 *   },
 *   ...
 * }
 * </pre>
 */
@Slf4j
public class ThresholdProfileLoader {

  public static final String DEFAULT_RESOURCE = "/threshold-profiles.json";

  private final ObjectMapper mapper = new ObjectMapper();

  /** Loads the profiles bundled with the engine. */
  public ThresholdProfileTable loadDefault() {
    return loadResource(DEFAULT_RESOURCE);
  }

  public ThresholdProfileTable loadResource(String resource) {
    try (InputStream in = ThresholdProfileLoader.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new ConfigurationException("Threshold profile resource not found: " + resource);
      }
      ThresholdProfileTable table = load(in);
      log.info("Loaded threshold profiles from {}", resource);
      return table;
    } catch (IOException e) {
      throw new ConfigurationException("Cannot read threshold profiles from " + resource, e);
    }
  }

  public ThresholdProfileTable load(InputStream in) throws IOException {
    return parse(mapper.readTree(in));
  }

  ThresholdProfileTable parse(JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new ConfigurationException("Threshold profiles must be a JSON object keyed by stage");
    }
    ThresholdProfileTable.Builder builder = ThresholdProfileTable.builder();
    Iterator<Map.Entry<String, JsonNode>> stages = root.fields();
    while (stages.hasNext()) {
      Map.Entry<String, JsonNode> stageEntry = stages.next();
      GrowthStage stage = parseKey(stageEntry.getKey(), "stage", GrowthStage::fromKey);

      Iterator<Map.Entry<String, JsonNode>> phases = stageEntry.getValue().fields();
      while (phases.hasNext()) {
        Map.Entry<String, JsonNode> phaseEntry = phases.next();
        DayNightPhase phase =
            parseKey(
                phaseEntry.getKey(),
                "phase",
                key -> DayNightPhase.valueOf(key.toUpperCase(Locale.ROOT)));
        builder.profile(stage, phase, parseRanges(stage, phase, phaseEntry.getValue()));
      }
    }
    return builder.build();
  }

  private Map<SensorVariable, VariableRange> parseRanges(
      GrowthStage stage, DayNightPhase phase, JsonNode node) {
    Map<SensorVariable, VariableRange> ranges = new EnumMap<>(SensorVariable.class);
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      SensorVariable variable = parseKey(field.getKey(), "variable", SensorVariable::fromKey);
      JsonNode range = field.getValue();
      for (String property : new String[] {"low", "high", "tolerance"}) {
        if (!range.path(property).isNumber()) {
          throw new ConfigurationException(
              String.format(
                  "Profile %s/%s: %s.%s must be a number",
                  stage.key(), phase.name().toLowerCase(Locale.ROOT), variable.key(), property));
        }
      }
      ranges.put(
          variable,
          new VariableRange(
              range.get("low").asDouble(),
              range.get("high").asDouble(),
              range.get("tolerance").asDouble()));
    }
    return ranges;
  }

  private <T> T parseKey(String key, String kind, Function<String, T> parser) {
    try {
      return parser.apply(key);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unknown " + kind + " in threshold profiles: " + key, e);
    }
  }
}
