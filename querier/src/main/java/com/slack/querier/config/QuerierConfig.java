package com.slack.querier.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.text.StringSubstitutor;
import org.apache.commons.text.lookup.StringLookup;

/** QuerierConfig loads and holds the querier configuration. */
public class QuerierConfig {

  private static QuerierConfig _instance = null;

  private static final ObjectMapper JSON_READER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  // Parse a json string as a QuerierConfig struct.
  @VisibleForTesting
  static QuerierConfigs.QuerierConfig fromJsonConfig(String jsonStr)
      throws JsonProcessingException {
    if (jsonStr == null || jsonStr.isBlank()) {
      throw new IllegalArgumentException("Querier config can't be empty");
    }
    QuerierConfigs.QuerierConfig querierConfig =
        JSON_READER.readValue(jsonStr, QuerierConfigs.QuerierConfig.class);
    ValidateQuerierConfig.validateConfig(querierConfig);
    return querierConfig;
  }

  // Parse a yaml string as a QuerierConfig struct
  @VisibleForTesting
  public static QuerierConfigs.QuerierConfig fromYamlConfig(String yamlStr)
      throws JsonProcessingException {
    return fromYamlConfig(yamlStr, System::getenv);
  }

  @VisibleForTesting
  public static QuerierConfigs.QuerierConfig fromYamlConfig(
      String yamlStr, StringLookup variableResolver) throws JsonProcessingException {
    StringSubstitutor substitute = new StringSubstitutor(variableResolver);
    ObjectMapper yamlReader = new ObjectMapper(new YAMLFactory());
    ObjectMapper jsonWriter = new ObjectMapper();

    Object obj = yamlReader.readValue(substitute.replace(yamlStr), Object.class);
    return fromJsonConfig(jsonWriter.writeValueAsString(obj));
  }

  @VisibleForTesting
  static void reset() {
    _instance = null;
  }

  public static void initFromFile(Path cfgFilePath) throws IOException {
    if (_instance == null) {
      if (Files.notExists(cfgFilePath)) {
        throw new IllegalArgumentException(
            "Missing config file at: " + cfgFilePath.toAbsolutePath());
      }

      String filename = cfgFilePath.getFileName().toString();
      if (filename.endsWith(".yaml")) {
        _instance = new QuerierConfig(fromYamlConfig(Files.readString(cfgFilePath)));
      } else if (filename.endsWith(".json")) {
        _instance = new QuerierConfig(fromJsonConfig(Files.readString(cfgFilePath)));
      } else {
        throw new RuntimeException(
            "Invalid config file format provided - must be either .json or .yaml");
      }
    }
  }

  public static QuerierConfigs.QuerierConfig get() {
    if (_instance == null) {
      throw new IllegalStateException("QuerierConfig not initialized");
    }
    return _instance.config;
  }

  private final QuerierConfigs.QuerierConfig config;

  private QuerierConfig(QuerierConfigs.QuerierConfig config) {
    this.config = config;
  }
}
