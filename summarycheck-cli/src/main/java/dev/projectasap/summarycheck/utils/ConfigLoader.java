/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import dev.projectasap.summarycheck.equality.Tolerance;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Utility class for loading conformance configuration from YAML files. */
public class ConfigLoader {

  /**
   * Loads conformance configuration from a YAML file.
   *
   * @param configFilePath path to the YAML configuration file
   * @return parsed conformance configuration
   * @throws IOException if file reading or parsing fails
   */
  public static ConformanceConfig loadConfig(String configFilePath) throws IOException {
    String yamlContent =
        new String(Files.readAllBytes(Paths.get(configFilePath)), StandardCharsets.UTF_8);
    return parseConfig(yamlContent);
  }

  /**
   * Parses conformance configuration from YAML text.
   *
   * @param yamlContent the YAML document
   * @return parsed conformance configuration
   * @throws IOException if the document is not valid YAML
   * @throws IllegalArgumentException if a required key is missing
   */
  public static ConformanceConfig parseConfig(String yamlContent) throws IOException {
    ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    ObjectNode rootNode = mapper.readValue(yamlContent, ObjectNode.class);
    if (rootNode == null) {
      throw new IllegalArgumentException("Configuration is empty");
    }

    ConformanceConfig config = new ConformanceConfig();

    JsonNode tolerance = rootNode.get("tolerance");
    if (tolerance != null) {
      config.tolerance =
          Tolerance.of(
              tolerance.path("absolute").asDouble(Tolerance.DEFAULT_ABSOLUTE),
              tolerance.path("relative").asDouble(Tolerance.DEFAULT_RELATIVE));
    }
    config.parallelism = rootNode.path("parallelism").asInt(1);

    JsonNode standard = rootNode.get("standardFixtures");
    if (standard != null) {
      config.standardCycles = require(standard, "cycles", "standardFixtures").asLong();
      config.standardFrequency = standard.path("frequency").asLong(config.standardFrequency);
      config.standardPartitions = standard.path("partitions").asInt(config.standardPartitions);
    }

    rootNode.path("datasets").forEach(node -> config.datasets.add(parseDataset(node)));

    JsonNode summarizers = require(rootNode, "summarizers", "configuration");
    summarizers.forEach(node -> config.summarizers.add(parseSummarizer(node)));
    if (config.summarizers.isEmpty()) {
      throw new IllegalArgumentException("At least one summarizer must be configured");
    }

    return config;
  }

  private static DatasetConfig parseDataset(JsonNode node) {
    DatasetConfig dataset = new DatasetConfig();
    dataset.label = node.path("label").asText(dataset.label);
    dataset.begin = node.path("begin").asLong(0L);
    dataset.end = require(node, "end", "dataset").asLong();
    dataset.frequency = node.path("frequency").asLong(dataset.frequency);
    dataset.uniform = node.path("uniform").asBoolean(dataset.uniform);
    dataset.ratioOfCycleSize = node.path("ratioOfCycleSize").asDouble(dataset.ratioOfCycleSize);
    dataset.partitions = node.path("partitions").asInt(dataset.partitions);
    dataset.seed = node.path("seed").asLong(0L);

    if (node.has("ids")) {
      List<Integer> ids = new ArrayList<>();
      node.get("ids").forEach(id -> ids.add(id.asInt()));
      dataset.ids = ids;
    }

    require(node, "columns", "dataset")
        .forEach(
            columnNode -> {
              DatasetConfig.ColumnConfig column = new DatasetConfig.ColumnConfig();
              column.name = require(columnNode, "name", "column").asText();
              column.scale = columnNode.path("scale").asDouble(column.scale);
              column.offset = columnNode.path("offset").asDouble(column.offset);
              dataset.columns.add(column);
            });
    return dataset;
  }

  private static SummarizerConfig parseSummarizer(JsonNode node) {
    SummarizerConfig summarizer = new SummarizerConfig();
    summarizer.type = require(node, "type", "summarizer").asText();
    node.path("columns").forEach(column -> summarizer.columns.add(column.asText()));
    node.path("properties").forEach(property -> summarizer.properties.add(property.asText()));
    if (node.has("subtractable")) {
      summarizer.subtractable = node.get("subtractable").asBoolean();
    }

    Map<String, String> parameters = new HashMap<>();
    node.path("parameters")
        .fields()
        .forEachRemaining(entry -> parameters.put(entry.getKey(), entry.getValue().asText()));
    summarizer.parameters = parameters;
    return summarizer;
  }

  private static JsonNode require(JsonNode node, String key, String context) {
    JsonNode value = node.get(key);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException("Missing required key '" + key + "' in " + context);
    }
    return value;
  }
}
