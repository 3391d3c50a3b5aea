/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.utils;

import dev.projectasap.summarycheck.datamodel.Schema;
import dev.projectasap.summarycheck.property.SummarizerProperties;
import dev.projectasap.summarycheck.property.SummarizerProperty;
import dev.projectasap.summarycheck.summarizer.Summarizer;
import dev.projectasap.summarycheck.summarizer.SummarizerFactory;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Configuration for a single summarizer under test. The type names a class in the {@code
 * dev.projectasap.summarycheck.summarizers} package, which is instantiated reflectively for each
 * dataset schema.
 */
public class SummarizerConfig {
  public static final String SUMMARIZER_PACKAGE = "dev.projectasap.summarycheck.summarizers";

  public String type;
  public List<String> columns = new ArrayList<>();
  public Map<String, String> parameters = Map.of();

  /** Property names to check; empty selects the set matching the summarizer's capabilities. */
  public List<String> properties = new ArrayList<>();

  /** Forces the subtractable property set on or off; null detects it from the summarizer. */
  public Boolean subtractable;

  public String name() {
    return columns.isEmpty() ? type : type + columns;
  }

  /**
   * Creates a factory that instantiates the configured summarizer for a schema.
   *
   * @return factory named after the type and columns
   * @throws IllegalArgumentException if the type does not name a summarizer class
   */
  public SummarizerFactory toFactory() {
    Class<?> clazz;
    try {
      clazz = Class.forName(SUMMARIZER_PACKAGE + "." + type);
    } catch (ClassNotFoundException e) {
      throw new IllegalArgumentException("Unknown summarizer type: " + type, e);
    }
    if (!Summarizer.class.isAssignableFrom(clazz)) {
      throw new IllegalArgumentException(type + " is not a summarizer");
    }
    return SummarizerFactory.named(name(), schema -> instantiate(clazz, schema));
  }

  /**
   * Resolves the properties to check against a summarizer built for the given schema.
   *
   * @param schema schema of the first fixture dataset
   * @return the configured properties in order
   */
  public List<SummarizerProperty> resolveProperties(Schema schema) {
    if (!properties.isEmpty()) {
      List<SummarizerProperty> resolved = new ArrayList<>();
      for (String property : properties) {
        resolved.add(SummarizerProperties.byName(property));
      }
      return resolved;
    }
    boolean useSubtractable =
        subtractable != null
            ? subtractable
            : toFactory().apply(schema).leftSubtractable().isPresent();
    return useSubtractable ? SummarizerProperties.subtractable() : SummarizerProperties.standard();
  }

  private Summarizer<?> instantiate(Class<?> clazz, Schema schema) {
    try {
      Constructor<?> constructor;
      Object instance;
      if ((constructor = findConstructor(clazz, Schema.class, List.class, Map.class)) != null) {
        instance = constructor.newInstance(schema, columns, parameters);
      } else if ((constructor = findConstructor(clazz, Schema.class, List.class)) != null) {
        instance = constructor.newInstance(schema, columns);
      } else if ((constructor = findConstructor(clazz, Schema.class)) != null) {
        instance = constructor.newInstance(schema);
      } else {
        throw new IllegalArgumentException(type + " has no schema constructor");
      }
      return (Summarizer<?>) instance;
    } catch (InvocationTargetException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw new RuntimeException("Failed to create summarizer " + type, e.getCause());
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException("Failed to create summarizer " + type, e);
    }
  }

  private static Constructor<?> findConstructor(Class<?> clazz, Class<?>... parameterTypes) {
    try {
      return clazz.getConstructor(parameterTypes);
    } catch (NoSuchMethodException e) {
      return null;
    }
  }
}
