/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.dataflow.common.setting.Settings;
import org.opensearch.dataflow.common.utils.StringUtils;

/**
 * Settings held in memory, starting from built-in defaults. Values can be changed at runtime; an
 * optimizer configuration taken earlier keeps the values it read.
 */
public class SystemSettings extends Settings {

  private static final Logger LOG = LogManager.getLogger();

  public static final Map<Key, Object> DEFAULTS =
      ImmutableMap.<Key, Object>of(
          Key.ENABLE_CONSOLIDATE_AFTER_UNION_NEGATE, true,
          Key.ENABLE_SPECIALIZED_ARRANGEMENTS, false,
          Key.PERSIST_FAST_PATH_LIMIT, 25,
          Key.ENABLE_NEW_OUTER_JOIN_LOWERING, false);

  private final Map<Key, Object> values = new EnumMap<>(Key.class);

  public SystemSettings() {
    values.putAll(DEFAULTS);
  }

  @Override
  @SuppressWarnings("unchecked")
  public synchronized <T> T getSettingValue(Key key) {
    return (T) values.get(key);
  }

  @Override
  public synchronized List<?> getSettings() {
    return values.entrySet().stream()
        .map(entry -> entry.getKey().getKeyValue() + "=" + entry.getValue())
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Changes one setting.
   *
   * @throws IllegalArgumentException if the value has the wrong type or is out of range
   */
  public synchronized void update(Key key, Object value) {
    values.put(key, validate(key, value));
    LOG.info("Updated setting {} to {}", key.getKeyValue(), value);
  }

  private static Object validate(Key key, Object value) {
    switch (key) {
      case PERSIST_FAST_PATH_LIMIT:
        if (!(value instanceof Integer) || (Integer) value < 0) {
          throw new IllegalArgumentException(
              StringUtils.format(
                  "setting %s must be a non-negative integer, got %s", key.getKeyValue(), value));
        }
        return value;
      default:
        if (!(value instanceof Boolean)) {
          throw new IllegalArgumentException(
              StringUtils.format("setting %s must be a boolean, got %s", key.getKeyValue(), value));
        }
        return value;
    }
  }

  /**
   * Reads settings from a JSON object keyed by setting name. Settings not named keep their
   * defaults.
   *
   * @param inputStream JSON document
   * @return the settings
   * @throws IllegalArgumentException if the document is malformed or names an unknown setting
   */
  public static SystemSettings fromInputStream(InputStream inputStream) {
    ObjectMapper objectMapper = new ObjectMapper();
    Map<String, Object> raw;
    try {
      raw = objectMapper.readValue(inputStream, new TypeReference<Map<String, Object>>() {});
    } catch (IOException e) {
      LOG.error("Optimizer settings document is malformed.");
      throw new IllegalArgumentException("Malformed optimizer settings json: " + e.getMessage(), e);
    }
    if (raw == null) {
      throw new IllegalArgumentException("Malformed optimizer settings json: empty document");
    }
    SystemSettings settings = new SystemSettings();
    raw.forEach(
        (name, value) -> {
          Key key =
              Key.of(name)
                  .orElseThrow(
                      () ->
                          new IllegalArgumentException(
                              StringUtils.format("unknown optimizer setting %s", name)));
          settings.update(key, value);
        });
    return settings;
  }
}
