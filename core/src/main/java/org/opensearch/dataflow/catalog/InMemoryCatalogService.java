/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.catalog;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.opensearch.dataflow.common.utils.StringUtils;
import org.opensearch.dataflow.exception.AdapterException;
import org.opensearch.dataflow.repr.GlobalId;

/** Catalog kept in a concurrent map. */
@Log4j2
public class InMemoryCatalogService implements CatalogService {

  private final Map<GlobalId, CatalogEntry> entries = new ConcurrentHashMap<>();

  /**
   * Registers an entry.
   *
   * @throws IllegalArgumentException if the id is taken, or an index names an unknown object
   */
  public void register(CatalogEntry entry) {
    entry
        .getIndexOn()
        .ifPresent(
            on -> {
              if (!entries.containsKey(on)) {
                throw new IllegalArgumentException(
                    StringUtils.format("index %s is on unknown object %s", entry.getId(), on));
              }
            });
    if (entries.putIfAbsent(entry.getId(), entry) != null) {
      throw new IllegalArgumentException(
          StringUtils.format("catalog item %s already exists", entry.getId()));
    }
    log.debug("Registered catalog item {}", entry);
  }

  @Override
  public CatalogEntry getEntry(GlobalId id) {
    return tryGetEntry(id).orElseThrow(() -> AdapterException.unknownItem(id.toString()));
  }

  @Override
  public Optional<CatalogEntry> tryGetEntry(GlobalId id) {
    return Optional.ofNullable(entries.get(id));
  }

  @Override
  public List<CatalogEntry> getIndexesOn(GlobalId onId, ComputeInstanceSnapshot instance) {
    return entries.values().stream()
        .filter(entry -> entry.getItemType() == CatalogItemType.INDEX)
        .filter(entry -> entry.getIndexOn().map(onId::equals).orElse(false))
        .filter(entry -> instance.containsCollection(entry.getId()))
        .sorted(Comparator.comparing(CatalogEntry::getId))
        .collect(Collectors.toList());
  }
}
