/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.catalog;

import java.util.List;
import java.util.Optional;
import org.opensearch.dataflow.exception.AdapterException;
import org.opensearch.dataflow.repr.GlobalId;

/** Read access to catalog items. Implementations must be safe to query from any thread. */
public interface CatalogService {

  /**
   * @throws AdapterException if no item has this id
   */
  CatalogEntry getEntry(GlobalId id);

  Optional<CatalogEntry> tryGetEntry(GlobalId id);

  /** Indexes on {@code onId} that are installed on {@code instance}, ordered by id. */
  List<CatalogEntry> getIndexesOn(GlobalId onId, ComputeInstanceSnapshot instance);
}
