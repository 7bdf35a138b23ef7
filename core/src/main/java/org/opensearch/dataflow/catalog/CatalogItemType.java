/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.catalog;

public enum CatalogItemType {
  TABLE,
  SOURCE,
  VIEW,
  MATERIALIZED_VIEW,
  INDEX;

  /** True for items whose contents live in durable storage and can be imported as a source. */
  public boolean isStorageCollection() {
    return this == TABLE || this == SOURCE || this == MATERIALIZED_VIEW;
  }
}
