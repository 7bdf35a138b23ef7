/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.transform;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.opensearch.dataflow.dataflow.DataflowMetainfo;

/** State shared by the transformations of one pipeline run. */
@Getter
@RequiredArgsConstructor
public class TransformContext {

  private final DataflowMetainfo metainfo;
}
