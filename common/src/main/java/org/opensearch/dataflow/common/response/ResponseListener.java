/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.common.response;

/**
 * Response listener for response post-processing callback. This is necessary because execution
 * may happen on a thread other than the caller's.
 *
 * @param <Response> response class
 */
public interface ResponseListener<Response> {

  /**
   * Handle successful response.
   *
   * @param response successful response
   */
  void onResponse(Response response);

  /**
   * Handle failed response.
   *
   * @param e exception
   */
  void onFailure(Exception e);
}
