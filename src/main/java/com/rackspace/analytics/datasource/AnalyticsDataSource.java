/*
 * Copyright 2023 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.analytics.datasource;

import java.util.List;
import reactor.core.publisher.Mono;

/**
 * An analytical store that metric queries can be executed against.
 */
public interface AnalyticsDataSource {

  /**
   * @return the dialect that queries for this store must be rendered with
   */
  SqlDialect getDialect();

  /**
   * Executes the query and decodes each result row into the given type, matching snake_case
   * column labels to properties.
   *
   * @return the decoded rows, or an error of {@link QueryExecutionException}
   */
  <R> Mono<List<R>> loadResults(String query, Class<R> rowType);
}
